package com.pearlthoughts.mailgateway.dispatch;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * A bulk recipient with its own substitution values.
 */
@Getter
@AllArgsConstructor
public class Recipient {

    private final String email;
    private final Map<String, String> data;
}
