package com.pearlthoughts.mailgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailGatewayApplication.class, args);
    }
}
