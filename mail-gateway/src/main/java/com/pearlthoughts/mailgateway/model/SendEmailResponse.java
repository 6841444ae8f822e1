package com.pearlthoughts.mailgateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pearlthoughts.mailgateway.mailer.DeliveryReceipt;
import lombok.Getter;
import lombok.Setter;

/**
 * Response of a single send
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendEmailResponse {

    private boolean success;
    private String messageId;
    private String response;
    private String error;

    public static SendEmailResponse success(DeliveryReceipt receipt) {
        SendEmailResponse result = new SendEmailResponse();
        result.setSuccess(true);
        result.setMessageId(receipt.getMessageId());
        result.setResponse(receipt.getResponse());
        return result;
    }

    public static SendEmailResponse failure(String error) {
        SendEmailResponse result = new SendEmailResponse();
        result.setSuccess(false);
        result.setError(error);
        return result;
    }
}
