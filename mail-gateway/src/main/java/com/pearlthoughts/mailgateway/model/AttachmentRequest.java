package com.pearlthoughts.mailgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pearlthoughts.mailgateway.mailer.MailAttachment;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Attachment passed through to the relay. Content is plain text unless
 * {@code encoding} is {@code base64}.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AttachmentRequest {

    public static final String BASE64 = "base64";

    @NotBlank(message = "Attachment filename is required")
    private String filename;

    @NotNull(message = "Attachment content is required")
    private String content;

    private String encoding;

    private String contentType;

    @JsonIgnore
    @AssertTrue(message = "Attachment content is not valid base64")
    public boolean isContentDecodable() {
        if (content == null || !isBase64()) {
            return true;
        }
        try {
            Base64.getMimeDecoder().decode(content);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public MailAttachment toMailAttachment() {
        byte[] bytes = isBase64()
                ? Base64.getMimeDecoder().decode(content)
                : content.getBytes(StandardCharsets.UTF_8);
        return new MailAttachment(filename, contentType, bytes);
    }

    private boolean isBase64() {
        return BASE64.equalsIgnoreCase(encoding);
    }
}
