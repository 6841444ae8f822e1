package com.pearlthoughts.mailgateway.controller;

import com.pearlthoughts.mailgateway.dispatch.BatchResult;
import com.pearlthoughts.mailgateway.dispatch.DispatchService;
import com.pearlthoughts.mailgateway.model.BulkSendRequest;
import com.pearlthoughts.mailgateway.model.BulkSendResponse;
import com.pearlthoughts.mailgateway.model.QueueStatusResponse;
import com.pearlthoughts.mailgateway.model.ReportRequest;
import com.pearlthoughts.mailgateway.model.ReportResponse;
import com.pearlthoughts.mailgateway.model.SendEmailRequest;
import com.pearlthoughts.mailgateway.model.SendEmailResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
public class MailGatewayController {

    private static final Logger logger = LoggerFactory.getLogger(MailGatewayController.class);

    private final DispatchService dispatchService;

    public MailGatewayController(DispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    /**
     * Send a single email
     */
    @PostMapping("/send")
    public ResponseEntity<?> sendEmail(@Valid @RequestBody SendEmailRequest request,
                                       BindingResult bindingResult) {
        if (bindingResult.hasErrors()) {
            return validationFailed(bindingResult);
        }

        logger.info("Received send request from: {} to: {}", request.getFrom(), request.getTo());
        SendEmailResponse response = dispatchService.sendEmail(request);

        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Send a templated email to each recipient. Per-recipient failures are part of a 200 response.
     */
    @PostMapping("/send-bulk")
    public ResponseEntity<?> sendBulk(@Valid @RequestBody BulkSendRequest request,
                                      BindingResult bindingResult) {
        if (bindingResult.hasErrors()) {
            return validationFailed(bindingResult);
        }

        logger.info("Received bulk send request from: {} for {} recipients",
                request.getFrom(), request.getRecipients().size());
        BatchResult result = dispatchService.sendBulk(request.toBulkJob());
        return ResponseEntity.ok(BulkSendResponse.from(result));
    }

    /**
     * Send a formatted cluster report
     */
    @PostMapping("/send-report")
    public ResponseEntity<?> sendReport(@Valid @RequestBody ReportRequest request,
                                        BindingResult bindingResult) {
        if (bindingResult.hasErrors()) {
            return validationFailed(bindingResult);
        }

        logger.info("Received {} report request for cluster: {}", request.getReportType(), request.getCluster());
        ReportResponse response = dispatchService.sendReport(request);

        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Relay connection pool status
     */
    @GetMapping("/queue/status")
    public ResponseEntity<QueueStatusResponse> getQueueStatus() {
        QueueStatusResponse response = dispatchService.getQueueStatus();

        HttpStatus status = response.isOperational() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }

    private ResponseEntity<Map<String, Object>> validationFailed(BindingResult bindingResult) {
        List<String> errors = bindingResult.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        logger.debug("Rejected request with validation errors: {}", errors);

        return ResponseEntity.badRequest().body(Map.of(
                "error", "Validation failed",
                "details", errors
        ));
    }
}
