package com.pearlthoughts.mailgateway.dispatch;

import com.pearlthoughts.mailgateway.mailer.DeliveryReceipt;
import com.pearlthoughts.mailgateway.mailer.MailAttachment;
import com.pearlthoughts.mailgateway.mailer.MailMessage;
import com.pearlthoughts.mailgateway.mailer.Mailer;
import com.pearlthoughts.mailgateway.mailer.TransportException;
import com.pearlthoughts.mailgateway.model.AttachmentRequest;
import com.pearlthoughts.mailgateway.model.QueueStatusResponse;
import com.pearlthoughts.mailgateway.model.ReportRequest;
import com.pearlthoughts.mailgateway.model.ReportResponse;
import com.pearlthoughts.mailgateway.model.SendEmailRequest;
import com.pearlthoughts.mailgateway.model.SendEmailResponse;
import com.pearlthoughts.mailgateway.report.ReportFormatter;
import com.pearlthoughts.mailgateway.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Dispatch engine: single, bulk and report sends on top of the {@link Mailer}.
 * Transport failures are turned into results here and never retried.
 */
@Service
public class DispatchService {

    private static final Logger logger = LoggerFactory.getLogger(DispatchService.class);

    static final String INTERRUPTED = "Dispatch interrupted";

    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    @Value("${mail.gateway.system-sender:}")
    private String systemSender;

    @Value("${mail.gateway.bulk.parallelism:1}")
    private int bulkParallelism;

    private final Mailer mailer;
    private final TemplateRenderer templateRenderer;
    private final ReportFormatter reportFormatter;
    private final Clock clock;
    private final Executor bulkExecutor;

    public DispatchService(Mailer mailer,
                           TemplateRenderer templateRenderer,
                           ReportFormatter reportFormatter,
                           Clock clock,
                           @Qualifier("bulkDispatchExecutor") Executor bulkExecutor) {
        this.mailer = mailer;
        this.templateRenderer = templateRenderer;
        this.reportFormatter = reportFormatter;
        this.clock = clock;
        this.bulkExecutor = bulkExecutor;
    }

    /**
     * Send one message built from the request fields.
     *
     * @param request validated single send request
     * @return success with the relay message id, or failure with the transport reason
     */
    public SendEmailResponse sendEmail(SendEmailRequest request) {
        MailMessage message = MailMessage.builder()
                .from(request.getFrom())
                .to(request.getTo())
                .subject(request.getSubject())
                .textBody(request.getText())
                .htmlBody(request.getHtml())
                .attachments(toMailAttachments(request.getAttachments()))
                .build();

        try {
            DeliveryReceipt receipt = mailer.deliver(message);
            logger.info("Email {} sent from {} to {}", receipt.getMessageId(), request.getFrom(), request.getTo());
            return SendEmailResponse.success(receipt);
        } catch (TransportException e) {
            logger.error("Send email error: {}", e.getMessage());
            return SendEmailResponse.failure(e.getMessage());
        }
    }

    /**
     * Render and deliver one message per recipient. A failure is recorded against its
     * recipient and never stops the rest of the batch.
     *
     * @param job the bulk job
     * @return exactly one outcome per input recipient
     */
    public BatchResult sendBulk(BulkJob job) {
        List<Recipient> recipients = job.getRecipients() != null ? job.getRecipients() : Collections.emptyList();
        int parallelism = effectiveParallelism(recipients.size());
        logger.info("Bulk send from {} to {} recipients (parallelism {})",
                job.getFrom(), recipients.size(), parallelism);

        List<DispatchOutcome> outcomes = parallelism > 1
                ? dispatchConcurrently(job, recipients)
                : dispatchSequentially(job, recipients);

        BatchResult result = BatchResult.of(outcomes);
        logger.info("Bulk send finished: {}", result);
        return result;
    }

    /**
     * Format a report and deliver it as one message to all recipients.
     *
     * @param request validated report request
     * @return success with message id and generation timestamp, or failure with the transport reason
     */
    public ReportResponse sendReport(ReportRequest request) {
        Instant generatedAt = clock.instant();
        String html = reportFormatter.format(request.getReportType(), request.getCluster(), request.getData());

        String subject = hasText(request.getSubject())
                ? request.getSubject()
                : String.format("%s Report - %s - %s", request.getReportType(), request.getCluster(),
                        SUBJECT_DATE.format(generatedAt.atZone(clock.getZone())));

        MailMessage message = MailMessage.builder()
                .from(hasText(request.getFrom()) ? request.getFrom() : systemSender)
                .to(request.getRecipients())
                .subject(subject)
                .htmlBody(html)
                .attachments(toMailAttachments(request.getData() != null ? request.getData().getAttachments() : null))
                .build();

        try {
            DeliveryReceipt receipt = mailer.deliver(message);
            logger.info("{} report for cluster {} sent to {} as {}",
                    request.getReportType(), request.getCluster(),
                    String.join(", ", request.getRecipients()), receipt.getMessageId());
            return ReportResponse.success(receipt.getMessageId(), request.getReportType(),
                    request.getCluster(), generatedAt.toString());
        } catch (TransportException e) {
            logger.error("Send report error: {}", e.getMessage());
            return ReportResponse.failure(e.getMessage());
        }
    }

    /**
     * Pool status backed by a relay handshake. A failing handshake is reported, not thrown.
     */
    public QueueStatusResponse getQueueStatus() {
        try {
            mailer.healthCheck();
            return QueueStatusResponse.operational(mailer.getStats());
        } catch (TransportException e) {
            logger.warn("Relay health check failed: {}", e.getMessage());
            return QueueStatusResponse.error(e.getMessage());
        }
    }

    private List<DispatchOutcome> dispatchSequentially(BulkJob job, List<Recipient> recipients) {
        List<DispatchOutcome> outcomes = new ArrayList<>(recipients.size());
        for (Recipient recipient : recipients) {
            if (Thread.currentThread().isInterrupted()) {
                outcomes.add(DispatchOutcome.failure(recipient.getEmail(), INTERRUPTED));
                continue;
            }
            outcomes.add(dispatchOne(job, recipient));
        }
        return outcomes;
    }

    private List<DispatchOutcome> dispatchConcurrently(BulkJob job, List<Recipient> recipients) {
        List<CompletableFuture<DispatchOutcome>> futures = recipients.stream()
                .map(recipient -> CompletableFuture.supplyAsync(() -> dispatchOne(job, recipient), bulkExecutor))
                .collect(Collectors.toList());

        List<DispatchOutcome> outcomes = new ArrayList<>(recipients.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<DispatchOutcome> future = futures.get(i);
            String email = recipients.get(i).getEmail();

            if (!interrupted) {
                try {
                    outcomes.add(future.get());
                    continue;
                } catch (ExecutionException e) {
                    outcomes.add(DispatchOutcome.failure(email, describe(e.getCause())));
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    logger.warn("Bulk send interrupted, abandoning recipients not yet started");
                }
            }

            // Not-yet-started recipients are abandoned; running ones finish
            if (future.cancel(false)) {
                outcomes.add(DispatchOutcome.failure(email, INTERRUPTED));
            } else {
                outcomes.add(awaitUninterruptibly(future, email));
            }
        }
        return outcomes;
    }

    private DispatchOutcome awaitUninterruptibly(CompletableFuture<DispatchOutcome> future, String email) {
        return future.handle((outcome, error) -> error == null
                        ? outcome
                        : DispatchOutcome.failure(email, describe(error)))
                .join();
    }

    private DispatchOutcome dispatchOne(BulkJob job, Recipient recipient) {
        String email = recipient.getEmail();
        try {
            Map<String, String> data = templateRenderer.merge(job.getSharedData(), recipient.getData());

            MailMessage message = MailMessage.builder()
                    .from(job.getFrom())
                    .to(List.of(email))
                    .subject(templateRenderer.render(job.getSubjectTemplate(), data))
                    .htmlBody(templateRenderer.render(job.getBodyTemplate(), data))
                    .build();

            DeliveryReceipt receipt = mailer.deliver(message);
            logger.debug("Bulk email {} sent to {}", receipt.getMessageId(), email);
            return DispatchOutcome.success(email, receipt.getMessageId());

        } catch (TransportException e) {
            logger.warn("Bulk email to {} failed: {}", email, e.getMessage());
            return DispatchOutcome.failure(email, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error sending bulk email to {}", email, e);
            return DispatchOutcome.failure(email, describe(e));
        }
    }

    private int effectiveParallelism(int recipientCount) {
        if (bulkParallelism <= 1 || recipientCount <= 1) {
            return 1;
        }
        int poolSize = mailer.getStats().getPoolSize();
        return Math.max(1, Math.min(bulkParallelism, Math.min(poolSize, recipientCount)));
    }

    private static List<MailAttachment> toMailAttachments(List<AttachmentRequest> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return Collections.emptyList();
        }
        return attachments.stream()
                .map(AttachmentRequest::toMailAttachment)
                .collect(Collectors.toList());
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
