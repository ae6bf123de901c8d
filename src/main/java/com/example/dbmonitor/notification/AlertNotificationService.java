package com.example.dbmonitor.notification;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.TargetInfo;
import com.example.dbmonitor.exception.NotificationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sends critical query alerts through Slack and/or e-mail.
 * Each channel is enabled independently; with none enabled the alert is only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertNotificationService implements NotificationDispatcher {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final int QUERY_PREVIEW_LENGTH = 100;

    private final MonitorProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<JavaMailSender> mailSender;

    @Override
    public void send(List<CriticalQueryEvent> events, TargetInfo target) {
        if (events == null || events.isEmpty()) {
            return;
        }

        MonitorProperties.NotificationConfig config = properties.getNotifications();
        String subject = subject(target);
        String text = renderText(events, target, Instant.now());

        List<String> failures = new ArrayList<>();
        int attempted = 0;

        if (config.getSlack().isEnabled()) {
            attempted++;
            try {
                sendSlack(subject, text);
            } catch (IOException | RuntimeException e) {
                failures.add("slack: " + e.getMessage());
                log.error("Failed to send Slack alert for {}: {}", target.databaseName(), e.getMessage());
            }
        }

        if (config.getEmail().isEnabled()) {
            attempted++;
            try {
                sendEmail(subject, text);
            } catch (RuntimeException e) {
                failures.add("email: " + e.getMessage());
                log.error("Failed to send e-mail alert for {}: {}", target.databaseName(), e.getMessage());
            }
        }

        if (attempted == 0) {
            log.warn("No notification channel enabled, alert for {} at {} logged only:\n{}",
                    target.databaseName(), target.host(), text);
            return;
        }
        if (failures.size() == attempted) {
            throw new NotificationException("All notification channels failed: " + String.join("; ", failures), null);
        }
        log.info("Alert for {} critical queries on {} sent", events.size(), target.databaseName());
    }

    static String subject(TargetInfo target) {
        return "Critical Query Alert: " + target.databaseName() + " at " + target.host();
    }

    /** Medium above the critical threshold, High above 1 s, Critical above 5 s. */
    static String severity(double meanTimeMs) {
        if (meanTimeMs > 5000) return "Critical";
        if (meanTimeMs > 1000) return "High";
        return "Medium";
    }

    static String renderText(List<CriticalQueryEvent> events, TargetInfo target, Instant alertTime) {
        StringBuilder sb = new StringBuilder("CRITICAL DATABASE QUERY ALERT\n\n");
        sb.append("Database: ").append(target.databaseName()).append(" at ").append(target.host()).append('\n');
        sb.append("Alert time: ").append(TIMESTAMP.format(alertTime)).append("\n\n");
        sb.append("The following queries require attention:\n\n");

        for (CriticalQueryEvent event : events) {
            String query = event.getQueryText();
            String preview = query.length() > QUERY_PREVIEW_LENGTH
                    ? query.substring(0, QUERY_PREVIEW_LENGTH) + "..." : query;
            sb.append(event.getRank()).append(". Query: ").append(preview).append('\n');
            sb.append("   Execution Time: ").append(String.format(Locale.ROOT, "%.2f", event.getMeanTimeMs())).append(" ms\n");
            sb.append("   Severity: ").append(severity(event.getMeanTimeMs())).append('\n');
            sb.append("   Calls: ").append(event.getCalls()).append('\n');
            sb.append("   Rows: ").append(event.getRowsReturned()).append('\n');
            if (event.getDetectedAt() != null) {
                sb.append("   Detected At: ").append(TIMESTAMP.format(event.getDetectedAt())).append('\n');
            }
            sb.append('\n');
        }

        sb.append("Recommendations:\n");
        sb.append("- Review the execution plan using EXPLAIN ANALYZE\n");
        sb.append("- Check for missing indexes\n");
        sb.append("- Consider query optimization or refactoring\n");
        sb.append("- Add appropriate indexes for frequently queried columns\n\n");
        sb.append("This is an automated message from DB Monitor.");
        return sb.toString();
    }

    private void sendSlack(String subject, String text) throws IOException {
        String webhookUrl = properties.getNotifications().getSlack().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            throw new IllegalStateException("Slack webhook URL not configured");
        }

        Map<String, Object> payload = Map.of(
                "text", ":rotating_light: *" + subject + "*\n```" + text + "```",
                "username", "DB Monitor"
        );
        Request request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Slack webhook answered " + response.code());
            }
        }
        log.debug("Slack alert delivered");
    }

    private void sendEmail(String subject, String text) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new IllegalStateException("No mail sender configured (spring.mail.host)");
        }
        MonitorProperties.NotificationConfig.EmailConfig email = properties.getNotifications().getEmail();
        String[] recipients = Arrays.stream(email.getTo().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
        if (recipients.length == 0) {
            throw new IllegalStateException("No alert recipients configured");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(email.getFrom());
        message.setTo(recipients);
        message.setSubject(subject);
        message.setText(text);
        sender.send(message);
        log.debug("E-mail alert delivered to {} recipients", recipients.length);
    }
}
