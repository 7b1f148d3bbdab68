package monops.batchengine.observer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeUnit;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.BatchReport;
import monops.batchengine.util.LogSanitizer;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts batch-level events (completed, failed, paused) to a configured URL. The JSON body is
 * signed with HMAC-SHA256 in the {@code X-Signature} header when a secret is set. Item-level
 * events are not forwarded. Without a URL the observer does nothing.
 */
@Component
@Slf4j
public class WebhookProgressObserver implements BatchProgressObserver {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String webhookUrl;
    private final String webhookSecret;

    public WebhookProgressObserver(
        @Value("${batch.webhook.url:}") String webhookUrl,
        @Value("${batch.webhook.secret:}") String webhookSecret,
        @Value("${batch.webhook.timeout-seconds:5}") long timeoutSeconds
    ) {
        this.webhookUrl = webhookUrl;
        this.webhookSecret = webhookSecret;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .callTimeout(timeoutSeconds * 2, TimeUnit.SECONDS)
            .build();
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public void batchCompleted(String batchId, BatchReport report) {
        post(WebhookPayload.from("batch_completed", report));
    }

    @Override
    public void batchFailed(String batchId, String reason, BatchReport report) {
        post(WebhookPayload.from("batch_failed", report));
    }

    @Override
    public void batchPaused(String batchId, BatchReport report) {
        post(WebhookPayload.from("batch_paused", report));
    }

    private void post(WebhookPayload payload) {
        if (!isEnabled()) {
            return;
        }
        try {
            String json = mapper.writeValueAsString(payload);
            Request.Builder builder = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(json, JSON));
            if (webhookSecret != null && !webhookSecret.isBlank()) {
                builder.addHeader("X-Signature", sign(json, webhookSecret));
            }
            try (Response response = client.newCall(builder.build()).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Webhook for batch {} responded with {}", payload.batchId(), response.code());
                }
            }
        } catch (IOException | GeneralSecurityException e) {
            log.warn("Unable to send webhook for batch {}: {}", payload.batchId(), LogSanitizer.sanitize(e.getMessage()));
        }
    }

    static String sign(String payload, String secret) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] signature = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder("sha256=");
        for (byte b : signature) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    record WebhookPayload(
        String event,
        String batchId,
        String status,
        int total,
        int succeeded,
        int failed,
        int skipped,
        int pending,
        String reason
    ) {
        static WebhookPayload from(String event, BatchReport report) {
            return new WebhookPayload(
                event,
                report.batchId(),
                report.status() != null ? report.status().getWireValue() : null,
                report.total(),
                report.succeeded().size(),
                report.failed().size(),
                report.skipped().size(),
                report.pending().size(),
                report.failureReason()
            );
        }
    }
}
