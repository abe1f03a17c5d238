package io.eventasaurus.ticketing.infrastructure.external.stripe;

import io.eventasaurus.ticketing.config.PaymentProperties;
import io.eventasaurus.ticketing.infrastructure.external.InvalidWebhookSignatureException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stripe-Signature 헤더 검증
 * <p>
 * 헤더 형식: {@code t=<unix seconds>,v1=<hex hmac>[,v1=...][,v0=...]}
 * 서명 대상: {@code "<t>.<raw body>"} 의 HMAC-SHA256.
 * 타임스탬프가 허용 오차를 벗어나면 재전송 공격으로 보고 거절한다.
 */
@Component
public class StripeSignatureVerifier {

    static final int MAX_PAYLOAD_BYTES = 1_048_576;

    private static final Pattern TIMESTAMP = Pattern.compile("\\d{1,12}");
    private static final Pattern HEX = Pattern.compile("[a-f0-9]+");

    private final Clock clock;
    private final Duration tolerance;

    public StripeSignatureVerifier(Clock clock, PaymentProperties properties) {
        this.clock = clock;
        this.tolerance = properties.signatureTolerance();
    }

    public void verify(String payload, String signatureHeader, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Webhook signing secret is not configured");
        }
        if (payload == null || payload.isEmpty()) {
            throw new InvalidWebhookSignatureException("Empty webhook body");
        }
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        if (body.length > MAX_PAYLOAD_BYTES) {
            throw new InvalidWebhookSignatureException("Webhook body too large: " + body.length + " bytes");
        }

        ParsedHeader header = parseHeader(signatureHeader);

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - header.timestamp()) > tolerance.toSeconds()) {
            throw new InvalidWebhookSignatureException("Timestamp outside tolerance: t=" + header.timestamp());
        }

        byte[] expected = hmacSha256Hex(secret, header.timestamp() + "." + payload)
            .getBytes(StandardCharsets.UTF_8);

        // constant-time compare
        boolean matched = false;
        for (String candidate : header.signatures()) {
            if (MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.UTF_8))) {
                matched = true;
            }
        }
        if (!matched) {
            throw new InvalidWebhookSignatureException("No matching v1 signature");
        }
    }

    /**
     * 테스트/로컬 전송용 서명 헤더 생성
     */
    public static String sign(String payload, String secret, long timestamp) {
        return "t=" + timestamp + ",v1=" + hmacSha256Hex(secret, timestamp + "." + payload);
    }

    private ParsedHeader parseHeader(String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException("Missing signature header");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new InvalidWebhookSignatureException("Malformed signature header element");
            }
            String key = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();

            if ("t".equals(key)) {
                if (timestamp != null || !TIMESTAMP.matcher(value).matches()) {
                    throw new InvalidWebhookSignatureException("Malformed signature timestamp");
                }
                timestamp = Long.parseLong(value);
            } else if ("v1".equals(key)) {
                if (!HEX.matcher(value).matches()) {
                    throw new InvalidWebhookSignatureException("Malformed v1 signature");
                }
                signatures.add(value);
            }
            // v0 등 다른 스킴은 무시
        }

        if (timestamp == null || signatures.isEmpty()) {
            throw new InvalidWebhookSignatureException("Signature header requires t and v1");
        }
        return new ParsedHeader(timestamp, signatures);
    }

    private static String hmacSha256Hex(String secret, String signedPayload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(signedPayload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }

    private record ParsedHeader(long timestamp, List<String> signatures) {
    }
}
