package io.eventasaurus.ticketing.infrastructure.external.stripe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventasaurus.ticketing.infrastructure.external.InvalidWebhookSignatureException;
import io.eventasaurus.ticketing.infrastructure.external.PaymentWebhookEvent;
import io.eventasaurus.ticketing.infrastructure.external.WebhookEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 검증된 웹훅 본문을 PaymentWebhookEvent 로 변환
 * <p>
 * 필수 필드: id, type, data.object. 누락 시 서명 실패와 동일하게 거절한다.
 * data.object.id 는 처리 대상 타입에서만 필수다. balance.available 처럼 id 없는 객체를 싣는 타입도 있다.
 */
@Component
@RequiredArgsConstructor
public class StripeWebhookEventParser {

    private final ObjectMapper objectMapper;

    public PaymentWebhookEvent parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookSignatureException("Webhook body is not valid JSON", e);
        }

        String id = text(root, "id");
        String rawType = text(root, "type");
        JsonNode object = root.path("data").path("object");
        String objectId = text(object, "id");

        if (id == null || rawType == null || !object.isObject()) {
            throw new InvalidWebhookSignatureException("Webhook body is missing id, type or data.object");
        }

        WebhookEventType type = WebhookEventType.from(rawType);
        if (type != WebhookEventType.UNHANDLED && objectId == null) {
            throw new InvalidWebhookSignatureException("Webhook body is missing data.object.id for " + rawType);
        }

        String paymentStatus = null;
        String paymentIntentId = null;
        if (type == WebhookEventType.SESSION_COMPLETED || type == WebhookEventType.SESSION_EXPIRED) {
            paymentStatus = text(object, "payment_status");
            paymentIntentId = text(object, "payment_intent");
        }

        return new PaymentWebhookEvent(id, type, rawType, objectId, paymentStatus, paymentIntentId);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value != null && value.isTextual() && !value.asText().isBlank()) ? value.asText() : null;
    }
}
