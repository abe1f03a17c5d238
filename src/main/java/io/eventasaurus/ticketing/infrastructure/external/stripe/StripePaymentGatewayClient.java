package io.eventasaurus.ticketing.infrastructure.external.stripe;

import com.fasterxml.jackson.databind.JsonNode;
import io.eventasaurus.ticketing.config.PaymentProperties;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSession;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSessionRequest;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSessionStatus;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayClient;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayException;
import io.eventasaurus.ticketing.infrastructure.external.PaymentIntentStatus;
import io.eventasaurus.ticketing.infrastructure.external.PaymentWebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.function.Supplier;

/**
 * Stripe REST API 연동 (Checkout Session + Connect destination charge)
 * <p>
 * - 요청 본문은 application/x-www-form-urlencoded (Stripe 규약)
 * - 세션 생성은 Idempotency-Key 헤더로 중복 생성 방지
 * - connect / read 타임아웃 초과 시 PaymentGatewayException
 */
@Slf4j
@Component
@Profile("!local")
public class StripePaymentGatewayClient implements PaymentGatewayClient {

    private final RestClient restClient;
    private final PaymentProperties properties;
    private final StripeSignatureVerifier signatureVerifier;
    private final StripeWebhookEventParser eventParser;

    public StripePaymentGatewayClient(RestClient.Builder restClientBuilder,
                                      PaymentProperties properties,
                                      StripeSignatureVerifier signatureVerifier,
                                      StripeWebhookEventParser eventParser) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.connectTimeout());
        requestFactory.setReadTimeout(properties.readTimeout());

        this.restClient = restClientBuilder
            .baseUrl(properties.apiBaseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.secretKey())
            .build();
        this.properties = properties;
        this.signatureVerifier = signatureVerifier;
        this.eventParser = eventParser;
    }

    @Override
    public CheckoutSession createCheckoutSession(CheckoutSessionRequest request) {
        MultiValueMap<String, String> form = toForm(request);

        JsonNode body = call("create checkout session for order " + request.orderId(), () ->
            restClient.post()
                .uri("/v1/checkout/sessions")
                .header("Idempotency-Key", request.idempotencyKey())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class)
        );

        String sessionId = requiredText(body, "id");
        String url = requiredText(body, "url");
        log.info("Stripe checkout session created: orderId={}, sessionId={}", request.orderId(), sessionId);
        return new CheckoutSession(sessionId, url, optionalText(body, "payment_intent"));
    }

    @Override
    public PaymentIntentStatus getPaymentIntent(String paymentReference) {
        JsonNode body = call("get payment intent " + paymentReference, () ->
            restClient.get()
                .uri("/v1/payment_intents/{id}", paymentReference)
                .retrieve()
                .body(JsonNode.class)
        );
        return new PaymentIntentStatus(requiredText(body, "id"), requiredText(body, "status"));
    }

    @Override
    public CheckoutSessionStatus getCheckoutSession(String sessionId) {
        JsonNode body = call("get checkout session " + sessionId, () ->
            restClient.get()
                .uri("/v1/checkout/sessions/{id}", sessionId)
                .retrieve()
                .body(JsonNode.class)
        );
        return new CheckoutSessionStatus(
            requiredText(body, "id"),
            requiredText(body, "payment_status"),
            optionalText(body, "payment_intent")
        );
    }

    @Override
    public PaymentWebhookEvent verifyWebhookSignature(String payload, String signatureHeader, String secret) {
        signatureVerifier.verify(payload, signatureHeader, secret);
        return eventParser.parse(payload);
    }

    private MultiValueMap<String, String> toForm(CheckoutSessionRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", "payment");
        form.add("client_reference_id", String.valueOf(request.orderId()));
        form.add("success_url", properties.successUrl());
        form.add("cancel_url", properties.cancelUrl());
        form.add("expires_at", String.valueOf(request.expiresAt().getEpochSecond()));

        List<CheckoutSessionRequest.LineItem> items = request.lineItems();
        for (int i = 0; i < items.size(); i++) {
            CheckoutSessionRequest.LineItem item = items.get(i);
            String prefix = "line_items[" + i + "]";
            form.add(prefix + "[price_data][currency]", request.currency());
            form.add(prefix + "[price_data][product_data][name]", item.name());
            form.add(prefix + "[price_data][unit_amount]", String.valueOf(item.unitAmountCents()));
            form.add(prefix + "[quantity]", String.valueOf(item.quantity()));
        }

        form.add("payment_intent_data[application_fee_amount]", String.valueOf(request.applicationFeeCents()));
        form.add("payment_intent_data[transfer_data][destination]", request.payoutAccountId());

        request.metadata().forEach((key, value) -> {
            form.add("metadata[" + key + "]", value);
            form.add("payment_intent_data[metadata][" + key + "]", value);
        });
        return form;
    }

    private JsonNode call(String description, Supplier<JsonNode> request) {
        try {
            JsonNode body = request.get();
            if (body == null) {
                throw new PaymentGatewayException("Empty response from Stripe: " + description, null);
            }
            return body;
        } catch (RestClientResponseException e) {
            throw new PaymentGatewayException(
                "Stripe returned " + e.getStatusCode().value() + " on " + description,
                e.getStatusCode().value(),
                e
            );
        } catch (RestClientException e) {
            // 연결 실패, 타임아웃 (ResourceAccessException) 포함
            throw new PaymentGatewayException("Stripe call failed on " + description, e);
        }
    }

    private static String requiredText(JsonNode body, String field) {
        String value = optionalText(body, field);
        if (value == null) {
            throw new PaymentGatewayException("Stripe response is missing '" + field + "'", null);
        }
        return value;
    }

    private static String optionalText(JsonNode body, String field) {
        JsonNode value = body.get(field);
        return (value != null && value.isTextual()) ? value.asText() : null;
    }
}
