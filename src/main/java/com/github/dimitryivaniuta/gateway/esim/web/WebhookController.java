package com.github.dimitryivaniuta.gateway.esim.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.service.WebhookIntakeService;
import com.github.dimitryivaniuta.gateway.esim.service.WebhookSignatureVerifier;
import com.github.dimitryivaniuta.gateway.esim.service.dto.IntakeResult;
import com.github.dimitryivaniuta.gateway.esim.service.dto.OrderPaidNotification;
import com.github.dimitryivaniuta.gateway.esim.web.dto.ErrorResponse;
import com.github.dimitryivaniuta.gateway.esim.web.dto.WebhookAck;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Storefront webhook endpoint.
 *
 * <p>The body is taken as raw bytes: the signature covers the exact bytes sent, so it is verified
 * before anything is parsed. Once a notification is authentic and well-formed the answer is always 200,
 * because any other status makes the storefront redeliver it.</p>
 */
@Slf4j
@RestController
@RequestMapping("/webhook")
public class WebhookController {

    /** Base64 HMAC-SHA256 of the body. */
    public static final String HMAC_HEADER = "X-Shopify-Hmac-Sha256";

    public static final String SHOP_DOMAIN_HEADER = "X-Shopify-Shop-Domain";

    public static final String WEBHOOK_ID_HEADER = "X-Shopify-Webhook-Id";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookIntakeService intakeService;
    private final ObjectMapper objectMapper;

    public WebhookController(
            WebhookSignatureVerifier signatureVerifier,
            WebhookIntakeService intakeService,
            ObjectMapper objectMapper
    ) {
        this.signatureVerifier = signatureVerifier;
        this.intakeService = intakeService;
        this.objectMapper = objectMapper;
    }

    /**
     * Handles {@code orders/paid}.
     *
     * @param body raw body
     * @param hmac signature header
     * @param shop shop domain header
     * @return 200 ack, 400 for a missing or malformed body, 401 for a missing or wrong signature
     */
    @PostMapping("/orders/paid")
    public ResponseEntity<?> ordersPaid(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = HMAC_HEADER, required = false) String hmac,
            @RequestHeader(value = SHOP_DOMAIN_HEADER, required = false) String shop
    ) {
        if (body == null || body.length == 0) {
            log.error("Webhook without body");
            return ResponseEntity.badRequest().body(ErrorResponse.of("MISSING_BODY", "Missing request body"));
        }
        if (hmac == null || hmac.isBlank()) {
            log.error("Webhook without HMAC header");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of("MISSING_SIGNATURE", "Missing HMAC signature"));
        }
        if (!signatureVerifier.verify(body, hmac)) {
            log.error("Webhook with invalid HMAC signature. shop={}", shop);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of("INVALID_SIGNATURE", "Invalid signature"));
        }

        OrderPaidNotification notification;
        try {
            notification = objectMapper.readValue(body, OrderPaidNotification.class);
        } catch (Exception e) {
            log.error("Webhook body is not a valid order notification: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_PAYLOAD", "Invalid JSON body"));
        }
        if (notification == null || notification.id() == null) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_PAYLOAD", "Order id missing"));
        }
        if (notification.customerEmail() == null) {
            log.error("No email found for order {}", notification.name());
            return ResponseEntity.badRequest().body(ErrorResponse.of("MISSING_EMAIL", "No customer email"));
        }

        try {
            IntakeResult result = intakeService.accept(shop, notification);
            log.info("Order {} processed. created={} skipped={}",
                    notification.name(), result.createdDeliveryIds().size(), result.skippedLineItemIds().size());
            return ResponseEntity.ok(WebhookAck.ok());
        } catch (Exception e) {
            log.error("Error processing order {}", notification.name(), e);
            return ResponseEntity.ok(WebhookAck.processingError());
        }
    }

    /**
     * Liveness probe for webhook routing.
     *
     * @return static status
     */
    @GetMapping("/test")
    public Map<String, String> test() {
        return Map.of("status", "ok", "message", "Webhook server is running");
    }
}
