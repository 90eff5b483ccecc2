package com.github.dimitryivaniuta.gateway.esim.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Application-level configuration properties.
 *
 * <p>Secrets are bound from the environment in {@code application.yml}. Validation runs at startup, so
 * a missing secret aborts the boot instead of failing the first webhook or job.</p>
 */
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {

    @Valid
    private final Webhook webhook = new Webhook();
    @Valid
    private final Vendor vendor = new Vendor();
    @Valid
    private final Crypto crypto = new Crypto();
    @Valid
    private final Queue queue = new Queue();
    @Valid
    private final Outbox outbox = new Outbox();
    @Valid
    private final Email email = new Email();
    @Valid
    private final Ops ops = new Ops();

    @Getter
    @Setter
    public static class Webhook {
        /**
         * Shared secret used by the storefront to sign notifications (HMAC-SHA256).
         */
        @NotBlank
        private String hmacSecret;
    }

    @Getter
    @Setter
    public static class Vendor {
        @NotBlank
        private String baseUrl = "https://bpm.roamwifi.hk";

        /**
         * Account phone number used to log in.
         */
        @NotBlank
        private String phone;

        @NotBlank
        private String password;

        /**
         * Key appended to the sorted parameter buffer before hashing.
         */
        @NotBlank
        private String signKey;

        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Read timeout for every vendor call; a timed out call is a transient failure.
         */
        private Duration readTimeout = Duration.ofSeconds(15);

        /**
         * Age after which a cached auth token is refreshed before use.
         */
        private Duration tokenTtl = Duration.ofMinutes(30);

        private final Paths paths = new Paths();
    }

    @Getter
    @Setter
    public static class Paths {
        private String login = "/api_order/login";
        private String addOrder = "/api_esim/addEsimOrder";
        private String orderDetails = "/api_esim/getOrderInfo";
        private String listSkus = "/api_esim/getSkus";
        private String listSkusByRegion = "/api_esim/getSkuByGroup";
        private String listPackages = "/api_esim/getPackages";
        private String refundOrder = "/api_esim/refundOrder";
    }

    @Getter
    @Setter
    public static class Crypto {
        /**
         * 64 hex chars, base64 of 32 bytes, or a passphrase hashed with SHA-256.
         */
        @NotBlank
        private String encryptionKey;
    }

    @Getter
    @Setter
    public static class Queue {
        /**
         * Queue name for provisioning jobs.
         */
        private String provisionJobType = "provision-esim";

        /**
         * Whether this instance polls and runs jobs; webhook-only instances turn it off.
         */
        private boolean workerEnabled = true;

        /**
         * Upper bound of jobs claimed and running at the same time in this process.
         */
        @Min(1)
        private int maxConcurrency = 5;

        private long pollIntervalMs = 1000L;

        /**
         * How long a claimed job stays invisible to other workers.
         */
        private Duration visibilityTimeout = Duration.ofMinutes(5);

        @Min(1)
        private int maxAttempts = 5;

        private Duration baseBackoff = Duration.ofSeconds(10);

        private Duration maxBackoff = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic for delivery events.
         */
        private String deliveryEventsTopic = "esim-delivery-events";

        private boolean dispatcherEnabled = true;

        private int batchSize = 100;

        private long publishIntervalMs = 1000L;

        private Duration sendTimeout = Duration.ofSeconds(5);

        private int maxAttempts = 10;

        private Duration baseBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Email {
        private String consumerGroup = "esim-delivery-email";

        private boolean listenerAutoStartup = true;
    }

    @Getter
    @Setter
    public static class Ops {
        /**
         * Token support tooling sends in {@code X-Ops-Token} to reach {@code /api/**}.
         */
        @NotBlank
        private String apiToken;
    }
}
