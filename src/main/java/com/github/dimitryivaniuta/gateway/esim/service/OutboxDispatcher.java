package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.esim.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.esim.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes delivery events from the outbox table to Kafka.
 *
 * <p>An event is marked SENT only after the broker acknowledged it, so every delivered eSIM reaches the
 * email listener at least once. Rows are locked {@code FOR UPDATE SKIP LOCKED}; several instances may
 * run the dispatcher side by side.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.outbox", name = "dispatcher-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    /**
     * Creates the dispatcher.
     *
     * @param outboxEventRepository repo
     * @param kafkaTemplate         template
     * @param properties            app properties
     * @param meterRegistry         metrics
     */
    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;

        this.sentCounter = Counter.builder("esim.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("esim.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("esim.outbox.dead").register(meterRegistry);
    }

    /**
     * Publishes the next batch of due events.
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public void publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();
        String topic = outbox.getDeliveryEventsTopic();

        List<OutboxEvent> batch = outboxEventRepository.lockNextBatchForPublish(
                List.of(OutboxStatus.NEW.name(), OutboxStatus.RETRY.name()),
                Instant.now(),
                outbox.getBatchSize()
        );
        if (batch.isEmpty()) {
            return;
        }

        int sent = 0;
        int retry = 0;
        int dead = 0;

        for (OutboxEvent e : batch) {
            try {
                kafkaTemplate.send(topic, e.getEventKey(), e.getPayload())
                        .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
                e.markSent();
                sent++;
                sentCounter.increment();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                e.markRetry("interrupted", outbox.getBaseBackoff());
                retry++;
                retryCounter.increment();
            } catch (Exception ex) {
                String err = Backoff.errorText(ex);
                int attempt = e.getAttemptCount() + 1;

                if (attempt >= outbox.getMaxAttempts()) {
                    e.markDead(err);
                    dead++;
                    deadCounter.increment();
                    log.error("Delivery event {} for {} moved to DEAD after {} attempts. error={}",
                            e.getId(), e.getAggregateId(), e.getAttemptCount(), err);
                } else {
                    Duration backoff = Backoff.compute(outbox.getBaseBackoff(), outbox.getMaxBackoff(), attempt);
                    e.markRetry(err, backoff);
                    retry++;
                    retryCounter.increment();
                    log.warn("Delivery event {} not published. attempt={} nextAttemptAt={} error={}",
                            e.getId(), e.getAttemptCount(), e.getNextAttemptAt(), err);
                }
            }

            outboxEventRepository.save(e);
        }

        log.info("Outbox batch published. sent={} retry={} dead={} topic={}", sent, retry, dead, topic);
    }
}
