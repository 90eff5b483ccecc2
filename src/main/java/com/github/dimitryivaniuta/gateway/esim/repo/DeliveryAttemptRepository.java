package com.github.dimitryivaniuta.gateway.esim.repo;

import com.github.dimitryivaniuta.gateway.esim.domain.DeliveryAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeliveryAttemptRepository extends JpaRepository<DeliveryAttempt, String> {

    /**
     * Whether a notification over the channel already went through.
     *
     * @param deliveryId delivery id
     * @param channel channel, e.g. {@code EMAIL}
     * @param result attempt result
     * @return true if at least one matching attempt exists
     */
    boolean existsByDeliveryIdAndChannelAndResult(String deliveryId, String channel, String result);
}
