package com.github.dimitryivaniuta.gateway.esim.repo;

import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link Delivery}.
 */
public interface DeliveryRepository extends JpaRepository<Delivery, String> {

    /**
     * Finds the delivery for an order line item (idempotency key).
     *
     * @param orderId storefront order id
     * @param lineItemId storefront line item id
     * @return delivery
     */
    Optional<Delivery> findByOrderIdAndLineItemId(String orderId, String lineItemId);

    /**
     * Lists deliveries of an order, oldest first.
     *
     * @param orderId storefront order id
     * @return deliveries
     */
    List<Delivery> findByOrderIdOrderByCreatedAtAsc(String orderId);
}
