package com.github.dimitryivaniuta.gateway.esim.service.dto;

/**
 * Everything needed to tell a customer how to activate their eSIM.
 *
 * @param deliveryId delivery id, usable as an idempotency key by the mail provider
 * @param to recipient
 * @param orderName storefront order name
 * @param productName product name from the SKU mapping, may be null
 * @param region covered region, may be null
 * @param dataAmount data allowance, may be null
 * @param validity validity, may be null
 * @param lpa LPA activation string, may be null
 * @param activationCode activation code, may be null
 * @param iccid ICCID, may be null
 */
public record DeliveryEmailRequest(
        String deliveryId,
        String to,
        String orderName,
        String productName,
        String region,
        String dataAmount,
        String validity,
        String lpa,
        String activationCode,
        String iccid
) {

    @Override
    public String toString() {
        // activation data stays out of logs
        return "DeliveryEmailRequest[deliveryId=" + deliveryId + ", orderName=" + orderName + "]";
    }
}
