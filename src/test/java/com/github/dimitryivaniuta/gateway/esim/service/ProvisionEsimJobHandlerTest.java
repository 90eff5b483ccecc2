package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.DeliveryStatus;
import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import com.github.dimitryivaniuta.gateway.esim.service.dto.ProvisionJobPayload;
import com.github.dimitryivaniuta.gateway.esim.vendor.FiRoamClient;
import com.github.dimitryivaniuta.gateway.esim.vendor.VendorUnavailableException;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.AddEsimOrderRequest;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CanonicalEsimPayload;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.OrderResult;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

class ProvisionEsimJobHandlerTest {

    private final ObjectMapper om = new ObjectMapper();

    private DeliveryStore store;
    private FiRoamClient vendor;
    private OrderPayloadFactory factory;
    private SecretVault vault;
    private ProvisionEsimJobHandler handler;

    private Delivery delivery;
    private ProvisioningJob job;

    @BeforeEach
    void setUp() throws Exception {
        store = Mockito.mock(DeliveryStore.class);
        vendor = Mockito.mock(FiRoamClient.class);
        factory = Mockito.mock(OrderPayloadFactory.class);
        vault = new SecretVault("handler-test-key");
        handler = new ProvisionEsimJobHandler(store, vendor, factory, vault, om);

        delivery = Delivery.pending("shop", "5551", "#1001", "L1", "v1", "ESIM-JP-5GB", "buyer@example.com");
        ProvisionJobPayload payload = new ProvisionJobPayload(delivery.getId(), "5551", "#1001", "L1", "v1",
                "buyer@example.com", "ESIM-JP-5GB", null);
        job = ProvisioningJob.newJob("provision-esim", delivery.getId(), om.writeValueAsString(payload));

        Mockito.when(store.findDelivery(delivery.getId())).thenReturn(Optional.of(delivery));
        Mockito.when(store.updateDelivery(ArgumentMatchers.any())).thenAnswer(inv -> inv.getArgument(0));
        Mockito.when(factory.build(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenReturn(AddEsimOrderRequest.of("26", "392", "1"));
    }

    @Test
    void deliversAndStoresEncryptedCanonicalPayload() throws Exception {
        JsonNode raw = om.readTree("{\"code\":0,\"data\":{\"orderNum\":\"EP-1\"}}");
        CanonicalEsimPayload canonical = new CanonicalEsimPayload("EP-1", "LPA:1$smdp.io$AC", null, "8901");
        Mockito.when(vendor.placeOrder(ArgumentMatchers.any(), ArgumentMatchers.eq(delivery.getId())))
                .thenReturn(OrderResult.created(raw, canonical, "a-1"));

        handler.handle(job);

        ArgumentCaptor<String> enc = ArgumentCaptor.forClass(String.class);
        Mockito.verify(store).markDelivered(ArgumentMatchers.eq(delivery.getId()), ArgumentMatchers.eq("EP-1"), enc.capture());
        CanonicalEsimPayload stored = om.readValue(vault.decrypt(enc.getValue()), CanonicalEsimPayload.class);
        Assertions.assertEquals(canonical, stored);
        Assertions.assertEquals(DeliveryStatus.PROVISIONING, delivery.getStatus());
    }

    @Test
    void deliveredDeliveryIsANoOp() {
        delivery.markDelivered("EP-0", "blob");

        handler.handle(job);

        Mockito.verifyNoInteractions(vendor, factory);
        Mockito.verify(store, Mockito.never()).updateDelivery(ArgumentMatchers.any());
        Mockito.verify(store, Mockito.never()).markDelivered(ArgumentMatchers.any(), ArgumentMatchers.any(), ArgumentMatchers.any());
    }

    @Test
    void missingDeliveryFails() {
        Mockito.when(store.findDelivery(delivery.getId())).thenReturn(Optional.empty());

        ProvisioningFailedException e = Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(job));
        Assertions.assertEquals("EsimDelivery " + delivery.getId() + " not found", e.getMessage());
    }

    @Test
    void vendorBusinessErrorMarksDeliveryFailed() throws Exception {
        JsonNode raw = om.readTree("{\"code\":3,\"message\":\"data not exist\"}");
        Mockito.when(vendor.placeOrder(ArgumentMatchers.any(), ArgumentMatchers.any())).thenReturn(OrderResult.rawOnly(raw));

        ProvisioningFailedException e = Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(job));

        Assertions.assertEquals("FiRoam error: code=3 message=data not exist", e.getMessage());
        Assertions.assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        Assertions.assertEquals(e.getMessage(), delivery.getLastError());
        Assertions.assertNull(delivery.getPayloadEncrypted());
        Mockito.verify(store, Mockito.times(2)).updateDelivery(delivery);
    }

    @Test
    void invalidPayloadErrorIsReported() throws Exception {
        JsonNode raw = om.readTree("{\"code\":0,\"data\":\"EP-5\"}");
        Mockito.when(vendor.placeOrder(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenReturn(OrderResult.failed(raw, "a-5", "usable: lpa or activationCode is required"));

        ProvisioningFailedException e = Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(job));
        Assertions.assertEquals("FiRoam error: usable: lpa or activationCode is required", e.getMessage());
    }

    @Test
    void successWithoutCardsIsUnexpected() throws Exception {
        JsonNode raw = om.readTree("{\"code\":0,\"data\":\"\"}");
        Mockito.when(vendor.placeOrder(ArgumentMatchers.any(), ArgumentMatchers.any())).thenReturn(OrderResult.rawOnly(raw));

        ProvisioningFailedException e = Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(job));
        Assertions.assertEquals("FiRoam returned unexpected response", e.getMessage());
    }

    @Test
    void transportFailureIsWrappedAndDeliveryFailed() {
        Mockito.when(vendor.placeOrder(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenThrow(new VendorUnavailableException("Vendor addEsimOrder unreachable: timeout"));

        ProvisioningFailedException e = Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(job));

        Assertions.assertInstanceOf(VendorUnavailableException.class, e.getCause());
        Assertions.assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        Assertions.assertEquals("Vendor addEsimOrder unreachable: timeout", delivery.getLastError());
    }

    @Test
    void mappingFailureMarksDeliveryFailed() {
        Mockito.when(factory.build(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenThrow(new ProvisioningFailedException("No provider mapping found for SKU: ESIM-JP-5GB"));

        Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(job));
        Assertions.assertEquals("No provider mapping found for SKU: ESIM-JP-5GB", delivery.getLastError());
        Mockito.verifyNoInteractions(vendor);
    }

    @Test
    void unreadablePayloadFails() {
        ProvisioningJob broken = ProvisioningJob.newJob("provision-esim", delivery.getId(), "not json");
        Assertions.assertThrows(ProvisioningFailedException.class, () -> handler.handle(broken));
    }
}
