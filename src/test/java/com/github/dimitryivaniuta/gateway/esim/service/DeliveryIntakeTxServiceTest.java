package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.DeliveryStatus;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryRepository;
import com.github.dimitryivaniuta.gateway.esim.service.dto.ProvisionJobPayload;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;

class DeliveryIntakeTxServiceTest {

    private DeliveryRepository deliveryRepository;
    private JobQueue jobQueue;
    private PostgresAdvisoryLockService lockService;
    private DeliveryIntakeTxService service;

    @BeforeEach
    void setUp() {
        deliveryRepository = Mockito.mock(DeliveryRepository.class);
        jobQueue = Mockito.mock(JobQueue.class);
        lockService = Mockito.mock(PostgresAdvisoryLockService.class);
        service = new DeliveryIntakeTxService(deliveryRepository, jobQueue, lockService, new AppProperties());

        Mockito.when(deliveryRepository.saveAndFlush(ArgumentMatchers.any(Delivery.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void newLineItemCreatesPendingDeliveryAndJob() {
        Mockito.when(deliveryRepository.findByOrderIdAndLineItemId("5551", "L1")).thenReturn(Optional.empty());

        Optional<Delivery> created = service.registerLineItem("shop", "5551", "#1001", "L1", "v1", "ESIM-JP-5GB", "buyer@example.com");

        Assertions.assertTrue(created.isPresent());
        Delivery d = created.get();
        Assertions.assertEquals(DeliveryStatus.PENDING, d.getStatus());
        Assertions.assertEquals("ESIM-JP-5GB", d.getSku());
        Assertions.assertNull(d.getPayloadEncrypted());

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        Mockito.verify(jobQueue).enqueue(ArgumentMatchers.eq("provision-esim"), ArgumentMatchers.eq(d.getId()), payload.capture());
        ProvisionJobPayload p = (ProvisionJobPayload) payload.getValue();
        Assertions.assertEquals(d.getId(), p.deliveryId());
        Assertions.assertEquals("5551", p.orderId());
        Assertions.assertEquals("L1", p.lineItemId());
        Assertions.assertEquals("buyer@example.com", p.customerEmail());
        Assertions.assertNull(p.orderPayload());

        InOrder order = Mockito.inOrder(lockService, deliveryRepository, jobQueue);
        order.verify(lockService).lockLineItem("5551", "L1");
        order.verify(deliveryRepository).findByOrderIdAndLineItemId("5551", "L1");
        order.verify(deliveryRepository).saveAndFlush(d);
        order.verify(jobQueue).enqueue(ArgumentMatchers.any(), ArgumentMatchers.any(), ArgumentMatchers.any());
    }

    @Test
    void knownLineItemIsSkippedWithoutJob() {
        Delivery existing = Delivery.pending("shop", "5551", "#1001", "L1", "v1", null, "buyer@example.com");
        Mockito.when(deliveryRepository.findByOrderIdAndLineItemId("5551", "L1")).thenReturn(Optional.of(existing));

        Optional<Delivery> created = service.registerLineItem("shop", "5551", "#1001", "L1", "v1", null, "buyer@example.com");

        Assertions.assertTrue(created.isEmpty());
        Mockito.verify(lockService).lockLineItem("5551", "L1");
        Mockito.verify(deliveryRepository, Mockito.never()).saveAndFlush(ArgumentMatchers.any());
        Mockito.verifyNoInteractions(jobQueue);
    }

    @Test
    void uniqueViolationOnFlushPropagatesBeforeJobIsWritten() {
        Mockito.when(deliveryRepository.findByOrderIdAndLineItemId("5551", "L1")).thenReturn(Optional.empty());
        Mockito.when(deliveryRepository.saveAndFlush(ArgumentMatchers.any(Delivery.class)))
                .thenThrow(new DataIntegrityViolationException("uq_delivery_order_line_item"));

        Assertions.assertThrows(DataIntegrityViolationException.class,
                () -> service.registerLineItem("shop", "5551", "#1001", "L1", "v1", null, "buyer@example.com"));
        Mockito.verifyNoInteractions(jobQueue);
    }
}
