package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.DeliveryAttempt;
import com.github.dimitryivaniuta.gateway.esim.domain.PackageType;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryAttemptRepository;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryRepository;
import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailRequest;
import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailResult;
import com.github.dimitryivaniuta.gateway.esim.service.dto.SkuMappingView;
import com.github.dimitryivaniuta.gateway.esim.service.events.EsimDeliveredEvent;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CanonicalEsimPayload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

class DeliveryEmailServiceTest {

    private final ObjectMapper om = new ObjectMapper();

    private DeliveryRepository deliveryRepository;
    private DeliveryAttemptRepository attemptRepository;
    private SkuMappingLookup lookup;
    private SecretVault vault;
    private DeliveryEmailSender sender;
    private SimpleMeterRegistry meters;
    private DeliveryEmailService service;

    private Delivery delivery;
    private EsimDeliveredEvent event;

    @BeforeEach
    void setUp() throws Exception {
        deliveryRepository = Mockito.mock(DeliveryRepository.class);
        attemptRepository = Mockito.mock(DeliveryAttemptRepository.class);
        lookup = Mockito.mock(SkuMappingLookup.class);
        vault = new SecretVault("email-test-key");
        sender = Mockito.mock(DeliveryEmailSender.class);
        meters = new SimpleMeterRegistry();
        service = new DeliveryEmailService(deliveryRepository, attemptRepository, lookup, vault, sender, om, meters);

        delivery = Delivery.pending("shop", "5551", "#1001", "L1", "v1", "ESIM-JP-5GB", "buyer@example.com");
        String json = om.writeValueAsString(new CanonicalEsimPayload("EP-1", "LPA:1$smdp.io$AC", "AC", "8901"));
        delivery.markDelivered("EP-1", vault.encrypt(json));

        event = new EsimDeliveredEvent("1", "e-1", Instant.now(), delivery.getId(), "5551", "#1001", "L1",
                "buyer@example.com", "ESIM-JP-5GB", "EP-1");

        Mockito.when(deliveryRepository.findById(delivery.getId())).thenReturn(Optional.of(delivery));
        Mockito.when(lookup.find("ESIM-JP-5GB")).thenReturn(new SkuMappingView("ESIM-JP-5GB", "firoam", "26:392",
                "Japan 5GB", "Japan", "5GB", "30 days", true, PackageType.FIXED, null));
    }

    @Test
    void sendsActivationDataAndRecordsAttempt() {
        Mockito.when(sender.sendDeliveryEmail(ArgumentMatchers.any())).thenReturn(DeliveryEmailResult.sent("msg-1"));

        service.handle(event);

        ArgumentCaptor<DeliveryEmailRequest> request = ArgumentCaptor.forClass(DeliveryEmailRequest.class);
        Mockito.verify(sender).sendDeliveryEmail(request.capture());
        Assertions.assertEquals("buyer@example.com", request.getValue().to());
        Assertions.assertEquals("LPA:1$smdp.io$AC", request.getValue().lpa());
        Assertions.assertEquals("8901", request.getValue().iccid());
        Assertions.assertEquals("Japan 5GB", request.getValue().productName());
        Assertions.assertEquals("30 days", request.getValue().validity());

        ArgumentCaptor<DeliveryAttempt> attempt = ArgumentCaptor.forClass(DeliveryAttempt.class);
        Mockito.verify(attemptRepository).save(attempt.capture());
        Assertions.assertEquals(DeliveryAttempt.RESULT_SENT, attempt.getValue().getResult());
        Assertions.assertEquals("msg-1", attempt.getValue().getMessageId());
        Assertions.assertEquals(1.0, meters.counter("esim.email.sent").count());
    }

    @Test
    void alreadySentIsSkipped() {
        Mockito.when(attemptRepository.existsByDeliveryIdAndChannelAndResult(
                delivery.getId(), DeliveryAttempt.CHANNEL_EMAIL, DeliveryAttempt.RESULT_SENT)).thenReturn(true);

        service.handle(event);

        Mockito.verifyNoInteractions(sender);
        Mockito.verify(attemptRepository, Mockito.never()).save(ArgumentMatchers.any());
    }

    @Test
    void undeliveredDeliveryIsSkipped() {
        delivery.markFailed("FiRoam error: code=3 message=data not exist");

        service.handle(event);

        Mockito.verifyNoInteractions(sender);
    }

    @Test
    void senderFailureIsRecordedAndRaised() {
        Mockito.when(sender.sendDeliveryEmail(ArgumentMatchers.any())).thenReturn(DeliveryEmailResult.failed("mailbox unavailable"));

        Assertions.assertThrows(DeliveryEmailException.class, () -> service.handle(event));

        ArgumentCaptor<DeliveryAttempt> attempt = ArgumentCaptor.forClass(DeliveryAttempt.class);
        Mockito.verify(attemptRepository).save(attempt.capture());
        Assertions.assertEquals(DeliveryAttempt.RESULT_FAILED, attempt.getValue().getResult());
        Assertions.assertEquals("mailbox unavailable", attempt.getValue().getError());
        Assertions.assertEquals(1.0, meters.counter("esim.email.failed").count());
    }

    @Test
    void senderExceptionCountsAsFailure() {
        Mockito.when(sender.sendDeliveryEmail(ArgumentMatchers.any())).thenThrow(new IllegalStateException("smtp down"));

        Assertions.assertThrows(DeliveryEmailException.class, () -> service.handle(event));
        Mockito.verify(attemptRepository).save(ArgumentMatchers.argThat(a -> "smtp down".equals(a.getError())));
    }
}
