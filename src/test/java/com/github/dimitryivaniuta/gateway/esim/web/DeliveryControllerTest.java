package com.github.dimitryivaniuta.gateway.esim.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.service.DeliveryOperationsService;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CancelResult;
import java.util.List;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.ErrorResponseException;

class DeliveryControllerTest {

    private DeliveryOperationsService operations;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        operations = Mockito.mock(DeliveryOperationsService.class);
        mvc = MockMvcBuilders.standaloneSetup(new DeliveryController(operations))
                .setControllerAdvice(new ErrorHandlingAdvice())
                .build();
    }

    @Test
    void deliveryViewHidesActivationData() throws Exception {
        Delivery d = Delivery.pending("shop", "5551", "#1001", "L1", "v1", "ESIM-JP-5GB", "buyer@example.com");
        d.markDelivered("EP-1", "encrypted-blob");
        Mockito.when(operations.get(d.getId())).thenReturn(d);

        mvc.perform(get("/api/deliveries/{id}", d.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DELIVERED"))
                .andExpect(jsonPath("$.vendorReferenceId").value("EP-1"))
                .andExpect(jsonPath("$.hasActivationData").value(true))
                .andExpect(jsonPath("$.payloadEncrypted").doesNotExist())
                .andExpect(jsonPath("$.customerEmail").doesNotExist());
    }

    @Test
    void listsDeliveriesOfAnOrder() throws Exception {
        Mockito.when(operations.listByOrder("5551")).thenReturn(List.of(
                Delivery.pending("shop", "5551", "#1001", "L1", "v1", null, "a@example.com"),
                Delivery.pending("shop", "5551", "#1001", "L2", "v2", null, "a@example.com")));

        mvc.perform(get("/api/deliveries").param("orderId", "5551"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", Matchers.hasSize(2)))
                .andExpect(jsonPath("$[1].lineItemId").value("L2"));
    }

    @Test
    void missingDeliveryIsProblemDetail() throws Exception {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, "Delivery 'x' not found.");
        Mockito.when(operations.get("x")).thenThrow(new ErrorResponseException(HttpStatus.NOT_FOUND, pd, null));

        mvc.perform(get("/api/deliveries/x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Delivery 'x' not found."));
    }

    @Test
    void refusedCancellationIsUnprocessable() throws Exception {
        Mockito.when(operations.cancel("d-1")).thenReturn(new CancelResult(null, false, "3", "data not exist"));

        mvc.perform(post("/api/deliveries/d-1/cancellation"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("3"))
                .andExpect(jsonPath("$.message").value("data not exist"));
    }

    @Test
    void acceptedCancellation() throws Exception {
        Mockito.when(operations.cancel("d-1")).thenReturn(new CancelResult(null, true, "0", "success"));

        mvc.perform(post("/api/deliveries/d-1/cancellation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void cancellationRequiresOpsToken() throws Exception {
        MockMvc guarded = MockMvcBuilders.standaloneSetup(new DeliveryController(operations))
                .setControllerAdvice(new ErrorHandlingAdvice())
                .addFilters(OpsApiTokenFilterTest.filter("ops-secret"))
                .build();

        guarded.perform(post("/api/deliveries/d-1/cancellation"))
                .andExpect(status().isUnauthorized());
        Mockito.verifyNoInteractions(operations);

        Mockito.when(operations.cancel("d-1")).thenReturn(new CancelResult(null, true, "0", "success"));

        guarded.perform(post("/api/deliveries/d-1/cancellation").header(OpsApiTokenFilter.OPS_TOKEN_HEADER, "ops-secret"))
                .andExpect(status().isOk());
        Mockito.verify(operations).cancel("d-1");
    }
}
