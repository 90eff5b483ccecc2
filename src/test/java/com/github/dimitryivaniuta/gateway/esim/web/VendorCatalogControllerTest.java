package com.github.dimitryivaniuta.gateway.esim.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.vendor.FiRoamClient;
import com.github.dimitryivaniuta.gateway.esim.vendor.VendorUnavailableException;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.SkuItem;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.VendorResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class VendorCatalogControllerTest {

    private final ObjectMapper om = new ObjectMapper();
    private FiRoamClient vendor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        vendor = Mockito.mock(FiRoamClient.class);
        mvc = MockMvcBuilders.standaloneSetup(new VendorCatalogController(vendor))
                .setControllerAdvice(new ErrorHandlingAdvice())
                .build();
    }

    @Test
    void typedSkus() throws Exception {
        Mockito.when(vendor.listSkus()).thenReturn(VendorResult.ok(om.readTree("{\"code\":0}"),
                List.of(new SkuItem(26L, "Japan", "392"))));

        mvc.perform(get("/api/vendor/skus"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].skuid").value(26))
                .andExpect(jsonPath("$.raw.code").value(0));
    }

    @Test
    void vendorFailureIsBadGateway() throws Exception {
        Mockito.when(vendor.listPackages("26")).thenReturn(VendorResult.rawOnly(om.readTree("{\"code\":3,\"message\":\"data not exist\"}")));

        mvc.perform(get("/api/vendor/skus/26/packages"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.raw.message").value("data not exist"));
    }

    @Test
    void unreachableVendorIsServiceUnavailable() throws Exception {
        Mockito.when(vendor.listSkusByRegion()).thenThrow(new VendorUnavailableException("Vendor getSkuByGroup unreachable"));

        mvc.perform(get("/api/vendor/skus/by-region"))
                .andExpect(status().isServiceUnavailable());
    }
}
