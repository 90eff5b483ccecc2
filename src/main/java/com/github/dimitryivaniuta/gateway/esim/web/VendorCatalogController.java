package com.github.dimitryivaniuta.gateway.esim.web;

import com.github.dimitryivaniuta.gateway.esim.vendor.FiRoamClient;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.PackageItem;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.SkuByGroup;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.SkuItem;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.VendorResult;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only passthrough to the vendor catalog, used when maintaining SKU mappings.
 *
 * <p>Responses carry the raw vendor answer next to the typed data; a vendor-side failure is a 502.</p>
 */
@RestController
@RequestMapping("/api/vendor/skus")
public class VendorCatalogController {

    private final FiRoamClient vendorClient;

    public VendorCatalogController(FiRoamClient vendorClient) {
        this.vendorClient = vendorClient;
    }

    @GetMapping
    public ResponseEntity<VendorResult<List<SkuItem>>> listSkus() {
        return toResponse(vendorClient.listSkus());
    }

    @GetMapping("/by-region")
    public ResponseEntity<VendorResult<SkuByGroup>> listSkusByRegion() {
        return toResponse(vendorClient.listSkusByRegion());
    }

    @GetMapping("/{skuId}/packages")
    public ResponseEntity<VendorResult<PackageItem>> listPackages(@PathVariable("skuId") String skuId) {
        return toResponse(vendorClient.listPackages(skuId));
    }

    private static <T> ResponseEntity<VendorResult<T>> toResponse(VendorResult<T> result) {
        return result.data() != null
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
    }
}
