package com.github.dimitryivaniuta.gateway.esim.web.dto;

import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CancelResult;

/**
 * Vendor answer to a cancellation request.
 *
 * @param success whether the vendor accepted the cancellation
 * @param code vendor result code
 * @param message vendor message
 */
public record CancellationResponse(boolean success, String code, String message) {

    public static CancellationResponse from(CancelResult r) {
        return new CancellationResponse(r.success(), r.code(), r.message());
    }
}
