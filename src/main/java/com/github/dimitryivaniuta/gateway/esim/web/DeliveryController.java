package com.github.dimitryivaniuta.gateway.esim.web;

import com.github.dimitryivaniuta.gateway.esim.service.DeliveryOperationsService;
import com.github.dimitryivaniuta.gateway.esim.web.dto.CancellationResponse;
import com.github.dimitryivaniuta.gateway.esim.web.dto.DeliveryView;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Delivery inspection and cancellation for support staff.
 */
@RestController
@RequestMapping("/api/deliveries")
public class DeliveryController {

    private final DeliveryOperationsService operationsService;

    public DeliveryController(DeliveryOperationsService operationsService) {
        this.operationsService = operationsService;
    }

    @GetMapping("/{id}")
    public DeliveryView get(@PathVariable("id") String id) {
        return DeliveryView.from(operationsService.get(id));
    }

    @GetMapping
    public List<DeliveryView> listByOrder(@RequestParam("orderId") String orderId) {
        return operationsService.listByOrder(orderId).stream().map(DeliveryView::from).toList();
    }

    /**
     * Cancels the vendor order of a delivered eSIM.
     *
     * @param id delivery id
     * @return 200 when the vendor accepted, 422 with the vendor code and message otherwise
     */
    @PostMapping("/{id}/cancellation")
    public ResponseEntity<CancellationResponse> cancel(@PathVariable("id") String id) {
        CancellationResponse response = CancellationResponse.from(operationsService.cancel(id));
        return response.success()
                ? ResponseEntity.ok(response)
                : ResponseEntity.unprocessableEntity().body(response);
    }
}
