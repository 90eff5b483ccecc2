package com.github.dimitryivaniuta.gateway.esim.repo;

import com.github.dimitryivaniuta.gateway.esim.domain.VendorOrderAttempt;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VendorOrderAttemptRepository extends JpaRepository<VendorOrderAttempt, String> {

    List<VendorOrderAttempt> findByDeliveryIdOrderByCreatedAtAsc(String deliveryId);
}
