package io.b2mash.revel.integration.email;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailDeliveryLogRepository extends JpaRepository<EmailDeliveryLog, UUID> {

  List<EmailDeliveryLog> findByReferenceTypeAndReferenceId(String referenceType, UUID referenceId);
}
