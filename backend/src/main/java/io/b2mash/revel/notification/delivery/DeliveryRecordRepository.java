package io.b2mash.revel.notification.delivery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeliveryRecordRepository extends JpaRepository<DeliveryRecord, UUID> {

  Optional<DeliveryRecord> findByNotificationIdAndChannel(
      UUID notificationId, DeliveryChannel channel);

  List<DeliveryRecord> findByNotificationId(UUID notificationId);

  @Query(
      """
      SELECT d FROM DeliveryRecord d
      WHERE d.status = io.b2mash.revel.notification.delivery.DeliveryStatus.FAILED
        AND d.retryable = true
        AND d.retryCount < :maxAttempts
        AND d.createdAt >= :since
        AND d.updatedAt < :idleSince
      ORDER BY d.createdAt ASC
      """)
  List<DeliveryRecord> findRetryCandidates(
      @Param("since") Instant since,
      @Param("idleSince") Instant idleSince,
      @Param("maxAttempts") int maxAttempts);

  @Modifying
  @Query("DELETE FROM DeliveryRecord d WHERE d.notificationId IN :notificationIds")
  int deleteByNotificationIdIn(@Param("notificationIds") List<UUID> notificationIds);
}
