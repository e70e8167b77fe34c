package io.b2mash.revel.notification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.userId = :userId
        AND n.archivedAt IS NULL
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findInbox(@Param("userId") UUID userId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.userId = :userId
        AND n.archivedAt IS NULL
        AND n.readAt IS NULL
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findUnreadInbox(@Param("userId") UUID userId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.userId = :userId
        AND n.archivedAt IS NULL
        AND n.readAt IS NULL
      """)
  long countUnread(@Param("userId") UUID userId);

  /**
   * Unread notifications created since the given instant that have no successful email delivery
   * yet, oldest first.
   */
  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.userId = :userId
        AND n.createdAt >= :since
        AND n.readAt IS NULL
        AND NOT EXISTS (
          SELECT 1 FROM DeliveryRecord d
          WHERE d.notificationId = n.id
            AND d.channel = io.b2mash.revel.notification.delivery.DeliveryChannel.EMAIL
            AND d.status = io.b2mash.revel.notification.delivery.DeliveryStatus.SENT
        )
      ORDER BY n.createdAt ASC
      """)
  List<Notification> findPendingForDigest(
      @Param("userId") UUID userId, @Param("since") Instant since);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.readAt = :readAt
      WHERE n.userId = :userId
        AND n.readAt IS NULL
      """)
  int markAllAsRead(@Param("userId") UUID userId, @Param("readAt") Instant readAt);

  @Query("SELECT n.id FROM Notification n WHERE n.createdAt < :cutoff")
  List<UUID> findIdsCreatedBefore(@Param("cutoff") Instant cutoff, Pageable pageable);

  @Modifying
  @Query("DELETE FROM Notification n WHERE n.id IN :ids")
  int deleteByIdIn(@Param("ids") List<UUID> ids);
}
