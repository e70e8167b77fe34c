package io.b2mash.revel.notification.delivery;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle of {@link DeliveryRecord} rows. Inserts race against the unique constraint on
 * (notification, channel): a losing insert re-reads the row the winner created.
 */
@Service
public class DeliveryTracker {

  private static final Logger log = LoggerFactory.getLogger(DeliveryTracker.class);

  private final DeliveryRecordRepository repository;

  public DeliveryTracker(DeliveryRecordRepository repository) {
    this.repository = repository;
  }

  public DeliveryRecord findOrCreate(UUID notificationId, DeliveryChannel channel) {
    return repository
        .findByNotificationIdAndChannel(notificationId, channel)
        .orElseGet(() -> insert(notificationId, channel));
  }

  public Optional<DeliveryRecord> find(UUID recordId) {
    return repository.findById(recordId);
  }

  public DeliveryRecord save(DeliveryRecord record) {
    return repository.save(record);
  }

  /**
   * Marks the email delivery of a digested notification as sent. Returns the existing record
   * unchanged if it was already sent.
   */
  public DeliveryRecord recordDigestDelivery(UUID notificationId, Instant now) {
    var record = findOrCreate(notificationId, DeliveryChannel.EMAIL);
    if (record.isSent()) {
      return record;
    }
    record.markSent(now, Map.of("digest", true));
    return repository.save(record);
  }

  private DeliveryRecord insert(UUID notificationId, DeliveryChannel channel) {
    try {
      return repository.saveAndFlush(new DeliveryRecord(notificationId, channel));
    } catch (DataIntegrityViolationException e) {
      log.debug(
          "Concurrent insert of delivery record notificationId={} channel={}, re-reading",
          notificationId,
          channel);
      return repository
          .findByNotificationIdAndChannel(notificationId, channel)
          .orElseThrow(() -> e);
    }
  }
}
