package io.b2mash.revel.notification.channel;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.exception.ResourceNotFoundException;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.NotificationRepository;
import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.delivery.DeliveryRecord;
import io.b2mash.revel.notification.delivery.DeliveryRetryScheduler;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import io.b2mash.revel.notification.preference.DigestFrequency;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.template.NotificationTemplate;
import io.b2mash.revel.notification.template.TemplateContextEnricher;
import io.b2mash.revel.notification.template.TemplateNotRegisteredException;
import io.b2mash.revel.notification.template.TemplateRegistry;
import io.b2mash.revel.recipient.RecipientRepository;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Routes stored notifications to their channels. For every effective channel there is exactly one
 * {@link DeliveryRecord}; sent records and records that failed for good are left alone, so
 * dispatching twice is harmless.
 *
 * <p>Failed attempts are rescheduled while the driver classifies the error as transient and the
 * record has attempts left. The delay doubles per attempt unless the remote side asked for a
 * specific one.
 */
@Service
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  static final String SKIP_REASON = "channel_unavailable";

  private final Map<DeliveryChannel, NotificationChannel> channels =
      new EnumMap<>(DeliveryChannel.class);
  private final NotificationRepository notificationRepository;
  private final RecipientRepository recipientRepository;
  private final NotificationPreferenceService preferenceService;
  private final TemplateRegistry templateRegistry;
  private final TemplateContextEnricher contextEnricher;
  private final DeliveryTracker deliveryTracker;
  private final DeliveryRetryScheduler retryScheduler;
  private final NotificationProperties.Delivery deliveryProperties;

  public NotificationDispatcher(
      List<NotificationChannel> drivers,
      NotificationRepository notificationRepository,
      RecipientRepository recipientRepository,
      NotificationPreferenceService preferenceService,
      TemplateRegistry templateRegistry,
      TemplateContextEnricher contextEnricher,
      DeliveryTracker deliveryTracker,
      DeliveryRetryScheduler retryScheduler,
      NotificationProperties properties) {
    for (NotificationChannel driver : drivers) {
      if (channels.put(driver.channel(), driver) != null) {
        throw new IllegalStateException("Duplicate driver for channel " + driver.channel());
      }
    }
    for (DeliveryChannel channel : DeliveryChannel.values()) {
      if (!channels.containsKey(channel)) {
        throw new IllegalStateException("No driver registered for channel " + channel);
      }
    }
    this.notificationRepository = notificationRepository;
    this.recipientRepository = recipientRepository;
    this.preferenceService = preferenceService;
    this.templateRegistry = templateRegistry;
    this.contextEnricher = contextEnricher;
    this.deliveryTracker = deliveryTracker;
    this.retryScheduler = retryScheduler;
    this.deliveryProperties = properties.delivery();
  }

  /**
   * Channels a notification of this type goes out on right now. Users on a digest cadence only get
   * the inbox entry; their email follows with the digest.
   */
  public Set<DeliveryChannel> determineDeliveryChannels(UUID userId, NotificationType type) {
    var preference = preferenceService.getOrCreate(userId);
    if (preference.getDigestFrequency() != DigestFrequency.IMMEDIATE) {
      return EnumSet.of(DeliveryChannel.IN_APP);
    }
    return preference.getChannelsForNotificationType(type);
  }

  /**
   * @throws ResourceNotFoundException if the notification does not exist
   * @throws TemplateNotRegisteredException if its type has no template
   */
  public List<DeliveryRecord> dispatch(UUID notificationId) {
    var notification =
        notificationRepository
            .findById(notificationId)
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    return dispatch(notification);
  }

  public List<DeliveryRecord> dispatch(Notification notification) {
    var template = lookupTemplate(notification);
    renderInApp(notification, template);

    var effectiveChannels =
        determineDeliveryChannels(notification.getUserId(), notification.getType());
    if (effectiveChannels.isEmpty()) {
      log.debug(
          "No delivery channels for notificationId={} type={}",
          notification.getId(),
          notification.getType());
      return List.of();
    }

    var records = new ArrayList<DeliveryRecord>();
    for (DeliveryChannel channel : effectiveChannels) {
      var record = deliveryTracker.findOrCreate(notification.getId(), channel);
      records.add(attempt(notification, record));
    }
    return records;
  }

  /** Dispatches each notification independently; one failure does not stop the others. */
  public DispatchReport dispatchBatch(Collection<UUID> notificationIds) {
    var dispatched = new ArrayList<UUID>();
    var failures = new LinkedHashMap<UUID, String>();
    for (UUID id : notificationIds) {
      try {
        dispatch(id);
        dispatched.add(id);
      } catch (TemplateNotRegisteredException | ResourceNotFoundException e) {
        failures.put(id, e.getMessage());
      } catch (RuntimeException e) {
        log.error("Dispatch failed for notificationId={}", id, e);
        failures.put(id, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      }
    }
    return new DispatchReport(dispatched, failures);
  }

  /** Makes one more attempt on a single record; used by delayed retries and the retry sweep. */
  public DeliveryRecord deliverRecord(UUID recordId) {
    var record =
        deliveryTracker
            .find(recordId)
            .orElseThrow(() -> new ResourceNotFoundException("DeliveryRecord", recordId));
    if (record.isSent()) {
      return record;
    }
    var notification =
        notificationRepository
            .findById(record.getNotificationId())
            .orElseThrow(
                () -> new ResourceNotFoundException("Notification", record.getNotificationId()));
    return attempt(notification, record);
  }

  private DeliveryRecord attempt(Notification notification, DeliveryRecord record) {
    if (record.isSent()) {
      log.debug(
          "Delivery already sent recordId={} channel={}", record.getId(), record.getChannel());
      return record;
    }
    if (record.isTerminallyFailed(deliveryProperties.maxAttempts())) {
      log.debug(
          "Delivery already failed for good recordId={} channel={} attempts={}",
          record.getId(),
          record.getChannel(),
          record.getRetryCount());
      return record;
    }

    var driver = channels.get(record.getChannel());
    if (!driver.canDeliver(notification)) {
      log.debug(
          "Skipping channel={} for notificationId={}", record.getChannel(), notification.getId());
      record.markSkipped(SKIP_REASON);
      return deliveryTracker.save(record);
    }

    try {
      driver.deliver(notification, record);
    } catch (RuntimeException e) {
      handleFailure(driver, record, e);
    }
    return record;
  }

  private void handleFailure(
      NotificationChannel driver, DeliveryRecord record, RuntimeException e) {
    int attempts = record.getRetryCount();
    if (driver.shouldRetry(e) && attempts < deliveryProperties.maxAttempts()) {
      var delay = backoff(e, attempts);
      log.warn(
          "Delivery attempt {} failed for recordId={} channel={}, retrying in {}: {}",
          attempts,
          record.getId(),
          record.getChannel(),
          delay,
          e.getMessage());
      UUID recordId = record.getId();
      retryScheduler.schedule(recordId, delay, () -> deliverRecord(recordId));
    } else {
      log.error(
          "Delivery failed permanently for recordId={} channel={} after {} attempt(s): {}",
          record.getId(),
          record.getChannel(),
          attempts,
          e.getMessage());
    }
  }

  Duration backoff(RuntimeException e, int attempts) {
    if (e instanceof TransientDeliveryException transientError
        && transientError.getRetryAfter().isPresent()) {
      return transientError.getRetryAfter().get();
    }
    return deliveryProperties.baseBackoff().multipliedBy(1L << Math.min(attempts, 20));
  }

  private NotificationTemplate lookupTemplate(Notification notification) {
    try {
      return templateRegistry.getTemplate(notification.getType());
    } catch (TemplateNotRegisteredException e) {
      log.error(
          "No template registered for type={}, cannot dispatch notificationId={}",
          notification.getType(),
          notification.getId());
      throw e;
    }
  }

  private void renderInApp(Notification notification, NotificationTemplate template) {
    if (notification.isRendered()) {
      return;
    }
    var recipient = recipientRepository.findById(notification.getUserId()).orElse(null);
    try {
      var context = contextEnricher.enrich(notification, recipient);
      notification.applyRendering(template.getInAppTitle(context), template.getInAppBody(context));
      notificationRepository.save(notification);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to render in-app content for notificationId={} type={}: {}",
          notification.getId(),
          notification.getType(),
          e.getMessage());
    }
  }
}
