package io.b2mash.revel.notification.channel;

import io.b2mash.revel.integration.email.EmailDeliveryLogService;
import io.b2mash.revel.integration.email.EmailMessage;
import io.b2mash.revel.integration.email.EmailProvider;
import io.b2mash.revel.integration.email.EmailRateLimiter;
import io.b2mash.revel.integration.email.SendResult;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.delivery.DeliveryRecord;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.template.TemplateContextEnricher;
import io.b2mash.revel.notification.template.TemplateRegistry;
import io.b2mash.revel.recipient.Recipient;
import io.b2mash.revel.recipient.RecipientRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends notifications through the configured {@link EmailProvider}. The transport outcome decides
 * the record's state; writing the delivery log afterwards is best effort.
 */
@Component
public final class EmailNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

  static final String REFERENCE_TYPE = "NOTIFICATION";

  private final EmailProvider emailProvider;
  private final EmailRateLimiter rateLimiter;
  private final EmailDeliveryLogService deliveryLogService;
  private final TemplateRegistry templateRegistry;
  private final TemplateContextEnricher contextEnricher;
  private final RecipientRepository recipientRepository;
  private final NotificationPreferenceService preferenceService;
  private final DeliveryTracker deliveryTracker;
  private final Clock clock;

  public EmailNotificationChannel(
      EmailProvider emailProvider,
      EmailRateLimiter rateLimiter,
      EmailDeliveryLogService deliveryLogService,
      TemplateRegistry templateRegistry,
      TemplateContextEnricher contextEnricher,
      RecipientRepository recipientRepository,
      NotificationPreferenceService preferenceService,
      DeliveryTracker deliveryTracker,
      Clock clock) {
    this.emailProvider = emailProvider;
    this.rateLimiter = rateLimiter;
    this.deliveryLogService = deliveryLogService;
    this.templateRegistry = templateRegistry;
    this.contextEnricher = contextEnricher;
    this.recipientRepository = recipientRepository;
    this.preferenceService = preferenceService;
    this.deliveryTracker = deliveryTracker;
    this.clock = clock;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.EMAIL;
  }

  @Override
  public boolean canDeliver(Notification notification) {
    var userId = notification.getUserId();
    if (!preferenceService.isChannelEnabled(userId, DeliveryChannel.EMAIL)
        || !preferenceService.isNotificationTypeEnabled(userId, notification.getType())) {
      return false;
    }
    return recipientRepository
        .findById(userId)
        .map(Recipient::hasDeliverableEmail)
        .orElse(false);
  }

  @Override
  public boolean deliver(Notification notification, DeliveryRecord record) {
    var recipient =
        recipientRepository
            .findById(notification.getUserId())
            .filter(Recipient::hasDeliverableEmail);
    if (recipient.isPresent() && !rateLimiter.tryAcquire(recipient.get().getEmail())) {
      throw DeliveryAttempt.defer(
          record,
          deliveryTracker,
          "Email rate limit reached for recipient",
          EmailRateLimiter.WINDOW);
    }
    return DeliveryAttempt.run(
        this, record, deliveryTracker, clock, () -> send(notification, record, recipient));
  }

  private Map<String, Object> send(
      Notification notification, DeliveryRecord record, Optional<Recipient> deliverable) {
    var recipient =
        deliverable.orElseThrow(
            () -> new PermanentDeliveryException("Recipient has no verified email address"));

    var template = templateRegistry.getTemplate(notification.getType());
    var context = contextEnricher.enrich(notification, recipient);
    var message =
        EmailMessage.forNotification(
            recipient.getEmail(),
            template.getEmailSubject(context),
            template.getEmailHtmlBody(context).orElse(null),
            template.getEmailTextBody(context),
            new ArrayList<>(template.getEmailAttachments(context).values()),
            REFERENCE_TYPE,
            notification.getId().toString(),
            (String) context.variables().get("one_click_unsubscribe_url"));

    SendResult result = emailProvider.sendEmail(message);

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("provider", emailProvider.providerId());
    recordDeliveryLog(notification, recipient, result)
        .ifPresent(logId -> metadata.put("email_log_id", logId.toString()));

    if (!result.success()) {
      log.warn(
          "Email delivery failed for notificationId={} recordId={} retryable={}: {}",
          notification.getId(),
          record.getId(),
          result.retryable(),
          result.errorMessage());
      throw result.retryable()
          ? new TransientDeliveryException(result.errorMessage())
          : new PermanentDeliveryException(result.errorMessage());
    }

    if (result.providerMessageId() != null) {
      metadata.put("provider_message_id", result.providerMessageId());
    }
    log.info(
        "Sent notification email notificationId={} type={} provider={}",
        notification.getId(),
        notification.getType(),
        emailProvider.providerId());
    return metadata;
  }

  private Optional<UUID> recordDeliveryLog(
      Notification notification, Recipient recipient, SendResult result) {
    try {
      var entry =
          deliveryLogService.record(
              REFERENCE_TYPE,
              notification.getId(),
              "notification/" + notification.getType().name().toLowerCase(Locale.ROOT),
              recipient.getEmail(),
              emailProvider.providerId(),
              result);
      return Optional.ofNullable(entry.getId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to write email delivery log for notificationId={}: {}",
          notification.getId(),
          e.getMessage());
      return Optional.empty();
    }
  }
}
