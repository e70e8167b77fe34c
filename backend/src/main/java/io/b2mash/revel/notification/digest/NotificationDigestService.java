package io.b2mash.revel.notification.digest;

import static io.b2mash.revel.notification.delivery.DeliveryChannel.EMAIL;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.integration.email.EmailDeliveryLogService;
import io.b2mash.revel.integration.email.EmailMessage;
import io.b2mash.revel.integration.email.EmailProvider;
import io.b2mash.revel.integration.email.SendResult;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.NotificationRepository;
import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import io.b2mash.revel.notification.preference.DigestFrequency;
import io.b2mash.revel.notification.preference.NotificationPreference;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.template.EmailTemplateRenderer;
import io.b2mash.revel.notification.template.NotificationTextRenderer;
import io.b2mash.revel.notification.template.TemplateContextEnricher;
import io.b2mash.revel.notification.template.TemplateRegistry;
import io.b2mash.revel.recipient.Recipient;
import io.b2mash.revel.recipient.RecipientRepository;
import io.b2mash.revel.template.MarkdownRenderer;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Batches a user's pending notifications into one email at their preferred time. A notification
 * counts as pending until it has a SENT email delivery record, which the digest creates for every
 * notification it includes.
 */
@Service
public class NotificationDigestService {

  private static final Logger log = LoggerFactory.getLogger(NotificationDigestService.class);

  static final String REFERENCE_TYPE = "DIGEST";
  static final int SUMMARY_LENGTH = 200;

  private static final int MINUTES_PER_DAY = 24 * 60;
  private static final String ITEM_TIME_PATTERN = "MMM d, h:mm a";

  private final NotificationRepository notificationRepository;
  private final NotificationPreferenceService preferenceService;
  private final RecipientRepository recipientRepository;
  private final DeliveryTracker deliveryTracker;
  private final EmailProvider emailProvider;
  private final EmailDeliveryLogService deliveryLogService;
  private final TemplateRegistry templateRegistry;
  private final TemplateContextEnricher contextEnricher;
  private final NotificationTextRenderer textRenderer;
  private final EmailTemplateRenderer emailRenderer;
  private final MarkdownRenderer markdownRenderer;
  private final NotificationProperties.Digest settings;
  private final Clock clock;

  public NotificationDigestService(
      NotificationRepository notificationRepository,
      NotificationPreferenceService preferenceService,
      RecipientRepository recipientRepository,
      DeliveryTracker deliveryTracker,
      EmailProvider emailProvider,
      EmailDeliveryLogService deliveryLogService,
      TemplateRegistry templateRegistry,
      TemplateContextEnricher contextEnricher,
      NotificationTextRenderer textRenderer,
      EmailTemplateRenderer emailRenderer,
      MarkdownRenderer markdownRenderer,
      NotificationProperties properties,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.preferenceService = preferenceService;
    this.recipientRepository = recipientRepository;
    this.deliveryTracker = deliveryTracker;
    this.emailProvider = emailProvider;
    this.deliveryLogService = deliveryLogService;
    this.templateRegistry = templateRegistry;
    this.contextEnricher = contextEnricher;
    this.textRenderer = textRenderer;
    this.emailRenderer = emailRenderer;
    this.markdownRenderer = markdownRenderer;
    this.settings = properties.digest();
    this.clock = clock;
  }

  /** Unread notifications since {@code since} without a sent email, oldest first. */
  public List<Notification> getPendingNotificationsForDigest(UUID userId, Instant since) {
    return notificationRepository.findPendingForDigest(userId, since);
  }

  /**
   * True when the user is on a digest cadence and their local time is within the configured window
   * of their preferred send time. Weekly digests also require the configured weekday.
   */
  public boolean shouldSendDigestNow(
      NotificationPreference preference, Recipient recipient, Instant now) {
    if (preference.getDigestFrequency() == DigestFrequency.IMMEDIATE) {
      return false;
    }
    ZoneId zone = resolveZone(recipient);
    var local = now.atZone(zone);

    var sendTime = preference.getDigestSendTime();
    int currentMinute = local.getHour() * 60 + local.getMinute();
    int preferredMinute = sendTime.getHour() * 60 + sendTime.getMinute();
    int diff = Math.abs(currentMinute - preferredMinute);
    diff = Math.min(diff, MINUTES_PER_DAY - diff);
    if (diff > settings.window().toMinutes()) {
      return false;
    }

    if (preference.getDigestFrequency() == DigestFrequency.WEEKLY) {
      DayOfWeek weeklyDay = settings.weeklyDay();
      return local.getDayOfWeek() == weeklyDay;
    }
    return true;
  }

  public DigestContent buildDigestContent(Recipient recipient, List<Notification> notifications) {
    Locale locale = recipient.toLocale();
    ZoneId zone = resolveZone(recipient);
    int count = notifications.size();

    String subject =
        textRenderer.message("notification.digest.subject", new Object[] {count}, locale);

    var variables = new LinkedHashMap<String, Object>();
    variables.putAll(contextEnricher.recipientVariables(recipient));
    variables.put("subject", subject);
    variables.put("title", subject);
    variables.put("total_count", count);
    variables.put("groups", groupByType(notifications, locale, zone));
    variables.put(
        "intro", textRenderer.message("notification.digest.intro", new Object[] {count}, locale));

    String textBody = textRenderer.render("email/digest.txt", variables, locale);
    String htmlBody = emailRenderer.render("digest", variables, locale);
    return new DigestContent(subject, textBody, htmlBody);
  }

  /**
   * Sends one digest email. On success every included notification gets a SENT email delivery
   * record, so it is never sent again.
   *
   * @return whether the email provider accepted the message
   */
  public boolean sendDigestEmail(Recipient recipient, List<Notification> notifications) {
    if (notifications.isEmpty()) {
      return false;
    }
    if (!recipient.hasDeliverableEmail()) {
      log.debug("Skipping digest for userId={}: no verified email", recipient.getUserId());
      return false;
    }

    var content = buildDigestContent(recipient, notifications);
    var recipientVariables = contextEnricher.recipientVariables(recipient);
    var message =
        EmailMessage.forNotification(
            recipient.getEmail(),
            content.subject(),
            content.htmlBody(),
            content.textBody(),
            List.of(),
            REFERENCE_TYPE,
            recipient.getUserId().toString(),
            (String) recipientVariables.get("one_click_unsubscribe_url"));

    SendResult result = emailProvider.sendEmail(message);
    recordDeliveryLog(recipient, result);
    if (!result.success()) {
      log.warn(
          "Digest email failed for userId={} retryable={}: {}",
          recipient.getUserId(),
          result.retryable(),
          result.errorMessage());
      return false;
    }

    Instant now = clock.instant();
    for (Notification notification : notifications) {
      deliveryTracker.recordDigestDelivery(notification.getId(), now);
    }
    log.info(
        "Sent digest email userId={} notificationCount={}",
        recipient.getUserId(),
        notifications.size());
    return true;
  }

  /** Sends every digest that is due now. One user's failure does not stop the scan. */
  public DigestRunSummary runDigestScan() {
    Instant now = clock.instant();
    int sent = 0;
    int skipped = 0;
    int failed = 0;

    for (NotificationPreference preference : preferenceService.findDigestSubscribers()) {
      try {
        var recipient = recipientRepository.findById(preference.getUserId()).orElse(null);
        if (recipient == null
            || !preference.isChannelEnabled(EMAIL)
            || !shouldSendDigestNow(preference, recipient, now)) {
          skipped++;
          continue;
        }
        var since = now.minus(preference.getDigestFrequency().lookback());
        var pending =
            acceptedByEmail(
                preference, getPendingNotificationsForDigest(recipient.getUserId(), since));
        if (pending.isEmpty()) {
          skipped++;
          continue;
        }
        if (sendDigestEmail(recipient, pending)) {
          sent++;
        } else {
          failed++;
        }
      } catch (Exception e) {
        failed++;
        log.error("Digest failed for userId={}", preference.getUserId(), e);
      }
    }

    log.info("Digest scan finished: sent={}, skipped={}, failed={}", sent, skipped, failed);
    return new DigestRunSummary(sent, skipped, failed);
  }

  /** Drops types the user switched off or routed away from email. */
  private List<Notification> acceptedByEmail(
      NotificationPreference preference, List<Notification> pending) {
    return pending.stream()
        .filter(n -> preference.getChannelsForNotificationType(n.getType()).contains(EMAIL))
        .toList();
  }

  private List<Map<String, Object>> groupByType(
      List<Notification> notifications, Locale locale, ZoneId zone) {
    var timeFormat = DateTimeFormatter.ofPattern(ITEM_TIME_PATTERN, locale);
    var grouped = new LinkedHashMap<NotificationType, List<Map<String, Object>>>();
    for (Notification notification : notifications) {
      var item = new LinkedHashMap<String, Object>();
      item.put("title", titleOf(notification, locale));
      item.put("summary", summaryOf(notification));
      item.put("created_at", timeFormat.format(notification.getCreatedAt().atZone(zone)));
      grouped.computeIfAbsent(notification.getType(), type -> new ArrayList<>()).add(item);
    }

    var groups = new ArrayList<Map<String, Object>>();
    grouped.forEach(
        (type, items) -> {
          var group = new LinkedHashMap<String, Object>();
          group.put("label", groupLabel(type, locale));
          group.put("items", items);
          groups.add(group);
        });
    return groups;
  }

  private String titleOf(Notification notification, Locale locale) {
    if (notification.isRendered()) {
      return notification.getTitle();
    }
    try {
      var recipient = recipientRepository.findById(notification.getUserId()).orElse(null);
      var context = contextEnricher.enrich(notification, recipient);
      return templateRegistry.getTemplate(notification.getType()).getInAppTitle(context);
    } catch (RuntimeException e) {
      log.warn(
          "Could not render digest title for notificationId={}: {}",
          notification.getId(),
          e.getMessage());
      return groupLabel(notification.getType(), locale);
    }
  }

  private String summaryOf(Notification notification) {
    String text = emailRenderer.toPlainText(markdownRenderer.toHtml(notification.getBody()));
    text = text.replaceAll("\\s+", " ").strip();
    if (text.length() <= SUMMARY_LENGTH) {
      return text;
    }
    return text.substring(0, SUMMARY_LENGTH - 1).stripTrailing() + "…";
  }

  private String groupLabel(NotificationType type, Locale locale) {
    String fallback = type.name().charAt(0) + type.name().substring(1).toLowerCase(Locale.ROOT);
    return textRenderer.message(
        "notification.digest.group." + type.name().toLowerCase(Locale.ROOT),
        null,
        fallback.replace('_', ' '),
        locale);
  }

  private void recordDeliveryLog(Recipient recipient, SendResult result) {
    try {
      deliveryLogService.record(
          REFERENCE_TYPE,
          recipient.getUserId(),
          "digest",
          recipient.getEmail(),
          emailProvider.providerId(),
          result);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to write digest delivery log for userId={}: {}",
          recipient.getUserId(),
          e.getMessage());
    }
  }

  private ZoneId resolveZone(Recipient recipient) {
    if (recipient == null) {
      return settings.defaultZone();
    }
    return recipient.zoneId().orElse(settings.defaultZone());
  }
}
