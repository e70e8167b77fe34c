package io.b2mash.revel.notification.channel;

import io.b2mash.revel.integration.telegram.TelegramAccount;
import io.b2mash.revel.integration.telegram.TelegramAccountService;
import io.b2mash.revel.integration.telegram.TelegramGateway;
import io.b2mash.revel.integration.telegram.TelegramRateLimiter;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.delivery.DeliveryRecord;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.template.TelegramHtmlSanitizer;
import io.b2mash.revel.notification.template.TemplateContextEnricher;
import io.b2mash.revel.notification.template.TemplateRegistry;
import io.b2mash.revel.recipient.RecipientRepository;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends notifications as HTML messages through the Telegram bot.
 *
 * <p>Bot API errors map onto retry classes: 429 is transient and honours {@code retry_after}, 403
 * means the user blocked the bot and marks the account blocked, other 4xx are permanent, and
 * 5xx or network errors are transient.
 */
@Component
public final class TelegramNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(TelegramNotificationChannel.class);

  private final TelegramGateway gateway;
  private final TelegramAccountService accountService;
  private final TelegramRateLimiter rateLimiter;
  private final TelegramHtmlSanitizer sanitizer;
  private final TemplateRegistry templateRegistry;
  private final TemplateContextEnricher contextEnricher;
  private final RecipientRepository recipientRepository;
  private final NotificationPreferenceService preferenceService;
  private final DeliveryTracker deliveryTracker;
  private final Clock clock;

  public TelegramNotificationChannel(
      TelegramGateway gateway,
      TelegramAccountService accountService,
      TelegramRateLimiter rateLimiter,
      TelegramHtmlSanitizer sanitizer,
      TemplateRegistry templateRegistry,
      TemplateContextEnricher contextEnricher,
      RecipientRepository recipientRepository,
      NotificationPreferenceService preferenceService,
      DeliveryTracker deliveryTracker,
      Clock clock) {
    this.gateway = gateway;
    this.accountService = accountService;
    this.rateLimiter = rateLimiter;
    this.sanitizer = sanitizer;
    this.templateRegistry = templateRegistry;
    this.contextEnricher = contextEnricher;
    this.recipientRepository = recipientRepository;
    this.preferenceService = preferenceService;
    this.deliveryTracker = deliveryTracker;
    this.clock = clock;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.TELEGRAM;
  }

  @Override
  public boolean canDeliver(Notification notification) {
    var userId = notification.getUserId();
    return gateway.isConfigured()
        && preferenceService.isChannelEnabled(userId, DeliveryChannel.TELEGRAM)
        && preferenceService.isNotificationTypeEnabled(userId, notification.getType())
        && accountService.findReachable(userId).isPresent();
  }

  @Override
  public boolean deliver(Notification notification, DeliveryRecord record) {
    if (!rateLimiter.tryAcquire()) {
      throw DeliveryAttempt.defer(
          record, deliveryTracker, "Telegram rate limit reached", TelegramRateLimiter.WINDOW);
    }
    return DeliveryAttempt.run(this, record, deliveryTracker, clock, () -> send(notification));
  }

  private Map<String, Object> send(Notification notification) {
    TelegramAccount account =
        accountService
            .findReachable(notification.getUserId())
            .orElseThrow(() -> new PermanentDeliveryException("No reachable Telegram chat"));

    var recipient = recipientRepository.findById(notification.getUserId()).orElse(null);
    var template = templateRegistry.getTemplate(notification.getType());
    var context = contextEnricher.enrich(notification, recipient);
    String html = sanitizer.fromMarkdown(template.getTelegramBody(context));

    var result = gateway.sendMessage(account.getChatId(), html);
    if (result.ok()) {
      log.info(
          "Sent notification to Telegram notificationId={} type={}",
          notification.getId(),
          notification.getType());
      var metadata = new LinkedHashMap<String, Object>();
      if (result.messageId() != null) {
        metadata.put("telegram_message_id", result.messageId());
      }
      return metadata;
    }

    String error = "Telegram error " + result.errorCode() + ": " + result.description();
    if (result.isRateLimited()) {
      var retryAfter =
          result.retryAfterSeconds() != null
              ? Duration.ofSeconds(result.retryAfterSeconds())
              : TelegramRateLimiter.WINDOW;
      throw new TransientDeliveryException(error, retryAfter);
    }
    if (result.isRecipientBlocked() && isBlockedByUser(result.description())) {
      accountService.markBlocked(notification.getUserId());
      throw new PermanentDeliveryException(error);
    }
    if (result.isServerSide()) {
      throw new TransientDeliveryException(error);
    }
    throw new PermanentDeliveryException(error);
  }

  private static boolean isBlockedByUser(String description) {
    if (description == null) {
      return true;
    }
    String lower = description.toLowerCase(Locale.ROOT);
    return lower.contains("blocked") || lower.contains("deactivated");
  }
}
