package io.b2mash.revel.notification.template;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.integration.email.UnsubscribeService;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.recipient.Recipient;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Prepares the variables templates see. Adds recipient-local formatted dates, deep links, the
 * recipient and a signed unsubscribe link on top of the stored context.
 *
 * <p>A {@code <field>_formatted} value supplied by the caller is kept as is, and {@code
 * <field>_short} is only derived when no formatted value exists.
 */
@Component
public class TemplateContextEnricher {

  static final List<String> DATE_FIELDS =
      List.of(
          "event_start",
          "event_end",
          "rsvp_created_at",
          "ticket_created_at",
          "invitation_expires_at");

  private static final String FULL_PATTERN = "EEEE, MMMM d, yyyy 'at' h:mm a z";
  private static final String SHORT_PATTERN = "MMM d, yyyy 'at' h:mm a";

  private final NotificationProperties properties;
  private final UnsubscribeService unsubscribeService;

  public TemplateContextEnricher(
      NotificationProperties properties, UnsubscribeService unsubscribeService) {
    this.properties = properties;
    this.unsubscribeService = unsubscribeService;
  }

  public RenderContext enrich(Notification notification, Recipient recipient) {
    Locale locale = recipient != null ? recipient.toLocale() : Locale.ENGLISH;
    ZoneId zone =
        recipient != null
            ? recipient.zoneId().orElse(properties.digest().defaultZone())
            : properties.digest().defaultZone();

    var variables = new LinkedHashMap<String, Object>(notification.getContext());
    addFormattedDates(variables, locale, zone);
    addLinks(variables);
    if (recipient != null) {
      addRecipient(variables, recipient);
    }
    variables.put("notification_type", notification.getType().name());
    return new RenderContext(notification, recipient, locale, zone, variables);
  }

  /** Variables shared by every email for this recipient, also used by the digest. */
  public Map<String, Object> recipientVariables(Recipient recipient) {
    var variables = new LinkedHashMap<String, Object>();
    addLinks(variables);
    addRecipient(variables, recipient);
    return variables;
  }

  private void addFormattedDates(Map<String, Object> variables, Locale locale, ZoneId zone) {
    var full = DateTimeFormatter.ofPattern(FULL_PATTERN, locale);
    var shortForm = DateTimeFormatter.ofPattern(SHORT_PATTERN, locale);
    for (String field : DATE_FIELDS) {
      String formattedKey = field + "_formatted";
      String shortKey = field + "_short";
      if (variables.get(formattedKey) != null) {
        continue;
      }
      ContextDates.parse(variables.get(field))
          .map(instant -> instant.atZone(zone))
          .ifPresent(
              zoned -> {
                variables.put(formattedKey, full.format(zoned));
                variables.putIfAbsent(shortKey, shortForm.format(zoned));
              });
    }
  }

  private void addLinks(Map<String, Object> variables) {
    String frontend = properties.frontendBaseUrl();
    variables.putIfAbsent("frontend_url", frontend);
    if (variables.get("event_id") != null) {
      variables.putIfAbsent("event_url", frontend + "/events/" + variables.get("event_id"));
    }
    if (variables.get("organization_id") != null) {
      variables.putIfAbsent(
          "organization_url", frontend + "/org/" + variables.get("organization_id"));
    }
    variables.putIfAbsent("preferences_url", frontend + "/account/notifications");
  }

  private void addRecipient(Map<String, Object> variables, Recipient recipient) {
    var recipientMap = new LinkedHashMap<String, Object>();
    recipientMap.put("name", recipient.greetingName());
    recipientMap.put("email", recipient.getEmail());
    variables.put("recipient", recipientMap);
    variables.put("recipient_name", recipient.greetingName());

    if (unsubscribeService.isConfigured()) {
      String token = unsubscribeService.generateToken(recipient.getUserId());
      variables.put(
          "unsubscribe_link", properties.frontendBaseUrl() + "/unsubscribe?token=" + token);
      variables.put(
          "one_click_unsubscribe_url",
          properties.apiBaseUrl() + "/api/notifications/unsubscribe?token=" + token);
    }
  }
}
