package io.b2mash.revel.notification.template;

import static io.b2mash.revel.notification.NotificationType.*;

import io.b2mash.revel.notification.NotificationType;
import java.util.ArrayList;
import java.util.List;

/** The production templates, one per notification type. */
public final class NotificationTemplateCatalog {

  private NotificationTemplateCatalog() {}

  public static List<NotificationTemplate> standardTemplates(TemplateToolkit toolkit) {
    var templates = new ArrayList<NotificationTemplate>();

    // Tickets and payments
    templates.add(calendar(TICKET_CREATED, toolkit, "event_name"));
    templates.add(standard(TICKET_UPDATED, toolkit, "event_name"));
    templates.add(standard(TICKET_CANCELLED, toolkit, "event_name"));
    templates.add(standard(TICKET_REFUNDED, toolkit, "event_name"));
    templates.add(standard(TICKET_CHECKED_IN, toolkit, "event_name"));
    templates.add(calendar(PAYMENT_CONFIRMATION, toolkit, "event_name"));

    // Events
    templates.add(calendar(EVENT_OPEN, toolkit, "event_name"));
    templates.add(calendar(EVENT_CREATED, toolkit, "event_name", "organization_name"));
    templates.add(standard(EVENT_UPDATED, toolkit, "event_name"));
    templates.add(calendar(EVENT_REMINDER, toolkit, "event_name", "days_until"));
    templates.add(standard(EVENT_CANCELLED, toolkit, "event_name"));
    templates.add(standard(EVENT_SERIES_FOLLOWED, toolkit, "follower_name", "series_name"));

    // RSVPs and waitlist
    templates.add(calendar(RSVP_CONFIRMATION, toolkit, "event_name"));
    templates.add(standard(RSVP_UPDATED, toolkit, "event_name"));
    templates.add(standard(RSVP_CANCELLED, toolkit, "event_name"));
    templates.add(standard(WAITLIST_SPOT_AVAILABLE, toolkit, "event_name"));

    // Potluck
    templates.add(standard(POTLUCK_ITEM_CREATED, toolkit, "item_name", "event_name"));
    templates.add(standard(POTLUCK_ITEM_UPDATED, toolkit, "item_name", "event_name"));
    templates.add(standard(POTLUCK_ITEM_CLAIMED, toolkit, "item_name", "event_name"));
    templates.add(standard(POTLUCK_ITEM_UNCLAIMED, toolkit, "item_name", "event_name"));
    templates.add(standard(POTLUCK_ITEM_DELETED, toolkit, "item_name", "event_name"));
    templates.add(standard(POTLUCK_UPDATE, toolkit, "event_name"));

    // Questionnaires
    templates.add(
        standard(QUESTIONNAIRE_SUBMITTED, toolkit, "submitter_name", "questionnaire_name"));
    templates.add(new QuestionnaireEvaluationTemplate(toolkit));

    // Invitations
    templates.add(calendar(INVITATION_RECEIVED, toolkit, "event_name", "invited_by_name"));
    templates.add(standard(INVITATION_CLAIMED, toolkit, "claimed_by_name", "event_name"));
    templates.add(standard(INVITATION_REVOKED, toolkit, "event_name"));
    templates.add(standard(INVITATION_REQUEST_CREATED, toolkit, "requester_name", "event_name"));

    // Memberships
    templates.add(standard(MEMBERSHIP_GRANTED, toolkit, "organization_name"));
    templates.add(standard(MEMBERSHIP_PROMOTED, toolkit, "organization_name", "role"));
    templates.add(standard(MEMBERSHIP_REMOVED, toolkit, "organization_name"));
    templates.add(
        standard(MEMBERSHIP_REQUEST_CREATED, toolkit, "requester_name", "organization_name"));
    templates.add(standard(MEMBERSHIP_REQUEST_APPROVED, toolkit, "organization_name"));
    templates.add(standard(MEMBERSHIP_REQUEST_REJECTED, toolkit, "organization_name"));

    // Whitelist
    templates.add(
        standard(WHITELIST_REQUEST_CREATED, toolkit, "requester_name", "organization_name"));
    templates.add(standard(WHITELIST_REQUEST_APPROVED, toolkit, "organization_name"));
    templates.add(standard(WHITELIST_REQUEST_REJECTED, toolkit, "organization_name"));

    // Follows and announcements
    templates.add(standard(ORGANIZATION_FOLLOWED, toolkit, "follower_name", "organization_name"));
    templates.add(
        calendar(NEW_EVENT_FROM_FOLLOWED_ORG, toolkit, "organization_name", "event_name"));
    templates.add(
        calendar(NEW_EVENT_FROM_FOLLOWED_SERIES, toolkit, "series_name", "event_name"));
    templates.add(
        standard(ORG_ANNOUNCEMENT, toolkit, "organization_name", "announcement_title"));

    // System
    templates.add(standard(MALWARE_DETECTED, toolkit, "file_name"));

    return templates;
  }

  private static NotificationTemplate standard(
      NotificationType type, TemplateToolkit toolkit, String... titleArgumentKeys) {
    return new StandardNotificationTemplate(type, toolkit, titleArgumentKeys);
  }

  private static NotificationTemplate calendar(
      NotificationType type, TemplateToolkit toolkit, String... titleArgumentKeys) {
    return new CalendarNotificationTemplate(type, toolkit, titleArgumentKeys);
  }
}
