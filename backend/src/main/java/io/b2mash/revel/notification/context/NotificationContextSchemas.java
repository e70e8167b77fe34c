package io.b2mash.revel.notification.context;

import static io.b2mash.revel.notification.NotificationType.*;

import io.b2mash.revel.notification.NotificationType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Context schema per notification type. Every context may also carry {@code frontend_url} and
 * pre-formatted date values ({@code <field>_formatted}) supplied by the caller.
 */
@Component
public class NotificationContextSchemas {

  private static final ContextSchema BASE =
      ContextSchema.builder().optional("frontend_url").build();

  private static final ContextSchema TICKET =
      ContextSchema.builder()
          .extend(BASE)
          .require("ticket_id", "ticket_reference", "event_id", "event_name")
          .build();

  private static final ContextSchema EVENT =
      ContextSchema.builder().extend(BASE).require("event_id", "event_name").build();

  private static final ContextSchema ORGANIZATION =
      ContextSchema.builder().extend(BASE).require("organization_id", "organization_name").build();

  private static final ContextSchema POTLUCK_ITEM =
      ContextSchema.builder()
          .extend(EVENT)
          .require("potluck_item_id", "item_name", "action")
          .optional("changed_by_username", "assigned_to_username")
          .build();

  private static final ContextSchema MEMBERSHIP =
      ContextSchema.builder()
          .extend(ORGANIZATION)
          .require("role", "action")
          .optional("actioned_by_name")
          .build();

  private static final ContextSchema WHITELIST_DECISION =
      ContextSchema.builder()
          .extend(ORGANIZATION)
          .require("request_id")
          .optional("decided_by_name", "reason")
          .build();

  private final Map<NotificationType, ContextSchema> schemas;

  public NotificationContextSchemas() {
    var map = new EnumMap<NotificationType, ContextSchema>(NotificationType.class);

    map.put(
        TICKET_CREATED,
        ContextSchema.builder()
            .extend(TICKET)
            .require("event_start", "event_location", "organization_id", "organization_name")
            .require("tier_name", "tier_price", "total_price")
            .require("quantity", ValueKind.INTEGER)
            .optional("qr_code_url", "event_end")
            .build());
    map.put(
        TICKET_UPDATED,
        ContextSchema.builder()
            .extend(TICKET)
            .require("old_status", "new_status")
            .optional("changed_by", "reason")
            .build());
    map.put(
        TICKET_CANCELLED,
        ContextSchema.builder()
            .extend(TICKET)
            .optional("cancellation_reason", "cancelled_by")
            .build());
    map.put(
        TICKET_REFUNDED,
        ContextSchema.builder()
            .extend(TICKET)
            .require("refund_amount")
            .optional("refund_reason")
            .build());
    map.put(
        TICKET_CHECKED_IN,
        ContextSchema.builder().extend(TICKET).optional("checked_in_at").build());
    map.put(
        PAYMENT_CONFIRMATION,
        ContextSchema.builder()
            .extend(TICKET)
            .require("event_start", "payment_amount", "payment_method")
            .optional("receipt_url")
            .build());

    map.put(
        EVENT_OPEN,
        ContextSchema.builder()
            .extend(EVENT)
            .extend(ORGANIZATION)
            .require("event_description", "event_start", "event_end", "event_location")
            .require("rsvp_required", ValueKind.BOOLEAN)
            .require("tickets_available", ValueKind.BOOLEAN)
            .require("questionnaire_required", ValueKind.BOOLEAN)
            .optional("event_image_url")
            .build());
    map.put(
        EVENT_CREATED,
        ContextSchema.builder()
            .extend(EVENT)
            .extend(ORGANIZATION)
            .require("event_description", "event_start", "event_end", "event_location")
            .build());
    map.put(
        EVENT_UPDATED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("changed_fields", ValueKind.LIST)
            .require("old_values", ValueKind.MAP)
            .require("new_values", ValueKind.MAP)
            .build());
    map.put(
        EVENT_REMINDER,
        ContextSchema.builder()
            .extend(EVENT)
            .require("event_start", "event_location")
            .require("days_until", ValueKind.INTEGER)
            .optional("rsvp_status", "ticket_reference")
            .build());
    map.put(
        EVENT_CANCELLED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("event_start")
            .require("refund_available", ValueKind.BOOLEAN)
            .optional("cancellation_reason")
            .build());
    map.put(
        EVENT_SERIES_FOLLOWED,
        ContextSchema.builder()
            .extend(ORGANIZATION)
            .require("series_id", "series_name", "follower_name")
            .build());

    map.put(
        RSVP_CONFIRMATION,
        ContextSchema.builder()
            .extend(EVENT)
            .require("rsvp_id", "event_start", "event_location", "response")
            .require("plus_ones", ValueKind.INTEGER)
            .optional("rsvp_created_at")
            .build());
    map.put(
        RSVP_UPDATED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("rsvp_id", "old_response", "new_response")
            .build());
    map.put(
        RSVP_CANCELLED,
        ContextSchema.builder().extend(EVENT).require("rsvp_id").optional("reason").build());
    map.put(
        WAITLIST_SPOT_AVAILABLE,
        ContextSchema.builder()
            .extend(EVENT)
            .require("event_start")
            .optional("claim_deadline")
            .build());

    map.put(POTLUCK_ITEM_CREATED, POTLUCK_ITEM);
    map.put(POTLUCK_ITEM_UPDATED, POTLUCK_ITEM);
    map.put(POTLUCK_ITEM_CLAIMED, POTLUCK_ITEM);
    map.put(POTLUCK_ITEM_UNCLAIMED, POTLUCK_ITEM);
    map.put(POTLUCK_ITEM_DELETED, POTLUCK_ITEM);
    map.put(
        POTLUCK_UPDATE,
        ContextSchema.builder()
            .extend(EVENT)
            .optional("items_count", ValueKind.INTEGER)
            .optional("summary")
            .build());

    map.put(
        QUESTIONNAIRE_SUBMITTED,
        ContextSchema.builder()
            .extend(ORGANIZATION)
            .require("submission_id", "questionnaire_name", "submitter_email", "submitter_name")
            .optional("event_id", "event_name")
            .build());
    map.put(
        QUESTIONNAIRE_EVALUATION_RESULT,
        ContextSchema.builder()
            .extend(BASE)
            .require("submission_id", "questionnaire_name", "evaluation_status")
            .optional("event_id", "event_name", "feedback")
            .build());

    map.put(
        INVITATION_RECEIVED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("invitation_id", "event_start", "invited_by_name")
            .optional("personal_message", "invitation_expires_at", "event_location")
            .build());
    map.put(
        INVITATION_CLAIMED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("invitation_id", "claimed_by_email", "claimed_by_name")
            .build());
    map.put(
        INVITATION_REVOKED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("invitation_id")
            .optional("revoked_by_name")
            .build());
    map.put(
        INVITATION_REQUEST_CREATED,
        ContextSchema.builder()
            .extend(EVENT)
            .require("request_id", "requester_name", "requester_email")
            .optional("message")
            .build());

    map.put(MEMBERSHIP_GRANTED, MEMBERSHIP);
    map.put(MEMBERSHIP_PROMOTED, MEMBERSHIP);
    map.put(MEMBERSHIP_REMOVED, MEMBERSHIP);
    map.put(MEMBERSHIP_REQUEST_APPROVED, MEMBERSHIP);
    map.put(MEMBERSHIP_REQUEST_REJECTED, MEMBERSHIP);
    map.put(
        MEMBERSHIP_REQUEST_CREATED,
        ContextSchema.builder()
            .extend(ORGANIZATION)
            .require("request_id", "requester_name", "requester_email")
            .optional("message")
            .build());

    map.put(
        WHITELIST_REQUEST_CREATED,
        ContextSchema.builder()
            .extend(ORGANIZATION)
            .require("request_id", "requester_name", "requester_email")
            .optional("message")
            .build());
    map.put(WHITELIST_REQUEST_APPROVED, WHITELIST_DECISION);
    map.put(WHITELIST_REQUEST_REJECTED, WHITELIST_DECISION);

    map.put(
        ORGANIZATION_FOLLOWED,
        ContextSchema.builder().extend(ORGANIZATION).require("follower_name").build());
    map.put(
        NEW_EVENT_FROM_FOLLOWED_ORG,
        ContextSchema.builder()
            .extend(EVENT)
            .extend(ORGANIZATION)
            .require("event_start")
            .optional("event_location", "event_end")
            .build());
    map.put(
        NEW_EVENT_FROM_FOLLOWED_SERIES,
        ContextSchema.builder()
            .extend(EVENT)
            .require("event_start", "series_id", "series_name")
            .optional("event_location", "event_end", "organization_name")
            .build());
    map.put(
        ORG_ANNOUNCEMENT,
        ContextSchema.builder()
            .extend(ORGANIZATION)
            .require("announcement_title", "announcement_body", "posted_by_name")
            .build());

    map.put(
        MALWARE_DETECTED,
        ContextSchema.builder()
            .extend(BASE)
            .require("file_name")
            .require("findings", ValueKind.MAP)
            .optional("quarantine_id")
            .build());

    this.schemas = Collections.unmodifiableMap(map);
  }

  public Optional<ContextSchema> find(NotificationType type) {
    return Optional.ofNullable(schemas.get(type));
  }

  public Map<NotificationType, ContextSchema> all() {
    return schemas;
  }
}
