package io.b2mash.revel.notification;

/** Closed set of notification kinds. Each value has a context schema and a registered template. */
public enum NotificationType {
  TICKET_CREATED,
  TICKET_UPDATED,
  TICKET_CANCELLED,
  TICKET_REFUNDED,
  TICKET_CHECKED_IN,
  PAYMENT_CONFIRMATION,

  EVENT_OPEN,
  EVENT_CREATED,
  EVENT_UPDATED,
  EVENT_REMINDER,
  EVENT_CANCELLED,
  EVENT_SERIES_FOLLOWED,

  RSVP_CONFIRMATION,
  RSVP_UPDATED,
  RSVP_CANCELLED,
  WAITLIST_SPOT_AVAILABLE,

  POTLUCK_ITEM_CREATED,
  POTLUCK_ITEM_UPDATED,
  POTLUCK_ITEM_CLAIMED,
  POTLUCK_ITEM_UNCLAIMED,
  POTLUCK_ITEM_DELETED,
  POTLUCK_UPDATE,

  QUESTIONNAIRE_SUBMITTED,
  QUESTIONNAIRE_EVALUATION_RESULT,

  INVITATION_RECEIVED,
  INVITATION_CLAIMED,
  INVITATION_REVOKED,
  INVITATION_REQUEST_CREATED,

  MEMBERSHIP_GRANTED,
  MEMBERSHIP_PROMOTED,
  MEMBERSHIP_REMOVED,
  MEMBERSHIP_REQUEST_CREATED,
  MEMBERSHIP_REQUEST_APPROVED,
  MEMBERSHIP_REQUEST_REJECTED,

  WHITELIST_REQUEST_CREATED,
  WHITELIST_REQUEST_APPROVED,
  WHITELIST_REQUEST_REJECTED,

  ORGANIZATION_FOLLOWED,
  NEW_EVENT_FROM_FOLLOWED_ORG,
  NEW_EVENT_FROM_FOLLOWED_SERIES,
  ORG_ANNOUNCEMENT,

  MALWARE_DETECTED
}
