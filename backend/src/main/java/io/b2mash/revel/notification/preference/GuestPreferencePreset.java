package io.b2mash.revel.notification.preference;

import static io.b2mash.revel.notification.NotificationType.*;

import io.b2mash.revel.notification.NotificationType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Types switched off for guest accounts. Applied once when the guest's preferences are created;
 * editing this set later does not touch existing rows.
 */
public final class GuestPreferencePreset {

  public static final Set<NotificationType> DISABLED_TYPES =
      Collections.unmodifiableSet(
          EnumSet.of(
              EVENT_OPEN,
              EVENT_CREATED,
              POTLUCK_ITEM_CREATED,
              POTLUCK_ITEM_UPDATED,
              POTLUCK_ITEM_CLAIMED,
              POTLUCK_ITEM_UNCLAIMED,
              QUESTIONNAIRE_SUBMITTED,
              INVITATION_CLAIMED,
              MEMBERSHIP_GRANTED,
              MEMBERSHIP_PROMOTED,
              MEMBERSHIP_REMOVED,
              MEMBERSHIP_REQUEST_APPROVED,
              MEMBERSHIP_REQUEST_REJECTED,
              ORG_ANNOUNCEMENT,
              MALWARE_DETECTED));

  private GuestPreferencePreset() {}

  static void applyTo(NotificationPreference preference) {
    for (var type : DISABLED_TYPES) {
      preference.putTypeSetting(type, NotificationTypeSetting.disabled());
    }
  }
}
