package io.b2mash.revel.notification;

/**
 * Decides who hears about a domain event. Implementations live with the domain that owns the event
 * and hand their result to {@link NotificationService#notifyAll}.
 *
 * @param <E> the domain event or context the recipients are derived from
 */
@FunctionalInterface
public interface RecipientResolver<E> {

  Iterable<RecipientContext> resolveRecipients(E eventContext);
}
