package io.b2mash.revel.notification;

import io.b2mash.revel.exception.ResourceNotFoundException;
import io.b2mash.revel.notification.context.NotificationContextValidator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for the rest of the platform. Notifications are validated and stored here with empty
 * title and body; rendering and delivery happen asynchronously after commit.
 */
@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationContextValidator contextValidator;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public NotificationService(
      NotificationRepository notificationRepository,
      NotificationContextValidator contextValidator,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.contextValidator = contextValidator;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Creates a notification and queues it for delivery. Returns the new notification's id. */
  @Transactional
  public UUID notify(NotificationType type, UUID userId, Map<String, Object> context) {
    var notification = createNotification(type, userId, context);
    eventPublisher.publishEvent(new NotificationCreatedEvent(List.of(notification.getId())));
    return notification.getId();
  }

  /** Fans one notification type out to every resolved recipient. */
  @Transactional
  public List<UUID> notifyAll(NotificationType type, Iterable<RecipientContext> recipients) {
    var requests = new ArrayList<NotificationRequest>();
    for (RecipientContext recipient : recipients) {
      requests.add(new NotificationRequest(type, recipient.userId(), recipient.context()));
    }
    if (requests.isEmpty()) {
      return List.of();
    }
    var ids = bulkCreateNotifications(requests).stream().map(Notification::getId).toList();
    eventPublisher.publishEvent(new NotificationCreatedEvent(ids));
    return ids;
  }

  /** Resolves the recipients of a domain event and fans the notification out to them. */
  @Transactional
  public <E> List<UUID> notifyAll(
      NotificationType type, RecipientResolver<E> resolver, E eventContext) {
    return notifyAll(type, resolver.resolveRecipients(eventContext));
  }

  /**
   * @throws io.b2mash.revel.notification.context.InvalidNotificationContextException if the
   *     context does not match the type's schema; nothing is stored
   */
  @Transactional
  public Notification createNotification(
      NotificationType type, UUID userId, Map<String, Object> context) {
    contextValidator.validate(type, context);
    var notification = notificationRepository.save(new Notification(type, userId, context));
    log.debug(
        "Created notification id={} type={} userId={}", notification.getId(), type, userId);
    return notification;
  }

  /** Validates every request before storing any of them, then stores all in one batch. */
  @Transactional
  public List<Notification> bulkCreateNotifications(List<NotificationRequest> requests) {
    for (NotificationRequest request : requests) {
      contextValidator.validate(request.type(), request.context());
    }
    var notifications =
        requests.stream()
            .map(request -> new Notification(request.type(), request.userId(), request.context()))
            .toList();
    var saved = notificationRepository.saveAll(notifications);
    log.info("Created {} notifications in bulk", saved.size());
    return saved;
  }

  @Transactional(readOnly = true)
  public Page<Notification> listNotifications(UUID userId, boolean unreadOnly, Pageable pageable) {
    if (unreadOnly) {
      return notificationRepository.findUnreadInbox(userId, pageable);
    }
    return notificationRepository.findInbox(userId, pageable);
  }

  @Transactional(readOnly = true)
  public long getUnreadCount(UUID userId) {
    return notificationRepository.countUnread(userId);
  }

  @Transactional
  public Notification markAsRead(UUID notificationId, UUID userId) {
    var notification = findOwned(notificationId, userId);
    notification.markRead(clock.instant());
    return notificationRepository.save(notification);
  }

  @Transactional
  public Notification markAsUnread(UUID notificationId, UUID userId) {
    var notification = findOwned(notificationId, userId);
    notification.markUnread();
    return notificationRepository.save(notification);
  }

  @Transactional
  public Notification archive(UUID notificationId, UUID userId) {
    var notification = findOwned(notificationId, userId);
    notification.archive(clock.instant());
    return notificationRepository.save(notification);
  }

  @Transactional
  public int markAllAsRead(UUID userId) {
    return notificationRepository.markAllAsRead(userId, clock.instant());
  }

  private Notification findOwned(UUID notificationId, UUID userId) {
    return notificationRepository
        .findByIdAndUserId(notificationId, userId)
        .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
  }
}
