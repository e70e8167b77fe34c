package io.b2mash.revel.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.exception.ResourceNotFoundException;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.NotificationRepository;
import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.delivery.DeliveryRecord;
import io.b2mash.revel.notification.delivery.DeliveryRetryScheduler;
import io.b2mash.revel.notification.delivery.DeliveryStatus;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import io.b2mash.revel.notification.preference.DigestFrequency;
import io.b2mash.revel.notification.preference.NotificationPreference;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.template.NotificationTemplate;
import io.b2mash.revel.notification.template.RenderContext;
import io.b2mash.revel.notification.template.TemplateContextEnricher;
import io.b2mash.revel.notification.template.TemplateNotRegisteredException;
import io.b2mash.revel.notification.template.TemplateRegistry;
import io.b2mash.revel.recipient.RecipientRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

class NotificationDispatcherTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");
  private static final UUID USER_ID = UUID.randomUUID();

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  private EmailNotificationChannel email;
  private TelegramNotificationChannel telegram;
  private InAppNotificationChannel inApp;
  private NotificationRepository notificationRepository;
  private NotificationPreferenceService preferenceService;
  private DeliveryTracker deliveryTracker;
  private DeliveryRetryScheduler retryScheduler;
  private TemplateRegistry templateRegistry;
  private NotificationPreference preference;
  private NotificationDispatcher dispatcher;

  private final Map<DeliveryChannel, DeliveryRecord> records =
      new EnumMap<>(DeliveryChannel.class);

  @BeforeEach
  void setUp() {
    email = mockDriver(EmailNotificationChannel.class, DeliveryChannel.EMAIL);
    telegram = mockDriver(TelegramNotificationChannel.class, DeliveryChannel.TELEGRAM);
    inApp = mockDriver(InAppNotificationChannel.class, DeliveryChannel.IN_APP);

    notificationRepository = mock(NotificationRepository.class);
    when(notificationRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

    preference =
        new NotificationPreference(USER_ID, List.of(DeliveryChannel.IN_APP, DeliveryChannel.EMAIL));
    preferenceService = mock(NotificationPreferenceService.class);
    when(preferenceService.getOrCreate(USER_ID)).thenReturn(preference);

    deliveryTracker = mock(DeliveryTracker.class);
    when(deliveryTracker.findOrCreate(any(), any()))
        .thenAnswer(
            invocation ->
                records.computeIfAbsent(
                    invocation.getArgument(1),
                    channel -> {
                      var record = new DeliveryRecord(invocation.getArgument(0), channel);
                      ReflectionTestUtils.setField(record, "id", UUID.randomUUID());
                      return record;
                    }));
    when(deliveryTracker.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

    var template = mock(NotificationTemplate.class);
    when(template.getInAppTitle(any())).thenReturn("New ticket");
    when(template.getInAppBody(any())).thenReturn("Your ticket is ready.");
    templateRegistry = new TemplateRegistry();
    templateRegistry.register(NotificationType.TICKET_CREATED, template);

    var enricher = mock(TemplateContextEnricher.class);
    when(enricher.enrich(any(), any()))
        .thenAnswer(
            invocation ->
                new RenderContext(
                    invocation.getArgument(0), null, Locale.ENGLISH, ZoneId.of("UTC"), Map.of()));

    retryScheduler = mock(DeliveryRetryScheduler.class);
    var recipientRepository = mock(RecipientRepository.class);
    when(recipientRepository.findById(any())).thenReturn(Optional.empty());

    dispatcher =
        new NotificationDispatcher(
            List.of(email, telegram, inApp),
            notificationRepository,
            recipientRepository,
            preferenceService,
            templateRegistry,
            enricher,
            deliveryTracker,
            retryScheduler,
            new NotificationProperties(null, null, 0, null, null, null, null));
  }

  @Test
  void immediatePreferenceDeliversOverEmailAndInApp() {
    var notification = ticketCreated();
    succeedOn(email);
    succeedOn(inApp);

    var channels = dispatcher.determineDeliveryChannels(USER_ID, NotificationType.TICKET_CREATED);
    var result = dispatcher.dispatch(notification);

    assertThat(channels).containsExactlyInAnyOrder(DeliveryChannel.EMAIL, DeliveryChannel.IN_APP);
    assertThat(result)
        .hasSize(2)
        .allSatisfy(r -> assertThat(r.getStatus()).isEqualTo(DeliveryStatus.SENT));
    assertThat(result)
        .extracting(DeliveryRecord::getChannel)
        .containsExactlyInAnyOrder(DeliveryChannel.EMAIL, DeliveryChannel.IN_APP);
    verify(telegram, never()).deliver(any(), any());
  }

  @Test
  void dispatchRendersInAppContentOnce() {
    var notification = ticketCreated();
    succeedOn(email);
    succeedOn(inApp);

    dispatcher.dispatch(notification);

    assertThat(notification.getTitle()).isEqualTo("New ticket");
    assertThat(notification.getBody()).isEqualTo("Your ticket is ready.");
    verify(notificationRepository).save(notification);
  }

  @Test
  void digestPreferenceKeepsOnlyInApp() {
    preference.setDigestFrequency(DigestFrequency.DAILY);

    assertThat(dispatcher.determineDeliveryChannels(USER_ID, NotificationType.TICKET_CREATED))
        .containsExactly(DeliveryChannel.IN_APP);
  }

  @Test
  void noEffectiveChannelsCreatesNoRecords() {
    preference.setSilenceAll(true);

    var result = dispatcher.dispatch(ticketCreated());

    assertThat(result).isEmpty();
    verify(deliveryTracker, never()).findOrCreate(any(), any());
  }

  @Test
  void transientFailureIsRetriedUntilSent() {
    var notification = ticketCreated();
    when(notificationRepository.findById(notification.getId()))
        .thenReturn(Optional.of(notification));
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(true);
    doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email,
                    invocation.getArgument(1),
                    deliveryTracker,
                    clock,
                    () -> {
                      throw new TransientDeliveryException("SMTP connection refused");
                    }))
        .doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email, invocation.getArgument(1), deliveryTracker, clock, Map::of))
        .when(email)
        .deliver(eq(notification), any());

    dispatcher.dispatch(notification);

    var record = records.get(DeliveryChannel.EMAIL);
    assertThat(record.getStatus()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.getRetryCount()).isEqualTo(1);
    assertThat(record.isRetryable()).isTrue();

    var retry = ArgumentCaptor.forClass(Runnable.class);
    verify(retryScheduler).schedule(eq(record.getId()), eq(Duration.ofMinutes(2)), retry.capture());
    when(deliveryTracker.find(record.getId())).thenReturn(Optional.of(record));

    retry.getValue().run();

    assertThat(record.getStatus()).isEqualTo(DeliveryStatus.SENT);
    assertThat(record.getDeliveredAt()).isEqualTo(NOW);
    assertThat(record.getRetryCount()).isEqualTo(2);
    assertThat(record.getErrorMessage()).isNull();
  }

  @Test
  void permanentFailureIsNotRetried() {
    var notification = ticketCreated();
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(true);
    doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email,
                    invocation.getArgument(1),
                    deliveryTracker,
                    clock,
                    () -> {
                      throw new PermanentDeliveryException("Mailbox does not exist");
                    }))
        .when(email)
        .deliver(eq(notification), any());

    dispatcher.dispatch(notification);

    var record = records.get(DeliveryChannel.EMAIL);
    assertThat(record.getStatus()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.isRetryable()).isFalse();
    assertThat(record.getMetadata()).containsEntry("error_class", "PERMANENT");
    verify(retryScheduler, never()).schedule(any(), any(), any());
  }

  @Test
  void transientFailureStopsAtMaxAttempts() {
    var notification = ticketCreated();
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(true);
    var record = new DeliveryRecord(notification.getId(), DeliveryChannel.EMAIL);
    ReflectionTestUtils.setField(record, "id", UUID.randomUUID());
    record.beginAttempt(NOW);
    record.beginAttempt(NOW);
    records.put(DeliveryChannel.EMAIL, record);
    doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email,
                    invocation.getArgument(1),
                    deliveryTracker,
                    clock,
                    () -> {
                      throw new TransientDeliveryException("timeout");
                    }))
        .when(email)
        .deliver(eq(notification), any());

    dispatcher.dispatch(notification);

    assertThat(record.getRetryCount()).isEqualTo(3);
    assertThat(record.getStatus()).isEqualTo(DeliveryStatus.FAILED);
    verify(retryScheduler, never()).schedule(any(), any(), any());
  }

  @Test
  void redispatchLeavesSentRecordsAlone() {
    var notification = ticketCreated();
    succeedOn(email);
    succeedOn(inApp);

    dispatcher.dispatch(notification);
    dispatcher.dispatch(notification);

    verify(email, times(1)).deliver(any(), any());
    verify(inApp, times(1)).deliver(any(), any());
    assertThat(records).hasSize(2);
  }

  @Test
  void redispatchLeavesPermanentlyFailedRecordAlone() {
    var notification = ticketCreated();
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(true);
    doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email,
                    invocation.getArgument(1),
                    deliveryTracker,
                    clock,
                    () -> {
                      throw new PermanentDeliveryException("Mailbox does not exist");
                    }))
        .when(email)
        .deliver(eq(notification), any());

    dispatcher.dispatch(notification);
    dispatcher.dispatch(notification);

    verify(email, times(1)).deliver(any(), any());
    assertThat(records.get(DeliveryChannel.EMAIL).getRetryCount()).isEqualTo(1);
  }

  @Test
  void repeatedRedispatchStopsAtMaxAttempts() {
    var notification = ticketCreated();
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(true);
    doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email,
                    invocation.getArgument(1),
                    deliveryTracker,
                    clock,
                    () -> {
                      throw new TransientDeliveryException("SMTP connection refused");
                    }))
        .when(email)
        .deliver(eq(notification), any());

    for (int i = 0; i < 5; i++) {
      dispatcher.dispatch(notification);
    }

    var record = records.get(DeliveryChannel.EMAIL);
    verify(email, times(3)).deliver(any(), any());
    assertThat(record.getRetryCount()).isEqualTo(3);
    assertThat(record.isTerminallyFailed(3)).isTrue();
  }

  @Test
  void throttledRecordIsDeliveredOnceTheLimiterClears() {
    var notification = ticketCreated();
    when(notificationRepository.findById(notification.getId()))
        .thenReturn(Optional.of(notification));
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(true);
    var window = Duration.ofSeconds(30);
    doAnswer(
            invocation -> {
              throw DeliveryAttempt.defer(
                  invocation.getArgument(1), deliveryTracker, "Email rate limit reached", window);
            })
        .doAnswer(
            invocation -> {
              throw DeliveryAttempt.defer(
                  invocation.getArgument(1), deliveryTracker, "Email rate limit reached", window);
            })
        .doAnswer(
            invocation -> {
              throw DeliveryAttempt.defer(
                  invocation.getArgument(1), deliveryTracker, "Email rate limit reached", window);
            })
        .doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    email, invocation.getArgument(1), deliveryTracker, clock, Map::of))
        .when(email)
        .deliver(eq(notification), any());

    dispatcher.dispatch(notification);

    var record = records.get(DeliveryChannel.EMAIL);
    assertThat(record.getRetryCount()).isZero();
    var retry = ArgumentCaptor.forClass(Runnable.class);
    verify(retryScheduler).schedule(eq(record.getId()), eq(window), retry.capture());
    when(deliveryTracker.find(record.getId())).thenReturn(Optional.of(record));

    retry.getValue().run();
    retry.getValue().run();
    retry.getValue().run();

    verify(retryScheduler, times(3)).schedule(eq(record.getId()), eq(window), any());
    assertThat(record.getStatus()).isEqualTo(DeliveryStatus.SENT);
    assertThat(record.getRetryCount()).isEqualTo(1);
  }

  @Test
  void unavailableChannelIsSkipped() {
    var notification = ticketCreated();
    succeedOn(inApp);
    when(email.canDeliver(notification)).thenReturn(false);

    dispatcher.dispatch(notification);

    var record = records.get(DeliveryChannel.EMAIL);
    assertThat(record.getStatus()).isEqualTo(DeliveryStatus.SKIPPED);
    assertThat(record.getMetadata())
        .containsEntry("skip_reason", NotificationDispatcher.SKIP_REASON);
    verify(email, never()).deliver(any(), any());
  }

  @Test
  void unregisteredTypeFailsLoudly() {
    var notification =
        withId(new Notification(NotificationType.MALWARE_DETECTED, USER_ID, Map.of()));

    assertThatThrownBy(() -> dispatcher.dispatch(notification))
        .isInstanceOf(TemplateNotRegisteredException.class)
        .hasMessageContaining("MALWARE_DETECTED");
    verify(deliveryTracker, never()).findOrCreate(any(), any());
  }

  @Test
  void batchReportsUnregisteredTypeAndContinues() {
    var broken = withId(new Notification(NotificationType.MALWARE_DETECTED, USER_ID, Map.of()));
    var fine = ticketCreated();
    when(notificationRepository.findById(broken.getId())).thenReturn(Optional.of(broken));
    when(notificationRepository.findById(fine.getId())).thenReturn(Optional.of(fine));
    succeedOn(email);
    succeedOn(inApp);

    var report = dispatcher.dispatchBatch(List.of(broken.getId(), fine.getId()));

    assertThat(report.hasFailures()).isTrue();
    assertThat(report.failures()).containsOnlyKeys(broken.getId());
    assertThat(report.dispatched()).containsExactly(fine.getId());
  }

  @Test
  void dispatchOfUnknownIdThrows() {
    var id = UUID.randomUUID();
    when(notificationRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> dispatcher.dispatch(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void backoffDoublesPerAttemptAndHonoursRetryAfter() {
    var plain = new TransientDeliveryException("busy");

    assertThat(dispatcher.backoff(plain, 1)).isEqualTo(Duration.ofMinutes(2));
    assertThat(dispatcher.backoff(plain, 2)).isEqualTo(Duration.ofMinutes(4));
    var throttled = new TransientDeliveryException("slow down", Duration.ofSeconds(7));
    assertThat(dispatcher.backoff(throttled, 2)).isEqualTo(Duration.ofSeconds(7));
  }

  @Test
  void constructorRequiresADriverPerChannel() {
    assertThatThrownBy(
            () ->
                new NotificationDispatcher(
                    List.of(email, inApp),
                    notificationRepository,
                    mock(RecipientRepository.class),
                    preferenceService,
                    templateRegistry,
                    mock(TemplateContextEnricher.class),
                    deliveryTracker,
                    retryScheduler,
                    new NotificationProperties(null, null, 0, null, null, null, null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("TELEGRAM");
  }

  private Notification ticketCreated() {
    return withId(
        new Notification(
            NotificationType.TICKET_CREATED, USER_ID, Map.of("event_name", "Summer Gala")));
  }

  private static Notification withId(Notification notification) {
    ReflectionTestUtils.setField(notification, "id", UUID.randomUUID());
    return notification;
  }

  private void succeedOn(NotificationChannel driver) {
    when(driver.canDeliver(any())).thenReturn(true);
    doAnswer(
            invocation ->
                DeliveryAttempt.run(
                    driver, invocation.getArgument(1), deliveryTracker, clock, Map::of))
        .when(driver)
        .deliver(any(), any());
  }

  private static <T extends NotificationChannel> T mockDriver(
      Class<T> type, DeliveryChannel channel) {
    T driver = mock(type);
    when(driver.channel()).thenReturn(channel);
    when(driver.shouldRetry(any())).thenCallRealMethod();
    return driver;
  }
}
