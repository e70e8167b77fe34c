package io.b2mash.revel.integration.email;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Hourly caps on outbound notification email, per recipient and for the whole platform. */
@Service
public class EmailRateLimiter {

  public static final Duration WINDOW = Duration.ofHours(1);
  private static final String PLATFORM_AGGREGATE_KEY = "platform-aggregate";

  private final int perRecipientLimit;
  private final int platformAggregateLimit;
  private final Cache<String, AtomicInteger> recipientCounters;
  private final Cache<String, AtomicInteger> aggregateCounter;

  @Autowired
  public EmailRateLimiter(
      @Value("${revel.email.rate-limit.per-recipient:60}") int perRecipientLimit,
      @Value("${revel.email.rate-limit.platform-aggregate:5000}") int platformAggregateLimit) {
    this(perRecipientLimit, platformAggregateLimit, Ticker.systemTicker());
  }

  EmailRateLimiter(int perRecipientLimit, int platformAggregateLimit, Ticker ticker) {
    this.perRecipientLimit = perRecipientLimit;
    this.platformAggregateLimit = platformAggregateLimit;
    this.recipientCounters =
        Caffeine.newBuilder().expireAfterWrite(WINDOW).maximumSize(100_000).ticker(ticker).build();
    this.aggregateCounter =
        Caffeine.newBuilder().expireAfterWrite(WINDOW).maximumSize(10).ticker(ticker).build();
  }

  public boolean tryAcquire(String recipientEmail) {
    String recipientKey = "recipient:" + recipientEmail.toLowerCase(Locale.ROOT);

    var recipientCounter = recipientCounters.get(recipientKey, k -> new AtomicInteger(0));
    if (recipientCounter.incrementAndGet() > perRecipientLimit) {
      recipientCounter.decrementAndGet();
      return false;
    }

    var aggregate = aggregateCounter.get(PLATFORM_AGGREGATE_KEY, k -> new AtomicInteger(0));
    if (aggregate.incrementAndGet() > platformAggregateLimit) {
      aggregate.decrementAndGet();
      recipientCounter.decrementAndGet();
      return false;
    }

    return true;
  }
}
