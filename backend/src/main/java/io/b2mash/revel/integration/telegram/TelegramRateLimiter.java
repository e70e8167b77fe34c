package io.b2mash.revel.integration.telegram;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.revel.config.NotificationProperties;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Fixed one-second windows capping outbound Bot API messages across the whole process. */
@Service
public class TelegramRateLimiter {

  public static final Duration WINDOW = Duration.ofSeconds(1);

  private final int messagesPerSecond;
  private final Ticker ticker;
  private final Cache<Long, AtomicInteger> windows;

  @Autowired
  public TelegramRateLimiter(NotificationProperties properties) {
    this(properties.telegram().messagesPerSecond(), Ticker.systemTicker());
  }

  TelegramRateLimiter(int messagesPerSecond, Ticker ticker) {
    this.messagesPerSecond = messagesPerSecond;
    this.ticker = ticker;
    this.windows =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofSeconds(5))
            .maximumSize(16)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire() {
    long window = TimeUnit.NANOSECONDS.toSeconds(ticker.read());
    var counter = windows.get(window, k -> new AtomicInteger(0));
    if (counter.incrementAndGet() > messagesPerSecond) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }
}
