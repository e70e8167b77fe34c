package io.b2mash.revel.integration.telegram;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TelegramAccountService {

  private static final Logger log = LoggerFactory.getLogger(TelegramAccountService.class);

  private final TelegramAccountRepository repository;
  private final Clock clock;

  public TelegramAccountService(TelegramAccountRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  /** Links (or re-links) a chat to the user, clearing any earlier block. */
  @Transactional
  public TelegramAccount link(UUID userId, long chatId) {
    var account =
        repository
            .findById(userId)
            .map(
                existing -> {
                  existing.relink(chatId, clock.instant());
                  return existing;
                })
            .orElseGet(() -> new TelegramAccount(userId, chatId, clock.instant()));
    log.info("Linked Telegram chat for userId={}", userId);
    return repository.save(account);
  }

  @Transactional(readOnly = true)
  public Optional<TelegramAccount> findReachable(UUID userId) {
    return repository.findById(userId).filter(TelegramAccount::isReachable);
  }

  @Transactional
  public void markBlocked(UUID userId) {
    repository
        .findById(userId)
        .ifPresent(
            account -> {
              account.markBlocked(clock.instant());
              repository.save(account);
              log.warn("Telegram chat of userId={} is blocked, disabling delivery", userId);
            });
  }
}
