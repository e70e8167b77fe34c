package io.b2mash.revel.integration.telegram;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Link between a user and the Telegram chat the bot writes to. */
@Entity
@Table(name = "telegram_accounts")
public class TelegramAccount {

  @Id
  @Column(name = "user_id")
  private UUID userId;

  @Column(name = "chat_id", nullable = false)
  private Long chatId;

  @Column(name = "linked_at", nullable = false)
  private Instant linkedAt;

  @Column(name = "blocked_at")
  private Instant blockedAt;

  protected TelegramAccount() {}

  public TelegramAccount(UUID userId, Long chatId, Instant linkedAt) {
    this.userId = userId;
    this.chatId = chatId;
    this.linkedAt = linkedAt;
  }

  /** The user blocked the bot or deleted their account; stop writing to this chat. */
  public void markBlocked(Instant when) {
    this.blockedAt = when;
  }

  public void relink(Long chatId, Instant when) {
    this.chatId = chatId;
    this.linkedAt = when;
    this.blockedAt = null;
  }

  public boolean isReachable() {
    return chatId != null && blockedAt == null;
  }

  public UUID getUserId() {
    return userId;
  }

  public Long getChatId() {
    return chatId;
  }

  public Instant getLinkedAt() {
    return linkedAt;
  }

  public Instant getBlockedAt() {
    return blockedAt;
  }
}
