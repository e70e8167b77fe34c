package io.b2mash.revel.integration.telegram;

/**
 * Outcome of a Bot API call. {@code errorCode} is the HTTP-like code Telegram reports, or 0 when
 * the API could not be reached at all.
 */
public record TelegramSendResult(
    boolean ok, Long messageId, int errorCode, String description, Integer retryAfterSeconds) {

  public static TelegramSendResult sent(Long messageId) {
    return new TelegramSendResult(true, messageId, 200, null, null);
  }

  public static TelegramSendResult unreachable(String description) {
    return new TelegramSendResult(false, null, 0, description, null);
  }

  public boolean isRateLimited() {
    return errorCode == 429;
  }

  /** Telegram answers 403 when the user blocked the bot or the account was deactivated. */
  public boolean isRecipientBlocked() {
    return errorCode == 403;
  }

  public boolean isServerSide() {
    return errorCode == 0 || errorCode >= 500;
  }
}
