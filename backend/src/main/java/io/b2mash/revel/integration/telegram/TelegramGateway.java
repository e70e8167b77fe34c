package io.b2mash.revel.integration.telegram;

/** Port for sending messages through the Telegram Bot API. */
public interface TelegramGateway {

  boolean isConfigured();

  /** Sends an HTML-formatted message. Never throws for API or network failures. */
  TelegramSendResult sendMessage(long chatId, String html);
}
