package io.b2mash.revel.integration.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.revel.config.NotificationProperties;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Calls {@code sendMessage} on the Telegram Bot API with HTML parse mode. */
@Component
public class BotApiTelegramGateway implements TelegramGateway {

  private static final Logger log = LoggerFactory.getLogger(BotApiTelegramGateway.class);

  private final RestClient restClient;
  private final String botToken;

  @Autowired
  public BotApiTelegramGateway(NotificationProperties properties) {
    this(RestClient.builder(), properties);
  }

  BotApiTelegramGateway(RestClient.Builder builder, NotificationProperties properties) {
    this.restClient = builder.baseUrl(properties.telegram().apiBaseUrl()).build();
    this.botToken = properties.telegram().botToken();
  }

  @Override
  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  @Override
  public TelegramSendResult sendMessage(long chatId, String html) {
    var body = new LinkedHashMap<String, Object>();
    body.put("chat_id", chatId);
    body.put("text", html);
    body.put("parse_mode", "HTML");
    body.put("disable_web_page_preview", true);

    try {
      var response =
          restClient
              .post()
              .uri("/bot{token}/sendMessage", botToken)
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {})
              .toEntity(BotApiResponse.class);

      var payload = response.getBody();
      if (payload == null) {
        return new TelegramSendResult(
            false, null, response.getStatusCode().value(), "Empty Bot API response", null);
      }
      if (payload.ok()) {
        Long messageId = payload.result() != null ? payload.result().messageId() : null;
        return TelegramSendResult.sent(messageId);
      }
      Integer retryAfter = payload.parameters() != null ? payload.parameters().retryAfter() : null;
      int errorCode =
          payload.errorCode() != null ? payload.errorCode() : response.getStatusCode().value();
      log.debug(
          "Telegram sendMessage rejected: errorCode={}, description={}",
          errorCode,
          payload.description());
      return new TelegramSendResult(false, null, errorCode, payload.description(), retryAfter);
    } catch (RestClientException e) {
      log.warn("Telegram Bot API unreachable: {}", e.getMessage());
      return TelegramSendResult.unreachable(e.getMessage());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record BotApiResponse(
      boolean ok,
      BotApiMessage result,
      @JsonProperty("error_code") Integer errorCode,
      String description,
      BotApiParameters parameters) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record BotApiMessage(@JsonProperty("message_id") Long messageId) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record BotApiParameters(@JsonProperty("retry_after") Integer retryAfter) {}
}
