package io.b2mash.revel.integration.telegram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.revel.config.NotificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class BotApiTelegramGatewayTest {

  private static final String SEND_URL =
      "https://telegram.test/bot123:secret/sendMessage";

  private MockRestServiceServer server;
  private BotApiTelegramGateway gateway;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    gateway = new BotApiTelegramGateway(builder, properties("123:secret"));
  }

  @Test
  void sendMessage_posts_html_message() {
    server
        .expect(requestTo(SEND_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.chat_id").value(4242))
        .andExpect(jsonPath("$.parse_mode").value("HTML"))
        .andExpect(jsonPath("$.text").value("<b>Hi</b>"))
        .andRespond(
            withSuccess(
                "{\"ok\":true,\"result\":{\"message_id\":991,\"chat\":{\"id\":4242}}}",
                MediaType.APPLICATION_JSON));

    var result = gateway.sendMessage(4242L, "<b>Hi</b>");

    assertThat(result.ok()).isTrue();
    assertThat(result.messageId()).isEqualTo(991L);
    server.verify();
  }

  @Test
  void sendMessage_reports_rate_limit_with_retry_after() {
    server
        .expect(requestTo(SEND_URL))
        .andRespond(
            withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    "{\"ok\":false,\"error_code\":429,"
                        + "\"description\":\"Too Many Requests: retry after 12\","
                        + "\"parameters\":{\"retry_after\":12}}"));

    var result = gateway.sendMessage(4242L, "hi");

    assertThat(result.ok()).isFalse();
    assertThat(result.isRateLimited()).isTrue();
    assertThat(result.retryAfterSeconds()).isEqualTo(12);
  }

  @Test
  void sendMessage_reports_blocked_recipient() {
    server
        .expect(requestTo(SEND_URL))
        .andRespond(
            withStatus(HttpStatus.FORBIDDEN)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    "{\"ok\":false,\"error_code\":403,"
                        + "\"description\":\"Forbidden: bot was blocked by the user\"}"));

    var result = gateway.sendMessage(4242L, "hi");

    assertThat(result.isRecipientBlocked()).isTrue();
    assertThat(result.description()).contains("blocked");
    assertThat(result.isServerSide()).isFalse();
  }

  @Test
  void isConfigured_requires_bot_token() {
    var unconfigured = new BotApiTelegramGateway(RestClient.builder(), properties(null));

    assertThat(gateway.isConfigured()).isTrue();
    assertThat(unconfigured.isConfigured()).isFalse();
  }

  private static NotificationProperties properties(String botToken) {
    return new NotificationProperties(
        null,
        null,
        0,
        null,
        null,
        null,
        new NotificationProperties.Telegram(botToken, "https://telegram.test/", 0));
  }
}
