package io.b2mash.revel.integration.email;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.revel.exception.GlobalExceptionHandler;
import io.b2mash.revel.exception.InvalidStateException;
import io.b2mash.revel.notification.preference.DigestFrequency;
import io.b2mash.revel.notification.preference.PreferenceView;
import java.time.LocalTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class UnsubscribeControllerTest {

  private static final UUID USER_ID = UUID.fromString("7b0c7c1e-3f4a-4d8e-9a57-2f4f6b1d2c11");

  private UnsubscribeService unsubscribeService;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    unsubscribeService = mock(UnsubscribeService.class);
    mockMvc =
        MockMvcBuilders.standaloneSetup(new UnsubscribeController(unsubscribeService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void get_returns_confirmation_page() throws Exception {
    when(unsubscribeService.processUnsubscribe("good-token"))
        .thenReturn("<h1>You have been unsubscribed</h1>");

    mockMvc
        .perform(get("/api/notifications/unsubscribe").param("token", "good-token"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
        .andExpect(content().string("<h1>You have been unsubscribed</h1>"));
  }

  @Test
  void get_with_invalid_token_returns_bad_request() throws Exception {
    when(unsubscribeService.processUnsubscribe("bad"))
        .thenThrow(new InvalidStateException("Invalid Token", "Invalid unsubscribe token"));

    mockMvc
        .perform(get("/api/notifications/unsubscribe").param("token", "bad"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void one_click_post_unsubscribes() throws Exception {
    mockMvc
        .perform(
            post("/api/notifications/unsubscribe")
                .param("token", "good-token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .content("List-Unsubscribe=One-Click"))
        .andExpect(status().isOk());

    verify(unsubscribeService).processUnsubscribe("good-token");
  }

  @Test
  void json_post_confirms_and_returns_preferences() throws Exception {
    when(unsubscribeService.confirmUnsubscribe(eq("t"), isNull()))
        .thenReturn(
            new PreferenceView(
                USER_ID, false, Set.of(), DigestFrequency.DAILY, LocalTime.of(9, 0), Map.of()));

    mockMvc
        .perform(
            post("/api/notifications/unsubscribe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"t\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.userId").value(USER_ID.toString()))
        .andExpect(jsonPath("$.digestFrequency").value("DAILY"));
  }
}
