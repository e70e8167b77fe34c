package io.b2mash.revel.integration.email;

import io.b2mash.revel.notification.preference.PreferenceUpdate;
import io.b2mash.revel.notification.preference.PreferenceView;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated endpoints reached from email footers. The signed token is the credential. */
@RestController
@RequestMapping("/api/notifications/unsubscribe")
public class UnsubscribeController {

  private final UnsubscribeService unsubscribeService;

  public UnsubscribeController(UnsubscribeService unsubscribeService) {
    this.unsubscribeService = unsubscribeService;
  }

  @GetMapping
  public ResponseEntity<String> unsubscribe(@RequestParam String token) {
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_HTML)
        .body(unsubscribeService.processUnsubscribe(token));
  }

  /** RFC 8058 one-click POST sent by mail clients; the token travels in the query string. */
  @PostMapping(consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<Void> oneClickUnsubscribe(@RequestParam String token) {
    unsubscribeService.processUnsubscribe(token);
    return ResponseEntity.ok().build();
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<PreferenceView> confirm(@RequestBody ConfirmUnsubscribeRequest request) {
    return ResponseEntity.ok(
        unsubscribeService.confirmUnsubscribe(request.token(), request.preferences()));
  }

  public record ConfirmUnsubscribeRequest(String token, PreferenceUpdate preferences) {}
}
