package io.b2mash.revel.integration.email;

/**
 * Outcome of a provider send. {@code retryable} tells whether a failed send may succeed if tried
 * again later; it is always false for a successful send.
 */
public record SendResult(
    boolean success, String providerMessageId, String errorMessage, boolean retryable) {

  public static SendResult sent(String providerMessageId) {
    return new SendResult(true, providerMessageId, null, false);
  }

  public static SendResult transientFailure(String errorMessage) {
    return new SendResult(false, null, errorMessage, true);
  }

  public static SendResult permanentFailure(String errorMessage) {
    return new SendResult(false, null, errorMessage, false);
  }
}
