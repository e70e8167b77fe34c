package io.b2mash.revel.notification.template;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.revel.template.MarkdownRenderer;
import org.junit.jupiter.api.Test;

class TelegramHtmlSanitizerTest {

  private final TelegramHtmlSanitizer sanitizer = new TelegramHtmlSanitizer(new MarkdownRenderer());

  @Test
  void convertsMarkdownToTelegramTags() {
    String html = sanitizer.fromMarkdown("# Reminder\n\n**Summer Gala** starts _soon_");

    assertThat(html)
        .contains("<b>Reminder</b>")
        .contains("<b>Summer Gala</b>")
        .contains("<i>soon</i>")
        .doesNotContain("<h1>")
        .doesNotContain("<p>")
        .doesNotContain("<strong>");
  }

  @Test
  void turnsListItemsIntoBullets() {
    String html = sanitizer.fromMarkdown("- Salad\n- Bread");

    assertThat(html).contains("• Salad").contains("• Bread").doesNotContain("<li>");
  }

  @Test
  void keepsSpoilers() {
    assertThat(sanitizer.sanitize("Prize: ||a trip to Rome||"))
        .contains("<span class=\"tg-spoiler\">a trip to Rome</span>");
  }

  @Test
  void stripsUnsupportedTagsButKeepsText() {
    String html =
        sanitizer.sanitize(
            "<div class=\"card\"><script>alert(1)</script><b>ok</b> <span>plain</span></div>");

    assertThat(html)
        .contains("<b>ok</b>")
        .contains("plain")
        .doesNotContain("<div")
        .doesNotContain("<script")
        .doesNotContain("<span");
  }

  @Test
  void blankInputIsEmpty() {
    assertThat(sanitizer.sanitize(null)).isEmpty();
    assertThat(sanitizer.fromMarkdown("")).isEmpty();
  }
}
