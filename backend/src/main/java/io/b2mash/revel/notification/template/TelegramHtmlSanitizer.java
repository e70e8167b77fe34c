package io.b2mash.revel.notification.template;

import io.b2mash.revel.template.MarkdownRenderer;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.TextNode;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

/**
 * Turns template markdown into the HTML subset the Telegram Bot API accepts: {@code b, i, u, s,
 * span.tg-spoiler, code, pre, a[href]}. Block elements become line breaks and bullets; any other
 * tag is dropped while its text is kept.
 */
@Component
public class TelegramHtmlSanitizer {

  private static final Safelist TELEGRAM_SAFELIST =
      new Safelist()
          .addTags("b", "i", "u", "s", "span", "code", "pre", "a")
          .addAttributes("a", "href")
          .addAttributes("span", "class")
          .addProtocols("a", "href", "https", "http", "tg", "mailto");

  private static final Pattern SPOILER = Pattern.compile("\\|\\|(.+?)\\|\\|");

  private final MarkdownRenderer markdownRenderer;

  public TelegramHtmlSanitizer(MarkdownRenderer markdownRenderer) {
    this.markdownRenderer = markdownRenderer;
  }

  public String fromMarkdown(String markdown) {
    return sanitize(markdownRenderer.toHtml(markdown));
  }

  public String sanitize(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String withSpoilers =
        SPOILER.matcher(html).replaceAll("<span class=\"tg-spoiler\">$1</span>");
    Document doc = Jsoup.parseBodyFragment(withSpoilers);
    var settings =
        new Document.OutputSettings().prettyPrint(false).escapeMode(Entities.EscapeMode.xhtml);
    doc.outputSettings(settings);

    doc.select("h1, h2, h3, h4, h5, h6")
        .forEach(
            heading -> {
              heading.after(new TextNode("\n"));
              heading.tagName("b");
            });
    doc.select("strong").forEach(e -> e.tagName("b"));
    doc.select("em").forEach(e -> e.tagName("i"));
    doc.select("del, strike").forEach(e -> e.tagName("s"));
    doc.select("ins").forEach(e -> e.tagName("u"));
    doc.select("br").forEach(br -> br.replaceWith(new TextNode("\n")));
    doc.select("li")
        .forEach(
            li -> {
              li.prependChild(new TextNode("• "));
              li.appendChild(new TextNode("\n"));
            });
    doc.select("p").forEach(p -> p.after(new TextNode("\n\n")));
    for (var span : doc.select("span")) {
      if ("tg-spoiler".equals(span.className())) {
        span.clearAttributes();
        span.attr("class", "tg-spoiler");
      } else {
        span.unwrap();
      }
    }

    String cleaned = Jsoup.clean(doc.body().html(), "", TELEGRAM_SAFELIST, settings);
    return cleaned.replaceAll("\\n{3,}", "\n\n").strip();
  }
}
