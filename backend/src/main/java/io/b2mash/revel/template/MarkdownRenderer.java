package io.b2mash.revel.template;

import java.util.List;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

/**
 * Converts notification bodies from CommonMark (plus {@code ~~strikethrough~~}) to HTML. Lines
 * inside a paragraph are kept apart with {@code <br>}.
 *
 * <p>Raw HTML in the input is rendered as escaped text, and the result is cleaned against a
 * safelist, so context values can never inject markup.
 */
@Component
public class MarkdownRenderer {

  private static final Safelist HTML_SAFELIST =
      new Safelist()
          .addTags(
              "p", "h1", "h2", "h3", "h4", "h5", "h6", "strong", "em", "del", "code", "pre",
              "blockquote", "ul", "ol", "li", "br", "a")
          .addAttributes("a", "href")
          .addAttributes("ol", "start")
          .addProtocols("a", "href", "https", "http", "mailto");

  private static final List<Extension> EXTENSIONS = List.of(StrikethroughExtension.create());

  private final Parser parser = Parser.builder().extensions(EXTENSIONS).build();
  private final HtmlRenderer htmlRenderer =
      HtmlRenderer.builder()
          .extensions(EXTENSIONS)
          .escapeHtml(true)
          .sanitizeUrls(true)
          .softbreak("<br>")
          .build();

  public String toHtml(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return "";
    }
    // Block separators only; text content has its angle brackets escaped.
    String html = htmlRenderer.render(parser.parse(markdown)).strip().replace(">\n<", "><");

    var settings = new Document.OutputSettings().prettyPrint(false);
    return Jsoup.clean(html, "", HTML_SAFELIST, settings);
  }
}
