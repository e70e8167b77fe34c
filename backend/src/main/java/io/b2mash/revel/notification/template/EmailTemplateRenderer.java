package io.b2mash.revel.notification.template;

import io.b2mash.revel.template.LenientStandardDialect;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders branded HTML emails from Thymeleaf classpath templates in {@code templates/email/}.
 *
 * <p>Rendering is two-pass: a content template (or ready-made content HTML) is produced first,
 * then injected into the {@code base} layout as unescaped HTML.
 */
@Component
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  private final TemplateEngine emailTemplateEngine;

  public EmailTemplateRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  /** Renders a content template (e.g. {@code digest}) and wraps it in the base layout. */
  public String render(String templateName, Map<String, Object> variables, Locale locale) {
    var ctx = new Context(locale);
    variables.forEach(ctx::setVariable);
    String contentHtml = emailTemplateEngine.process(templateName, ctx);
    return wrap(ctx, contentHtml, templateName);
  }

  /** Wraps already-rendered, already-sanitized content HTML in the base layout. */
  public String renderLayout(String contentHtml, Map<String, Object> variables, Locale locale) {
    var ctx = new Context(locale);
    variables.forEach(ctx::setVariable);
    return wrap(ctx, contentHtml, "inline");
  }

  /**
   * Strips HTML tags to produce a plain-text fallback body. Preserves link text with URL in
   * parentheses. Collapses whitespace.
   */
  public String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;

    // <a href="url">text</a> -> text (url)
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");

    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</div>", "\n");
    text = text.replaceAll("</li>", "\n");
    text = text.replaceAll("</tr>", "\n");
    text = text.replaceAll("</td>", " ");

    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("\\n{3,}", "\n\n");

    return text.strip();
  }

  private String wrap(Context ctx, String contentHtml, String source) {
    ctx.setVariable("contentHtml", contentHtml);
    String fullHtml = emailTemplateEngine.process("base", ctx);
    log.debug("Rendered email from '{}', HTML size={}", source, fullHtml.length());
    return fullHtml;
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var engine = new TemplateEngine();
    engine.setDialect(new LenientStandardDialect());

    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
