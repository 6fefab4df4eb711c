package io.trektribe.backend.notification.template;

import io.trektribe.backend.integration.email.RenderedEmail;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders HTML emails from Thymeleaf templates under {@code templates/email/}.
 *
 * <p>Two passes: the content template is rendered first, then injected unescaped into the {@code
 * base} layout.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  private final TemplateEngine emailTemplateEngine;

  public EmailTemplateRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  /**
   * @param templateName template name without path or suffix, e.g. "notification"
   * @param context template variables; {@code subject} becomes the email subject
   */
  public RenderedEmail render(String templateName, Map<String, Object> context) {
    var ctx = new Context();
    context.forEach(ctx::setVariable);

    String contentHtml = emailTemplateEngine.process(templateName, ctx);

    ctx.setVariable("contentHtml", contentHtml);
    String fullHtml = emailTemplateEngine.process("base", ctx);

    String subject =
        context.get("subject") instanceof String s && !s.isBlank() ? s : "Trek Tribe";

    log.debug("Rendered email template '{}', HTML size={}", templateName, fullHtml.length());
    return new RenderedEmail(subject, fullHtml, toPlainText(fullHtml));
  }

  /** Strips tags for the plain-text part, keeping link targets in parentheses. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;
    text = text.replaceAll("(?is)<(style|title)[^>]*>.*?</\\1>", "");
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</(p|h1|h2|div|tr)>", "\n");
    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&quot;", "\"");
    text = text.replace("&#39;", "'");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&amp;", "&");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll(" *\\n *", "\n");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var engine = new TemplateEngine();

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
