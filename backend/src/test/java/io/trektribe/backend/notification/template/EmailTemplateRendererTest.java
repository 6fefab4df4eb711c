package io.trektribe.backend.notification.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmailTemplateRendererTest {

  private final EmailTemplateRenderer renderer = new EmailTemplateRenderer();

  @Test
  void rendersContentInsideBaseLayout() {
    var rendered = renderer.render("notification", context("https://app.example/trips/t-1"));

    assertThat(rendered.subject()).isEqualTo("Trip Updated");
    assertThat(rendered.htmlBody())
        .contains("<h1")
        .contains("Trip Updated")
        .contains("The trip changed.")
        .contains("href=\"https://app.example/trips/t-1\"")
        .contains(
            "This is an automated message from Trek Tribe. Please do not reply to this email.");
  }

  @Test
  void omitsTripButtonWithoutTripUrl() {
    var rendered = renderer.render("notification", context(null));

    assertThat(rendered.htmlBody()).doesNotContain("View Trip");
  }

  @Test
  void escapesUserSuppliedText() {
    var ctx = context(null);
    ctx.put("body", "<script>alert('x')</script>");

    var rendered = renderer.render("notification", ctx);

    assertThat(rendered.htmlBody()).doesNotContain("<script>").contains("&lt;script&gt;");
  }

  @Test
  void plainTextKeepsLinksAndDropsTags() {
    var rendered = renderer.render("notification", context("https://app.example/trips/t-1"));

    assertThat(rendered.plainTextBody())
        .contains("Trip Updated")
        .contains("The trip changed.")
        .contains("View Trip (https://app.example/trips/t-1)")
        .doesNotContain("<");
  }

  @Test
  void toPlainTextDecodesEntities() {
    assertThat(renderer.toPlainText("<p>Tom &amp; Jerry&#39;s &quot;trip&quot;</p>"))
        .isEqualTo("Tom & Jerry's \"trip\"");
    assertThat(renderer.toPlainText(null)).isEmpty();
  }

  @Test
  void subjectFallsBackToBrandName() {
    var ctx = context(null);
    ctx.remove("subject");

    assertThat(renderer.render("notification", ctx).subject()).isEqualTo("Trek Tribe");
  }

  private static Map<String, Object> context(String tripUrl) {
    var ctx = new HashMap<String, Object>();
    ctx.put("subject", "Trip Updated");
    ctx.put("title", "Trip Updated");
    ctx.put("body", "The trip changed.");
    ctx.put("brandColor", "#2E7D32");
    ctx.put("appUrl", "https://app.example");
    ctx.put("tripUrl", tripUrl);
    return ctx;
  }
}
