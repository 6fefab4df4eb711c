package io.trektribe.backend.integration.email;

/** Output of template rendering, addressed later by the dispatcher. */
public record RenderedEmail(String subject, String htmlBody, String plainTextBody) {}
