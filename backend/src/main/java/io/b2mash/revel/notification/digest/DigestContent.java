package io.b2mash.revel.notification.digest;

public record DigestContent(String subject, String textBody, String htmlBody) {}
