package io.b2mash.revel.integration.email;

import java.util.Objects;

public record EmailAttachment(String filename, byte[] content, String contentType) {

  public EmailAttachment {
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(contentType, "contentType");
  }
}
