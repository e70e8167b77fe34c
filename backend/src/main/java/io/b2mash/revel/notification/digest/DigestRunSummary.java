package io.b2mash.revel.notification.digest;

/** Counts from one digest scan: digests sent, users not due or with nothing pending, failures. */
public record DigestRunSummary(int sent, int skipped, int failed) {}
