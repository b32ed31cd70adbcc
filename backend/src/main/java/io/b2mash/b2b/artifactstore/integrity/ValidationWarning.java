package io.b2mash.b2b.artifactstore.integrity;

/** Content did not start with the signature its name or declared type promised. Non-fatal. */
public record ValidationWarning(String fileName, FileSignature expected, String message) {}
