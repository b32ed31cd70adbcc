package io.b2mash.b2b.artifactstore.artifact;

import java.util.Locale;
import java.util.Set;

public final class MimeTypes {

  public static final String PDF = "application/pdf";
  public static final String GENERIC_BINARY = "application/octet-stream";

  private static final Set<String> PLACEHOLDERS =
      Set.of("", GENERIC_BINARY, "binary/octet-stream", "application/unknown");

  private MimeTypes() {}

  /** Lower-cases and strips parameters: {@code "Application/PDF; charset=x"} to {@code pdf}. */
  public static String normalize(String mimeType) {
    if (mimeType == null) {
      return "";
    }
    int semicolon = mimeType.indexOf(';');
    String base = semicolon >= 0 ? mimeType.substring(0, semicolon) : mimeType;
    return base.trim().toLowerCase(Locale.ROOT);
  }

  /** True for MIME types that say nothing about the content (missing, empty or generic binary). */
  public static boolean isPlaceholder(String mimeType) {
    return PLACEHOLDERS.contains(normalize(mimeType));
  }
}
