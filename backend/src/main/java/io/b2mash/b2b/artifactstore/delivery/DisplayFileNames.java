package io.b2mash.b2b.artifactstore.delivery;

import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import java.util.Map;
import java.util.regex.Pattern;

/** Display file names for delivered artifacts. */
public final class DisplayFileNames {

  public static final String DEFAULT_NAME = "document";

  private static final Pattern ILLEGAL_CHARACTERS = Pattern.compile("[<>:\"/\\\\|?*]");
  private static final Pattern RECOGNIZABLE_EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{2,6}$");

  private static final Map<String, String> EXTENSIONS =
      Map.of(
          MimeTypes.PDF, ".pdf",
          "image/jpeg", ".jpg",
          "image/jpg", ".jpg",
          "image/png", ".png",
          "image/gif", ".gif");

  private DisplayFileNames() {}

  /**
   * Name the file is presented under: the sanitized name (or {@value #DEFAULT_NAME}), with an
   * extension inferred from {@code mimeType} when the sanitized name has none.
   */
  public static String derive(String name, String mimeType) {
    String base = sanitize(name);
    if (RECOGNIZABLE_EXTENSION.matcher(base).find()) {
      return base;
    }
    return base + EXTENSIONS.getOrDefault(MimeTypes.normalize(mimeType), "");
  }

  /** Replaces characters illegal in file names with {@code _}. Idempotent. */
  public static String sanitize(String name) {
    if (name == null) {
      return DEFAULT_NAME;
    }
    String sanitized = ILLEGAL_CHARACTERS.matcher(name).replaceAll("_").trim();
    return sanitized.isEmpty() ? DEFAULT_NAME : sanitized;
  }
}
