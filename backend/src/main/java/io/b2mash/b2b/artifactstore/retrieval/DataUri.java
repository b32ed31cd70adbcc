package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.exception.InvalidDescriptorException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/** Decoded {@code data:[<mime>][;base64],<payload>} URI. */
public record DataUri(String mimeType, byte[] content) {

  private static final String SCHEME = "data:";

  public static DataUri parse(String uri) {
    if (uri == null || !uri.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
      throw new InvalidDescriptorException("Embedded file data is not a data URI");
    }
    int comma = uri.indexOf(',');
    if (comma < 0) {
      throw new InvalidDescriptorException("Embedded file data has no payload");
    }

    String header = uri.substring(SCHEME.length(), comma);
    String payload = uri.substring(comma + 1);
    boolean base64 = header.toLowerCase(Locale.ROOT).endsWith(";base64");
    int semicolon = header.indexOf(';');
    String mimeType = (semicolon >= 0 ? header.substring(0, semicolon) : header).trim();

    byte[] content;
    try {
      content = base64 ? Base64.getMimeDecoder().decode(payload) : percentDecode(payload);
    } catch (IllegalArgumentException e) {
      throw new InvalidDescriptorException("Embedded file data is not decodable");
    }
    return new DataUri(mimeType.isEmpty() ? null : mimeType, content);
  }

  /**
   * Decodes {@code %XX} escapes straight to bytes. Unescaped characters are taken as UTF-8 and
   * {@code +} stays literal.
   */
  static byte[] percentDecode(String payload) {
    var out = new ByteArrayOutputStream(payload.length());
    int i = 0;
    while (i < payload.length()) {
      char c = payload.charAt(i);
      if (c == '%') {
        if (i + 3 > payload.length()) {
          throw new IllegalArgumentException("Truncated escape at index " + i);
        }
        int high = Character.digit(payload.charAt(i + 1), 16);
        int low = Character.digit(payload.charAt(i + 2), 16);
        if (high < 0 || low < 0) {
          throw new IllegalArgumentException("Invalid escape at index " + i);
        }
        out.write((high << 4) | low);
        i += 3;
      } else {
        int end = i;
        while (end < payload.length() && payload.charAt(end) != '%') {
          end++;
        }
        out.writeBytes(payload.substring(i, end).getBytes(StandardCharsets.UTF_8));
        i = end;
      }
    }
    return out.toByteArray();
  }
}
