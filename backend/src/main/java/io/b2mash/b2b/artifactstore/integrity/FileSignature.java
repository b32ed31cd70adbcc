package io.b2mash.b2b.artifactstore.integrity;

import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Leading bytes that identify the formats the store accepts. */
public enum FileSignature {
  PDF(MimeTypes.PDF, List.of("pdf"), new byte[] {'%', 'P', 'D', 'F'}),
  PNG("image/png", List.of("png"), new byte[] {(byte) 0x89, 'P', 'N', 'G'}),
  JPEG("image/jpeg", List.of("jpg", "jpeg"), new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}),
  GIF("image/gif", List.of("gif"), new byte[] {'G', 'I', 'F', '8'});

  private final String mimeType;
  private final List<String> extensions;
  private final byte[] magic;

  FileSignature(String mimeType, List<String> extensions, byte[] magic) {
    this.mimeType = mimeType;
    this.extensions = extensions;
    this.magic = magic;
  }

  public String mimeType() {
    return mimeType;
  }

  public boolean matches(byte[] content) {
    return content != null
        && content.length >= magic.length
        && Arrays.equals(content, 0, magic.length, magic, 0, magic.length);
  }

  public static Optional<FileSignature> forExtension(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return Optional.empty();
    }
    String ext = fileName.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(s -> s.extensions.contains(ext)).findFirst();
  }

  public static Optional<FileSignature> forMimeType(String mimeType) {
    String normalized = MimeTypes.normalize(mimeType);
    if (normalized.equals("application/x-pdf")) {
      return Optional.of(PDF);
    }
    if (normalized.equals("image/jpg") || normalized.equals("image/pjpeg")) {
      return Optional.of(JPEG);
    }
    return Arrays.stream(values()).filter(s -> s.mimeType.equals(normalized)).findFirst();
  }

  /** Signature the content actually starts with, if any. */
  public static Optional<FileSignature> detect(byte[] content) {
    return Arrays.stream(values()).filter(s -> s.matches(content)).findFirst();
  }
}
