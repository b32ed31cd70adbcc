package io.b2mash.b2b.artifactstore.classify;

import java.util.Objects;

/** Delivery transforms the store applies to images. Never valid for documents. */
public record ImageTransformOptions(String quality, String fetchFormat) {

  public ImageTransformOptions {
    Objects.requireNonNull(quality, "quality");
    Objects.requireNonNull(fetchFormat, "fetchFormat");
  }

  /** Transform directive recorded with the stored object, e.g. {@code q_auto,f_auto}. */
  public String directive() {
    return "q_" + quality + ",f_" + fetchFormat;
  }
}
