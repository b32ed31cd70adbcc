package io.b2mash.b2b.artifactstore.delivery;

import io.b2mash.b2b.artifactstore.integrity.ValidationWarning;
import java.net.URI;
import java.util.List;

/**
 * A file presented to the user.
 *
 * @param fileName sanitized name the file was presented under
 * @param mimeType reconciled content type
 * @param size content size in bytes
 * @param location where the host put the file
 * @param warnings integrity warnings raised before delivery
 */
public record DeliveryReceipt(
    String fileName, String mimeType, long size, URI location, List<ValidationWarning> warnings) {}
