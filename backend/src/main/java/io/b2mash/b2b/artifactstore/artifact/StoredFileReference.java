package io.b2mash.b2b.artifactstore.artifact;

/**
 * File reference as persisted by the owning records (notices, submissions, gallery entries). Every
 * field is optional, and records migrated from the legacy format may still carry stale legacy
 * fields next to a delivery URL.
 *
 * @param deliveryUrl remote store delivery URL (current format)
 * @param storeId remote store object id
 * @param originalName name of the file as uploaded
 * @param size size in bytes, null when unknown
 * @param mimeType declared MIME type
 * @param fileName legacy server file name
 * @param fileId legacy server file id
 * @param dataUri embedded {@code data:} URI (oldest format)
 * @param name fallback display name used by the oldest format
 */
public record StoredFileReference(
    String deliveryUrl,
    String storeId,
    String originalName,
    Long size,
    String mimeType,
    String fileName,
    String fileId,
    String dataUri,
    String name) {

  public static StoredFileReference remote(
      String deliveryUrl, String storeId, String originalName, long size, String mimeType) {
    return new StoredFileReference(
        deliveryUrl, storeId, originalName, size, mimeType, null, null, null, null);
  }

  public static StoredFileReference legacy(String fileName, String fileId) {
    return new StoredFileReference(null, null, null, null, null, fileName, fileId, null, null);
  }

  public static StoredFileReference inline(String dataUri, String name) {
    return new StoredFileReference(null, null, null, null, null, null, null, dataUri, name);
  }
}
