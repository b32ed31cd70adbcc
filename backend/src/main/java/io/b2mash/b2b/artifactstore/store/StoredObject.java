package io.b2mash.b2b.artifactstore.store;

/**
 * What the store reports back from a put. {@code reportedResourceType} is the store's own value
 * ("raw", "image") and is not guaranteed to match the requested type.
 */
public record StoredObject(
    String storeId, String deliveryUrl, String reportedResourceType, long byteSize) {}
