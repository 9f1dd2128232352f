package com.nevis.dossier.storage;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Object storage holding the uploaded case documents.
 *
 * @see com.nevis.dossier.exception.BlobNotFoundException
 * @see com.nevis.dossier.exception.BlobStoreUnavailableException
 */
public interface BlobStore {

    String put(String key, byte[] content, String contentType, Map<String, String> metadata);

    byte[] get(String key);

    boolean delete(String key);

    List<String> list(String prefix);

    String sign(String key, Duration ttl);
}
