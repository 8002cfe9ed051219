package com.scholary.pdf.handler.objectstore;

import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>Documents can be read from an object store instead of being uploaded, and batch artifacts can
 * be written back. Keeping this behind an interface lets the processing service be tested with a
 * mock.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve a whole object into memory.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] getObjectBytes(String bucket, String key);

  /**
   * Store an object.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);

  /**
   * List the keys under a prefix, following pagination.
   *
   * @param prefix key prefix, empty for the whole bucket
   * @throws ObjectStoreException if listing fails
   */
  List<String> listObjectKeys(String bucket, String prefix);
}
