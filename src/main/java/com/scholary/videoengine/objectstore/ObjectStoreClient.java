package com.scholary.videoengine.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Object storage used to keep our own copy of stage artifacts.
 *
 * <p>Implementations work against S3 or any S3-compatible service.
 */
public interface ObjectStoreClient {

  /**
   * Open an object for reading. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object is missing or cannot be read
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Upload an object of known length.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);

  /**
   * Time-limited GET URL for an object.
   *
   * @throws ObjectStoreException if the URL cannot be signed
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
