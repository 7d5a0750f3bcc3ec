package com.truetickets.tickets.blob;

/**
 * Somewhere to keep uploaded files that the browser can fetch by url.
 */
public interface BlobStore {

  /**
   * Store the bytes under the key.
   *
   * @param key         the key
   * @param bytes       the bytes
   * @param contentType the content type
   * @return the public url of the stored object
   */
  String put(String key, byte[] bytes, String contentType);

}
