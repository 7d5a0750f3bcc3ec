package com.truetickets.tickets.blob;

import com.truetickets.server.exception.InternalException;
import com.truetickets.server.exception.ThrottledException;
import com.truetickets.tickets.model.AttachmentsConfiguration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Blob store backed by a public read S3 bucket.
 */
@Singleton
public class S3BlobStore implements BlobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3BlobStore.class);

  private final S3Client s3Client;
  private final String bucket;

  /**
   * Instantiates a new S3 blob store.
   *
   * @param s3Client      the s3 client
   * @param configuration the configuration
   */
  @Inject
  public S3BlobStore(final S3Client s3Client,
                     final AttachmentsConfiguration configuration) {
    LOGGER.info("S3BlobStore({})", configuration.bucket());
    this.s3Client = s3Client;
    this.bucket = configuration.bucket();
  }

  @Override
  public String put(final String key, final byte[] bytes, final String contentType) {
    LOGGER.trace("put({},{})", key, bytes.length);
    final PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(contentType)
        .build();
    try {
      s3Client.putObject(request, RequestBody.fromBytes(bytes));
    } catch (SdkClientException e) {
      throw new ThrottledException("Service Busy", "Could not reach the attachment store.", e);
    } catch (S3Exception e) {
      LOGGER.error("put({}): {}", key, e.getMessage());
      throw new InternalException("Upload Error", "Could not store the attachment.", e);
    }
    return url(key);
  }

  /**
   * Public url of the key.
   *
   * @param key the key
   * @return the string
   */
  public String url(final String key) {
    return "https://" + bucket + ".s3.amazonaws.com/" + key;
  }

}
