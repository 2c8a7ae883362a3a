package com.scholary.videoengine.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * AWS SDK v2 implementation of {@link ObjectStoreClient}.
 *
 * <p>Works with S3 and with MinIO or DigitalOcean Spaces through an endpoint override and
 * path-style access. The SDK retries transient failures itself; anything that still fails is
 * wrapped in {@link ObjectStoreException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    StaticCredentialsProvider credentials =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));
    Region region =
        properties.region() == null || properties.region().isBlank()
            ? Region.US_EAST_1
            : Region.of(properties.region());
    URI endpoint = URI.create(properties.endpoint());

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentials)
            .endpointOverride(endpoint)
            .forcePathStyle(properties.pathStyleAccess())
            .build();
    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentials)
            .endpointOverride(endpoint)
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);
    try {
      return s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (NoSuchKeyException e) {
      throw new ObjectStoreException(
          String.format("Object not found: bucket=%s, key=%s", bucket, key), e);
    } catch (SdkException e) {
      throw new ObjectStoreException(
          String.format("Failed to retrieve object: bucket=%s, key=%s", bucket, key), e);
    }
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build(),
          RequestBody.fromInputStream(data, contentLength));
      LOGGER.info("Uploaded object: bucket={}, key={}, bytes={}", bucket, key, contentLength);
    } catch (SdkException e) {
      throw new ObjectStoreException(
          String.format("Failed to upload object: bucket=%s, key=%s", bucket, key), e);
    }
  }

  @Override
  public void deleteObject(String bucket, String key) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);
    } catch (SdkException e) {
      throw new ObjectStoreException(
          String.format("Failed to delete object: bucket=%s, key=%s", bucket, key), e);
    }
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    try {
      GetObjectPresignRequest request =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
              .build();
      return s3Presigner.presignGetObject(request).url();
    } catch (SdkException e) {
      throw new ObjectStoreException(
          String.format("Failed to presign: bucket=%s, key=%s", bucket, key), e);
    }
  }

  @Override
  public void close() {
    LOGGER.info("Closing S3 client and presigner");
    s3Client.close();
    s3Presigner.close();
  }
}
