package com.jobmatch.matcher.service.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.exception.StorageException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/** Object store backed by a single S3 bucket. */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "matcher.storage.type", havingValue = "s3")
public class S3ObjectStorage implements ObjectStorage {

  private final S3Client s3Client;
  private final MatcherProperties properties;

  private String bucket;

  @PostConstruct
  public void init() {
    bucket = properties.getStorage().getBucket();
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException("matcher.storage.bucket must be set for S3 storage");
    }
    log.info("S3 object storage using bucket {}", bucket);
  }

  @Override
  public byte[] get(String key) {
    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      return s3Client.getObjectAsBytes(request).asByteArray();
    } catch (NoSuchKeyException e) {
      throw new ResourceNotFoundException("Object not found: " + key);
    } catch (Exception e) {
      log.error("Failed to read s3://{}/{}", bucket, key, e);
      throw new StorageException("Failed to read " + key, e);
    }
  }

  @Override
  public void put(String key, byte[] content) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder().bucket(bucket).key(key).build(),
          RequestBody.fromBytes(content));
      log.debug("Wrote s3://{}/{} ({} bytes)", bucket, key, content.length);
    } catch (Exception e) {
      log.error("Failed to write s3://{}/{}", bucket, key, e);
      throw new StorageException("Failed to write " + key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (Exception e) {
      log.error("Failed to delete s3://{}/{}", bucket, key, e);
      throw new StorageException("Failed to delete " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw new StorageException("Failed to check " + key, e);
    }
  }

  @Override
  public List<String> list(String prefix) {
    List<String> keys = new ArrayList<>();
    try {
      String continuationToken = null;
      do {
        ListObjectsV2Request.Builder requestBuilder =
            ListObjectsV2Request.builder().bucket(bucket).prefix(prefix);
        if (continuationToken != null) {
          requestBuilder.continuationToken(continuationToken);
        }
        ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
        for (S3Object object : response.contents()) {
          keys.add(object.key());
        }
        continuationToken = response.nextContinuationToken();
      } while (continuationToken != null);
    } catch (Exception e) {
      log.error("Failed to list s3://{}/{}", bucket, prefix, e);
      throw new StorageException("Failed to list " + prefix, e);
    }
    Collections.sort(keys);
    return keys;
  }

  @Override
  public void copy(String sourceKey, String targetKey) {
    try {
      s3Client.copyObject(
          CopyObjectRequest.builder()
              .sourceBucket(bucket)
              .sourceKey(sourceKey)
              .destinationBucket(bucket)
              .destinationKey(targetKey)
              .build());
    } catch (NoSuchKeyException e) {
      throw new ResourceNotFoundException("Object not found: " + sourceKey);
    } catch (Exception e) {
      log.error("Failed to copy s3://{}/{} to {}", bucket, sourceKey, targetKey, e);
      throw new StorageException("Failed to copy " + sourceKey, e);
    }
  }
}
