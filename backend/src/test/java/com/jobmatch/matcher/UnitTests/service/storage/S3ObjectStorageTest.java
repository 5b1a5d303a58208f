package com.jobmatch.matcher.UnitTests.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.exception.StorageException;
import com.jobmatch.matcher.service.storage.S3ObjectStorage;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3ObjectStorage Tests")
class S3ObjectStorageTest {

  private static final String BUCKET = "job-matcher-artifacts";

  @Mock private S3Client s3Client;

  private S3ObjectStorage storage;

  @BeforeEach
  void setUp() {
    MatcherProperties properties = new MatcherProperties();
    properties.getStorage().setType("s3");
    properties.getStorage().setBucket(BUCKET);
    storage = new S3ObjectStorage(s3Client, properties);
    storage.init();
  }

  @Test
  @DisplayName("Should refuse to start without a bucket")
  void shouldRequireBucket() {
    MatcherProperties properties = new MatcherProperties();
    S3ObjectStorage unconfigured = new S3ObjectStorage(s3Client, properties);

    assertThatThrownBy(unconfigured::init)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("matcher.storage.bucket");
  }

  @Nested
  @DisplayName("Reads")
  class ReadTests {

    @Test
    @DisplayName("Should read object bytes from the configured bucket")
    void shouldReadObject() {
      byte[] content = "centroids".getBytes(StandardCharsets.UTF_8);
      when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
          .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

      assertThat(storage.get("linkedin/france/centroids.bin")).isEqualTo(content);

      ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
      verify(s3Client).getObjectAsBytes(captor.capture());
      assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
      assertThat(captor.getValue().key()).isEqualTo("linkedin/france/centroids.bin");
    }

    @Test
    @DisplayName("Should map a missing key to not found")
    void shouldMapMissingKey() {
      when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
          .thenThrow(NoSuchKeyException.builder().message("missing").build());

      assertThatThrownBy(() -> storage.get("linkedin/france/labels.bin"))
          .isInstanceOf(ResourceNotFoundException.class)
          .hasMessageContaining("linkedin/france/labels.bin");
    }

    @Test
    @DisplayName("Should wrap other failures as storage errors")
    void shouldWrapFailures() {
      when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
          .thenThrow(S3Exception.builder().statusCode(500).message("boom").build());

      assertThatThrownBy(() -> storage.get("linkedin/france/labels.bin"))
          .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Should treat a 404 head response as absent")
    void shouldReportAbsentOnNotFound() {
      when(s3Client.headObject(any(HeadObjectRequest.class)))
          .thenThrow(S3Exception.builder().statusCode(404).message("not found").build());

      assertThat(storage.exists("temp/linkedin/france/manifest.json")).isFalse();
    }

    @Test
    @DisplayName("Should report an existing key")
    void shouldReportPresent() {
      when(s3Client.headObject(any(HeadObjectRequest.class)))
          .thenReturn(HeadObjectResponse.builder().build());

      assertThat(storage.exists("linkedin/france/manifest.json")).isTrue();
    }
  }

  @Nested
  @DisplayName("Listing")
  class ListTests {

    @Test
    @DisplayName("Should follow continuation tokens and sort keys")
    void shouldFollowPages() {
      when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
          .thenReturn(
              ListObjectsV2Response.builder()
                  .contents(S3Object.builder().key("temp/linkedin/france/labels.bin").build())
                  .nextContinuationToken("page-2")
                  .build(),
              ListObjectsV2Response.builder()
                  .contents(S3Object.builder().key("temp/linkedin/france/centroids.bin").build())
                  .build());

      assertThat(storage.list("temp/linkedin/france/"))
          .containsExactly("temp/linkedin/france/centroids.bin", "temp/linkedin/france/labels.bin");
    }
  }

  @Nested
  @DisplayName("Writes")
  class WriteTests {

    @Test
    @DisplayName("Should put objects under the given key")
    void shouldPutObject() {
      storage.put("temp/linkedin/france/manifest.json", new byte[] {1, 2});

      ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
      verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
      assertThat(captor.getValue().key()).isEqualTo("temp/linkedin/france/manifest.json");
    }

    @Test
    @DisplayName("Should copy within the bucket")
    void shouldCopyWithinBucket() {
      storage.copy("temp/linkedin/france/knn_model.json", "linkedin/france/knn_model.json");

      ArgumentCaptor<CopyObjectRequest> captor = ArgumentCaptor.forClass(CopyObjectRequest.class);
      verify(s3Client).copyObject(captor.capture());
      assertThat(captor.getValue().sourceBucket()).isEqualTo(BUCKET);
      assertThat(captor.getValue().destinationBucket()).isEqualTo(BUCKET);
      assertThat(captor.getValue().destinationKey()).isEqualTo("linkedin/france/knn_model.json");
    }
  }
}
