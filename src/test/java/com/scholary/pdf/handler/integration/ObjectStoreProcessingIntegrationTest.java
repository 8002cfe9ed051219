package com.scholary.pdf.handler.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.pdf.handler.processor.TestPdfs;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * End-to-end test of the object-store endpoints against MinIO.
 *
 * <p>Uses Testcontainers to start MinIO and is skipped when Docker is not available.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class ObjectStoreProcessingIntegrationTest {

  private static final String MINIO_ACCESS_KEY = "minioadmin";
  private static final String MINIO_SECRET_KEY = "minioadmin";
  private static final String TEST_BUCKET = "documents-test";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", MINIO_ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", MINIO_SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  @Autowired private TestRestTemplate restTemplate;

  private static S3Client s3Client;

  private static String minioEndpoint() {
    return String.format(
        "http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));
  }

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add("objectstore.enabled", () -> "true");
    registry.add("objectstore.endpoint", ObjectStoreProcessingIntegrationTest::minioEndpoint);
    registry.add("objectstore.accessKey", () -> MINIO_ACCESS_KEY);
    registry.add("objectstore.secretKey", () -> MINIO_SECRET_KEY);
    registry.add("objectstore.bucket", () -> TEST_BUCKET);
    registry.add("objectstore.pathStyleAccess", () -> "true");
  }

  @BeforeAll
  static void setUp() {
    s3Client =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(MINIO_ACCESS_KEY, MINIO_SECRET_KEY)))
            .endpointOverride(URI.create(minioEndpoint()))
            .forcePathStyle(true)
            .build();

    s3Client.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
    put("single/report.pdf", TestPdfs.withPages("Stored report"));
    put("batch/one.pdf", TestPdfs.withPages("Batch one"));
    put("batch/two.pdf", TestPdfs.withPages("Batch two"));
    put("batch/broken.pdf", "not really a pdf".getBytes(StandardCharsets.UTF_8));
    put("batch/readme.txt", "ignored".getBytes(StandardCharsets.UTF_8));
  }

  private static void put(String key, byte[] content) {
    s3Client.putObject(
        PutObjectRequest.builder().bucket(TEST_BUCKET).key(key).build(),
        RequestBody.fromBytes(content));
  }

  @Test
  void processObject_shouldProcessStoredDocument() {
    ResponseEntity<byte[]> response =
        restTemplate.postForEntity(
            "/api/process-object", Map.of("key", "single/report.pdf"), byte[].class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(new String(response.getBody(), StandardCharsets.UTF_8)).contains("Stored report");
    assertThat(response.getHeaders().getContentDisposition().getFilename())
        .isEqualTo("report.txt");
  }

  @Test
  void processObject_shouldReportMissingObjectAsTransportFailure() {
    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity(
            "/api/process-object",
            Map.of("bucket", TEST_BUCKET, "key", "single/missing.pdf"),
            JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody().get("category").asText()).isEqualTo("TRANSPORT_FAILURE");
  }

  @Test
  void processFolder_shouldProcessEveryPdfAndWriteArtifacts() {
    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity(
            "/api/process-folder",
            Map.of("prefix", "batch/", "outputPrefix", "processed/"),
            JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode body = response.getBody();
    assertThat(body.get("totalFiles").asInt()).isEqualTo(3);
    assertThat(body.get("successful").asInt()).isEqualTo(2);
    assertThat(body.get("failed").asInt()).isEqualTo(1);

    String written =
        s3Client
            .getObjectAsBytes(
                GetObjectRequest.builder().bucket(TEST_BUCKET).key("processed/one.txt").build())
            .asUtf8String();
    assertThat(written).contains("Batch one");
  }
}
