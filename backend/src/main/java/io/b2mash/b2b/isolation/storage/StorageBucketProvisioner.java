package io.b2mash.b2b.isolation.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.isolation.audit.AuditEventBuilder;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.config.S3Config.S3Properties;
import io.b2mash.b2b.isolation.exception.ResourceAlreadyExistsException;
import io.b2mash.b2b.isolation.exception.ResourceNotEmptyException;
import io.b2mash.b2b.isolation.exception.ResourceNotFoundException;
import io.b2mash.b2b.isolation.multitenancy.TenantNamespaces;
import io.b2mash.b2b.isolation.provisioning.QuotaPolicy;
import io.b2mash.b2b.isolation.tenant.Plan;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyExistsException;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.BucketVersioningStatus;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.PutBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;
import software.amazon.awssdk.services.s3.model.VersioningConfiguration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/**
 * One bucket per tenant, named by {@link TenantNamespaces#bucketName}. Objects under {@code
 * public/} are world-readable; everything under {@code private/} is reachable only through
 * presigned URLs. All AWS SDK types are confined to this class.
 */
@Service
public class StorageBucketProvisioner {

  private static final Logger log = LoggerFactory.getLogger(StorageBucketProvisioner.class);

  static final String PLAN_TAG = "plan";
  static final List<String> SEED_KEYS = List.of("public/products/.keep", "private/exports/.keep");
  static final int DELETE_BATCH_SIZE = 1000;
  static final long DEFAULT_EXPIRY_SECONDS = 3600;
  static final long MAX_EXPIRY_SECONDS = 604_800;

  private static final String US_EAST_1 = "us-east-1";

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final S3Properties s3Properties;
  private final ObjectMapper objectMapper;
  private final AuditService auditService;

  public StorageBucketProvisioner(
      S3Client s3Client,
      S3Presigner s3Presigner,
      S3Properties s3Properties,
      ObjectMapper objectMapper,
      AuditService auditService) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.s3Properties = s3Properties;
    this.objectMapper = objectMapper;
    this.auditService = auditService;
  }

  /**
   * Creates the tenant bucket and applies {@link #configure(UUID, Plan)} to it. If configuration
   * fails the bucket is left in place; calling {@code configure} again completes it.
   *
   * @throws ResourceAlreadyExistsException if the bucket already exists
   */
  public BucketCreationResult create(UUID tenantId, Plan plan) {
    String bucketName = TenantNamespaces.bucketName(tenantId);
    Plan effectivePlan = plan != null ? plan : Plan.FREE;
    long start = System.nanoTime();

    if (bucketExists(bucketName)) {
      throw new ResourceAlreadyExistsException("Bucket", bucketName);
    }
    try {
      s3Client.createBucket(createBucketRequest(bucketName));
    } catch (BucketAlreadyOwnedByYouException | BucketAlreadyExistsException e) {
      throw new ResourceAlreadyExistsException("Bucket", bucketName, e);
    }

    applyConfiguration(bucketName, effectivePlan);

    long durationMs = (System.nanoTime() - start) / 1_000_000;
    long quotaBytes = QuotaPolicy.storageQuotaBytes(effectivePlan);
    log.info(
        "Created bucket {} for tenant {} on plan {} in {} ms",
        bucketName,
        tenantId,
        effectivePlan,
        durationMs);
    auditService.log(
        AuditEventBuilder.builder()
            .action("bucket.created")
            .entityType("bucket")
            .entityId(bucketName)
            .tenantId(tenantId)
            .details(Map.of("plan", effectivePlan.slug(), "quotaBytes", quotaBytes))
            .build());
    return new BucketCreationResult(bucketName, quotaBytes, endpoint(), Instant.now(), durationMs);
  }

  /**
   * Brings an existing tenant bucket to its provisioned state: versioning on, public-read policy
   * on {@code public/*}, the {@code plan} tag and the seed folders. Every call is a full overwrite,
   * so it can be repeated on a bucket whose creation stopped part way.
   *
   * @throws ResourceNotFoundException if the bucket does not exist
   */
  public void configure(UUID tenantId, Plan plan) {
    String bucketName = TenantNamespaces.bucketName(tenantId);
    if (!bucketExists(bucketName)) {
      throw new ResourceNotFoundException("Bucket", bucketName);
    }
    Plan effectivePlan = plan != null ? plan : Plan.FREE;
    applyConfiguration(bucketName, effectivePlan);
    log.info("Configured bucket {} for tenant {} on plan {}", bucketName, tenantId, effectivePlan);
  }

  public boolean exists(UUID tenantId) {
    return bucketExists(TenantNamespaces.bucketName(tenantId));
  }

  /**
   * Deletes the tenant bucket.
   *
   * @param force remove every object version and delete marker first
   * @return false if there was no bucket to delete
   * @throws ResourceNotEmptyException if the bucket holds anything and {@code force} is false
   */
  public boolean delete(UUID tenantId, boolean force) {
    String bucketName = TenantNamespaces.bucketName(tenantId);
    if (!bucketExists(bucketName)) {
      log.info("Bucket {} does not exist, nothing to delete", bucketName);
      return false;
    }

    int removed = 0;
    if (force) {
      removed = purgeAllVersions(bucketName);
    } else if (hasAnyVersion(bucketName)) {
      throw new ResourceNotEmptyException(
          "Bucket", bucketName, "Bucket still contains objects; delete with force to purge them");
    }

    s3Client.deleteBucket(DeleteBucketRequest.builder().bucket(bucketName).build());
    log.info("Deleted bucket {} ({} versions purged)", bucketName, removed);
    auditService.log(
        AuditEventBuilder.builder()
            .action("bucket.deleted")
            .entityType("bucket")
            .entityId(bucketName)
            .tenantId(tenantId)
            .details(Map.of("force", force, "purgedVersions", removed))
            .build());
    return true;
  }

  /**
   * Sums the current objects in the tenant bucket. The quota comes from the bucket's {@code plan}
   * tag; an unreadable or missing tag falls back to the FREE quota.
   *
   * @throws ResourceNotFoundException if the bucket does not exist
   */
  public BucketStats getStats(UUID tenantId) {
    String bucketName = TenantNamespaces.bucketName(tenantId);
    if (!bucketExists(bucketName)) {
      throw new ResourceNotFoundException("Bucket", bucketName);
    }

    long usedBytes = 0;
    long totalObjects = 0;
    Instant lastModified = null;
    String continuationToken = null;
    do {
      ListObjectsV2Response page =
          s3Client.listObjectsV2(
              ListObjectsV2Request.builder()
                  .bucket(bucketName)
                  .continuationToken(continuationToken)
                  .build());
      for (S3Object object : page.contents()) {
        usedBytes += object.size() != null ? object.size() : 0;
        totalObjects++;
        if (object.lastModified() != null
            && (lastModified == null || object.lastModified().isAfter(lastModified))) {
          lastModified = object.lastModified();
        }
      }
      continuationToken =
          Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
    } while (continuationToken != null);

    long quotaBytes = QuotaPolicy.storageQuotaBytes(planFromTag(bucketName));
    double usagePercent = quotaBytes > 0 ? (usedBytes * 100.0) / quotaBytes : 0;
    return new BucketStats(usedBytes, totalObjects, quotaBytes, usagePercent, lastModified);
  }

  public PresignedUrl getSignedUploadUrl(UUID tenantId, String key) {
    return getSignedUploadUrl(tenantId, key, DEFAULT_EXPIRY_SECONDS);
  }

  /** Presigned PUT for a single key under {@code public/} or {@code private/}. */
  public PresignedUrl getSignedUploadUrl(UUID tenantId, String key, long expirySeconds) {
    validateKey(key);
    Duration expiry = validateExpiry(expirySeconds);
    var putRequest =
        PutObjectRequest.builder().bucket(TenantNamespaces.bucketName(tenantId)).key(key).build();
    var presigned =
        s3Presigner.presignPutObject(
            PutObjectPresignRequest.builder()
                .signatureDuration(expiry)
                .putObjectRequest(putRequest)
                .build());
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  public PresignedUrl getSignedDownloadUrl(UUID tenantId, String key) {
    return getSignedDownloadUrl(tenantId, key, DEFAULT_EXPIRY_SECONDS);
  }

  /** Presigned GET for a single key under {@code public/} or {@code private/}. */
  public PresignedUrl getSignedDownloadUrl(UUID tenantId, String key, long expirySeconds) {
    validateKey(key);
    Duration expiry = validateExpiry(expirySeconds);
    var getRequest =
        GetObjectRequest.builder().bucket(TenantNamespaces.bucketName(tenantId)).key(key).build();
    var presigned =
        s3Presigner.presignGetObject(
            GetObjectPresignRequest.builder()
                .signatureDuration(expiry)
                .getObjectRequest(getRequest)
                .build());
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  /** Best effort: failures are logged and reported as false. */
  public boolean deleteObject(UUID tenantId, String key) {
    try {
      validateKey(key);
      s3Client.deleteObject(
          DeleteObjectRequest.builder()
              .bucket(TenantNamespaces.bucketName(tenantId))
              .key(key)
              .build());
      return true;
    } catch (SdkException | IllegalArgumentException e) {
      log.warn(
          "Best-effort deletion failed for tenant {} key={}: {}", tenantId, key, e.getMessage());
      return false;
    }
  }

  private void applyConfiguration(String bucketName, Plan plan) {
    s3Client.putBucketVersioning(
        PutBucketVersioningRequest.builder()
            .bucket(bucketName)
            .versioningConfiguration(
                VersioningConfiguration.builder().status(BucketVersioningStatus.ENABLED).build())
            .build());
    s3Client.putBucketPolicy(
        PutBucketPolicyRequest.builder()
            .bucket(bucketName)
            .policy(publicReadPolicy(bucketName))
            .build());
    s3Client.putBucketTagging(
        PutBucketTaggingRequest.builder()
            .bucket(bucketName)
            .tagging(
                Tagging.builder()
                    .tagSet(Tag.builder().key(PLAN_TAG).value(plan.slug()).build())
                    .build())
            .build());
    for (String key : SEED_KEYS) {
      s3Client.putObject(
          PutObjectRequest.builder().bucket(bucketName).key(key).build(), RequestBody.empty());
    }
  }

  private boolean bucketExists(String bucketName) {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
      return true;
    } catch (NoSuchBucketException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw e;
    }
  }

  private CreateBucketRequest createBucketRequest(String bucketName) {
    var builder = CreateBucketRequest.builder().bucket(bucketName);
    String region = s3Properties.region();
    if (region != null && !US_EAST_1.equals(region)) {
      builder.createBucketConfiguration(
          CreateBucketConfiguration.builder().locationConstraint(region).build());
    }
    return builder.build();
  }

  private boolean hasAnyVersion(String bucketName) {
    var page =
        s3Client.listObjectVersions(
            ListObjectVersionsRequest.builder().bucket(bucketName).maxKeys(1).build());
    return !page.versions().isEmpty() || !page.deleteMarkers().isEmpty();
  }

  /** Deletes every version and delete marker, at most {@value #DELETE_BATCH_SIZE} per request. */
  private int purgeAllVersions(String bucketName) {
    int removed = 0;
    String keyMarker = null;
    String versionIdMarker = null;
    boolean truncated;
    do {
      ListObjectVersionsResponse page =
          s3Client.listObjectVersions(
              ListObjectVersionsRequest.builder()
                  .bucket(bucketName)
                  .keyMarker(keyMarker)
                  .versionIdMarker(versionIdMarker)
                  .build());
      var identifiers = new ArrayList<ObjectIdentifier>();
      page.versions()
          .forEach(
              v ->
                  identifiers.add(
                      ObjectIdentifier.builder().key(v.key()).versionId(v.versionId()).build()));
      page.deleteMarkers()
          .forEach(
              m ->
                  identifiers.add(
                      ObjectIdentifier.builder().key(m.key()).versionId(m.versionId()).build()));
      for (int from = 0; from < identifiers.size(); from += DELETE_BATCH_SIZE) {
        int to = Math.min(from + DELETE_BATCH_SIZE, identifiers.size());
        var batch = identifiers.subList(from, to);
        s3Client.deleteObjects(
            DeleteObjectsRequest.builder()
                .bucket(bucketName)
                .delete(Delete.builder().objects(batch).quiet(true).build())
                .build());
        removed += batch.size();
      }
      truncated = Boolean.TRUE.equals(page.isTruncated());
      keyMarker = page.nextKeyMarker();
      versionIdMarker = page.nextVersionIdMarker();
    } while (truncated);
    return removed;
  }

  private Plan planFromTag(String bucketName) {
    try {
      var tagging =
          s3Client.getBucketTagging(GetBucketTaggingRequest.builder().bucket(bucketName).build());
      return tagging.tagSet().stream()
          .filter(tag -> PLAN_TAG.equals(tag.key()))
          .findFirst()
          .flatMap(tag -> Plan.fromSlug(tag.value()))
          .orElse(Plan.FREE);
    } catch (SdkException e) {
      log.warn(
          "Could not read plan tag of bucket {}, using FREE quota: {}",
          bucketName,
          e.getMessage());
      return Plan.FREE;
    }
  }

  private String publicReadPolicy(String bucketName) {
    var statement = new LinkedHashMap<String, Object>();
    statement.put("Effect", "Allow");
    statement.put("Principal", Map.of("AWS", List.of("*")));
    statement.put("Action", List.of("s3:GetObject"));
    statement.put("Resource", List.of("arn:aws:s3:::" + bucketName + "/public/*"));
    var policy = new LinkedHashMap<String, Object>();
    policy.put("Version", "2012-10-17");
    policy.put("Statement", List.of(statement));
    try {
      return objectMapper.writeValueAsString(policy);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize bucket policy for " + bucketName, e);
    }
  }

  private String endpoint() {
    String endpoint = s3Properties.endpoint();
    if (endpoint != null && !endpoint.isBlank()) {
      return endpoint;
    }
    return "https://s3." + s3Properties.region() + ".amazonaws.com";
  }

  static void validateKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Object key must not be blank");
    }
    if (!key.startsWith("public/") && !key.startsWith("private/")) {
      throw new IllegalArgumentException("Object key must live under public/ or private/");
    }
    for (String segment : key.split("/")) {
      if (segment.equals("..")) {
        throw new IllegalArgumentException("Object key must not contain '..' segments");
      }
    }
  }

  private static Duration validateExpiry(long expirySeconds) {
    if (expirySeconds < 1 || expirySeconds > MAX_EXPIRY_SECONDS) {
      throw new IllegalArgumentException(
          "Expiry must be between 1 and " + MAX_EXPIRY_SECONDS + " seconds");
    }
    return Duration.ofSeconds(expirySeconds);
  }
}
