package com.telemetryrollup.job;

import com.telemetryrollup.core.store.ObjectStore;
import com.telemetryrollup.core.store.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ObjectStore} backed by one S3 bucket.
 *
 * <p>
 * Listing follows continuation tokens until the result is no longer
 * truncated. Every SDK failure surfaces as an {@link ObjectStoreException}
 * carrying the key or prefix involved; retries are left to the SDK's own
 * retry policy.
 * </p>
 *
 * @since 1.0.0
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger LOG = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3;
    private final String bucket;

    /**
     * @param s3     client; owned by the caller
     * @param bucket bucket holding readings and rollups
     */
    public S3ObjectStore(S3Client s3, String bucket) {
        this.s3 = Objects.requireNonNull(s3, "s3 client must not be null");
        this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
    }

    @Override
    public List<String> list(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        List<String> keys = new ArrayList<>();
        String token = null;
        int pages = 0;
        try {
            do {
                String continuation = token;
                ListObjectsV2Response page = s3.listObjectsV2(b -> b
                        .bucket(bucket)
                        .prefix(prefix)
                        .continuationToken(continuation));
                for (S3Object object : page.contents()) {
                    keys.add(object.key());
                }
                pages++;
                token = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (token != null);
        } catch (SdkException e) {
            throw new ObjectStoreException(
                    "Failed to list s3://" + bucket + "/" + prefix + ": " + e.getMessage(), prefix, e);
        }
        LOG.debug("Listed {} key(s) under s3://{}/{} in {} page(s)", keys.size(), bucket, prefix, pages);
        return keys;
    }

    @Override
    public byte[] get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        try {
            return s3.getObjectAsBytes(b -> b.bucket(bucket).key(key)).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new ObjectStoreException("Object not found: s3://" + bucket + "/" + key, key, e);
        } catch (SdkException e) {
            throw new ObjectStoreException(
                    "Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), key, e);
        }
    }

    @Override
    public void put(String key, byte[] body, String contentType) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(body, "body must not be null");
        try {
            s3.putObject(b -> b.bucket(bucket).key(key).contentType(contentType), RequestBody.fromBytes(body));
        } catch (SdkException e) {
            throw new ObjectStoreException(
                    "Failed to write s3://" + bucket + "/" + key + ": " + e.getMessage(), key, e);
        }
        LOG.debug("Wrote {} byte(s) to s3://{}/{}", body.length, bucket, key);
    }

    public String getBucket() {
        return bucket;
    }
}
