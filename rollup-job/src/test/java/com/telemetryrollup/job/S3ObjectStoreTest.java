package com.telemetryrollup.job;

import com.telemetryrollup.core.store.ObjectStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link S3ObjectStore} against a mocked {@link S3Client}.
 */
@ExtendWith(MockitoExtension.class)
class S3ObjectStoreTest {

    private static final String BUCKET = "telemetry";
    private static final String PREFIX = "sensor-data/2026/02/09/hour=13/";

    @Mock
    S3Client s3;

    @Captor
    ArgumentCaptor<Consumer<PutObjectRequest.Builder>> putCaptor;

    @Captor
    ArgumentCaptor<RequestBody> bodyCaptor;

    private S3ObjectStore store;

    @BeforeEach
    void setUp() {
        store = new S3ObjectStore(s3, BUCKET);
    }

    @Test
    @DisplayName("list follows continuation tokens across pages")
    void listPaginates() {
        List<ListObjectsV2Request> requests = new ArrayList<>();
        when(s3.listObjectsV2(ArgumentMatchers.<Consumer<ListObjectsV2Request.Builder>>any()))
                .thenAnswer(invocation -> {
                    ListObjectsV2Request request = build(invocation.getArgument(0));
                    requests.add(request);
                    if (request.continuationToken() == null) {
                        return page(true, "page-2", PREFIX + "a.json", PREFIX + "b.json");
                    }
                    return page(false, null, PREFIX + "c.json");
                });

        List<String> keys = store.list(PREFIX);

        assertThat(keys).containsExactly(PREFIX + "a.json", PREFIX + "b.json", PREFIX + "c.json");
        assertThat(requests).hasSize(2);
        assertThat(requests).allSatisfy(request -> {
            assertThat(request.bucket()).isEqualTo(BUCKET);
            assertThat(request.prefix()).isEqualTo(PREFIX);
        });
        assertThat(requests.get(1).continuationToken()).isEqualTo("page-2");
    }

    @Test
    @DisplayName("a listing SDK failure becomes an ObjectStoreException for the prefix")
    void listFailure() {
        when(s3.listObjectsV2(ArgumentMatchers.<Consumer<ListObjectsV2Request.Builder>>any()))
                .thenThrow(SdkClientException.create("connection reset"));

        assertThatThrownBy(() -> store.list(PREFIX))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("connection reset")
                .extracting(e -> ((ObjectStoreException) e).getKey())
                .isEqualTo(PREFIX);
    }

    @Test
    @DisplayName("get returns the object bytes of the requested key")
    void getReturnsBytes() {
        byte[] body = "{\"sensor_id\":\"temp_001\"}".getBytes(StandardCharsets.UTF_8);
        List<GetObjectRequest> requests = new ArrayList<>();
        when(s3.getObjectAsBytes(ArgumentMatchers.<Consumer<GetObjectRequest.Builder>>any()))
                .thenAnswer(invocation -> {
                    Consumer<GetObjectRequest.Builder> consumer = invocation.getArgument(0);
                    GetObjectRequest.Builder builder = GetObjectRequest.builder();
                    consumer.accept(builder);
                    requests.add(builder.build());
                    return ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), body);
                });

        assertThat(store.get(PREFIX + "a.json")).isEqualTo(body);
        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.bucket()).isEqualTo(BUCKET);
            assertThat(request.key()).isEqualTo(PREFIX + "a.json");
        });
    }

    @Test
    @DisplayName("a missing key is reported as not found")
    void getMissing() {
        when(s3.getObjectAsBytes(ArgumentMatchers.<Consumer<GetObjectRequest.Builder>>any()))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> store.get(PREFIX + "gone.json"))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("not found")
                .hasCauseInstanceOf(NoSuchKeyException.class);
    }

    @Test
    @DisplayName("put sends bucket, key, content type and body")
    void putSendsObject() throws Exception {
        byte[] body = "{\"aggregations\":[]}".getBytes(StandardCharsets.UTF_8);

        store.put("aggregated-data/r.json", body, "application/json");

        verify(s3, times(1)).putObject(putCaptor.capture(), bodyCaptor.capture());
        PutObjectRequest.Builder builder = PutObjectRequest.builder();
        putCaptor.getValue().accept(builder);
        PutObjectRequest request = builder.build();
        assertThat(request.bucket()).isEqualTo(BUCKET);
        assertThat(request.key()).isEqualTo("aggregated-data/r.json");
        assertThat(request.contentType()).isEqualTo("application/json");
        try (InputStream in = bodyCaptor.getValue().contentStreamProvider().newStream()) {
            assertThat(in.readAllBytes()).isEqualTo(body);
        }
    }

    @Test
    @DisplayName("a rejected put propagates as ObjectStoreException")
    void putFailure() {
        when(s3.putObject(ArgumentMatchers.<Consumer<PutObjectRequest.Builder>>any(), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("access denied"));
        byte[] body = new byte[] {'{', '}'};

        assertThatThrownBy(() -> store.put("aggregated-data/r.json", body, "application/json"))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("access denied");
    }

    private static ListObjectsV2Request build(Consumer<ListObjectsV2Request.Builder> consumer) {
        ListObjectsV2Request.Builder builder = ListObjectsV2Request.builder();
        consumer.accept(builder);
        return builder.build();
    }

    private static ListObjectsV2Response page(boolean truncated, String nextToken, String... keys) {
        List<S3Object> contents = new ArrayList<>();
        for (String key : keys) {
            contents.add(S3Object.builder().key(key).build());
        }
        return ListObjectsV2Response.builder()
                .contents(contents)
                .isTruncated(truncated)
                .nextContinuationToken(nextToken)
                .build();
    }
}
