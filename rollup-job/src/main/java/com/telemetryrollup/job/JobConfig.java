package com.telemetryrollup.job;

import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration of one rollup job invocation.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven by a scheduler's container definition, Docker {@code -e}
 * flags or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    /** Backing store of readings and rollups. */
    public enum StoreType {
        S3, FILESYSTEM;

        static StoreType parse(String value) {
            try {
                return valueOf(value.strip().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "STORE_TYPE must be one of s3, filesystem; got: " + value, e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Store
    // ---------------------------------------------------------------
    private final StoreType storeType;
    private final String s3Bucket;
    private final String awsRegion;
    private final Path storeRoot;

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------
    private final String rollupConfigPath;

    // ---------------------------------------------------------------
    // Window (both or neither)
    // ---------------------------------------------------------------
    private final Instant windowStart;
    private final Instant windowEnd;

    private JobConfig(Builder b) {
        this.storeType = b.storeType;
        this.s3Bucket = b.s3Bucket;
        this.awsRegion = b.awsRegion;
        this.storeRoot = b.storeRoot;
        this.rollupConfigPath = b.rollupConfigPath;
        this.windowStart = b.windowStart;
        this.windowEnd = b.windowEnd;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is malformed or inconsistent
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static JobConfig fromEnvironment(UnaryOperator<String> env) {
        return new Builder()
                .storeType(StoreType.parse(value(env, "STORE_TYPE", "filesystem")))
                .s3Bucket(value(env, "S3_BUCKET", ""))
                .awsRegion(value(env, "AWS_REGION", "us-east-1"))
                .storeRoot(Path.of(value(env, "STORE_ROOT", "./data")))
                .rollupConfigPath(value(env, "ROLLUP_CONFIG_PATH", ""))
                .windowStart(parseInstant("WINDOW_START", value(env, "WINDOW_START", "")))
                .windowEnd(parseInstant("WINDOW_END", value(env, "WINDOW_END", "")))
                .build();
    }

    /**
     * Copy of this configuration with the window replaced by command-line
     * arguments.
     *
     * @param args {@code []} to keep the configured window, or
     *             {@code [start, end]} as ISO-8601 instants
     * @return the resulting configuration
     * @throws IllegalArgumentException if {@code args} has another length or
     *                                  cannot be parsed
     */
    public JobConfig withArgs(String[] args) {
        Objects.requireNonNull(args, "args must not be null");
        if (args.length == 0) {
            return this;
        }
        if (args.length != 2) {
            throw new IllegalArgumentException(
                    "Usage: RollupJob [<start> <end>] (ISO-8601 instants), got " + args.length + " argument(s)");
        }
        return toBuilder()
                .windowStart(parseInstant("start", args[0]))
                .windowEnd(parseInstant("end", args[1]))
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .storeType(storeType)
                .s3Bucket(s3Bucket)
                .awsRegion(awsRegion)
                .storeRoot(storeRoot)
                .rollupConfigPath(rollupConfigPath)
                .windowStart(windowStart)
                .windowEnd(windowEnd);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public StoreType getStoreType() {
        return storeType;
    }

    public String getS3Bucket() {
        return s3Bucket;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public Path getStoreRoot() {
        return storeRoot;
    }

    public String getRollupConfigPath() {
        return rollupConfigPath;
    }

    /** @return explicit window start, or {@code null} for the default window */
    public Instant getWindowStart() {
        return windowStart;
    }

    /** @return explicit window end, or {@code null} for the default window */
    public Instant getWindowEnd() {
        return windowEnd;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that an S3 store names a bucket
     * and region, and that the window bounds are given together and in order.
     * </p>
     */
    public static class Builder {
        private StoreType storeType = StoreType.FILESYSTEM;
        private String s3Bucket = "";
        private String awsRegion = "us-east-1";
        private Path storeRoot = Path.of("./data");
        private String rollupConfigPath = "";
        private Instant windowStart;
        private Instant windowEnd;

        public Builder storeType(StoreType v) {
            this.storeType = v;
            return this;
        }

        public Builder s3Bucket(String v) {
            this.s3Bucket = v;
            return this;
        }

        public Builder awsRegion(String v) {
            this.awsRegion = v;
            return this;
        }

        public Builder storeRoot(Path v) {
            this.storeRoot = v;
            return this;
        }

        public Builder rollupConfigPath(String v) {
            this.rollupConfigPath = v;
            return this;
        }

        public Builder windowStart(Instant v) {
            this.windowStart = v;
            return this;
        }

        public Builder windowEnd(Instant v) {
            this.windowEnd = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(storeType, "storeType required");
            Objects.requireNonNull(storeRoot, "storeRoot required");
            if (rollupConfigPath == null) {
                rollupConfigPath = "";
            }

            if (storeType == StoreType.S3) {
                requireNonBlank(s3Bucket, "S3_BUCKET");
                requireNonBlank(awsRegion, "AWS_REGION");
            }
            if ((windowStart == null) != (windowEnd == null)) {
                throw new IllegalArgumentException("Window start and end must be given together");
            }
            if (windowStart != null && !windowStart.isBefore(windowEnd)) {
                throw new IllegalArgumentException(
                        "Window start must be before end, got: [" + windowStart + ", " + windowEnd + ")");
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank for an S3 store");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.strip() : defaultValue;
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.strip()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    name + " is not an ISO-8601 instant with offset: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "storeType=" + storeType +
                ", s3Bucket='" + s3Bucket + '\'' +
                ", awsRegion='" + awsRegion + '\'' +
                ", storeRoot=" + storeRoot +
                ", rollupConfigPath='" + rollupConfigPath + '\'' +
                ", windowStart=" + windowStart +
                ", windowEnd=" + windowEnd +
                '}';
    }
}
