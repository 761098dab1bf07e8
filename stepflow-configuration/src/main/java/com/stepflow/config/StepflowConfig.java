package com.stepflow.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Library settings loaded from environment variables.
 * <p>
 * External artifacts: STEPFLOW_EXTERNAL_ARTIFACTS_DIR (scope under the artifact store where uploaded values land).
 * Setting keys: STEPFLOW_EXTRA_SETTING_KEYS (comma-separated general keys accepted besides {@code docker} and {@code resources}).
 * Caching: STEPFLOW_SOURCE_HASH_ALGORITHM (digest used for code content hashes).
 */
public final class StepflowConfig {

    private static final String ENV_EXTERNAL_ARTIFACTS_DIR = "STEPFLOW_EXTERNAL_ARTIFACTS_DIR";
    private static final String ENV_EXTRA_SETTING_KEYS = "STEPFLOW_EXTRA_SETTING_KEYS";
    private static final String ENV_SOURCE_HASH_ALGORITHM = "STEPFLOW_SOURCE_HASH_ALGORITHM";
    private static final String ENV_WARN_EXTERNAL_ARTIFACT_CACHING = "STEPFLOW_WARN_EXTERNAL_ARTIFACT_CACHING";

    private static final String DEFAULT_EXTERNAL_ARTIFACTS_DIR = "external_artifacts";
    private static final String DEFAULT_SOURCE_HASH_ALGORITHM = "SHA-256";
    private static final List<String> DEFAULT_GENERAL_SETTING_KEYS = List.of("docker", "resources");

    private static volatile StepflowConfig current;

    private final String externalArtifactsDir;
    private final List<String> generalSettingKeys;
    private final String sourceHashAlgorithm;
    private final boolean warnExternalArtifactCaching;

    private StepflowConfig(Builder b) {
        this.externalArtifactsDir = b.externalArtifactsDir;
        this.generalSettingKeys = Collections.unmodifiableList(new ArrayList<>(b.generalSettingKeys));
        this.sourceHashAlgorithm = b.sourceHashAlgorithm;
        this.warnExternalArtifactCaching = b.warnExternalArtifactCaching;
    }

    /**
     * Returns the process-wide configuration, reading the environment on first use.
     */
    public static StepflowConfig get() {
        StepflowConfig cfg = current;
        if (cfg == null) {
            synchronized (StepflowConfig.class) {
                cfg = current;
                if (cfg == null) {
                    cfg = fromEnvironment();
                    current = cfg;
                }
            }
        }
        return cfg;
    }

    /** Replaces the process-wide configuration (mainly for tests and embedding applications). */
    public static void set(StepflowConfig config) {
        current = Objects.requireNonNull(config, "config");
    }

    /** Drops the process-wide configuration so the next {@link #get()} reads the environment again. */
    public static void reset() {
        current = null;
    }

    /** Scope (directory name under the artifact store) for uploaded external artifacts. Default {@code external_artifacts}. */
    public String getExternalArtifactsDir() {
        return externalArtifactsDir;
    }

    /**
     * General (not stack-component specific) setting keys: {@code docker}, {@code resources}
     * and any key listed in STEPFLOW_EXTRA_SETTING_KEYS.
     */
    public List<String> getGeneralSettingKeys() {
        return generalSettingKeys;
    }

    /** Digest algorithm for code content hashes (e.g. SHA-256). */
    public String getSourceHashAlgorithm() {
        return sourceHashAlgorithm;
    }

    /** Whether passing an external artifact by value logs a cache invalidation warning. Default true. */
    public boolean isWarnExternalArtifactCaching() {
        return warnExternalArtifactCaching;
    }

    public static StepflowConfig fromEnvironment() {
        List<String> settingKeys = new ArrayList<>(DEFAULT_GENERAL_SETTING_KEYS);
        for (String key : parseCommaSeparated(System.getenv(ENV_EXTRA_SETTING_KEYS))) {
            if (!settingKeys.contains(key)) settingKeys.add(key);
        }
        return builder()
                .externalArtifactsDir(getEnv(ENV_EXTERNAL_ARTIFACTS_DIR, DEFAULT_EXTERNAL_ARTIFACTS_DIR))
                .generalSettingKeys(settingKeys)
                .sourceHashAlgorithm(getEnv(ENV_SOURCE_HASH_ALGORITHM, DEFAULT_SOURCE_HASH_ALGORITHM))
                .warnExternalArtifactCaching(parseBoolean(System.getenv(ENV_WARN_EXTERNAL_ARTIFACT_CACHING), true))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String externalArtifactsDir = DEFAULT_EXTERNAL_ARTIFACTS_DIR;
        private List<String> generalSettingKeys = DEFAULT_GENERAL_SETTING_KEYS;
        private String sourceHashAlgorithm = DEFAULT_SOURCE_HASH_ALGORITHM;
        private boolean warnExternalArtifactCaching = true;

        public Builder externalArtifactsDir(String externalArtifactsDir) {
            if (externalArtifactsDir == null || externalArtifactsDir.isBlank()) {
                throw new IllegalArgumentException("externalArtifactsDir must be non-blank");
            }
            this.externalArtifactsDir = externalArtifactsDir.trim();
            return this;
        }

        public Builder generalSettingKeys(List<String> generalSettingKeys) {
            this.generalSettingKeys = generalSettingKeys != null ? generalSettingKeys : List.of();
            return this;
        }

        public Builder sourceHashAlgorithm(String sourceHashAlgorithm) {
            this.sourceHashAlgorithm = Objects.requireNonNull(sourceHashAlgorithm, "sourceHashAlgorithm");
            return this;
        }

        public Builder warnExternalArtifactCaching(boolean warnExternalArtifactCaching) {
            this.warnExternalArtifactCaching = warnExternalArtifactCaching;
            return this;
        }

        public StepflowConfig build() {
            return new StepflowConfig(this);
        }
    }
}
