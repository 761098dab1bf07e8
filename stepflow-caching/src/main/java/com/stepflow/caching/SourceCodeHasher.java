package com.stepflow.caching;

import com.stepflow.config.StepflowConfig;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Hex content hash of a class's code as returned by a {@link SourceCodeReader}.
 */
public final class SourceCodeHasher {

    private final String algorithm;
    private final SourceCodeReader reader;

    public SourceCodeHasher(String algorithm, SourceCodeReader reader) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.reader = Objects.requireNonNull(reader, "reader");
        newDigest(algorithm);
    }

    /** Uses the configured algorithm (STEPFLOW_SOURCE_HASH_ALGORITHM) and class file bytes. */
    public static SourceCodeHasher fromConfig() {
        return new SourceCodeHasher(StepflowConfig.get().getSourceHashAlgorithm(), new ClassFileSourceCodeReader());
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String hash(Class<?> type) {
        return HexFormat.of().formatHex(newDigest(algorithm).digest(reader.read(type)));
    }

    static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported hash algorithm: " + algorithm, e);
        }
    }
}
