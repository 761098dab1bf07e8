package com.stepflow.caching;

import com.stepflow.stepconfig.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the caching fingerprint of a step from code identity only: a hash of the step
 * implementation under {@value #STEP_SOURCE_KEY}, plus for every output with materializers an
 * {@code <output>_materializer_source} entry hashing the materializer code hashes in resolution
 * order. Parameter values and artifacts are combined with this fingerprint by the orchestrator.
 */
public final class CachingFingerprintCalculator {

    private static final Logger log = LoggerFactory.getLogger(CachingFingerprintCalculator.class);

    public static final String STEP_SOURCE_KEY = "step_source";
    public static final String MATERIALIZER_SOURCE_SUFFIX = "_materializer_source";

    private final SourceCodeHasher hasher;

    public CachingFingerprintCalculator(SourceCodeHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    public static CachingFingerprintCalculator fromConfig() {
        return new CachingFingerprintCalculator(SourceCodeHasher.fromConfig());
    }

    /**
     * @param stepClass            step implementation class
     * @param outputMaterializers  output name to resolved materializer sources, in output order
     * @return ordered fingerprint entries
     */
    public Map<String, String> compute(Class<?> stepClass, Map<String, List<Source>> outputMaterializers) {
        Objects.requireNonNull(stepClass, "stepClass");
        Map<String, String> fingerprint = new LinkedHashMap<>();
        fingerprint.put(STEP_SOURCE_KEY, hasher.hash(stepClass));
        if (outputMaterializers != null) {
            outputMaterializers.forEach((outputName, sources) -> {
                if (sources == null || sources.isEmpty()) return;
                MessageDigest md5 = SourceCodeHasher.newDigest("MD5");
                for (Source source : sources) {
                    md5.update(hasher.hash(source.load()).getBytes(StandardCharsets.UTF_8));
                }
                fingerprint.put(outputName + MATERIALIZER_SOURCE_SUFFIX, HexFormat.of().formatHex(md5.digest()));
            });
        }
        log.debug("Caching fingerprint for {}: {}", stepClass.getName(), fingerprint);
        return Collections.unmodifiableMap(fingerprint);
    }
}
