package com.hcltech.vocab.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.hcltech.vocab.common.IEnvGetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link HierarchyConfig} from JSON or the environment.
 * <p>
 * In JSON a missing or null {@code separator} means "no nesting". In the environment an unset
 * {@link #ENV_SEPARATOR} keeps the fallback's separator.
 */
public interface HierarchyConfigLoader {

    String ENV_SEPARATOR = "VOCAB_INDENT_SEPARATOR";
    String ENV_BASE_LEVEL = "VOCAB_BASE_LEVEL";

    /* ------------ Cached Jackson instances (thread-safe) ------------ */
    ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);
    ObjectReader CONFIG_READER = JSON.readerFor(HierarchyConfig.class);

    /* ---------------- Public API ---------------- */

    static HierarchyConfig fromJson(InputStream in) throws IOException {
        return validated(CONFIG_READER.readValue(in));
    }

    static HierarchyConfig fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    static HierarchyConfig fromJson(String json) throws IOException {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        }
    }

    static HierarchyConfig fromEnv(IEnvGetter env, HierarchyConfig fallback) {
        HierarchyConfig base = validated(fallback);
        HierarchyConfig cfg = new HierarchyConfig(
                IEnvGetter.getVerbatimOr(env, ENV_SEPARATOR, base.separator()),
                IEnvGetter.getIntOr(env, ENV_BASE_LEVEL, base.baseLevel()));
        Holder.log.debug("Hierarchy config from environment: separator='{}', baseLevel={}", cfg.separator(), cfg.baseLevel());
        return validated(cfg);
    }

    /** Null becomes {@link HierarchyConfig#defaults()}; an empty separator or a negative base level is rejected. */
    static HierarchyConfig validated(HierarchyConfig cfg) {
        if (cfg == null) return HierarchyConfig.defaults();
        if (cfg.separator() != null && cfg.separator().isEmpty()) {
            throw new IllegalArgumentException("Setting the indent separator to zero length is not allowed.");
        }
        if (cfg.baseLevel() < 0) {
            throw new IllegalArgumentException("Base level must not be negative but was " + cfg.baseLevel());
        }
        return cfg;
    }

    final class Holder {
        private static final Logger log = LoggerFactory.getLogger(HierarchyConfigLoader.class);

        private Holder() {}
    }
}
