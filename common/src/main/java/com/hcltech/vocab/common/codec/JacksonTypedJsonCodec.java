package com.hcltech.vocab.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.hcltech.vocab.common.errorsor.ErrorsOr;

import java.util.Objects;

/**
 * JSON codec for one target type, bound once to a reader and a writer. Blank input and a bare {@code null}
 * document decode to errors rather than to a null value.
 */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectReader reader;
    private final ObjectWriter writer;
    private final String target;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(MAPPER.readerFor(Objects.requireNonNull(klass, "klass")), klass.getSimpleName());
    }

    public JacksonTypedJsonCodec(TypeReference<T> typeRef) {
        this(MAPPER.readerFor(Objects.requireNonNull(typeRef, "typeRef")), typeRef.getType().getTypeName());
    }

    private JacksonTypedJsonCodec(ObjectReader reader, String target) {
        this.reader = reader;
        this.writer = MAPPER.writer();
        this.target = target;
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        return ErrorsOr.trying(() -> writer.writeValueAsString(value),
                e -> "Failed to encode " + target + " to JSON: " + e.getMessage());
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.error("Failed to decode from JSON: empty input");
        try {
            T value = reader.readValue(json);
            if (value == null) return ErrorsOr.error("Failed to decode from JSON: null document");
            return ErrorsOr.lift(value);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON into " + target + ": " + e.getMessage());
        }
    }
}
