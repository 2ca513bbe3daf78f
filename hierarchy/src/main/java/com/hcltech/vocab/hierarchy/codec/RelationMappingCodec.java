package com.hcltech.vocab.hierarchy.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.vocab.common.codec.Codec;
import com.hcltech.vocab.common.codec.JacksonTypedJsonCodec;
import com.hcltech.vocab.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Relation mapping ↔ JSON object {@code {"concept": ["child", ...], ...}}. Key order is kept both ways; a null
 * child list reads as empty, a null child is an error.
 */
public final class RelationMappingCodec implements Codec<Map<String, List<String>>, String> {
    private final JacksonTypedJsonCodec<LinkedHashMap<String, List<String>>> json =
            new JacksonTypedJsonCodec<>(new TypeReference<LinkedHashMap<String, List<String>>>() {});

    @Override
    public ErrorsOr<String> encode(Map<String, List<String>> relations) {
        if (relations == null) return ErrorsOr.error("Relation mapping must not be null");
        return json.encode(new LinkedHashMap<>(relations));
    }

    @Override
    public ErrorsOr<Map<String, List<String>>> decode(String text) {
        return json.decode(text).flatMap(RelationMappingCodec::normalised);
    }

    private static ErrorsOr<Map<String, List<String>>> normalised(LinkedHashMap<String, List<String>> raw) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        raw.forEach((concept, children) -> {
            if (children == null) out.put(concept, List.of());
            else if (children.stream().anyMatch(Objects::isNull))
                errors.add("Concept \"" + concept + "\" has a null narrower concept");
            else out.put(concept, List.copyOf(children));
        });
        return errors.isEmpty() ? ErrorsOr.lift(out) : ErrorsOr.errors(errors);
    }
}
