package com.hcltech.vocab.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.vocab.common.errorsor.ErrorsOr;

import java.util.List;

/** Two-way conversion between an in-memory value and its wire form. Neither direction throws. */
public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    default Codec<To, From> invert() {
        return new Codec<To, From>() {
            @Override
            public ErrorsOr<From> encode(To p) {
                return Codec.this.decode(p);
            }

            @Override
            public ErrorsOr<To> decode(From from) {
                return Codec.this.encode(from);
            }
        };
    }

    /** One item per line; blank lines are skipped when decoding. */
    static <T> Codec<List<T>, String> lines(Codec<T, String> itemCodec) {
        return new LineSeparatedListCodec<>(itemCodec);
    }

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }

    static <T> Codec<T, String> typedCodec(TypeReference<T> typeRef) {
        return new JacksonTypedJsonCodec<>(typeRef);
    }
}
