package com.hcltech.cpm.common.codec;

import com.hcltech.cpm.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    /** Compact JSON for {@code klass}. */
    static <T> Codec<T, String> json(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass, false);
    }

    /** Indented JSON for {@code klass}, for files people read. */
    static <T> Codec<T, String> prettyJson(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass, true);
    }
}
