package com.ryuqq.governor.adapter.inmemory.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.governor.core.spi.ValueCodec;

import java.io.IOException;

/**
 * JSON value codec.
 *
 * <p>A value's size is the byte length of its JSON serialization. Decoding reads
 * the JSON back into the requested type, so collections come back as mutable
 * Jackson defaults ({@code ArrayList}, {@code LinkedHashMap}) and their elements
 * as JSON-native values.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class JacksonValueCodec implements ValueCodec {

    private final ObjectMapper objectMapper;

    public JacksonValueCodec() {
        this(new ObjectMapper());
    }

    public JacksonValueCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(value);
    }

    @Override
    public <T> T decode(byte[] payload, Class<T> type) throws IOException {
        return objectMapper.readValue(payload, type);
    }
}
