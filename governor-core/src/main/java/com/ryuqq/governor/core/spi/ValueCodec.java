package com.ryuqq.governor.core.spi;

/**
 * Serializes cache values to measure, store and mirror them.
 *
 * <p>The length of the encoded form is the payload size charged against the cache
 * capacity. Stores keep the encoded form and decode a fresh copy on every read.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface ValueCodec {

    /**
     * Encodes a value.
     *
     * @param value value to encode
     * @return encoded bytes
     * @throws Exception if the value cannot be encoded
     */
    byte[] encode(Object value) throws Exception;

    /**
     * Decodes a payload produced by {@link #encode(Object)}.
     *
     * @param payload encoded bytes
     * @param type type to decode into
     * @param <T> value type
     * @return a new instance equal to the encoded value
     * @throws Exception if the payload cannot be decoded into {@code type}
     */
    <T> T decode(byte[] payload, Class<T> type) throws Exception;
}
