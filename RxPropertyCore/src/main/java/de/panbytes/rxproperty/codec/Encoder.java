package de.panbytes.rxproperty.codec;

/**
 * Encodes a value, e.g. a bean into a JSON string.
 *
 * @param <I> the value's type.
 * @param <O> the encoded type.
 */
@FunctionalInterface
public interface Encoder<I, O> {

    /**
     * @param value the value to encode.
     * @return the encoded value, never {@code null}.
     * @throws Exception if the value cannot be encoded.
     */
    O encode(I value) throws Exception;
}
