package de.panbytes.rxproperty.codec;

/**
 * Decodes an input into a value, e.g. a JSON string into a bean.
 *
 * @param <I> the encoded type.
 * @param <O> the decoded type.
 */
@FunctionalInterface
public interface Decoder<I, O> {

    /**
     * @param input the encoded input.
     * @return the decoded value, never {@code null}.
     * @throws Exception if the input cannot be decoded.
     */
    O decode(I input) throws Exception;
}
