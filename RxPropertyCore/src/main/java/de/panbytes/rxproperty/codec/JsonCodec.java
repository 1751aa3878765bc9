package de.panbytes.rxproperty.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Jackson-based JSON codec for a single type.
 *
 * @param <T> the decoded type.
 */
public final class JsonCodec<T> implements Decoder<String, T>, Encoder<T, String> {

    private final Class<T> type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    private JsonCodec(ObjectMapper mapper, Class<T> type) {
        this.type = type;
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    public static <T> JsonCodec<T> forType(Class<T> type) {
        return forType(new ObjectMapper(), type);
    }

    public static <T> JsonCodec<T> forType(ObjectMapper mapper, Class<T> type) {
        checkNotNull(mapper, "ObjectMapper may not be null!");
        checkNotNull(type, "Type may not be null!");
        return new JsonCodec<>(mapper, type);
    }

    /**
     * @throws IOException          if the input is no valid JSON for the type.
     * @throws NullPointerException if the input is JSON {@code null}.
     */
    @Override
    public T decode(String json) throws IOException {
        checkNotNull(json, "Json may not be null!");
        T value = this.reader.readValue(json);
        return checkNotNull(value, "Json '%s' decoded to null!", json);
    }

    @Override
    public String encode(T value) throws JsonProcessingException {
        checkNotNull(value, "Value may not be null!");
        return this.writer.writeValueAsString(value);
    }

    @Override
    public String toString() {
        return "JsonCodec[" + this.type.getSimpleName() + "]";
    }
}
