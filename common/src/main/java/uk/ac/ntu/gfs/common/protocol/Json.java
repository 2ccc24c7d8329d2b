package uk.ac.ntu.gfs.common.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.List;

public final class Json {
    private Json() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<List<ChunkInfo>> CHUNK_LIST = new TypeReference<>() {};

    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static ChunkInfo chunk(byte[] body) throws IOException {
        return MAPPER.readValue(body, ChunkInfo.class);
    }

    public static List<ChunkInfo> chunkList(byte[] body) throws IOException {
        List<ChunkInfo> chunks = MAPPER.readValue(body, CHUNK_LIST);
        return chunks == null ? List.of() : chunks;
    }
}
