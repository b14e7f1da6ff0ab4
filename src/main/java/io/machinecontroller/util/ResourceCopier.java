package io.machinecontroller.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Deep copies resources by round-tripping them through their JSON form, the same
 * representation they are stored in.
 */
public final class ResourceCopier {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ResourceCopier() {
        // Utility class - prevent instantiation
    }

    /**
     * @param value the object to copy
     * @param type the concrete type to materialize the copy as
     * @return an independently owned copy
     * @throws IllegalStateException if the object cannot be represented as JSON
     */
    public static <T> T deepCopy(Object value, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            byte[] json = MAPPER.writeValueAsBytes(value);
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy " + type.getSimpleName(), e);
        }
    }
}
