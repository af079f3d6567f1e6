package com.fdb.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fdb.error.ErrorType;
import com.fdb.error.FdbException;
import lombok.experimental.UtilityClass;

/**
 * JSON rendering of typed rows and query results.
 */
@UtilityClass
public class FdbJson {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.registerModule(new FdbModule());
        OBJECT_MAPPER.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public static String toJson(Object value) throws FdbException {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FdbException(ErrorType.SERIALIZATION_ERROR, "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
