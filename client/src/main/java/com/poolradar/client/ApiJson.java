package com.poolradar.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Jackson setup shared by the gateway and the cache mirror. Unknown properties are ignored so API
 * additions do not break decoding; shape mismatches still fail.
 */
public final class ApiJson {

    private ApiJson() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .findAndRegisterModules();
    }
}
