package com.positionalert.common.json;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Shared mapper settings for alert events, positions files and provider payloads.
 * Decimals are read as {@link java.math.BigDecimal} so prices keep their exact scale.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class JacksonConfig {

    public static JsonMapper createJsonMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }
}
