/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.opensearch.b2c;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DefaultObjectMapper {
    public static final ObjectMapper objectMapper = new ObjectMapper();

    static {
        // discovery documents are remote input, do not echo them back in parser errors
        objectMapper.disable(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION);
        objectMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    private DefaultObjectMapper() {}

    public static <T> T readValue(InputStream in, Class<T> clazz) throws IOException {
        return objectMapper.readValue(in, clazz);
    }

    public static <T> T convertValue(Object value, Class<T> clazz) {
        return objectMapper.convertValue(value, clazz);
    }
}
