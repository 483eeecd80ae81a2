package io.github.tclast.util;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson setup. AST output nests a few JSON levels per body level, so both nesting constraints are raised
 * above Jackson's default of 1000 to cover the deepest tree the builder's depth guard allows.
 */
public class Json {

    /** Upper bound on JSON nesting, comfortably above {@code maxBodyDepth * 5} for the default guard. */
    public static final int MAX_NESTING_DEPTH = 10_000;

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // Utility class - no instantiation
    }

    private static ObjectMapper createMapper() {
        var factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .build())
                .streamWriteConstraints(StreamWriteConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .build())
                .build();
        return new ObjectMapper(factory).disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** The factory the serializer creates its generators from. */
    public static JsonFactory getFactory() {
        return MAPPER.getFactory();
    }

    /** Parses JSON text into a tree, e.g. to check serializer output. */
    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
