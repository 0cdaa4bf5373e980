package io.github.jbellis.apiguard.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Single, centrally-configured Jackson {@link ObjectMapper} for options files.
 *
 * <p>Unknown properties fail the read so that a misspelled option is reported instead of silently ignored.
 * Comments are accepted since options files are written by hand.
 */
public final class Json {
    public static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private Json() {}   // no instances
}
