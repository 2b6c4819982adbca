package edu.brandeis.cosi103a.gametheory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper factory so results, runs and experiments serialize the same way
 * whether they are printed by the CLI, written to disk, or handed to a repository.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {
        // Utility class
    }

    /**
     * Creates an ObjectMapper with Guava, JDK8 (Optional) and java.time support.
     * Timestamps are written as ISO-8601 strings.
     *
     * @return a new ObjectMapper instance
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Same as {@link #create()} but with indented output, for files and console output.
     */
    public static ObjectMapper createPretty() {
        return create().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
