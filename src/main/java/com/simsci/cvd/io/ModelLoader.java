package com.simsci.cvd.io;

import com.simsci.cvd.api.ConfigurationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/** Reads {@link ModelDefinition}s from JSON. */
public final class ModelLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ModelLoader() {
        // Utility class
    }

    public static ModelDefinition read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), ModelDefinition.class);
    }

    /**
     * @throws ConfigurationException if the text is not a valid model definition.
     */
    public static ModelDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid model definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Reads a model definition from the classpath. */
    public static ModelDefinition readResource(String name) throws IOException {
        try (InputStream in = ModelLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null)
                throw new IOException("Resource not found: " + name);
            return MAPPER.readValue(in, ModelDefinition.class);
        }
    }
}
