package com.scidata.dfe.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidata.dfe.exception.GraphConstructionException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link PipelineDefinition}s from JSON text, files or classpath
 * resources.
 */
public final class PipelineParser {
    private static final ObjectMapper MAPPER = JsonSupport.newMapper();

    private PipelineParser() {
        // Utility class
    }

    public static PipelineDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, PipelineDefinition.class));
        } catch (JsonProcessingException e) {
            throw new GraphConstructionException("Malformed pipeline definition: " + e.getOriginalMessage());
        }
    }

    public static PipelineDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static PipelineDefinition parseResource(String resource) throws IOException {
        try (InputStream in = PipelineParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Pipeline resource not found: " + resource);
            return validate(MAPPER.readValue(in, PipelineDefinition.class));
        }
    }

    public static String toJson(PipelineDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize pipeline " + def.getPipeline().getName(), e);
        }
    }

    private static PipelineDefinition validate(PipelineDefinition def) {
        if (def.getPipeline() == null)
            throw new GraphConstructionException("Missing 'pipeline' key");
        if (def.getPipeline().getStages() == null || def.getPipeline().getStages().isEmpty())
            throw new GraphConstructionException("Pipeline " + def.getPipeline().getName() + " declares no stages");
        return def;
    }
}
