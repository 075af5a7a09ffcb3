package com.tektonqueue.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.Map;

/**
 * Converts PipelineRuns to and from YAML/JSON documents and to the generic map form
 * expressions evaluate against.
 */
public final class PipelineRunMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // CEL integers are 64-bit; Jackson would otherwise hand out Integer for small numbers.
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_LONG_FOR_INTS);

    private static final ObjectMapper yamlMapper = new ObjectMapper(
            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private PipelineRunMapper() {
    }

    /**
     * Convert a PipelineRun to nested maps and lists mirroring its JSON shape.
     */
    public static Map<String, Object> toMap(PipelineRun pipelineRun) {
        return objectMapper.convertValue(pipelineRun, MAP_TYPE);
    }

    /**
     * Parse a PipelineRun from YAML or JSON (JSON is a subset of YAML).
     *
     * @throws IllegalArgumentException if the document cannot be parsed
     */
    public static PipelineRun fromYaml(String document) {
        try {
            return yamlMapper.readValue(document, PipelineRun.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid PipelineRun document: " + e.getOriginalMessage(), e);
        }
    }

    public static String toYaml(PipelineRun pipelineRun) {
        try {
            return yamlMapper.writeValueAsString(pipelineRun);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + pipelineRun, e);
        }
    }

    public static String toJson(PipelineRun pipelineRun) {
        try {
            return objectMapper.writeValueAsString(pipelineRun);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + pipelineRun, e);
        }
    }
}
