package com.coursereq.parser;

import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.validation.RequirementSchemaValidator;
import com.coursereq.validation.RequirementSchemaValidator.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns oracle output into the typed model. Only candidates that pass
 * {@link RequirementSchemaValidator} are bound.
 */
@Component
public class RequirementJsonReader {
    private final ObjectMapper objectMapper;
    private final RequirementSchemaValidator validator;

    public RequirementJsonReader(ObjectMapper objectMapper, RequirementSchemaValidator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public ReadResult read(String json) {
        JsonNode candidate;
        try {
            candidate = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            return ReadResult.rejected(List.of("Root: Malformed JSON (" + e.getOriginalMessage() + ")"));
        }
        return read(candidate);
    }

    public ReadResult read(JsonNode candidate) {
        ValidationResult validation = validator.validate(candidate);
        if (!validation.isValid()) {
            return ReadResult.rejected(validation.errors());
        }
        try {
            return new ReadResult(objectMapper.treeToValue(candidate, ParsedCourseRequirements.class), List.of());
        } catch (JsonProcessingException e) {
            return ReadResult.rejected(List.of("Root: Cannot bind requirements (" + e.getOriginalMessage() + ")"));
        }
    }

    public record ReadResult(ParsedCourseRequirements requirements, List<String> errors) {
        public ReadResult {
            errors = List.copyOf(errors);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        static ReadResult rejected(List<String> errors) {
            return new ReadResult(null, errors);
        }
    }
}
