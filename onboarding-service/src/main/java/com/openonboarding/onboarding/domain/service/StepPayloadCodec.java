package com.openonboarding.onboarding.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openonboarding.onboarding.domain.model.AmenitiesPayload;
import com.openonboarding.onboarding.domain.model.BusinessFeaturesPayload;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.domain.model.PropertyInfoPayload;
import com.openonboarding.onboarding.domain.model.RoomsPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;
import com.openonboarding.onboarding.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Converts between raw JSON and typed step payloads. Incoming payloads are decoded once here; the rest of
 * the engine only sees {@link StepPayload} records.
 */
@Component
@RequiredArgsConstructor
public class StepPayloadCodec {

    private final ObjectMapper objectMapper;

    public static Class<? extends StepPayload> payloadType(StepId stepId) {
        return switch (stepId) {
            case AMENITIES -> AmenitiesPayload.class;
            case IMAGES -> ImagesPayload.class;
            case PROPERTY_INFO -> PropertyInfoPayload.class;
            case ROOMS -> RoomsPayload.class;
            case BUSINESS_FEATURES -> BusinessFeaturesPayload.class;
        };
    }

    /**
     * @throws ValidationException listing the offending field when the JSON does not fit the step schema
     */
    public StepPayload decode(StepId stepId, JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            throw new ValidationException("Payload for step " + stepId.wireId() + " is required");
        }
        if (!json.isObject()) {
            throw new ValidationException("Payload for step " + stepId.wireId() + " must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(json, payloadType(stepId));
        } catch (JsonMappingException e) {
            throw new ValidationException(describe(e));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Malformed payload for step " + stepId.wireId() + ": " + e.getMessage());
        }
    }

    public Map<StepId, StepPayload> decodeDraft(Map<String, JsonNode> rawDraft) {
        Map<StepId, StepPayload> draft = new EnumMap<>(StepId.class);
        if (rawDraft == null) {
            return draft;
        }
        rawDraft.forEach((key, value) -> {
            StepId stepId = StepId.find(key)
                    .orElseThrow(() -> new ValidationException("Unknown onboarding step: " + key));
            draft.put(stepId, decode(stepId, value));
        });
        return draft;
    }

    public String writeDraft(Map<StepId, StepPayload> draft) {
        ObjectNode root = objectMapper.createObjectNode();
        draft.forEach((stepId, payload) -> root.set(stepId.wireId(), objectMapper.valueToTree(payload)));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize onboarding draft", e);
        }
    }

    public Map<StepId, StepPayload> readDraft(String json) {
        Map<StepId, StepPayload> draft = new EnumMap<>(StepId.class);
        if (json == null || json.isBlank()) {
            return draft;
        }
        try {
            JsonNode root = objectMapper.reader()
                    .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .readTree(json);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                StepId stepId = StepId.fromWireId(field.getKey());
                draft.put(stepId, objectMapper.treeToValue(field.getValue(), payloadType(stepId)));
            }
            return draft;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Stored onboarding draft is unreadable", e);
        }
    }

    private static String describe(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference reference : e.getPath()) {
            if (reference.getFieldName() != null) {
                if (!path.isEmpty()) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        String field = path.isEmpty() ? "payload" : path.toString();
        return "Invalid value for " + field + ": " + e.getOriginalMessage();
    }
}
