package com.openonboarding.onboarding.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.openonboarding.common.dto.BaseResponse;
import com.openonboarding.common.exception.BusinessException;
import com.openonboarding.common.util.Constants;
import com.openonboarding.onboarding.api.dto.CreateSessionRequest;
import com.openonboarding.onboarding.api.dto.ImageUploadResponse;
import com.openonboarding.onboarding.api.dto.SessionStatusResponse;
import com.openonboarding.onboarding.api.dto.ValidateStepRequest;
import com.openonboarding.onboarding.domain.amenity.AmenityCatalog;
import com.openonboarding.onboarding.domain.amenity.AmenityCategory;
import com.openonboarding.onboarding.domain.amenity.AmenityDefinition;
import com.openonboarding.onboarding.domain.image.ImageUpload;
import com.openonboarding.onboarding.domain.model.ImageCategory;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;
import com.openonboarding.onboarding.domain.service.CompletionResult;
import com.openonboarding.onboarding.domain.service.OnboardingSessionService;
import com.openonboarding.onboarding.domain.service.SessionSummary;
import com.openonboarding.onboarding.domain.service.StepPayloadCodec;
import com.openonboarding.onboarding.domain.service.StepUpdateResult;
import com.openonboarding.onboarding.domain.validation.ValidationResult;
import com.openonboarding.onboarding.exception.ValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST adapter over {@link OnboardingSessionService}. Decodes raw step JSON into typed payloads and
 * wraps results in {@link BaseResponse}.
 */
@RestController
@RequestMapping(Constants.API_BASE_PATH)
@RequiredArgsConstructor
public class OnboardingController {

    private final OnboardingSessionService sessionService;
    private final StepPayloadCodec payloadCodec;
    private final AmenityCatalog amenityCatalog;

    @PostMapping("/sessions")
    public ResponseEntity<BaseResponse<SessionSummary>> createSession(
            @Valid @RequestBody CreateSessionRequest request) {
        SessionSummary summary = sessionService.createSession(request.hotelId(), request.ownerId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.ok("Onboarding session created", summary));
    }

    @PutMapping("/sessions/{sessionId}/steps/{stepId}")
    public ResponseEntity<BaseResponse<StepUpdateResult>> updateStep(
            @PathVariable String sessionId,
            @PathVariable String stepId,
            @RequestBody JsonNode payload) {
        StepId step = parseStep(stepId);
        StepPayload decoded = payloadCodec.decode(step, payload);
        return ResponseEntity.ok(BaseResponse.ok(sessionService.updateStep(sessionId, step, decoded)));
    }

    @PostMapping(value = "/sessions/{sessionId}/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BaseResponse<ImageUploadResponse>> uploadImages(
            @PathVariable String sessionId,
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "category", defaultValue = "ROOMS") ImageCategory category) {
        List<ImageUpload> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            String imageId = UUID.randomUUID().toString();
            uploads.add(new ImageUpload(imageId, category,
                    "/images/" + sessionId + "/" + imageId, read(file), List.of()));
        }
        ImageUploadResponse response = ImageUploadResponse.from(sessionService.uploadImages(sessionId, uploads));
        return ResponseEntity.ok(BaseResponse.ok(response));
    }

    @PostMapping("/steps/{stepId}/validate")
    public ResponseEntity<BaseResponse<ValidationResult>> validateStep(
            @PathVariable String stepId,
            @RequestBody ValidateStepRequest request) {
        StepId step = parseStep(stepId);
        StepPayload payload = payloadCodec.decode(step, request.payload());
        ValidationResult result = sessionService.validateStep(step, payload, request.validateDependencies(),
                payloadCodec.decodeDraft(request.draft()));
        return ResponseEntity.ok(BaseResponse.ok(result));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<BaseResponse<SessionStatusResponse>> getStatus(@PathVariable String sessionId) {
        return ResponseEntity.ok(BaseResponse.ok(SessionStatusResponse.from(sessionService.getStatus(sessionId))));
    }

    @PostMapping("/sessions/{sessionId}/complete")
    public ResponseEntity<BaseResponse<CompletionResult>> complete(@PathVariable String sessionId) {
        CompletionResult result = sessionService.complete(sessionId);
        String message = result.alreadyCompleted() ? "Onboarding already completed" : "Onboarding completed";
        return ResponseEntity.ok(BaseResponse.ok(message, result));
    }

    @GetMapping("/amenities")
    public ResponseEntity<BaseResponse<Map<AmenityCategory, List<AmenityDefinition>>>> listAmenities() {
        return ResponseEntity.ok(BaseResponse.ok(amenityCatalog.snapshot().byCategory()));
    }

    private static StepId parseStep(String stepId) {
        return StepId.find(stepId)
                .orElseThrow(() -> new ValidationException("Unknown onboarding step: " + stepId));
    }

    private static byte[] read(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new BusinessException("Unable to read uploaded file " + file.getOriginalFilename(), e,
                    "UPLOAD_UNREADABLE");
        }
    }
}
