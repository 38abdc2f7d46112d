package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.model.AmenitiesPayload;
import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.domain.model.RoomRecord;
import com.openonboarding.onboarding.domain.model.RoomsPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks each room's structure. When dependencies are requested, room amenities and images are also
 * compared with the property-level amenity selection and image gallery; mismatches only warn.
 */
@Component
public class RoomsStepValidator implements StepValidator<RoomsPayload> {

    @Override
    public StepId stepId() {
        return StepId.ROOMS;
    }

    @Override
    public Class<RoomsPayload> payloadType() {
        return RoomsPayload.class;
    }

    @Override
    public ValidationResult validate(RoomsPayload payload, ValidationContext context) {
        List<RoomRecord> rooms = payload.rooms();
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        if (rooms.isEmpty()) {
            return result.error("At least one room type is required").build();
        }

        for (int i = 0; i < rooms.size(); i++) {
            RoomRecord room = rooms.get(i);
            String label = isBlank(room.id()) ? "at position " + (i + 1) : room.id();
            if (isBlank(room.id())) {
                result.error("Room " + label + " must have an id");
            }
            if (isBlank(room.name())) {
                result.error("Room " + label + " must have a name");
            }
            if (room.maxOccupancy() == null || room.maxOccupancy() < 1) {
                result.error("Room " + label + " must allow at least one guest");
            }
            if (room.basePrice() == null) {
                result.warning("Room " + label + " has no base price");
            } else if (room.basePrice().compareTo(BigDecimal.ZERO) < 0) {
                result.error("Room " + label + " must not have a negative base price");
            }
            if (room.imageIds().isEmpty()) {
                result.warning("Room " + label + " has no images");
            }
        }

        if (context.validateDependencies()) {
            checkDependencies(rooms, context, result);
        }
        return result.build();
    }

    private void checkDependencies(List<RoomRecord> rooms, ValidationContext context,
                                   ValidationResult.ValidationResultBuilder result) {
        Set<String> propertyAmenities = context.draftStep(StepId.AMENITIES, AmenitiesPayload.class)
                .map(AmenitiesPayload::selectedAmenities)
                .orElse(Set.of());
        Set<String> galleryImageIds = context.draftStep(StepId.IMAGES, ImagesPayload.class)
                .map(images -> images.images().stream().map(ImageRecord::id).collect(Collectors.toSet()))
                .orElse(null);

        for (RoomRecord room : rooms) {
            List<String> foreignAmenities = room.amenities().stream()
                    .filter(amenity -> !propertyAmenities.contains(amenity))
                    .toList();
            if (!foreignAmenities.isEmpty()) {
                result.warning(String.format("Room %s lists amenities not selected for the property: %s",
                        room.id(), String.join(", ", foreignAmenities)));
            }
            if (galleryImageIds != null) {
                List<String> unknownImages = room.imageIds().stream()
                        .filter(imageId -> !galleryImageIds.contains(imageId))
                        .toList();
                if (!unknownImages.isEmpty()) {
                    result.warning(String.format("Room %s references images that were not uploaded: %s",
                            room.id(), String.join(", ", unknownImages)));
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
