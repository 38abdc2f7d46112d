package com.openonboarding.onboarding.domain.quality;

import com.openonboarding.onboarding.domain.amenity.PropertyType;
import com.openonboarding.onboarding.domain.image.ImageQualityStandards;
import com.openonboarding.onboarding.domain.model.AmenitiesPayload;
import com.openonboarding.onboarding.domain.model.BusinessFeaturesPayload;
import com.openonboarding.onboarding.domain.model.HotelPolicies;
import com.openonboarding.onboarding.domain.model.ImageCategory;
import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.domain.model.LocationDetails;
import com.openonboarding.onboarding.domain.model.PropertyInfoPayload;
import com.openonboarding.onboarding.domain.model.RoomRecord;
import com.openonboarding.onboarding.domain.model.RoomsPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the weighted listing quality score of a draft together with ranked recommendations and the
 * list of missing information.
 *
 * <pre>
 * overall = 0.4 * imageQuality + 0.4 * contentCompleteness + 0.2 * policyClarity
 * </pre>
 *
 * Every factor is scored 0-100. The result depends only on the draft, so scoring an unchanged draft twice
 * gives identical output.
 */
public class QualityScoreAggregator {

    static final double IMAGE_WEIGHT = 0.4;
    static final double CONTENT_WEIGHT = 0.4;
    static final double POLICY_WEIGHT = 0.2;

    static final int PROFESSIONAL_SCORE = 85;
    static final int HIGH_PRIORITY_SHORTFALL = 20;
    static final int MEDIUM_PRIORITY_SHORTFALL = 10;
    static final int DETAILED_DESCRIPTION_WORDS = 50;

    private static final List<Factor> IMAGE_FACTORS = List.of(
            new Factor("imageCount", 0.3, RecommendationType.IMAGE,
                    "Add more photos", "Upload more photos showing the whole property"),
            new Factor("highQualityRatio", 0.4, RecommendationType.IMAGE,
                    "Improve photo quality", "Replace dark, blurry or low resolution photos with sharp, well-lit ones"),
            new Factor("categoryCoverage", 0.2, RecommendationType.IMAGE,
                    "Cover the key areas", "Add photos of the exterior, the lobby and the rooms"),
            new Factor("professionalPhotos", 0.1, RecommendationType.IMAGE,
                    "Use professional photography", "Add professional photos of at least full HD resolution"));

    private static final List<Factor> CONTENT_FACTORS = List.of(
            new Factor("descriptionQuality", 0.25, RecommendationType.CONTENT,
                    "Enrich the property description",
                    "Write at least 100 words about what makes the property special, its location and facilities"),
            new Factor("amenityCompleteness", 0.25, RecommendationType.AMENITY,
                    "Select more amenities", "List every amenity guests can use"),
            new Factor("locationDetails", 0.25, RecommendationType.CONTENT,
                    "Describe the location",
                    "Add nearby attractions, transportation, accessibility and neighborhood details"),
            new Factor("roomInformation", 0.25, RecommendationType.CONTENT,
                    "Complete the room details", "Give every room a name, price, occupancy and at least one photo"));

    private static final List<Factor> POLICY_FACTORS = List.of(
            new Factor("cancellationPolicy", 0.25, RecommendationType.POLICY,
                    "Clarify the cancellation policy", "Describe the cancellation terms in detail"),
            new Factor("checkInOut", 0.25, RecommendationType.POLICY,
                    "Explain check-in and check-out", "Describe the check-in and check-out process"),
            new Factor("bookingTerms", 0.25, RecommendationType.POLICY,
                    "Specify booking terms", "Add booking terms including payment terms"),
            new Factor("additionalPolicies", 0.25, RecommendationType.POLICY,
                    "State pet and smoking rules", "Specify whether pets and smoking are allowed"));

    private static final Map<PropertyType, Integer> EXPECTED_AMENITIES = new EnumMap<>(Map.of(
            PropertyType.HOTEL, 8,
            PropertyType.RESORT, 10,
            PropertyType.LUXURY_HOTEL, 12,
            PropertyType.BUSINESS_HOTEL, 10,
            PropertyType.BOUTIQUE_HOTEL, 8,
            PropertyType.GUEST_HOUSE, 5,
            PropertyType.HOMESTAY, 4,
            PropertyType.APARTMENT, 5));

    private final int minImageCount;
    private final int goodThreshold;
    private final ImageQualityStandards standards;

    public QualityScoreAggregator(int minImageCount, int goodThreshold, ImageQualityStandards standards) {
        this.minImageCount = Math.max(1, minImageCount);
        this.goodThreshold = goodThreshold;
        this.standards = standards;
    }

    public QualityScoreBreakdown score(Map<StepId, StepPayload> draft) {
        Map<StepId, StepPayload> safeDraft = draft == null ? Map.of() : draft;
        ComponentScore image = component(IMAGE_WEIGHT, IMAGE_FACTORS, imageFactors(images(safeDraft)));
        ComponentScore content = component(CONTENT_WEIGHT, CONTENT_FACTORS, contentFactors(safeDraft));
        ComponentScore policy = component(POLICY_WEIGHT, POLICY_FACTORS, policyFactors(policies(safeDraft)));
        int overall = clamp(IMAGE_WEIGHT * image.score() + CONTENT_WEIGHT * content.score()
                + POLICY_WEIGHT * policy.score());
        return new QualityScoreBreakdown(image, content, policy, overall);
    }

    public QualityAssessment assess(Map<StepId, StepPayload> draft) {
        Map<StepId, StepPayload> safeDraft = draft == null ? Map.of() : draft;
        QualityScoreBreakdown breakdown = score(safeDraft);
        return new QualityAssessment(breakdown, recommendations(breakdown), missingInformation(safeDraft));
    }

    // ---- image quality ----

    private Map<String, Integer> imageFactors(List<ImageRecord> images) {
        int count = images.size();
        long highQuality = images.stream()
                .filter(image -> image.qualityScore() != null
                        && image.qualityScore() >= standards.highQualityThreshold())
                .count();
        long professional = images.stream()
                .filter(image -> image.qualityScore() != null && image.qualityScore() >= PROFESSIONAL_SCORE)
                .filter(image -> image.dimensions() != null
                        && image.dimensions().atLeast(standards.minWidth(), standards.minHeight()))
                .count();
        Set<ImageCategory> categories = images.stream()
                .map(ImageRecord::category)
                .filter(ImageCategory.ESSENTIAL::contains)
                .collect(Collectors.toSet());

        Map<String, Integer> factors = new LinkedHashMap<>();
        factors.put("imageCount", clamp(100.0 * count / minImageCount));
        factors.put("highQualityRatio", count == 0 ? 0 : clamp(100.0 * highQuality / count));
        factors.put("categoryCoverage", clamp(100.0 * categories.size() / ImageCategory.ESSENTIAL.size()));
        factors.put("professionalPhotos", clamp(100.0 * professional / minImageCount));
        return factors;
    }

    // ---- content completeness ----

    private Map<String, Integer> contentFactors(Map<StepId, StepPayload> draft) {
        PropertyInfoPayload info = step(draft, StepId.PROPERTY_INFO, PropertyInfoPayload.class);
        AmenitiesPayload amenities = step(draft, StepId.AMENITIES, AmenitiesPayload.class);
        RoomsPayload rooms = step(draft, StepId.ROOMS, RoomsPayload.class);

        Map<String, Integer> factors = new LinkedHashMap<>();
        factors.put("descriptionQuality", descriptionScore(info == null ? null : info.description()));
        factors.put("amenityCompleteness", amenityScore(amenities));
        factors.put("locationDetails", locationScore(info == null ? null : info.locationDetails()));
        factors.put("roomInformation", roomScore(rooms == null ? List.of() : rooms.rooms()));
        return factors;
    }

    static int descriptionScore(String description) {
        if (description == null || description.isBlank()) {
            return 0;
        }
        int words = wordCount(description);
        int score;
        if (words >= 100) {
            score = 55;
        } else if (words >= 50) {
            score = 40;
        } else if (words >= 20) {
            score = 25;
        } else {
            score = 15;
        }
        String text = description.toLowerCase(Locale.ROOT);
        if (text.contains("unique") || text.contains("special")) {
            score += 15;
        }
        if (text.contains("location") || text.contains("nearby")) {
            score += 15;
        }
        if (text.contains("amenities") || text.contains("facilities")) {
            score += 15;
        }
        return clamp(score);
    }

    private static int amenityScore(AmenitiesPayload amenities) {
        if (amenities == null || amenities.selectedAmenities().isEmpty()) {
            return 0;
        }
        PropertyType type = amenities.propertyType() == null ? PropertyType.HOTEL : amenities.propertyType();
        int expected = EXPECTED_AMENITIES.getOrDefault(type, 8);
        return clamp(100.0 * amenities.selectedAmenities().size() / expected);
    }

    private static int locationScore(LocationDetails location) {
        if (location == null) {
            return 0;
        }
        int score = 0;
        if (!location.nearbyAttractions().isEmpty()) {
            score += 25;
        }
        if (!location.transportation().isEmpty()) {
            score += 25;
        }
        if (!location.accessibility().isEmpty()) {
            score += 25;
        }
        if (location.neighborhood() != null && !location.neighborhood().isBlank()) {
            score += 25;
        }
        return score;
    }

    private static int roomScore(List<RoomRecord> rooms) {
        if (rooms.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (RoomRecord room : rooms) {
            int points = 0;
            if (room.name() != null && !room.name().isBlank()) {
                points += 25;
            }
            if (room.basePrice() != null && room.basePrice().signum() > 0) {
                points += 25;
            }
            if (room.maxOccupancy() != null && room.maxOccupancy() >= 1) {
                points += 25;
            }
            if (!room.imageIds().isEmpty()) {
                points += 25;
            }
            total += points;
        }
        return clamp(total / rooms.size());
    }

    // ---- policy clarity ----

    private static Map<String, Integer> policyFactors(HotelPolicies policies) {
        Map<String, Integer> factors = new LinkedHashMap<>();
        if (policies == null) {
            POLICY_FACTORS.forEach(factor -> factors.put(factor.name(), 0));
            return factors;
        }

        int cancellation = 0;
        if (policies.cancellation() != null) {
            cancellation = 50 + (hasText(policies.cancellation().details()) ? 50 : 0);
        }
        int checkInOut = (policies.checkIn() != null && hasText(policies.checkIn().process()) ? 50 : 0)
                + (policies.checkOut() != null && hasText(policies.checkOut().process()) ? 50 : 0);
        int booking = 0;
        if (policies.booking() != null) {
            booking = 50 + (hasText(policies.booking().paymentTerms()) ? 50 : 0);
        }
        int additional = (policies.pet() != null && policies.pet().allowed() != null ? 50 : 0)
                + (policies.smoking() != null && policies.smoking().allowed() != null ? 50 : 0);

        factors.put("cancellationPolicy", cancellation);
        factors.put("checkInOut", checkInOut);
        factors.put("bookingTerms", booking);
        factors.put("additionalPolicies", additional);
        return factors;
    }

    // ---- recommendations ----

    private List<Recommendation> recommendations(QualityScoreBreakdown breakdown) {
        List<Recommendation> recommendations = new ArrayList<>();
        collect(breakdown.imageQuality(), IMAGE_FACTORS, recommendations);
        collect(breakdown.contentCompleteness(), CONTENT_FACTORS, recommendations);
        collect(breakdown.policyClarity(), POLICY_FACTORS, recommendations);
        recommendations.sort(Comparator.comparing(Recommendation::priority)
                .thenComparing(Comparator.comparingInt(Recommendation::estimatedImpact).reversed())
                .thenComparing(Recommendation::factor));
        return recommendations;
    }

    private void collect(ComponentScore component, List<Factor> factors, List<Recommendation> out) {
        for (Factor factor : factors) {
            int value = component.factors().getOrDefault(factor.name(), 0);
            if (value >= goodThreshold) {
                continue;
            }
            int shortfall = goodThreshold - value;
            int impact = Math.max(1, (int) Math.round(component.weight() * factor.weight() * shortfall));
            RecommendationPriority priority = shortfall >= HIGH_PRIORITY_SHORTFALL
                    ? RecommendationPriority.HIGH
                    : shortfall >= MEDIUM_PRIORITY_SHORTFALL ? RecommendationPriority.MEDIUM : RecommendationPriority.LOW;
            out.add(new Recommendation(factor.type(), priority, factor.title(), factor.action(), impact, factor.name()));
        }
    }

    // ---- missing information ----

    private List<MissingInformation> missingInformation(Map<StepId, StepPayload> draft) {
        List<MissingInformation> missing = new ArrayList<>();

        List<ImageRecord> images = images(draft);
        List<String> imageItems = new ArrayList<>();
        if (images.isEmpty()) {
            imageItems.add("Property photos");
        } else {
            Set<ImageCategory> present = images.stream().map(ImageRecord::category).collect(Collectors.toSet());
            for (ImageCategory essential : ImageCategory.ESSENTIAL) {
                if (!present.contains(essential)) {
                    imageItems.add(capitalize(essential.name()) + " photos");
                }
            }
            if (images.size() < minImageCount) {
                imageItems.add("Minimum " + minImageCount + " property photos");
            }
        }
        if (!imageItems.isEmpty()) {
            missing.add(new MissingInformation("Images", imageItems, RecommendationPriority.HIGH));
        }

        PropertyInfoPayload info = step(draft, StepId.PROPERTY_INFO, PropertyInfoPayload.class);
        AmenitiesPayload amenities = step(draft, StepId.AMENITIES, AmenitiesPayload.class);
        RoomsPayload rooms = step(draft, StepId.ROOMS, RoomsPayload.class);
        List<String> contentItems = new ArrayList<>();
        if (info == null || !hasText(info.description())) {
            contentItems.add("Property description");
        } else if (wordCount(info.description()) < DETAILED_DESCRIPTION_WORDS) {
            contentItems.add("Detailed property description");
        }
        if (info == null || info.locationDetails() == null) {
            contentItems.add("Location details");
        }
        if (amenities == null || amenities.selectedAmenities().isEmpty()) {
            contentItems.add("Amenities");
        }
        if (rooms == null || rooms.rooms().isEmpty()) {
            contentItems.add("Room types");
        }
        if (!contentItems.isEmpty()) {
            missing.add(new MissingInformation("Content", contentItems, countPriority(contentItems.size())));
        }

        HotelPolicies policies = info == null ? null : info.policies();
        List<String> policyItems = new ArrayList<>();
        if (policies == null || policies.cancellation() == null) {
            policyItems.add("Cancellation policy");
        }
        if (policies == null || policies.checkIn() == null) {
            policyItems.add("Check-in policy");
        }
        if (policies == null || policies.checkOut() == null) {
            policyItems.add("Check-out policy");
        }
        if (policies == null || policies.booking() == null) {
            policyItems.add("Booking terms");
        }
        if (!policyItems.isEmpty()) {
            missing.add(new MissingInformation("Policies", policyItems, countPriority(policyItems.size())));
        }

        BusinessFeaturesPayload business = step(draft, StepId.BUSINESS_FEATURES, BusinessFeaturesPayload.class);
        List<String> businessItems = new ArrayList<>();
        if (business == null || business.meetingRooms().isEmpty()) {
            businessItems.add("Meeting rooms");
        }
        if (business == null || business.connectivity() == null || business.connectivity().wifiSpeed() == null) {
            businessItems.add("WiFi speed");
        }
        if (!businessItems.isEmpty()) {
            boolean businessProperty = amenities != null && amenities.propertyType() == PropertyType.BUSINESS_HOTEL;
            missing.add(new MissingInformation("Business Features", businessItems,
                    businessProperty ? RecommendationPriority.MEDIUM : RecommendationPriority.LOW));
        }
        return missing;
    }

    private static RecommendationPriority countPriority(int missingCount) {
        return missingCount > 2 ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM;
    }

    // ---- helpers ----

    private static ComponentScore component(double weight, List<Factor> specs, Map<String, Integer> factors) {
        double total = 0;
        for (Factor spec : specs) {
            total += spec.weight() * factors.getOrDefault(spec.name(), 0);
        }
        return new ComponentScore(clamp(total), weight, factors);
    }

    private static List<ImageRecord> images(Map<StepId, StepPayload> draft) {
        ImagesPayload images = step(draft, StepId.IMAGES, ImagesPayload.class);
        return images == null ? List.of() : images.images();
    }

    private static HotelPolicies policies(Map<StepId, StepPayload> draft) {
        PropertyInfoPayload info = step(draft, StepId.PROPERTY_INFO, PropertyInfoPayload.class);
        return info == null ? null : info.policies();
    }

    private static <P extends StepPayload> P step(Map<StepId, StepPayload> draft, StepId stepId, Class<P> type) {
        StepPayload payload = draft.get(stepId);
        return type.isInstance(payload) ? type.cast(payload) : null;
    }

    private static int wordCount(String text) {
        return text.trim().split("\\s+").length;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String capitalize(String enumName) {
        String lower = enumName.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    static int clamp(double value) {
        long rounded = Math.round(value);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    private record Factor(String name, double weight, RecommendationType type, String title, String action) {
    }
}
