package com.openonboarding.onboarding.domain.amenity;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the amenity catalog from a JSON resource once at startup.
 */
@Slf4j
@Component
public class ClasspathAmenityCatalog implements AmenityCatalog {

    private final AmenityCatalogSnapshot snapshot;

    public ClasspathAmenityCatalog(
            ObjectMapper objectMapper,
            @Value("${onboarding.amenities.catalog-location:classpath:amenity-catalog.json}") Resource catalogResource) {
        this.snapshot = load(objectMapper, catalogResource);
        log.info("Loaded {} amenities from {}", snapshot.amenities().size(), catalogResource.getDescription());
    }

    @Override
    public AmenityCatalogSnapshot snapshot() {
        return snapshot;
    }

    private static AmenityCatalogSnapshot load(ObjectMapper objectMapper, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
            return new AmenityCatalogSnapshot(
                    document.amenities() == null ? List.of() : document.amenities(),
                    document.requiredCategories());
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load amenity catalog from " + resource.getDescription(), e);
        }
    }

    public record CatalogDocument(List<AmenityDefinition> amenities,
                           Map<PropertyType, Set<AmenityCategory>> requiredCategories) {
    }
}
