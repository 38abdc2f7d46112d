package com.openonboarding.onboarding.domain.image;

import com.openonboarding.onboarding.domain.model.ImageCategory;

import java.util.List;

/**
 * Raw image handed to the engine by the upload adapter. Storage of the bytes happens elsewhere;
 * {@code url} is where the adapter put them.
 */
public record ImageUpload(String id, ImageCategory category, String url, byte[] content, List<String> tags) {

    public ImageUpload {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
