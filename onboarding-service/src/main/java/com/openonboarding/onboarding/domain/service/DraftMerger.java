package com.openonboarding.onboarding.domain.service;

import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.domain.model.RoomRecord;
import com.openonboarding.onboarding.domain.model.RoomsPayload;
import com.openonboarding.onboarding.domain.model.StepPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Folds an accepted payload into the stored draft entry for its step.
 *
 * <ul>
 *   <li>images and rooms are upserted by id: stored order is kept, a known id is replaced in place and
 *       new ids are appended; repeated ids inside one payload resolve to the last occurrence</li>
 *   <li>the amenity selection is a set and replaces the stored selection exactly</li>
 *   <li>property info and business features replace the stored entry wholesale</li>
 * </ul>
 *
 * Merging the same payload twice yields the same draft entry.
 */
@Slf4j
@Component
public class DraftMerger {

    public StepPayload merge(StepPayload existing, StepPayload incoming) {
        if (incoming instanceof ImagesPayload images) {
            List<ImageRecord> stored = existing instanceof ImagesPayload previous ? previous.images() : List.of();
            return new ImagesPayload(upsert(stored, images.images(), ImageRecord::id));
        }
        if (incoming instanceof RoomsPayload rooms) {
            List<RoomRecord> stored = existing instanceof RoomsPayload previous ? previous.rooms() : List.of();
            return new RoomsPayload(upsert(stored, rooms.rooms(), RoomRecord::id));
        }
        return incoming;
    }

    private static <T> List<T> upsert(List<T> stored, List<T> incoming, Function<T, String> identity) {
        Map<String, T> byId = new LinkedHashMap<>();
        for (T item : stored) {
            byId.put(identity.apply(item), item);
        }
        for (T item : incoming) {
            byId.put(identity.apply(item), item);
        }
        log.debug("Upserted {} incoming entries onto {} stored, {} total", incoming.size(), stored.size(), byId.size());
        return new ArrayList<>(byId.values());
    }
}
