package com.tablecast.hub.poll;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Last revision marker seen per polled entity.
 * <p>
 * {@code UNSEEN → BASELINED} on the first observation (no notification), then a
 * notification each time the marker differs from the cached one. Bounded: the least
 * recently observed entity is evicted past {@code maxEntries} and re-baselines
 * silently on its next observation.
 * </p>
 */
public class RevisionTracker {

    /**
     * What an observation did to the cache.
     */
    public enum Outcome {
        BASELINED,
        UNCHANGED,
        CHANGED
    }

    private final Map<String, String> markers;

    public RevisionTracker(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.markers = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > maxEntries;
            }
        };
    }

    /**
     * Records a fetched marker.
     *
     * @param entityId stable entity id
     * @param marker   revision marker just fetched
     * @return {@link Outcome#CHANGED} only when a different marker was cached before
     */
    public synchronized Outcome observe(String entityId, String marker) {
        String previous = markers.put(entityId, marker);
        if (previous == null) {
            return Outcome.BASELINED;
        }
        return Objects.equals(previous, marker) ? Outcome.UNCHANGED : Outcome.CHANGED;
    }

    public synchronized String lastMarker(String entityId) {
        return markers.get(entityId);
    }

    public synchronized int size() {
        return markers.size();
    }
}
