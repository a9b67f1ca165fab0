package com.tablecast.core.model;

import com.tablecast.core.topic.TopicKey;

/**
 * A table at a venue, the unit the POS poller watches.
 *
 * @param slug   venue slug
 * @param mesaId table identifier within the venue
 */
public record MesaRef(String slug, String mesaId) {

    public MesaRef {
        if (slug == null || slug.isBlank() || mesaId == null || mesaId.isBlank()) {
            throw new IllegalArgumentException("Mesa requires slug and mesaId");
        }
    }

    /**
     * Parses {@code slug:mesaId}. The slug may not contain ':'; the mesa id may.
     */
    public static MesaRef parse(String mesaKey) {
        int sep = mesaKey == null ? -1 : mesaKey.indexOf(':');
        if (sep <= 0 || sep == mesaKey.length() - 1) {
            throw new IllegalArgumentException("Invalid mesa key '" + mesaKey + "', expected slug:mesaId");
        }
        return new MesaRef(mesaKey.substring(0, sep), mesaKey.substring(sep + 1));
    }

    public String key() {
        return TopicKey.mesaKey(slug, mesaId);
    }

    public TopicKey topic() {
        return TopicKey.mesa(slug, mesaId);
    }

    @Override
    public String toString() {
        return key();
    }
}
