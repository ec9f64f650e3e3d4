package org.gathermine.model;

import java.util.Objects;

/**
 * A region of the game world as the addon knows it.
 * <p>
 * Identity is the canonical id only. The external id is the key the upstream source uses
 * and several external ids may point at the same canonical zone.
 */
public final class Zone {

    private final String externalId;
    private final String canonicalId;
    private final String displayName;

    /**
     * Creates a zone.
     *
     * @param externalId  the id used by the upstream source
     * @param canonicalId the id used in the persisted tables
     * @param displayName the human readable name
     */
    public Zone(String externalId, String canonicalId, String displayName) {
        this.externalId = Objects.requireNonNull(externalId, "externalId");
        this.canonicalId = Objects.requireNonNull(canonicalId, "canonicalId");
        this.displayName = displayName == null ? "" : displayName;
    }

    public String externalId() {
        return externalId;
    }

    public String canonicalId() {
        return canonicalId;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns the canonical id as a number, which is what the persisted tables are ordered by.
     *
     * @return the numeric canonical id
     * @throws InvalidObservationException if the canonical id is not a non-negative decimal integer
     */
    public long numericId() {
        if (!isNumeric(canonicalId)) {
            throw new InvalidObservationException(
                    String.format("Zone '%s' has non-numeric canonical id '%s'", displayName, canonicalId));
        }
        try {
            return Long.parseLong(canonicalId);
        } catch (NumberFormatException e) {
            throw new InvalidObservationException("Zone canonical id out of range: " + canonicalId, e);
        }
    }

    /**
     * Checks whether a text is a plain non-negative decimal integer.
     *
     * @param text the text to check
     * @return {@code true} for one or more ASCII digits
     */
    public static boolean isNumeric(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Zone)) return false;
        return canonicalId.equals(((Zone) o).canonicalId);
    }

    @Override
    public int hashCode() {
        return canonicalId.hashCode();
    }

    @Override
    public String toString() {
        return displayName + " (" + canonicalId + ")";
    }
}
