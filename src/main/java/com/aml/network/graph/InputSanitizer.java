package com.aml.network.graph;

import com.aml.network.core.InvalidRequestException;

/**
 * Validation for values that end up inside store queries.
 */
public final class InputSanitizer {

    /** Maximum allowed length for entity and relationship ids. */
    public static final int MAX_ID_LENGTH = 256;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates an entity id. Rejects null, blank, overly long, or control-character-containing ids.
     *
     * @param fieldName name used in the error message
     * @param entityId  the id to validate
     * @throws InvalidRequestException if the id is invalid
     */
    public static void validateEntityId(String fieldName, String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new InvalidRequestException(fieldName + " must not be null or blank");
        }
        if (entityId.length() > MAX_ID_LENGTH) {
            throw new InvalidRequestException(fieldName + " exceeds maximum length of "
                    + MAX_ID_LENGTH + " characters (was " + entityId.length() + ")");
        }
        if (containsControlCharacters(entityId)) {
            throw new InvalidRequestException(fieldName + " must not contain control characters");
        }
    }

    /**
     * Validates an integer parameter against an inclusive range.
     */
    public static void validateRange(String fieldName, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidRequestException(fieldName + " must be between " + min + " and " + max
                    + " (was " + value + ")");
        }
    }

    /**
     * Validates a fractional parameter against the inclusive [0, 1] range.
     */
    public static void validateUnitInterval(String fieldName, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidRequestException(fieldName + " must be between 0 and 1 (was " + value + ")");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
