package com.lexicon.enrichment.graph;

/**
 * Validation for values that end up inlined in Cypher statements.
 */
public final class InputSanitizer {

    /** Maximum length of a term, label or key phrase. */
    public static final int MAX_TERM_LENGTH = 1000;

    /** Maximum length of any other string value, such as a sentence or an explanation. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 20_000;

    private InputSanitizer() {
    }

    /**
     * Rejects null, blank, overly long or control-character-containing terms.
     *
     * @throws IllegalArgumentException if the term is invalid
     */
    public static void validateTerm(String term) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Term must not be null or blank");
        }
        if (term.length() > MAX_TERM_LENGTH) {
            throw new IllegalArgumentException(
                    "Term exceeds maximum length of " + MAX_TERM_LENGTH + " characters (was " + term.length() + ")");
        }
        if (containsControlCharacters(term)) {
            throw new IllegalArgumentException("Term must not contain control characters");
        }
    }

    /**
     * Relation types are stored as a property; they are restricted to letters, digits and underscores.
     */
    public static void validateRelationType(String relationType) {
        if (relationType == null || relationType.isBlank()) {
            throw new IllegalArgumentException("Relation type must not be null or blank");
        }
        if (!relationType.matches("^[\\p{L}0-9_]+$")) {
            throw new IllegalArgumentException(
                    "Relation type must contain only letters, digits and underscores, got: '" + relationType + "'");
        }
    }

    /**
     * @throws IllegalArgumentException if the value exceeds {@link #MAX_CYPHER_VALUE_LENGTH}
     */
    public static void sanitizeForCypher(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
