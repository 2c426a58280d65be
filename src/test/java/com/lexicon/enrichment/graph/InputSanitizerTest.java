package com.lexicon.enrichment.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputSanitizer Tests")
class InputSanitizerTest {

    @Nested
    @DisplayName("Terms")
    class Terms {

        @Test
        @DisplayName("Should accept ordinary terms with apostrophes and umlauts")
        void acceptsTerms() {
            assertDoesNotThrow(() -> InputSanitizer.validateTerm("wat'n Wedder"));
            assertDoesNotThrow(() -> InputSanitizer.validateTerm("Hüs\tHof"));
        }

        @Test
        @DisplayName("Should reject null and blank terms")
        void rejectsBlank() {
            assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateTerm(null));
            assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateTerm("   "));
        }

        @Test
        @DisplayName("Should reject control characters")
        void rejectsControlCharacters() {
            assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateTerm("Hus\u0000"));
            assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateTerm("Hus\u007F"));
        }

        @Test
        @DisplayName("Should reject terms over the maximum length")
        void rejectsLongTerms() {
            String ok = "a".repeat(InputSanitizer.MAX_TERM_LENGTH);
            assertDoesNotThrow(() -> InputSanitizer.validateTerm(ok));
            assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateTerm(ok + "a"));
        }
    }

    @Nested
    @DisplayName("Relation types")
    class RelationTypes {

        @ParameterizedTest
        @ValueSource(strings = {"synonym", "SEE_ALSO", "gegensätzlich", "type2"})
        @DisplayName("Should accept letters, digits and underscores")
        void accepts(String type) {
            assertDoesNotThrow(() -> InputSanitizer.validateRelationType(type));
        }

        @ParameterizedTest
        @ValueSource(strings = {"see also", "a-b", "x'}) DETACH DELETE n //", ""})
        @DisplayName("Should reject anything else")
        void rejects(String type) {
            assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationType(type));
        }
    }

    @Test
    @DisplayName("Should bound free-text values")
    void boundsValues() {
        assertDoesNotThrow(() -> InputSanitizer.sanitizeForCypher(null));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.sanitizeForCypher("x".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH + 1)));
    }
}
