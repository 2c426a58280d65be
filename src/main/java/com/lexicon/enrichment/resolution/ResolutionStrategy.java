package com.lexicon.enrichment.resolution;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One way of turning a freeform reference into a concept id. Strategies are pure reads.
 */
public interface ResolutionStrategy {

    String name();

    /**
     * @return the matched candidate form and concept id, or empty
     */
    Optional<Match> resolve(String term);

    /**
     * @param candidate the form that matched
     * @param conceptId the concept it matched
     */
    record Match(String candidate, String conceptId) {
    }

    static ResolutionStrategy of(String name, Function<String, Optional<Match>> function) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(function, "function is required");
        return new ResolutionStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<Match> resolve(String term) {
                return function.apply(term);
            }

            @Override
            public String toString() {
                return "ResolutionStrategy{" + name + "}";
            }
        };
    }
}
