package com.lexicon.enrichment.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A group of lexical records judged to describe the same phrase.
 * The first record seen becomes the primary; the others are its duplicates.
 */
public record Cluster(LexicalRecord primary, List<LexicalRecord> duplicates) {

    public static final String EXPLANATION_SEPARATOR = " ++ ";

    public Cluster {
        Objects.requireNonNull(primary, "primary is required");
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
    }

    public String representativeKey() {
        return primary.normalizedKey();
    }

    public List<LexicalRecord> members() {
        List<LexicalRecord> members = new ArrayList<>(duplicates.size() + 1);
        members.add(primary);
        members.addAll(duplicates);
        return members;
    }

    public List<String> memberIds() {
        return members().stream().map(LexicalRecord::id).toList();
    }

    /**
     * All non-blank explanations of the cluster in member order, joined by {@value #EXPLANATION_SEPARATOR}.
     */
    public String mergedExplanation() {
        return Stream.concat(Stream.of(primary), duplicates.stream())
                .map(LexicalRecord::explanation)
                .filter(e -> e != null && !e.isBlank())
                .map(String::trim)
                .collect(Collectors.joining(EXPLANATION_SEPARATOR));
    }

    public int size() {
        return duplicates.size() + 1;
    }
}
