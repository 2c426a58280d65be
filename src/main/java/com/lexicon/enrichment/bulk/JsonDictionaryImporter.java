package com.lexicon.enrichment.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.knowledge.ConceptRepository;
import com.lexicon.enrichment.ledger.JobLedger;
import com.lexicon.enrichment.oracle.JsonPayloads;
import com.lexicon.enrichment.resolution.ResolutionCascade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Imports a structured dictionary file (a JSON array of {@link DictionaryEntry}) in two passes.
 *
 * <p>Pass 1 upserts one concept per entry, links its terms, and enqueues its usage examples as
 * {@link WorkItemKind#DICTIONARY_EXAMPLE} work items. Pass 2 resolves the entry's relations through the
 * cascade, so references to headwords that appear later in the file still resolve. Entries without a
 * headword are skipped and reported.</p>
 */
public class JsonDictionaryImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonDictionaryImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ConceptRepository concepts;
    private final JobLedger ledger;
    private final ResolutionCascade cascade;
    private final ObjectMapper objectMapper;

    public JsonDictionaryImporter(ConceptRepository concepts, JobLedger ledger, ResolutionCascade cascade) {
        this(concepts, ledger, cascade, new ObjectMapper());
    }

    public JsonDictionaryImporter(ConceptRepository concepts, JobLedger ledger, ResolutionCascade cascade,
                                  ObjectMapper objectMapper) {
        this.concepts = Objects.requireNonNull(concepts, "concepts is required");
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.cascade = Objects.requireNonNull(cascade, "cascade is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    public ImportResult importEntries(InputStream input, String sourceName, ProgressCallback callback) {
        return importEntries(new InputStreamReader(input, StandardCharsets.UTF_8), sourceName, callback);
    }

    public ImportResult importEntries(Reader reader, String sourceName, ProgressCallback callback) {
        List<ImportResult.ImportError> errors = new ArrayList<>();
        List<DictionaryEntry> entries;
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            StringBuilder content = new StringBuilder();
            String line;
            while ((line = br.readLine()) != null) {
                content.append(line).append('\n');
            }
            entries = parse(content.toString());
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
            return new ImportResult(0, 0, 0, 0, 0, 0, errors);
        } catch (IllegalArgumentException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", e.getMessage()));
            return new ImportResult(0, 0, 0, 0, 0, 0, errors);
        }
        return importEntries(entries, sourceName, callback, errors);
    }

    public ImportResult importEntries(List<DictionaryEntry> entries, String sourceName, ProgressCallback callback) {
        return importEntries(entries, sourceName, callback, new ArrayList<>());
    }

    private ImportResult importEntries(List<DictionaryEntry> entries, String sourceName, ProgressCallback callback,
                                       List<ImportResult.ImportError> errors) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long total = entries.size();
        long conceptsUpserted = 0;
        long termsLinked = 0;
        long examplesEnqueued = 0;

        log.info("import.started source={} entries={}", sourceName, total);
        Map<Integer, String> conceptIds = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            DictionaryEntry entry = entries.get(i);
            long entryNumber = i + 1L;
            if (entry.headword() == null || entry.headword().isBlank()) {
                errors.add(new ImportResult.ImportError(entryNumber, "", "Entry has no headword"));
                log.warn("import.entry_skipped entry={} reason=no headword", entryNumber);
                continue;
            }
            try {
                Concept concept = concepts.upsert(Concept.builder()
                        .label(entry.headword().trim())
                        .partOfSpeech(entry.partOfSpeech())
                        .definition(entry.germanDefinition())
                        .senseId(entry.senseId())
                        .notes(entry.usageNotes().isEmpty() ? null : String.join("; ", entry.usageNotes()))
                        .build());
                conceptIds.put(i, concept.getId());
                conceptsUpserted++;

                concepts.linkTerm(new TermLink(entry.headword().trim(), Language.CANONICAL, concept.getId(),
                        null, null, null, null, null, sourceName));
                termsLinked++;
                for (DictionaryEntry.Translation translation : entry.translations()) {
                    if (translation.term() == null || translation.term().isBlank()) {
                        continue;
                    }
                    concepts.linkTerm(new TermLink(translation.term(), Language.SOURCE, concept.getId(),
                            translation.pronunciation(), translation.gender(), translation.plural(),
                            translation.etymology(), translation.note(), sourceName));
                    termsLinked++;
                }
                examplesEnqueued += ledger.enqueue(examples(entry, concept.getId()));
            } catch (RuntimeException e) {
                errors.add(new ImportResult.ImportError(entryNumber, entry.headword(), e.getMessage()));
                log.warn("import.error entry={} headword='{}' error={}", entryNumber, entry.headword(), e.getMessage());
            }
            if (entryNumber % PROGRESS_INTERVAL == 0) {
                cb.onProgress(entryNumber, total * 2, "Pass 1: processed " + entryNumber + " entries");
            }
        }

        // concepts changed, cached misses are stale
        cascade.invalidate();

        long relationsCreated = 0;
        long relationsUnresolved = 0;
        for (int i = 0; i < entries.size(); i++) {
            String sourceId = conceptIds.get(i);
            DictionaryEntry entry = entries.get(i);
            if (sourceId == null || entry.relations().isEmpty()) {
                continue;
            }
            for (DictionaryEntry.RelationEntry relation : entry.relations()) {
                String type = Relation.normalizeType(relation.type());
                if (relation.targetTerm() == null || relation.targetTerm().isBlank() || type == null) {
                    errors.add(new ImportResult.ImportError(i + 1L, entry.headword(),
                            "Relation without target term or type"));
                    continue;
                }
                Optional<String> targetId = cascade.resolve(relation.targetTerm());
                if (targetId.isEmpty()) {
                    relationsUnresolved++;
                    log.warn("import.relation_unresolved source='{}' target='{}'", entry.headword(), relation.targetTerm());
                    continue;
                }
                if (targetId.get().equals(sourceId)) {
                    continue;
                }
                try {
                    if (concepts.createRelation(Relation.builder()
                            .sourceConceptId(sourceId)
                            .targetConceptId(targetId.get())
                            .type(type)
                            .note(relation.note())
                            .origin(sourceName)
                            .build())) {
                        relationsCreated++;
                    }
                } catch (RuntimeException e) {
                    errors.add(new ImportResult.ImportError(i + 1L, entry.headword(), e.getMessage()));
                    log.warn("import.relation_error source='{}' target='{}' error={}",
                            entry.headword(), relation.targetTerm(), e.getMessage());
                }
            }
            if ((i + 1L) % PROGRESS_INTERVAL == 0) {
                cb.onProgress(total + i + 1L, total * 2, "Pass 2: processed " + (i + 1) + " entries");
            }
        }

        ImportResult result = new ImportResult(total, conceptsUpserted, termsLinked, examplesEnqueued,
                relationsCreated, relationsUnresolved, errors);
        cb.onProgress(total * 2, total * 2, "Import completed");
        log.info("import.completed source={} result={}", sourceName, result);
        return result;
    }

    /**
     * Work items for the usage examples of one entry. Ids are derived from the concept and the example,
     * so importing the same file twice enqueues nothing new.
     */
    List<WorkItem> examples(DictionaryEntry entry, String conceptId) {
        List<WorkItem> items = new ArrayList<>();
        int sequence = 0;
        for (DictionaryEntry.Example example : entry.examples()) {
            if (example.halunder() == null || example.halunder().isBlank()) {
                log.debug("import.example_skipped headword='{}' reason=no source text", entry.headword());
                continue;
            }
            sequence++;
            String key = conceptId + "|" + example.halunder().trim();
            items.add(WorkItem.builder()
                    .id(UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString())
                    .sourceText(example.halunder().trim())
                    .targetHint(example.german())
                    .note(example.note())
                    .parentId(conceptId)
                    .sequenceNumber(sequence)
                    .kind(WorkItemKind.DICTIONARY_EXAMPLE)
                    .build());
        }
        return items;
    }

    List<DictionaryEntry> parse(String content) {
        try {
            JsonNode root = objectMapper.readTree(JsonPayloads.stripCodeFences(content));
            JsonNode array = root != null && root.isObject() ? root.path("entries") : root;
            if (array == null || !array.isArray()) {
                throw new IllegalArgumentException("Dictionary file must contain a JSON array of entries");
            }
            List<DictionaryEntry> entries = new ArrayList<>(array.size());
            for (JsonNode node : array) {
                entries.add(objectMapper.treeToValue(node, DictionaryEntry.class));
            }
            return entries;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid dictionary JSON: " + e.getOriginalMessage(), e);
        }
    }
}
