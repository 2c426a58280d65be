package com.lexicon.enrichment.bulk;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.core.model.TranslationRecord;
import com.lexicon.enrichment.knowledge.HighlightRepository;
import com.lexicon.enrichment.knowledge.TranslationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Streams translation records and highlights to CSV using paginated reads.
 *
 * <pre>
 * # TRANSLATIONS
 * workItemId,variant,cleanedText,translation,confidence,notes
 * # HIGHLIGHTS
 * keyTerm,gloss,explanation,category,relevance,tags,sourceTable,sourceIds
 * </pre>
 * List values are joined with {@code |}.
 */
public class CsvExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvExporter.class);
    static final int PAGE_SIZE = 500;

    private final TranslationRepository translations;
    private final HighlightRepository highlights;

    public CsvExporter(TranslationRepository translations, HighlightRepository highlights) {
        this.translations = Objects.requireNonNull(translations, "translations is required");
        this.highlights = Objects.requireNonNull(highlights, "highlights is required");
    }

    public ExportResult export(OutputStream output, ProgressCallback callback) throws IOException {
        Writer writer = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        ExportResult result = export(writer, callback);
        writer.flush();
        return result;
    }

    public ExportResult export(Writer writer, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));

        pw.println("# TRANSLATIONS");
        pw.println("workItemId,variant,cleanedText,translation,confidence,notes");
        long translationCount = 0;
        PageRequest request = PageRequest.first(PAGE_SIZE);
        while (true) {
            Page<TranslationRecord> page = translations.findAll(request);
            for (TranslationRecord record : page.content()) {
                pw.printf(Locale.ROOT, "%s,%s,%s,%s,%.2f,%s%n",
                        csvEscape(record.workItemId()),
                        csvEscape(record.variant()),
                        csvEscape(record.cleanedText()),
                        csvEscape(record.translation()),
                        record.confidence(),
                        csvEscape(record.notes()));
                translationCount++;
            }
            cb.onProgress(translationCount, -1, "Exported " + translationCount + " translations");
            if (!page.hasNext()) {
                break;
            }
            request = request.next();
        }

        pw.println();
        pw.println("# HIGHLIGHTS");
        pw.println("keyTerm,gloss,explanation,category,relevance,tags,sourceTable,sourceIds");
        long highlightCount = 0;
        request = PageRequest.first(PAGE_SIZE);
        while (true) {
            Page<Highlight> page = highlights.findAll(request);
            for (Highlight highlight : page.content()) {
                pw.printf("%s,%s,%s,%s,%d,%s,%s,%s%n",
                        csvEscape(highlight.keyTerm()),
                        csvEscape(highlight.gloss()),
                        csvEscape(highlight.explanation()),
                        csvEscape(highlight.category()),
                        highlight.relevance(),
                        csvEscape(String.join("|", highlight.tags())),
                        csvEscape(highlight.sourceTable()),
                        csvEscape(String.join("|", highlight.sourceIds())));
                highlightCount++;
            }
            cb.onProgress(translationCount + highlightCount, -1, "Exported " + highlightCount + " highlights");
            if (!page.hasNext()) {
                break;
            }
            request = request.next();
        }

        pw.flush();
        if (pw.checkError()) {
            throw new IOException("Writing the CSV export failed");
        }
        ExportResult result = new ExportResult(translationCount, highlightCount);
        cb.onProgress(translationCount + highlightCount, translationCount + highlightCount, "Export completed");
        log.info("export.completed result={}", result);
        return result;
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
