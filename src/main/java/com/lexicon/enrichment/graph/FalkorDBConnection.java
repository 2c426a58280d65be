package com.lexicon.enrichment.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * FalkorDB implementation using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\w+)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("falkordb.ping_failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("falkordb.indexes.create graph={}", graphName);

        safeExecute("CREATE INDEX FOR (w:WorkItem) ON (w.id)");
        safeExecute("CREATE INDEX FOR (w:WorkItem) ON (w.status)");
        safeExecute("CREATE INDEX FOR (w:WorkItem) ON (w.parentId)");

        safeExecute("CREATE INDEX FOR (c:Concept) ON (c.id)");
        safeExecute("CREATE INDEX FOR (c:Concept) ON (c.label)");
        safeExecute("CREATE INDEX FOR (c:Concept) ON (c.naturalKey)");

        safeExecute("CREATE INDEX FOR (t:Term) ON (t.text)");
        safeExecute("CREATE INDEX FOR (t:Term) ON (t.normalizedText)");

        safeExecute("CREATE INDEX FOR (h:Highlight) ON (h.key)");
        safeExecute("CREATE INDEX FOR (r:Translation) ON (r.workItemId)");
        safeExecute("CREATE INDEX FOR (l:LexicalRecord) ON (l.id)");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $name} placeholders with literal values in a single pass.
     * Inlined values are never scanned again; placeholders without a parameter are left as written.
     */
    static String processParams(String query, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? formatValue(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            // keys are property names written by our own statements
            return map.entrySet().stream()
                    .map(e -> e.getKey() + ": " + formatValue(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("falkordb.closed graph={}", graphName);
    }
}
