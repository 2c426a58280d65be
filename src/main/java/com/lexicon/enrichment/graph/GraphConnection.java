package com.lexicon.enrichment.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph store holding the ledger and the knowledge base.
 * Statements are independent; the store offers no cross-statement transactions.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params statement parameters, referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query
     * @param params query parameters, referenced as {@code $name}
     * @return result rows keyed by column alias
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the lookup indexes used by the pipeline if they do not exist.
     */
    void createIndexes();

    @Override
    void close();
}
