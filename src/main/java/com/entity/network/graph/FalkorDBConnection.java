package com.entity.network.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} over a FalkorDB graph through the JFalkorDB client. All scopes
 * share one graph and are told apart by the {@code scopeId} property.
 */
public class FalkorDBConnection implements GraphConnection {

    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    /** Scope filters come first in every query; id and type narrow lookups inside a scope. */
    static final List<String> INDEXES = List.of(
            "CREATE INDEX FOR (e:Entity) ON (e.scopeId)",
            "CREATE INDEX FOR (e:Entity) ON (e.id)",
            "CREATE INDEX FOR (e:Entity) ON (e.type)",
            "CREATE INDEX FOR ()-[r:RELATES]-() ON (r.type)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected graph={} host={} port={}", graphName, host, port);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String cypher = CypherLiterals.inline(query, params);
        log.debug("cypher.execute graph={} query={}", graphName, cypher);
        graph.query(cypher);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String cypher = CypherLiterals.inline(query, params);
        ResultSet resultSet = graph.query(cypher);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String column : record.keys()) {
                row.put(column, record.getValue(column));
            }
            rows.add(row);
        }
        log.debug("cypher.query graph={} rows={} query={}", graphName, rows.size(), cypher);
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("falkordb.ping.failed graph={}", graphName, e);
            return false;
        }
    }

    @Override
    public void createIndexes() {
        int created = 0;
        for (String statement : INDEXES) {
            try {
                graph.query(statement);
                created++;
            } catch (RuntimeException e) {
                // FalkorDB rejects an index that already exists
                log.debug("falkordb.index.skipped graph={} statement={} reason={}",
                        graphName, statement, e.getMessage());
            }
        }
        log.info("falkordb.indexes.ready graph={} created={} total={}", graphName, created, INDEXES.size());
    }

    @Override
    public void close() {
        try {
            driver.close();
            log.info("falkordb.closed graph={}", graphName);
        } catch (Exception e) {
            log.warn("falkordb.close.failed graph={}", graphName, e);
        }
    }
}
