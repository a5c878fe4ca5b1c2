package com.lexbridge.backend.graph;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.Values;

/**
 * Mirrors lifecycle events into Neo4j as
 * (Client)-[:OWNS]->(Case), (Case)-[:OFFERED_TO]->(Advocate),
 * (Advocate)-[:DECLINED]->(Case) and (Advocate)-[:REPRESENTS]->(Case).
 * Nodes and relationships are merged, so replaying an event is harmless.
 */
@Slf4j
public class Neo4jCaseGraph implements CaseGraph {

    private final Driver neo4jDriver;

    public Neo4jCaseGraph(Driver neo4jDriver) {
        this.neo4jDriver = neo4jDriver;
    }

    @Override
    public void caseOpened(String clientId, String caseId) {
        record("Client", clientId, "OWNS", "Case", caseId);
    }

    @Override
    public void caseOffered(String caseId, String advocateId) {
        record("Case", caseId, "OFFERED_TO", "Advocate", advocateId);
    }

    @Override
    public void caseDeclined(String advocateId, String caseId) {
        record("Advocate", advocateId, "DECLINED", "Case", caseId);
    }

    @Override
    public void caseAccepted(String advocateId, String caseId) {
        record("Advocate", advocateId, "REPRESENTS", "Case", caseId);
    }

    private void record(String fromLabel, String fromId, String relType, String toLabel, String toId) {
        if (fromId == null || toId == null) {
            return;
        }
        try {
            mergeRelation(fromLabel, fromId, relType, toLabel, toId);
        } catch (RuntimeException e) {
            log.warn("Could not record {}-[:{}]->{} for {} / {}", fromLabel, relType, toLabel, fromId, toId, e);
        }
    }

    /** Merge both nodes by id, then the relationship between them. */
    protected void mergeRelation(String fromLabel, String fromId, String relType, String toLabel, String toId) {
        try (Session session = neo4jDriver.session()) {
            session.executeWrite(tx -> {
                tx.run("""
                    MERGE (a:%s {id: $fromId})
                    MERGE (b:%s {id: $toId})
                    MERGE (a)-[r:%s]->(b)
                    """.formatted(fromLabel, toLabel, relType),
                    Values.parameters("fromId", fromId, "toId", toId));
                return null;
            });
        }
    }
}
