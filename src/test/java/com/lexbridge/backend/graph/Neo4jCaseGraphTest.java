package com.lexbridge.backend.graph;

import org.junit.jupiter.api.Test;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Neo4jCaseGraphTest {

    @Test
    void events_shouldMapToRelationships() {
        List<String> merged = new ArrayList<>();
        Neo4jCaseGraph graph = new Neo4jCaseGraph(mock(Driver.class)) {
            @Override
            protected void mergeRelation(String fromLabel, String fromId, String relType, String toLabel, String toId) {
                merged.add(fromLabel + ":" + fromId + "-" + relType + "->" + toLabel + ":" + toId);
            }
        };

        graph.caseOpened("client-1", "case-1");
        graph.caseOffered("case-1", "adv-1");
        graph.caseDeclined("adv-1", "case-1");
        graph.caseAccepted("adv-2", "case-1");
        graph.caseOffered("case-1", null);

        assertThat(merged).containsExactly(
                "Client:client-1-OWNS->Case:case-1",
                "Case:case-1-OFFERED_TO->Advocate:adv-1",
                "Advocate:adv-1-DECLINED->Case:case-1",
                "Advocate:adv-2-REPRESENTS->Case:case-1");
    }

    @Test
    void events_shouldNotThrow_whenDatabaseUnreachable() {
        Driver driver = mock(Driver.class);
        when(driver.session()).thenThrow(new IllegalStateException("connection refused"));
        Neo4jCaseGraph graph = new Neo4jCaseGraph(driver);

        assertThatCode(() -> graph.caseOpened("client-1", "case-1")).doesNotThrowAnyException();
    }

    @Test
    void events_shouldNotThrow_whenWriteFails() {
        Driver driver = mock(Driver.class);
        Session session = mock(Session.class);
        when(driver.session()).thenReturn(session);
        when(session.executeWrite(any())).thenThrow(new IllegalStateException("leader lost"));
        Neo4jCaseGraph graph = new Neo4jCaseGraph(driver);

        assertThatCode(() -> graph.caseAccepted("adv-1", "case-1")).doesNotThrowAnyException();
    }
}
