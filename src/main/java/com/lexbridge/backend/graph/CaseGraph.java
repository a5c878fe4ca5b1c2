package com.lexbridge.backend.graph;

/**
 * Relationship view of the case lifecycle, kept next to the document store for
 * traversal queries. Recording is best-effort: implementations must not throw.
 */
public interface CaseGraph {

    void caseOpened(String clientId, String caseId);

    void caseOffered(String caseId, String advocateId);

    void caseDeclined(String advocateId, String caseId);

    void caseAccepted(String advocateId, String caseId);

    /** Used when recording is switched off. */
    CaseGraph NOOP = new CaseGraph() {
        @Override
        public void caseOpened(String clientId, String caseId) {
        }

        @Override
        public void caseOffered(String caseId, String advocateId) {
        }

        @Override
        public void caseDeclined(String advocateId, String caseId) {
        }

        @Override
        public void caseAccepted(String advocateId, String caseId) {
        }
    };
}
