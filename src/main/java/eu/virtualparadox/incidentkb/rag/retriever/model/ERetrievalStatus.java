package eu.virtualparadox.incidentkb.rag.retriever.model;

public enum ERetrievalStatus {
    OK,
    DEGRADED
}
