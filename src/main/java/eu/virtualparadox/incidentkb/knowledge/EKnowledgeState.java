package eu.virtualparadox.incidentkb.knowledge;

public enum EKnowledgeState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    DEGRADED;

    /**
     * Whether queries are served in this state.
     */
    public boolean isServing() {
        return this == READY || this == DEGRADED;
    }
}
