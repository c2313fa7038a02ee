package eu.virtualparadox.incidentkb.knowledge.stats;

import eu.virtualparadox.incidentkb.knowledge.EKnowledgeState;
import eu.virtualparadox.incidentkb.rag.index.model.IndexStats;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalStats;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Merged statistics of the knowledge base.
 *
 * @param state              orchestrator state
 * @param documentsLoaded    documents read during the last build (0 when a snapshot was reused)
 * @param chunksCreated      chunks indexed, or records found in a reused snapshot
 * @param initializationTime duration of the last successful initialization, {@code null} if none
 * @param retrievalCalls     searches served by the orchestrator
 * @param lastSearch         the most recent search, {@code null} if none
 * @param snapshotReused     whether the last initialization reused a persisted snapshot
 * @param docsPath           source-document directory
 * @param indexPath          index root directory
 * @param index              vector index statistics
 * @param retriever          retriever statistics
 * @param lastError          message of the last initialization failure, {@code null} if none
 */
public record KnowledgeStats(EKnowledgeState state,
                             int documentsLoaded,
                             int chunksCreated,
                             Duration initializationTime,
                             long retrievalCalls,
                             LastSearch lastSearch,
                             boolean snapshotReused,
                             Path docsPath,
                             Path indexPath,
                             IndexStats index,
                             RetrievalStats retriever,
                             String lastError) {
}
