package eu.virtualparadox.incidentkb.rag.index;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One writer lock per collection name. Readers never take these locks.
 */
final class CollectionLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    ReentrantLock forCollection(final String collection) {
        return locks.computeIfAbsent(collection, c -> new ReentrantLock());
    }
}
