package me.christianrobert.mspgsync.core.tools;

import jakarta.enterprise.context.ApplicationScoped;

import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per target schema. DDL statements against the same schema are issued one at a
 * time; data loading does not take the lock.
 */
@ApplicationScoped
public class DdlLockRegistry {

    @FunctionalInterface
    public interface DdlAction {
        void execute() throws SQLException;
    }

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String schema) {
        return locks.computeIfAbsent(schema, s -> new ReentrantLock());
    }

    public void withSchemaLock(String schema, DdlAction action) throws SQLException {
        ReentrantLock lock = lockFor(schema);
        lock.lock();
        try {
            action.execute();
        } finally {
            lock.unlock();
        }
    }
}
