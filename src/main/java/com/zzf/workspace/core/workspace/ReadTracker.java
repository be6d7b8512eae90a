package com.zzf.workspace.core.workspace;

import com.zzf.workspace.core.workspace.error.ReadRequiredException;
import com.zzf.workspace.core.workspace.error.StaleReadException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers, per operation, the version of every path it has read, so a later write in
 * the same operation can be refused when the file moved underneath it.
 * <p>
 * Operations are kept in access order and evicted when idle for longer than
 * {@code idleTtl} or when more than {@code maxOperations} are tracked. Distinct
 * operations never share an entry; concurrent calls inside one operation on the same
 * path are the caller's to serialize.
 */
@Slf4j
public final class ReadTracker {

    @FunctionalInterface
    public interface VersionLookup {
        /**
         * Current version of the path, empty if it does not exist.
         */
        Optional<ReadVersion> current(String workspacePath);
    }

    private final VersionLookup versions;
    private final int maxOperations;
    private final long idleTtlMillis;
    private final Clock clock;
    private final LinkedHashMap<OperationKey, OperationReads> operations = new LinkedHashMap<>(16, 0.75f, true);

    public ReadTracker(VersionLookup versions, int maxOperations, Duration idleTtl, Clock clock) {
        if (versions == null) {
            throw new IllegalArgumentException("versions is null");
        }
        this.versions = versions;
        this.maxOperations = Math.max(1, maxOperations);
        this.idleTtlMillis = idleTtl == null || idleTtl.isNegative() || idleTtl.isZero() ? Long.MAX_VALUE : idleTtl.toMillis();
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public void recordRead(OperationKey operationKey, String workspacePath) {
        Optional<ReadVersion> version = versions.current(workspacePath);
        if (version.isEmpty()) {
            return;
        }
        synchronized (operations) {
            evictExpired();
            OperationReads reads = operations.computeIfAbsent(operationKey, k -> new OperationReads());
            reads.touch(clock.millis());
            reads.paths.put(workspacePath, version.get());
            evictOverflow();
        }
    }

    public void assertReadBeforeWrite(OperationKey operationKey, String workspacePath) {
        ReadVersion prior = lookup(operationKey, workspacePath);
        if (prior == null) {
            throw new ReadRequiredException(workspacePath);
        }
        Optional<ReadVersion> current = versions.current(workspacePath);
        if (current.isEmpty()) {
            throw new StaleReadException(workspacePath, true);
        }
        if (prior.getModifiedAtNanos() != current.get().getModifiedAtNanos()
                || prior.getSizeBytes() != current.get().getSizeBytes()) {
            log.info("read.stale op={} path={} prior={} current={}", operationKey, workspacePath, prior, current.get());
            throw new StaleReadException(workspacePath, false);
        }
    }

    /**
     * Re-baselines a path the operation itself just wrote. No-op when it never read it.
     */
    public void refreshAfterWrite(OperationKey operationKey, String workspacePath) {
        synchronized (operations) {
            OperationReads reads = operations.get(operationKey);
            if (reads == null || !reads.paths.containsKey(workspacePath)) {
                return;
            }
        }
        Optional<ReadVersion> version = versions.current(workspacePath);
        synchronized (operations) {
            OperationReads reads = operations.get(operationKey);
            if (reads == null) {
                return;
            }
            if (version.isPresent()) {
                reads.paths.put(workspacePath, version.get());
            } else {
                reads.paths.remove(workspacePath);
            }
        }
    }

    public int trackedOperations() {
        synchronized (operations) {
            evictExpired();
            return operations.size();
        }
    }

    public void clear() {
        synchronized (operations) {
            operations.clear();
        }
    }

    private ReadVersion lookup(OperationKey operationKey, String workspacePath) {
        synchronized (operations) {
            evictExpired();
            OperationReads reads = operations.get(operationKey);
            if (reads == null) {
                return null;
            }
            reads.touch(clock.millis());
            return reads.paths.get(workspacePath);
        }
    }

    private void evictExpired() {
        if (idleTtlMillis == Long.MAX_VALUE) {
            return;
        }
        long now = clock.millis();
        Iterator<Map.Entry<OperationKey, OperationReads>> it = operations.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<OperationKey, OperationReads> entry = it.next();
            if (now - entry.getValue().lastAccessMillis > idleTtlMillis) {
                log.debug("read.evict op={} reason=idle", entry.getKey());
                it.remove();
            }
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<OperationKey, OperationReads>> it = operations.entrySet().iterator();
        while (operations.size() > maxOperations && it.hasNext()) {
            Map.Entry<OperationKey, OperationReads> eldest = it.next();
            log.debug("read.evict op={} reason=capacity", eldest.getKey());
            it.remove();
        }
    }

    /**
     * Guarded by {@code operations}.
     */
    private static final class OperationReads {
        private final Map<String, ReadVersion> paths = new HashMap<>();
        private long lastAccessMillis;

        private void touch(long now) {
            lastAccessMillis = now;
        }
    }
}
