package com.wifi.emitter.positioning.cache;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.EmitterRow;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.emitter.EmitterRecord;
import com.wifi.emitter.positioning.emitter.SyncAction;
import com.wifi.emitter.positioning.exception.EmitterPersistenceException;
import com.wifi.emitter.positioning.repository.EmitterRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bounded working set of emitter records in front of the {@link EmitterRepository}.
 *
 * <p>Records are loaded in batches before use, handed out by {@link #get}, and written back by
 * {@link #sync()} in one transaction. Records not used for {@code maxAge} syncs are evicted once
 * they are clean. If the working set still exceeds {@code maxWorkingSetSize} after a sync, it is
 * cleared outright; dirty records have been flushed by then.
 *
 * <p>Every operation holds the cache lock, including the repository calls it makes. Once
 * {@link #close()} has run, loads and syncs do nothing and {@link #get} returns null.
 */
@Slf4j
@Component
public class EmitterCache {

    private final Object lock = new Object();
    private final Map<String, EmitterRecord> workingSet = new HashMap<>();

    private final EmitterRepository repository;
    private final int maxAge;
    private final int maxWorkingSetSize;
    private boolean closed;

    public EmitterCache(EmitterRepository repository, PositioningProperties properties) {
        this.repository = repository;
        this.maxAge = properties.getCache().getMaxAge();
        this.maxWorkingSetSize = properties.getCache().getMaxWorkingSetSize();
    }

    /**
     * Makes sure every id has a resident record. Ids not yet resident are read with a single
     * repository query; ids the store does not know become UNKNOWN records.
     *
     * @param identifications emitters about to be used
     * @throws EmitterPersistenceException if the store cannot be read
     */
    public void batchLoad(Collection<RfIdentification> identifications) {
        synchronized (lock) {
            if (closed) {
                log.debug("batchLoad() - cache closed, ignoring {} emitters", identifications.size());
                return;
            }
            List<RfIdentification> toLoad = new ArrayList<>();
            for (RfIdentification id : identifications) {
                if (!workingSet.containsKey(id.uniqueKey())) {
                    toLoad.add(id);
                }
            }
            if (toLoad.isEmpty()) {
                return;
            }

            Map<String, EmitterRow> rows = repository.load(toLoad);
            int unknown = 0;
            for (RfIdentification id : toLoad) {
                EmitterRow row = rows.get(id.uniqueKey());
                EmitterRecord emitterRecord;
                if (row == null) {
                    emitterRecord = new EmitterRecord(id);
                    unknown++;
                } else {
                    emitterRecord = EmitterRecord.fromRow(row);
                }
                workingSet.put(id.uniqueKey(), emitterRecord);
            }
            log.debug("batchLoad() - {} requested, {} loaded, {} unknown",
                    identifications.size(), toLoad.size() - unknown, unknown);
        }
    }

    /**
     * Returns the resident record, creating an UNKNOWN one on a miss. Never reads the store, so
     * callers that want persisted coverage call {@link #batchLoad} first. Resets the record's age.
     *
     * @param identification emitter to look up
     * @return the resident record, null for a null id or a closed cache
     */
    public EmitterRecord get(RfIdentification identification) {
        if (identification == null) {
            return null;
        }
        synchronized (lock) {
            if (closed) {
                return null;
            }
            EmitterRecord emitterRecord = workingSet.computeIfAbsent(
                    identification.uniqueKey(), key -> new EmitterRecord(identification));
            emitterRecord.resetAge();
            return emitterRecord;
        }
    }

    /**
     * Returns the resident record without creating one or touching its age.
     *
     * @param identification emitter to look up
     * @return the record if resident
     */
    public Optional<EmitterRecord> peek(RfIdentification identification) {
        synchronized (lock) {
            return Optional.ofNullable(workingSet.get(identification.uniqueKey()));
        }
    }

    public int size() {
        synchronized (lock) {
            return workingSet.size();
        }
    }

    /**
     * Ages every record, flushes dirty records in one transaction and evicts aged-out clean ones.
     * If the flush fails, the transaction is cancelled, no record is changed, and the dirty records
     * stay resident for the next sync.
     */
    public void sync() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            List<EmitterRecord> agedOut = new ArrayList<>();
            Set<EmitterRecord> dirty = new LinkedHashSet<>();
            List<EmitterRecord.SyncPlan> plans = new ArrayList<>();

            for (EmitterRecord emitterRecord : workingSet.values()) {
                emitterRecord.incrementAge();
                if (emitterRecord.getAge() >= maxAge) {
                    agedOut.add(emitterRecord);
                }
                if (emitterRecord.syncNeeded()) {
                    EmitterRecord.SyncPlan plan = emitterRecord.planSync();
                    if (plan.action() != SyncAction.NONE) {
                        dirty.add(emitterRecord);
                        plans.add(plan);
                    }
                }
            }

            boolean flushed = dirty.isEmpty() || flush(dirty, plans);

            int evicted = 0;
            for (EmitterRecord emitterRecord : agedOut) {
                if (!flushed && dirty.contains(emitterRecord)) {
                    continue;
                }
                workingSet.remove(emitterRecord.getIdentification().uniqueKey());
                evicted++;
            }

            if (workingSet.size() > maxWorkingSetSize) {
                log.debug("sync() - working set {} above {}, clearing", workingSet.size(), maxWorkingSetSize);
                if (flushed) {
                    workingSet.clear();
                } else {
                    workingSet.values().removeIf(emitterRecord -> !dirty.contains(emitterRecord));
                }
            }
            log.debug("sync() - {} written, {} evicted, {} resident",
                    flushed ? dirty.size() : 0, evicted, workingSet.size());
        }
    }

    private boolean flush(Set<EmitterRecord> dirty, List<EmitterRecord.SyncPlan> plans) {
        try {
            repository.beginTransaction();
            for (EmitterRecord.SyncPlan plan : plans) {
                switch (plan.action()) {
                    case INSERT -> repository.insert(plan.row());
                    case UPDATE -> repository.update(plan.row());
                    case INVALIDATE -> repository.invalidate(plan.row());
                    case DROP -> repository.drop(plan.row());
                    case NONE -> { }
                }
            }
            repository.endTransaction();
        } catch (RuntimeException e) {
            log.error("sync() - flush of {} emitters failed, keeping them for the next sync", dirty.size(), e);
            repository.cancelTransaction();
            return false;
        }

        int i = 0;
        for (EmitterRecord emitterRecord : dirty) {
            emitterRecord.completeSync(plans.get(i++).action());
        }
        return true;
    }

    /**
     * Flushes, empties the working set and closes the store. Calling it again does nothing.
     */
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            sync();
            closed = true;
            workingSet.clear();
            repository.close();
            log.info("Emitter cache closed");
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }
}
