package com.p14n.pgtopics.maintenance;

import com.p14n.pgtopics.broker.AsyncExecutor;
import com.p14n.pgtopics.data.PubSubConfig;
import com.p14n.pgtopics.db.EventStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep returning stuck events to pending and deleting expired dead
 * letters.
 *
 * <p>
 * An event is stuck when the process that claimed it died or hung before
 * reporting an outcome. Only the topics registered here are swept, so each
 * process recovers the topics it serves.
 * </p>
 */
public class MaintenanceService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceService.class);

    private final EventStore store;
    private final AsyncExecutor executor;
    private final Duration period;
    private final Duration stuckThreshold;
    private final int batchSize;
    private final Map<Long, String> topics = new ConcurrentHashMap<>();
    private ScheduledFuture<?> future;

    public MaintenanceService(EventStore store, AsyncExecutor executor, PubSubConfig config) {
        this.store = store;
        this.executor = executor;
        this.period = config.maintenancePeriod();
        this.stuckThreshold = config.stuckThreshold();
        this.batchSize = config.stuckBatchSize();
    }

    public void register(long topicId, String name) {
        topics.put(topicId, name);
    }

    public void unregister(long topicId) {
        topics.remove(topicId);
    }

    public boolean isRegistered(long topicId) {
        return topics.containsKey(topicId);
    }

    public synchronized void start() {
        if (future != null) {
            throw new IllegalStateException("Maintenance already started");
        }
        long millis = period.toMillis();
        future = executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        logger.atInfo().log("Maintenance scheduled every {}", period);
    }

    /**
     * Runs one sweep. Failures are logged per topic and never stop the sweep.
     *
     * @return the number of stuck events recovered
     */
    public int sweep() {
        int recovered = 0;
        for (Map.Entry<Long, String> topic : topics.entrySet()) {
            try {
                recovered += store.clearStuckEvents(topic.getKey(), batchSize, stuckThreshold);
            } catch (SQLException | RuntimeException e) {
                logger.atError().setCause(e).log("Failed to clear stuck events on topic {}", topic.getValue());
            }
        }
        try {
            store.cleanupOldDeadLetters();
        } catch (SQLException | RuntimeException e) {
            logger.atError().setCause(e).log("Failed to clean up old dead letters");
        }
        return recovered;
    }

    @Override
    public synchronized void close() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }
}
