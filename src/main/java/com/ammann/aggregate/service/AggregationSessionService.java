/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.model.AggregateCache;
import com.ammann.aggregate.model.AggregateSet;
import com.ammann.aggregate.model.AggregationResult;
import com.ammann.aggregate.model.DayRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Keeps one aggregation cache per dataset and feeds it into every recompute for that
 * dataset.
 *
 * <p>Recomputes of the same dataset are serialized on the dataset's session; different
 * datasets proceed independently. When more than {@code aggregate.sessions.max-sessions}
 * datasets are active, the least recently used session is dropped and its next recompute
 * starts from an empty cache.
 */
@ApplicationScoped
public class AggregationSessionService {

    private static final Logger LOG = Logger.getLogger(AggregationSessionService.class);

    static final int DEFAULT_MAX_SESSIONS = 64;

    @ConfigProperty(name = "aggregate.sessions.max-sessions", defaultValue = "64")
    int maxSessions = DEFAULT_MAX_SESSIONS;

    private final PeriodAggregationService aggregationService;

    // Access-ordered, guarded by itself.
    private final LinkedHashMap<String, Session> sessions = new LinkedHashMap<>(16, 0.75f, true);

    @Inject
    public AggregationSessionService(PeriodAggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    /**
     * Recomputes the aggregates of a dataset from its current log.
     *
     * @param datasetId dataset the log belongs to
     * @param log       complete current log of the dataset
     * @return aggregates for every granularity
     */
    public AggregateSet aggregate(String datasetId, Collection<DayRecord> log) {
        if (datasetId == null || datasetId.isBlank()) {
            throw new IllegalArgumentException("Dataset id must not be blank");
        }
        Session session = sessionFor(datasetId);
        synchronized (session) {
            AggregationResult result = aggregationService.recompute(log, session.cache);
            session.cache = result.cache();
            return result.aggregates();
        }
    }

    /**
     * Returns the cache of a dataset's latest recompute, if any.
     */
    public Optional<AggregateCache> current(String datasetId) {
        Session session;
        synchronized (sessions) {
            session = sessions.get(datasetId);
        }
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.ofNullable(session.cache);
        }
    }

    /**
     * Drops the cache of a dataset, e.g. after the dataset was deleted.
     *
     * @return {@code true} if a session existed
     */
    public boolean evict(String datasetId) {
        synchronized (sessions) {
            boolean removed = sessions.remove(datasetId) != null;
            if (removed) {
                LOG.debugf("Evicted aggregation session for dataset %s", datasetId);
            }
            return removed;
        }
    }

    public int sessionCount() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    private Session sessionFor(String datasetId) {
        synchronized (sessions) {
            Session session = sessions.computeIfAbsent(datasetId, id -> new Session());
            int limit = Math.max(1, maxSessions);
            Iterator<Map.Entry<String, Session>> eldest = sessions.entrySet().iterator();
            while (sessions.size() > limit && eldest.hasNext()) {
                Map.Entry<String, Session> entry = eldest.next();
                if (entry.getValue() == session) {
                    continue;
                }
                LOG.infof("Dropping aggregation session for dataset %s (limit %d)", entry.getKey(), limit);
                eldest.remove();
            }
            return session;
        }
    }

    private static final class Session {
        private AggregateCache cache;
    }
}
