package com.shortspilot.orchestrator.discovery;

import com.shortspilot.orchestrator.model.WorkItem;
import com.shortspilot.orchestrator.store.StaleWriteException;
import com.shortspilot.orchestrator.store.TrackingStore;
import com.shortspilot.orchestrator.store.TrackingStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feeds discovered sources into the tracking store.
 *
 * New ids are added as DISCOVERED. Items still in the pipeline get their
 * priority refreshed so ordering follows current popularity; COMPLETED and
 * FAILED items are left alone, which is what keeps a source from being
 * processed twice.
 */
@Service
public class DiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final DiscoverySource source;
    private final TrackingStore   store;
    private final Clock           clock;

    public DiscoveryService(DiscoverySource source, TrackingStore store, Clock clock) {
        this.source = source;
        this.store  = store;
        this.clock  = clock;
    }

    /**
     * @return number of newly tracked items
     */
    public int ingest() {
        Map<String, DiscoveredItem> batch = new LinkedHashMap<>();
        for (DiscoveredItem d : source.discover()) {
            if (d == null || d.id() == null || d.id().isBlank()) {
                log.debug("Ignoring discovered entry without id: {}", d);
                continue;
            }
            batch.putIfAbsent(d.id(), d);
        }

        Map<String, WorkItem> known = store.load();
        int added     = 0;
        int refreshed = 0;
        for (DiscoveredItem d : batch.values()) {
            if (store.corruptRecordIds().contains(d.id())) continue;
            WorkItem existing = known.get(d.id());
            try {
                if (existing == null) {
                    store.upsert(new WorkItem(d.id(), d.title(), d.sourceUrl(), d.priority(), clock.instant()));
                    added++;
                } else if (!existing.getStatus().isTerminal() && existing.getPriority() != d.priority()) {
                    existing.updatePriority(d.priority());
                    store.upsert(existing);
                    refreshed++;
                }
            } catch (StaleWriteException e) {
                log.warn("Discovered item {} changed concurrently, leaving it as is: {}", d.id(), e.getMessage());
            }
        }
        try {
            store.commit();
        } catch (TrackingStoreException e) {
            store.discard();
            throw e;
        }

        log.info("Discovery: {} candidate(s), {} new, {} priority update(s)",
                batch.size(), added, refreshed);
        return added;
    }
}
