package org.academic.store;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Loads the store at startup and reports table occupancy in the log.
 */
@ApplicationScoped
public class StoreDiagnostics {

    private static final Logger LOG = Logger.getLogger(StoreDiagnostics.class);

    @Inject
    RecordStore store;

    void onStart(@Observes StartupEvent ev) {
        LOG.info("🚀 Loading record store...");
        store.ensureLoaded();
        logStats();
    }

    void onStop(@Observes ShutdownEvent ev) {
        LOG.info("🛑 Shutting down - " + store.stats());
    }

    @Scheduled(every = "${academic-store.stats-interval}", identity = "store-stats")
    void reportOccupancy() {
        logStats();
    }

    public StoreStats logStats() {
        StoreStats stats = store.stats();
        LOG.info("📊 Record store statistics:");
        LOG.infof("  - Classes:  %d / %d (%.1f%%)", stats.classCount, stats.classCapacity, stats.classOccupancy());
        LOG.infof("  - Students: %d / %d (%.1f%%)", stats.studentCount, stats.studentCapacity, stats.studentOccupancy());
        LOG.infof("  - %s: %s", stats.classesFile, stats.classesFilePresent ? "OK" : "MISSING");
        LOG.infof("  - %s: %s", stats.studentsFile, stats.studentsFilePresent ? "OK" : "MISSING");
        return stats;
    }
}
