package org.academic.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Exposes one {@link RecordStore} configured from {@code academic-store.*} properties.
 */
@ApplicationScoped
public class RecordStoreProducer {

    private static final Logger LOG = Logger.getLogger(RecordStoreProducer.class);

    @ConfigProperty(name = "academic-store.classes-file", defaultValue = "data/classes.dat")
    String classesFile;

    @ConfigProperty(name = "academic-store.students-file", defaultValue = "data/students.dat")
    String studentsFile;

    @ConfigProperty(name = "academic-store.max-classes", defaultValue = "100")
    int maxClasses;

    @ConfigProperty(name = "academic-store.max-students", defaultValue = "500")
    int maxStudents;

    @ConfigProperty(name = "academic-store.max-evaluations", defaultValue = "10")
    int maxEvaluations;

    @ConfigProperty(name = "academic-store.max-attendance", defaultValue = "50")
    int maxAttendance;

    @Produces
    @Singleton
    RecordStore recordStore() {
        StoreSettings settings = new StoreSettings(Path.of(classesFile), Path.of(studentsFile),
            maxClasses, maxStudents, maxEvaluations, maxAttendance);
        LOG.infof("Opening record store with %s", settings);
        return new RecordStore(settings);
    }

    void closeRecordStore(@Disposes RecordStore store) {
        LOG.info("Closing record store...");
        store.close();
    }
}
