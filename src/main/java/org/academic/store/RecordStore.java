package org.academic.store;

import org.academic.store.model.AttendanceMark;
import org.academic.store.model.ClassSection;
import org.academic.store.model.Evaluation;
import org.academic.store.model.Grades;
import org.academic.store.model.Student;
import org.academic.store.persistence.BinaryTableFile;
import org.academic.store.persistence.ClassSectionLayout;
import org.academic.store.persistence.PersistenceManager;
import org.academic.store.persistence.StudentLayout;
import org.academic.store.table.ClassTable;
import org.academic.store.table.StudentTable;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Embedded store for class sections and their students, backed by two binary files.
 *
 * <p>Every operation loads the tables on first use. A successful mutation rewrites the
 * affected file(s) before returning; if that write fails the change is kept in memory and
 * {@link OperationResult#OK_NOT_PERSISTED} is returned. Deleting or rekeying a class carries
 * over to its students and rewrites both files.
 *
 * <p>All public methods lock the store, so one instance can be shared between threads of a
 * single process. Separate processes must not open the same files.
 */
public class RecordStore implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RecordStore.class);

    private final StoreSettings settings;
    private final ClassTable classes;
    private final StudentTable students;
    private final PersistenceManager persistence;

    public RecordStore(StoreSettings settings) {
        this.settings = settings;
        this.classes = new ClassTable(settings.maxClasses);
        this.students = new StudentTable(settings.maxStudents, settings.maxEvaluations, settings.maxAttendance);
        this.persistence = new PersistenceManager(classes, students,
            new BinaryTableFile<>("class", settings.classesFile, new ClassSectionLayout()),
            new BinaryTableFile<>("student", settings.studentsFile,
                new StudentLayout(settings.maxEvaluations, settings.maxAttendance)));
    }

    public StoreSettings getSettings() {
        return settings;
    }

    public synchronized void ensureLoaded() {
        persistence.ensureLoaded();
    }

    // ==============================================================================
    // Classes
    // ==============================================================================

    public synchronized OperationResult insertClass(ClassSection section) {
        if (section == null) {
            LOG.warn("✗ Rejected null class");
            return OperationResult.INVALID;
        }
        ensureLoaded();

        OperationResult result = classes.insert(section);
        switch (result) {
            case CAPACITY_EXCEEDED:
                LOG.warnf("✗ Class limit reached (%d/%d) - class %d not saved", classes.size(), classes.capacity(), section.id);
                return result;
            case DUPLICATE:
                LOG.warnf("✗ Class with id %d already exists", section.id);
                return result;
            default:
                LOG.infof("✓ Class %d saved (total: %d classes)", section.id, classes.size());
                return persisted(persistence.flushClasses());
        }
    }

    public synchronized boolean classExists(int id) {
        ensureLoaded();
        return classes.contains(id);
    }

    public synchronized Optional<ClassSection> findClass(int id) {
        ensureLoaded();
        return Optional.ofNullable(classes.find(id));
    }

    /**
     * Classes in insertion order, at most {@code limit} of them.
     */
    public synchronized List<ClassSection> listClasses(int limit) {
        ensureLoaded();
        return classes.list(limit);
    }

    public synchronized OperationResult updateClass(int id, String disciplineName, String professorName) {
        if (disciplineName == null || professorName == null) {
            return OperationResult.INVALID;
        }
        ensureLoaded();

        if (!classes.updateFields(id, disciplineName, professorName)) {
            LOG.warnf("✗ Class %d not found", id);
            return OperationResult.NOT_FOUND;
        }
        LOG.infof("✓ Class %d updated", id);
        return persisted(persistence.flushClasses());
    }

    /**
     * Changes a class id and moves every student of the old id to the new one.
     * Same id is a no-op success; an id already in use is a {@link OperationResult#CONFLICT}.
     */
    public synchronized OperationResult rekeyClass(int oldId, int newId) {
        ensureLoaded();
        if (oldId == newId) {
            return OperationResult.OK;
        }

        OperationResult result = classes.rekey(oldId, newId);
        if (result == OperationResult.CONFLICT) {
            LOG.warnf("✗ New class id %d already exists", newId);
            return result;
        }
        if (result == OperationResult.NOT_FOUND) {
            LOG.warnf("✗ Class %d not found", oldId);
            return result;
        }

        int moved = students.reassignClass(oldId, newId);
        boolean classesSaved = persistence.flushClasses();
        boolean studentsSaved = persistence.flushStudents();
        LOG.infof("✓ Class id changed: %d → %d (%d students updated)", oldId, newId, moved);
        return persisted(classesSaved, studentsSaved);
    }

    /**
     * Deletes a class together with all of its students.
     * An unknown id changes nothing and writes nothing.
     */
    public synchronized OperationResult deleteClass(int id) {
        ensureLoaded();
        if (classes.remove(id) == null) {
            LOG.warnf("✗ Class %d not found", id);
            return OperationResult.NOT_FOUND;
        }

        int removed = students.removeByClass(id);
        boolean studentsSaved = persistence.flushStudents();
        boolean classesSaved = persistence.flushClasses();
        LOG.infof("✓ Class %d deleted (%d students removed)", id, removed);
        return persisted(classesSaved, studentsSaved);
    }

    // ==============================================================================
    // Students
    // ==============================================================================

    /**
     * Adds a student. The class id is not checked against the class table.
     */
    public synchronized OperationResult insertStudent(Student student) {
        if (student == null) {
            LOG.warn("✗ Rejected null student");
            return OperationResult.INVALID;
        }
        ensureLoaded();

        OperationResult result = students.insert(student);
        switch (result) {
            case CAPACITY_EXCEEDED:
                LOG.warnf("✗ Student %d not saved - table at %d/%d or too many sub-records",
                    student.enrollmentNumber, students.size(), students.capacity());
                return result;
            case INVALID:
                LOG.warnf("✗ Student %d not saved - null evaluation or attendance entry", student.enrollmentNumber);
                return result;
            case DUPLICATE:
                LOG.warnf("✗ Student with enrollment %d already exists", student.enrollmentNumber);
                return result;
            default:
                LOG.infof("✓ Student %d saved (total: %d students)", student.enrollmentNumber, students.size());
                return persisted(persistence.flushStudents());
        }
    }

    public synchronized boolean studentExists(int enrollment) {
        ensureLoaded();
        return students.contains(enrollment);
    }

    public synchronized Optional<Student> findStudent(int enrollment) {
        ensureLoaded();
        return Optional.ofNullable(students.find(enrollment));
    }

    public synchronized List<Student> listStudentsByClass(int classId, int limit) {
        ensureLoaded();
        return students.listByClass(classId, limit);
    }

    public synchronized OperationResult updateStudentName(int enrollment, String name) {
        if (name == null) {
            return OperationResult.INVALID;
        }
        ensureLoaded();

        if (!students.updateName(enrollment, name)) {
            LOG.warnf("✗ Student %d not found", enrollment);
            return OperationResult.NOT_FOUND;
        }
        LOG.infof("✓ Student %d updated", enrollment);
        return persisted(persistence.flushStudents());
    }

    public synchronized OperationResult rekeyStudent(int oldEnrollment, int newEnrollment) {
        ensureLoaded();
        if (oldEnrollment == newEnrollment) {
            return OperationResult.OK;
        }

        OperationResult result = students.rekey(oldEnrollment, newEnrollment);
        if (result == OperationResult.CONFLICT) {
            LOG.warnf("✗ New enrollment %d already exists", newEnrollment);
            return result;
        }
        if (result == OperationResult.NOT_FOUND) {
            LOG.warnf("✗ Student %d not found", oldEnrollment);
            return result;
        }
        LOG.infof("✓ Enrollment changed: %d → %d", oldEnrollment, newEnrollment);
        return persisted(persistence.flushStudents());
    }

    public synchronized OperationResult deleteStudent(int enrollment) {
        ensureLoaded();
        if (students.remove(enrollment) == null) {
            LOG.warnf("✗ Student %d not found", enrollment);
            return OperationResult.NOT_FOUND;
        }
        LOG.infof("✓ Student %d deleted", enrollment);
        return persisted(persistence.flushStudents());
    }

    // ==============================================================================
    // Grades
    // ==============================================================================

    /**
     * Overwrites the whole grade sheet. The average is stored as given.
     */
    public synchronized OperationResult replaceGrades(int enrollment, Grades grades) {
        if (grades == null) {
            LOG.warn("✗ Rejected null grades");
            return OperationResult.INVALID;
        }
        ensureLoaded();

        if (!students.replaceGrades(enrollment, grades)) {
            LOG.warnf("✗ Student %d not found - grades not saved", enrollment);
            return OperationResult.NOT_FOUND;
        }
        LOG.infof("✓ Grades saved for %d: %s", enrollment, grades);
        return persisted(persistence.flushStudents());
    }

    public synchronized Optional<Grades> fetchGrades(int enrollment) {
        ensureLoaded();
        Grades grades = students.grades(enrollment);
        if (grades == null) {
            LOG.debugf("No grades for unknown student %d", enrollment);
        }
        return Optional.ofNullable(grades);
    }

    // ==============================================================================
    // Attendance
    // ==============================================================================

    /**
     * Appends a mark. Dates are not de-duplicated.
     */
    public synchronized OperationResult appendAttendance(int enrollment, AttendanceMark mark) {
        if (mark == null) {
            return OperationResult.INVALID;
        }
        ensureLoaded();

        OperationResult result = students.appendAttendance(enrollment, mark);
        if (result == OperationResult.NOT_FOUND) {
            LOG.warnf("✗ Student %d not found - attendance not added", enrollment);
            return result;
        }
        if (result == OperationResult.CAPACITY_EXCEEDED) {
            LOG.warnf("✗ Attendance limit (%d) reached for student %d", students.maxAttendance(), enrollment);
            return result;
        }
        LOG.infof("✓ Attendance added for %d: %s", enrollment, mark);
        return persisted(persistence.flushStudents());
    }

    public synchronized List<AttendanceMark> listAttendance(int enrollment, int limit) {
        ensureLoaded();
        return students.listAttendance(enrollment, limit);
    }

    /**
     * First mark whose date equals {@code date} exactly.
     */
    public synchronized Optional<AttendanceMark> findAttendanceByDate(int enrollment, String date) {
        if (date == null) {
            return Optional.empty();
        }
        ensureLoaded();
        return Optional.ofNullable(students.findAttendanceByDate(enrollment, date));
    }

    // ==============================================================================
    // Evaluations
    // ==============================================================================

    public synchronized OperationResult appendEvaluation(int enrollment, Evaluation evaluation) {
        if (evaluation == null) {
            return OperationResult.INVALID;
        }
        ensureLoaded();

        OperationResult result = students.appendEvaluation(enrollment, evaluation);
        if (result == OperationResult.NOT_FOUND) {
            LOG.warnf("✗ Student %d not found - evaluation not added", enrollment);
            return result;
        }
        if (result == OperationResult.CAPACITY_EXCEEDED) {
            LOG.warnf("✗ Evaluation limit (%d) reached for student %d", students.maxEvaluations(), enrollment);
            return result;
        }
        LOG.infof("✓ Evaluation added for %d: %s", enrollment, evaluation);
        return persisted(persistence.flushStudents());
    }

    public synchronized List<Evaluation> listEvaluations(int enrollment, int limit) {
        ensureLoaded();
        return students.listEvaluations(enrollment, limit);
    }

    /**
     * Replaces the first evaluation dated {@code date}.
     */
    public synchronized OperationResult updateEvaluationByDate(int enrollment, String date, Evaluation replacement) {
        if (date == null || replacement == null) {
            return OperationResult.INVALID;
        }
        ensureLoaded();

        if (!students.updateEvaluationByDate(enrollment, date, replacement)) {
            LOG.warnf("✗ Evaluation not found - student %d, date %s", enrollment, date);
            return OperationResult.NOT_FOUND;
        }
        LOG.infof("✓ Evaluation updated - student %d, date %s", enrollment, date);
        return persisted(persistence.flushStudents());
    }

    // ==============================================================================
    // Maintenance
    // ==============================================================================

    public synchronized StoreStats stats() {
        ensureLoaded();
        BinaryTableFile<ClassSection> classFile = persistence.getClassFile();
        BinaryTableFile<Student> studentFile = persistence.getStudentFile();
        return new StoreStats(
            classes.size(), classes.capacity(),
            students.size(), students.capacity(),
            classFile.getPath().toString(), classFile.exists(),
            studentFile.getPath().toString(), studentFile.exists());
    }

    /**
     * Discards memory and reads both files again, picking up changes made outside this store.
     */
    public synchronized void forceReload() {
        persistence.forceReload();
        LOG.info("✓ Reload complete");
    }

    /**
     * Removes every class and student, in memory and on disk.
     */
    public synchronized OperationResult wipeAll() {
        boolean written = persistence.wipeAll();
        LOG.info("✓ Store wiped");
        return persisted(written);
    }

    /**
     * Writes both tables if they were ever loaded.
     */
    @Override
    public synchronized void close() {
        if (!persistence.isLoaded()) {
            return;
        }
        boolean classesSaved = persistence.flushClasses();
        boolean studentsSaved = persistence.flushStudents();
        if (!classesSaved || !studentsSaved) {
            LOG.error("❌ Store closed with unsaved changes");
        }
    }

    /**
     * Snapshot of every student, in insertion order.
     */
    public synchronized List<Student> allStudents() {
        ensureLoaded();
        List<Student> all = new ArrayList<>();
        students.records().forEach(s -> all.add(s.copy()));
        return all;
    }

    private static OperationResult persisted(boolean... writes) {
        for (boolean written : writes) {
            if (!written) {
                return OperationResult.OK_NOT_PERSISTED;
            }
        }
        return OperationResult.OK;
    }
}
