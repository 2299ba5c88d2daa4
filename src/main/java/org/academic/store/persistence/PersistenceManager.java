package org.academic.store.persistence;

import org.academic.store.model.ClassSection;
import org.academic.store.model.Student;
import org.academic.store.table.ClassTable;
import org.academic.store.table.StudentTable;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Moves the two tables between memory and their backing files.
 * Loading happens once per instance; every flush rewrites a whole file.
 */
public class PersistenceManager {

    private static final Logger LOG = Logger.getLogger(PersistenceManager.class);

    private final ClassTable classes;
    private final StudentTable students;
    private final BinaryTableFile<ClassSection> classFile;
    private final BinaryTableFile<Student> studentFile;

    private boolean loaded;

    public PersistenceManager(ClassTable classes, StudentTable students,
                              BinaryTableFile<ClassSection> classFile, BinaryTableFile<Student> studentFile) {
        this.classes = classes;
        this.students = students;
        this.classFile = classFile;
        this.studentFile = studentFile;
    }

    /**
     * Loads both tables on the first call. Later calls do nothing.
     */
    public void ensureLoaded() {
        if (loaded) {
            return;
        }
        int classCount = classes.replaceAll(classFile.load(classes.capacity()));
        int studentCount = students.replaceAll(studentFile.load(students.capacity()));
        loaded = true;
        LOG.infof("✅ Store loaded: %d classes, %d students", classCount, studentCount);
    }

    public boolean isLoaded() {
        return loaded;
    }

    public boolean flushClasses() {
        return flush(classFile, classes.size(), () -> classFile.write(classes.records()));
    }

    public boolean flushStudents() {
        return flush(studentFile, students.size(), () -> studentFile.write(students.records()));
    }

    /**
     * Drops the in-memory state and reads both files again.
     */
    public void forceReload() {
        LOG.info("🔄 Forcing reload from disk...");
        loaded = false;
        classes.clear();
        students.clear();
        ensureLoaded();
    }

    /**
     * Empties both tables and writes the empty state to both files.
     *
     * @return true if both files were written
     */
    public boolean wipeAll() {
        LOG.warn("⚠️ Wiping ALL classes and students");
        classes.clear();
        students.clear();
        loaded = true;
        boolean classesWritten = flushClasses();
        boolean studentsWritten = flushStudents();
        return classesWritten && studentsWritten;
    }

    public BinaryTableFile<ClassSection> getClassFile() {
        return classFile;
    }

    public BinaryTableFile<Student> getStudentFile() {
        return studentFile;
    }

    private boolean flush(BinaryTableFile<?> file, int count, FileWrite write) {
        try {
            write.run();
            LOG.infof("💾 Saved %d %s records to %s", count, file.getTableName(), file.getPath());
            return true;
        } catch (IOException e) {
            LOG.errorf(e, "❌ Could not write %s - changes stay in memory only: %s", file.getPath(), e.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    private interface FileWrite {
        void run() throws IOException;
    }
}
