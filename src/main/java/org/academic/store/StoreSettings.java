package org.academic.store;

import java.nio.file.Path;

/**
 * Backing file locations and table limits for one {@link RecordStore}.
 */
public class StoreSettings {

    public static final int DEFAULT_MAX_CLASSES = 100;
    public static final int DEFAULT_MAX_STUDENTS = 500;
    public static final int DEFAULT_MAX_EVALUATIONS = 10;
    public static final int DEFAULT_MAX_ATTENDANCE = 50;

    public final Path classesFile;
    public final Path studentsFile;
    public final int maxClasses;
    public final int maxStudents;
    public final int maxEvaluations;
    public final int maxAttendance;

    public StoreSettings(Path classesFile, Path studentsFile,
                         int maxClasses, int maxStudents, int maxEvaluations, int maxAttendance) {
        if (classesFile == null || studentsFile == null) {
            throw new IllegalArgumentException("Both backing files must be set");
        }
        if (classesFile.toAbsolutePath().normalize().equals(studentsFile.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Classes and students cannot share a backing file: " + classesFile);
        }
        this.classesFile = classesFile;
        this.studentsFile = studentsFile;
        this.maxClasses = maxClasses;
        this.maxStudents = maxStudents;
        this.maxEvaluations = maxEvaluations;
        this.maxAttendance = maxAttendance;
    }

    /**
     * Default limits with {@code classes.dat} and {@code students.dat} under {@code directory}.
     */
    public static StoreSettings defaults(Path directory) {
        return new StoreSettings(directory.resolve("classes.dat"), directory.resolve("students.dat"),
            DEFAULT_MAX_CLASSES, DEFAULT_MAX_STUDENTS, DEFAULT_MAX_EVALUATIONS, DEFAULT_MAX_ATTENDANCE);
    }

    @Override
    public String toString() {
        return String.format("StoreSettings{classes=%s (max %d), students=%s (max %d), evaluations<=%d, attendance<=%d}",
            classesFile, maxClasses, studentsFile, maxStudents, maxEvaluations, maxAttendance);
    }
}
