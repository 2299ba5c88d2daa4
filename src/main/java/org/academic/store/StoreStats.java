package org.academic.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Table occupancy at one point in time.
 */
public class StoreStats {
    public final int classCount;
    public final int classCapacity;
    public final int studentCount;
    public final int studentCapacity;
    public final String classesFile;
    public final boolean classesFilePresent;
    public final String studentsFile;
    public final boolean studentsFilePresent;

    public StoreStats(int classCount, int classCapacity, int studentCount, int studentCapacity,
                      String classesFile, boolean classesFilePresent,
                      String studentsFile, boolean studentsFilePresent) {
        this.classCount = classCount;
        this.classCapacity = classCapacity;
        this.studentCount = studentCount;
        this.studentCapacity = studentCapacity;
        this.classesFile = classesFile;
        this.classesFilePresent = classesFilePresent;
        this.studentsFile = studentsFile;
        this.studentsFilePresent = studentsFilePresent;
    }

    public double classOccupancy() {
        return classCount * 100.0 / classCapacity;
    }

    public double studentOccupancy() {
        return studentCount * 100.0 / studentCapacity;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("classes", classCount);
        stats.put("classCapacity", classCapacity);
        stats.put("students", studentCount);
        stats.put("studentCapacity", studentCapacity);
        stats.put("classesFile", classesFile);
        stats.put("classesFilePresent", classesFilePresent);
        stats.put("studentsFile", studentsFile);
        stats.put("studentsFilePresent", studentsFilePresent);
        return stats;
    }

    @Override
    public String toString() {
        return String.format("StoreStats{classes=%d/%d (%.1f%%), students=%d/%d (%.1f%%), %s: %s, %s: %s}",
            classCount, classCapacity, classOccupancy(),
            studentCount, studentCapacity, studentOccupancy(),
            classesFile, classesFilePresent ? "OK" : "MISSING",
            studentsFile, studentsFilePresent ? "OK" : "MISSING");
    }
}
