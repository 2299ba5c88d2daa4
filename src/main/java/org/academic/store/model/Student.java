package org.academic.store.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An enrolled student, keyed by enrollment number.
 * {@code classId} is a soft reference to a {@link ClassSection}; it is not checked on insert.
 */
public class Student {
    public int classId;
    public int enrollmentNumber;
    public String name;
    public Grades grades = new Grades();
    public List<Evaluation> evaluations = new ArrayList<>();
    public List<AttendanceMark> attendance = new ArrayList<>();

    public Student() {
    }

    public Student(int classId, int enrollmentNumber, String name) {
        this.classId = classId;
        this.enrollmentNumber = enrollmentNumber;
        this.name = name;
    }

    /**
     * Deep copy, sub-records included.
     */
    public Student copy() {
        Student copy = new Student(classId, enrollmentNumber, name);
        copy.grades = grades != null ? grades.copy() : new Grades();
        if (evaluations != null) {
            evaluations.forEach(e -> copy.evaluations.add(e.copy()));
        }
        if (attendance != null) {
            attendance.forEach(a -> copy.attendance.add(a.copy()));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Student)) return false;
        Student other = (Student) o;
        return classId == other.classId &&
               enrollmentNumber == other.enrollmentNumber &&
               Objects.equals(name, other.name) &&
               Objects.equals(grades, other.grades) &&
               Objects.equals(evaluations, other.evaluations) &&
               Objects.equals(attendance, other.attendance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classId, enrollmentNumber, name, grades, evaluations, attendance);
    }

    @Override
    public String toString() {
        return String.format("Student{enrollment=%d, classId=%d, name='%s', evaluations=%d, attendance=%d}",
            enrollmentNumber, classId, name,
            evaluations != null ? evaluations.size() : 0,
            attendance != null ? attendance.size() : 0);
    }
}
