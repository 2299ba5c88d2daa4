package org.academic.store.table;

import org.academic.store.OperationResult;
import org.academic.store.model.AttendanceMark;
import org.academic.store.model.Evaluation;
import org.academic.store.model.Grades;
import org.academic.store.model.Student;
import org.academic.store.persistence.FixedText;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Students keyed by enrollment number, each owning bounded lists of evaluations and attendance marks.
 * Date lookups compare the stored string exactly and address the first match only.
 */
public class StudentTable extends KeyedTable<Student> {

    private final int maxEvaluations;
    private final int maxAttendance;

    public StudentTable(int capacity, int maxEvaluations, int maxAttendance) {
        super(capacity, student -> student.enrollmentNumber);
        if (maxEvaluations < 1 || maxAttendance < 1) {
            throw new IllegalArgumentException("Per-student limits must be positive: evaluations="
                + maxEvaluations + ", attendance=" + maxAttendance);
        }
        this.maxEvaluations = maxEvaluations;
        this.maxAttendance = maxAttendance;
    }

    public int maxEvaluations() {
        return maxEvaluations;
    }

    public int maxAttendance() {
        return maxAttendance;
    }

    /**
     * Appends a copy of {@code student}. Null entries in its sub-record lists make it {@link OperationResult#INVALID}.
     */
    public OperationResult insert(Student student) {
        if (hasNullEntry(student.evaluations) || hasNullEntry(student.attendance)) {
            return OperationResult.INVALID;
        }
        if (isFull()) {
            return OperationResult.CAPACITY_EXCEEDED;
        }
        if (contains(student.enrollmentNumber)) {
            return OperationResult.DUPLICATE;
        }
        if (size(student.evaluations) > maxEvaluations || size(student.attendance) > maxAttendance) {
            return OperationResult.CAPACITY_EXCEEDED;
        }
        records.put(student.enrollmentNumber, normalize(student));
        return OperationResult.OK;
    }

    public List<Student> listByClass(int classId, int limit) {
        List<Student> inClass = records.values().stream()
            .filter(s -> s.classId == classId)
            .collect(Collectors.toList());
        return copies(inClass, limit);
    }

    public boolean updateName(int enrollment, String name) {
        Student student = records.get(enrollment);
        if (student == null) {
            return false;
        }
        student.name = FixedText.fit(name, FixedText.NAME_SLOT);
        return true;
    }

    public OperationResult rekey(int oldEnrollment, int newEnrollment) {
        if (oldEnrollment == newEnrollment) {
            return OperationResult.OK;
        }
        if (contains(newEnrollment)) {
            return OperationResult.CONFLICT;
        }
        Student student = records.get(oldEnrollment);
        if (student == null) {
            return OperationResult.NOT_FOUND;
        }
        student.enrollmentNumber = newEnrollment;
        moveKey(oldEnrollment, newEnrollment);
        return OperationResult.OK;
    }

    /**
     * Removes every student of a class, keeping the order of the others.
     *
     * @return number of students removed
     */
    public int removeByClass(int classId) {
        int removed = 0;
        Iterator<Student> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().classId == classId) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Points every student of {@code oldClassId} at {@code newClassId}.
     *
     * @return number of students updated
     */
    public int reassignClass(int oldClassId, int newClassId) {
        int updated = 0;
        for (Student student : records.values()) {
            if (student.classId == oldClassId) {
                student.classId = newClassId;
                updated++;
            }
        }
        return updated;
    }

    // Grades

    public boolean replaceGrades(int enrollment, Grades grades) {
        Student student = records.get(enrollment);
        if (student == null) {
            return false;
        }
        student.grades = grades.copy();
        return true;
    }

    public Grades grades(int enrollment) {
        Student student = records.get(enrollment);
        return student != null ? student.grades.copy() : null;
    }

    // Attendance

    public OperationResult appendAttendance(int enrollment, AttendanceMark mark) {
        Student student = records.get(enrollment);
        if (student == null) {
            return OperationResult.NOT_FOUND;
        }
        if (student.attendance.size() >= maxAttendance) {
            return OperationResult.CAPACITY_EXCEEDED;
        }
        student.attendance.add(normalize(mark));
        return OperationResult.OK;
    }

    public List<AttendanceMark> listAttendance(int enrollment, int limit) {
        Student student = records.get(enrollment);
        if (student == null) {
            return new ArrayList<>();
        }
        return student.attendance.stream()
            .limit(Math.max(0, limit))
            .map(AttendanceMark::copy)
            .collect(Collectors.toList());
    }

    public AttendanceMark findAttendanceByDate(int enrollment, String date) {
        Student student = records.get(enrollment);
        if (student == null) {
            return null;
        }
        return student.attendance.stream()
            .filter(mark -> mark.date.equals(date))
            .findFirst()
            .map(AttendanceMark::copy)
            .orElse(null);
    }

    // Evaluations

    public OperationResult appendEvaluation(int enrollment, Evaluation evaluation) {
        Student student = records.get(enrollment);
        if (student == null) {
            return OperationResult.NOT_FOUND;
        }
        if (student.evaluations.size() >= maxEvaluations) {
            return OperationResult.CAPACITY_EXCEEDED;
        }
        student.evaluations.add(normalize(evaluation));
        return OperationResult.OK;
    }

    public List<Evaluation> listEvaluations(int enrollment, int limit) {
        Student student = records.get(enrollment);
        if (student == null) {
            return new ArrayList<>();
        }
        return student.evaluations.stream()
            .limit(Math.max(0, limit))
            .map(Evaluation::copy)
            .collect(Collectors.toList());
    }

    public boolean updateEvaluationByDate(int enrollment, String date, Evaluation replacement) {
        Student student = records.get(enrollment);
        if (student == null) {
            return false;
        }
        for (int i = 0; i < student.evaluations.size(); i++) {
            if (student.evaluations.get(i).date.equals(date)) {
                student.evaluations.set(i, normalize(replacement));
                return true;
            }
        }
        return false;
    }

    @Override
    protected Student normalize(Student student) {
        Student copy = new Student(student.classId, student.enrollmentNumber,
            FixedText.fit(student.name, FixedText.NAME_SLOT));
        copy.grades = student.grades != null ? student.grades.copy() : new Grades();
        if (student.evaluations != null) {
            student.evaluations.stream()
                .limit(maxEvaluations)
                .forEach(e -> copy.evaluations.add(normalize(e)));
        }
        if (student.attendance != null) {
            student.attendance.stream()
                .limit(maxAttendance)
                .forEach(a -> copy.attendance.add(normalize(a)));
        }
        return copy;
    }

    @Override
    protected Student copyOf(Student student) {
        return student.copy();
    }

    private static Evaluation normalize(Evaluation evaluation) {
        return new Evaluation(evaluation.score,
            FixedText.fit(evaluation.comment, FixedText.COMMENT_SLOT),
            FixedText.fit(evaluation.date, FixedText.DATE_SLOT));
    }

    private static AttendanceMark normalize(AttendanceMark mark) {
        return new AttendanceMark(FixedText.fit(mark.date, FixedText.DATE_SLOT), mark.present);
    }

    private static boolean hasNullEntry(List<?> list) {
        return list != null && list.contains(null);
    }

    private static int size(List<?> list) {
        return list != null ? list.size() : 0;
    }
}
