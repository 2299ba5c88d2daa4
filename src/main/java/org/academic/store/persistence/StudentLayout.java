package org.academic.store.persistence;

import org.academic.store.model.AttendanceMark;
import org.academic.store.model.Evaluation;
import org.academic.store.model.Grades;
import org.academic.store.model.Student;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Fixed layout of a student record:
 * <pre>
 * classId (int) | enrollment (int) | name (100)
 * grades: np1, np2, pim, average (4 x float)
 * evaluations: maxEvaluations x [score (float) | comment (500) | date (11)]
 * attendance:  maxAttendance  x [date (11) | present (int)]
 * evaluation count (int) | attendance count (int)
 * </pre>
 * Unused sub-record slots are zero-filled.
 */
public class StudentLayout implements RecordLayout<Student> {

    private static final int GRADES_SIZE = 4 * Float.BYTES;
    private static final int EVALUATION_SIZE = Float.BYTES + FixedText.COMMENT_SLOT + FixedText.DATE_SLOT;
    private static final int ATTENDANCE_SIZE = FixedText.DATE_SLOT + Integer.BYTES;

    private final int maxEvaluations;
    private final int maxAttendance;

    public StudentLayout(int maxEvaluations, int maxAttendance) {
        this.maxEvaluations = maxEvaluations;
        this.maxAttendance = maxAttendance;
    }

    @Override
    public int recordSize() {
        return 2 * Integer.BYTES
            + FixedText.NAME_SLOT
            + GRADES_SIZE
            + maxEvaluations * EVALUATION_SIZE
            + maxAttendance * ATTENDANCE_SIZE
            + 2 * Integer.BYTES;
    }

    @Override
    public void write(DataOutput out, Student record) throws IOException {
        out.writeInt(record.classId);
        out.writeInt(record.enrollmentNumber);
        FixedText.write(out, record.name, FixedText.NAME_SLOT);

        Grades grades = record.grades != null ? record.grades : new Grades();
        out.writeFloat(grades.np1);
        out.writeFloat(grades.np2);
        out.writeFloat(grades.pimProject);
        out.writeFloat(grades.average);

        int evaluationCount = Math.min(record.evaluations.size(), maxEvaluations);
        for (int i = 0; i < maxEvaluations; i++) {
            if (i < evaluationCount) {
                Evaluation evaluation = record.evaluations.get(i);
                out.writeFloat(evaluation.score);
                FixedText.write(out, evaluation.comment, FixedText.COMMENT_SLOT);
                FixedText.write(out, evaluation.date, FixedText.DATE_SLOT);
            } else {
                out.write(new byte[EVALUATION_SIZE]);
            }
        }

        int attendanceCount = Math.min(record.attendance.size(), maxAttendance);
        for (int i = 0; i < maxAttendance; i++) {
            if (i < attendanceCount) {
                AttendanceMark mark = record.attendance.get(i);
                FixedText.write(out, mark.date, FixedText.DATE_SLOT);
                out.writeInt(mark.present ? 1 : 0);
            } else {
                out.write(new byte[ATTENDANCE_SIZE]);
            }
        }

        out.writeInt(evaluationCount);
        out.writeInt(attendanceCount);
    }

    @Override
    public Student read(DataInput in) throws IOException {
        Student student = new Student();
        student.classId = in.readInt();
        student.enrollmentNumber = in.readInt();
        student.name = FixedText.read(in, FixedText.NAME_SLOT);
        student.grades = new Grades(in.readFloat(), in.readFloat(), in.readFloat(), in.readFloat());

        Evaluation[] evaluations = new Evaluation[maxEvaluations];
        for (int i = 0; i < maxEvaluations; i++) {
            float score = in.readFloat();
            String comment = FixedText.read(in, FixedText.COMMENT_SLOT);
            String date = FixedText.read(in, FixedText.DATE_SLOT);
            evaluations[i] = new Evaluation(score, comment, date);
        }

        AttendanceMark[] attendance = new AttendanceMark[maxAttendance];
        for (int i = 0; i < maxAttendance; i++) {
            String date = FixedText.read(in, FixedText.DATE_SLOT);
            attendance[i] = new AttendanceMark(date, in.readInt() != 0);
        }

        int evaluationCount = clamp(in.readInt(), maxEvaluations);
        int attendanceCount = clamp(in.readInt(), maxAttendance);
        for (int i = 0; i < evaluationCount; i++) {
            student.evaluations.add(evaluations[i]);
        }
        for (int i = 0; i < attendanceCount; i++) {
            student.attendance.add(attendance[i]);
        }
        return student;
    }

    private static int clamp(int count, int max) {
        return Math.max(0, Math.min(count, max));
    }
}
