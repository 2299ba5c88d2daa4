package org.academic.store.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GradesTest {

    @Test
    @DisplayName("Average is the mean of the three scores")
    void testWithAverage() {
        Grades grades = Grades.withAverage(8.0f, 7.5f, 9.0f);

        assertEquals(8.0f, grades.np1);
        assertEquals(7.5f, grades.np2);
        assertEquals(9.0f, grades.pimProject);
        assertEquals(8.17f, grades.average, 0.01f);
    }

    @Test
    @DisplayName("Student copy does not share sub-records")
    void testStudentDeepCopy() {
        Student student = new Student(1, 1001, "Ana");
        student.grades = new Grades(1f, 2f, 3f, 2f);
        student.evaluations.add(new Evaluation(5f, "ok", "01/03/2024"));

        Student copy = student.copy();
        copy.grades.np1 = 10f;
        copy.evaluations.get(0).comment = "changed";

        assertEquals(1f, student.grades.np1);
        assertEquals("ok", student.evaluations.get(0).comment);
        assertNotEquals(student, copy);
    }
}
