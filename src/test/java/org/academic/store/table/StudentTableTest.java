package org.academic.store.table;

import org.academic.store.OperationResult;
import org.academic.store.model.AttendanceMark;
import org.academic.store.model.Evaluation;
import org.academic.store.model.Grades;
import org.academic.store.model.Student;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class StudentTableTest {

    private StudentTable table;

    @BeforeEach
    void setUp() {
        table = new StudentTable(500, 10, 50);
        table.insert(new Student(1, 1001, "Ana"));
        table.insert(new Student(2, 1002, "Bruno"));
        table.insert(new Student(1, 1003, "Carla"));
    }

    private List<Integer> enrollments() {
        return table.records().stream().map(s -> s.enrollmentNumber).collect(Collectors.toList());
    }

    @Test
    @Order(1)
    @DisplayName("Duplicate enrollment is rejected")
    void testDuplicateEnrollment() {
        assertEquals(OperationResult.DUPLICATE, table.insert(new Student(9, 1001, "Impostor")));
        assertEquals("Ana", table.find(1001).name);
        assertEquals(3, table.size());
    }

    @Test
    @Order(2)
    @DisplayName("Student table capacity is enforced")
    void testCapacity() {
        StudentTable small = new StudentTable(2, 10, 50);
        assertEquals(OperationResult.OK, small.insert(new Student(1, 1, "A")));
        assertEquals(OperationResult.OK, small.insert(new Student(1, 2, "B")));
        assertEquals(OperationResult.CAPACITY_EXCEEDED, small.insert(new Student(1, 3, "C")));
        assertEquals(2, small.size());
    }

    @Test
    @Order(3)
    @DisplayName("Student arriving with too many evaluations is rejected")
    void testInsertWithOversizedSubRecords() {
        Student loaded = new Student(1, 2000, "Overloaded");
        for (int i = 0; i < 11; i++) {
            loaded.evaluations.add(new Evaluation(5f, "", "0" + (i % 9 + 1) + "/01/2024"));
        }

        assertEquals(OperationResult.CAPACITY_EXCEEDED, table.insert(loaded));
        assertFalse(table.contains(2000));
    }

    @Test
    @Order(4)
    @DisplayName("Students listed by class, in insertion order, up to the limit")
    void testListByClass() {
        List<String> names = table.listByClass(1, 10).stream().map(s -> s.name).collect(Collectors.toList());

        assertThat(names, contains("Ana", "Carla"));
        assertThat(table.listByClass(1, 1), hasSize(1));
        assertThat(table.listByClass(77, 10), empty());
    }

    @Test
    @Order(5)
    @DisplayName("Rekey moves the key and keeps the position")
    void testRekey() {
        assertEquals(OperationResult.OK, table.rekey(1002, 2002));
        assertEquals(OperationResult.CONFLICT, table.rekey(1001, 1003));
        assertEquals(OperationResult.NOT_FOUND, table.rekey(4040, 5050));

        assertThat(enrollments(), contains(1001, 2002, 1003));
        assertEquals("Bruno", table.find(2002).name);
    }

    @Test
    @Order(6)
    @DisplayName("Class removal takes only the students of that class")
    void testRemoveByClass() {
        assertEquals(2, table.removeByClass(1));
        assertThat(enrollments(), contains(1002));
        assertEquals(0, table.removeByClass(1));
    }

    @Test
    @Order(7)
    @DisplayName("Class reassignment updates only matching students")
    void testReassignClass() {
        assertEquals(2, table.reassignClass(1, 10));

        assertEquals(10, table.find(1001).classId);
        assertEquals(2, table.find(1002).classId);
        assertEquals(10, table.find(1003).classId);
    }

    @Test
    @Order(8)
    @DisplayName("Grades are replaced wholesale and returned as copies")
    void testGrades() {
        assertTrue(table.replaceGrades(1001, new Grades(8.0f, 7.5f, 9.0f, 8.17f)));
        assertFalse(table.replaceGrades(4040, new Grades()));

        Grades grades = table.grades(1001);
        assertEquals(new Grades(8.0f, 7.5f, 9.0f, 8.17f), grades);

        grades.np1 = 0f;
        assertEquals(8.0f, table.grades(1001).np1);
        assertNull(table.grades(4040));
    }

    @Test
    @Order(9)
    @DisplayName("51st attendance mark is rejected")
    void testAttendanceCapacity() {
        for (int day = 1; day <= 50; day++) {
            String date = String.format("%02d/03/2024", (day - 1) % 28 + 1);
            assertEquals(OperationResult.OK, table.appendAttendance(1001, new AttendanceMark(date, day % 2 == 0)));
        }

        assertEquals(OperationResult.CAPACITY_EXCEEDED, table.appendAttendance(1001, new AttendanceMark("01/04/2024", true)));
        List<AttendanceMark> marks = table.listAttendance(1001, 100);
        assertThat(marks, hasSize(50));
        assertEquals("01/03/2024", marks.get(0).date);
        assertEquals(OperationResult.NOT_FOUND, table.appendAttendance(4040, new AttendanceMark("01/03/2024", true)));
    }

    @Test
    @Order(10)
    @DisplayName("Attendance lookup by date returns the first match")
    void testAttendanceByDate() {
        table.appendAttendance(1001, new AttendanceMark("01/03/2024", true));
        table.appendAttendance(1001, new AttendanceMark("01/03/2024", false));

        assertTrue(table.findAttendanceByDate(1001, "01/03/2024").present);
        assertNull(table.findAttendanceByDate(1001, "02/03/2024"));
        assertNull(table.findAttendanceByDate(4040, "01/03/2024"));
        assertThat(table.listAttendance(1001, 1), hasSize(1));
    }

    @Test
    @Order(11)
    @DisplayName("11th evaluation is rejected")
    void testEvaluationCapacity() {
        for (int i = 1; i <= 10; i++) {
            String date = String.format("%02d/04/2024", i);
            assertEquals(OperationResult.OK, table.appendEvaluation(1002, new Evaluation(i, "week " + i, date)));
        }

        assertEquals(OperationResult.CAPACITY_EXCEEDED, table.appendEvaluation(1002, new Evaluation(10f, "extra", "30/04/2024")));
        assertThat(table.listEvaluations(1002, 50), hasSize(10));
        assertThat(table.listEvaluations(4040, 50), empty());
    }

    @Test
    @Order(12)
    @DisplayName("Evaluation update by date replaces only the first match")
    void testUpdateEvaluationByDate() {
        table.appendEvaluation(1003, new Evaluation(5f, "first", "10/03/2024"));
        table.appendEvaluation(1003, new Evaluation(6f, "second", "10/03/2024"));

        assertTrue(table.updateEvaluationByDate(1003, "10/03/2024", new Evaluation(9f, "revised", "10/03/2024")));
        assertFalse(table.updateEvaluationByDate(1003, "11/03/2024", new Evaluation(1f, "none", "11/03/2024")));
        assertFalse(table.updateEvaluationByDate(4040, "10/03/2024", new Evaluation(1f, "none", "10/03/2024")));

        List<Evaluation> evaluations = table.listEvaluations(1003, 10);
        assertEquals("revised", evaluations.get(0).comment);
        assertEquals("second", evaluations.get(1).comment);
    }

    @Test
    @Order(13)
    @DisplayName("Stored student is detached from the inserted object")
    void testInsertCopies() {
        Student original = new Student(3, 3000, "Davi");
        table.insert(original);
        original.name = "Changed";
        original.attendance.add(new AttendanceMark("01/01/2024", true));

        Student stored = table.find(3000);
        assertEquals("Davi", stored.name);
        assertThat(stored.attendance, empty());
    }
}
