package com.university.records.registry;

import com.university.records.TestFixtures;
import com.university.records.advising.AdvisingService;
import com.university.records.catalog.CatalogService;
import com.university.records.domain.AcademicYear;
import com.university.records.domain.DomainModels.Department;
import com.university.records.domain.DomainModels.DepartmentChanges;
import com.university.records.domain.DomainModels.NewStudent;
import com.university.records.domain.DomainModels.Student;
import com.university.records.domain.DomainModels.StudentChanges;
import com.university.records.domain.DomainModels.WorkloadEntry;
import com.university.records.domain.Email;
import com.university.records.domain.EnrollmentKey;
import com.university.records.domain.SectionKey;
import com.university.records.domain.Semester;
import com.university.records.domain.StudentStatus;
import com.university.records.enrollment.EnrollmentService;
import com.university.records.error.DatabaseException;
import com.university.records.error.ErrorKind;
import com.university.records.error.IncorrectValueException;
import com.university.records.error.RecordNotFoundException;
import com.university.records.repository.AdvisorJdbcRepository;
import com.university.records.repository.EnrollmentJdbcRepository;
import com.university.records.transaction.RecordsTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class RegistryServiceTest {
    @Autowired
    private RegistryService registry;

    @Autowired
    private CatalogService catalog;

    @Autowired
    private EnrollmentService enrollmentService;

    @Autowired
    private AdvisingService advising;

    @Autowired
    private RecordsTransactions transactions;

    @Autowired
    private EnrollmentJdbcRepository enrollments;

    @Autowired
    private AdvisorJdbcRepository advisors;

    private TestFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures(registry, catalog);
    }

    @Test
    void departmentStillInUseCannotBeDeleted() {
        String dept = fixtures.department();
        long student = registry.createStudent(new NewStudent("Grace", "Hopper", dept,
                Email.of("grace" + TestFixtures.next() + "@uni.edu"), 12, null, null));

        DatabaseException ex = assertThrows(DatabaseException.class, () -> registry.deleteDepartment(dept));
        assertEquals(ErrorKind.DATABASE_ERROR, ex.kind());
        assertTrue(registry.findDepartment(dept).isPresent());

        registry.deleteStudent(student);
        registry.deleteDepartment(dept);
        assertTrue(registry.findDepartment(dept).isEmpty());
        assertThrows(RecordNotFoundException.class, () -> registry.deleteDepartment(dept));
    }

    @Test
    void departmentUpdateTouchesOnlyGivenFields() {
        String dept = fixtures.department();
        registry.updateDepartment(dept, new DepartmentChanges(null, new BigDecimal("250.50"), "East", null));

        Department updated = registry.findDepartment(dept).orElseThrow();
        assertEquals(0, new BigDecimal("250.50").compareTo(updated.budget()));
        assertEquals("East", updated.building());
        assertEquals("555-0100", updated.phone());

        assertThrows(IncorrectValueException.class,
                () -> registry.updateDepartment(dept, new DepartmentChanges(null, null, null, null)));
        assertThrows(IncorrectValueException.class,
                () -> registry.updateDepartment(dept, new DepartmentChanges(null, new BigDecimal("-1"), null, null)));
        assertThrows(RecordNotFoundException.class,
                () -> registry.updateDepartment("Nowhere-" + TestFixtures.next(), new DepartmentChanges("1", null, null, null)));
    }

    @Test
    void studentDefaultsAndUpdates() {
        long id = fixtures.student();
        Student created = registry.findStudent(id).orElseThrow();
        assertEquals(StudentStatus.ACTIVE, created.status());
        assertEquals(fixtures.departmentName(), created.deptName());

        registry.updateStudent(id, new StudentChanges(null, null, null, "Math", 30, null, null, StudentStatus.GRADUATED));
        Student updated = registry.findStudent(id).orElseThrow();
        assertEquals("Math", updated.major());
        assertEquals(30, updated.totalCredits());
        assertEquals(StudentStatus.GRADUATED, updated.status());
        assertEquals(created.email(), updated.email());

        assertTrue(registry.students(fixtures.departmentName()).stream().anyMatch(s -> s.id() == id));
    }

    @Test
    void studentCreationChecksDepartmentAndEmailUniqueness() {
        Email email = Email.of("dup" + TestFixtures.next() + "@uni.edu");
        registry.createStudent(new NewStudent("A", "B", fixtures.departmentName(), email, 0, null, LocalDate.of(2025, 1, 1)));

        assertThrows(DatabaseException.class, () -> registry.createStudent(
                new NewStudent("C", "D", fixtures.departmentName(), email, 0, null, null)));
        RecordNotFoundException noDept = assertThrows(RecordNotFoundException.class, () -> registry.createStudent(
                new NewStudent("C", "D", "Nowhere-" + TestFixtures.next(), Email.of("x" + TestFixtures.next() + "@uni.edu"), 0, null, null)));
        assertEquals("Department", noDept.recordType());
        assertThrows(IncorrectValueException.class, () -> registry.createStudent(
                new NewStudent("C", "D", fixtures.departmentName(), Email.of("y" + TestFixtures.next() + "@uni.edu"), -1, null, null)));
    }

    @Test
    void deletingAStudentReleasesTheirSeats() {
        SectionKey section = fixtures.section(fixtures.course(3), 2);
        long leaving = fixtures.student();
        long staying = fixtures.student();
        enrollmentService.enroll(new EnrollmentKey(leaving, section));
        enrollmentService.enroll(new EnrollmentKey(staying, section));

        registry.deleteStudent(leaving);

        assertEquals(1, catalog.findSection(section).orElseThrow().enrolled());
        assertTrue(enrollmentService.findEnrollment(new EnrollmentKey(leaving, section)).isEmpty());
        assertEquals(List.of(staying), enrollmentService.roster(section).stream().map(e -> e.key().studentId()).toList());
        assertThrows(RecordNotFoundException.class, () -> registry.deleteStudent(leaving));
    }

    @Test
    void deletingAStudentWhileTheirCancellationCommitsReleasesTheSeatOnce() throws Exception {
        SectionKey section = fixtures.section(fixtures.course(3), 5);
        long leaving = fixtures.student();
        long staying = fixtures.student();
        EnrollmentKey leavingKey = new EnrollmentKey(leaving, section);
        enrollmentService.enroll(leavingKey);
        enrollmentService.enroll(new EnrollmentKey(staying, section));

        CountDownLatch cancelled = new CountDownLatch(1);
        CountDownLatch commit = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        Future<?> cancel = pool.submit(() -> transactions.run("Cancel then wait", () -> {
            enrollmentService.cancelEnrollment(leavingKey);
            cancelled.countDown();
            await(commit);
        }));
        assertTrue(cancelled.await(10, TimeUnit.SECONDS));
        Future<?> delete = pool.submit(() -> registry.deleteStudent(leaving));
        Thread.sleep(500);
        assertFalse(delete.isDone());

        commit.countDown();
        cancel.get(30, TimeUnit.SECONDS);
        delete.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(1, catalog.findSection(section).orElseThrow().enrolled());
        assertEquals(1, enrollments.countActive(section));
        assertTrue(registry.findStudent(leaving).isEmpty());
    }

    @Test
    void deletingAStudentRemovesTheirAdvisorAndAdvisorHistory() {
        long student = fixtures.student();
        advising.assignAdvisor(student, fixtures.instructor(), LocalDate.of(2024, 9, 1));
        advising.assignAdvisor(student, fixtures.instructor(), LocalDate.of(2025, 1, 10));
        assertEquals(1, advising.advisorHistory(student).size());

        registry.deleteStudent(student);

        assertTrue(advisors.find(student).isEmpty());
        assertTrue(advisors.loadHistory(student).isEmpty());
        assertThrows(RecordNotFoundException.class, () -> advising.currentAdvisor(student));
    }

    @Test
    void activeEnrollmentsAreListedInSectionOrder() {
        String first = fixtures.course(3);
        String second = fixtures.course(3);
        SectionKey later = fixtures.section(second, 5);
        SectionKey earlier = fixtures.section(first, 5);
        long student = fixtures.student();
        enrollmentService.enroll(new EnrollmentKey(student, later));
        enrollmentService.enroll(new EnrollmentKey(student, earlier));

        List<EnrollmentKey> active = enrollments.loadActiveKeys(student);

        assertEquals(List.of(earlier, later), active.stream().map(EnrollmentKey::section).toList());
    }

    @Test
    void workloadListsSectionsTaughtInTerm() {
        long instructor = fixtures.instructor();
        SectionKey fall = fixtures.section(fixtures.course(3), 10);
        SectionKey spring = fixtures.section(fixtures.course(3), "Spring", 2025, 10);
        enrollmentService.assignInstructor(instructor, fall);
        enrollmentService.assignInstructor(instructor, spring);

        List<WorkloadEntry> workload = registry.workload(instructor, Semester.FALL, AcademicYear.of(2025));
        assertEquals(1, workload.size());
        assertEquals(fall.courseId(), workload.get(0).courseId());
        assertEquals("MWF 10:00-11:00", workload.get(0).timeSlot().toString());

        assertThrows(RecordNotFoundException.class, () -> registry.workload(-3, Semester.FALL, AcademicYear.of(2025)));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
