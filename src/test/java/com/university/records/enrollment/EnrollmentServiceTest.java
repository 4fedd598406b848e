package com.university.records.enrollment;

import com.university.records.TestFixtures;
import com.university.records.catalog.CatalogService;
import com.university.records.domain.DomainModels.Enrollment;
import com.university.records.domain.EnrollmentKey;
import com.university.records.domain.Grade;
import com.university.records.domain.SectionKey;
import com.university.records.error.CapacityExceededException;
import com.university.records.error.DuplicateEnrollmentException;
import com.university.records.error.ErrorKind;
import com.university.records.error.IncorrectValueException;
import com.university.records.error.PrerequisiteNotMetException;
import com.university.records.error.RecordNotFoundException;
import com.university.records.error.RecordsException;
import com.university.records.registry.RegistryService;
import com.university.records.repository.EnrollmentJdbcRepository;
import com.university.records.validation.FieldValidators;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class EnrollmentServiceTest {
    @Autowired
    private EnrollmentService enrollmentService;

    @Autowired
    private RegistryService registry;

    @Autowired
    private CatalogService catalog;

    @Autowired
    private EnrollmentJdbcRepository enrollments;

    private TestFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures(registry, catalog);
    }

    @Test
    void enrollTakesOneSeatAndKeepsCountEqualToRoster() {
        SectionKey section = fixtures.section(fixtures.course(3), 5);
        long s1 = fixtures.student();
        long s2 = fixtures.student();

        Enrollment enrollment = enrollmentService.enroll(new EnrollmentKey(s1, section));
        enrollmentService.enroll(new EnrollmentKey(s2, section));

        assertTrue(enrollment.active());
        assertNull(enrollment.grade());
        assertNotNull(enrollment.enrollmentDate());
        assertEquals(2, enrolled(section));
        assertEquals(2, enrollmentService.roster(section).size());
    }

    @Test
    void secondActiveEnrollmentIsRejectedWithoutTakingASeat() {
        SectionKey section = fixtures.section(fixtures.course(3), 5);
        long student = fixtures.student();
        EnrollmentKey key = new EnrollmentKey(student, section);
        enrollmentService.enroll(key);

        assertThrows(DuplicateEnrollmentException.class, () -> enrollmentService.enroll(key));
        assertEquals(1, enrolled(section));
    }

    @Test
    void cancelledEnrollmentCanBeReactivated() {
        SectionKey section = fixtures.section(fixtures.course(3), 1);
        long student = fixtures.student();
        EnrollmentKey key = new EnrollmentKey(student, section);
        enrollmentService.enroll(key);

        enrollmentService.cancelEnrollment(key);
        assertEquals(0, enrolled(section));
        assertTrue(enrollmentService.findEnrollment(key).orElseThrow().cancelled());
        assertTrue(enrollmentService.roster(section).isEmpty());

        Enrollment again = enrollmentService.enroll(key);
        assertTrue(again.active());
        assertEquals(1, enrolled(section));
        assertFalse(enrollmentService.findEnrollment(key).orElseThrow().cancelled());
    }

    @Test
    void fullSectionRejectsEnrollment() {
        SectionKey section = fixtures.section(fixtures.course(3), 1);
        enrollmentService.enroll(new EnrollmentKey(fixtures.student(), section));

        CapacityExceededException ex = assertThrows(CapacityExceededException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(fixtures.student(), section)));
        assertEquals(ErrorKind.CAPACITY_EXCEEDED, ex.kind());
        assertEquals(1, enrolled(section));
    }

    @Test
    void missingSectionIsReportedBeforeMissingStudent() {
        SectionKey missing = SectionKey.of("NOPE" + TestFixtures.next(), "001", "Fall", 2025);

        RecordNotFoundException ex = assertThrows(RecordNotFoundException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(-1, missing)));
        assertEquals("Section", ex.recordType());

        SectionKey section = fixtures.section(fixtures.course(3), 1);
        RecordNotFoundException noStudent = assertThrows(RecordNotFoundException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(-1, section)));
        assertEquals("Student", noStudent.recordType());
        assertEquals(0, enrolled(section));
    }

    @Test
    void duplicateIsReportedBeforeFullSection() {
        SectionKey section = fixtures.section(fixtures.course(3), 1);
        EnrollmentKey key = new EnrollmentKey(fixtures.student(), section);
        enrollmentService.enroll(key);

        assertThrows(DuplicateEnrollmentException.class, () -> enrollmentService.enroll(key));
    }

    @Test
    void capacityIsReportedBeforeMissingPrerequisites() {
        String basics = fixtures.course(3);
        String advanced = fixtures.course(3);
        catalog.addPrerequisite(advanced, basics);
        SectionKey section = fixtures.section(advanced, 1);

        long unprepared = fixtures.student();
        RecordsException first = assertThrows(RecordsException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(unprepared, section)));
        assertEquals(ErrorKind.PREREQUISITE_NOT_MET, first.kind());

        enrollmentService.enroll(new EnrollmentKey(passedStudent(basics), section));

        RecordsException full = assertThrows(RecordsException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(unprepared, section)));
        assertEquals(ErrorKind.CAPACITY_EXCEEDED, full.kind());
    }

    @Test
    void missingPrerequisitesAreListedAndNothingChanges() {
        String p1 = fixtures.course(3);
        String p2 = fixtures.course(4);
        String target = fixtures.course(3);
        catalog.addPrerequisite(target, p1);
        catalog.addPrerequisite(target, p2);
        SectionKey section = fixtures.section(target, 10);
        long student = passedStudent(p1);

        PrerequisiteNotMetException ex = assertThrows(PrerequisiteNotMetException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(student, section)));
        assertEquals(List.of(p2), ex.missingPrerequisites());
        assertEquals(0, enrolled(section));
        assertTrue(enrollmentService.findEnrollment(new EnrollmentKey(student, section)).isEmpty());
    }

    @Test
    void failingOrUngradedPrerequisiteDoesNotCount() {
        String basics = fixtures.course(3);
        String advanced = fixtures.course(3);
        catalog.addPrerequisite(advanced, basics);
        SectionKey basicsSection = fixtures.section(basics, 10);
        SectionKey advancedSection = fixtures.section(advanced, 10);

        long ungraded = fixtures.student();
        enrollmentService.enroll(new EnrollmentKey(ungraded, basicsSection));
        assertThrows(PrerequisiteNotMetException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(ungraded, advancedSection)));

        long failed = fixtures.student();
        enrollmentService.enroll(new EnrollmentKey(failed, basicsSection));
        enrollmentService.assignGrade(new EnrollmentKey(failed, basicsSection), Grade.F);
        assertThrows(PrerequisiteNotMetException.class,
                () -> enrollmentService.enroll(new EnrollmentKey(failed, advancedSection)));

        enrollmentService.assignGrade(new EnrollmentKey(failed, basicsSection), Grade.D);
        assertTrue(enrollmentService.enroll(new EnrollmentKey(failed, advancedSection)).active());
    }

    @Test
    void cancellingUnknownOrCancelledEnrollmentIsNotFound() {
        SectionKey section = fixtures.section(fixtures.course(3), 2);
        EnrollmentKey key = new EnrollmentKey(fixtures.student(), section);

        assertThrows(RecordNotFoundException.class, () -> enrollmentService.cancelEnrollment(key));

        enrollmentService.enroll(key);
        enrollmentService.cancelEnrollment(key);
        assertThrows(RecordNotFoundException.class, () -> enrollmentService.cancelEnrollment(key));
        assertEquals(0, enrolled(section));
    }

    @Test
    void gradeIsOverwrittenOnlyOnActiveEnrollments() {
        SectionKey section = fixtures.section(fixtures.course(3), 2);
        EnrollmentKey key = new EnrollmentKey(fixtures.student(), section);

        assertThrows(RecordNotFoundException.class, () -> enrollmentService.assignGrade(key, Grade.A));

        enrollmentService.enroll(key);
        enrollmentService.assignGrade(key, Grade.B);
        Enrollment regraded = enrollmentService.assignGrade(key, Grade.A_MINUS);
        assertEquals(Grade.A_MINUS, regraded.grade());
        assertEquals(1, enrolled(section));

        enrollmentService.cancelEnrollment(key);
        assertThrows(RecordNotFoundException.class, () -> enrollmentService.assignGrade(key, Grade.A));
    }

    @Test
    void unknownGradeSymbolIsRejectedAtTheBoundary() {
        IncorrectValueException ex = assertThrows(IncorrectValueException.class, () -> FieldValidators.grade("E"));
        assertEquals("grade", ex.field());
    }

    @Test
    void instructorsCanBeAssignedAndRemoved() {
        SectionKey section = fixtures.section(fixtures.course(3), 2);
        long instructor = fixtures.instructor();

        enrollmentService.assignInstructor(instructor, section);
        enrollmentService.assignInstructor(instructor, section);
        assertEquals(1, enrollmentService.instructorsOf(section).size());

        enrollmentService.unassignInstructor(instructor, section);
        assertTrue(enrollmentService.instructorsOf(section).isEmpty());
        assertThrows(RecordNotFoundException.class, () -> enrollmentService.unassignInstructor(instructor, section));
        assertThrows(RecordNotFoundException.class, () -> enrollmentService.assignInstructor(-1, section));
    }

    @Test
    void concurrentEnrollmentsForTheLastSeatProduceOneSuccess() throws Exception {
        SectionKey section = fixtures.section(fixtures.course(3), 1);
        long s1 = fixtures.student();
        long s2 = fixtures.student();

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<String>> results = new ArrayList<>();
        for (long student : List.of(s1, s2)) {
            Callable<String> attempt = () -> {
                start.await();
                try {
                    enrollmentService.enroll(new EnrollmentKey(student, section));
                    return "ok";
                } catch (RecordsException e) {
                    return e.kind().name();
                }
            };
            results.add(pool.submit(attempt));
        }
        start.countDown();

        List<String> outcomes = new ArrayList<>();
        for (Future<String> f : results) {
            outcomes.add(f.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertEquals(1, outcomes.stream().filter("ok"::equals).count());
        assertEquals(1, outcomes.stream().filter(ErrorKind.CAPACITY_EXCEEDED.name()::equals).count());
        assertEquals(1, enrolled(section));
        assertEquals(1, enrollmentService.roster(section).size());
    }

    private long passedStudent(String courseId) {
        SectionKey section = fixtures.section(courseId, "Spring", 2024, 10);
        long student = fixtures.student();
        EnrollmentKey key = new EnrollmentKey(student, section);
        enrollmentService.enroll(key);
        enrollmentService.assignGrade(key, Grade.B);
        return student;
    }

    /** Seat count of the section, checked against its active roster on every read. */
    private int enrolled(SectionKey section) {
        int enrolled = catalog.findSection(section).orElseThrow().enrolled();
        assertEquals(enrollments.countActive(section), enrolled);
        return enrolled;
    }
}
