package com.university.records.enrollment;

import com.university.records.domain.DomainModels.Enrollment;
import com.university.records.domain.DomainModels.Section;
import com.university.records.domain.DomainModels.Teaching;
import com.university.records.domain.EnrollmentKey;
import com.university.records.domain.Grade;
import com.university.records.domain.SectionKey;
import com.university.records.error.CapacityExceededException;
import com.university.records.error.DatabaseException;
import com.university.records.error.DuplicateEnrollmentException;
import com.university.records.error.PrerequisiteNotMetException;
import com.university.records.error.RecordNotFoundException;
import com.university.records.prerequisite.PrerequisiteModels.Eligibility;
import com.university.records.prerequisite.PrerequisiteResolver;
import com.university.records.repository.EnrollmentJdbcRepository;
import com.university.records.repository.InstructorJdbcRepository;
import com.university.records.repository.SectionJdbcRepository;
import com.university.records.repository.StudentJdbcRepository;
import com.university.records.repository.TeachingJdbcRepository;
import com.university.records.transaction.RecordsTransactions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
public class EnrollmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentService.class);

    private final RecordsTransactions transactions;
    private final SectionJdbcRepository sections;
    private final EnrollmentJdbcRepository enrollments;
    private final StudentJdbcRepository students;
    private final InstructorJdbcRepository instructors;
    private final TeachingJdbcRepository teachings;
    private final PrerequisiteResolver resolver;

    public EnrollmentService(RecordsTransactions transactions,
                             SectionJdbcRepository sections,
                             EnrollmentJdbcRepository enrollments,
                             StudentJdbcRepository students,
                             InstructorJdbcRepository instructors,
                             TeachingJdbcRepository teachings,
                             PrerequisiteResolver resolver) {
        this.transactions = transactions;
        this.sections = sections;
        this.enrollments = enrollments;
        this.students = students;
        this.instructors = instructors;
        this.teachings = teachings;
        this.resolver = resolver;
    }

    // section, student, duplicate, capacity, prerequisites: the first failed check is reported
    public Enrollment enroll(EnrollmentKey key) {
        SectionKey sectionKey = key.section();
        return transactions.write("Enroll " + key, () -> {
            Section section = sections.lock(sectionKey)
                    .orElseThrow(() -> new RecordNotFoundException("Section", sectionKey));
            if (!students.lock(key.studentId())) {
                throw new RecordNotFoundException("Student", key.studentId());
            }

            Optional<Enrollment> existing = enrollments.lock(key);
            if (existing.isPresent() && existing.get().active()) {
                log.debug("Rejected enrollment {}: already active", key);
                throw new DuplicateEnrollmentException(key);
            }
            if (section.openSeats() <= 0) {
                log.debug("Rejected enrollment {}: section full at {}", key, section.capacity());
                throw new CapacityExceededException(sectionKey, section.capacity());
            }
            Eligibility eligibility = resolver.explain(key.studentId(), sectionKey.courseId());
            if (!eligibility.eligible()) {
                log.debug("Rejected enrollment {}: missing {}", key, eligibility.missingPrerequisites());
                throw new PrerequisiteNotMetException(key.studentId(), sectionKey.courseId(), eligibility.missingPrerequisites());
            }

            takeSeat(section);
            LocalDate today = LocalDate.now();
            if (existing.isPresent()) {
                enrollments.reactivate(key, today);
            } else {
                insert(key, today);
            }
            log.info("Enrolled student {} in {} ({}/{} seats taken)", key.studentId(), sectionKey,
                    section.enrolled() + 1, section.capacity());
            return new Enrollment(key, false, null, today);
        });
    }

    public void cancelEnrollment(EnrollmentKey key) {
        SectionKey sectionKey = key.section();
        transactions.run("Cancel enrollment " + key, () -> {
            sections.lock(sectionKey).orElseThrow(() -> new RecordNotFoundException("Section", sectionKey));
            if (enrollments.cancel(key) == 0) {
                throw new RecordNotFoundException("Takes", key);
            }
            if (sections.releaseSeat(sectionKey) == 0) {
                throw new DatabaseException("Section " + sectionKey + " has no taken seat to release.");
            }
            log.info("Cancelled enrollment of student {} in {}", key.studentId(), sectionKey);
        });
    }

    public Enrollment assignGrade(EnrollmentKey key, Grade grade) {
        return transactions.write("Assign grade " + key, () -> {
            if (enrollments.updateGrade(key, grade) == 0) {
                throw new RecordNotFoundException("Takes", key);
            }
            log.info("Graded student {} in {}: {}", key.studentId(), key.section(), grade.symbol());
            return enrollments.find(key).orElseThrow(() -> new RecordNotFoundException("Takes", key));
        });
    }

    public void assignInstructor(long instructorId, SectionKey sectionKey) {
        transactions.run("Assign instructor " + instructorId + " to " + sectionKey, () -> {
            if (sections.find(sectionKey).isEmpty()) {
                throw new RecordNotFoundException("Section", sectionKey);
            }
            if (!instructors.exists(instructorId)) {
                throw new RecordNotFoundException("Instructor", instructorId);
            }
            teachings.upsert(instructorId, sectionKey);
            log.info("Instructor {} teaches {}", instructorId, sectionKey);
        });
    }

    public void unassignInstructor(long instructorId, SectionKey sectionKey) {
        transactions.run("Unassign instructor " + instructorId + " from " + sectionKey, () -> {
            if (teachings.delete(instructorId, sectionKey) == 0) {
                throw new RecordNotFoundException("Teaches", instructorId + "-" + sectionKey);
            }
            log.info("Instructor {} no longer teaches {}", instructorId, sectionKey);
        });
    }

    public Optional<Enrollment> findEnrollment(EnrollmentKey key) {
        return transactions.read("Find enrollment " + key, () -> enrollments.find(key));
    }

    public List<Enrollment> roster(SectionKey sectionKey) {
        return transactions.read("Roster of " + sectionKey, () -> {
            if (sections.find(sectionKey).isEmpty()) {
                throw new RecordNotFoundException("Section", sectionKey);
            }
            return enrollments.loadRoster(sectionKey);
        });
    }

    public List<Teaching> instructorsOf(SectionKey sectionKey) {
        return transactions.read("Instructors of " + sectionKey, () -> teachings.loadForSection(sectionKey));
    }

    private void takeSeat(Section section) {
        try {
            if (sections.takeSeat(section.key()) == 0) {
                throw new CapacityExceededException(section.key(), section.capacity());
            }
        } catch (DataIntegrityViolationException e) {
            throw new CapacityExceededException(section.key(), e);
        }
    }

    private void insert(EnrollmentKey key, LocalDate today) {
        try {
            enrollments.insert(key, today);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEnrollmentException(key);
        }
    }
}
