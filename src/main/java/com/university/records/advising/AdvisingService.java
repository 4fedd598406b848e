package com.university.records.advising;

import com.university.records.domain.DomainModels.Advisor;
import com.university.records.domain.DomainModels.AdvisorHistoryEntry;
import com.university.records.error.IncorrectValueException;
import com.university.records.error.RecordNotFoundException;
import com.university.records.repository.AdvisorJdbcRepository;
import com.university.records.repository.InstructorJdbcRepository;
import com.university.records.repository.StudentJdbcRepository;
import com.university.records.transaction.RecordsTransactions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
public class AdvisingService {
    private static final Logger log = LoggerFactory.getLogger(AdvisingService.class);

    private final RecordsTransactions transactions;
    private final AdvisorJdbcRepository advisors;
    private final StudentJdbcRepository students;
    private final InstructorJdbcRepository instructors;

    public AdvisingService(RecordsTransactions transactions,
                           AdvisorJdbcRepository advisors,
                           StudentJdbcRepository students,
                           InstructorJdbcRepository instructors) {
        this.transactions = transactions;
        this.advisors = advisors;
        this.students = students;
        this.instructors = instructors;
    }

    /**
     * Destructive: overwrites the student's current advisor row. The replaced row is kept only in
     * {@link #advisorHistory(long)}.
     */
    public Advisor assignAdvisor(long studentId, long instructorId, LocalDate startDate) {
        return transactions.write("Assign advisor " + instructorId + " to student " + studentId, () -> {
            requireStudent(studentId);
            requireInstructor(instructorId);
            LocalDate start = startDate == null ? LocalDate.now() : startDate;

            advisors.lock(studentId).ifPresent(previous -> {
                advisors.archive(previous, Instant.now());
                log.info("Replacing advisor {} of student {} (since {})", previous.instructorId(), studentId, previous.startDate());
            });
            advisors.upsert(studentId, instructorId, start);
            log.info("Instructor {} advises student {} from {}", instructorId, studentId, start);
            return new Advisor(studentId, instructorId, start, null);
        });
    }

    public Advisor updateAdvisor(long studentId, long newInstructorId, LocalDate endDate) {
        return transactions.write("Update advisor of student " + studentId, () -> {
            requireStudent(studentId);
            requireInstructor(newInstructorId);
            Advisor current = advisors.lock(studentId)
                    .orElseThrow(() -> new RecordNotFoundException("Advisor", studentId));
            if (endDate != null && current.startDate() != null && endDate.isBefore(current.startDate())) {
                throw new IncorrectValueException("end_date", endDate, "before start date " + current.startDate());
            }
            if (current.instructorId() == null || current.instructorId() != newInstructorId) {
                advisors.archive(current, Instant.now());
            }
            advisors.update(studentId, newInstructorId, endDate);
            log.info("Advisor of student {} is now {} (end {})", studentId, newInstructorId, endDate);
            return new Advisor(studentId, newInstructorId, current.startDate(), endDate);
        });
    }

    public Optional<Advisor> currentAdvisor(long studentId) {
        return transactions.read("Advisor of student " + studentId, () -> {
            requireStudent(studentId);
            return advisors.find(studentId);
        });
    }

    public List<AdvisorHistoryEntry> advisorHistory(long studentId) {
        return transactions.read("Advisor history of student " + studentId, () -> {
            requireStudent(studentId);
            return advisors.loadHistory(studentId);
        });
    }

    private void requireStudent(long studentId) {
        if (!students.exists(studentId)) {
            throw new RecordNotFoundException("Student", studentId);
        }
    }

    private void requireInstructor(long instructorId) {
        if (!instructors.exists(instructorId)) {
            throw new RecordNotFoundException("Instructor", instructorId);
        }
    }
}
