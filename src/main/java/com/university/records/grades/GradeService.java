package com.university.records.grades;

import com.university.records.domain.DomainModels.GpaSummary;
import com.university.records.domain.DomainModels.TranscriptEntry;
import com.university.records.error.RecordNotFoundException;
import com.university.records.repository.EnrollmentJdbcRepository;
import com.university.records.repository.EnrollmentJdbcRepository.GradedCreditRow;
import com.university.records.repository.StudentJdbcRepository;
import com.university.records.transaction.RecordsTransactions;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class GradeService {
    private final RecordsTransactions transactions;
    private final EnrollmentJdbcRepository enrollments;
    private final StudentJdbcRepository students;

    public GradeService(RecordsTransactions transactions,
                        EnrollmentJdbcRepository enrollments,
                        StudentJdbcRepository students) {
        this.transactions = transactions;
        this.enrollments = enrollments;
        this.students = students;
    }

    public GpaSummary calculateGpa(long studentId) {
        return transactions.read("GPA of student " + studentId, () -> {
            if (!students.exists(studentId)) {
                throw new RecordNotFoundException("Student", studentId);
            }
            List<GradedCreditRow> rows = enrollments.loadGradedCredits(studentId);
            double points = 0.0;
            int credits = 0;
            for (GradedCreditRow row : rows) {
                points += row.credits() * row.grade().points();
                credits += row.credits();
            }
            if (credits == 0) {
                throw new RecordNotFoundException("Graded coursework", studentId);
            }
            return new GpaSummary(studentId, points / credits, credits, rows.size());
        });
    }

    public List<TranscriptEntry> transcript(long studentId) {
        return transactions.read("Transcript of student " + studentId, () -> {
            if (!students.exists(studentId)) {
                throw new RecordNotFoundException("Student", studentId);
            }
            return enrollments.loadTranscript(studentId);
        });
    }
}
