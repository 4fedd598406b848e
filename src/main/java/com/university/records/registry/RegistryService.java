package com.university.records.registry;

import com.university.records.domain.AcademicYear;
import com.university.records.domain.DomainModels.Department;
import com.university.records.domain.DomainModels.DepartmentChanges;
import com.university.records.domain.DomainModels.Instructor;
import com.university.records.domain.DomainModels.InstructorChanges;
import com.university.records.domain.DomainModels.NewInstructor;
import com.university.records.domain.DomainModels.NewStudent;
import com.university.records.domain.DomainModels.Student;
import com.university.records.domain.DomainModels.StudentChanges;
import com.university.records.domain.DomainModels.WorkloadEntry;
import com.university.records.domain.EnrollmentKey;
import com.university.records.domain.SectionKey;
import com.university.records.domain.Semester;
import com.university.records.error.DatabaseException;
import com.university.records.error.IncorrectValueException;
import com.university.records.error.RecordNotFoundException;
import com.university.records.repository.DepartmentJdbcRepository;
import com.university.records.repository.EnrollmentJdbcRepository;
import com.university.records.repository.InstructorJdbcRepository;
import com.university.records.repository.SectionJdbcRepository;
import com.university.records.repository.StudentJdbcRepository;
import com.university.records.transaction.RecordsTransactions;
import com.university.records.validation.FieldValidators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class RegistryService {
    private static final Logger log = LoggerFactory.getLogger(RegistryService.class);

    private final RecordsTransactions transactions;
    private final DepartmentJdbcRepository departments;
    private final StudentJdbcRepository students;
    private final InstructorJdbcRepository instructors;
    private final EnrollmentJdbcRepository enrollments;
    private final SectionJdbcRepository sections;

    public RegistryService(RecordsTransactions transactions,
                           DepartmentJdbcRepository departments,
                           StudentJdbcRepository students,
                           InstructorJdbcRepository instructors,
                           EnrollmentJdbcRepository enrollments,
                           SectionJdbcRepository sections) {
        this.transactions = transactions;
        this.departments = departments;
        this.students = students;
        this.instructors = instructors;
        this.enrollments = enrollments;
        this.sections = sections;
    }

    // departments

    public Department createDepartment(Department department) {
        Department valid = new Department(
                FieldValidators.required("dept_name", department.name()),
                department.phone(),
                FieldValidators.nonNegativeAmount("budget", department.budget()),
                department.building(),
                department.dean());
        return transactions.write("Create department " + valid.name(), () -> {
            try {
                departments.insert(valid);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Department '" + valid.name() + "' already exists.", e);
            }
            log.info("Created department {}", valid.name());
            return valid;
        });
    }

    public void updateDepartment(String name, DepartmentChanges changes) {
        requireChanges(changes.phone(), changes.budget(), changes.building(), changes.dean());
        if (changes.budget() != null) {
            FieldValidators.nonNegativeAmount("budget", changes.budget());
        }
        transactions.run("Update department " + name, () -> {
            if (departments.update(name, changes) == 0) {
                throw new RecordNotFoundException("Department", name);
            }
        });
    }

    public void deleteDepartment(String name) {
        transactions.run("Delete department " + name, () -> {
            if (!departments.exists(name)) {
                throw new RecordNotFoundException("Department", name);
            }
            try {
                departments.delete(name);
            } catch (DataIntegrityViolationException e) {
                throw new DatabaseException("Department '" + name + "' is still referenced by students, instructors or courses.", e);
            }
            log.info("Deleted department {}", name);
        });
    }

    public Optional<Department> findDepartment(String name) {
        return transactions.read("Find department " + name, () -> departments.find(name));
    }

    public List<Department> departments() {
        return transactions.read("List departments", departments::findAll);
    }

    // students

    public long createStudent(NewStudent student) {
        FieldValidators.required("fname", student.firstName());
        FieldValidators.required("lname", student.lastName());
        FieldValidators.totalCredits(student.totalCredits());
        if (student.email() == null) {
            throw new IncorrectValueException("email", null);
        }
        return transactions.write("Create student " + student.email(), () -> {
            requireDepartment(student.deptName());
            long id;
            try {
                id = students.insert(student);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Email '" + student.email() + "' is already registered.", e);
            }
            log.info("Created student {} in {}", id, student.deptName());
            return id;
        });
    }

    public void updateStudent(long id, StudentChanges changes) {
        requireChanges(changes.firstName(), changes.lastName(), changes.deptName(), changes.major(),
                changes.totalCredits(), changes.email(), changes.enrollmentDate(), changes.status());
        if (changes.totalCredits() != null) {
            FieldValidators.totalCredits(changes.totalCredits());
        }
        transactions.run("Update student " + id, () -> {
            if (!students.exists(id)) {
                throw new RecordNotFoundException("Student", id);
            }
            if (changes.deptName() != null) {
                requireDepartment(changes.deptName());
            }
            try {
                students.update(id, changes);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Email '" + changes.email() + "' is already registered.", e);
            }
        });
    }

    // sections are locked before the student row, the same order enroll uses
    public void deleteStudent(long id) {
        transactions.run("Delete student " + id, () -> {
            Set<SectionKey> locked = new HashSet<>();
            lockEnrolledSections(id, locked);
            if (!students.lock(id)) {
                throw new RecordNotFoundException("Student", id);
            }
            List<EnrollmentKey> active = lockEnrolledSections(id, locked);
            for (EnrollmentKey key : active) {
                if (sections.releaseSeat(key.section()) == 0) {
                    throw new DatabaseException("Section " + key.section() + " has no taken seat to release.");
                }
            }
            students.delete(id);
            log.info("Deleted student {} and released {} seats", id, active.size());
        });
    }

    public Optional<Student> findStudent(long id) {
        return transactions.read("Find student " + id, () -> students.find(id));
    }

    public List<Student> students(String deptName) {
        return transactions.read("List students", () -> students.findAll(deptName));
    }

    // instructors

    public long createInstructor(NewInstructor instructor) {
        FieldValidators.required("fname", instructor.firstName());
        FieldValidators.required("lname", instructor.lastName());
        FieldValidators.nonNegativeAmount("salary", instructor.salary());
        if (instructor.email() == null) {
            throw new IncorrectValueException("email", null);
        }
        if (instructor.rank() == null) {
            throw new IncorrectValueException("academic rank", null);
        }
        return transactions.write("Create instructor " + instructor.email(), () -> {
            requireDepartment(instructor.deptName());
            long id;
            try {
                id = instructors.insert(instructor);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Email '" + instructor.email() + "' is already registered.", e);
            }
            log.info("Created instructor {} in {}", id, instructor.deptName());
            return id;
        });
    }

    public void updateInstructor(long id, InstructorChanges changes) {
        requireChanges(changes.firstName(), changes.lastName(), changes.deptName(), changes.rank(),
                changes.salary(), changes.email(), changes.hireDate(), changes.office());
        if (changes.salary() != null) {
            FieldValidators.nonNegativeAmount("salary", changes.salary());
        }
        transactions.run("Update instructor " + id, () -> {
            if (!instructors.exists(id)) {
                throw new RecordNotFoundException("Instructor", id);
            }
            if (changes.deptName() != null) {
                requireDepartment(changes.deptName());
            }
            try {
                instructors.update(id, changes);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Email '" + changes.email() + "' is already registered.", e);
            }
        });
    }

    public void deleteInstructor(long id) {
        transactions.run("Delete instructor " + id, () -> {
            if (instructors.delete(id) == 0) {
                throw new RecordNotFoundException("Instructor", id);
            }
            log.info("Deleted instructor {}", id);
        });
    }

    public Optional<Instructor> findInstructor(long id) {
        return transactions.read("Find instructor " + id, () -> instructors.find(id));
    }

    public List<Instructor> instructors(String deptName) {
        return transactions.read("List instructors", () -> instructors.findAll(deptName));
    }

    public List<WorkloadEntry> workload(long instructorId, Semester semester, AcademicYear year) {
        return transactions.read("Workload of instructor " + instructorId, () -> {
            if (!instructors.exists(instructorId)) {
                throw new RecordNotFoundException("Instructor", instructorId);
            }
            return instructors.workload(instructorId, semester, year);
        });
    }

    // Returns the active keys read once every section they name is locked; no cancel can then commit in between.
    private List<EnrollmentKey> lockEnrolledSections(long studentId, Set<SectionKey> locked) {
        while (true) {
            List<EnrollmentKey> active = enrollments.loadActiveKeys(studentId);
            List<SectionKey> unlocked = active.stream()
                    .map(EnrollmentKey::section)
                    .filter(s -> !locked.contains(s))
                    .toList();
            if (unlocked.isEmpty()) {
                return active;
            }
            for (SectionKey section : unlocked) {
                sections.lock(section);
                locked.add(section);
            }
        }
    }

    private void requireDepartment(String name) {
        if (name == null || !departments.exists(name)) {
            throw new RecordNotFoundException("Department", name);
        }
    }

    private static void requireChanges(Object... values) {
        for (Object v : values) {
            if (v != null) return;
        }
        throw new IncorrectValueException("updates", "none", "no field to update");
    }
}
