package com.university.records.catalog;

import com.university.records.domain.AcademicYear;
import com.university.records.domain.DomainModels.Course;
import com.university.records.domain.DomainModels.CourseChanges;
import com.university.records.domain.DomainModels.NewSection;
import com.university.records.domain.DomainModels.Prerequisite;
import com.university.records.domain.DomainModels.Section;
import com.university.records.domain.DomainModels.SectionChanges;
import com.university.records.domain.SectionKey;
import com.university.records.domain.Semester;
import com.university.records.error.DatabaseException;
import com.university.records.error.IncorrectValueException;
import com.university.records.error.RecordNotFoundException;
import com.university.records.prerequisite.PrerequisiteResolver;
import com.university.records.repository.CourseJdbcRepository;
import com.university.records.repository.DepartmentJdbcRepository;
import com.university.records.repository.PrerequisiteJdbcRepository;
import com.university.records.repository.SectionJdbcRepository;
import com.university.records.transaction.RecordsTransactions;
import com.university.records.validation.FieldValidators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class CatalogService {
    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final RecordsTransactions transactions;
    private final CourseJdbcRepository courses;
    private final PrerequisiteJdbcRepository prerequisites;
    private final SectionJdbcRepository sections;
    private final DepartmentJdbcRepository departments;
    private final PrerequisiteResolver resolver;

    public CatalogService(RecordsTransactions transactions,
                          CourseJdbcRepository courses,
                          PrerequisiteJdbcRepository prerequisites,
                          SectionJdbcRepository sections,
                          DepartmentJdbcRepository departments,
                          PrerequisiteResolver resolver) {
        this.transactions = transactions;
        this.courses = courses;
        this.prerequisites = prerequisites;
        this.sections = sections;
        this.departments = departments;
        this.resolver = resolver;
    }

    // courses

    public Course createCourse(Course course) {
        Course valid = new Course(
                FieldValidators.required("course_id", course.id()),
                FieldValidators.required("title", course.title()),
                FieldValidators.credits(course.credits()),
                course.deptName(),
                course.description());
        return transactions.write("Create course " + valid.id(), () -> {
            requireDepartment(valid.deptName());
            try {
                courses.insert(valid);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Course '" + valid.id() + "' already exists.", e);
            }
            log.info("Created course {} ({} credits)", valid.id(), valid.credits());
            return valid;
        });
    }

    public void updateCourse(String courseId, CourseChanges changes) {
        if (changes.title() == null && changes.credits() == null && changes.deptName() == null && changes.description() == null) {
            throw new IncorrectValueException("updates", "none", "no field to update");
        }
        if (changes.credits() != null) {
            FieldValidators.credits(changes.credits());
        }
        transactions.run("Update course " + courseId, () -> {
            if (!courses.exists(courseId)) {
                throw new RecordNotFoundException("Course", courseId);
            }
            if (changes.deptName() != null) {
                requireDepartment(changes.deptName());
            }
            courses.update(courseId, changes);
        });
    }

    // edges naming the course as a prerequisite are left dangling
    public void deleteCourse(String courseId) {
        transactions.run("Delete course " + courseId, () -> {
            if (courses.delete(courseId) == 0) {
                throw new RecordNotFoundException("Course", courseId);
            }
            log.info("Deleted course {}", courseId);
        });
    }

    public Optional<Course> findCourse(String courseId) {
        return transactions.read("Find course " + courseId, () -> courses.find(courseId));
    }

    public List<Course> courses(String deptName) {
        return transactions.read("List courses", () -> courses.findAll(deptName));
    }

    // prerequisites

    public void addPrerequisite(String courseId, String prerequisiteId) {
        transactions.run("Add prerequisite " + prerequisiteId + " to " + courseId, () -> {
            requireCourse(courseId);
            requireCourse(prerequisiteId);
            prerequisites.lockGraph();
            if (prerequisites.loadDirectPrerequisiteIds(courseId).contains(prerequisiteId)) {
                throw new IncorrectValueException("prereq_id", prerequisiteId, "already a prerequisite of " + courseId);
            }
            if (resolver.wouldCreateCycle(courseId, prerequisiteId)) {
                throw new IncorrectValueException("prereq_id", prerequisiteId, "creates a prerequisite cycle with " + courseId);
            }
            prerequisites.add(courseId, prerequisiteId);
            log.info("{} now requires {}", courseId, prerequisiteId);
        });
    }

    public void removePrerequisite(String courseId, String prerequisiteId) {
        transactions.run("Remove prerequisite " + prerequisiteId + " from " + courseId, () -> {
            requireCourse(courseId);
            requireCourse(prerequisiteId);
            prerequisites.lockGraph();
            if (prerequisites.remove(courseId, prerequisiteId) == 0) {
                throw new RecordNotFoundException("Prerequisite", courseId + "->" + prerequisiteId);
            }
        });
    }

    public List<Prerequisite> prerequisites(String courseId) {
        return transactions.read("Prerequisites of " + courseId, () -> {
            requireCourse(courseId);
            return prerequisites.loadForCourse(courseId);
        });
    }

    // sections

    public Section createSection(NewSection section) {
        if (section.timeSlot() == null) {
            throw new IncorrectValueException("time_slot", null);
        }
        FieldValidators.capacity(section.capacity());
        SectionKey key = section.key();
        return transactions.write("Create section " + key, () -> {
            requireCourse(key.courseId());
            try {
                sections.insert(section);
            } catch (DuplicateKeyException e) {
                throw new DatabaseException("Section " + key + " already exists.", e);
            }
            log.info("Created section {} with {} seats", key, section.capacity());
            return new Section(key, section.timeSlot(), section.room(), section.capacity(), 0);
        });
    }

    public Section updateSection(SectionKey key, SectionChanges changes) {
        if (changes.timeSlot() == null && changes.room() == null && changes.capacity() == null) {
            throw new IncorrectValueException("updates", "none", "no field to update");
        }
        if (changes.capacity() != null) {
            FieldValidators.capacity(changes.capacity());
        }
        return transactions.write("Update section " + key, () -> {
            Section current = sections.lock(key).orElseThrow(() -> new RecordNotFoundException("Section", key));
            if (changes.capacity() != null && changes.capacity() < current.enrolled()) {
                throw new IncorrectValueException("capacity", changes.capacity(),
                        "below the " + current.enrolled() + " seats already taken");
            }
            sections.update(key, changes);
            return sections.find(key).orElseThrow(() -> new RecordNotFoundException("Section", key));
        });
    }

    public void deleteSection(SectionKey key) {
        transactions.run("Delete section " + key, () -> {
            if (sections.delete(key) == 0) {
                throw new RecordNotFoundException("Section", key);
            }
            log.info("Deleted section {}", key);
        });
    }

    public Optional<Section> findSection(SectionKey key) {
        return transactions.read("Find section " + key, () -> sections.find(key));
    }

    public List<Section> sections(Semester semester, AcademicYear year) {
        return transactions.read("List sections", () -> sections.findAll(semester, year));
    }

    private void requireCourse(String courseId) {
        if (!courses.exists(courseId)) {
            throw new RecordNotFoundException("Course", courseId);
        }
    }

    private void requireDepartment(String name) {
        if (name == null || !departments.exists(name)) {
            throw new RecordNotFoundException("Department", name);
        }
    }
}
