package com.hhplus.checkout.infrastructure.persistence.catalog;

import com.hhplus.checkout.domain.catalog.Course;
import com.hhplus.checkout.domain.catalog.CourseRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public class MySQLCourseRepository implements CourseRepository {

    private final CourseJpaRepository courseJpaRepository;

    public MySQLCourseRepository(CourseJpaRepository courseJpaRepository) {
        this.courseJpaRepository = courseJpaRepository;
    }

    @Override
    public Optional<Course> findById(Long courseId) {
        return courseJpaRepository.findById(courseId);
    }

    @Override
    public Course save(Course course) {
        return courseJpaRepository.save(course);
    }
}
