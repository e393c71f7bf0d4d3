package com.hhplus.checkout.domain.catalog;

import java.util.Optional;

public interface CourseRepository {

    Optional<Course> findById(Long courseId);

    Course save(Course course);
}
