package com.hhplus.checkout.infrastructure.persistence.catalog;

import com.hhplus.checkout.domain.catalog.Course;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CourseJpaRepository extends JpaRepository<Course, Long> {
}
