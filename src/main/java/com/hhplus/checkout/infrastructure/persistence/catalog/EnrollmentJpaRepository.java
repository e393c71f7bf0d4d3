package com.hhplus.checkout.infrastructure.persistence.catalog;

import com.hhplus.checkout.domain.catalog.Enrollment;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EnrollmentJpaRepository extends JpaRepository<Enrollment, Long> {

    boolean existsByCourseIdAndUserId(Long courseId, Long userId);
}
