package com.hhplus.checkout.infrastructure.persistence.catalog;

import com.hhplus.checkout.domain.catalog.Enrollment;
import com.hhplus.checkout.domain.catalog.EnrollmentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

/**
 * MySQL 기반 Enrollment Repository 구현
 *
 * saveIfAbsent는 바깥 트랜잭션 없이 호출됩니다 (AFTER_COMMIT 리스너).
 * saveAndFlush가 자체 트랜잭션으로 실행되므로 유니크 제약 위반을 여기서 받아 false로 돌려줄 수 있습니다.
 */
@Slf4j
@Repository
@Primary
public class MySQLEnrollmentRepository implements EnrollmentRepository {

    private final EnrollmentJpaRepository enrollmentJpaRepository;

    public MySQLEnrollmentRepository(EnrollmentJpaRepository enrollmentJpaRepository) {
        this.enrollmentJpaRepository = enrollmentJpaRepository;
    }

    @Override
    public boolean existsByCourseIdAndUserId(Long courseId, Long userId) {
        return enrollmentJpaRepository.existsByCourseIdAndUserId(courseId, userId);
    }

    @Override
    public boolean saveIfAbsent(Enrollment enrollment) {
        if (enrollmentJpaRepository.existsByCourseIdAndUserId(enrollment.getCourseId(), enrollment.getUserId())) {
            return false;
        }
        try {
            enrollmentJpaRepository.saveAndFlush(enrollment);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("[MySQLEnrollmentRepository] 동시 등록으로 이미 존재 - courseId={}, userId={}",
                    enrollment.getCourseId(), enrollment.getUserId());
            return false;
        }
    }
}
