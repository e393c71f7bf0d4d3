package com.hhplus.checkout.domain.catalog;

public interface EnrollmentRepository {

    boolean existsByCourseIdAndUserId(Long courseId, Long userId);

    /**
     * (course, user) 조합이 없을 때만 저장합니다.
     *
     * @return 새로 저장했으면 true, 이미 존재하면 false
     */
    boolean saveIfAbsent(Enrollment enrollment);
}
