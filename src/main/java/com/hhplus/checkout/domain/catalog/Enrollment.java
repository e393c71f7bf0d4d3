package com.hhplus.checkout.domain.catalog;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 수강 권한
 *
 * (course_id, user_id) 유니크 제약으로 같은 강의 권한이 두 번 부여되지 않습니다.
 */
@Entity
@Table(name = "enrollments",
        uniqueConstraints = @UniqueConstraint(name = "uk_enrollment_course_user", columnNames = {"course_id", "user_id"}))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Enrollment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "enrollment_id")
    private Long enrollmentId;

    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "source", nullable = false)
    @Enumerated(EnumType.STRING)
    private EnrollmentSource source;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "enrolled_at", nullable = false)
    private LocalDateTime enrolledAt;

    public static Enrollment purchased(Long courseId, Long userId, Long orderId) {
        return Enrollment.builder()
                .courseId(courseId)
                .userId(userId)
                .orderId(orderId)
                .source(EnrollmentSource.PURCHASE)
                .enrolledAt(LocalDateTime.now())
                .build();
    }
}
