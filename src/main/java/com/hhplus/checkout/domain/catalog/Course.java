package com.hhplus.checkout.domain.catalog;

import com.hhplus.checkout.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Course 엔티티 (카탈로그 읽기 모델)
 *
 * 무료 강의(price가 null 또는 0)는 장바구니를 거치지 않고 바로 수강 신청합니다.
 */
@Entity
@Table(name = "courses")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Course {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "course_id")
    private Long courseId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "published", nullable = false)
    private boolean published;

    @Column(name = "price")
    private Long price;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isPriced() {
        return price != null && price > 0;
    }

    public Money priceAsMoney() {
        return Money.ofMinor(price == null ? 0L : price, currency);
    }
}
