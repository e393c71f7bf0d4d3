package com.hhplus.checkout.application.catalog;

import com.hhplus.checkout.common.exception.ConflictException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.catalog.*;
import com.hhplus.checkout.domain.common.vo.Money;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * CatalogService - 카탈로그 검증 및 가격 조회
 *
 * 장바구니 추가와 체크아웃 재검증이 같은 규칙을 쓰도록 한 곳에 모읍니다.
 *
 * 상품 규칙:
 * - ACTIVE 상태만 구매 가능
 * - 옵션을 지정하면 해당 상품의 옵션이어야 함
 * - 재고를 추적하는 상품은 수량만큼 재고가 있어야 함
 *
 * 강의 규칙:
 * - 공개(published)되고 가격이 있는 강의만 (무료 강의는 장바구니를 거치지 않음)
 * - 이미 수강 중인 사용자는 구매 불가
 */
@Service
public class CatalogService {

    private final ProductRepository productRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final String storeCurrency;

    public CatalogService(ProductRepository productRepository,
                          CourseRepository courseRepository,
                          EnrollmentRepository enrollmentRepository,
                          @Value("${checkout.currency:USD}") String storeCurrency) {
        this.productRepository = productRepository;
        this.courseRepository = courseRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.storeCurrency = storeCurrency.trim().toUpperCase(Locale.ROOT);
    }

    public Money zero() {
        return Money.zero(storeCurrency);
    }

    public PricedItem priceProduct(Long productId, Long variantId, int quantity) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PRODUCT_NOT_FOUND, productId));
        if (!product.isActive()) {
            throw new ValidationException(ErrorCode.PRODUCT_NOT_AVAILABLE, "productId=" + productId);
        }

        ProductVariant variant = null;
        if (variantId != null) {
            variant = productRepository.findVariantById(variantId)
                    .filter(v -> v.belongsTo(productId))
                    .orElseThrow(() -> new ValidationException(ErrorCode.VARIANT_MISMATCH,
                            "productId=" + productId + ", variantId=" + variantId));
        }

        if (!product.hasStockFor(variant, quantity)) {
            throw new ValidationException(ErrorCode.INSUFFICIENT_STOCK,
                    "productId=" + productId + ", quantity=" + quantity);
        }

        Money unitPrice = requireStoreCurrency(product.effectivePrice(variant));
        String name = variant == null ? product.getName() : product.getName() + " - " + variant.getName();
        return new PricedItem(false, productId, variantId, null, name, unitPrice, quantity);
    }

    /**
     * @param userId 구매자 (강의는 로그인 사용자만 구매 가능하므로 필수)
     */
    public PricedItem priceCourse(Long courseId, Long userId) {
        if (userId == null) {
            throw new ValidationException(ErrorCode.CART_LOGIN_REQUIRED);
        }
        Course course = courseRepository.findById(courseId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.COURSE_NOT_FOUND, courseId));
        if (!course.isPublished()) {
            throw new ValidationException(ErrorCode.COURSE_NOT_PURCHASABLE, "공개되지 않은 강의 - courseId=" + courseId);
        }
        if (!course.isPriced()) {
            throw new ValidationException(ErrorCode.COURSE_NOT_PURCHASABLE, "무료 강의는 바로 수강 신청하세요 - courseId=" + courseId);
        }
        if (enrollmentRepository.existsByCourseIdAndUserId(courseId, userId)) {
            throw new ConflictException(ErrorCode.COURSE_ALREADY_ENROLLED, "courseId=" + courseId);
        }

        Money price = requireStoreCurrency(course.priceAsMoney());
        return new PricedItem(true, null, null, courseId, course.getTitle(), price, 1);
    }

    private Money requireStoreCurrency(Money price) {
        if (!storeCurrency.equals(price.getCurrency())) {
            throw new ValidationException(ErrorCode.CURRENCY_MISMATCH,
                    "store=" + storeCurrency + ", item=" + price.getCurrency());
        }
        return price;
    }
}
