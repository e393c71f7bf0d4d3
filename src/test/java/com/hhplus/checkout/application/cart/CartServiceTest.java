package com.hhplus.checkout.application.cart;

import com.hhplus.checkout.application.catalog.CatalogService;
import com.hhplus.checkout.common.exception.ConflictException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.cart.CartOwner;
import com.hhplus.checkout.domain.catalog.Course;
import com.hhplus.checkout.domain.catalog.CourseRepository;
import com.hhplus.checkout.domain.catalog.EnrollmentRepository;
import com.hhplus.checkout.domain.catalog.Product;
import com.hhplus.checkout.domain.catalog.ProductRepository;
import com.hhplus.checkout.domain.catalog.ProductStatus;
import com.hhplus.checkout.domain.catalog.ProductVariant;
import com.hhplus.checkout.domain.common.vo.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

/**
 * CartServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상:
 * - 장바구니 지연 생성과 합계 계산
 * - 같은 (상품, 옵션) 추가 시 수량 합산 (동시 요청 포함)
 * - 수량 0 수정 = 항목 삭제
 * - 강의 항목 규칙 (로그인 필수, 중복 추가 무시)
 *
 * 카탈로그 저장소는 Mock, 장바구니 저장소는 In-Memory 구현을 사용합니다.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final Long PRODUCT_ID = 1L;
    private static final Long VARIANT_ID = 11L;
    private static final Long COURSE_ID = 100L;
    private static final Long USER_ID = 10L;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private EnrollmentRepository enrollmentRepository;

    private InMemoryCartRepository cartRepository;
    private CartService cartService;

    @BeforeEach
    void setUp() {
        cartRepository = new InMemoryCartRepository();
        CatalogService catalogService = new CatalogService(productRepository, courseRepository, enrollmentRepository, "USD");
        cartService = new CartService(cartRepository, catalogService);

        Product product = Product.builder()
                .productId(PRODUCT_ID)
                .name("티셔츠")
                .status(ProductStatus.ACTIVE)
                .price(3000L)
                .salePrice(2500L)
                .currency("USD")
                .trackStock(false)
                .build();
        ProductVariant variant = ProductVariant.builder()
                .variantId(VARIANT_ID)
                .productId(PRODUCT_ID)
                .name("XL")
                .price(2700L)
                .build();
        Course course = Course.builder()
                .courseId(COURSE_ID)
                .title("Spring 입문")
                .published(true)
                .price(1000L)
                .currency("USD")
                .build();

        when(productRepository.findById(PRODUCT_ID)).thenReturn(Optional.of(product));
        when(productRepository.findVariantById(VARIANT_ID)).thenReturn(Optional.of(variant));
        when(courseRepository.findById(COURSE_ID)).thenReturn(Optional.of(course));
        when(enrollmentRepository.existsByCourseIdAndUserId(anyLong(), anyLong())).thenReturn(false);
    }

    // ========== 장바구니 조회 ==========

    @Test
    @DisplayName("장바구니 조회 - 없으면 빈 장바구니를 생성한다")
    void testGetCart_CreatesEmptyCart() {
        // Given
        CartOwner owner = CartOwner.ofSession("session-abc");

        // When
        CartSummary first = cartService.getCart(owner);
        CartSummary second = cartService.getCart(owner);

        // Then
        assertNotNull(first.getCartId());
        assertEquals(first.getCartId(), second.getCartId());
        assertTrue(first.isEmpty());
        assertEquals(Money.zero("USD"), first.getSubtotal());
    }

    // ========== 상품 추가 ==========

    @Test
    @DisplayName("상품 추가 - 같은 상품을 두 번 추가하면 한 줄에 수량이 합산된다")
    void testAddProduct_MergesQuantity() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);

        // When
        cartService.addProduct(owner, PRODUCT_ID, null, 2);
        CartSummary summary = cartService.addProduct(owner, PRODUCT_ID, null, 3);

        // Then
        assertEquals(1, summary.getLines().size());
        assertEquals(5, summary.getLines().get(0).getQuantity());
        assertEquals(Money.parse("125.00", "USD"), summary.getSubtotal());
        assertTrue(summary.isHasProducts());
    }

    @Test
    @DisplayName("상품 추가 - 옵션이 다르면 별도 항목이 되고 옵션 가격을 적용한다")
    void testAddProduct_VariantIsSeparateLine() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);

        // When
        cartService.addProduct(owner, PRODUCT_ID, null, 1);
        CartSummary summary = cartService.addProduct(owner, PRODUCT_ID, VARIANT_ID, 1);

        // Then
        assertEquals(2, summary.getLines().size());
        assertEquals("티셔츠 - XL", summary.getLines().get(1).getName());
        assertEquals(Money.parse("52.00", "USD"), summary.getSubtotal());
    }

    @Test
    @DisplayName("상품 추가 - 합계 수량이 1000을 넘으면 거부한다")
    void testAddProduct_ExceedsMaxQuantity() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);
        cartService.addProduct(owner, PRODUCT_ID, null, 999);

        // When & Then
        ValidationException e = assertThrows(ValidationException.class,
                () -> cartService.addProduct(owner, PRODUCT_ID, null, 2));
        assertEquals(ErrorCode.CART_INVALID_QUANTITY, e.getErrorCode());
    }

    @Test
    @DisplayName("상품 추가 - 판매 중이 아닌 상품은 거부한다")
    void testAddProduct_InactiveProduct() {
        // Given
        Product archived = Product.builder()
                .productId(2L)
                .name("단종 상품")
                .status(ProductStatus.ARCHIVED)
                .price(1000L)
                .currency("USD")
                .build();
        when(productRepository.findById(2L)).thenReturn(Optional.of(archived));

        // When & Then
        ValidationException e = assertThrows(ValidationException.class,
                () -> cartService.addProduct(CartOwner.ofUser(USER_ID), 2L, null, 1));
        assertEquals(ErrorCode.PRODUCT_NOT_AVAILABLE, e.getErrorCode());
    }

    @Test
    @DisplayName("상품 추가 - 같은 상품 동시 추가 요청은 한 줄로 수렴한다")
    void testAddProduct_ConcurrentSameProduct() throws InterruptedException {
        // Given
        CartOwner owner = CartOwner.ofSession("session-concurrent");
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        List<Throwable> errors = new ArrayList<>();

        // When
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    cartService.addProduct(owner, PRODUCT_ID, null, 1);
                } catch (Throwable t) {
                    synchronized (errors) {
                        errors.add(t);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertTrue(errors.isEmpty(), "동시 추가 중 예외 발생: " + errors);
        CartSummary summary = cartService.getCart(owner);
        assertEquals(1, summary.getLines().size());
        assertEquals(threadCount, summary.getTotalQuantity());
    }

    // ========== 강의 추가 ==========

    @Test
    @DisplayName("강의 추가 - 비로그인 사용자는 강의를 담을 수 없다")
    void testAddCourse_GuestRejected() {
        // When & Then
        ValidationException e = assertThrows(ValidationException.class,
                () -> cartService.addCourse(CartOwner.ofSession("guest"), COURSE_ID));
        assertEquals(ErrorCode.CART_LOGIN_REQUIRED, e.getErrorCode());
    }

    @Test
    @DisplayName("강의 추가 - 같은 강의를 다시 담아도 한 줄, 수량 1")
    void testAddCourse_Idempotent() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);

        // When
        cartService.addCourse(owner, COURSE_ID);
        CartSummary summary = cartService.addCourse(owner, COURSE_ID);

        // Then
        assertEquals(1, summary.getLines().size());
        assertEquals(1, summary.getLines().get(0).getQuantity());
        assertTrue(summary.isHasCourses());
        assertFalse(summary.isHasProducts());
    }

    @Test
    @DisplayName("강의 추가 - 이미 수강 중인 강의는 충돌")
    void testAddCourse_AlreadyEnrolled() {
        // Given
        when(enrollmentRepository.existsByCourseIdAndUserId(COURSE_ID, USER_ID)).thenReturn(true);

        // When & Then
        ConflictException e = assertThrows(ConflictException.class,
                () -> cartService.addCourse(CartOwner.ofUser(USER_ID), COURSE_ID));
        assertEquals(ErrorCode.COURSE_ALREADY_ENROLLED, e.getErrorCode());
    }

    // ========== 수량 수정 / 삭제 ==========

    @Test
    @DisplayName("수량 수정 - 0으로 수정하면 항목이 삭제된다")
    void testSetQuantity_ZeroRemovesItem() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);
        CartSummary added = cartService.addProduct(owner, PRODUCT_ID, null, 3);
        Long cartItemId = added.getLines().get(0).getCartItemId();

        // When
        CartSummary summary = cartService.setQuantity(owner, cartItemId, 0);

        // Then
        assertTrue(summary.getLines().isEmpty());
        assertTrue(cartRepository.findItemById(cartItemId).isEmpty());
    }

    @Test
    @DisplayName("수량 수정 - 지정한 수량으로 교체된다")
    void testSetQuantity_Replaces() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);
        CartSummary added = cartService.addProduct(owner, PRODUCT_ID, null, 3);
        Long cartItemId = added.getLines().get(0).getCartItemId();

        // When
        CartSummary summary = cartService.setQuantity(owner, cartItemId, 7);

        // Then
        assertEquals(7, summary.getTotalQuantity());
        assertEquals(Money.parse("175.00", "USD"), summary.getSubtotal());
    }

    @Test
    @DisplayName("수량 수정 - 범위를 벗어난 수량은 거부한다")
    void testSetQuantity_OutOfRange() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);
        CartSummary added = cartService.addProduct(owner, PRODUCT_ID, null, 1);
        Long cartItemId = added.getLines().get(0).getCartItemId();

        // When & Then
        assertThrows(ValidationException.class, () -> cartService.setQuantity(owner, cartItemId, -1));
        assertThrows(ValidationException.class, () -> cartService.setQuantity(owner, cartItemId, 1001));
    }

    @Test
    @DisplayName("항목 삭제 - 다른 소유자의 항목은 찾을 수 없다")
    void testRemoveItem_OtherOwner() {
        // Given
        CartSummary added = cartService.addProduct(CartOwner.ofUser(USER_ID), PRODUCT_ID, null, 1);
        Long cartItemId = added.getLines().get(0).getCartItemId();
        CartOwner other = CartOwner.ofUser(99L);
        cartService.getCart(other);

        // When & Then
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> cartService.removeItem(other, cartItemId));
        assertEquals(ErrorCode.CART_ITEM_NOT_FOUND, e.getErrorCode());
    }

    @Test
    @DisplayName("장바구니 비우기 - 모든 항목이 삭제된다")
    void testClear() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);
        cartService.addProduct(owner, PRODUCT_ID, null, 1);
        cartService.addCourse(owner, COURSE_ID);

        // When
        cartService.clear(owner);

        // Then
        assertTrue(cartService.getCart(owner).isEmpty());
    }

    // ========== 합계 ==========

    @Test
    @DisplayName("합계 - 구매 불가가 된 항목은 합계에서 제외하고 사유를 표시한다")
    void testSummarize_UnavailableLineExcluded() {
        // Given
        CartOwner owner = CartOwner.ofUser(USER_ID);
        cartService.addProduct(owner, PRODUCT_ID, null, 2);
        cartService.addCourse(owner, COURSE_ID);
        when(enrollmentRepository.existsByCourseIdAndUserId(COURSE_ID, USER_ID)).thenReturn(true);

        // When
        CartSummary summary = cartService.getCart(owner);

        // Then
        assertEquals(2, summary.getLines().size());
        CartLine courseLine = summary.getLines().get(1);
        assertFalse(courseLine.isAvailable());
        assertEquals(ErrorCode.COURSE_ALREADY_ENROLLED.getMessage(), courseLine.getUnavailableReason());
        assertEquals(Money.parse("50.00", "USD"), summary.getSubtotal());
        assertFalse(summary.isCheckoutReady());
    }
}
