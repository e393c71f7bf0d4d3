package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.application.catalog.CatalogService;
import com.hhplus.checkout.application.catalog.PricedItem;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.cart.Cart;
import com.hhplus.checkout.domain.cart.CartItem;
import com.hhplus.checkout.domain.cart.CartOwner;
import com.hhplus.checkout.domain.cart.CartRepository;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.*;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import com.hhplus.checkout.infrastructure.lock.DistributedLock;
import com.hhplus.checkout.infrastructure.lock.LockKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * CheckoutTransactionService - 체크아웃 트랜잭션 구간 (Application 계층)
 *
 * CheckoutService에서 분리해 프록시를 거쳐 호출되도록 합니다.
 * 프로세서 호출은 이 클래스 밖(트랜잭션 없음)에서 일어납니다.
 *
 * CheckoutService (1, 3단계: 프로세서 호출, 보상)
 *     ↓
 * CheckoutTransactionService (2단계: 재검증 + 주문/결제 저장)
 */
@Slf4j
@Service
public class CheckoutTransactionService {

    private final CartRepository cartRepository;
    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final CatalogService catalogService;
    private final OrderAdjustmentPolicy adjustmentPolicy;
    private final OrderNumberGenerator orderNumberGenerator;

    public CheckoutTransactionService(CartRepository cartRepository,
                                      OrderRepository orderRepository,
                                      PaymentRepository paymentRepository,
                                      CatalogService catalogService,
                                      OrderAdjustmentPolicy adjustmentPolicy,
                                      OrderNumberGenerator orderNumberGenerator) {
        this.cartRepository = cartRepository;
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.catalogService = catalogService;
        this.adjustmentPolicy = adjustmentPolicy;
        this.orderNumberGenerator = orderNumberGenerator;
    }

    /**
     * 장바구니를 카탈로그 현재 가격으로 다시 계산하고 PENDING 주문/결제를 저장합니다.
     *
     * 장바구니는 여기서 비우지 않습니다. 결제 성공 이벤트가 도착했을 때 비웁니다.
     */
    @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
    @Transactional
    public PendingCheckout createPendingOrder(CartOwner owner, String email) {
        Cart cart = cartRepository.findByOwner(owner)
                .orElseThrow(() -> new ValidationException(ErrorCode.CART_EMPTY));
        List<CartItem> cartItems = cartRepository.findItems(cart.getCartId());
        if (cartItems.isEmpty()) {
            throw new ValidationException(ErrorCode.CART_EMPTY);
        }

        List<PricedItem> pricedItems = new ArrayList<>();
        List<OrderItem> orderItems = new ArrayList<>();
        Money subtotal = catalogService.zero();
        for (CartItem cartItem : cartItems) {
            PricedItem priced = cartItem.isCourse()
                    ? catalogService.priceCourse(cartItem.getCourseId(), owner.getUserId())
                    : catalogService.priceProduct(cartItem.getProductId(), cartItem.getVariantId(), cartItem.getQuantity());
            pricedItems.add(priced);
            orderItems.add(priced.toOrderItem());
            subtotal = subtotal.add(priced.lineTotal());
        }

        OrderAdjustments adjustments = adjustmentPolicy.adjust(pricedItems, subtotal);
        Order order = Order.place(orderNumberGenerator.generate(), owner.getUserId(), owner.getSessionId(),
                cart.getCartId(), email, orderItems, adjustments);
        if (!order.getTotal().isPositive()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "결제 금액은 0보다 커야 합니다");
        }

        Order savedOrder = orderRepository.save(order);
        Payment payment = paymentRepository.save(Payment.pending(savedOrder.getOrderId(), savedOrder.getTotal()));

        log.info("[CheckoutTransactionService] PENDING 주문 생성 - orderId={}, orderNumber={}, total={}",
                savedOrder.getOrderId(), savedOrder.getOrderNumber(), savedOrder.getTotal());
        return new PendingCheckout(savedOrder, payment);
    }

    @Transactional
    public Payment attachChargeIntent(Long paymentId, String chargeIntentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PAYMENT_NOT_FOUND, paymentId));
        payment.attachChargeIntent(chargeIntentId);
        return paymentRepository.save(payment);
    }

    /**
     * 보상: 프로세서 결제 의도를 만들지 못한 PENDING 주문과 결제를 삭제합니다.
     */
    @Transactional
    public void discardPendingOrder(Long orderId) {
        paymentRepository.findByOrderId(orderId).ifPresent(paymentRepository::delete);
        orderRepository.findById(orderId)
                .filter(Order::isPending)
                .ifPresent(orderRepository::delete);
        log.info("[CheckoutTransactionService] PENDING 주문 폐기 - orderId={}", orderId);
    }
}
