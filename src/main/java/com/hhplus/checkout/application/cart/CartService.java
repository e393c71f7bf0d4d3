package com.hhplus.checkout.application.cart;

import com.hhplus.checkout.application.catalog.CatalogService;
import com.hhplus.checkout.application.catalog.PricedItem;
import com.hhplus.checkout.common.exception.BizException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.cart.*;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.infrastructure.lock.DistributedLock;
import com.hhplus.checkout.infrastructure.lock.LockKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * CartService - Application 계층
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository 인터페이스에만 의존 (Port)
 * - 소유자 단위 변경은 분산락으로 직렬화하고, 같은 (상품, 옵션) 동시 추가는 저장소 upsert로 한 행에 수렴
 *
 * 규칙:
 * - 장바구니는 첫 접근 시 지연 생성
 * - 수량 0으로 수정 = 항목 삭제
 * - 강의 항목은 수량 1 고정, 로그인 사용자만 추가 가능
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final CatalogService catalogService;

    public CartService(CartRepository cartRepository,
                       CatalogService catalogService) {
        this.cartRepository = cartRepository;
        this.catalogService = catalogService;
    }

    /**
     * 장바구니 조회 (없으면 생성)
     */
    public CartSummary getCart(CartOwner owner) {
        Cart cart = getOrCreate(owner);
        return summarize(cart);
    }

    public Cart getOrCreate(CartOwner owner) {
        return cartRepository.findByOwner(owner)
                .orElseGet(() -> createCart(owner));
    }

    /**
     * 상품 추가. 이미 담긴 (상품, 옵션)이면 수량을 더합니다.
     */
    @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
    public CartSummary addProduct(CartOwner owner, Long productId, Long variantId, int quantity) {
        validateAddQuantity(quantity);
        Cart cart = getOrCreate(owner);

        int existing = findQuantity(cart.getCartId(), CartItem.productKey(productId, variantId));
        int combined = existing + quantity;
        if (combined > CartConstants.MAX_CART_QUANTITY) {
            throw new ValidationException(ErrorCode.CART_INVALID_QUANTITY, "합계 수량=" + combined);
        }
        catalogService.priceProduct(productId, variantId, combined);

        cartRepository.upsertProductItem(cart.getCartId(), productId, variantId, quantity);
        log.info("[CartService] 상품 추가 - owner={}, productId={}, variantId={}, quantity={}",
                owner, productId, variantId, quantity);
        return summarize(cart);
    }

    /**
     * 강의 추가. 이미 담긴 강의면 변화 없음.
     */
    @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
    public CartSummary addCourse(CartOwner owner, Long courseId) {
        if (!owner.isUser()) {
            throw new ValidationException(ErrorCode.CART_LOGIN_REQUIRED);
        }
        catalogService.priceCourse(courseId, owner.getUserId());

        Cart cart = getOrCreate(owner);
        boolean inserted = cartRepository.insertCourseItemIfAbsent(cart.getCartId(), courseId);
        log.info("[CartService] 강의 추가 - owner={}, courseId={}, inserted={}", owner, courseId, inserted);
        return summarize(cart);
    }

    /**
     * 수량 수정. 0이면 removeItem과 동일합니다.
     */
    @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
    public CartSummary setQuantity(CartOwner owner, Long cartItemId, int quantity) {
        if (quantity < 0 || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new ValidationException(ErrorCode.CART_INVALID_QUANTITY, "quantity=" + quantity);
        }
        Cart cart = findOwnedCart(owner, cartItemId);
        CartItem item = findOwnedItem(cart, cartItemId);

        if (quantity == 0) {
            cartRepository.deleteItem(cartItemId);
            log.info("[CartService] 수량 0 → 항목 삭제 - owner={}, cartItemId={}", owner, cartItemId);
            return summarize(cart);
        }

        if (item.isCourse()) {
            if (quantity != CartConstants.COURSE_QUANTITY) {
                throw new ValidationException(ErrorCode.CART_INVALID_QUANTITY, "강의 수량은 1로 고정됩니다");
            }
            return summarize(cart);
        }

        catalogService.priceProduct(item.getProductId(), item.getVariantId(), quantity);
        item.changeQuantity(quantity);
        cartRepository.saveItem(item);
        return summarize(cart);
    }

    @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
    public CartSummary removeItem(CartOwner owner, Long cartItemId) {
        Cart cart = findOwnedCart(owner, cartItemId);
        findOwnedItem(cart, cartItemId);
        cartRepository.deleteItem(cartItemId);
        log.info("[CartService] 항목 삭제 - owner={}, cartItemId={}", owner, cartItemId);
        return summarize(cart);
    }

    @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
    public void clear(CartOwner owner) {
        cartRepository.findByOwner(owner)
                .ifPresent(cart -> cartRepository.deleteItems(cart.getCartId()));
    }

    /**
     * 결제 성공 이벤트에서 원본 장바구니를 비울 때 사용합니다.
     */
    public void clearById(Long cartId) {
        cartRepository.deleteItems(cartId);
        log.info("[CartService] 결제 완료로 장바구니 비움 - cartId={}", cartId);
    }

    public CartSummary summarize(Cart cart) {
        List<CartItem> items = cartRepository.findItems(cart.getCartId());
        List<CartLine> lines = new ArrayList<>();
        Money subtotal = catalogService.zero();
        int totalQuantity = 0;
        boolean hasProducts = false;
        boolean hasCourses = false;

        for (CartItem item : items) {
            CartLine line = price(cart, item);
            lines.add(line);
            if (item.isCourse()) {
                hasCourses = true;
            } else {
                hasProducts = true;
            }
            if (line.isAvailable()) {
                subtotal = subtotal.add(line.getLineTotal());
                totalQuantity += line.getQuantity();
            }
        }

        return CartSummary.builder()
                .cartId(cart.getCartId())
                .userId(cart.getUserId())
                .sessionId(cart.getSessionId())
                .lines(lines)
                .subtotal(subtotal)
                .totalQuantity(totalQuantity)
                .hasProducts(hasProducts)
                .hasCourses(hasCourses)
                .build();
    }

    private CartLine price(Cart cart, CartItem item) {
        CartLine.CartLineBuilder line = CartLine.builder()
                .cartItemId(item.getCartItemId())
                .itemType(item.getItemType())
                .productId(item.getProductId())
                .variantId(item.getVariantId())
                .courseId(item.getCourseId())
                .quantity(item.getQuantity());
        try {
            PricedItem priced = item.isCourse()
                    ? catalogService.priceCourse(item.getCourseId(), cart.getUserId())
                    : catalogService.priceProduct(item.getProductId(), item.getVariantId(), item.getQuantity());
            return line.name(priced.getName())
                    .unitPrice(priced.getUnitPrice())
                    .lineTotal(priced.lineTotal())
                    .available(true)
                    .build();
        } catch (BizException e) {
            return line.available(false)
                    .unavailableReason(e.getErrorCode().getMessage())
                    .build();
        }
    }

    private Cart createCart(CartOwner owner) {
        try {
            Cart cart = cartRepository.save(Cart.createFor(owner));
            log.info("[CartService] 장바구니 생성 - owner={}, cartId={}", owner, cart.getCartId());
            return cart;
        } catch (DataIntegrityViolationException e) {
            // 같은 소유자의 동시 생성 요청이 먼저 커밋됨
            return cartRepository.findByOwner(owner).orElseThrow(() -> e);
        }
    }

    private int findQuantity(Long cartId, String itemKey) {
        return cartRepository.findItems(cartId).stream()
                .filter(item -> itemKey.equals(item.getItemKey()))
                .mapToInt(CartItem::getQuantity)
                .findFirst()
                .orElse(0);
    }

    private Cart findOwnedCart(CartOwner owner, Long cartItemId) {
        return cartRepository.findByOwner(owner)
                .orElseThrow(() -> new NotFoundException(ErrorCode.CART_ITEM_NOT_FOUND, cartItemId));
    }

    private CartItem findOwnedItem(Cart cart, Long cartItemId) {
        return cartRepository.findItemById(cartItemId)
                .filter(item -> item.getCartId().equals(cart.getCartId()))
                .orElseThrow(() -> new NotFoundException(ErrorCode.CART_ITEM_NOT_FOUND, cartItemId));
    }

    private void validateAddQuantity(int quantity) {
        if (quantity < CartConstants.MIN_ADD_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new ValidationException(ErrorCode.CART_INVALID_QUANTITY, "quantity=" + quantity);
        }
    }
}
