package com.hhplus.checkout.presentation.checkout;

import com.hhplus.checkout.application.checkout.CheckoutCommand;
import com.hhplus.checkout.application.checkout.CheckoutResult;
import com.hhplus.checkout.application.checkout.CheckoutService;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.cart.CartOwner;
import com.hhplus.checkout.presentation.checkout.request.CheckoutRequest;
import com.hhplus.checkout.presentation.checkout.response.CheckoutResponse;
import com.hhplus.checkout.presentation.common.CartOwnerResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CheckoutController - Presentation 계층
 *
 * POST /checkout: 장바구니로 PENDING 주문을 만들고 결제 의도를 발급합니다.
 */
@RestController
@RequestMapping("/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final CartOwnerResolver cartOwnerResolver;

    public CheckoutController(CheckoutService checkoutService, CartOwnerResolver cartOwnerResolver) {
        this.checkoutService = checkoutService;
        this.cartOwnerResolver = cartOwnerResolver;
    }

    @PostMapping
    public ResponseEntity<CheckoutResponse> checkout(@RequestBody(required = false) CheckoutRequest body,
                                                     HttpServletRequest request) {
        CartOwner owner = cartOwnerResolver.resolveExisting(request);
        if (owner == null) {
            // 소유자를 모르면 장바구니도 없음
            throw new ValidationException(ErrorCode.CART_EMPTY);
        }
        String email = body == null ? null : body.getEmail();
        CheckoutResult result = checkoutService.checkout(new CheckoutCommand(owner, email));
        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.from(result));
    }
}
