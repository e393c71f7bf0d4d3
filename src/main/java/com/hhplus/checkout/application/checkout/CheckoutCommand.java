package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.domain.cart.CartOwner;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CheckoutCommand {
    private final CartOwner owner;
    private final String email;
}
