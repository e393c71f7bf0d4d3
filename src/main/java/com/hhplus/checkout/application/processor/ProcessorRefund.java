package com.hhplus.checkout.application.processor;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ProcessorRefund {
    private final String id;
    private final long amountMinor;
    private final String status;
}
