package com.hhplus.checkout.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShipOrderRequest {
    @JsonProperty("tracking_number")
    private String trackingNumber;
}
