package com.hhplus.checkout.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.order.dto.OrderView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderItemResponse {

    @JsonProperty("order_item_id")
    private Long orderItemId;

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("variant_id")
    private Long variantId;

    @JsonProperty("course_id")
    private Long courseId;

    private String name;

    private Integer quantity;

    @JsonProperty("unit_price")
    private String unitPrice;

    @JsonProperty("line_total")
    private String lineTotal;

    public static OrderItemResponse from(OrderView.Item item) {
        return OrderItemResponse.builder()
                .orderItemId(item.getOrderItemId())
                .itemType(item.getItemType())
                .productId(item.getProductId())
                .variantId(item.getVariantId())
                .courseId(item.getCourseId())
                .name(item.getName())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice().toDecimalString())
                .lineTotal(item.getLineTotal().toDecimalString())
                .build();
    }
}
