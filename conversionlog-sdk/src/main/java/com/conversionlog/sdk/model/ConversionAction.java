package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Funnel milestones reported to the advertising platform.
 */
public enum ConversionAction {
    VIEW_ITEM("view_item"),
    ADD_TO_CART("add_to_cart"),
    BEGIN_CHECKOUT("begin_checkout"),
    ADD_PAYMENT_INFO("add_payment_info"),
    PURCHASE("purchase");

    private final String value;

    ConversionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Purchases are matched across delivery paths by transaction id, so they must carry one.
     */
    public boolean requiresTransactionId() {
        return this == PURCHASE;
    }

    public static ConversionAction fromValue(String value) {
        for (ConversionAction action : ConversionAction.values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown ConversionAction: " + value);
    }
}
