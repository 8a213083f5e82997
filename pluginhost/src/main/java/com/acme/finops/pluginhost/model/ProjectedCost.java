package com.acme.finops.pluginhost.model;

import java.util.Objects;

public record ProjectedCost(String currency, double unitPrice, double costPerMonth, String billingDetail) {
    public ProjectedCost {
        Objects.requireNonNull(currency, "currency");
        billingDetail = billingDetail == null ? "" : billingDetail;
    }
}
