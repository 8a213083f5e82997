package com.acme.finops.pluginhost.model;

import java.util.Objects;

public record Recommendation(String id,
                             String category,
                             String actionType,
                             String description,
                             double estimatedSavings,
                             String currency) {
    public Recommendation {
        Objects.requireNonNull(id, "id");
        category = category == null ? "" : category;
        actionType = actionType == null ? "" : actionType;
        description = description == null ? "" : description;
        currency = currency == null ? "" : currency;
    }
}
