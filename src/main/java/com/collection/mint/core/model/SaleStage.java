package com.collection.mint.core.model;

/**
 * Phase of the sale, derived from time. Declaration order is the order the
 * stages occur in, so {@link #compareTo} reflects progress.
 */
public enum SaleStage {
    IDLE,
    PRESALE_OG,
    PRESALE_WL,
    PUBLIC_SALE;

    public boolean isAtLeast(SaleStage other) {
        return this.compareTo(other) >= 0;
    }
}
