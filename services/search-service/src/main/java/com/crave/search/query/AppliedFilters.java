package com.crave.search.query;

public final class AppliedFilters {
    private final boolean boundsApplied;
    private final boolean priceFilterApplied;
    private final boolean minimumVotesApplied;

    public AppliedFilters(boolean boundsApplied, boolean priceFilterApplied, boolean minimumVotesApplied) {
        this.boundsApplied = boundsApplied;
        this.priceFilterApplied = priceFilterApplied;
        this.minimumVotesApplied = minimumVotesApplied;
    }

    public boolean isBoundsApplied() {
        return boundsApplied;
    }

    public boolean isPriceFilterApplied() {
        return priceFilterApplied;
    }

    public boolean isMinimumVotesApplied() {
        return minimumVotesApplied;
    }
}
