package com.gameflip.sdk;

import java.util.Locale;

public enum ListingStatus {
    /** Being edited; cannot be listed yet. */
    DRAFT,
    /** Required fields filled in. */
    READY,
    /** Published. */
    ONSALE,
    /** Bought, payment in progress. */
    SALE_PENDING,
    SOLD;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
