package com.gameflip.sdk;

import java.util.Locale;

/**
 * States of Steam escrows and bulk objects.
 *
 * <pre>
 *                   +-- steam_escrow --+
 *                   |                  v
 *     start &lt;-&gt; receive_pending --&gt; received -----&gt; listed
 *                                      |               ^
 *                                      +-&gt; trade_hold -+
 *
 *     received &lt;--&gt; deliver_pending --&gt; delivered
 *         |
 *         +----&gt; return_pending -----&gt; returned
 * </pre>
 */
public enum EscrowStatus {
    START,
    RECEIVE_PENDING,
    RECEIVED,
    LISTED,
    STEAM_ESCROW,
    TRADE_HOLD,
    DELIVER_PENDING,
    DELIVERED,
    RETURN_PENDING,
    RETURNED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
