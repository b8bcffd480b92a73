package com.gameflip.sdk;

/**
 * Listing categories. A listing must use the category matching its item under the Gameflip terms of service;
 * physical items ship within the continental US only.
 */
public enum ListingCategory {
    GAMES("CONSOLE_VIDEO_GAMES"),
    INGAME("DIGITAL_INGAME"),
    GIFTCARD("GIFTCARD"),
    CONSOLE("VIDEO_GAME_HARDWARE"),
    ACCESSORIES("VIDEO_GAME_ACCESSORIES"),
    TOYS("TOYS_AND_GAMES"),
    VIDEO("VIDEO_DVD"),
    OTHER("UNKNOWN");

    private final String value;

    ListingCategory(String value) {
        this.value = value;
    }

    /**
     * @return wire value used in listing bodies and search filters.
     */
    public String value() {
        return value;
    }
}
