package com.gameflip.sdk;

/**
 * Steam games whose items can be traded through Gameflip escrow.
 */
public enum SteamApp {
    CSGO("730", "2"),
    TF2("440", "2"),
    DOTA2("570", "2"),
    RUST("252490", "2"),
    PUBG("578080", "2"),
    H1Z1_KOK("433850", "1"),
    JUST_SURVIVE("295110", "1");

    static final String DEFAULT_CONTEXT_ID = "2";

    private final String appId;
    private final String contextId;

    SteamApp(String appId, String contextId) {
        this.appId = appId;
        this.contextId = contextId;
    }

    public String appId() {
        return appId;
    }

    /**
     * Inventory context holding tradable items for this game.
     */
    public String contextId() {
        return contextId;
    }

    /**
     * @return context of a known app id, {@code "2"} for any other game.
     */
    public static String contextIdFor(String appId) {
        for (SteamApp app : values()) {
            if (app.appId.equals(appId)) {
                return app.contextId;
            }
        }
        return DEFAULT_CONTEXT_ID;
    }
}
