package com.gameflip.sdk.auth;

import com.gameflip.sdk.GfConfigurationException;

/**
 * Contract for producing the {@code Authorization} header value of an outbound request.
 */
public interface Authenticator {

    String authorizationHeader() throws GfConfigurationException;
}
