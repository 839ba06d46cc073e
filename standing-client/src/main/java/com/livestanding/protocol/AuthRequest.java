package com.livestanding.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The single outbound frame: sent once right after the transport opens.
 */
public class AuthRequest {

    @JsonProperty("access_token")
    private final String accessToken;

    public AuthRequest(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getAccessToken() {
        return accessToken;
    }
}
