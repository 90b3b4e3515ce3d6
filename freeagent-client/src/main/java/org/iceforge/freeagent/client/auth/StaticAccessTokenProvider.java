package org.iceforge.freeagent.client.auth;

import java.util.Objects;

public final class StaticAccessTokenProvider implements AccessTokenProvider {
    private final String token;

    public StaticAccessTokenProvider(String token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public String accessToken() {
        return token;
    }

    @Override
    public String toString() {
        return "StaticAccessTokenProvider{token=***}";
    }
}
