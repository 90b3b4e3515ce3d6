package org.iceforge.freeagent.client.auth;

/** Supplies the bearer token sent with every request. Called once per request. */
@FunctionalInterface
public interface AccessTokenProvider {
    String accessToken();
}
