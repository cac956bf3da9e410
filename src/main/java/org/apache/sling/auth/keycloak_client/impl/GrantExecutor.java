/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.sling.auth.keycloak_client.impl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Objects;

import com.nimbusds.oauth2.sdk.AccessTokenResponse;
import com.nimbusds.oauth2.sdk.AuthorizationCode;
import com.nimbusds.oauth2.sdk.AuthorizationCodeGrant;
import com.nimbusds.oauth2.sdk.AuthorizationGrant;
import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.RefreshTokenGrant;
import com.nimbusds.oauth2.sdk.auth.ClientAuthentication;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.token.AccessToken;
import com.nimbusds.oauth2.sdk.token.RefreshToken;
import com.nimbusds.oauth2.sdk.token.Tokens;
import net.minidev.json.JSONObject;
import org.apache.sling.auth.keycloak_client.IdentityProviderException;
import org.apache.sling.auth.keycloak_client.KeycloakClientException;
import org.apache.sling.auth.keycloak_client.KeycloakTokens;
import org.apache.sling.auth.keycloak_client.spi.GenericOAuth2Client;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the authorization code and refresh token grants against the realm token endpoint.
 */
class GrantExecutor {

    private static final Logger logger = LoggerFactory.getLogger(GrantExecutor.class);

    private final GenericOAuth2Client oauth2Client;
    private final String tokenEndpoint;
    private final ClientID clientId;
    private final @Nullable ClientAuthentication clientAuthentication;
    private final @Nullable URI redirectUri;

    GrantExecutor(
            @NotNull GenericOAuth2Client oauth2Client,
            @NotNull String tokenEndpoint,
            @NotNull ClientID clientId,
            @Nullable ClientAuthentication clientAuthentication,
            @Nullable URI redirectUri) {
        this.oauth2Client = oauth2Client;
        this.tokenEndpoint = tokenEndpoint;
        this.clientId = clientId;
        this.clientAuthentication = clientAuthentication;
        this.redirectUri = redirectUri;
    }

    @NotNull
    KeycloakTokens authByCode(@NotNull String code) {
        return execute(new AuthorizationCodeGrant(new AuthorizationCode(code), redirectUri));
    }

    @NotNull
    KeycloakTokens authByRefreshToken(@NotNull String refreshToken) {
        return execute(new RefreshTokenGrant(new RefreshToken(refreshToken)));
    }

    private @NotNull KeycloakTokens execute(@NotNull AuthorizationGrant grant) {
        URI endpoint;
        try {
            endpoint = new URI(tokenEndpoint);
        } catch (URISyntaxException e) {
            logger.error("Token Endpoint is not a valid URI: {} Error: {}", tokenEndpoint, e.getMessage());
            throw new KeycloakClientException(String.format("Token Endpoint is not a valid URI: %s", tokenEndpoint), e);
        }

        GrantType grantType = grant.getType();
        logger.debug("Requesting tokens with grant type {}", grantType);
        Map<String, Object> response = oauth2Client.requestTokens(endpoint, clientId, clientAuthentication, grant);
        checkResponse(response);
        return toKeycloakTokens(response);
    }

    /**
     * Fails if the payload carries an OAuth 2.0 error.
     *
     * @throws IdentityProviderException if the {@code error} member is present and not empty
     */
    static void checkResponse(@NotNull Map<String, Object> response) {
        Object error = response.get("error");
        if (error == null || error.toString().isEmpty()) {
            return;
        }
        String description = Objects.toString(response.get("error_description"), "");
        logger.debug("Provider error. Received code: {}, message: {}", error, description);
        throw new IdentityProviderException(error.toString(), error + ": " + description, response);
    }

    private static @NotNull KeycloakTokens toKeycloakTokens(@NotNull Map<String, Object> response) {
        Tokens tokens;
        try {
            tokens = AccessTokenResponse.parse(new JSONObject(response)).getTokens();
        } catch (ParseException e) {
            logger.error("Failed to parse token response: {}", e.getMessage(), e);
            throw new KeycloakClientException("Failed to parse token response: " + e.getMessage(), e);
        }

        AccessToken accessToken = tokens.getAccessToken();
        long expiresAt = accessToken.getLifetime() > 0
                ? System.currentTimeMillis() + accessToken.getLifetime() * 1000
                : 0;
        RefreshToken refreshToken = tokens.getRefreshToken();
        Object idToken = response.get("id_token");

        return new KeycloakTokens(
                accessToken.getValue(),
                expiresAt,
                refreshToken != null ? refreshToken.getValue() : null,
                idToken instanceof String idTokenValue ? idTokenValue : null);
    }
}
