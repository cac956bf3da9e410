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
package org.apache.sling.auth.keycloak_client;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Client side view of a single Keycloak realm.
 *
 * <p>Providers are published as OSGi services and should be retrieved using the <code>name</code> property.</p>
 *
 * <pre>{@code private @Reference(target = "(name=my-realm)") KeycloakProvider provider;}</pre>
 */
public interface KeycloakProvider {

    /**
     * @return the name of the provider configuration
     */
    @NotNull
    String name();

    /**
     * Returns the base URL for authorizing a client, e.g.
     * {@code https://idp.example.com/realms/demo/protocol/openid-connect/auth}
     */
    @NotNull
    String getBaseAuthorizationUrl();

    /**
     * Returns the URL of the token endpoint.
     */
    @NotNull
    String getBaseAccessTokenUrl();

    /**
     * Returns the URL of the userinfo endpoint.
     */
    @NotNull
    String getResourceOwnerDetailsUrl();

    /**
     * Builds the logout URL, appending the given parameters (e.g. {@code redirect_uri},
     * {@code id_token_hint}) as query string.
     */
    @NotNull
    String getLogoutUrl(@NotNull Map<String, String> options);

    /**
     * Builds the authorization code request URL.
     *
     * <p>{@code state}, {@code scope} and {@code redirect_uri} may be supplied through the options; all other
     * entries are sent as additional request parameters.</p>
     */
    @NotNull
    String getAuthorizationUrl(@NotNull Map<String, String> options);

    /**
     * Builds the authorization code request URL against a different server URL, for clients that reach
     * Keycloak through another network than the one configured (e.g. inside a container network).
     */
    @NotNull
    String getAuthorizationUrlDocker(@NotNull String authServerUrl, @NotNull Map<String, String> options);

    /**
     * @return the scopes requested when none are given, {@code name} and {@code email}
     */
    @NotNull
    List<String> getDefaultScopes();

    /**
     * Exchanges an authorization code for tokens.
     *
     * @throws IdentityProviderException if the token endpoint answers with an error
     */
    @NotNull
    KeycloakTokens authByCode(@NotNull String code);

    /**
     * Exchanges a refresh token for a new set of tokens.
     *
     * @throws IdentityProviderException if the token endpoint answers with an error
     */
    @NotNull
    KeycloakTokens authByRefreshToken(@NotNull String refreshToken);

    /**
     * Verifies the access token and returns the resource owner it describes.
     *
     * @throws EncryptionConfigurationException if no algorithm and key are configured
     * @throws SignatureVerificationException if the access token fails verification
     */
    @NotNull
    KeycloakResourceOwner getResourceOwner(@NotNull KeycloakTokens tokens);

    /**
     * Requests the userinfo endpoint and returns the resource owner it describes. Signed
     * ({@code application/jwt}) responses are verified before use.
     *
     * @throws IdentityProviderException if the userinfo endpoint answers with an error
     * @throws EncryptionConfigurationException if a signed response arrives and no algorithm and key are configured
     * @throws SignatureVerificationException if a signed response fails verification
     */
    @NotNull
    KeycloakResourceOwner fetchResourceOwner(@NotNull KeycloakTokens tokens);

    /**
     * Resolves a raw resource owner response to its claims, verifying it when it is encoded.
     */
    @NotNull
    Map<String, Object> decryptResponse(@NotNull RawResourceOwnerResponse response);

    /**
     * @return true if both an algorithm and a key are configured
     */
    boolean usesEncryption();
}
