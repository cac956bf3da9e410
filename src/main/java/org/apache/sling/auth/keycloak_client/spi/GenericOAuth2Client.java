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
package org.apache.sling.auth.keycloak_client.spi;

import java.net.URI;
import java.util.Map;

import com.nimbusds.oauth2.sdk.AuthorizationGrant;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.auth.ClientAuthentication;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import org.apache.sling.auth.keycloak_client.KeycloakClientException;
import org.apache.sling.auth.keycloak_client.RawResourceOwnerResponse;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Service Provider Interface for the provider-neutral part of the OAuth 2.0 protocol.
 *
 * <p>Implementations talk to the endpoints and return the payloads as received. Interpreting
 * them, including detecting error payloads, is left to the caller.</p>
 */
public interface GenericOAuth2Client {

    /**
     * Sends a token request for the given grant.
     *
     * @param tokenEndpoint the token endpoint
     * @param clientId the client identifier, sent as request parameter for public clients
     * @param clientAuthentication the client credentials, {@code null} for public clients
     * @param grant the authorization grant to exchange
     * @return the parsed JSON payload, which may be an error payload
     * @throws KeycloakClientException if the request cannot be sent or the response is not JSON
     */
    @NotNull
    Map<String, Object> requestTokens(
            @NotNull URI tokenEndpoint,
            @NotNull ClientID clientId,
            @Nullable ClientAuthentication clientAuthentication,
            @NotNull AuthorizationGrant grant);

    /**
     * Requests the userinfo endpoint with the given bearer token.
     *
     * @param userInfoEndpoint the userinfo endpoint
     * @param accessToken the bearer token
     * @return an encoded response for {@code application/jwt} payloads and a structured one otherwise;
     *         structured responses may be error payloads
     * @throws KeycloakClientException if the request cannot be sent or the response cannot be parsed
     */
    @NotNull
    RawResourceOwnerResponse requestResourceOwnerDetails(
            @NotNull URI userInfoEndpoint, @NotNull BearerAccessToken accessToken);

    /**
     * Builds an authorization code request URL.
     */
    @NotNull
    URI buildAuthorizationUrl(
            @NotNull URI authorizationEndpoint,
            @NotNull ClientID clientId,
            @Nullable URI redirectUri,
            @NotNull Scope scope,
            @NotNull State state,
            @NotNull Map<String, String> customParameters);
}
