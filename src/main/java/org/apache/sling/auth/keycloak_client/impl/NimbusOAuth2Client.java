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

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.nimbusds.oauth2.sdk.AuthorizationGrant;
import com.nimbusds.oauth2.sdk.AuthorizationRequest;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.TokenRequest;
import com.nimbusds.oauth2.sdk.auth.ClientAuthentication;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import com.nimbusds.oauth2.sdk.token.BearerTokenError;
import com.nimbusds.openid.connect.sdk.UserInfoRequest;
import org.apache.sling.auth.keycloak_client.KeycloakClientException;
import org.apache.sling.auth.keycloak_client.RawResourceOwnerResponse;
import org.apache.sling.auth.keycloak_client.spi.GenericOAuth2Client;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GenericOAuth2Client} backed by the Nimbus OAuth 2.0 SDK and its HTTP transport.
 */
@Component(service = GenericOAuth2Client.class)
public class NimbusOAuth2Client implements GenericOAuth2Client {

    private static final Logger logger = LoggerFactory.getLogger(NimbusOAuth2Client.class);

    private static final String CONTENT_TYPE_JWT = "application/jwt";

    @Override
    public @NotNull Map<String, Object> requestTokens(
            @NotNull URI tokenEndpoint,
            @NotNull ClientID clientId,
            @Nullable ClientAuthentication clientAuthentication,
            @NotNull AuthorizationGrant grant) {
        TokenRequest tokenRequest = clientAuthentication != null
                ? new TokenRequest.Builder(tokenEndpoint, clientAuthentication, grant).build()
                : new TokenRequest.Builder(tokenEndpoint, clientId, grant).build();

        HTTPRequest httpRequest = tokenRequest.toHTTPRequest();
        httpRequest.setAccept("application/json");
        try {
            HTTPResponse httpResponse = httpRequest.send();
            return httpResponse.getContentAsJSONObject();
        } catch (IOException e) {
            logger.error("Failed to send token request: {}", e.getMessage(), e);
            throw new KeycloakClientException("Failed to send token request to " + tokenEndpoint, e);
        } catch (ParseException e) {
            logger.error("Failed to parse token response: {}", e.getMessage(), e);
            throw new KeycloakClientException("Failed to parse token response: " + e.getMessage(), e);
        }
    }

    @Override
    public @NotNull RawResourceOwnerResponse requestResourceOwnerDetails(
            @NotNull URI userInfoEndpoint, @NotNull BearerAccessToken accessToken) {
        try {
            HTTPResponse httpResponse =
                    new UserInfoRequest(userInfoEndpoint, accessToken).toHTTPRequest().send();

            String content = httpResponse.getContent();
            if (content == null || content.isBlank()) {
                return RawResourceOwnerResponse.structured(toErrorPayload(httpResponse));
            }

            String contentType = httpResponse.getHeaderValue("Content-Type");
            if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith(CONTENT_TYPE_JWT)) {
                logger.debug("UserInfo response is a signed token");
                return RawResourceOwnerResponse.encoded(content.trim());
            }

            return RawResourceOwnerResponse.structured(httpResponse.getContentAsJSONObject());
        } catch (IOException e) {
            logger.error("Failed to send userinfo request: {}", e.getMessage(), e);
            throw new KeycloakClientException("Failed to send userinfo request to " + userInfoEndpoint, e);
        } catch (ParseException e) {
            logger.error("Failed to parse userinfo response: {}", e.getMessage(), e);
            throw new KeycloakClientException("Failed to parse userinfo response: " + e.getMessage(), e);
        }
    }

    /**
     * Keycloak reports rejected bearer tokens through the {@code WWW-Authenticate} header only. Empty
     * responses without such a header cannot be interpreted.
     */
    private static @NotNull Map<String, Object> toErrorPayload(@NotNull HTTPResponse httpResponse)
            throws ParseException {
        String challenge = httpResponse.getHeaderValue("WWW-Authenticate");
        if (challenge == null) {
            throw new ParseException("Empty response with status code " + httpResponse.getStatusCode());
        }
        BearerTokenError error = BearerTokenError.parse(challenge);
        if (error.getCode() == null) {
            throw new ParseException("No error code in WWW-Authenticate header, status code "
                    + httpResponse.getStatusCode());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error.getCode());
        if (error.getDescription() != null) {
            payload.put("error_description", error.getDescription());
        }
        return payload;
    }

    @Override
    public @NotNull URI buildAuthorizationUrl(
            @NotNull URI authorizationEndpoint,
            @NotNull ClientID clientId,
            @Nullable URI redirectUri,
            @NotNull Scope scope,
            @NotNull State state,
            @NotNull Map<String, String> customParameters) {
        AuthorizationRequest.Builder builder = new AuthorizationRequest.Builder(ResponseType.CODE, clientId)
                .endpointURI(authorizationEndpoint)
                .scope(scope)
                .state(state);

        if (redirectUri != null) {
            builder.redirectionURI(redirectUri);
        }

        for (Map.Entry<String, String> p : customParameters.entrySet()) {
            builder.customParameter(p.getKey(), p.getValue());
        }
        return builder.build().toURI();
    }
}
