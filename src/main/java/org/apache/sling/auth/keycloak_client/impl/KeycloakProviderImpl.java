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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.auth.ClientAuthentication;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import org.apache.sling.auth.keycloak_client.KeycloakClientException;
import org.apache.sling.auth.keycloak_client.KeycloakProvider;
import org.apache.sling.auth.keycloak_client.KeycloakResourceOwner;
import org.apache.sling.auth.keycloak_client.KeycloakTokens;
import org.apache.sling.auth.keycloak_client.RawResourceOwnerResponse;
import org.apache.sling.auth.keycloak_client.spi.GenericOAuth2Client;
import org.apache.sling.auth.keycloak_client.spi.JwtVerifier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Reference;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.AttributeType;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Component(service = KeycloakProvider.class)
@Designate(ocd = KeycloakProviderImpl.Config.class, factory = true)
public class KeycloakProviderImpl implements KeycloakProvider {

    @ObjectClassDefinition(
            name = "Apache Sling Keycloak Provider",
            description = "OpenID Connect client configuration for a single Keycloak realm")
    public @interface Config {
        @AttributeDefinition(name = "Name", description = "Unique name of this provider configuration")
        String name();

        @AttributeDefinition(
                name = "Auth Server URL",
                description = "Keycloak base URL without trailing slash, e.g. http://localhost:8080/auth")
        String authServerUrl();

        @AttributeDefinition(name = "Realm")
        String realm();

        String clientId();

        @AttributeDefinition(type = AttributeType.PASSWORD, description = "Leave empty for public clients")
        String clientSecret() default "";

        @AttributeDefinition(name = "Redirect URI", description = "Redirect URI sent with authorization requests")
        String redirectUri() default "";

        @AttributeDefinition(
                name = "Encryption Algorithm",
                description = "JWS algorithm of signed responses, e.g. RS256. Must be set together with the key.")
        String encryptionAlgorithm() default "";

        @AttributeDefinition(
                name = "Encryption Key",
                description = "Realm public key as shown in the Keycloak admin console, with or without PEM header."
                        + " For HMAC algorithms the shared secret.")
        String encryptionKey() default "";

        String webconsole_configurationFactory_nameHint() default
                "Name: {name}, realm: {realm}, server: {authServerUrl}";
    }

    private static final Logger logger = LoggerFactory.getLogger(KeycloakProviderImpl.class);

    private static final List<String> DEFAULT_SCOPES = List.of("name", "email");

    private final String name;
    private final ClientID clientId;
    private final @Nullable URI redirectUri;
    private final KeycloakEndpoints endpoints;
    private final GenericOAuth2Client oauth2Client;
    private final GrantExecutor grantExecutor;
    private final ResponseVerifier responseVerifier;

    @Activate
    public KeycloakProviderImpl(
            Config cfg, @Reference GenericOAuth2Client oauth2Client, @Reference JwtVerifier jwtVerifier) {
        requireNonEmpty(cfg.name(), "name");
        requireNonEmpty(cfg.authServerUrl(), "authServerUrl");
        requireNonEmpty(cfg.realm(), "realm");
        requireNonEmpty(cfg.clientId(), "clientId");

        String algorithm = emptyToNull(cfg.encryptionAlgorithm());
        String key = emptyToNull(cfg.encryptionKey());
        validateEncryption(algorithm, key);

        this.name = cfg.name();
        this.clientId = new ClientID(cfg.clientId());
        this.redirectUri = toRedirectUri(emptyToNull(cfg.redirectUri()));
        this.endpoints = new KeycloakEndpoints(cfg.authServerUrl(), cfg.realm());
        this.oauth2Client = oauth2Client;

        String clientSecret = emptyToNull(cfg.clientSecret());
        ClientAuthentication clientAuthentication =
                clientSecret != null ? new ClientSecretBasic(clientId, new Secret(clientSecret)) : null;
        this.grantExecutor = new GrantExecutor(
                oauth2Client, endpoints.tokenUrl(), clientId, clientAuthentication, redirectUri);

        this.responseVerifier = new ResponseVerifier(
                algorithm, key != null ? toKeyMaterial(algorithm, key) : null, jwtVerifier);

        logger.info(
                "KeycloakProvider '{}' activated for realm {} at {}, signed responses {}",
                name,
                cfg.realm(),
                cfg.authServerUrl(),
                algorithm != null ? "verified with " + algorithm : "not accepted");
    }

    /**
     * Both or none of the algorithm and key must be configured, and the algorithm must be one that can be
     * verified against a single key.
     */
    private static void validateEncryption(@Nullable String algorithm, @Nullable String key) {
        if ((algorithm == null) != (key == null)) {
            throw new IllegalArgumentException(
                    "encryptionAlgorithm and encryptionKey must either both be provided or both be empty");
        }
        if (algorithm != null && !isSupportedAlgorithm(algorithm)) {
            throw new IllegalArgumentException(String.format("Unsupported encryptionAlgorithm '%s'", algorithm));
        }
    }

    static boolean isSupportedAlgorithm(@NotNull String algorithm) {
        JWSAlgorithm jwsAlgorithm = JWSAlgorithm.parse(algorithm);
        return JWSAlgorithm.Family.RSA.contains(jwsAlgorithm)
                || JWSAlgorithm.Family.EC.contains(jwsAlgorithm)
                || JWSAlgorithm.Family.HMAC_SHA.contains(jwsAlgorithm);
    }

    /**
     * HMAC secrets are used verbatim, public keys are brought into PEM form.
     */
    private static @NotNull String toKeyMaterial(@NotNull String algorithm, @NotNull String key) {
        if (JWSAlgorithm.Family.HMAC_SHA.contains(JWSAlgorithm.parse(algorithm))) {
            return key;
        }
        String trimmed = key.trim();
        return trimmed.startsWith("-----BEGIN") ? trimmed : PublicKeyFormatter.format(trimmed);
    }

    private static @Nullable URI toRedirectUri(@Nullable String redirectUri) {
        if (redirectUri == null) {
            return null;
        }
        try {
            return new URI(redirectUri);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(String.format("Invalid redirectUri '%s'", redirectUri), e);
        }
    }

    private static void requireNonEmpty(@Nullable String value, @NotNull String configName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(configName + " must be configured");
        }
    }

    private static @Nullable String emptyToNull(@Nullable String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }

    @Override
    public @NotNull String name() {
        return name;
    }

    @Override
    public @NotNull String getBaseAuthorizationUrl() {
        return endpoints.authorizationUrl();
    }

    @Override
    public @NotNull String getBaseAccessTokenUrl() {
        return endpoints.tokenUrl();
    }

    @Override
    public @NotNull String getResourceOwnerDetailsUrl() {
        return endpoints.userInfoUrl();
    }

    @Override
    public @NotNull String getLogoutUrl(@NotNull Map<String, String> options) {
        return endpoints.logoutUrl(options);
    }

    @Override
    public @NotNull String getAuthorizationUrl(@NotNull Map<String, String> options) {
        return buildAuthorizationUrl(endpoints.authorizationUrl(), options);
    }

    @Override
    public @NotNull String getAuthorizationUrlDocker(
            @NotNull String authServerUrl, @NotNull Map<String, String> options) {
        return buildAuthorizationUrl(endpoints.authorizationUrl(authServerUrl), options);
    }

    private @NotNull String buildAuthorizationUrl(@NotNull String endpoint, @NotNull Map<String, String> options) {
        Map<String, String> customParameters = new LinkedHashMap<>(options);
        String state = customParameters.remove("state");
        String scope = customParameters.remove("scope");
        String redirect = customParameters.remove("redirect_uri");

        URI authorizationEndpoint;
        URI requestRedirectUri;
        try {
            authorizationEndpoint = new URI(endpoint);
            requestRedirectUri = redirect != null ? new URI(redirect) : redirectUri;
        } catch (URISyntaxException e) {
            throw new KeycloakClientException("Invalid authorization request URI: " + e.getMessage(), e);
        }

        return oauth2Client
                .buildAuthorizationUrl(
                        authorizationEndpoint,
                        clientId,
                        requestRedirectUri,
                        scope != null ? Scope.parse(scope) : new Scope(DEFAULT_SCOPES.toArray(new String[0])),
                        state != null ? new State(state) : new State(),
                        customParameters)
                .toString();
    }

    @Override
    public @NotNull List<String> getDefaultScopes() {
        return DEFAULT_SCOPES;
    }

    @Override
    public @NotNull KeycloakTokens authByCode(@NotNull String code) {
        return grantExecutor.authByCode(code);
    }

    @Override
    public @NotNull KeycloakTokens authByRefreshToken(@NotNull String refreshToken) {
        return grantExecutor.authByRefreshToken(refreshToken);
    }

    @Override
    public @NotNull KeycloakResourceOwner getResourceOwner(@NotNull KeycloakTokens tokens) {
        Map<String, Object> claims = decryptResponse(RawResourceOwnerResponse.encoded(tokens.accessToken()));
        return createResourceOwner(claims);
    }

    @Override
    public @NotNull KeycloakResourceOwner fetchResourceOwner(@NotNull KeycloakTokens tokens) {
        URI userInfoEndpoint;
        try {
            userInfoEndpoint = new URI(endpoints.userInfoUrl());
        } catch (URISyntaxException e) {
            throw new KeycloakClientException(
                    String.format("UserInfo Endpoint is not a valid URI: %s", endpoints.userInfoUrl()), e);
        }

        RawResourceOwnerResponse response = oauth2Client.requestResourceOwnerDetails(
                userInfoEndpoint, new BearerAccessToken(tokens.accessToken()));
        if (response instanceof RawResourceOwnerResponse.Structured structured) {
            GrantExecutor.checkResponse(structured.claims());
        }
        return createResourceOwner(decryptResponse(response));
    }

    @Override
    public @NotNull Map<String, Object> decryptResponse(@NotNull RawResourceOwnerResponse response) {
        return responseVerifier.resolve(response);
    }

    @Override
    public boolean usesEncryption() {
        return responseVerifier.usesEncryption();
    }

    private static @NotNull KeycloakResourceOwner createResourceOwner(@NotNull Map<String, Object> claims) {
        return new KeycloakResourceOwner(claims);
    }
}
