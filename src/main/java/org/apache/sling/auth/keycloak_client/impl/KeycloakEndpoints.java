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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nimbusds.oauth2.sdk.util.URLUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Derives the OpenID Connect endpoints of a Keycloak realm.
 *
 * <p>All endpoints live under {@code <authServerUrl>/realms/<realm>/protocol/openid-connect}. The
 * URLs are concatenated as configured, without any well-formedness check.</p>
 */
class KeycloakEndpoints {

    static final String PROTOCOL_PATH = "/protocol/openid-connect";

    private final String authServerUrl;
    private final String realm;

    KeycloakEndpoints(@NotNull String authServerUrl, @NotNull String realm) {
        this.authServerUrl = authServerUrl;
        this.realm = realm;
    }

    @NotNull
    String identityProviderBaseUrl() {
        return identityProviderBaseUrl(authServerUrl);
    }

    @NotNull
    String identityProviderBaseUrl(@NotNull String serverUrl) {
        return serverUrl + "/realms/" + realm;
    }

    @NotNull
    String authorizationUrl() {
        return authorizationUrl(authServerUrl);
    }

    @NotNull
    String authorizationUrl(@NotNull String serverUrl) {
        return identityProviderBaseUrl(serverUrl) + PROTOCOL_PATH + "/auth";
    }

    @NotNull
    String tokenUrl() {
        return identityProviderBaseUrl() + PROTOCOL_PATH + "/token";
    }

    @NotNull
    String userInfoUrl() {
        return identityProviderBaseUrl() + PROTOCOL_PATH + "/userinfo";
    }

    @NotNull
    String logoutUrl() {
        return identityProviderBaseUrl() + PROTOCOL_PATH + "/logout";
    }

    @NotNull
    String logoutUrl(@NotNull Map<String, String> parameters) {
        return appendQuery(logoutUrl(), parameters);
    }

    /**
     * Appends the parameters to the URL as form encoded query string, keeping their iteration order.
     * Entries with a {@code null} value are skipped.
     */
    static @NotNull String appendQuery(@NotNull String url, @NotNull Map<String, String> parameters) {
        Map<String, List<String>> query = new LinkedHashMap<>();
        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            if (parameter.getValue() != null) {
                query.computeIfAbsent(parameter.getKey(), k -> new ArrayList<>()).add(parameter.getValue());
            }
        }
        if (query.isEmpty()) {
            return url;
        }
        char separator = url.indexOf('?') >= 0 ? '&' : '?';
        return url + separator + URLUtils.serializeParameters(query);
    }
}
