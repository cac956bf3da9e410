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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KeycloakEndpointsTest {

    private final KeycloakEndpoints endpoints = new KeycloakEndpoints("https://idp.example.com", "demo");

    @Test
    void testIdentityProviderBaseUrl() {
        assertEquals("https://idp.example.com/realms/demo", endpoints.identityProviderBaseUrl());
    }

    @Test
    void testProtocolEndpoints() {
        assertEquals(
                "https://idp.example.com/realms/demo/protocol/openid-connect/auth", endpoints.authorizationUrl());
        assertEquals("https://idp.example.com/realms/demo/protocol/openid-connect/token", endpoints.tokenUrl());
        assertEquals(
                "https://idp.example.com/realms/demo/protocol/openid-connect/userinfo", endpoints.userInfoUrl());
        assertEquals("https://idp.example.com/realms/demo/protocol/openid-connect/logout", endpoints.logoutUrl());
    }

    @Test
    void testAuthorizationUrlForOtherServer() {
        assertEquals(
                "http://keycloak:8080/auth/realms/demo/protocol/openid-connect/auth",
                endpoints.authorizationUrl("http://keycloak:8080/auth"));
    }

    @Test
    void testLogoutUrlWithRedirect() {
        assertEquals(
                "https://idp.example.com/realms/demo/protocol/openid-connect/logout?redirect_uri=https%3A%2F%2Fapp.example.com",
                endpoints.logoutUrl(Map.of("redirect_uri", "https://app.example.com")));
    }

    @Test
    void testLogoutUrlKeepsParameterOrder() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("post_logout_redirect_uri", "https://app.example.com/bye");
        options.put("id_token_hint", "abc.def.ghi");

        assertEquals(
                "https://idp.example.com/realms/demo/protocol/openid-connect/logout"
                        + "?post_logout_redirect_uri=https%3A%2F%2Fapp.example.com%2Fbye&id_token_hint=abc.def.ghi",
                endpoints.logoutUrl(options));
    }

    @Test
    void testLogoutUrlWithoutParameters() {
        assertEquals(
                "https://idp.example.com/realms/demo/protocol/openid-connect/logout",
                endpoints.logoutUrl(Collections.emptyMap()));
    }

    @Test
    void testAppendQueryToUrlWithQuery() {
        assertEquals("https://host/path?a=1&b=2", KeycloakEndpoints.appendQuery("https://host/path?a=1", Map.of("b", "2")));
    }

    @Test
    void testMalformedServerUrlIsNotValidated() {
        KeycloakEndpoints malformed = new KeycloakEndpoints("not a url", "demo");
        assertEquals("not a url/realms/demo/protocol/openid-connect/token", malformed.tokenUrl());
    }
}
