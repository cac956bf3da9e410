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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The authenticated user as described by the claims of a Keycloak token or userinfo response.
 *
 * <p>Claims that the realm does not issue are reported as {@code null} or as an empty list.</p>
 */
public class KeycloakResourceOwner {

    private final Map<String, Object> claims;

    public KeycloakResourceOwner(@NotNull Map<String, Object> claims) {
        this.claims = Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    /**
     * @return the subject identifier ({@code sub})
     */
    @Nullable
    public String getId() {
        return getStringClaim("sub");
    }

    @Nullable
    public String getName() {
        return getStringClaim("name");
    }

    @Nullable
    public String getEmail() {
        return getStringClaim("email");
    }

    @Nullable
    public String getPreferredUsername() {
        return getStringClaim("preferred_username");
    }

    @Nullable
    public String getGivenName() {
        return getStringClaim("given_name");
    }

    @Nullable
    public String getFamilyName() {
        return getStringClaim("family_name");
    }

    /**
     * @return the realm roles found under {@code realm_access.roles}
     */
    @NotNull
    public List<String> getRealmRoles() {
        return rolesOf(claims.get("realm_access"));
    }

    /**
     * @param clientId the client whose roles are requested
     * @return the client roles found under {@code resource_access.<clientId>.roles}
     */
    @NotNull
    public List<String> getClientRoles(@NotNull String clientId) {
        Object resourceAccess = claims.get("resource_access");
        if (!(resourceAccess instanceof Map<?, ?> clients)) {
            return Collections.emptyList();
        }
        return rolesOf(clients.get(clientId));
    }

    @Nullable
    public Object getClaim(@NotNull String name) {
        return claims.get(name);
    }

    @NotNull
    public Map<String, Object> toMap() {
        return claims;
    }

    private @Nullable String getStringClaim(@NotNull String name) {
        Object value = claims.get(name);
        return value != null ? value.toString() : null;
    }

    private static @NotNull List<String> rolesOf(@Nullable Object access) {
        if (!(access instanceof Map<?, ?> accessMap)) {
            return Collections.emptyList();
        }
        if (!(accessMap.get("roles") instanceof List<?> roles)) {
            return Collections.emptyList();
        }
        return roles.stream().map(String::valueOf).collect(Collectors.toUnmodifiableList());
    }
}
