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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Tokens issued by the Keycloak token endpoint.
 */
public class KeycloakTokens {

    private final @NotNull String accessToken;
    private final long expiresAt;
    private final @Nullable String refreshToken;
    private final @Nullable String idToken;

    public KeycloakTokens(
            @NotNull String accessToken, long expiresAt, @Nullable String refreshToken, @Nullable String idToken) {
        this.accessToken = accessToken;
        this.expiresAt = expiresAt;
        this.refreshToken = refreshToken;
        this.idToken = idToken;
    }

    /**
     * @return the access token wire value
     */
    @NotNull
    public String accessToken() {
        return accessToken;
    }

    /**
     * @return the expiry as epoch milliseconds, or {@code 0} if the provider did not send a lifetime
     */
    public long expiresAt() {
        return expiresAt;
    }

    @Nullable
    public String refreshToken() {
        return refreshToken;
    }

    @Nullable
    public String idToken() {
        return idToken;
    }
}
