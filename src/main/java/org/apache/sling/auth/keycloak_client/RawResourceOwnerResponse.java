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

import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * A resource owner payload as received from the provider, before verification.
 *
 * <p>Either an {@link Encoded} signed token that must be verified, or {@link Structured} claims
 * that were already decoded.</p>
 */
public sealed interface RawResourceOwnerResponse
        permits RawResourceOwnerResponse.Encoded, RawResourceOwnerResponse.Structured {

    static @NotNull RawResourceOwnerResponse encoded(@NotNull String token) {
        return new Encoded(token);
    }

    static @NotNull RawResourceOwnerResponse structured(@NotNull Map<String, Object> claims) {
        return new Structured(claims);
    }

    record Encoded(@NotNull String token) implements RawResourceOwnerResponse {}

    record Structured(@NotNull Map<String, Object> claims) implements RawResourceOwnerResponse {}
}
