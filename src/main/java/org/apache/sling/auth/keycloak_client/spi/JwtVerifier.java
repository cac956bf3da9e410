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

import java.util.Map;
import java.util.Set;

import org.apache.sling.auth.keycloak_client.SignatureVerificationException;
import org.jetbrains.annotations.NotNull;

/**
 * Service Provider Interface for signed token verification.
 */
public interface JwtVerifier {

    /**
     * Verifies the signature and the time based claims of a token.
     *
     * @param token the serialized token
     * @param key the key material, a PEM encoded public key or a shared secret depending on the algorithm
     * @param algorithms the accepted JWS algorithm names; tokens signed with any other algorithm are rejected
     * @param leewaySeconds the clock skew tolerated when checking {@code iat}, {@code nbf} and {@code exp}
     * @return the claims of the token
     * @throws SignatureVerificationException if the token cannot be verified
     */
    @NotNull
    Map<String, Object> verify(
            @NotNull String token, @NotNull String key, @NotNull Set<String> algorithms, int leewaySeconds);
}
