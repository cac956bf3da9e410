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
import java.util.Map;

import org.apache.sling.auth.keycloak_client.EncryptionConfigurationException;
import org.apache.sling.auth.keycloak_client.RawResourceOwnerResponse;
import org.apache.sling.auth.keycloak_client.SignatureVerificationException;
import org.apache.sling.auth.keycloak_client.spi.JwtVerifier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw resource owner response into claims.
 *
 * <p>Structured responses are returned as they are. Encoded responses are signed tokens and are verified
 * with the configured key, accepting only the configured algorithm. Time based claims are checked with
 * a clock skew of {@value #LEEWAY_SECONDS} seconds.</p>
 */
class ResponseVerifier {

    static final int LEEWAY_SECONDS = 5;

    private static final Logger logger = LoggerFactory.getLogger(ResponseVerifier.class);

    private final @Nullable String algorithm;
    private final @Nullable String key;
    private final JwtVerifier jwtVerifier;

    ResponseVerifier(@Nullable String algorithm, @Nullable String key, @NotNull JwtVerifier jwtVerifier) {
        this.algorithm = algorithm;
        this.key = key;
        this.jwtVerifier = jwtVerifier;
    }

    boolean usesEncryption() {
        return algorithm != null && !algorithm.isEmpty() && key != null && !key.isEmpty();
    }

    /**
     * @throws EncryptionConfigurationException if the response is encoded and no algorithm and key are configured
     * @throws SignatureVerificationException if the encoded response fails verification
     */
    @NotNull
    Map<String, Object> resolve(@NotNull RawResourceOwnerResponse response) {
        if (response instanceof RawResourceOwnerResponse.Structured structured) {
            return structured.claims();
        }

        String token = ((RawResourceOwnerResponse.Encoded) response).token();
        if (!usesEncryption()) {
            logger.debug("Received an encoded response but no encryption algorithm and key are configured");
            throw EncryptionConfigurationException.undeterminedEncryption();
        }

        return jwtVerifier.verify(token, key, Collections.singleton(algorithm), LEEWAY_SECONDS);
    }
}
