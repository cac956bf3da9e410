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
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Raised when the identity provider answers a token or userinfo request with an error payload.
 *
 * <p>The message has the form {@code error: error_description}. The complete payload is kept
 * for diagnostics.</p>
 */
public class IdentityProviderException extends KeycloakClientException {

    private static final long serialVersionUID = 1L;

    private final String code;
    private final Map<String, Object> responseBody;

    public IdentityProviderException(
            @NotNull String code, @NotNull String message, @NotNull Map<String, Object> responseBody) {
        super(message);
        this.code = code;
        this.responseBody = Collections.unmodifiableMap(new LinkedHashMap<>(responseBody));
    }

    /**
     * @return the OAuth 2.0 error code, e.g. {@code invalid_grant}
     */
    @NotNull
    public String getCode() {
        return code;
    }

    /**
     * @return the full error payload returned by the provider
     */
    @NotNull
    public Map<String, Object> getResponseBody() {
        return responseBody;
    }
}
