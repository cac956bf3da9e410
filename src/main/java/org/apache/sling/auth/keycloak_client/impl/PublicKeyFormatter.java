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

import org.jetbrains.annotations.NotNull;

/**
 * Wraps the bare base64 public key shown in the Keycloak realm settings into a PEM block.
 */
final class PublicKeyFormatter {

    static final String HEADER = "-----BEGIN PUBLIC KEY-----";
    static final String FOOTER = "-----END PUBLIC KEY-----";

    private static final int LINE_LENGTH = 64;

    private PublicKeyFormatter() {
        // Utility class
    }

    /**
     * Splits the key into 64 character lines and adds the PEM header and footer. The input is not validated,
     * broken key material is only detected when a token is verified against it.
     *
     * @param raw the base64 encoded key, without header and footer
     * @return the PEM encoded key
     */
    static @NotNull String format(@NotNull String raw) {
        StringBuilder pem = new StringBuilder(HEADER).append('\n');
        for (int start = 0; start < raw.length(); start += LINE_LENGTH) {
            pem.append(raw, start, Math.min(raw.length(), start + LINE_LENGTH)).append('\n');
        }
        return pem.append(FOOTER).toString();
    }
}
