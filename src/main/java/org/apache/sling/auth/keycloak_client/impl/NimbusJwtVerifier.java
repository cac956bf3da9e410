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

import javax.crypto.spec.SecretKeySpec;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.spec.X509EncodedKeySpec;
import java.text.ParseException;
import java.util.Base64;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.KeySourceException;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.proc.BadJWTException;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import com.nimbusds.jwt.proc.JWTClaimsSetVerifier;
import org.apache.sling.auth.keycloak_client.SignatureVerificationException;
import org.apache.sling.auth.keycloak_client.spi.JwtVerifier;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies signed tokens against a single configured key using the Nimbus JOSE+JWT library.
 *
 * <p>RSA ({@code RS*}, {@code PS*}) and EC ({@code ES*}) algorithms expect a PEM or bare base64 encoded
 * X.509 public key. HMAC ({@code HS*}) algorithms use the UTF-8 bytes of the key as shared secret.
 * Unsecured tokens are always rejected.</p>
 */
@Component(service = JwtVerifier.class)
public class NimbusJwtVerifier implements JwtVerifier {

    private static final Logger logger = LoggerFactory.getLogger(NimbusJwtVerifier.class);

    @Override
    public @NotNull Map<String, Object> verify(
            @NotNull String token, @NotNull String key, @NotNull Set<String> algorithms, int leewaySeconds) {
        Set<JWSAlgorithm> acceptedAlgorithms =
                algorithms.stream().map(JWSAlgorithm::parse).collect(Collectors.toSet());

        DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
        processor.setJWSKeySelector((header, context) -> {
            if (!acceptedAlgorithms.contains(header.getAlgorithm())) {
                logger.debug("Token algorithm {} is not accepted", header.getAlgorithm());
                return Collections.emptyList();
            }
            return List.of(toKey(header.getAlgorithm(), key));
        });
        // Keycloak may type access tokens as at+jwt, the header type is not restricted
        processor.setJWSTypeVerifier((type, context) -> {});
        processor.setJWTClaimsSetVerifier(timeClaimsVerifier(leewaySeconds));

        try {
            JWTClaimsSet claimsSet = processor.process(token, null);
            logger.debug("Token verified for subject: {}", claimsSet.getSubject());
            return claimsSet.toJSONObject();
        } catch (ParseException | BadJOSEException | JOSEException e) {
            logger.debug("Token verification failed: {}", e.getMessage());
            throw new SignatureVerificationException("Token verification failed: " + e.getMessage(), e);
        }
    }

    /**
     * Checks {@code exp} and {@code nbf} with the given skew, and additionally rejects tokens issued
     * further in the future than the skew allows.
     */
    static @NotNull JWTClaimsSetVerifier<SecurityContext> timeClaimsVerifier(int leewaySeconds) {
        DefaultJWTClaimsVerifier<SecurityContext> defaultVerifier = new DefaultJWTClaimsVerifier<>(null, null);
        defaultVerifier.setMaxClockSkew(leewaySeconds);

        return (claimsSet, context) -> {
            defaultVerifier.verify(claimsSet, context);

            Date issueTime = claimsSet.getIssueTime();
            if (issueTime != null && issueTime.getTime() > System.currentTimeMillis() + leewaySeconds * 1000L) {
                throw new BadJWTException("JWT issue time is in the future");
            }
        };
    }

    static @NotNull Key toKey(@NotNull JWSAlgorithm algorithm, @NotNull String key) throws KeySourceException {
        if (JWSAlgorithm.Family.HMAC_SHA.contains(algorithm)) {
            return new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA" + algorithm.getName().substring(2));
        }

        String keyType;
        if (JWSAlgorithm.Family.RSA.contains(algorithm)) {
            keyType = "RSA";
        } else if (JWSAlgorithm.Family.EC.contains(algorithm)) {
            keyType = "EC";
        } else {
            throw new KeySourceException("Unsupported algorithm: " + algorithm);
        }

        try {
            String body = key.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s", "");
            byte[] encoded = Base64.getDecoder().decode(body);
            return KeyFactory.getInstance(keyType).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new KeySourceException("Invalid " + keyType + " public key: " + e.getMessage(), e);
        }
    }
}
