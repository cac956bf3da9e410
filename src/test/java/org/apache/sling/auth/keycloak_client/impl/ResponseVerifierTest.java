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

import java.text.ParseException;
import java.util.Base64;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import org.apache.sling.auth.keycloak_client.EncryptionConfigurationException;
import org.apache.sling.auth.keycloak_client.RawResourceOwnerResponse;
import org.apache.sling.auth.keycloak_client.SignatureVerificationException;
import org.apache.sling.auth.keycloak_client.spi.JwtVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.apache.sling.auth.keycloak_client.impl.KeycloakTestSupport.SUBJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ResponseVerifierTest {

    private KeycloakTestSupport support;
    private ResponseVerifier verifier;

    @BeforeEach
    void setUp() throws Exception {
        support = new KeycloakTestSupport();
        verifier = new ResponseVerifier("RS256", support.pemPublicKey(), new NimbusJwtVerifier());
    }

    private static Date secondsFromNow(int seconds) {
        return new Date(System.currentTimeMillis() + seconds * 1000L);
    }

    private Map<String, Object> resolve(String token) {
        return verifier.resolve(RawResourceOwnerResponse.encoded(token));
    }

    // ============ Structured responses ============

    @Test
    void structuredResponseIsReturnedUnchanged() {
        Map<String, Object> claims = new HashMap<>();
        claims.put("sub", SUBJECT);

        assertThat(verifier.resolve(RawResourceOwnerResponse.structured(claims))).isSameAs(claims);
    }

    @Test
    void structuredResponseIsReturnedUnchangedWithoutConfiguration() {
        JwtVerifier jwtVerifier = mock(JwtVerifier.class);
        ResponseVerifier unconfigured = new ResponseVerifier(null, null, jwtVerifier);
        Map<String, Object> claims = Map.of("sub", SUBJECT);

        assertThat(unconfigured.resolve(RawResourceOwnerResponse.structured(claims))).isSameAs(claims);
        verifyNoInteractions(jwtVerifier);
    }

    // ============ Configuration ============

    @Test
    void encodedResponseWithoutConfigurationIsRejected() {
        JwtVerifier jwtVerifier = mock(JwtVerifier.class);
        ResponseVerifier unconfigured = new ResponseVerifier(null, null, jwtVerifier);

        assertThat(unconfigured.usesEncryption()).isFalse();
        assertThatThrownBy(() -> unconfigured.resolve(RawResourceOwnerResponse.encoded("sometoken")))
                .isInstanceOf(EncryptionConfigurationException.class)
                .hasMessage("undetermined encryption");
        verifyNoInteractions(jwtVerifier);
    }

    @Test
    void partialConfigurationDoesNotEnableVerification() {
        JwtVerifier jwtVerifier = mock(JwtVerifier.class);

        assertThat(new ResponseVerifier("RS256", null, jwtVerifier).usesEncryption()).isFalse();
        assertThat(new ResponseVerifier("", "key", jwtVerifier).usesEncryption()).isFalse();
        assertThatThrownBy(() -> new ResponseVerifier("RS256", "", jwtVerifier)
                        .resolve(RawResourceOwnerResponse.encoded("sometoken")))
                .isInstanceOf(EncryptionConfigurationException.class);
        verifyNoInteractions(jwtVerifier);
    }

    @Test
    void verificationIsRestrictedToConfiguredAlgorithmWithLeeway() {
        JwtVerifier jwtVerifier = mock(JwtVerifier.class);
        Map<String, Object> claims = Map.of("sub", SUBJECT);
        when(jwtVerifier.verify("sometoken", "pem", Set.of("RS256"), 5)).thenReturn(claims);

        ResponseVerifier configured = new ResponseVerifier("RS256", "pem", jwtVerifier);

        assertThat(configured.resolve(RawResourceOwnerResponse.encoded("sometoken"))).isSameAs(claims);
        verify(jwtVerifier).verify("sometoken", "pem", Set.of("RS256"), ResponseVerifier.LEEWAY_SECONDS);
    }

    // ============ Signature verification ============

    @Test
    void validTokenReturnsClaims() throws Exception {
        JWTClaimsSet claimsSet = support.defaultClaims()
                .claim("realm_access", Map.of("roles", List.of("offline_access", "user")))
                .build();

        Map<String, Object> claims = resolve(support.createToken(claimsSet));

        assertThat(claims)
                .containsEntry("sub", SUBJECT)
                .containsEntry("email", "jane.doe@example.com")
                .containsEntry("realm_access", Map.of("roles", List.of("offline_access", "user")));
        assertThat(claims.get("exp")).isInstanceOf(Long.class);
        assertThat((Long) claims.get("exp")).isEqualTo(claimsSet.getExpirationTime().getTime() / 1000);
    }

    @Test
    void accessTokenTypedTokenIsAccepted() throws Exception {
        String token = support.createToken(
                support.headerBuilder().type(new JOSEObjectType("at+jwt")).build(),
                support.defaultClaims().build());

        assertThat(resolve(token)).containsEntry("sub", SUBJECT);
    }

    @Test
    void tokenSignedWithOtherAlgorithmIsRejected() throws Exception {
        String token = support.createToken(JWSAlgorithm.RS512, support.defaultClaims().build());

        assertThatThrownBy(() -> resolve(token))
                .isInstanceOf(SignatureVerificationException.class)
                .hasCauseInstanceOf(Exception.class);
    }

    @Test
    void tokenSignedWithHmacOfPublicKeyIsRejected() throws Exception {
        SignedJWT signedJWT =
                new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), support.defaultClaims().build());
        signedJWT.sign(new MACSigner(support.pemPublicKey().getBytes()));

        assertThatThrownBy(() -> resolve(signedJWT.serialize())).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void unsecuredTokenIsRejected() throws Exception {
        String token = new PlainJWT(support.defaultClaims().build()).serialize();

        assertThatThrownBy(() -> resolve(token)).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void tokenSignedWithOtherKeyIsRejected() throws Exception {
        String token = new KeycloakTestSupport().createValidToken();

        assertThatThrownBy(() -> resolve(token)).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void malformedTokenIsRejected() {
        assertThatThrownBy(() -> resolve("not.a.valid.jwt"))
                .isInstanceOf(SignatureVerificationException.class)
                .hasCauseInstanceOf(ParseException.class);
    }

    @Test
    void malformedKeyIsRejectedOnVerification() throws Exception {
        ResponseVerifier broken = new ResponseVerifier(
                "RS256", PublicKeyFormatter.format("bm90IGEga2V5"), new NimbusJwtVerifier());

        assertThatThrownBy(() -> broken.resolve(RawResourceOwnerResponse.encoded(support.createValidToken())))
                .isInstanceOf(SignatureVerificationException.class);
    }

    // ============ Clock skew ============

    @Test
    void notBeforeWithinLeewayIsAccepted() throws Exception {
        String token = support.createToken(
                support.defaultClaims().notBeforeTime(secondsFromNow(3)).build());

        assertThat(resolve(token)).containsEntry("sub", SUBJECT);
    }

    @Test
    void notBeforeBeyondLeewayIsRejected() throws Exception {
        String token = support.createToken(
                support.defaultClaims().notBeforeTime(secondsFromNow(10)).build());

        assertThatThrownBy(() -> resolve(token)).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void expirationWithinLeewayIsAccepted() throws Exception {
        String token = support.createToken(
                support.defaultClaims().expirationTime(secondsFromNow(-3)).build());

        assertThat(resolve(token)).containsEntry("sub", SUBJECT);
    }

    @Test
    void expirationBeyondLeewayIsRejected() throws Exception {
        String token = support.createToken(
                support.defaultClaims().expirationTime(secondsFromNow(-10)).build());

        assertThatThrownBy(() -> resolve(token)).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void issueTimeWithinLeewayIsAccepted() throws Exception {
        String token = support.createToken(
                support.defaultClaims().issueTime(secondsFromNow(3)).build());

        assertThat(resolve(token)).containsEntry("sub", SUBJECT);
    }

    @Test
    void issueTimeBeyondLeewayIsRejected() throws Exception {
        String token = support.createToken(
                support.defaultClaims().issueTime(secondsFromNow(10)).build());

        assertThatThrownBy(() -> resolve(token)).isInstanceOf(SignatureVerificationException.class);
    }

    // ============ Other key types ============

    @Test
    void ecSignedTokenIsVerified() throws Exception {
        ECKey ecKey = new ECKeyGenerator(Curve.P_256).generate();
        String rawKey = Base64.getEncoder().encodeToString(ecKey.toECPublicKey().getEncoded());
        SignedJWT signedJWT =
                new SignedJWT(new JWSHeader(JWSAlgorithm.ES256), support.defaultClaims().build());
        signedJWT.sign(new ECDSASigner(ecKey));

        ResponseVerifier ecVerifier =
                new ResponseVerifier("ES256", PublicKeyFormatter.format(rawKey), new NimbusJwtVerifier());

        assertThat(ecVerifier.resolve(RawResourceOwnerResponse.encoded(signedJWT.serialize())))
                .containsEntry("sub", SUBJECT);
    }

    @Test
    void hmacSignedTokenIsVerifiedWithSharedSecret() throws Exception {
        String secret = "a-shared-secret-that-is-at-least-256-bits-long";
        SignedJWT signedJWT =
                new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), support.defaultClaims().build());
        signedJWT.sign(new MACSigner(secret));

        ResponseVerifier hmacVerifier = new ResponseVerifier("HS256", secret, new NimbusJwtVerifier());

        assertThat(hmacVerifier.resolve(RawResourceOwnerResponse.encoded(signedJWT.serialize())))
                .containsEntry("sub", SUBJECT);
    }
}
