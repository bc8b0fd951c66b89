/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.opensearch.b2c.jwt;

import java.text.ParseException;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.b2c.TenantConfig;
import org.opensearch.b2c.keys.KeySet;
import org.opensearch.b2c.keys.SigningKey;

import com.nimbusds.jose.Header;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

/**
 * Verifies compact serialized access tokens against a {@link KeySet} snapshot.
 * <p>
 * The signature is checked before any claim is looked at. A key id that is not part of the
 * snapshot yields {@link ValidationResult#needKeyRefresh()} rather than a rejection, because
 * the token may have been signed with a key published after the snapshot was taken.
 * Verification is pure computation and never performs I/O.
 */
public class JwtVerifier {

    private final static Logger log = LogManager.getLogger(JwtVerifier.class);

    public static final Set<JWSAlgorithm> SUPPORTED_ALGORITHMS = JWSAlgorithm.Family.RSA;

    static final String POLICY_CLAIM = "tfp";
    static final String FALLBACK_POLICY_CLAIM = "acr";

    private final long clockSkewToleranceMs;
    private final LongSupplier currentTimeMillis;

    public JwtVerifier(int clockSkewToleranceSeconds) {
        this(clockSkewToleranceSeconds, System::currentTimeMillis);
    }

    public JwtVerifier(int clockSkewToleranceSeconds, LongSupplier currentTimeMillis) {
        this.clockSkewToleranceMs = clockSkewToleranceSeconds * 1000L;
        this.currentTimeMillis = currentTimeMillis;
    }

    /**
     * @throws VerifierException if the crypto provider fails while checking the signature
     */
    public ValidationResult verify(String token, KeySet keySet, String expectedIssuer, TenantConfig tenantConfig)
        throws VerifierException {

        if (Strings.isNullOrEmpty(token)) {
            return reject(InvalidReason.MALFORMED_TOKEN, "empty token");
        }

        String[] parts = token.split("\\.", -1);

        if (parts.length != 3) {
            return reject(InvalidReason.MALFORMED_TOKEN, "token has " + parts.length + " segments");
        }

        Base64URL[] segments = new Base64URL[3];

        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                return reject(InvalidReason.MALFORMED_TOKEN, "segment " + i + " is empty");
            }

            segments[i] = new Base64URL(parts[i]);

            // rejects padding, characters outside the alphabet and non-zero trailing bits
            if (!Base64URL.encode(segments[i].decode()).toString().equals(parts[i])) {
                return reject(InvalidReason.MALFORMED_TOKEN, "segment " + i + " is not canonical base64url");
            }
        }

        Header header;

        try {
            header = Header.parse(segments[0]);
        } catch (ParseException e) {
            return reject(InvalidReason.MALFORMED_TOKEN, "invalid header: " + e.getMessage());
        }

        if (!(header instanceof JWSHeader) || !SUPPORTED_ALGORITHMS.contains(header.getAlgorithm())) {
            return reject(InvalidReason.UNSUPPORTED_ALGORITHM, "alg " + header.getAlgorithm());
        }

        JWSHeader jwsHeader = (JWSHeader) header;
        String kid = jwsHeader.getKeyID();

        if (Strings.isNullOrEmpty(kid)) {
            return reject(InvalidReason.MALFORMED_TOKEN, "header has no kid");
        }

        SigningKey key = keySet.getKey(kid);

        if (key == null) {
            if (log.isDebugEnabled()) {
                log.debug("Unknown kid {}, known kids are {}", kid, keySet.getKeyIds());
            }
            return ValidationResult.needKeyRefresh();
        }

        if (key.getAlgorithm() != null && !key.getAlgorithm().equals(jwsHeader.getAlgorithm().getName())) {
            return reject(
                InvalidReason.SIGNATURE_INVALID,
                "algorithm of JWT does not match algorithm of JWK (" + key.getAlgorithm() + " != " + jwsHeader.getAlgorithm() + ")"
            );
        }

        SignedJWT jwt;

        try {
            jwt = new SignedJWT(segments[0], segments[1], segments[2]);
        } catch (ParseException e) {
            return reject(InvalidReason.MALFORMED_TOKEN, "invalid JWS: " + e.getMessage());
        }

        if (!verifySignature(jwt, key)) {
            return reject(InvalidReason.SIGNATURE_INVALID, "signature does not match key " + kid);
        }

        Map<String, Object> claims = jwt.getPayload().toJSONObject();

        if (claims == null) {
            return reject(InvalidReason.MALFORMED_TOKEN, "payload is not a JSON object");
        }

        JWTClaimsSet claimsSet;

        try {
            claimsSet = JWTClaimsSet.parse(claims);
        } catch (ParseException e) {
            return reject(InvalidReason.MALFORMED_TOKEN, "invalid claims: " + e.getMessage());
        }

        InvalidReason claimFailure = validateClaims(claimsSet, expectedIssuer, tenantConfig);

        if (claimFailure != null) {
            return reject(claimFailure, "claim check failed");
        }

        return ValidationResult.valid(claims);
    }

    private boolean verifySignature(SignedJWT jwt, SigningKey key) throws VerifierException {
        try {
            return jwt.verify(new RSASSAVerifier(key.getPublicKey()));
        } catch (JOSEException e) {
            throw new VerifierException("Cannot verify JWT signature with key " + key.getKeyId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the standard claims in a fixed order and returns the first failure, or null if
     * all checks pass.
     */
    InvalidReason validateClaims(JWTClaimsSet claims, String expectedIssuer, TenantConfig tenantConfig) {
        long now = currentTimeMillis.getAsLong();

        Date exp = claims.getExpirationTime();

        if (exp == null || exp.getTime() <= now - clockSkewToleranceMs) {
            return InvalidReason.CLAIM_EXPIRED;
        }

        Date nbf = claims.getNotBeforeTime();

        if (nbf != null && nbf.getTime() > now + clockSkewToleranceMs) {
            return InvalidReason.CLAIM_NOT_YET_VALID;
        }

        if (expectedIssuer == null || !expectedIssuer.equals(claims.getIssuer())) {
            return InvalidReason.ISSUER_MISMATCH;
        }

        Object policy = claims.getClaims().containsKey(POLICY_CLAIM) ? claims.getClaim(POLICY_CLAIM) : claims.getClaim(FALLBACK_POLICY_CLAIM);

        if (!(policy instanceof String) || !tenantConfig.getPolicyName().equalsIgnoreCase((String) policy)) {
            return InvalidReason.POLICY_MISMATCH;
        }

        Set<String> requiredAudience = tenantConfig.getRequiredAudience().orElse(null);
        List<String> audience = claims.getAudience();

        if (requiredAudience != null && (audience == null || Collections.disjoint(requiredAudience, audience))) {
            return InvalidReason.AUDIENCE_MISMATCH;
        }

        return null;
    }

    private static ValidationResult reject(InvalidReason reason, String detail) {
        if (log.isDebugEnabled()) {
            log.debug("Rejecting token ({}): {}", reason, detail);
        }
        return ValidationResult.invalid(reason);
    }

    public long getClockSkewToleranceMs() {
        return clockSkewToleranceMs;
    }
}
