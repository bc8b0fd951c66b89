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

package org.opensearch.b2c.keys;

import java.security.interfaces.RSAPublicKey;
import java.util.Objects;

import com.google.common.base.Strings;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.KeyType;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.util.Base64URL;

/**
 * An RSA public signing key published by the identity provider. Immutable.
 */
public final class SigningKey {

    private final RSAKey jwk;
    private final RSAPublicKey publicKey;

    private SigningKey(RSAKey jwk, RSAPublicKey publicKey) {
        this.jwk = jwk;
        this.publicKey = publicKey;
    }

    /**
     * @throws IllegalArgumentException if the JWK has no key id or its RSA parameters do not form a valid public key
     */
    public static SigningKey fromJwk(RSAKey jwk) {
        Objects.requireNonNull(jwk, "jwk");

        if (Strings.isNullOrEmpty(jwk.getKeyID())) {
            throw new IllegalArgumentException("RSA key without kid");
        }

        try {
            return new SigningKey(jwk.toPublicJWK(), jwk.toRSAPublicKey());
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Invalid RSA key " + jwk.getKeyID() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a key from its base64url encoded modulus and exponent.
     *
     * @param algorithm the declared algorithm of the key, may be null
     */
    public static SigningKey of(String keyId, String modulus, String exponent, String algorithm) {
        RSAKey.Builder builder = new RSAKey.Builder(new Base64URL(modulus), new Base64URL(exponent)).keyID(keyId);

        if (!Strings.isNullOrEmpty(algorithm)) {
            builder.algorithm(JWSAlgorithm.parse(algorithm));
        }

        return fromJwk(builder.build());
    }

    public String getKeyId() {
        return jwk.getKeyID();
    }

    public String getKeyType() {
        return KeyType.RSA.getValue();
    }

    public String getModulus() {
        return jwk.getModulus().toString();
    }

    public String getExponent() {
        return jwk.getPublicExponent().toString();
    }

    /**
     * @return the algorithm the key is declared for, or null if the key set does not restrict it
     */
    public String getAlgorithm() {
        return jwk.getAlgorithm() == null ? null : jwk.getAlgorithm().getName();
    }

    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SigningKey that = (SigningKey) o;
        return Objects.equals(getKeyId(), that.getKeyId())
            && getModulus().equals(that.getModulus())
            && getExponent().equals(that.getExponent())
            && Objects.equals(getAlgorithm(), that.getAlgorithm());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKeyId(), getModulus(), getExponent(), getAlgorithm());
    }

    @Override
    public String toString() {
        return "SigningKey [kid=" + getKeyId() + ", kty=" + getKeyType() + ", alg=" + getAlgorithm() + "]";
    }
}
