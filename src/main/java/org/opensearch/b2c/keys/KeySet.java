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

import java.text.ParseException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;

/**
 * Immutable snapshot of the signing keys of an identity provider, indexed by key id.
 * <p>
 * A snapshot is never modified after creation. Key rotation replaces the snapshot as a whole,
 * so holders of an older instance keep seeing a consistent, if stale, set of keys.
 */
public final class KeySet {
    private final static Logger log = LogManager.getLogger(KeySet.class);

    private final Map<String, SigningKey> keys;
    private final Instant fetchedAt;

    private KeySet(Map<String, SigningKey> keys, Instant fetchedAt) {
        this.keys = Collections.unmodifiableMap(keys);
        this.fetchedAt = fetchedAt;
    }

    /**
     * @throws IllegalArgumentException if two keys share a key id
     */
    public static KeySet of(Collection<SigningKey> keys, Instant fetchedAt) {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        Map<String, SigningKey> byKeyId = new LinkedHashMap<>();

        for (SigningKey key : keys) {
            if (byKeyId.putIfAbsent(key.getKeyId(), key) != null) {
                throw new IllegalArgumentException("Duplicate kid " + key.getKeyId());
            }
        }

        return new KeySet(byKeyId, fetchedAt);
    }

    /**
     * Parses a JWKS document. Only RSA keys intended for signatures are kept; keys of other
     * types or uses are skipped.
     *
     * @throws KeyFetchException if the document is not a valid JWKS, an RSA key has no kid,
     *                           or a kid occurs more than once
     */
    public static KeySet parse(String jwksDocument, Instant fetchedAt) throws KeyFetchException {
        JWKSet jwkSet;

        try {
            jwkSet = JWKSet.parse(jwksDocument);
        } catch (ParseException e) {
            throw new KeyFetchException("Invalid JWKS document: " + e.getMessage(), e);
        }

        Map<String, SigningKey> byKeyId = new LinkedHashMap<>();

        for (JWK jwk : jwkSet.getKeys()) {
            if (!(jwk instanceof RSAKey)) {
                log.debug("Skipping key {} of unsupported type {}", jwk.getKeyID(), jwk.getKeyType());
                continue;
            }

            if (jwk.getKeyUse() != null && !KeyUse.SIGNATURE.equals(jwk.getKeyUse())) {
                log.debug("Skipping key {} with use {}", jwk.getKeyID(), jwk.getKeyUse());
                continue;
            }

            SigningKey signingKey;

            try {
                signingKey = SigningKey.fromJwk((RSAKey) jwk);
            } catch (IllegalArgumentException e) {
                throw new KeyFetchException("Invalid JWKS document: " + e.getMessage(), e);
            }

            if (byKeyId.putIfAbsent(signingKey.getKeyId(), signingKey) != null) {
                throw new KeyFetchException("Invalid JWKS document: duplicate kid " + signingKey.getKeyId());
            }
        }

        return new KeySet(byKeyId, fetchedAt);
    }

    /**
     * @return the key with the given id, or null if this snapshot does not contain it
     */
    public SigningKey getKey(String kid) {
        return kid == null ? null : keys.get(kid);
    }

    public boolean containsKey(String kid) {
        return kid != null && keys.containsKey(kid);
    }

    public Set<String> getKeyIds() {
        return keys.keySet();
    }

    public Collection<SigningKey> getKeys() {
        return keys.values();
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    @Override
    public String toString() {
        return "KeySet [kids=" + keys.keySet() + ", fetchedAt=" + fetchedAt + "]";
    }
}
