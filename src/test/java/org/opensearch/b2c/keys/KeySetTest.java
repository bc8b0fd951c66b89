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

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import org.opensearch.b2c.TestJwts;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class KeySetTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-05-01T10:00:00Z");

    static final RSAKey K1 = TestJwts.generateKey("k1");
    static final RSAKey K2 = TestJwts.generateKey("k2");

    @Test
    public void testParseContainsExactlyTheDocumentKeys() throws JOSEException {
        KeySet keySet = KeySet.parse(TestJwts.jwks(K1, K2), FETCHED_AT);

        assertThat(keySet.size(), is(2));
        assertThat(keySet.getKeyIds(), equalTo(Set.of("k1", "k2")));
        assertThat(keySet.getKey("k1").getModulus(), is(K1.getModulus().toString()));
        assertThat(keySet.getKey("k1").getExponent(), is(K1.getPublicExponent().toString()));
        assertThat(keySet.getKey("k2").getPublicKey(), equalTo(K2.toRSAPublicKey()));
        assertThat(keySet.getKey("k3"), nullValue());
        assertThat(keySet.getKey(null), nullValue());
        assertThat(keySet.getFetchedAt(), is(FETCHED_AT));
    }

    @Test
    public void testParseTypicalB2cDocument() {
        String document = "{\"keys\":[{\"kid\":\"X5eXk4xyojNFum1kl2Ytv8dlNP4-c57dO6QGTVBwaNk\",\"nbf\":1493763266,"
            + "\"use\":\"sig\",\"kty\":\"RSA\",\"e\":\"AQAB\",\"n\":\""
            + K1.getModulus()
            + "\"}]}";

        KeySet keySet = KeySet.parse(document, FETCHED_AT);

        SigningKey key = keySet.getKey("X5eXk4xyojNFum1kl2Ytv8dlNP4-c57dO6QGTVBwaNk");
        assertThat(key, notNullValue());
        assertThat(key.getKeyType(), is("RSA"));
        assertThat(key.getExponent(), is("AQAB"));
        assertThat(key.getAlgorithm(), nullValue());
    }

    @Test
    public void testSnapshotIsImmutable() {
        KeySet keySet = KeySet.parse(TestJwts.jwks(K1), FETCHED_AT);

        assertThrows(UnsupportedOperationException.class, () -> keySet.getKeyIds().add("k2"));
        assertThrows(UnsupportedOperationException.class, () -> keySet.getKeys().clear());
    }

    @Test
    public void testDuplicateKidIsRejected() {
        RSAKey otherK1 = TestJwts.generateKey("k1");

        Throwable exception = assertThrows(KeyFetchException.class, () -> KeySet.parse(TestJwts.jwks(K1, otherK1), FETCHED_AT));
        assertThat(exception.getMessage(), containsString("duplicate kid k1"));
    }

    @Test
    public void testOfRejectsDuplicateKid() throws JOSEException {
        SigningKey first = SigningKey.fromJwk(K1);
        SigningKey second = SigningKey.fromJwk(TestJwts.generateKey("k1"));

        assertThrows(IllegalArgumentException.class, () -> KeySet.of(List.of(first, second), FETCHED_AT));
    }

    @Test
    public void testRsaKeyWithoutKidIsRejected() throws JOSEException {
        RSAKey withoutKid = new RSAKey.Builder(K1.toRSAPublicKey()).build();

        assertThrows(KeyFetchException.class, () -> KeySet.parse(new JWKSet(withoutKid).toString(), FETCHED_AT));
    }

    @Test
    public void testNonRsaAndEncryptionKeysAreSkipped() throws JOSEException {
        ECKey ecKey = new ECKeyGenerator(Curve.P_256).keyID("ec1").generate();
        RSAKey encryptionKey = new RSAKey.Builder(K2.toRSAPublicKey()).keyID("enc1").keyUse(KeyUse.ENCRYPTION).build();
        RSAKey signingKey = new RSAKey.Builder(K1.toRSAPublicKey()).keyID("k1").keyUse(KeyUse.SIGNATURE).build();

        KeySet keySet = KeySet.parse(new JWKSet(List.of(ecKey.toPublicJWK(), encryptionKey, signingKey)).toString(), FETCHED_AT);

        assertThat(keySet.getKeyIds(), equalTo(Set.of("k1")));
        assertFalse(keySet.containsKey("ec1"));
        assertFalse(keySet.containsKey("enc1"));
    }

    @Test
    public void testPrivateKeyMaterialIsDropped() {
        KeySet keySet = KeySet.parse(new JWKSet(K1).toString(false), FETCHED_AT);

        assertTrue(keySet.containsKey("k1"));
        assertThat(keySet.getKey("k1").getPublicKey(), notNullValue());
    }

    @Test
    public void testDeclaredAlgorithmIsKept() {
        SigningKey key = SigningKey.of("k1", K1.getModulus().toString(), K1.getPublicExponent().toString(), "RS256");

        assertThat(key.getAlgorithm(), is("RS256"));
        assertThat(KeySet.of(List.of(key), FETCHED_AT).getKey("k1"), equalTo(key));
    }

    @Test
    public void testEmptyKeySet() {
        KeySet keySet = KeySet.parse("{\"keys\":[]}", FETCHED_AT);

        assertTrue(keySet.isEmpty());
    }

    @Test
    public void testInvalidDocuments() {
        assertThrows(KeyFetchException.class, () -> KeySet.parse("", FETCHED_AT));
        assertThrows(KeyFetchException.class, () -> KeySet.parse("not json", FETCHED_AT));
        assertThrows(KeyFetchException.class, () -> KeySet.parse("[]", FETCHED_AT));
        assertThrows(KeyFetchException.class, () -> KeySet.parse("{\"issuer\":\"x\"}", FETCHED_AT));
        assertThrows(KeyFetchException.class, () -> KeySet.parse("{\"keys\":[{\"kty\":\"RSA\",\"kid\":\"k1\"}]}", FETCHED_AT));
    }
}
