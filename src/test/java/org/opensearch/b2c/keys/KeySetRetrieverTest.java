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

import java.net.URI;
import java.util.Set;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.opensearch.b2c.MockIdpServer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.Assert.assertThrows;

public class KeySetRetrieverTest {

    private MockIdpServer mockIdpServer;
    private KeySetRetriever keySetRetriever;

    @Before
    public void setUp() throws Exception {
        mockIdpServer = new MockIdpServer();
        mockIdpServer.setKeys(KeySetTest.K1, KeySetTest.K2);
        keySetRetriever = new KeySetRetriever(URI.create(mockIdpServer.getJwksUri()), 5000);
    }

    @After
    public void tearDown() {
        mockIdpServer.close();
    }

    @Test
    public void testGet() {
        KeySet keySet = keySetRetriever.get();

        assertThat(keySet.getKeyIds(), equalTo(Set.of("k1", "k2")));
        assertThat(keySet.getFetchedAt(), notNullValue());
        assertThat(mockIdpServer.getKeysRequests(), is(1));
    }

    @Test
    public void testEachGetFetchesAgain() {
        keySetRetriever.get();
        mockIdpServer.setKeys(KeySetTest.K2);

        KeySet keySet = keySetRetriever.get();

        assertThat(keySet.getKeyIds(), equalTo(Set.of("k2")));
        assertThat(mockIdpServer.getKeysRequests(), is(2));
    }

    @Test
    public void testErrorStatus() {
        mockIdpServer.setKeysStatus(500);

        Throwable exception = assertThrows(KeyFetchException.class, () -> keySetRetriever.get());
        assertThat(exception.getMessage(), containsString("500"));
    }

    @Test
    public void testInvalidDocument() {
        mockIdpServer.setKeysBody("<html>Bad gateway</html>");

        assertThrows(KeyFetchException.class, () -> keySetRetriever.get());
    }

    @Test
    public void testUnknownPath() {
        KeySetRetriever wrongPath = new KeySetRetriever(URI.create(mockIdpServer.getUri() + "/keys"), 5000);

        assertThrows(KeyFetchException.class, () -> wrongPath.get());
    }
}
