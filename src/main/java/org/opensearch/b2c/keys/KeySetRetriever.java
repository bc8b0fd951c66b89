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

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fetches the JWKS document from the key set location announced by the discovery document.
 */
public class KeySetRetriever implements KeySetProvider {
    private final static Logger log = LogManager.getLogger(KeySetRetriever.class);

    private final URI jwksUri;
    private final int requestTimeoutMs;

    public KeySetRetriever(URI jwksUri, int requestTimeoutMs) {
        this.jwksUri = jwksUri;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public KeySet get() throws KeyFetchException {
        try (CloseableHttpClient httpClient = HttpClients.custom().useSystemProperties().build()) {

            HttpGet httpGet = new HttpGet(jwksUri);

            RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(requestTimeoutMs)
                .setConnectTimeout(requestTimeoutMs)
                .setSocketTimeout(requestTimeoutMs)
                .build();

            httpGet.setConfig(requestConfig);

            try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                StatusLine statusLine = response.getStatusLine();

                if (statusLine.getStatusCode() < 200 || statusLine.getStatusCode() >= 300) {
                    throw new KeyFetchException("Error while getting " + jwksUri + ": " + statusLine);
                }

                HttpEntity httpEntity = response.getEntity();

                if (httpEntity == null) {
                    throw new KeyFetchException("Error while getting " + jwksUri + ": Empty response entity");
                }

                KeySet keySet = KeySet.parse(EntityUtils.toString(httpEntity, StandardCharsets.UTF_8), Instant.now());

                if (log.isDebugEnabled()) {
                    log.debug("Fetched {} from {}", keySet, jwksUri);
                }

                return keySet;
            }
        } catch (IOException e) {
            throw new KeyFetchException("Error while getting " + jwksUri + ": " + e, e);
        }
    }

    public URI getJwksUri() {
        return jwksUri;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    @Override
    public String toString() {
        return "KeySetRetriever [jwksUri=" + jwksUri + "]";
    }
}
