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

package org.opensearch.b2c.discovery;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import com.google.common.base.Strings;
import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.b2c.DefaultObjectMapper;
import org.opensearch.b2c.discovery.json.OpenIdProviderConfiguration;

/**
 * Resolves a tenant and policy into {@link IssuerMetadata} by fetching the OpenID discovery
 * document of the policy. There are no retries; callers decide whether to try again.
 */
public class DiscoveryResolver {
    private final static Logger log = LogManager.getLogger(DiscoveryResolver.class);

    private final String discoveryUrlTemplate;
    private final int requestTimeoutMs;

    public DiscoveryResolver(String discoveryUrlTemplate, int requestTimeoutMs) {
        this.discoveryUrlTemplate = discoveryUrlTemplate;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public CompletableFuture<IssuerMetadata> resolveAsync(String tenantName, String policyName, Executor executor) {
        return CompletableFuture.supplyAsync(() -> resolve(tenantName, policyName), executor);
    }

    public IssuerMetadata resolve(String tenantName, String policyName) throws DiscoveryException {
        URI discoveryUri = getDiscoveryUri(tenantName, policyName);

        log.debug("Resolving issuer metadata from {}", discoveryUri);

        OpenIdProviderConfiguration configuration = fetch(discoveryUri);

        if (Strings.isNullOrEmpty(configuration.getIssuer()) || configuration.getIssuer().isBlank()) {
            throw new DiscoveryException("Discovery document at " + discoveryUri + " does not contain an issuer");
        }

        if (Strings.isNullOrEmpty(configuration.getJwksUri()) || configuration.getJwksUri().isBlank()) {
            throw new DiscoveryException("Discovery document at " + discoveryUri + " does not contain a jwks_uri");
        }

        URI jwksUri;

        try {
            jwksUri = new URI(configuration.getJwksUri());
        } catch (URISyntaxException e) {
            throw new DiscoveryException("Discovery document at " + discoveryUri + " contains an invalid jwks_uri: " + e.getMessage(), e);
        }

        if (!jwksUri.isAbsolute()) {
            throw new DiscoveryException("Discovery document at " + discoveryUri + " contains a relative jwks_uri " + jwksUri);
        }

        IssuerMetadata metadata = new IssuerMetadata(configuration.getIssuer(), jwksUri);

        log.info("Resolved {} for tenant {} and policy {}", metadata, tenantName, policyName);

        return metadata;
    }

    public URI getDiscoveryUri(String tenantName, String policyName) throws DiscoveryException {
        String uri = discoveryUrlTemplate.replace("{tenant}", tenantName).replace("{policy}", policyName);

        try {
            return new URI(uri);
        } catch (URISyntaxException e) {
            throw new DiscoveryException("Invalid discovery location " + uri + ": " + e.getMessage(), e);
        }
    }

    private OpenIdProviderConfiguration fetch(URI discoveryUri) throws DiscoveryException {
        try (CloseableHttpClient httpClient = HttpClients.custom().useSystemProperties().build()) {

            HttpGet httpGet = new HttpGet(discoveryUri);

            RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(requestTimeoutMs)
                .setConnectTimeout(requestTimeoutMs)
                .setSocketTimeout(requestTimeoutMs)
                .build();

            httpGet.setConfig(requestConfig);

            try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                StatusLine statusLine = response.getStatusLine();

                if (statusLine.getStatusCode() < 200 || statusLine.getStatusCode() >= 300) {
                    throw new DiscoveryException("Error while getting " + discoveryUri + ": " + statusLine);
                }

                HttpEntity httpEntity = response.getEntity();

                if (httpEntity == null) {
                    throw new DiscoveryException("Error while getting " + discoveryUri + ": Empty response entity");
                }

                OpenIdProviderConfiguration parsedEntity = DefaultObjectMapper.readValue(
                    httpEntity.getContent(),
                    OpenIdProviderConfiguration.class
                );

                if (parsedEntity == null) {
                    throw new DiscoveryException("Error while getting " + discoveryUri + ": Empty discovery document");
                }

                return parsedEntity;
            }
        } catch (IOException e) {
            throw new DiscoveryException("Error while getting " + discoveryUri + ": " + e, e);
        }
    }

    public String getDiscoveryUrlTemplate() {
        return discoveryUrlTemplate;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }
}
