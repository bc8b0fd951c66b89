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

package org.opensearch.b2c;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.LongSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.b2c.discovery.DiscoveryException;
import org.opensearch.b2c.discovery.DiscoveryResolver;
import org.opensearch.b2c.discovery.IssuerMetadata;
import org.opensearch.b2c.jwt.JwtVerifier;
import org.opensearch.b2c.jwt.ValidationResult;
import org.opensearch.b2c.jwt.VerifierException;
import org.opensearch.b2c.keys.KeyFetchException;
import org.opensearch.b2c.keys.KeySet;
import org.opensearch.b2c.keys.KeySetProvider;
import org.opensearch.b2c.keys.KeySetRetriever;
import org.opensearch.b2c.keys.SelfRefreshingKeySet;
import org.opensearch.common.util.concurrent.OpenSearchExecutors;

/**
 * Validates access tokens of one B2C tenant and policy.
 * <p>
 * A validator only exists in a ready state: {@link #create(TenantConfig)} runs discovery and the
 * initial key fetch and completes with either a fully initialized validator or the
 * {@link DiscoveryException} / {@link KeyFetchException} that prevented it.
 * <p>
 * {@link #validateAccessToken(String)} is synchronous and works on the key set snapshot active
 * at the time of the call. When it returns {@link ValidationResult.Status#NEED_KEY_REFRESH},
 * callers should call {@link #refreshValidationKeys()} once and validate again; a key id that is
 * still unknown after that should be treated as invalid. The validator never retries on its own.
 * <p>
 * Each validator owns its key set, so validators for different tenants can coexist in one process.
 */
public class B2cTokenValidator implements Closeable {
    private final static Logger log = LogManager.getLogger(B2cTokenValidator.class);

    private final TenantConfig tenantConfig;
    private final IssuerMetadata issuerMetadata;
    private final SelfRefreshingKeySet keySet;
    private final JwtVerifier jwtVerifier;
    private final ExecutorService ownedExecutor;

    private B2cTokenValidator(
        TenantConfig tenantConfig,
        IssuerMetadata issuerMetadata,
        SelfRefreshingKeySet keySet,
        JwtVerifier jwtVerifier,
        ExecutorService ownedExecutor
    ) {
        this.tenantConfig = tenantConfig;
        this.issuerMetadata = issuerMetadata;
        this.keySet = keySet;
        this.jwtVerifier = jwtVerifier;
        this.ownedExecutor = ownedExecutor;
    }

    public static CompletableFuture<B2cTokenValidator> create(TenantConfig tenantConfig) {
        return builder(tenantConfig).build();
    }

    public static Builder builder(TenantConfig tenantConfig) {
        return new Builder(tenantConfig);
    }

    /**
     * Validates a compact serialized access token against the current key set. Performs no I/O.
     *
     * @throws VerifierException if the signature could not be checked because of a crypto provider failure
     */
    public ValidationResult validateAccessToken(String accessToken) throws VerifierException {
        return jwtVerifier.verify(accessToken, keySet.current(), issuerMetadata.getIssuer(), tenantConfig);
    }

    /**
     * Fetches the key set again and activates it on success. Concurrent calls share one fetch.
     *
     * @return a future that fails with {@link KeyFetchException} if the keys could not be refreshed;
     *         the previously active keys stay in use in that case
     */
    public CompletableFuture<Void> refreshValidationKeys() {
        return keySet.refresh();
    }

    public TenantConfig getTenantConfig() {
        return tenantConfig;
    }

    public IssuerMetadata getIssuerMetadata() {
        return issuerMetadata;
    }

    public KeySet currentKeySet() {
        return keySet.current();
    }

    SelfRefreshingKeySet getSelfRefreshingKeySet() {
        return keySet;
    }

    /**
     * Shuts down the refresh executor if the validator created it. A caller supplied executor is left alone.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return "B2cTokenValidator [tenantConfig=" + tenantConfig + ", issuerMetadata=" + issuerMetadata + "]";
    }

    static ExecutorService newDefaultExecutor(TenantConfig tenantConfig) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            1,
            1,
            60,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            OpenSearchExecutors.daemonThreadFactory("b2c-keys-" + tenantConfig.getTenantName())
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    public static final class Builder {
        private final TenantConfig tenantConfig;
        private ExecutorService executor;
        private DiscoveryResolver discoveryResolver;
        private Function<IssuerMetadata, KeySetProvider> keySetProviderFactory;
        private LongSupplier currentTimeMillis = System::currentTimeMillis;

        private Builder(TenantConfig tenantConfig) {
            this.tenantConfig = Objects.requireNonNull(tenantConfig, "tenantConfig");
        }

        /**
         * Runs discovery and key refreshes on the given executor instead of a validator owned one.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder discoveryResolver(DiscoveryResolver discoveryResolver) {
            this.discoveryResolver = discoveryResolver;
            return this;
        }

        /**
         * Replaces the HTTP based key set retrieval. The factory is called once with the resolved
         * issuer metadata; the provider it returns serves the initial fetch and every refresh.
         */
        public Builder keySetProviderFactory(Function<IssuerMetadata, KeySetProvider> keySetProviderFactory) {
            this.keySetProviderFactory = keySetProviderFactory;
            return this;
        }

        public Builder currentTimeMillis(LongSupplier currentTimeMillis) {
            this.currentTimeMillis = Objects.requireNonNull(currentTimeMillis, "currentTimeMillis");
            return this;
        }

        public CompletableFuture<B2cTokenValidator> build() {
            final ExecutorService ownedExecutor = executor == null ? newDefaultExecutor(tenantConfig) : null;
            final ExecutorService effectiveExecutor = executor == null ? ownedExecutor : executor;
            final DiscoveryResolver resolver = discoveryResolver != null
                ? discoveryResolver
                : new DiscoveryResolver(tenantConfig.getDiscoveryUrlTemplate(), tenantConfig.getRequestTimeoutMs());
            final Function<IssuerMetadata, KeySetProvider> providerFactory = keySetProviderFactory != null
                ? keySetProviderFactory
                : metadata -> new KeySetRetriever(metadata.getJwksUri(), tenantConfig.getRequestTimeoutMs());
            final LongSupplier clock = currentTimeMillis;

            log.info("Initializing token validator for {}", tenantConfig);

            CompletableFuture<B2cTokenValidator> result = resolver.resolveAsync(
                tenantConfig.getTenantName(),
                tenantConfig.getPolicyName(),
                effectiveExecutor
            ).thenApplyAsync(issuerMetadata -> {
                KeySetProvider keySetProvider = providerFactory.apply(issuerMetadata);
                KeySet initialKeySet = keySetProvider.get();

                if (initialKeySet == null) {
                    throw new KeyFetchException("Key set provider " + keySetProvider + " yielded null");
                }

                SelfRefreshingKeySet selfRefreshingKeySet = new SelfRefreshingKeySet(
                    keySetProvider,
                    initialKeySet,
                    effectiveExecutor,
                    clock
                );
                selfRefreshingKeySet.setRefreshRateLimitTimeWindowMs(tenantConfig.getRefreshRateLimitTimeWindowMs());
                selfRefreshingKeySet.setRefreshRateLimitCount(tenantConfig.getRefreshRateLimitCount());

                JwtVerifier jwtVerifier = new JwtVerifier(tenantConfig.getClockSkewToleranceSeconds(), clock);

                log.info("Token validator for tenant {} ready with {}", tenantConfig.getTenantName(), initialKeySet);

                return new B2cTokenValidator(tenantConfig, issuerMetadata, selfRefreshingKeySet, jwtVerifier, ownedExecutor);
            }, effectiveExecutor);

            return result.whenComplete((validator, e) -> {
                if (e != null) {
                    log.error("Error creating token validator for {}", tenantConfig, e);

                    if (ownedExecutor != null) {
                        ownedExecutor.shutdown();
                    }
                }
            });
        }
    }
}
