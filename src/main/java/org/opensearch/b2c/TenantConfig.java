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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.opensearch.common.settings.Settings;

/**
 * Immutable description of the B2C tenant and policy (user flow) a validator accepts tokens for.
 * <p>
 * Besides tenant, policy and the optional audience set, it carries the tunables of the
 * discovery and key refresh machinery. Instances are created through {@link #builder(String, String)}
 * or {@link #fromSettings(Settings)}.
 */
public final class TenantConfig {

    public static final String TENANT_NAME = "tenant_name";
    public static final String POLICY_NAME = "policy_name";
    public static final String REQUIRED_AUDIENCE = "required_audience";
    public static final String DISCOVERY_URL_TEMPLATE = "discovery_url_template";
    public static final String IDP_REQUEST_TIMEOUT_MS = "idp_request_timeout_ms";
    public static final String CLOCK_SKEW_TOLERANCE_SECONDS = "jwt_clock_skew_tolerance_seconds";
    public static final String REFRESH_RATE_LIMIT_TIME_WINDOW_MS = "refresh_rate_limit_time_window_ms";
    public static final String REFRESH_RATE_LIMIT_COUNT = "refresh_rate_limit_count";

    public static final String DEFAULT_DISCOVERY_URL_TEMPLATE =
        "https://{tenant}.b2clogin.com/{tenant}.onmicrosoft.com/{policy}/v2.0/.well-known/openid-configuration";
    public static final int DEFAULT_IDP_REQUEST_TIMEOUT_MS = 5000;
    public static final int DEFAULT_CLOCK_SKEW_TOLERANCE_SECONDS = 0;
    public static final int DEFAULT_REFRESH_RATE_LIMIT_TIME_WINDOW_MS = 10000;
    public static final int DEFAULT_REFRESH_RATE_LIMIT_COUNT = 10;

    private final String tenantName;
    private final String policyName;
    private final Set<String> requiredAudience;
    private final String discoveryUrlTemplate;
    private final int requestTimeoutMs;
    private final int clockSkewToleranceSeconds;
    private final int refreshRateLimitTimeWindowMs;
    private final int refreshRateLimitCount;

    private TenantConfig(Builder builder) {
        this.tenantName = builder.tenantName;
        this.policyName = builder.policyName;
        this.requiredAudience = builder.requiredAudience == null
            ? null
            : Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredAudience));
        this.discoveryUrlTemplate = builder.discoveryUrlTemplate;
        this.requestTimeoutMs = builder.requestTimeoutMs;
        this.clockSkewToleranceSeconds = builder.clockSkewToleranceSeconds;
        this.refreshRateLimitTimeWindowMs = builder.refreshRateLimitTimeWindowMs;
        this.refreshRateLimitCount = builder.refreshRateLimitCount;
    }

    public static Builder builder(String tenantName, String policyName) {
        return new Builder(tenantName, policyName);
    }

    /**
     * Reads a tenant configuration from settings. {@code required_audience} is optional; when
     * it is absent audience checking is disabled, when it is present it must not be empty.
     */
    public static TenantConfig fromSettings(Settings settings) {
        Builder builder = builder(settings.get(TENANT_NAME), settings.get(POLICY_NAME));

        if (settings.keySet().contains(REQUIRED_AUDIENCE)) {
            builder.requiredAudience(settings.getAsList(REQUIRED_AUDIENCE));
        }

        return builder.discoveryUrlTemplate(settings.get(DISCOVERY_URL_TEMPLATE, DEFAULT_DISCOVERY_URL_TEMPLATE))
            .requestTimeoutMs(settings.getAsInt(IDP_REQUEST_TIMEOUT_MS, DEFAULT_IDP_REQUEST_TIMEOUT_MS))
            .clockSkewToleranceSeconds(settings.getAsInt(CLOCK_SKEW_TOLERANCE_SECONDS, DEFAULT_CLOCK_SKEW_TOLERANCE_SECONDS))
            .refreshRateLimitTimeWindowMs(settings.getAsInt(REFRESH_RATE_LIMIT_TIME_WINDOW_MS, DEFAULT_REFRESH_RATE_LIMIT_TIME_WINDOW_MS))
            .refreshRateLimitCount(settings.getAsInt(REFRESH_RATE_LIMIT_COUNT, DEFAULT_REFRESH_RATE_LIMIT_COUNT))
            .build();
    }

    public String getTenantName() {
        return tenantName;
    }

    public String getPolicyName() {
        return policyName;
    }

    /**
     * @return the accepted audiences, or empty if audience checking is disabled
     */
    public Optional<Set<String>> getRequiredAudience() {
        return Optional.ofNullable(requiredAudience);
    }

    public String getDiscoveryUrlTemplate() {
        return discoveryUrlTemplate;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public int getClockSkewToleranceSeconds() {
        return clockSkewToleranceSeconds;
    }

    public int getRefreshRateLimitTimeWindowMs() {
        return refreshRateLimitTimeWindowMs;
    }

    public int getRefreshRateLimitCount() {
        return refreshRateLimitCount;
    }

    @Override
    public String toString() {
        return "TenantConfig [tenantName="
            + tenantName
            + ", policyName="
            + policyName
            + ", requiredAudience="
            + requiredAudience
            + ", discoveryUrlTemplate="
            + discoveryUrlTemplate
            + "]";
    }

    public static final class Builder {
        private final String tenantName;
        private final String policyName;
        private Set<String> requiredAudience;
        private String discoveryUrlTemplate = DEFAULT_DISCOVERY_URL_TEMPLATE;
        private int requestTimeoutMs = DEFAULT_IDP_REQUEST_TIMEOUT_MS;
        private int clockSkewToleranceSeconds = DEFAULT_CLOCK_SKEW_TOLERANCE_SECONDS;
        private int refreshRateLimitTimeWindowMs = DEFAULT_REFRESH_RATE_LIMIT_TIME_WINDOW_MS;
        private int refreshRateLimitCount = DEFAULT_REFRESH_RATE_LIMIT_COUNT;

        private Builder(String tenantName, String policyName) {
            this.tenantName = tenantName;
            this.policyName = policyName;
        }

        public Builder requiredAudience(Collection<String> requiredAudience) {
            this.requiredAudience = requiredAudience == null ? null : new LinkedHashSet<>(requiredAudience);
            return this;
        }

        public Builder requiredAudience(String... requiredAudience) {
            return requiredAudience(List.of(requiredAudience));
        }

        public Builder discoveryUrlTemplate(String discoveryUrlTemplate) {
            this.discoveryUrlTemplate = discoveryUrlTemplate;
            return this;
        }

        public Builder requestTimeoutMs(int requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public Builder clockSkewToleranceSeconds(int clockSkewToleranceSeconds) {
            this.clockSkewToleranceSeconds = clockSkewToleranceSeconds;
            return this;
        }

        public Builder refreshRateLimitTimeWindowMs(int refreshRateLimitTimeWindowMs) {
            this.refreshRateLimitTimeWindowMs = refreshRateLimitTimeWindowMs;
            return this;
        }

        public Builder refreshRateLimitCount(int refreshRateLimitCount) {
            this.refreshRateLimitCount = refreshRateLimitCount;
            return this;
        }

        public TenantConfig build() {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(tenantName), "%s must not be empty", TENANT_NAME);
            Preconditions.checkArgument(!Strings.isNullOrEmpty(policyName), "%s must not be empty", POLICY_NAME);
            Preconditions.checkArgument(
                !Strings.isNullOrEmpty(discoveryUrlTemplate),
                "%s must not be empty",
                DISCOVERY_URL_TEMPLATE
            );

            if (requiredAudience != null) {
                Preconditions.checkArgument(!requiredAudience.isEmpty(), "%s must not be empty if configured", REQUIRED_AUDIENCE);

                for (String audience : requiredAudience) {
                    Preconditions.checkArgument(!Strings.isNullOrEmpty(audience), "%s must not contain empty values", REQUIRED_AUDIENCE);
                }
            }

            Preconditions.checkArgument(requestTimeoutMs > 0, "%s must be positive", IDP_REQUEST_TIMEOUT_MS);
            Preconditions.checkArgument(clockSkewToleranceSeconds >= 0, "%s must not be negative", CLOCK_SKEW_TOLERANCE_SECONDS);
            Preconditions.checkArgument(refreshRateLimitTimeWindowMs >= 0, "%s must not be negative", REFRESH_RATE_LIMIT_TIME_WINDOW_MS);
            Preconditions.checkArgument(refreshRateLimitCount > 0, "%s must be positive", REFRESH_RATE_LIMIT_COUNT);

            return new TenantConfig(this);
        }
    }
}
