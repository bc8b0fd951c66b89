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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.opensearch.b2c.DefaultObjectMapper;

/**
 * Outcome of validating an access token. Exactly one of:
 * <ul>
 * <li>{@link Status#VALID}: signature and all claim checks passed, the claims are available</li>
 * <li>{@link Status#NEED_KEY_REFRESH}: the token is signed with a key id missing from the current
 * key set; refresh the keys once and validate again</li>
 * <li>{@link Status#INVALID}: the token was rejected for the given {@link InvalidReason}</li>
 * </ul>
 */
public final class ValidationResult {

    public enum Status {
        VALID,
        NEED_KEY_REFRESH,
        INVALID
    }

    private static final ValidationResult NEED_KEY_REFRESH = new ValidationResult(Status.NEED_KEY_REFRESH, null, null);

    private final Status status;
    private final Map<String, Object> claims;
    private final InvalidReason invalidReason;

    private ValidationResult(Status status, Map<String, Object> claims, InvalidReason invalidReason) {
        this.status = status;
        this.claims = claims;
        this.invalidReason = invalidReason;
    }

    public static ValidationResult valid(Map<String, Object> claims) {
        return new ValidationResult(Status.VALID, Collections.unmodifiableMap(Objects.requireNonNull(claims, "claims")), null);
    }

    public static ValidationResult needKeyRefresh() {
        return NEED_KEY_REFRESH;
    }

    public static ValidationResult invalid(InvalidReason reason) {
        return new ValidationResult(Status.INVALID, null, Objects.requireNonNull(reason, "reason"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean needsKeyRefresh() {
        return status == Status.NEED_KEY_REFRESH;
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    /**
     * @throws IllegalStateException if the result is not {@link Status#VALID}
     */
    public Map<String, Object> getClaims() {
        if (status != Status.VALID) {
            throw new IllegalStateException("No claims available for a " + status + " result");
        }
        return claims;
    }

    /**
     * @return the claims of a valid result, empty otherwise
     */
    public Optional<Map<String, Object>> ok() {
        return Optional.ofNullable(claims);
    }

    /**
     * @return the rejection reason, or null unless the result is {@link Status#INVALID}
     */
    public InvalidReason getInvalidReason() {
        return invalidReason;
    }

    /**
     * Projects the claims of a valid result onto a caller defined type. Claim names are mapped to
     * fields the usual Jackson way, so {@code @JsonProperty("tfp")} renames a field and
     * {@code @JsonIgnoreProperties(ignoreUnknown = true)} tolerates claims the type does not model.
     *
     * @throws IllegalStateException if the result is not {@link Status#VALID}
     * @throws ClaimsProjectionException if the claims do not fit the target type
     */
    public <T> T getClaimsAs(Class<T> type) {
        Map<String, Object> validClaims = getClaims();

        try {
            return DefaultObjectMapper.convertValue(validClaims, type);
        } catch (IllegalArgumentException e) {
            throw new ClaimsProjectionException("Cannot map claims to " + type.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationResult that = (ValidationResult) o;
        return status == that.status && Objects.equals(claims, that.claims) && invalidReason == that.invalidReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, claims, invalidReason);
    }

    @Override
    public String toString() {
        switch (status) {
            case VALID:
                return "ValidationResult [VALID, claims=" + claims.keySet() + "]";
            case INVALID:
                return "ValidationResult [INVALID, reason=" + invalidReason + "]";
            default:
                return "ValidationResult [NEED_KEY_REFRESH]";
        }
    }
}
