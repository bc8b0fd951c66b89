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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.Test;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ValidationResultTest {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserClaims {
        @JsonProperty("sub")
        public String subject;
        @JsonProperty("tfp")
        public String policy;
        public String name;
        public List<String> emails;
    }

    public static class StrictClaims {
        public String sub;
    }

    private static Map<String, Object> claims() {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", "8a1f6a2e-34d5-4bb6-93c4-f0e1a7e5c9d2");
        claims.put("tfp", "B2C_1_signupsignin");
        claims.put("name", "Nyota Uhura");
        claims.put("emails", List.of("uhura@example.com"));
        claims.put("exp", 1700003600);
        return claims;
    }

    @Test
    public void testValid() {
        ValidationResult result = ValidationResult.valid(claims());

        assertTrue(result.isValid());
        assertFalse(result.isInvalid());
        assertFalse(result.needsKeyRefresh());
        assertThat(result.getClaims(), equalTo(claims()));
        assertThat(result.ok(), is(Optional.of(claims())));
        assertThat(result.getInvalidReason(), nullValue());
        assertThrows(UnsupportedOperationException.class, () -> result.getClaims().put("sub", "someone else"));
    }

    @Test
    public void testNeedKeyRefresh() {
        ValidationResult result = ValidationResult.needKeyRefresh();

        assertTrue(result.needsKeyRefresh());
        assertThat(result, sameInstance(ValidationResult.needKeyRefresh()));
        assertThat(result.ok(), is(Optional.empty()));
        assertThat(result.getInvalidReason(), nullValue());
        assertThrows(IllegalStateException.class, result::getClaims);
    }

    @Test
    public void testInvalid() {
        ValidationResult result = ValidationResult.invalid(InvalidReason.AUDIENCE_MISMATCH);

        assertTrue(result.isInvalid());
        assertThat(result.getStatus(), is(ValidationResult.Status.INVALID));
        assertThat(result.getInvalidReason(), is(InvalidReason.AUDIENCE_MISMATCH));
        assertThat(result.ok(), is(Optional.empty()));
        assertThat(result, equalTo(ValidationResult.invalid(InvalidReason.AUDIENCE_MISMATCH)));
        assertThrows(IllegalStateException.class, result::getClaims);
        assertThrows(IllegalStateException.class, () -> result.getClaimsAs(UserClaims.class));
    }

    @Test
    public void testGetClaimsAs() {
        UserClaims userClaims = ValidationResult.valid(claims()).getClaimsAs(UserClaims.class);

        assertThat(userClaims.subject, is("8a1f6a2e-34d5-4bb6-93c4-f0e1a7e5c9d2"));
        assertThat(userClaims.policy, is("B2C_1_signupsignin"));
        assertThat(userClaims.name, is("Nyota Uhura"));
        assertThat(userClaims.emails, equalTo(List.of("uhura@example.com")));
    }

    @Test
    public void testGetClaimsAsWithUnknownClaims() {
        ValidationResult result = ValidationResult.valid(claims());

        assertThrows(ClaimsProjectionException.class, () -> result.getClaimsAs(StrictClaims.class));
    }

    @Test
    public void testGetClaimsAsWithIncompatibleType() {
        Map<String, Object> claims = claims();
        claims.put("emails", Map.of("primary", "uhura@example.com"));

        assertThrows(ClaimsProjectionException.class, () -> ValidationResult.valid(claims).getClaimsAs(UserClaims.class));
    }
}
