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

/**
 * Why a token was rejected. These are expected outcomes for untrusted input and are
 * reported as part of a {@link ValidationResult}, never thrown.
 */
public enum InvalidReason {
    MALFORMED_TOKEN,
    UNSUPPORTED_ALGORITHM,
    SIGNATURE_INVALID,
    CLAIM_EXPIRED,
    CLAIM_NOT_YET_VALID,
    ISSUER_MISMATCH,
    POLICY_MISMATCH,
    AUDIENCE_MISMATCH
}
