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
 * Thrown when a signature could not be checked at all because the crypto provider failed.
 * A signature that does not match is reported as {@link InvalidReason#SIGNATURE_INVALID} instead.
 */
public class VerifierException extends RuntimeException {
    private static final long serialVersionUID = 5873109982743311270L;

    public VerifierException(String message, Throwable cause) {
        super(message, cause);
    }

    public VerifierException(String message) {
        super(message);
    }
}
