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

public class ClaimsProjectionException extends RuntimeException {
    private static final long serialVersionUID = -3377254126548211309L;

    public ClaimsProjectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClaimsProjectionException(String message) {
        super(message);
    }
}
