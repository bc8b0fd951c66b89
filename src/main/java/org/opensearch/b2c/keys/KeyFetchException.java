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

/**
 * Thrown when a signing key set cannot be fetched or parsed, or when a refresh is refused
 * because of the refresh rate limit. The active key set is never affected.
 */
public class KeyFetchException extends RuntimeException {
    private static final long serialVersionUID = -2131437356128846170L;

    public KeyFetchException() {
        super();
    }

    public KeyFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public KeyFetchException(String message) {
        super(message);
    }

    public KeyFetchException(Throwable cause) {
        super(cause);
    }
}
