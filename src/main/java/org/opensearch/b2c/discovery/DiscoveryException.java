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

/**
 * Thrown when the issuer metadata of a tenant cannot be resolved, either because the
 * discovery document could not be fetched or because it is not a usable OpenID provider
 * configuration.
 */
public class DiscoveryException extends RuntimeException {
    private static final long serialVersionUID = 4406239563410843112L;

    public DiscoveryException() {
        super();
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(Throwable cause) {
        super(cause);
    }
}
