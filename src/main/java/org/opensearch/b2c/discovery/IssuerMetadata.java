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

import java.net.URI;
import java.util.Objects;

/**
 * The parts of a discovery document the validator needs: the issuer tokens must carry
 * and the location of the signing key set.
 */
public final class IssuerMetadata {

    private final String issuer;
    private final URI jwksUri;

    public IssuerMetadata(String issuer, URI jwksUri) {
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.jwksUri = Objects.requireNonNull(jwksUri, "jwksUri");
    }

    public String getIssuer() {
        return issuer;
    }

    public URI getJwksUri() {
        return jwksUri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IssuerMetadata that = (IssuerMetadata) o;
        return issuer.equals(that.issuer) && jwksUri.equals(that.jwksUri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(issuer, jwksUri);
    }

    @Override
    public String toString() {
        return "IssuerMetadata [issuer=" + issuer + ", jwksUri=" + jwksUri + "]";
    }
}
