// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

/**
 * Base runtime exception for ITL failures surfaced to callers as exceptions.
 *
 * <p>
 * Rejected documents are normally reported as data through
 * {@link sh.itl.core.SchemaResult}; these exceptions exist for callers that
 * prefer to fail fast and for misuse of an accepted graph.
 *
 * <pre>
 * ItlException
 * ├── {@link SchemaRejectedException}      - a document failed to compile
 * └── {@link UnresolvedReferenceException} - a graph was asked for a type it does not hold
 * </pre>
 *
 * @since 0.1.0-alpha
 */
public sealed class ItlException extends RuntimeException
        permits SchemaRejectedException, UnresolvedReferenceException {

    public ItlException(final String message) {
        super(message);
    }
}
