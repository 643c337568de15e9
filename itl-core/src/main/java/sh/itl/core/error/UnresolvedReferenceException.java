// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

/**
 * Thrown when a graph is asked to resolve a name or link it does not hold, for
 * instance a {@link sh.itl.core.model.TypeRef.Named} produced by another
 * document.
 */
public final class UnresolvedReferenceException extends ItlException {

    public UnresolvedReferenceException(final String message) {
        super(message);
    }

    public static UnresolvedReferenceException unknownName(final String name) {
        return new UnresolvedReferenceException("No type named '" + name + "' in this graph");
    }
}
