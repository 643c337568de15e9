// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

/**
 * Pipeline stage that reported a problem. Stages run in declaration order and
 * a document only reaches a stage when every earlier one succeeded.
 */
public enum Stage {
    /** JSON decoding. */
    PARSE,
    /** Grammar shape checks and name resolution. */
    BUILD,
    /** Semantic invariants over the linked graph. */
    VALIDATE
}
