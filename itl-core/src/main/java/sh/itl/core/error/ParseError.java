// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

import java.util.Objects;

import sh.itl.core.model.NodePath;

/**
 * The input is not well-formed JSON. Positions are 1-based; {@code -1} means the
 * decoder did not report one.
 *
 * @param message    the decoder message
 * @param line       line of the error
 * @param column     column of the error
 * @param byteOffset byte offset of the error
 */
public record ParseError(String message, long line, long column, long byteOffset) implements SchemaProblem {

    public static final String CODE = "MALFORMED_JSON";

    public ParseError {
        Objects.requireNonNull(message, "message");
    }

    public static ParseError withoutLocation(final String message) {
        return new ParseError(message, -1, -1, -1);
    }

    public boolean hasLocation() {
        return line > 0;
    }

    @Override
    public Stage stage() {
        return Stage.PARSE;
    }

    @Override
    public NodePath path() {
        return NodePath.root();
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public String detail() {
        if (!hasLocation()) {
            return message;
        }
        return "%s (line %d, column %d, byte %d)".formatted(message, line, column, byteOffset);
    }
}
