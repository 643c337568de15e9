// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.json;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import sh.itl.core.error.ParseError;

/**
 * Outcome of decoding raw bytes: a JSON tree or the first syntax error.
 */
public sealed interface ParsedJson permits ParsedJson.Tree, ParsedJson.Failed {

    record Tree(JsonNode root) implements ParsedJson {
        public Tree {
            Objects.requireNonNull(root, "root");
        }
    }

    record Failed(ParseError error) implements ParsedJson {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
