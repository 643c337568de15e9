// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Optional;

/**
 * Advisory floating-point models for the {@code float} kind. Translators may
 * use the model to pick a wire representation; the core attaches no semantics.
 */
public enum FloatModel {
    BINARY16("binary16"),
    BINARY32("binary32"),
    BINARY64("binary64"),
    BINARY128("binary128"),
    DECIMAL32("decimal32"),
    DECIMAL64("decimal64"),
    DECIMAL128("decimal128");

    private final String keyword;

    FloatModel(final String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<FloatModel> fromKeyword(final String keyword) {
        for (FloatModel model : values()) {
            if (model.keyword.equals(keyword)) {
                return Optional.of(model);
            }
        }
        return Optional.empty();
    }
}
