// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import sh.itl.core.error.SchemaRejectedException;
import sh.itl.core.validate.ValidatedGraph;

/**
 * Static entry points using the default {@link SchemaOptions}.
 *
 * <pre>{@code
 * SchemaResult result = ItlSchema.parseAndValidate(bytes);
 * ValidatedGraph graph = ItlSchema.compileOrThrow(bytes);
 * }</pre>
 *
 * <p>
 * Use {@link #compiler(SchemaOptions)} for legacy kinds or strict key checks.
 */
public final class ItlSchema {

    private static final SchemaCompiler DEFAULT = SchemaCompiler.create();

    private ItlSchema() {
    }

    public static SchemaResult parseAndValidate(final byte[] bytes) {
        return DEFAULT.compile(bytes);
    }

    public static SchemaResult parseAndValidate(final String document) {
        return DEFAULT.compile(document);
    }

    /**
     * Reads and compiles a document file.
     *
     * @param file the document
     * @return the compile result
     * @throws IOException if the file cannot be read
     */
    public static SchemaResult parseAndValidate(final Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return DEFAULT.compile(Files.readAllBytes(file));
    }

    /**
     * @throws SchemaRejectedException if any stage rejects the document
     */
    public static ValidatedGraph compileOrThrow(final byte[] bytes) {
        return DEFAULT.compileOrThrow(bytes);
    }

    public static SchemaCompiler compiler(final SchemaOptions options) {
        return SchemaCompiler.create(options);
    }
}
