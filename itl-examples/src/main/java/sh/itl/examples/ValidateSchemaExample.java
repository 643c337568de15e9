// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.examples;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import sh.itl.core.AnsiColors;
import sh.itl.core.ItlDebug;
import sh.itl.core.SchemaCompiler;
import sh.itl.core.SchemaOptions;
import sh.itl.core.SchemaResult;
import sh.itl.core.error.SchemaProblem;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeNames;

/**
 * Validates an ITL document and prints either its named types or every problem.
 *
 * <p>Without arguments the bundled {@code sample-schema.json} is validated,
 * followed by a broken document showing how problems are aggregated.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl itl-examples exec:java \
 *     -Dexec.mainClass=sh.itl.examples.ValidateSchemaExample \
 *     -Dexec.args="path/to/schema.json --legacy --strict"
 * </pre>
 */
public final class ValidateSchemaExample {

    private static final String BROKEN = """
            {
              "types": [
                {"name": "A", "kind": "record", "fields": [
                  {"name": "x", "type": {"kind": "byte"}},
                  {"name": "x", "type": {"kind": "bool"}}
                ]},
                {"name": "B", "kind": "string", "size": 10, "capacity": 4},
                {"name": "C", "kind": "fixed", "base": 10, "digits": 2, "scale": 5}
              ]
            }
            """;

    private ValidateSchemaExample() {
        // Prevent instantiation
    }

    public static void main(String[] args) throws IOException {
        boolean legacy = false;
        boolean strict = false;
        Path file = null;
        for (String arg : args) {
            if ("--legacy".equals(arg)) {
                legacy = true;
            } else if ("--strict".equals(arg)) {
                strict = true;
            } else if ("--debug".equals(arg)) {
                ItlDebug.setEnabled(true);
            } else {
                file = Path.of(arg);
            }
        }

        SchemaCompiler compiler = SchemaCompiler.create(SchemaOptions.builder()
                .legacyKinds(legacy)
                .rejectUnknownKeys(strict)
                .build());

        if (file != null) {
            System.out.println("=== " + file + " ===\n");
            boolean accepted = report(compiler.compile(Files.readAllBytes(file)));
            if (!accepted) {
                System.exit(1);
            }
            return;
        }

        System.out.println("=== Bundled sample-schema.json ===\n");
        report(compiler.compile(readSample()));

        System.out.println("\n=== A document with three independent problems ===\n");
        report(compiler.compile(BROKEN));
    }

    private static boolean report(SchemaResult result) {
        if (result instanceof SchemaResult.Accepted accepted) {
            System.out.println(AnsiColors.success("Accepted"));
            for (TypeDef type : accepted.graph().namedTypes()) {
                System.out.println("  " + AnsiColors.kv(type.name(), TypeNames.describe(type)));
            }
            return true;
        }
        SchemaResult.Rejected rejected = (SchemaResult.Rejected) result;
        System.out.println(AnsiColors.error("Rejected at " + rejected.stage()
                + " with " + rejected.problems().size() + " problem(s)"));
        for (SchemaProblem problem : rejected.problems()) {
            System.out.println("  " + problem.render());
        }
        return false;
    }

    private static byte[] readSample() throws IOException {
        try (InputStream in = ValidateSchemaExample.class.getResourceAsStream("/sample-schema.json")) {
            if (in == null) {
                throw new IOException("sample-schema.json is missing from the classpath");
            }
            return in.readAllBytes();
        }
    }
}
