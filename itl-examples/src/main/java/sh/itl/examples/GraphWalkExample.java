// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.examples;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import sh.itl.core.AnsiColors;
import sh.itl.core.ItlSchema;
import sh.itl.core.model.Field;
import sh.itl.core.model.Label;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeNames;
import sh.itl.core.model.TypeRef;
import sh.itl.core.model.TypeVisitor;
import sh.itl.core.model.UnionField;
import sh.itl.core.validate.ValidatedGraph;

/**
 * Walks an accepted graph the way a binding generator would: one
 * {@link TypeVisitor} call per named type, following links through the graph.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl itl-examples exec:java -Dexec.mainClass=sh.itl.examples.GraphWalkExample
 * </pre>
 */
public final class GraphWalkExample {

    private static final String SCHEMA = """
            {
              "note": {"package": "demo"},
              "types": [
                {"name": "Msg", "kind": "union", "discriminator": "Flag", "fields": [
                  {"name": "a", "type": "Ping", "labels": [0]},
                  {"name": "b", "type": {"kind": "byte"}, "labels": [1, 2]},
                  {"name": "other", "type": {"kind": "bool"}, "labels": []}
                ]},
                {"name": "Flag", "kind": "int", "bits": 8, "unsigned": true},
                {"name": "Ping", "kind": "record", "fields": [
                  {"name": "seq", "type": {"name": "Seq", "kind": "int", "bits": 32}},
                  {"name": "next", "type": "Ping", "optional": true}
                ]}
              ]
            }
            """;

    private GraphWalkExample() {
        // Prevent instantiation
    }

    public static void main(String[] args) {
        ValidatedGraph graph = ItlSchema.compileOrThrow(SCHEMA.getBytes(StandardCharsets.UTF_8));
        System.out.println("=== Graph for package " + graph.note().get("package").orElse("?") + " ===\n");

        Describer describer = new Describer(graph);
        for (TypeDef type : graph.namedTypes()) {
            System.out.println(AnsiColors.BOLD + type.name() + AnsiColors.RESET + " " + type.accept(describer));
        }

        // Links resolve to the registry entry, so following one never copies a subtree
        TypeDef.UnionType msg = (TypeDef.UnionType) graph.require("Msg");
        TypeDef flag = graph.resolve(msg.discriminator());
        System.out.println("\nMsg discriminator resolves to " + TypeNames.describe(flag)
                + (flag == graph.require("Flag") ? " (same instance)" : ""));
        System.out.println("Inline named type Seq: " + TypeNames.describe(graph.require("Seq")));
    }

    /** Renders each kind with the detail a generator would care about. */
    private static final class Describer implements TypeVisitor<String> {

        private final ValidatedGraph graph;

        Describer(ValidatedGraph graph) {
            this.graph = graph;
        }

        private String target(TypeRef ref) {
            return ref instanceof TypeRef.Named named
                    ? named.name() + " -> " + graph.resolve(ref).kind()
                    : TypeNames.describe(graph.resolve(ref));
        }

        @Override
        public String visitByte(TypeDef.ByteType type) {
            return "is a byte";
        }

        @Override
        public String visitBool(TypeDef.BoolType type) {
            return "is a bool";
        }

        @Override
        public String visitInt(TypeDef.IntType type) {
            return "is " + TypeNames.describe(type);
        }

        @Override
        public String visitFloat(TypeDef.FloatType type) {
            return "is " + TypeNames.describe(type);
        }

        @Override
        public String visitFixed(TypeDef.FixedType type) {
            return "is " + TypeNames.describe(type);
        }

        @Override
        public String visitSequence(TypeDef.SequenceType type) {
            return "is a sequence of " + target(type.type());
        }

        @Override
        public String visitString(TypeDef.StringType type) {
            return "is " + TypeNames.describe(type);
        }

        @Override
        public String visitRecord(TypeDef.RecordType type) {
            StringBuilder sb = new StringBuilder("is a record");
            for (Field field : type.fields()) {
                sb.append("\n    ").append(field.name()).append(field.optional() ? "?" : "")
                        .append(": ").append(target(field.type()));
            }
            return sb.toString();
        }

        @Override
        public String visitUnion(TypeDef.UnionType type) {
            StringBuilder sb = new StringBuilder("is a union over " + target(type.discriminator()));
            for (UnionField field : type.fields()) {
                String labels = field.isDefault()
                        ? "default"
                        : field.labels().stream().map(Label::render).collect(Collectors.joining(", "));
                sb.append("\n    [").append(labels).append("] ").append(field.name())
                        .append(": ").append(target(field.type()));
            }
            return sb.toString();
        }

        @Override
        public String visitRune(TypeDef.RuneType type) {
            return "is a rune";
        }

        @Override
        public String visitEnum(TypeDef.EnumType type) {
            return "is " + TypeNames.describe(type);
        }

        @Override
        public String visitBitset(TypeDef.BitsetType type) {
            return "is " + TypeNames.describe(type);
        }
    }
}
