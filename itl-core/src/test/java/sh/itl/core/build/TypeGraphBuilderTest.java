// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.build;

import static org.junit.jupiter.api.Assertions.*;
import static sh.itl.core.TestDocuments.build;
import static sh.itl.core.TestDocuments.graph;
import static sh.itl.core.TestDocuments.tree;
import static sh.itl.core.TestDocuments.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import sh.itl.core.error.StructuralError;
import sh.itl.core.error.StructuralErrorCode;
import sh.itl.core.model.BitFlag;
import sh.itl.core.model.EnumValue;
import sh.itl.core.model.FloatModel;
import sh.itl.core.model.Label;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.SequenceSize;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeRef;

class TypeGraphBuilderTest {

    private static List<String> rendered(BuildResult result) {
        return result.errors().stream().map(StructuralError::render).collect(Collectors.toList());
    }

    private static StructuralError single(BuildResult result) {
        assertFalse(result.isSuccess());
        assertEquals(1, result.errors().size(), () -> "errors: " + rendered(result));
        return result.errors().get(0);
    }

    // ═══════════════════════════════════════════════════════════════
    // Name resolution
    // ═══════════════════════════════════════════════════════════════

    @Test
    void build_forwardReference_resolvesToRegistryLink() {
        TypeGraph graph = graph(types(
                "{\"name\":\"A\",\"kind\":\"record\",\"fields\":[{\"name\":\"b\",\"type\":\"B\"}]}",
                "{\"name\":\"B\",\"kind\":\"int\",\"bits\":16}"));

        TypeDef.RecordType a = (TypeDef.RecordType) graph.registry().lookup("A").orElseThrow();
        TypeRef.Named link = assertInstanceOf(TypeRef.Named.class, a.fields().get(0).type());
        assertEquals("B", link.name());
        assertEquals(graph.registry().idOf("B").orElseThrow(), link.id());
        assertSame(graph.registry().lookup("B").orElseThrow(), graph.registry().resolve(link));
    }

    @Test
    void build_selfReference_isLinkNotCopy() {
        TypeGraph graph = graph(types(
                "{\"name\":\"Node\",\"kind\":\"record\",\"fields\":["
                        + "{\"name\":\"value\",\"type\":{\"kind\":\"byte\"}},"
                        + "{\"name\":\"next\",\"type\":\"Node\",\"optional\":true}]}"));

        TypeDef.RecordType node = (TypeDef.RecordType) graph.registry().lookup("Node").orElseThrow();
        TypeRef next = node.fields().get(1).type();
        assertInstanceOf(TypeRef.Named.class, next);
        assertSame(node, graph.registry().resolve(next));
        assertTrue(node.fields().get(1).optional());
    }

    @Test
    void build_unknownName_reportsTypePosition() {
        StructuralError error = single(build(types(
                "{\"name\":\"A\",\"kind\":\"record\",\"fields\":["
                        + "{\"name\":\"x\",\"type\":{\"kind\":\"bool\"}},"
                        + "{\"name\":\"y\",\"type\":\"Missing\"}]}")));

        assertEquals(StructuralErrorCode.UNKNOWN_TYPE_REFERENCE, error.errorCode());
        assertEquals(NodePath.of("types[0].fields[1].type"), error.path());
        assertTrue(error.detail().contains("Missing"));
        assertEquals("BUILD UNKNOWN_TYPE_REFERENCE at types[0].fields[1].type: "
                + "no type named 'Missing' is declared in this document", error.render());
    }

    @Test
    void build_kindKeywordIsNotATypeName() {
        StructuralError error = single(build(types(
                "{\"name\":\"A\",\"kind\":\"sequence\",\"type\":\"byte\"}")));

        assertEquals(StructuralErrorCode.UNKNOWN_TYPE_REFERENCE, error.errorCode());
        assertEquals("types[0].type", error.path().toString());
    }

    @Test
    void build_duplicateTypeName_reportsSecondDeclaration() {
        StructuralError error = single(build(types(
                "{\"name\":\"A\",\"kind\":\"byte\"}",
                "{\"name\":\"B\",\"kind\":\"bool\"}",
                "{\"name\":\"A\",\"kind\":\"int\"}")));

        assertEquals(StructuralErrorCode.DUPLICATE_TYPE_NAME, error.errorCode());
        assertEquals("types[2].name", error.path().toString());
        assertTrue(error.detail().contains("types[0]"), error.detail());
    }

    @Test
    void build_duplicateBetweenTopLevelAndInlineName_isReported() {
        StructuralError error = single(build(types(
                "{\"name\":\"R\",\"kind\":\"record\",\"fields\":[{\"name\":\"f\",\"type\":{\"name\":\"X\",\"kind\":\"byte\"}}]}",
                "{\"name\":\"X\",\"kind\":\"bool\"}")));

        assertEquals(StructuralErrorCode.DUPLICATE_TYPE_NAME, error.errorCode());
        assertEquals("types[1].name", error.path().toString());
    }

    @Test
    void build_inlineNamedType_ownedByContainerAndRegistered() {
        TypeGraph graph = graph(types(
                "{\"name\":\"R\",\"kind\":\"record\",\"fields\":[{\"name\":\"f\",\"type\":{\"name\":\"Inner\",\"kind\":\"byte\"}}]}",
                "{\"name\":\"S\",\"kind\":\"sequence\",\"type\":\"Inner\"}"));

        TypeDef.RecordType r = (TypeDef.RecordType) graph.registry().lookup("R").orElseThrow();
        TypeRef.Inline inline = assertInstanceOf(TypeRef.Inline.class, r.fields().get(0).type());
        TypeRegistry.Entry entry = graph.registry().entry("Inner").orElseThrow();
        assertSame(inline.definition(), entry.definition());
        assertEquals("types[0].fields[0].type", entry.path().toString());

        TypeDef.SequenceType s = (TypeDef.SequenceType) graph.registry().lookup("S").orElseThrow();
        assertSame(inline.definition(), graph.registry().resolve(s.type()));
        assertEquals(2, graph.declarations().size());
        assertEquals(3, graph.registry().size());
    }

    @Test
    void build_anonymousTopLevelDefinition_isDeclaredButNotRegistered() {
        TypeGraph graph = graph(types("{\"kind\":\"bool\"}", "{\"name\":\"N\",\"kind\":\"byte\"}"));

        assertEquals(2, graph.declarations().size());
        assertEquals(1, graph.registry().size());
        assertNull(graph.declarations().get(0).definition().name());
    }

    // ═══════════════════════════════════════════════════════════════
    // Shape errors
    // ═══════════════════════════════════════════════════════════════

    @Test
    void build_rootNotObject_isMalformedRoot() {
        StructuralError error = single(build("[]"));

        assertEquals(StructuralErrorCode.MALFORMED_ROOT, error.errorCode());
        assertTrue(error.path().isRoot());
    }

    @Test
    void build_rootWithoutTypes_isMalformedRoot() {
        StructuralError error = single(build("{\"note\":{}}"));

        assertEquals(StructuralErrorCode.MALFORMED_ROOT, error.errorCode());
        assertEquals("types", error.path().toString());
    }

    @Test
    void build_missingAndUnknownKind_reportedAtKindPath() {
        BuildResult result = build(types("{\"name\":\"A\"}", "{\"name\":\"B\",\"kind\":\"struct\"}"));

        assertEquals(2, result.errors().size());
        assertEquals(StructuralErrorCode.MISSING_KIND, result.errors().get(0).errorCode());
        assertEquals("types[0].kind", result.errors().get(0).path().toString());
        assertEquals(StructuralErrorCode.UNKNOWN_KIND, result.errors().get(1).errorCode());
        assertEquals("types[1].kind", result.errors().get(1).path().toString());
    }

    @Test
    void build_siblingErrors_allReported() {
        BuildResult result = build(types(
                "{\"name\":\"A\"}",
                "{\"name\":\"B\",\"kind\":\"record\",\"fields\":{}}",
                "{\"name\":\"C\",\"kind\":\"record\",\"fields\":[{\"name\":\"x\",\"type\":\"Nope\"}]}"));

        assertNull(result.graph());
        assertEquals(List.of(
                "BUILD MISSING_KIND at types[0].kind: type definition has no 'kind'",
                "BUILD WRONG_VALUE_KIND at types[1].fields: expected an array but found an object",
                "BUILD UNKNOWN_TYPE_REFERENCE at types[2].fields[0].type: "
                        + "no type named 'Nope' is declared in this document"),
                rendered(result));
    }

    @Test
    void build_missingRequiredKeys_namedByPath() {
        BuildResult result = build(types(
                "{\"name\":\"F\",\"kind\":\"fixed\",\"base\":10}",
                "{\"name\":\"U\",\"kind\":\"union\",\"fields\":[{\"name\":\"a\",\"type\":{\"kind\":\"byte\"}}]}"));

        Set<String> paths = result.errors().stream()
                .map(e -> e.code() + "@" + e.path())
                .collect(Collectors.toSet());
        assertEquals(Set.of(
                "MISSING_KEY@types[0].digits",
                "MISSING_KEY@types[0].scale",
                "MISSING_KEY@types[1].discriminator",
                "MISSING_KEY@types[1].fields[0].labels"), paths);
    }

    @Test
    void build_wrongValueKinds_reported() {
        BuildResult result = build(types(
                "{\"name\":\"I\",\"kind\":\"int\",\"bits\":\"eight\",\"unsigned\":1}",
                "{\"name\":\"R\",\"kind\":\"record\",\"fields\":[{\"name\":\"a\",\"type\":42}]}"));

        assertEquals(List.of(
                "BUILD WRONG_VALUE_KIND at types[0].bits: expected an integer but found a string",
                "BUILD WRONG_VALUE_KIND at types[0].unsigned: expected a boolean but found an integer",
                "BUILD WRONG_VALUE_KIND at types[1].fields[0].type: "
                        + "expected a type name or an inline type definition but found an integer"),
                rendered(result));
    }

    @Test
    void build_blankName_isInvalidName() {
        StructuralError error = single(build(types("{\"name\":\" \",\"kind\":\"byte\"}")));

        assertEquals(StructuralErrorCode.INVALID_NAME, error.errorCode());
        assertEquals("types[0].name", error.path().toString());
    }

    @Test
    void build_valueOutOfRange_reported() {
        StructuralError error = single(build(types(
                "{\"name\":\"S\",\"kind\":\"string\",\"capacity\":99999999999999999999999}")));

        assertEquals(StructuralErrorCode.VALUE_OUT_OF_RANGE, error.errorCode());
        assertEquals("types[0].capacity", error.path().toString());
    }

    @Test
    void build_unknownFloatModel_reported() {
        StructuralError error = single(build(types("{\"name\":\"F\",\"kind\":\"float\",\"model\":\"binary80\"}")));

        assertEquals(StructuralErrorCode.UNKNOWN_FLOAT_MODEL, error.errorCode());
        assertEquals("types[0].model", error.path().toString());
    }

    @Test
    void build_explicitNullOnOptionalKey_treatedAsAbsent() {
        TypeGraph graph = graph(types("{\"name\":\"I\",\"kind\":\"int\",\"bits\":null,\"note\":null}"));

        TypeDef.IntType type = (TypeDef.IntType) graph.registry().lookup("I").orElseThrow();
        assertNull(type.bits());
        assertTrue(type.note().isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════
    // Unknown keys
    // ═══════════════════════════════════════════════════════════════

    @Test
    void build_unknownKey_ignoredByDefault() {
        assertTrue(build(types("{\"name\":\"I\",\"kind\":\"int\",\"bitz\":8}")).isSuccess());
    }

    @Test
    void build_unknownKey_rejectedWhenStrict() {
        BuildResult result = build(
                "{\"types\":[{\"name\":\"R\",\"kind\":\"record\",\"size\":3,"
                        + "\"fields\":[{\"name\":\"a\",\"type\":{\"kind\":\"bool\"},\"labels\":[]}]}],\"version\":2}",
                false, true);

        assertEquals(List.of("version", "types[0].size", "types[0].fields[0].labels"),
                result.errors().stream().map(e -> e.path().toString()).collect(Collectors.toList()));
        assertTrue(result.errors().stream().allMatch(e -> e.errorCode() == StructuralErrorCode.UNKNOWN_KEY));
    }

    // ═══════════════════════════════════════════════════════════════
    // Node contents
    // ═══════════════════════════════════════════════════════════════

    @Test
    void build_sequenceSizes_scalarAndDimensions() {
        TypeGraph graph = graph(types(
                "{\"name\":\"V\",\"kind\":\"sequence\",\"type\":{\"kind\":\"byte\"},\"size\":4,\"capacity\":8}",
                "{\"name\":\"M\",\"kind\":\"sequence\",\"type\":{\"kind\":\"byte\"},\"size\":[2,3]}",
                "{\"name\":\"L\",\"kind\":\"sequence\",\"type\":{\"kind\":\"byte\"}}"));

        TypeDef.SequenceType v = (TypeDef.SequenceType) graph.registry().lookup("V").orElseThrow();
        assertEquals(new SequenceSize.Scalar(4), v.size());
        assertEquals(Long.valueOf(8), v.capacity());
        TypeDef.SequenceType m = (TypeDef.SequenceType) graph.registry().lookup("M").orElseThrow();
        assertEquals(new SequenceSize.Dimensions(List.of(2L, 3L)), m.size());
        assertEquals(6, m.size().elementCount());
        assertNull(((TypeDef.SequenceType) graph.registry().lookup("L").orElseThrow()).size());
    }

    @Test
    void build_unionLabels_parsedByJsonKind() {
        TypeGraph graph = graph(types(
                "{\"name\":\"D\",\"kind\":\"string\"}",
                "{\"name\":\"U\",\"kind\":\"union\",\"discriminator\":\"D\",\"fields\":["
                        + "{\"name\":\"a\",\"type\":{\"kind\":\"byte\"},\"labels\":[1,\"x\",true,1]},"
                        + "{\"name\":\"b\",\"type\":{\"kind\":\"byte\"},\"labels\":[]}]}"));

        TypeDef.UnionType union = (TypeDef.UnionType) graph.registry().lookup("U").orElseThrow();
        assertEquals(Set.of(Label.of(1), Label.of("x"), Label.of(true)), union.fields().get(0).labels());
        assertTrue(union.fields().get(1).isDefault());
        assertSame(union.fields().get(1), union.defaultField());
    }

    @Test
    void build_floatAndFixed_parsed() {
        TypeGraph graph = graph(types(
                "{\"name\":\"F\",\"kind\":\"float\",\"model\":\"decimal64\"}",
                "{\"name\":\"X\",\"kind\":\"fixed\",\"base\":10,\"digits\":9,\"scale\":2}"));

        assertEquals(FloatModel.DECIMAL64, ((TypeDef.FloatType) graph.registry().lookup("F").orElseThrow()).model());
        TypeDef.FixedType fixed = (TypeDef.FixedType) graph.registry().lookup("X").orElseThrow();
        assertEquals(10, fixed.base());
        assertEquals(9, fixed.digits());
        assertEquals(2, fixed.scale());
    }

    @Test
    void build_notes_preservedVerbatim() {
        TypeGraph graph = graph("{\"note\":{\"doc\":{\"tags\":[1,2.50,null]}},\"types\":["
                + "{\"name\":\"R\",\"kind\":\"record\",\"note\":{\"x\":true},"
                + "\"fields\":[{\"name\":\"f\",\"type\":{\"kind\":\"bool\"},\"note\":{\"y\":\"z\"}}]}]}");

        Map<?, ?> doc = (Map<?, ?>) graph.note().get("doc").orElseThrow();
        assertEquals(Arrays.asList(BigInteger.ONE, new BigDecimal("2.50"), null), doc.get("tags"));
        TypeDef.RecordType r = (TypeDef.RecordType) graph.registry().lookup("R").orElseThrow();
        assertEquals(Boolean.TRUE, r.note().get("x").orElseThrow());
        assertEquals("z", r.fields().get(0).note().get("y").orElseThrow());
    }

    @Test
    void build_nonObjectNote_isWrongValueKind() {
        StructuralError error = single(build(types("{\"name\":\"B\",\"kind\":\"bool\",\"note\":\"text\"}")));

        assertEquals(StructuralErrorCode.WRONG_VALUE_KIND, error.errorCode());
        assertEquals("types[0].note", error.path().toString());
    }

    // ═══════════════════════════════════════════════════════════════
    // Legacy grammar
    // ═══════════════════════════════════════════════════════════════

    @Test
    void build_legacyKind_disabledByDefault() {
        StructuralError error = single(build(types("{\"name\":\"R\",\"kind\":\"rune\"}")));

        assertEquals(StructuralErrorCode.LEGACY_DISABLED, error.errorCode());
        assertEquals("types[0].kind", error.path().toString());
    }

    @Test
    void build_encodingKey_disabledByDefault() {
        StructuralError error = single(build(types("{\"name\":\"I\",\"kind\":\"int\",\"encoding\":\"le\"}")));

        assertEquals(StructuralErrorCode.LEGACY_DISABLED, error.errorCode());
        assertEquals("types[0].encoding", error.path().toString());
    }

    @Test
    void build_legacyKinds_parsedWhenEnabled() {
        TypeGraph graph = graph(types(
                "{\"name\":\"E\",\"kind\":\"enum\",\"values\":[{\"name\":\"a\"},{\"name\":\"b\"},"
                        + "{\"name\":\"c\",\"value\":5},{\"name\":\"d\"}]}",
                "{\"name\":\"B\",\"kind\":\"bitset\",\"size\":8,\"values\":[{\"name\":\"r\",\"bit\":0},{\"name\":\"w\",\"bit\":3}]}",
                "{\"name\":\"R\",\"kind\":\"rune\",\"encoding\":\"utf-8\"}",
                "{\"name\":\"I\",\"kind\":\"int\",\"encoding\":\"zigzag\"}"), true);

        TypeDef.EnumType e = (TypeDef.EnumType) graph.registry().lookup("E").orElseThrow();
        assertEquals(List.of(BigInteger.ZERO, BigInteger.ONE, BigInteger.valueOf(5), BigInteger.valueOf(6)),
                e.values().stream().map(EnumValue::value).collect(Collectors.toList()));
        TypeDef.BitsetType b = (TypeDef.BitsetType) graph.registry().lookup("B").orElseThrow();
        assertEquals(List.of(0L, 3L), b.values().stream().map(BitFlag::bit).collect(Collectors.toList()));
        assertEquals("utf-8", ((TypeDef.RuneType) graph.registry().lookup("R").orElseThrow()).encoding());
        assertEquals("zigzag", ((TypeDef.IntType) graph.registry().lookup("I").orElseThrow()).encoding());
    }

    @Test
    void build_isRepeatable() {
        TypeGraphBuilder builder = new TypeGraphBuilder(false, false);
        String document = types("{\"name\":\"A\",\"kind\":\"byte\"}");

        BuildResult first = builder.build(tree(document));
        BuildResult second = builder.build(tree(document));

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertNotSame(first.graph().registry(), second.graph().registry());
    }
}
