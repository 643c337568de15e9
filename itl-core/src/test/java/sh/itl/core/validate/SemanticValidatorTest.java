// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import static org.junit.jupiter.api.Assertions.*;
import static sh.itl.core.TestDocuments.graph;
import static sh.itl.core.TestDocuments.types;
import static sh.itl.core.TestDocuments.validate;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import sh.itl.core.build.TypeGraph;
import sh.itl.core.error.Stage;
import sh.itl.core.error.UnresolvedReferenceException;
import sh.itl.core.error.ValidationError;
import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.Kind;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeRef;

class SemanticValidatorTest {

    private static final String FLAG_MSG = types(
            "{\"name\":\"Flag\",\"kind\":\"int\",\"bits\":8,\"unsigned\":true}",
            "{\"kind\":\"string\",\"capacity\":16}",
            "{\"name\":\"Msg\",\"kind\":\"union\",\"discriminator\":\"Flag\",\"fields\":["
                    + "{\"name\":\"ping\",\"type\":{\"name\":\"Ping\",\"kind\":\"record\",\"fields\":[]},\"labels\":[0]},"
                    + "{\"name\":\"other\",\"type\":{\"kind\":\"byte\"},\"labels\":[]}]}");

    // ═══════════════════════════════════════════════════════════════
    // Accepted graphs
    // ═══════════════════════════════════════════════════════════════

    @Test
    void accepted_namedTypesInDeclarationOrder() {
        ValidatedGraph graph = validate(FLAG_MSG).graph();

        assertNotNull(graph);
        assertEquals(List.of("Flag", "Msg"),
                graph.namedTypes().stream().map(TypeDef::name).collect(Collectors.toList()));
    }

    @Test
    void accepted_declarationsIncludeAnonymous() {
        ValidatedGraph graph = validate(FLAG_MSG).graph();

        assertEquals(3, graph.declarations().size());
        assertEquals(Kind.STRING, graph.declarations().get(1).kind());
        assertNull(graph.declarations().get(1).name());
    }

    @Test
    void accepted_lookupFindsInlineNamedTypes() {
        ValidatedGraph graph = validate(FLAG_MSG).graph();

        assertEquals(Kind.RECORD, graph.lookup("Ping").orElseThrow().kind());
        assertTrue(graph.lookup("Pong").isEmpty());
        assertEquals(3, graph.registry().size());
    }

    @Test
    void accepted_resolveFollowsDiscriminatorLink() {
        ValidatedGraph graph = validate(FLAG_MSG).graph();
        TypeDef.UnionType msg = (TypeDef.UnionType) graph.require("Msg");

        assertInstanceOf(TypeRef.Named.class, msg.discriminator());
        assertSame(graph.require("Flag"), graph.resolve(msg.discriminator()));
    }

    @Test
    void require_unknownName_throws() {
        ValidatedGraph graph = validate(FLAG_MSG).graph();

        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> graph.require("Missing"));
        assertTrue(e.getMessage().contains("'Missing'"));
    }

    @Test
    void accepted_namedTypeNamesRoundTrip() {
        ValidatedGraph graph = validate(FLAG_MSG).graph();

        for (TypeDef type : graph.namedTypes()) {
            assertEquals(type.name(), graph.require(type.name()).name());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Aggregation
    // ═══════════════════════════════════════════════════════════════

    @Test
    void rejected_collectsEveryRuleAcrossDefinitions() {
        ValidationResult result = validate(types(
                "{\"name\":\"S\",\"kind\":\"string\",\"size\":9,\"capacity\":3}",
                "{\"name\":\"F\",\"kind\":\"fixed\",\"base\":10,\"digits\":2,\"scale\":5}",
                "{\"name\":\"R\",\"kind\":\"record\",\"fields\":["
                        + "{\"name\":\"x\",\"type\":{\"kind\":\"byte\"}},"
                        + "{\"name\":\"x\",\"type\":\"R\"}]}"));

        assertFalse(result.isValid());
        assertNull(result.graph());
        assertEquals(List.of(
                ValidationRule.SIZE_EXCEEDS_CAPACITY,
                ValidationRule.INVALID_FIXED_SCALE,
                ValidationRule.DUPLICATE_FIELD_NAME,
                ValidationRule.UNBOUNDED_RECURSION),
                result.errors().stream().map(ValidationError::rule).collect(Collectors.toList()));
    }

    @Test
    void rejected_errorsCarryStageAndRelatedPaths() {
        ValidationResult result = validate(types(
                "{\"name\":\"S\",\"kind\":\"string\",\"size\":9,\"capacity\":3}"));

        ValidationError error = result.errors().get(0);
        assertEquals(Stage.VALIDATE, error.stage());
        assertEquals("SIZE_EXCEEDS_CAPACITY", error.code());
        assertEquals(List.of(NodePath.of("types[0].capacity")), error.related());
    }

    @Test
    void validate_isRepeatable() {
        SemanticValidator validator = new SemanticValidator();
        TypeGraph graph = graph(FLAG_MSG);

        ValidationResult first = validator.validate(graph);
        ValidationResult second = validator.validate(graph);

        assertTrue(first.isValid());
        assertTrue(second.isValid());
        assertEquals(first.graph().namedTypes(), second.graph().namedTypes());
    }

    @Test
    void validationResult_requiresExactlyOneOutcome() {
        assertThrows(IllegalArgumentException.class, () -> new ValidationResult(null, List.of()));
    }
}
