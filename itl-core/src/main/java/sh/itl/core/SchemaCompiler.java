// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.itl.core.build.BuildResult;
import sh.itl.core.build.TypeGraph;
import sh.itl.core.build.TypeGraphBuilder;
import sh.itl.core.error.SchemaProblem;
import sh.itl.core.error.SchemaRejectedException;
import sh.itl.core.error.Stage;
import sh.itl.core.json.ItlJson;
import sh.itl.core.json.ParsedJson;
import sh.itl.core.validate.SemanticValidator;
import sh.itl.core.validate.ValidatedGraph;
import sh.itl.core.validate.ValidationResult;

/**
 * The ITL front end: parse, build, validate.
 *
 * <p>
 * Each call compiles one document synchronously on the calling thread. Stages
 * run strictly in order and a stage runs only if the previous one succeeded,
 * so a rejection always carries the problems of exactly one stage.
 *
 * <p>
 * A compiler holds only immutable configuration and can be shared freely;
 * independent documents may be compiled concurrently.
 *
 * <pre>{@code
 * SchemaCompiler compiler = SchemaCompiler.create(SchemaOptions.builder().legacyKinds(true).build());
 * SchemaResult result = compiler.compile(Files.readAllBytes(path));
 * }</pre>
 */
public final class SchemaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCompiler.class);

    private final SchemaOptions options;
    private final ItlJson json;
    private final TypeGraphBuilder builder;
    private final SemanticValidator validator;

    private SchemaCompiler(final SchemaOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.json = new ItlJson(options.maxNestingDepth());
        this.builder = new TypeGraphBuilder(options.legacyKinds(), options.rejectUnknownKeys());
        this.validator = new SemanticValidator();
    }

    public static SchemaCompiler create() {
        return new SchemaCompiler(SchemaOptions.defaults());
    }

    public static SchemaCompiler create(final SchemaOptions options) {
        return new SchemaCompiler(options);
    }

    public SchemaOptions options() {
        return options;
    }

    /**
     * Compiles a document.
     *
     * @param bytes the raw document
     * @return the accepted graph, or every problem of the first failing stage
     */
    public SchemaResult compile(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        final long start = System.nanoTime();

        final ParsedJson parsed = json.parse(bytes);
        final long parsedAt = System.nanoTime();
        if (parsed instanceof ParsedJson.Failed failed) {
            return reject(Stage.PARSE, List.of(failed.error()), start);
        }
        DebugLogger.logStage(LogFormatter.formatParse(bytes.length, micros(start, parsedAt)));
        final JsonNode root = ((ParsedJson.Tree) parsed).root();

        final BuildResult built = builder.build(root);
        final long builtAt = System.nanoTime();
        if (!built.isSuccess()) {
            return reject(Stage.BUILD, built.errors(), start);
        }
        final TypeGraph graph = built.graph();
        DebugLogger.logStage(LogFormatter.formatBuild(
                graph.declarations().size(), graph.registry().size(), micros(parsedAt, builtAt)));

        final ValidationResult validated = validator.validate(graph);
        final long validatedAt = System.nanoTime();
        if (!validated.isValid()) {
            return reject(Stage.VALIDATE, validated.errors(), start);
        }
        final ValidatedGraph accepted = validated.graph();
        DebugLogger.logStage(LogFormatter.formatValidate(accepted.namedTypes().size(), micros(builtAt, validatedAt)));
        LOG.debug("Accepted ITL document with {} declarations ({} named)",
                accepted.declarations().size(), accepted.namedTypes().size());
        return new SchemaResult.Accepted(accepted);
    }

    public SchemaResult compile(final String document) {
        Objects.requireNonNull(document, "document");
        return compile(document.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compiles a document that is expected to be valid.
     *
     * @param bytes the raw document
     * @return the validated graph
     * @throws SchemaRejectedException if any stage rejects the document
     */
    public ValidatedGraph compileOrThrow(final byte[] bytes) {
        return compile(bytes).graphOrThrow();
    }

    private static SchemaResult reject(final Stage stage, final List<? extends SchemaProblem> problems,
            final long start) {
        final List<SchemaProblem> copy = List.copyOf(problems);
        DebugLogger.logStage(LogFormatter.formatRejected(stage, copy.size(), micros(start, System.nanoTime())));
        for (SchemaProblem problem : copy) {
            DebugLogger.logProblem(LogFormatter.formatProblem(problem));
        }
        LOG.debug("Rejected ITL document at {} with {} problem(s)", stage, copy.size());
        return new SchemaResult.Rejected(stage, copy);
    }

    private static long micros(final long fromNanos, final long toNanos) {
        return (toNanos - fromNanos) / 1_000;
    }
}
