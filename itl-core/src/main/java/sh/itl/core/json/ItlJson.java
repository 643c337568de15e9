// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.json;

import java.io.IOException;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import sh.itl.core.error.ParseError;

/**
 * Lexical stage of the pipeline: decodes bytes into a Jackson tree without any
 * knowledge of the ITL grammar.
 *
 * <p>The mapper is strict. Duplicate keys inside one object, trailing content
 * after the root value and nesting deeper than the configured limit are syntax
 * errors. Integers decode as {@link java.math.BigInteger} and decimals as exact
 * {@link java.math.BigDecimal}, so notes keep every digit of the source.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class ItlJson {

    private final JsonMapper mapper;

    public ItlJson(final int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.mapper = createMapper(maxNestingDepth);
    }

    /**
     * Decodes a complete JSON document.
     *
     * @param bytes the document, UTF-8 or any encoding Jackson auto-detects
     * @return the tree, or the syntax error that stopped decoding
     */
    public ParsedJson parse(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        final JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            return new ParsedJson.Failed(toParseError(e));
        } catch (IOException e) {
            return new ParsedJson.Failed(ParseError.withoutLocation("Unable to read JSON: " + e.getMessage()));
        }
        if (root == null || root.isMissingNode()) {
            return new ParsedJson.Failed(ParseError.withoutLocation("document is empty"));
        }
        return new ParsedJson.Tree(root);
    }

    private static ParseError toParseError(final JsonProcessingException e) {
        final String message = e.getOriginalMessage() == null ? e.getClass().getSimpleName() : e.getOriginalMessage();
        final JsonLocation location = e.getLocation();
        if (location == null) {
            return ParseError.withoutLocation(message);
        }
        return new ParseError(message, location.getLineNr(), location.getColumnNr(), location.getByteOffset());
    }

    private static JsonMapper createMapper(final int maxNestingDepth) {
        final JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(maxNestingDepth)
                        .build())
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
        return JsonMapper.builder(factory)
                .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
    }
}
