// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.build;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.itl.core.error.StructuralError;
import sh.itl.core.error.StructuralErrorCode;
import sh.itl.core.json.JsonValues;
import sh.itl.core.model.BitFlag;
import sh.itl.core.model.EnumValue;
import sh.itl.core.model.Field;
import sh.itl.core.model.FloatModel;
import sh.itl.core.model.Kind;
import sh.itl.core.model.Label;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.Note;
import sh.itl.core.model.SequenceSize;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeId;
import sh.itl.core.model.TypeRef;
import sh.itl.core.model.UnionField;

/**
 * Turns a decoded JSON tree into a linked {@link TypeGraph}.
 *
 * <p>
 * The build runs in two passes over {@code Root.types}:
 * <ol>
 * <li>every named definition, top-level or inline, reserves a registry slot;
 * duplicate names are reported here, before anything is resolved, so forward
 * references work;</li>
 * <li>every definition is built and every string in a Type position becomes a
 * {@link TypeRef.Named} link to its slot, never a copy of the target.</li>
 * </ol>
 *
 * <p>
 * Shape errors do not stop the walk. A broken node yields no definition, but
 * its siblings are still checked, so one run reports every structural error
 * reachable in the document.
 *
 * <p>
 * Instances hold only configuration and may be shared; each call to
 * {@link #build(JsonNode)} works on private state.
 */
public final class TypeGraphBuilder {

    private final boolean legacyKinds;
    private final boolean rejectUnknownKeys;

    /**
     * @param legacyKinds       accept {@code rune}, {@code enum}, {@code bitset} and
     *                          {@code encoding} keys
     * @param rejectUnknownKeys report keys the grammar does not define instead of
     *                          ignoring them
     */
    public TypeGraphBuilder(final boolean legacyKinds, final boolean rejectUnknownKeys) {
        this.legacyKinds = legacyKinds;
        this.rejectUnknownKeys = rejectUnknownKeys;
    }

    public BuildResult build(final JsonNode root) {
        Objects.requireNonNull(root, "root");
        return new Run().build(root);
    }

    private final class Run {

        private final List<StructuralError> errors = new ArrayList<>();
        private final TypeRegistry.Builder registry = TypeRegistry.builder();

        BuildResult build(final JsonNode root) {
            final NodePath rootPath = NodePath.root();
            if (!root.isObject()) {
                errors.add(new StructuralError(StructuralErrorCode.MALFORMED_ROOT, rootPath,
                        "document root must be an object with a 'types' array but found "
                                + JsonValues.describe(root)));
                return BuildResult.failure(errors);
            }
            checkKeys(root, rootPath, GrammarKeys.ROOT);

            final NodePath typesPath = rootPath.key("types");
            final JsonNode types = root.get("types");
            if (types == null || types.isNull()) {
                errors.add(new StructuralError(StructuralErrorCode.MALFORMED_ROOT, typesPath,
                        "required key 'types' is missing"));
                return BuildResult.failure(errors);
            }
            if (!types.isArray()) {
                errors.add(new StructuralError(StructuralErrorCode.MALFORMED_ROOT, typesPath,
                        "'types' must be an array but found " + JsonValues.describe(types)));
                return BuildResult.failure(errors);
            }
            final Note note = readNote(root, rootPath);

            for (int i = 0; i < types.size(); i++) {
                collectNames(types.get(i), typesPath.index(i));
            }

            final List<TypeGraph.Declaration> declarations = new ArrayList<>(types.size());
            for (int i = 0; i < types.size(); i++) {
                final NodePath path = typesPath.index(i);
                final TypeDef definition = readTypeDef(types.get(i), path);
                if (definition != null) {
                    declarations.add(new TypeGraph.Declaration(path, definition));
                }
            }

            if (!errors.isEmpty()) {
                return BuildResult.failure(errors);
            }
            return BuildResult.success(new TypeGraph(registry.build(), declarations, note));
        }

        // ═══════════════════════════════════════════════════════════════
        // Pass 1: name registration
        // ═══════════════════════════════════════════════════════════════

        private void collectNames(final JsonNode node, final NodePath path) {
            if (node == null || !node.isObject()) {
                return;
            }
            final JsonNode nameNode = node.get("name");
            if (nameNode != null && nameNode.isTextual() && !nameNode.textValue().isBlank()) {
                final String name = nameNode.textValue();
                if (registry.contains(name)) {
                    errors.add(StructuralError.duplicateTypeName(path.key("name"), name, registry.pathOf(name)));
                } else {
                    registry.register(name, path);
                }
            }

            final JsonNode kindNode = node.get("kind");
            final Optional<Kind> kind = Kind.fromKeyword(kindNode == null ? null : kindNode.textValue());
            if (kind.isEmpty()) {
                return;
            }
            switch (kind.get()) {
                case SEQUENCE -> collectNames(node.get("type"), path.key("type"));
                case RECORD -> collectFieldNames(node, path);
                case UNION -> {
                    collectNames(node.get("discriminator"), path.key("discriminator"));
                    collectFieldNames(node, path);
                }
                default -> {
                    // scalar and legacy kinds hold no Type positions
                }
            }
        }

        private void collectFieldNames(final JsonNode node, final NodePath path) {
            final JsonNode fields = node.get("fields");
            if (fields == null || !fields.isArray()) {
                return;
            }
            final NodePath fieldsPath = path.key("fields");
            for (int i = 0; i < fields.size(); i++) {
                final JsonNode field = fields.get(i);
                if (field.isObject()) {
                    collectNames(field.get("type"), fieldsPath.index(i).key("type"));
                }
            }
        }

        // ═══════════════════════════════════════════════════════════════
        // Pass 2: definitions and links
        // ═══════════════════════════════════════════════════════════════

        @Nullable
        private TypeDef readTypeDef(final JsonNode node, final NodePath path) {
            if (!node.isObject()) {
                errors.add(StructuralError.wrongValueKind(path, "a type definition object", JsonValues.describe(node)));
                return null;
            }
            final JsonNode kindNode = node.get("kind");
            if (kindNode == null || kindNode.isNull()) {
                errors.add(new StructuralError(StructuralErrorCode.MISSING_KIND, path.key("kind"),
                        "type definition has no 'kind'"));
                return null;
            }
            if (!kindNode.isTextual()) {
                errors.add(StructuralError.wrongValueKind(path.key("kind"), "a string", JsonValues.describe(kindNode)));
                return null;
            }
            final Optional<Kind> parsedKind = Kind.fromKeyword(kindNode.textValue());
            if (parsedKind.isEmpty()) {
                errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_KIND, path.key("kind"),
                        "unknown kind '%s'".formatted(kindNode.textValue())));
                return null;
            }
            final Kind kind = parsedKind.get();
            if (kind.isLegacy() && !legacyKinds) {
                errors.add(new StructuralError(StructuralErrorCode.LEGACY_DISABLED, path.key("kind"),
                        "kind '%s' belongs to the legacy grammar and legacy kinds are disabled"
                                .formatted(kind.keyword())));
                return null;
            }
            checkKeys(node, path, kind);

            final String name = readName(node, path);
            final Note note = readNote(node, path);
            final TypeDef definition = switch (kind) {
                case BYTE -> new TypeDef.ByteType(name, note);
                case BOOL -> new TypeDef.BoolType(name, note);
                case INT -> new TypeDef.IntType(name,
                        optionalInt(node, path, "bits"),
                        optionalBool(node, path, "unsigned"),
                        readEncoding(node, path),
                        note);
                case FLOAT -> new TypeDef.FloatType(name, readFloatModel(node, path), readEncoding(node, path), note);
                case FIXED -> readFixed(node, path, name, note);
                case SEQUENCE -> readSequence(node, path, name, note);
                case STRING -> new TypeDef.StringType(name,
                        optionalLong(node, path, "size"),
                        optionalLong(node, path, "capacity"),
                        readEncoding(node, path),
                        note);
                case RECORD -> readRecord(node, path, name, note);
                case UNION -> readUnion(node, path, name, note);
                case RUNE -> new TypeDef.RuneType(name, readEncoding(node, path), note);
                case ENUM -> readEnum(node, path, name, note);
                case BITSET -> readBitset(node, path, name, note);
            };

            if (definition != null && name != null) {
                registry.slotAt(path).ifPresent(id -> registry.define(id, definition));
            }
            return definition;
        }

        @Nullable
        private TypeDef readFixed(final JsonNode node, final NodePath path, @Nullable final String name,
                final Note note) {
            final Long base = requireLong(node, path, "base");
            final Long digits = requireLong(node, path, "digits");
            final Long scale = requireLong(node, path, "scale");
            final String encoding = readEncoding(node, path);
            if (base == null || digits == null || scale == null) {
                return null;
            }
            return new TypeDef.FixedType(name, base, digits, scale, encoding, note);
        }

        @Nullable
        private TypeDef readSequence(final JsonNode node, final NodePath path, @Nullable final String name,
                final Note note) {
            final TypeRef element = requireTypeRef(node, path, "type");
            final SequenceSize size = readSequenceSize(node, path);
            final Long capacity = optionalLong(node, path, "capacity");
            if (element == null) {
                return null;
            }
            return new TypeDef.SequenceType(name, element, size, capacity, note);
        }

        @Nullable
        private TypeDef readRecord(final JsonNode node, final NodePath path, @Nullable final String name,
                final Note note) {
            final JsonNode array = requireArray(node, path, "fields");
            if (array == null) {
                return null;
            }
            final NodePath fieldsPath = path.key("fields");
            final List<Field> fields = new ArrayList<>(array.size());
            boolean complete = true;
            for (int i = 0; i < array.size(); i++) {
                final Field field = readField(array.get(i), fieldsPath.index(i));
                if (field == null) {
                    complete = false;
                } else {
                    fields.add(field);
                }
            }
            return complete ? new TypeDef.RecordType(name, fields, note) : null;
        }

        @Nullable
        private TypeDef readUnion(final JsonNode node, final NodePath path, @Nullable final String name,
                final Note note) {
            final TypeRef discriminator = requireTypeRef(node, path, "discriminator");
            final JsonNode array = requireArray(node, path, "fields");
            if (array == null) {
                return null;
            }
            final NodePath fieldsPath = path.key("fields");
            final List<UnionField> fields = new ArrayList<>(array.size());
            boolean complete = true;
            for (int i = 0; i < array.size(); i++) {
                final UnionField field = readUnionField(array.get(i), fieldsPath.index(i));
                if (field == null) {
                    complete = false;
                } else {
                    fields.add(field);
                }
            }
            if (discriminator == null || !complete) {
                return null;
            }
            return new TypeDef.UnionType(name, discriminator, fields, note);
        }

        @Nullable
        private TypeDef readEnum(final JsonNode node, final NodePath path, @Nullable final String name,
                final Note note) {
            final JsonNode array = requireArray(node, path, "values");
            if (array == null) {
                return null;
            }
            final NodePath valuesPath = path.key("values");
            final List<EnumValue> values = new ArrayList<>(array.size());
            boolean complete = true;
            BigInteger next = BigInteger.ZERO;
            for (int i = 0; i < array.size(); i++) {
                final EnumValue value = readEnumValue(array.get(i), valuesPath.index(i), next);
                if (value == null) {
                    complete = false;
                } else {
                    values.add(value);
                    next = value.value().add(BigInteger.ONE);
                }
            }
            return complete ? new TypeDef.EnumType(name, values, note) : null;
        }

        @Nullable
        private TypeDef readBitset(final JsonNode node, final NodePath path, @Nullable final String name,
                final Note note) {
            final Long size = optionalLong(node, path, "size");
            final JsonNode array = requireArray(node, path, "values");
            if (array == null) {
                return null;
            }
            final NodePath valuesPath = path.key("values");
            final List<BitFlag> flags = new ArrayList<>(array.size());
            boolean complete = true;
            for (int i = 0; i < array.size(); i++) {
                final BitFlag flag = readBitFlag(array.get(i), valuesPath.index(i));
                if (flag == null) {
                    complete = false;
                } else {
                    flags.add(flag);
                }
            }
            return complete ? new TypeDef.BitsetType(name, size, flags, note) : null;
        }

        @Nullable
        private Field readField(final JsonNode node, final NodePath path) {
            if (!node.isObject()) {
                errors.add(StructuralError.wrongValueKind(path, "a field object", JsonValues.describe(node)));
                return null;
            }
            checkKeys(node, path, GrammarKeys.FIELD);
            final String name = requireName(node, path);
            final TypeRef type = requireTypeRef(node, path, "type");
            final boolean optional = optionalBool(node, path, "optional");
            final Note note = readNote(node, path);
            if (name == null || type == null) {
                return null;
            }
            return new Field(name, type, optional, note);
        }

        @Nullable
        private UnionField readUnionField(final JsonNode node, final NodePath path) {
            if (!node.isObject()) {
                errors.add(StructuralError.wrongValueKind(path, "a union field object", JsonValues.describe(node)));
                return null;
            }
            checkKeys(node, path, GrammarKeys.UNION_FIELD);
            final String name = requireName(node, path);
            final TypeRef type = requireTypeRef(node, path, "type");
            final Set<Label> labels = readLabels(node, path);
            final Note note = readNote(node, path);
            if (name == null || type == null || labels == null) {
                return null;
            }
            return new UnionField(name, type, labels, note);
        }

        @Nullable
        private Set<Label> readLabels(final JsonNode node, final NodePath path) {
            final JsonNode array = requireArray(node, path, "labels");
            if (array == null) {
                return null;
            }
            final NodePath labelsPath = path.key("labels");
            final Set<Label> labels = new LinkedHashSet<>();
            boolean complete = true;
            for (int i = 0; i < array.size(); i++) {
                final JsonNode element = array.get(i);
                if (element.isIntegralNumber()) {
                    labels.add(new Label.IntLabel(element.bigIntegerValue()));
                } else if (element.isTextual()) {
                    labels.add(new Label.TextLabel(element.textValue()));
                } else if (element.isBoolean()) {
                    labels.add(new Label.BoolLabel(element.booleanValue()));
                } else {
                    errors.add(StructuralError.wrongValueKind(labelsPath.index(i),
                            "an integer, string or boolean label", JsonValues.describe(element)));
                    complete = false;
                }
            }
            return complete ? labels : null;
        }

        @Nullable
        private EnumValue readEnumValue(final JsonNode node, final NodePath path, final BigInteger next) {
            if (!node.isObject()) {
                errors.add(StructuralError.wrongValueKind(path, "an enum value object", JsonValues.describe(node)));
                return null;
            }
            checkKeys(node, path, GrammarKeys.ENUM_VALUE);
            final String name = requireName(node, path);
            final Note note = readNote(node, path);
            BigInteger value = next;
            final JsonNode valueNode = node.get("value");
            if (valueNode != null && !valueNode.isNull()) {
                if (!valueNode.isIntegralNumber()) {
                    errors.add(StructuralError.wrongValueKind(path.key("value"), "an integer",
                            JsonValues.describe(valueNode)));
                    return null;
                }
                value = valueNode.bigIntegerValue();
            }
            return name == null ? null : new EnumValue(name, value, note);
        }

        @Nullable
        private BitFlag readBitFlag(final JsonNode node, final NodePath path) {
            if (!node.isObject()) {
                errors.add(StructuralError.wrongValueKind(path, "a bit flag object", JsonValues.describe(node)));
                return null;
            }
            checkKeys(node, path, GrammarKeys.BIT_FLAG);
            final String name = requireName(node, path);
            final Long bit = requireLong(node, path, "bit");
            final Note note = readNote(node, path);
            if (name == null || bit == null) {
                return null;
            }
            return new BitFlag(name, bit, note);
        }

        // ═══════════════════════════════════════════════════════════════
        // Type positions
        // ═══════════════════════════════════════════════════════════════

        @Nullable
        private TypeRef requireTypeRef(final JsonNode node, final NodePath path, final String key) {
            final JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                errors.add(StructuralError.missingKey(path, key));
                return null;
            }
            return readTypeRef(value, path.key(key));
        }

        @Nullable
        private TypeRef readTypeRef(final JsonNode node, final NodePath path) {
            if (node.isTextual()) {
                final String name = node.textValue();
                if (name.isBlank()) {
                    errors.add(new StructuralError(StructuralErrorCode.INVALID_NAME, path,
                            "type reference must not be blank"));
                    return null;
                }
                final Optional<TypeId> id = registry.idOf(name);
                if (id.isEmpty()) {
                    errors.add(StructuralError.unknownTypeReference(path, name));
                    return new TypeRef.Unresolved(name);
                }
                return new TypeRef.Named(name, id.get());
            }
            if (node.isObject()) {
                final TypeDef inline = readTypeDef(node, path);
                return inline == null ? null : new TypeRef.Inline(inline);
            }
            errors.add(StructuralError.wrongValueKind(path, "a type name or an inline type definition",
                    JsonValues.describe(node)));
            return null;
        }

        // ═══════════════════════════════════════════════════════════════
        // Scalar keys
        // ═══════════════════════════════════════════════════════════════

        @Nullable
        private String readName(final JsonNode node, final NodePath path) {
            final JsonNode value = node.get("name");
            if (value == null || value.isNull()) {
                return null;
            }
            return checkName(value, path.key("name"));
        }

        @Nullable
        private String requireName(final JsonNode node, final NodePath path) {
            final JsonNode value = node.get("name");
            if (value == null || value.isNull()) {
                errors.add(StructuralError.missingKey(path, "name"));
                return null;
            }
            return checkName(value, path.key("name"));
        }

        @Nullable
        private String checkName(final JsonNode value, final NodePath path) {
            if (!value.isTextual()) {
                errors.add(StructuralError.wrongValueKind(path, "a string", JsonValues.describe(value)));
                return null;
            }
            if (value.textValue().isBlank()) {
                errors.add(new StructuralError(StructuralErrorCode.INVALID_NAME, path, "name must not be blank"));
                return null;
            }
            return value.textValue();
        }

        private Note readNote(final JsonNode node, final NodePath path) {
            final JsonNode value = node.get("note");
            if (value == null || value.isNull()) {
                return Note.EMPTY;
            }
            if (!value.isObject()) {
                errors.add(StructuralError.wrongValueKind(path.key("note"), "an object", JsonValues.describe(value)));
                return Note.EMPTY;
            }
            return new Note(JsonValues.toMap(value));
        }

        @Nullable
        private String readEncoding(final JsonNode node, final NodePath path) {
            final JsonNode value = node.get("encoding");
            if (value == null || value.isNull()) {
                return null;
            }
            if (!legacyKinds) {
                errors.add(new StructuralError(StructuralErrorCode.LEGACY_DISABLED, path.key("encoding"),
                        "'encoding' belongs to the legacy grammar and legacy kinds are disabled"));
                return null;
            }
            if (!value.isTextual()) {
                errors.add(StructuralError.wrongValueKind(path.key("encoding"), "a string",
                        JsonValues.describe(value)));
                return null;
            }
            return value.textValue();
        }

        @Nullable
        private FloatModel readFloatModel(final JsonNode node, final NodePath path) {
            final JsonNode value = node.get("model");
            if (value == null || value.isNull()) {
                return null;
            }
            if (!value.isTextual()) {
                errors.add(StructuralError.wrongValueKind(path.key("model"), "a string", JsonValues.describe(value)));
                return null;
            }
            final Optional<FloatModel> model = FloatModel.fromKeyword(value.textValue());
            if (model.isEmpty()) {
                errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_FLOAT_MODEL, path.key("model"),
                        "unknown float model '%s'".formatted(value.textValue())));
                return null;
            }
            return model.get();
        }

        @Nullable
        private SequenceSize readSequenceSize(final JsonNode node, final NodePath path) {
            final JsonNode value = node.get("size");
            if (value == null || value.isNull()) {
                return null;
            }
            final NodePath sizePath = path.key("size");
            if (value.isIntegralNumber()) {
                final Long count = toLong(value, sizePath);
                return count == null ? null : new SequenceSize.Scalar(count);
            }
            if (value.isArray()) {
                final List<Long> extents = new ArrayList<>(value.size());
                boolean complete = true;
                for (int i = 0; i < value.size(); i++) {
                    final JsonNode element = value.get(i);
                    if (!element.isIntegralNumber()) {
                        errors.add(StructuralError.wrongValueKind(sizePath.index(i), "an integer",
                                JsonValues.describe(element)));
                        complete = false;
                        continue;
                    }
                    final Long extent = toLong(element, sizePath.index(i));
                    if (extent == null) {
                        complete = false;
                    } else {
                        extents.add(extent);
                    }
                }
                return complete ? new SequenceSize.Dimensions(extents) : null;
            }
            errors.add(StructuralError.wrongValueKind(sizePath, "an integer or an array of integers",
                    JsonValues.describe(value)));
            return null;
        }

        private boolean optionalBool(final JsonNode node, final NodePath path, final String key) {
            final JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return false;
            }
            if (!value.isBoolean()) {
                errors.add(StructuralError.wrongValueKind(path.key(key), "a boolean", JsonValues.describe(value)));
                return false;
            }
            return value.booleanValue();
        }

        @Nullable
        private Integer optionalInt(final JsonNode node, final NodePath path, final String key) {
            final JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return null;
            }
            if (!value.isIntegralNumber()) {
                errors.add(StructuralError.wrongValueKind(path.key(key), "an integer", JsonValues.describe(value)));
                return null;
            }
            if (!value.canConvertToInt()) {
                errors.add(new StructuralError(StructuralErrorCode.VALUE_OUT_OF_RANGE, path.key(key),
                        "%s does not fit a 32-bit integer".formatted(value.asText())));
                return null;
            }
            return value.intValue();
        }

        @Nullable
        private Long optionalLong(final JsonNode node, final NodePath path, final String key) {
            final JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return null;
            }
            if (!value.isIntegralNumber()) {
                errors.add(StructuralError.wrongValueKind(path.key(key), "an integer", JsonValues.describe(value)));
                return null;
            }
            return toLong(value, path.key(key));
        }

        @Nullable
        private Long requireLong(final JsonNode node, final NodePath path, final String key) {
            final JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                errors.add(StructuralError.missingKey(path, key));
                return null;
            }
            return optionalLong(node, path, key);
        }

        @Nullable
        private Long toLong(final JsonNode value, final NodePath path) {
            if (!value.canConvertToLong()) {
                errors.add(new StructuralError(StructuralErrorCode.VALUE_OUT_OF_RANGE, path,
                        "%s does not fit a 64-bit integer".formatted(value.asText())));
                return null;
            }
            return value.longValue();
        }

        @Nullable
        private JsonNode requireArray(final JsonNode node, final NodePath path, final String key) {
            final JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                errors.add(StructuralError.missingKey(path, key));
                return null;
            }
            if (!value.isArray()) {
                errors.add(StructuralError.wrongValueKind(path.key(key), "an array", JsonValues.describe(value)));
                return null;
            }
            return value;
        }

        private void checkKeys(final JsonNode node, final NodePath path, final Kind kind) {
            if (!rejectUnknownKeys) {
                return;
            }
            final Iterator<String> keys = node.fieldNames();
            while (keys.hasNext()) {
                final String key = keys.next();
                if (!GrammarKeys.allowed(kind, key)) {
                    errors.add(unknownKey(path, key, kind.keyword()));
                }
            }
        }

        private void checkKeys(final JsonNode node, final NodePath path, final Set<String> allowed) {
            if (!rejectUnknownKeys) {
                return;
            }
            final Iterator<String> keys = node.fieldNames();
            while (keys.hasNext()) {
                final String key = keys.next();
                if (!allowed.contains(key)) {
                    errors.add(unknownKey(path, key, "this object"));
                }
            }
        }

        private StructuralError unknownKey(final NodePath path, final String key, final String owner) {
            return new StructuralError(StructuralErrorCode.UNKNOWN_KEY, path.key(key),
                    "key '%s' is not defined for %s".formatted(key, owner));
        }
    }
}
