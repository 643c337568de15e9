// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import static org.junit.jupiter.api.Assertions.*;
import static sh.itl.core.TestDocuments.types;
import static sh.itl.core.TestDocuments.validate;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.itl.core.error.ValidationError;
import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.NodePath;

class NameUniquenessCheckTest {

    @Test
    void recordFieldNames_mustBeUnique() {
        ValidationResult result = validate(types(
                "{\"name\":\"R\",\"kind\":\"record\",\"fields\":["
                        + "{\"name\":\"a\",\"type\":{\"kind\":\"byte\"}},"
                        + "{\"name\":\"b\",\"type\":{\"kind\":\"byte\"}},"
                        + "{\"name\":\"a\",\"type\":{\"kind\":\"bool\"}}]}"));

        assertEquals(1, result.errors().size());
        ValidationError error = result.errors().get(0);
        assertEquals(ValidationRule.DUPLICATE_FIELD_NAME, error.rule());
        assertEquals("types[0].fields[2].name", error.path().toString());
        assertEquals(List.of(NodePath.of("types[0].fields[0].name")), error.related());
        assertTrue(error.detail().contains("types[0].fields[0].name"), error.detail());
    }

    @Test
    void eachRepeat_reportedSeparately() {
        ValidationResult result = validate(types(
                "{\"name\":\"R\",\"kind\":\"record\",\"fields\":["
                        + "{\"name\":\"a\",\"type\":{\"kind\":\"byte\"}},"
                        + "{\"name\":\"a\",\"type\":{\"kind\":\"byte\"}},"
                        + "{\"name\":\"a\",\"type\":{\"kind\":\"byte\"}}]}"));

        assertEquals(2, result.errors().size());
        assertEquals(result.errors().get(0).related(), result.errors().get(1).related());
    }

    @Test
    void unionFieldNames_mustBeUnique() {
        ValidationResult result = validate(types(
                "{\"name\":\"U\",\"kind\":\"union\",\"discriminator\":{\"kind\":\"bool\"},\"fields\":["
                        + "{\"name\":\"x\",\"type\":{\"kind\":\"byte\"},\"labels\":[true]},"
                        + "{\"name\":\"x\",\"type\":{\"kind\":\"byte\"},\"labels\":[false]}]}"));

        assertEquals(1, result.errors().size());
        assertEquals(ValidationRule.DUPLICATE_FIELD_NAME, result.errors().get(0).rule());
        assertEquals("types[0].fields[1].name", result.errors().get(0).path().toString());
    }

    @Test
    void sameFieldNameInDifferentRecords_accepted() {
        assertTrue(validate(types(
                "{\"name\":\"A\",\"kind\":\"record\",\"fields\":[{\"name\":\"id\",\"type\":{\"kind\":\"byte\"}}]}",
                "{\"name\":\"B\",\"kind\":\"record\",\"fields\":[{\"name\":\"id\",\"type\":{\"kind\":\"byte\"}}]}"))
                .isValid());
    }
}
