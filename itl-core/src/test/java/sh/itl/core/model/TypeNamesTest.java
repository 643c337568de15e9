// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import static org.junit.jupiter.api.Assertions.*;
import static sh.itl.core.TestDocuments.graph;
import static sh.itl.core.TestDocuments.types;

import org.junit.jupiter.api.Test;

import sh.itl.core.build.TypeGraph;

class TypeNamesTest {

    private static String describeFirst(final String definition) {
        TypeGraph graph = graph(types(definition));
        return TypeNames.describe(graph.declarations().get(0).definition());
    }

    @Test
    void scalars() {
        assertEquals("byte", describeFirst("{\"kind\":\"byte\"}"));
        assertEquals("int(bits=8, unsigned)", describeFirst("{\"kind\":\"int\",\"bits\":8,\"unsigned\":true}"));
        assertEquals("int", describeFirst("{\"kind\":\"int\"}"));
        assertEquals("fixed(base=10, digits=9, scale=2)",
                describeFirst("{\"kind\":\"fixed\",\"base\":10,\"digits\":9,\"scale\":2}"));
        assertEquals("string(capacity=32)", describeFirst("{\"kind\":\"string\",\"capacity\":32}"));
    }

    @Test
    void sequences() {
        assertEquals("sequence<byte>[]", describeFirst("{\"kind\":\"sequence\",\"type\":{\"kind\":\"byte\"}}"));
        assertEquals("sequence<bool>[4][4]",
                describeFirst("{\"kind\":\"sequence\",\"type\":{\"kind\":\"bool\"},\"size\":[4,4]}"));
    }

    @Test
    void namedReferences_renderAsNames() {
        TypeGraph graph = graph(types(
                "{\"name\":\"Node\",\"kind\":\"record\",\"fields\":["
                        + "{\"name\":\"id\",\"type\":{\"kind\":\"int\"}},"
                        + "{\"name\":\"next\",\"type\":\"Node\",\"optional\":true}]}"));

        assertEquals("record{id: int, next?: Node}",
                TypeNames.describe(graph.declarations().get(0).definition()));
    }

    @Test
    void unions_listAlternatives() {
        assertEquals("union<byte>{ping, other}", describeFirst(
                "{\"kind\":\"union\",\"discriminator\":{\"kind\":\"byte\"},\"fields\":["
                        + "{\"name\":\"ping\",\"type\":{\"kind\":\"bool\"},\"labels\":[0]},"
                        + "{\"name\":\"other\",\"type\":{\"kind\":\"bool\"},\"labels\":[]}]}"));
    }
}
