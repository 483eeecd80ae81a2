package io.github.tclast.json;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tclast.json.TreeValue.Seq;
import io.github.tclast.json.WireSchema.Shape;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class WireSchemaTest {

    @ParameterizedTest
    @ValueSource(strings = {"name", "end_pos", "a.b", "::ns", "42"})
    void fieldNameShapes(String name) {
        assertTrue(WireSchema.looksLikeFieldName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a b", "tab\there", "nul\u0000", "line\nbreak"})
    void notFieldNames(String name) {
        assertFalse(WireSchema.looksLikeFieldName(name));
    }

    @Test
    void emptySequencesAreArraysUnlessAlwaysObject() {
        var empty = new Seq(List.of());
        assertEquals(Shape.ARRAY, WireSchema.shapeOf(null, empty));
        assertEquals(Shape.ARRAY, WireSchema.shapeOf("children", empty));
        assertEquals(Shape.ARRAY, WireSchema.shapeOf("value", empty));
        assertEquals(Shape.OBJECT, WireSchema.shapeOf("else_body", empty));
    }

    @Test
    void nonTextKeyMakesArray() {
        var seq = new Seq(List.of(new TreeValue.Int(1), TreeValue.text("x")));
        assertFalse(WireSchema.looksLikeObject(seq));
        assertEquals(Shape.ARRAY, WireSchema.shapeOf("var_ref", seq));
    }

    @Test
    void arrayAndObjectListsAreDisjoint() {
        for (var field : WireSchema.ARRAY_FIELDS) {
            assertFalse(WireSchema.OBJECT_FIELDS.contains(field), field);
        }
    }
}
