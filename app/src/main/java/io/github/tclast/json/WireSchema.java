package io.github.tclast.json;

import com.google.common.base.CharMatcher;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The JSON layout consumers rely on. Since {@link TreeValue} does not tell maps from lists, the shape of every
 * {@link TreeValue.Seq} is decided here, in this order:
 *
 * <ol>
 *   <li>a field in {@link #ARRAY_FIELDS} is always a JSON array, {@code []} when empty;
 *   <li>a field in {@link #OBJECT_FIELDS} is always a JSON object, {@code {}} when empty;
 *   <li>anything else, including array elements and the top-level value, is an object only when it is non-empty, has
 *       an even number of items, and every item at an even position is a string that looks like a field name (no
 *       whitespace, no control characters). Otherwise it is an array.
 * </ol>
 *
 * <p>The third rule is a heuristic: a two-element list of plain words such as {@code [a, b]} would read as an object.
 * Every ordered field the analyzer emits is in {@link #ARRAY_FIELDS}, so the heuristic only ever sees node objects.
 *
 * <p>Strings stay strings ({@code "42"} is not turned into {@code 42}); only line, column and depth are numbers, and
 * only {@code had_error}, {@code is_varargs} and {@code fallthrough} are booleans. Root fields are {@code type},
 * {@code filepath}, {@code comments}, {@code children}, {@code had_error}, {@code errors} and {@code range}; every
 * other node has {@code type}, its own fields, {@code range} and {@code depth}. A range is
 * {@code {"start":{"line":L,"column":C},"end_pos":{...}}} with an exclusive end.
 */
public final class WireSchema {

    public static final Set<String> ARRAY_FIELDS = Set.of(
            "children",
            "params",
            "comments",
            "errors",
            "args",
            "vars",
            "refs",
            "patterns",
            "exports",
            "elements",
            "cases",
            "elseif",
            "additional",
            "pairs",
            "options");

    public static final Set<String> OBJECT_FIELDS =
            Set.of("range", "start", "end_pos", "body", "then_body", "else_body", "var_ref");

    private static final CharMatcher NOT_IN_FIELD_NAME =
            CharMatcher.whitespace().or(CharMatcher.javaIsoControl());

    public enum Shape {
        OBJECT,
        ARRAY
    }

    private WireSchema() {}

    /** Shape of {@code seq} when it is the value of {@code field}; {@code null} for array elements and the root. */
    public static Shape shapeOf(@Nullable String field, TreeValue.Seq seq) {
        if (field != null && ARRAY_FIELDS.contains(field)) {
            return Shape.ARRAY;
        }
        if (field != null && OBJECT_FIELDS.contains(field)) {
            // an always-object field that cannot be written as one degrades to an array
            return hasNameValueLayout(seq) ? Shape.OBJECT : Shape.ARRAY;
        }
        return looksLikeObject(seq) ? Shape.OBJECT : Shape.ARRAY;
    }

    public static boolean looksLikeObject(TreeValue.Seq seq) {
        if (seq.isEmpty() || seq.size() % 2 != 0) {
            return false;
        }
        for (int i = 0; i < seq.size(); i += 2) {
            if (!(seq.get(i) instanceof TreeValue.Text name) || !looksLikeFieldName(name.value())) {
                return false;
            }
        }
        return true;
    }

    public static boolean looksLikeFieldName(String name) {
        return !name.isEmpty() && NOT_IN_FIELD_NAME.matchesNoneOf(name);
    }

    private static boolean hasNameValueLayout(TreeValue.Seq seq) {
        if (seq.size() % 2 != 0) {
            return false;
        }
        for (int i = 0; i < seq.size(); i += 2) {
            if (!(seq.get(i) instanceof TreeValue.Text)) {
                return false;
            }
        }
        return true;
    }
}
