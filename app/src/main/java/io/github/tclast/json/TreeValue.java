package io.github.tclast.json;

import java.util.ArrayList;
import java.util.List;

/**
 * Untyped value model the serializer renders. A node becomes a {@link Seq} of alternating field names and values; a
 * list becomes a plain {@link Seq}. Which of the two a {@code Seq} is gets decided only at render time by
 * {@link WireSchema}.
 */
public sealed interface TreeValue permits TreeValue.Text, TreeValue.Int, TreeValue.Bool, TreeValue.Seq {

    /** Always rendered as a JSON string, even when it looks like a number. */
    record Text(String value) implements TreeValue {}

    record Int(long value) implements TreeValue {}

    record Bool(boolean value) implements TreeValue {}

    record Seq(List<TreeValue> items) implements TreeValue {
        public Seq {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public TreeValue get(int index) {
            return items.get(index);
        }
    }

    static Text text(String value) {
        return new Text(value);
    }

    static Seq strings(List<String> values) {
        return new Seq(values.stream().<TreeValue>map(Text::new).toList());
    }

    static Fields fields() {
        return new Fields();
    }

    /** Builds the alternating name/value {@link Seq} of one object, in insertion order. */
    final class Fields {
        private final List<TreeValue> items = new ArrayList<>();

        private Fields() {}

        public Fields put(String name, TreeValue value) {
            items.add(new Text(name));
            items.add(value);
            return this;
        }

        public Fields put(String name, String value) {
            return put(name, new Text(value));
        }

        public Fields put(String name, long value) {
            return put(name, new Int(value));
        }

        public Fields put(String name, boolean value) {
            return put(name, new Bool(value));
        }

        public Seq build() {
            return new Seq(items);
        }
    }
}
