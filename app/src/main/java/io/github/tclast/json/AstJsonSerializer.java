package io.github.tclast.json;

import com.fasterxml.jackson.core.JsonGenerator;
import io.github.tclast.analyzer.ast.AstNode;
import io.github.tclast.util.Json;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jetbrains.annotations.Nullable;

/**
 * Renders nodes as JSON text. Lowering to {@link TreeValue} happens first; the shape of each sequence then follows
 * {@link WireSchema}. String escaping is Jackson's: quotes, backslashes and control characters are escaped, other
 * characters are written as they are.
 */
public final class AstJsonSerializer {
    private final boolean prettyPrint;

    public AstJsonSerializer() {
        this(false);
    }

    public AstJsonSerializer(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String toJson(AstNode node) {
        return render(NodeLowering.lower(node));
    }

    public String render(TreeValue value) {
        var out = new StringWriter();
        try (JsonGenerator generator = Json.getFactory().createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            write(generator, value);
        } catch (IOException e) {
            // StringWriter does not fail; this only surfaces generator bugs
            throw new UncheckedIOException("Failed to render JSON", e);
        }
        return out.toString();
    }

    /** Walks sequences with an explicit stack so output depth never depends on the thread's stack size. */
    private void write(JsonGenerator generator, TreeValue value) throws IOException {
        Deque<OpenSeq> open = new ArrayDeque<>();
        writeValue(generator, null, value, open);
        while (!open.isEmpty()) {
            var current = open.peek();
            if (current.next >= current.seq.size()) {
                open.pop();
                if (current.object) {
                    generator.writeEndObject();
                } else {
                    generator.writeEndArray();
                }
            } else if (current.object) {
                var name = ((TreeValue.Text) current.seq.get(current.next)).value();
                var item = current.seq.get(current.next + 1);
                current.next += 2;
                generator.writeFieldName(name);
                writeValue(generator, name, item, open);
            } else {
                var item = current.seq.get(current.next++);
                writeValue(generator, null, item, open);
            }
        }
    }

    /** Writes a scalar, or starts a sequence and leaves its items to {@link #write}. */
    private static void writeValue(
            JsonGenerator generator, @Nullable String field, TreeValue value, Deque<OpenSeq> open)
            throws IOException {
        if (value instanceof TreeValue.Text text) {
            generator.writeString(text.value());
        } else if (value instanceof TreeValue.Int number) {
            generator.writeNumber(number.value());
        } else if (value instanceof TreeValue.Bool bool) {
            generator.writeBoolean(bool.value());
        } else if (value instanceof TreeValue.Seq seq) {
            boolean object = WireSchema.shapeOf(field, seq) == WireSchema.Shape.OBJECT;
            if (object) {
                generator.writeStartObject();
            } else {
                generator.writeStartArray();
            }
            open.push(new OpenSeq(seq, object));
        }
    }

    private static final class OpenSeq {
        private final TreeValue.Seq seq;
        private final boolean object;
        private int next;

        private OpenSeq(TreeValue.Seq seq, boolean object) {
            this.seq = seq;
            this.object = object;
        }
    }
}
