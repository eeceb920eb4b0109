package com.example.typedcsv.reader;

import com.example.typedcsv.exceptions.LeafDecodeException;
import com.example.typedcsv.mapping.HeaderMatcher;
import com.example.typedcsv.shape.ScalarShape;
import com.example.typedcsv.shape.Shape;
import com.example.typedcsv.shape.ShapeReader;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Decode-mode walker over one row whose fields are already in leaf order.
 * Each leaf consumes one field; leaves past the end of the row see an empty field.
 */
@Slf4j
final class RowDecoder implements ShapeReader {

    private final List<String> fields;
    private final Deque<String> path = new ArrayDeque<>();
    private int position;

    RowDecoder(List<String> fields) {
        this.fields = fields;
    }

    /** Number of fields consumed so far. */
    int position() {
        return position;
    }

    static <T> T decode(Shape<T> shape, List<String> fields) {
        try {
            return shape.read(new RowDecoder(fields));
        } catch (LeafDecodeException e) {
            throw e.withRecordType(shape.name());
        }
    }

    private String fieldAt(int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    private String nextField() {
        return fieldAt(position++);
    }

    private String path() {
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = path.descendingIterator();
        while (it.hasNext()) {
            if (sb.length() > 0) sb.append('.');
            sb.append(it.next());
        }
        return sb.toString();
    }

    @Override
    public <V> V readScalar(ScalarShape<V> scalar) {
        String text = nextField();
        try {
            return scalar.parse(text);
        } catch (IllegalArgumentException e) {
            throw new LeafDecodeException(path(), text,
                    "could not convert '" + text + "' to " + scalar.name(), e);
        }
    }

    @Override
    public <R> R readStruct(String name, int fieldCount, Step<R> body) {
        return body.apply(this);
    }

    @Override
    public <R> R readStructField(String name, int index, Step<R> body) {
        return nested(name, body);
    }

    @Override
    public <R> R readTuple(int length, Step<R> body) {
        return body.apply(this);
    }

    @Override
    public <R> R readTupleElement(int index, Step<R> body) {
        return nested(String.valueOf(index), body);
    }

    @Override
    public <R> R readSingleton(Step<R> element) {
        return nested("0", element);
    }

    private <R> R nested(String segment, Step<R> body) {
        path.push(segment);
        try {
            return body.apply(this);
        } finally {
            path.pop();
        }
    }

    @Override
    public <R> R readOptional(OptionalStep<R> body) {
        int mark = position;
        String text = fieldAt(mark);
        if (text.isEmpty()) {
            position++;
            return body.apply(this, false);
        }
        try {
            return body.apply(this, true);
        } catch (LeafDecodeException e) {
            // malformed optional data reads as absent
            log.debug("Treating '{}' at {} as absent: {}", text, path(), e.getReason());
            position = mark + 1;
            return body.apply(this, false);
        }
    }

    @Override
    public <R> R readChoice(String name, List<String> variants, VariantStep<R> body) {
        int mark = position;
        LeafDecodeException last = null;
        for (int i = 0; i < variants.size(); i++) {
            position = mark;
            try {
                return body.apply(this, i);
            } catch (LeafDecodeException e) {
                last = e;
            }
        }
        String text = fieldAt(mark);
        position = mark + 1;
        throw new LeafDecodeException(path(), text,
                "could not load '" + text + "' into any variant of " + name + " " + variants, last);
    }

    @Override
    public void readVariantName(String name) {
        String text = nextField();
        if (!HeaderMatcher.equalsIgnoreAsciiCase(text, name)) {
            throw new LeafDecodeException(path(), text, "expected '" + name + "'");
        }
    }
}
