package com.example.typedcsv.writer;

import com.example.typedcsv.exceptions.LeafEncodeException;
import com.example.typedcsv.shape.ScalarShape;
import com.example.typedcsv.shape.Shape;
import com.example.typedcsv.shape.ShapeWriter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Encode-mode walker: renders every leaf of a record as one raw field, in shape order.
 */
final class RowEncoder implements ShapeWriter {

    private final String recordType;
    private final List<String> fields = new ArrayList<>();
    private final Deque<String> path = new ArrayDeque<>();

    private RowEncoder(String recordType) {
        this.recordType = recordType;
    }

    static <T> List<String> encode(Shape<T> shape, T record) {
        RowEncoder encoder = new RowEncoder(shape.name());
        shape.write(record, encoder);
        return encoder.fields;
    }

    @Override
    public <V> void writeScalar(ScalarShape<V> scalar, V value) {
        if (value == null) {
            throw unwritable("null " + scalar.name());
        }
        fields.add(scalar.render(value));
    }

    @Override
    public void writeStruct(String name, int fieldCount, Body body) {
        body.apply(this);
    }

    @Override
    public void writeStructField(String name, int index, Body body) {
        nested(name, body);
    }

    @Override
    public void writeTuple(int length, Body body) {
        body.apply(this);
    }

    @Override
    public void writeTupleElement(int index, Body body) {
        nested(String.valueOf(index), body);
    }

    @Override
    public void writeSingleton(int size, Body element) {
        if (size != 1) {
            throw unwritable("a list written as one column must hold exactly one element, not " + size);
        }
        nested("0", element);
    }

    @Override
    public void writeAbsent() {
        fields.add("");
    }

    @Override
    public void writePresent(Body body) {
        body.apply(this);
    }

    @Override
    public void writeChoice(String name, String variant, Body body) {
        body.apply(this);
    }

    @Override
    public void writeVariantName(String name) {
        fields.add(name);
    }

    @Override
    public RuntimeException unwritable(String reason) {
        return new LeafEncodeException(recordType, path(), reason);
    }

    private void nested(String segment, Body body) {
        path.push(segment);
        try {
            body.apply(this);
        } finally {
            path.pop();
        }
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
}
