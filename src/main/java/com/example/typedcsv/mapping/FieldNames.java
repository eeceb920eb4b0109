package com.example.typedcsv.mapping;

import com.example.typedcsv.shape.Shape;

import java.util.Collections;
import java.util.List;

/**
 * Ordered field names of a shape together with the leaf each name labels.
 * Anonymous leaves (tuple positions, newtype members) have no name but still
 * count towards {@link #leafCount()}.
 */
public final class FieldNames {

    private final List<String> names;
    private final int[] leafIndexes;
    private final int leafCount;

    FieldNames(List<String> names, int[] leafIndexes, int leafCount) {
        this.names = Collections.unmodifiableList(names);
        this.leafIndexes = leafIndexes;
        this.leafCount = leafCount;
    }

    /**
     * Walks {@code shape} without data to discover its field names.
     *
     * @throws com.example.typedcsv.exceptions.UnsupportedShapeException if a named
     *         field does not hold exactly one leaf
     */
    public static FieldNames of(Shape<?> shape) {
        FieldNamesReader reader = new FieldNamesReader(shape.name());
        shape.read(reader);
        return reader.result();
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    /**
     * Position within the row of the leaf labelled by the {@code nameIndex}-th name.
     */
    public int leafIndex(int nameIndex) {
        return leafIndexes[nameIndex];
    }

    public int leafCount() {
        return leafCount;
    }

    @Override
    public String toString() {
        return names + " (" + leafCount + " leaves)";
    }
}
