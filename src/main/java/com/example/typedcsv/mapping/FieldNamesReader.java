package com.example.typedcsv.mapping;

import com.example.typedcsv.exceptions.UnsupportedShapeException;
import com.example.typedcsv.shape.ScalarShape;
import com.example.typedcsv.shape.ShapeReader;
import com.example.typedcsv.shape.Shapes;

import java.util.ArrayList;
import java.util.List;

/**
 * Names-mode walker. Scalars yield their default value, optionals take the
 * present branch and choices their first variant; only the struct field names
 * and the number of leaves are recorded. Every variant of a choice is walked
 * to check that it fills exactly one column.
 */
final class FieldNamesReader implements ShapeReader {

    private final String recordType;
    private final List<String> names = new ArrayList<>();
    private final List<Integer> leafIndexes = new ArrayList<>();
    private int leafCount;
    /** > 0 while inside an optional or choice, whose field names are not columns of their own. */
    private int leafDepth;
    /** Name of the enclosing named field, if any. */
    private String openField;

    FieldNamesReader(String recordType) {
        this.recordType = recordType;
    }

    FieldNames result() {
        int[] indexes = new int[leafIndexes.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = leafIndexes.get(i);
        }
        return new FieldNames(names, indexes, leafCount);
    }

    @Override
    public <V> V readScalar(ScalarShape<V> scalar) {
        leafCount++;
        return scalar.defaultValue();
    }

    @Override
    public <R> R readStruct(String name, int fieldCount, Step<R> body) {
        return body.apply(this);
    }

    @Override
    public <R> R readStructField(String name, int index, Step<R> body) {
        if (leafDepth > 0 || isAnonymous(name, index)) {
            return body.apply(this);
        }
        if (openField != null) {
            throw new UnsupportedShapeException(recordType + ": field '" + name
                    + "' is nested inside field '" + openField + "'; named fields must hold a single value");
        }
        int start = leafCount;
        names.add(name);
        leafIndexes.add(start);
        openField = name;
        R result;
        try {
            result = body.apply(this);
        } finally {
            openField = null;
        }
        if (leafCount - start != 1) {
            throw new UnsupportedShapeException(recordType + ": field '" + name + "' spans "
                    + (leafCount - start) + " columns; named fields must hold exactly one");
        }
        return result;
    }

    @Override
    public <R> R readTuple(int length, Step<R> body) {
        return body.apply(this);
    }

    @Override
    public <R> R readTupleElement(int index, Step<R> body) {
        return body.apply(this);
    }

    @Override
    public <R> R readSingleton(Step<R> element) {
        return element.apply(this);
    }

    @Override
    public <R> R readOptional(OptionalStep<R> body) {
        int start = leafCount;
        R result;
        leafDepth++;
        try {
            result = body.apply(this, true);
        } finally {
            leafDepth--;
        }
        requireOneColumn(start, "optional value");
        return result;
    }

    @Override
    public <R> R readChoice(String name, List<String> variants, VariantStep<R> body) {
        int start = leafCount;
        R first = null;
        leafDepth++;
        try {
            for (int i = 0; i < variants.size(); i++) {
                leafCount = start;
                R result = body.apply(this, i);
                requireOneColumn(start, "variant '" + variants.get(i) + "' of " + name);
                if (i == 0) {
                    first = result;
                }
            }
        } finally {
            leafDepth--;
        }
        return first;
    }

    @Override
    public void readVariantName(String name) {
        leafCount++;
    }

    private void requireOneColumn(int start, String what) {
        int width = leafCount - start;
        if (width != 1) {
            String where = openField == null ? "" : " in field '" + openField + "'";
            throw new UnsupportedShapeException(recordType + ": " + what + where + " spans "
                    + width + " columns; it must hold exactly one");
        }
    }

    // Struct fields cannot be told apart from tuple positions otherwise; see Shapes#ANONYMOUS_FIELD_PREFIX.
    static boolean isAnonymous(String name, int index) {
        return name.equals(Shapes.ANONYMOUS_FIELD_PREFIX + index);
    }
}
