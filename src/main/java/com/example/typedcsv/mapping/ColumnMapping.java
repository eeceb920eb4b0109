package com.example.typedcsv.mapping;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Resolved correspondence between the columns of a header row and the fields of a shape.
 */
public final class ColumnMapping {

    private static final int UNUSED = -1;

    private final int[] fieldForColumn;
    private final int fieldCount;

    ColumnMapping(int[] fieldForColumn, int fieldCount) {
        this.fieldForColumn = fieldForColumn;
        this.fieldCount = fieldCount;
    }

    static ColumnMapping identity(int width) {
        int[] mapping = new int[width];
        for (int i = 0; i < width; i++) {
            mapping[i] = i;
        }
        return new ColumnMapping(mapping, width);
    }

    static int[] unused(int columns) {
        int[] mapping = new int[columns];
        Arrays.fill(mapping, UNUSED);
        return mapping;
    }

    public int columnCount() {
        return fieldForColumn.length;
    }

    public int fieldCount() {
        return fieldCount;
    }

    /**
     * Index of the field fed by {@code column}, or empty if the column is ignored.
     */
    public OptionalInt fieldFor(int column) {
        int field = fieldForColumn[column];
        return field == UNUSED ? OptionalInt.empty() : OptionalInt.of(field);
    }

    public boolean isIdentity() {
        if (fieldForColumn.length != fieldCount) {
            return false;
        }
        for (int i = 0; i < fieldForColumn.length; i++) {
            if (fieldForColumn[i] != i) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnMapping)) return false;
        ColumnMapping that = (ColumnMapping) o;
        return fieldCount == that.fieldCount && Arrays.equals(fieldForColumn, that.fieldForColumn);
    }

    @Override
    public int hashCode() {
        return 31 * fieldCount + Arrays.hashCode(fieldForColumn);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < fieldForColumn.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(fieldForColumn[i] == UNUSED ? "-" : String.valueOf(fieldForColumn[i]));
        }
        return sb.append(']').toString();
    }
}
