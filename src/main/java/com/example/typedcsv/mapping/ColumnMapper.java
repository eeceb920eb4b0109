package com.example.typedcsv.mapping;

import com.example.typedcsv.exceptions.HeaderCountMismatchException;
import com.example.typedcsv.exceptions.HeaderNameMismatchException;

import java.util.List;

/**
 * Reconciles a header row with the field names of a shape.
 * <p>
 * Reordering is a greedy left-to-right match: each field, in declaration
 * order, takes the first header not yet taken that matches it. This is not a
 * maximum matching, but it is deterministic and keeps duplicate names in
 * their relative order on both sides.
 */
public final class ColumnMapper {

    private ColumnMapper() {}

    public static ColumnMapping map(List<String> headers, List<String> fieldNames, MatchPolicy policy) {
        checkCounts(headers.size(), fieldNames.size(), policy.isIgnoreUnusedColumns());
        HeaderMatcher matcher = policy.getHeaderMatcher();
        if (policy.isReorderColumns()) {
            return mapAnyOrder(headers, fieldNames, matcher);
        } else if (policy.isIgnoreUnusedColumns()) {
            return mapInOrderSkipping(headers, fieldNames, matcher);
        } else {
            return mapPositionally(headers, fieldNames, matcher);
        }
    }

    private static void checkCounts(int headers, int fields, boolean ignoreUnused) {
        if (ignoreUnused ? headers < fields : headers != fields) {
            throw new HeaderCountMismatchException(fields, headers);
        }
    }

    private static ColumnMapping mapPositionally(List<String> headers, List<String> fieldNames, HeaderMatcher matcher) {
        for (int i = 0; i < headers.size(); i++) {
            if (!matcher.matches(headers.get(i), fieldNames.get(i))) {
                throw new HeaderNameMismatchException("header '" + headers.get(i) + "' in column " + i
                        + " does not match field '" + fieldNames.get(i) + "'");
            }
        }
        return ColumnMapping.identity(headers.size());
    }

    private static ColumnMapping mapAnyOrder(List<String> headers, List<String> fieldNames, HeaderMatcher matcher) {
        int[] mapping = ColumnMapping.unused(headers.size());
        boolean[] used = new boolean[headers.size()];
        for (int field = 0; field < fieldNames.size(); field++) {
            String name = fieldNames.get(field);
            int column = firstMatch(headers, name, matcher, used, 0);
            if (column < 0) {
                throw new HeaderNameMismatchException("no remaining header matches field '" + name + "'");
            }
            used[column] = true;
            mapping[column] = field;
        }
        return new ColumnMapping(mapping, fieldNames.size());
    }

    private static ColumnMapping mapInOrderSkipping(List<String> headers, List<String> fieldNames, HeaderMatcher matcher) {
        int[] mapping = ColumnMapping.unused(headers.size());
        int cursor = 0;
        for (int field = 0; field < fieldNames.size(); field++) {
            String name = fieldNames.get(field);
            int column = firstMatch(headers, name, matcher, null, cursor);
            if (column < 0) {
                throw new HeaderNameMismatchException("no header at or after column " + cursor
                        + " matches field '" + name + "'");
            }
            mapping[column] = field;
            cursor = column + 1;
        }
        return new ColumnMapping(mapping, fieldNames.size());
    }

    private static int firstMatch(List<String> headers, String name, HeaderMatcher matcher, boolean[] used, int from) {
        for (int column = from; column < headers.size(); column++) {
            if ((used == null || !used[column]) && matcher.matches(headers.get(column), name)) {
                return column;
            }
        }
        return -1;
    }
}
