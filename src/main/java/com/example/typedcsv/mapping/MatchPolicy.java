package com.example.typedcsv.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * How a header row is reconciled with the field names of a shape.
 * The default requires the headers to equal the field names, in order.
 */
@Value
@Builder(toBuilder = true)
public class MatchPolicy {

    public static final MatchPolicy STRICT = MatchPolicy.builder().build();

    /** Allow the columns to appear in any order. */
    boolean reorderColumns;

    /** Allow headers that match no field; their columns are skipped. */
    boolean ignoreUnusedColumns;

    @NonNull
    @Builder.Default
    HeaderMatcher headerMatcher = HeaderMatcher.EXACT;
}
