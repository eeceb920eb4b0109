package com.example.typedcsv.shape;

import lombok.Value;

/**
 * Two records side by side in one row.
 */
@Value(staticConstructor = "of")
public class Pair<A, B> {
    A first;
    B second;
}
