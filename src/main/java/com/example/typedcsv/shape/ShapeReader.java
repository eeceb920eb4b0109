package com.example.typedcsv.shape;

import java.util.List;

/**
 * Visitor driven by {@link Shape#read}. Implementations decide what a leaf
 * read means: the names walker returns defaults and records field names, the
 * row decoder parses the next raw field.
 */
public interface ShapeReader {

    <V> V readScalar(ScalarShape<V> scalar);

    <R> R readStruct(String name, int fieldCount, Step<R> body);

    <R> R readStructField(String name, int index, Step<R> body);

    <R> R readTuple(int length, Step<R> body);

    <R> R readTupleElement(int index, Step<R> body);

    /**
     * Reads a container that holds exactly one element.
     */
    <R> R readSingleton(Step<R> element);

    /**
     * Reads an optional leaf. {@code body} is called with {@code present == true}
     * to parse the value and with {@code false} to produce the absent value.
     */
    <R> R readOptional(OptionalStep<R> body);

    /**
     * Reads a tagged choice. {@code body} is called with the index of the
     * variant to attempt; a reader may call it several times.
     */
    <R> R readChoice(String name, List<String> variants, VariantStep<R> body);

    /**
     * Consumes a zero-data variant, written as the variant's name.
     */
    void readVariantName(String name);

    @FunctionalInterface
    interface Step<R> {
        R apply(ShapeReader in);
    }

    @FunctionalInterface
    interface OptionalStep<R> {
        R apply(ShapeReader in, boolean present);
    }

    @FunctionalInterface
    interface VariantStep<R> {
        R apply(ShapeReader in, int variant);
    }
}
