package com.example.typedcsv.shape;

/**
 * Visitor driven by {@link Shape#write}; every leaf becomes one raw field.
 */
public interface ShapeWriter {

    <V> void writeScalar(ScalarShape<V> scalar, V value);

    void writeStruct(String name, int fieldCount, Body body);

    void writeStructField(String name, int index, Body body);

    void writeTuple(int length, Body body);

    void writeTupleElement(int index, Body body);

    void writeSingleton(int size, Body element);

    void writeAbsent();

    void writePresent(Body body);

    void writeChoice(String name, String variant, Body body);

    void writeVariantName(String name);

    /**
     * Builds the exception to throw when a value cannot be written at the current position.
     */
    RuntimeException unwritable(String reason);

    @FunctionalInterface
    interface Body {
        void apply(ShapeWriter out);
    }
}
