package com.example.typedcsv.shape;

/**
 * Static description of a record type that can be laid out as one CSV row.
 * <p>
 * A shape walks itself through a {@link ShapeReader} to produce an instance
 * (or, in names mode, to announce its field names) and through a
 * {@link ShapeWriter} to turn an instance into raw fields. Shapes are
 * immutable and can be shared between sessions.
 *
 * @param <T> the record type
 */
public interface Shape<T> {

    /**
     * Type name used in error messages.
     */
    String name();

    T read(ShapeReader in);

    void write(T value, ShapeWriter out);
}
