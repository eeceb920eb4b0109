package com.example.typedcsv.shape;

import java.util.Objects;
import java.util.function.Function;

/**
 * A leaf holding one scalar value rendered as one raw field.
 * The parser signals malformed text by throwing {@link IllegalArgumentException}.
 */
public final class ScalarShape<V> implements Shape<V> {

    private final String name;
    private final V defaultValue;
    private final Function<String, V> parser;
    private final Function<V, String> renderer;

    public ScalarShape(String name, V defaultValue, Function<String, V> parser, Function<V, String> renderer) {
        this.name = Objects.requireNonNull(name, "name");
        this.defaultValue = defaultValue;
        this.parser = Objects.requireNonNull(parser, "parser");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Value produced when the shape is walked without data.
     */
    public V defaultValue() {
        return defaultValue;
    }

    public V parse(String text) {
        return parser.apply(text);
    }

    public String render(V value) {
        return renderer.apply(value);
    }

    @Override
    public V read(ShapeReader in) {
        return in.readScalar(this);
    }

    @Override
    public void write(V value, ShapeWriter out) {
        out.writeScalar(this, value);
    }

    @Override
    public String toString() {
        return name;
    }
}
