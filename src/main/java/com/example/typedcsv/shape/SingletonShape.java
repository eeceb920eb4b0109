package com.example.typedcsv.shape;

import java.util.Collections;
import java.util.List;

/**
 * A list that must hold exactly one element, so it occupies as many columns as its element.
 */
final class SingletonShape<V> implements Shape<List<V>> {

    private final Shape<V> element;

    SingletonShape(Shape<V> element) {
        this.element = element;
    }

    @Override
    public String name() {
        return "List<" + element.name() + ">";
    }

    @Override
    public List<V> read(ShapeReader in) {
        return in.readSingleton(r -> Collections.singletonList(element.read(r)));
    }

    @Override
    public void write(List<V> value, ShapeWriter out) {
        if (value == null) {
            throw out.unwritable("null where a list was expected");
        }
        out.writeSingleton(value.size(), o -> element.write(value.get(0), o));
    }
}
