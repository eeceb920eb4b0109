package com.example.typedcsv.shape;

import java.util.List;

/**
 * Decoded member values of a struct or tuple, handed to its constructor
 * once every member has been read.
 */
public final class Values {

    private final List<String> names;
    private final Object[] values;

    Values(List<String> names, Object[] values) {
        this.names = names;
        this.values = values;
    }

    public <V> V get(int index) {
        return cast(values[index]);
    }

    public <V> V get(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No member named " + name + " in " + names);
        }
        return get(index);
    }

    public int size() {
        return values.length;
    }

    /**
     * The one unchecked conversion of the shape package: member values and member
     * shapes are typed by the struct or tuple that declares them.
     */
    @SuppressWarnings("unchecked")
    static <V> V cast(Object value) {
        return (V) value;
    }
}
