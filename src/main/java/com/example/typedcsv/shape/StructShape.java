package com.example.typedcsv.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A record with ordered, named fields. Built with {@link Shapes#struct(String)}.
 */
public final class StructShape<T> implements Shape<T> {

    private final String name;
    private final List<Field<T, ?>> fields;
    private final List<String> fieldNames;
    private final Function<Values, T> constructor;

    private StructShape(String name, List<Field<T, ?>> fields, Function<Values, T> constructor) {
        this.name = name;
        this.fields = fields;
        List<String> names = new ArrayList<>(fields.size());
        for (Field<T, ?> field : fields) {
            names.add(field.name);
        }
        this.fieldNames = Collections.unmodifiableList(names);
        this.constructor = constructor;
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> fieldNames() {
        return fieldNames;
    }

    @Override
    public T read(ShapeReader in) {
        return in.readStruct(name, fields.size(), r -> {
            Object[] values = new Object[fields.size()];
            for (int i = 0; i < fields.size(); i++) {
                Field<T, ?> field = fields.get(i);
                values[i] = r.readStructField(field.name, i, field.shape::read);
            }
            return constructor.apply(new Values(fieldNames, values));
        });
    }

    @Override
    public void write(T value, ShapeWriter out) {
        if (value == null) {
            throw out.unwritable("null " + name);
        }
        out.writeStruct(name, fields.size(), o -> {
            for (int i = 0; i < fields.size(); i++) {
                Field<T, ?> field = fields.get(i);
                o.writeStructField(field.name, i, fo -> field.write(value, fo));
            }
        });
    }

    private static final class Field<T, V> {
        final String name;
        final Shape<V> shape;
        final Function<T, V> getter;

        Field(String name, Shape<V> shape, Function<T, V> getter) {
            this.name = name;
            this.shape = shape;
            this.getter = getter;
        }

        void write(T owner, ShapeWriter out) {
            shape.write(getter.apply(owner), out);
        }
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Field<T, ?>> fields = new ArrayList<>();

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public <V> Builder<T> field(String fieldName, Shape<V> shape, Function<T, V> getter) {
            fields.add(new Field<>(Objects.requireNonNull(fieldName, "fieldName"),
                    Objects.requireNonNull(shape, "shape"), Objects.requireNonNull(getter, "getter")));
            return this;
        }

        public StructShape<T> build(Function<Values, T> constructor) {
            return new StructShape<>(name, new ArrayList<>(fields), Objects.requireNonNull(constructor, "constructor"));
        }
    }
}
