package com.example.typedcsv.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A tagged union whose variants carry zero or one payload. Occupies a single column:
 * zero-data variants are written as their name, one-payload variants as the payload.
 * Decoding tries the variants in declaration order against the same raw field.
 */
public final class ChoiceShape<T> implements Shape<T> {

    private final String name;
    private final List<Variant<T>> variants;
    private final List<String> variantNames;

    private ChoiceShape(String name, List<Variant<T>> variants) {
        this.name = name;
        this.variants = variants;
        List<String> names = new ArrayList<>(variants.size());
        for (Variant<T> variant : variants) {
            names.add(variant.name());
        }
        this.variantNames = Collections.unmodifiableList(names);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> variantNames() {
        return variantNames;
    }

    @Override
    public T read(ShapeReader in) {
        return in.readChoice(name, variantNames, (r, index) -> variants.get(index).read(r));
    }

    @Override
    public void write(T value, ShapeWriter out) {
        if (value == null) {
            throw out.unwritable("null " + name);
        }
        for (Variant<T> variant : variants) {
            if (variant.matches(value)) {
                out.writeChoice(name, variant.name(), o -> variant.write(value, o));
                return;
            }
        }
        throw out.unwritable("no variant of " + name + " accepts " + value);
    }

    private interface Variant<T> {
        String name();

        boolean matches(T value);

        T read(ShapeReader in);

        void write(T value, ShapeWriter out);
    }

    private static final class UnitVariant<T> implements Variant<T> {
        private final String name;
        private final T instance;

        UnitVariant(String name, T instance) {
            this.name = name;
            this.instance = instance;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean matches(T value) {
            return instance.equals(value);
        }

        @Override
        public T read(ShapeReader in) {
            in.readVariantName(name);
            return instance;
        }

        @Override
        public void write(T value, ShapeWriter out) {
            out.writeVariantName(name);
        }
    }

    private static final class PayloadVariant<T, S extends T, P> implements Variant<T> {
        private final String name;
        private final Class<S> type;
        private final Shape<P> payload;
        private final Function<P, S> constructor;
        private final Function<S, P> getter;

        PayloadVariant(String name, Class<S> type, Shape<P> payload, Function<P, S> constructor, Function<S, P> getter) {
            this.name = name;
            this.type = type;
            this.payload = payload;
            this.constructor = constructor;
            this.getter = getter;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean matches(T value) {
            return type.isInstance(value);
        }

        @Override
        public T read(ShapeReader in) {
            return constructor.apply(payload.read(in));
        }

        @Override
        public void write(T value, ShapeWriter out) {
            payload.write(getter.apply(type.cast(value)), out);
        }
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Variant<T>> variants = new ArrayList<>();

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<T> unit(String variantName, T instance) {
            variants.add(new UnitVariant<>(Objects.requireNonNull(variantName, "variantName"),
                    Objects.requireNonNull(instance, "instance")));
            return this;
        }

        public <S extends T, P> Builder<T> variant(String variantName, Class<S> type, Shape<P> payload,
                                                   Function<P, S> constructor, Function<S, P> getter) {
            variants.add(new PayloadVariant<>(Objects.requireNonNull(variantName, "variantName"), type, payload,
                    constructor, getter));
            return this;
        }

        public ChoiceShape<T> build() {
            if (variants.isEmpty()) {
                throw new IllegalStateException(name + " declares no variants");
            }
            return new ChoiceShape<>(name, new ArrayList<>(variants));
        }
    }
}
