package com.example.typedcsv.shape;

import java.util.Optional;

final class OptionalShape<V> implements Shape<Optional<V>> {

    private final Shape<V> inner;

    OptionalShape(Shape<V> inner) {
        this.inner = inner;
    }

    @Override
    public String name() {
        return "Optional<" + inner.name() + ">";
    }

    @Override
    public Optional<V> read(ShapeReader in) {
        return in.readOptional((r, present) -> present ? Optional.ofNullable(inner.read(r)) : Optional.empty());
    }

    @Override
    public void write(Optional<V> value, ShapeWriter out) {
        if (value == null) {
            throw out.unwritable("null where an Optional was expected");
        }
        if (value.isPresent()) {
            out.writePresent(o -> inner.write(value.get(), o));
        } else {
            out.writeAbsent();
        }
    }
}
