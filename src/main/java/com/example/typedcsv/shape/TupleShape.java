package com.example.typedcsv.shape;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Ordered, unnamed members. Members contribute their own field names (if any)
 * but the positions themselves are anonymous.
 */
final class TupleShape<T> implements Shape<T> {

    private final String name;
    private final List<Shape<Object>> members;
    private final Function<Values, T> constructor;
    private final Function<T, List<?>> deconstructor;

    TupleShape(String name, List<Shape<Object>> members, Function<Values, T> constructor,
               Function<T, List<?>> deconstructor) {
        this.name = name;
        this.members = members;
        this.constructor = constructor;
        this.deconstructor = deconstructor;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public T read(ShapeReader in) {
        return in.readTuple(members.size(), r -> {
            Object[] values = new Object[members.size()];
            for (int i = 0; i < members.size(); i++) {
                Shape<Object> member = members.get(i);
                values[i] = r.readTupleElement(i, member::read);
            }
            return constructor.apply(new Values(Collections.emptyList(), values));
        });
    }

    @Override
    public void write(T value, ShapeWriter out) {
        if (value == null) {
            throw out.unwritable("null " + name);
        }
        List<?> parts = deconstructor.apply(value);
        if (parts.size() != members.size()) {
            throw out.unwritable(name + " expects " + members.size() + " members, got " + parts.size());
        }
        out.writeTuple(members.size(), o -> {
            for (int i = 0; i < members.size(); i++) {
                Object part = parts.get(i);
                Shape<Object> member = members.get(i);
                o.writeTupleElement(i, eo -> member.write(part, eo));
            }
        });
    }
}
