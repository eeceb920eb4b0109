package com.example.typedcsv.shape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factory methods for the supported shapes.
 * <pre>{@code
 * Shape<Animal> ANIMAL = Shapes.<Animal>struct("Animal")
 *         .field("count", Shapes.integer(), Animal::getCount)
 *         .field("animal", Shapes.string(), Animal::getAnimal)
 *         .build(v -> new Animal(v.get(0), v.get(1)));
 * }</pre>
 */
public final class Shapes {

    /**
     * Field name given to the single member of a {@link #newtype}. Struct fields
     * named {@code _field<index>} are treated as anonymous, so regular struct
     * fields must not use that pattern.
     */
    public static final String ANONYMOUS_FIELD_PREFIX = "_field";

    private static final ScalarShape<Integer> INT = new ScalarShape<>("int", 0, Integer::parseInt, Object::toString);
    private static final ScalarShape<Long> LONG = new ScalarShape<>("long", 0L, Long::parseLong, Object::toString);
    private static final ScalarShape<Short> SHORT = new ScalarShape<>("short", (short) 0, Short::parseShort, Object::toString);
    private static final ScalarShape<Byte> BYTE = new ScalarShape<>("byte", (byte) 0, Byte::parseByte, Object::toString);
    private static final ScalarShape<Double> DOUBLE = new ScalarShape<>("double", 0.0d, Double::parseDouble, Object::toString);
    private static final ScalarShape<Float> FLOAT = new ScalarShape<>("float", 0.0f, Float::parseFloat, Object::toString);
    private static final ScalarShape<Boolean> BOOLEAN = new ScalarShape<>("boolean", false, Shapes::parseBoolean, Object::toString);
    private static final ScalarShape<Character> CHAR = new ScalarShape<>("char", '\0', Shapes::parseChar, Object::toString);
    private static final ScalarShape<String> STRING = new ScalarShape<>("String", "", Function.identity(), Function.identity());

    private Shapes() {}

    public static ScalarShape<Integer> integer() {
        return INT;
    }

    public static ScalarShape<Long> longInteger() {
        return LONG;
    }

    public static ScalarShape<Short> shortInteger() {
        return SHORT;
    }

    public static ScalarShape<Byte> byteInteger() {
        return BYTE;
    }

    public static ScalarShape<Double> doubleFloat() {
        return DOUBLE;
    }

    public static ScalarShape<Float> singleFloat() {
        return FLOAT;
    }

    public static ScalarShape<Boolean> bool() {
        return BOOLEAN;
    }

    public static ScalarShape<Character> character() {
        return CHAR;
    }

    public static ScalarShape<String> string() {
        return STRING;
    }

    /**
     * An optional leaf: an empty field is absent, and so is a field the inner shape cannot parse.
     */
    public static <V> Shape<Optional<V>> optional(Shape<V> inner) {
        return new OptionalShape<>(inner);
    }

    /**
     * A list with exactly one element.
     */
    public static <V> Shape<List<V>> singleton(Shape<V> element) {
        return new SingletonShape<>(element);
    }

    public static <T> StructShape.Builder<T> struct(String name) {
        return new StructShape.Builder<>(name);
    }

    public static <T> ChoiceShape.Builder<T> choice(String name) {
        return new ChoiceShape.Builder<>(name);
    }

    /**
     * A single-member struct whose member is anonymous, e.g. a {@code Count} wrapping an {@code int}.
     */
    public static <T, V> StructShape<T> newtype(String name, Shape<V> inner, Function<V, T> constructor,
                                                Function<T, V> getter) {
        return Shapes.<T>struct(name)
                .field(ANONYMOUS_FIELD_PREFIX + 0, inner, getter)
                .build(v -> constructor.apply(v.get(0)));
    }

    public static <E extends Enum<E>> ChoiceShape<E> enumeration(Class<E> type) {
        ChoiceShape.Builder<E> builder = choice(type.getSimpleName());
        for (E constant : type.getEnumConstants()) {
            builder.unit(constant.name(), constant);
        }
        return builder.build();
    }

    public static Shape<List<Object>> tuple(Shape<?>... members) {
        List<Shape<Object>> shapes = erase(Arrays.asList(members));
        return new TupleShape<List<Object>>(tupleName(shapes), shapes, Shapes::valuesToList, list -> list);
    }

    public static <A, B> Shape<Pair<A, B>> pair(Shape<A> first, Shape<B> second) {
        List<Shape<Object>> shapes = erase(Arrays.asList(first, second));
        return new TupleShape<Pair<A, B>>(tupleName(shapes), shapes,
                v -> Pair.<A, B>of(v.get(0), v.get(1)),
                p -> Arrays.asList(p.getFirst(), p.getSecond()));
    }

    private static List<Shape<Object>> erase(List<? extends Shape<?>> shapes) {
        List<Shape<Object>> erased = new ArrayList<>(shapes.size());
        for (Shape<?> shape : shapes) {
            erased.add(Values.cast(shape));
        }
        return Collections.unmodifiableList(erased);
    }

    private static String tupleName(List<Shape<Object>> shapes) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < shapes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(shapes.get(i).name());
        }
        return sb.append(')').toString();
    }

    private static List<Object> valuesToList(Values values) {
        List<Object> list = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            list.add(values.get(i));
        }
        return Collections.unmodifiableList(list);
    }

    private static Boolean parseBoolean(String text) {
        if ("true".equals(text)) return Boolean.TRUE;
        if ("false".equals(text)) return Boolean.FALSE;
        throw new IllegalArgumentException("not a boolean");
    }

    private static Character parseChar(String text) {
        if (text.length() != 1) {
            throw new IllegalArgumentException("expected exactly one character");
        }
        return text.charAt(0);
    }
}
