package com.example.typedcsv;

import com.example.typedcsv.shape.ChoiceShape;
import com.example.typedcsv.shape.Pair;
import com.example.typedcsv.shape.Shape;
import com.example.typedcsv.shape.Shapes;
import com.example.typedcsv.shape.StructShape;
import lombok.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Record types shared by the tests.
 */
public final class TestShapes {

    private TestShapes() {}

    @Value
    public static class Simple {
        int a;
        int b;
    }

    public static final StructShape<Simple> SIMPLE = Shapes.<Simple>struct("Simple")
            .field("a", Shapes.integer(), Simple::getA)
            .field("b", Shapes.integer(), Simple::getB)
            .build(v -> new Simple(v.<Integer>get(0), v.<Integer>get(1)));

    public static final Shape<Pair<Simple, Simple>> SIMPLE_PAIR = Shapes.pair(SIMPLE, SIMPLE);

    @Value
    public static class Animal {
        int count;
        String animal;
    }

    public static final StructShape<Animal> ANIMAL = Shapes.<Animal>struct("Animal")
            .field("count", Shapes.integer(), Animal::getCount)
            .field("animal", Shapes.string(), Animal::getAnimal)
            .build(v -> new Animal(v.<Integer>get("count"), v.<String>get("animal")));

    @Value
    public static class Count {
        int value;
    }

    public static final Shape<Count> COUNT = Shapes.newtype("Count", Shapes.integer(), Count::new, Count::getValue);

    public enum Group { Bird, Mammal }

    public static final ChoiceShape<Group> GROUP = Shapes.enumeration(Group.class);

    /** One column holding either an integer or a floating point number. */
    public interface NumberValue {}

    @Value
    public static class IntegerNumber implements NumberValue {
        long value;
    }

    @Value
    public static class FloatNumber implements NumberValue {
        double value;
    }

    public static final ChoiceShape<NumberValue> NUMBER = Shapes.<NumberValue>choice("Number")
            .variant("Integer", IntegerNumber.class, Shapes.longInteger(), IntegerNumber::new, IntegerNumber::getValue)
            .variant("Float", FloatNumber.class, Shapes.doubleFloat(), FloatNumber::new, FloatNumber::getValue)
            .build();

    @Value
    public static class Part1 {
        String name1;
        String name2;
        Optional<Count> dist;
        NumberValue dist2;
    }

    public static final StructShape<Part1> PART1 = Shapes.<Part1>struct("Part1")
            .field("name1", Shapes.string(), Part1::getName1)
            .field("name2", Shapes.string(), Part1::getName2)
            .field("dist", Shapes.optional(COUNT), Part1::getDist)
            .field("dist2", NUMBER, Part1::getDist2)
            .build(v -> new Part1(v.get(0), v.get(1), v.get(2), v.get(3)));

    @Value
    public static class Part2 {
        int size;
    }

    public static final StructShape<Part2> PART2 = Shapes.<Part2>struct("Part2")
            .field("size", Shapes.integer(), Part2::getSize)
            .build(v -> new Part2(v.<Integer>get(0)));

    @Value
    public static class Zoo1 {
        Count count;
        String animal;
    }

    public static final StructShape<Zoo1> ZOO1 = Shapes.<Zoo1>struct("Zoo1")
            .field("count", COUNT, Zoo1::getCount)
            .field("animal", Shapes.string(), Zoo1::getAnimal)
            .build(v -> new Zoo1(v.get(0), v.get(1)));

    @Value
    public static class Zoo2 {
        Group group;
        Optional<String> description;
    }

    public static final StructShape<Zoo2> ZOO2 = Shapes.<Zoo2>struct("Zoo2")
            .field("group", GROUP, Zoo2::getGroup)
            .field("description", Shapes.optional(Shapes.string()), Zoo2::getDescription)
            .build(v -> new Zoo2(v.get(0), v.get(1)));

    @Value
    public static class WithSingletons {
        List<Integer> a;
        List<Integer> b;
    }

    public static final StructShape<WithSingletons> WITH_SINGLETONS = Shapes.<WithSingletons>struct("WithSingletons")
            .field("a", Shapes.singleton(Shapes.integer()), WithSingletons::getA)
            .field("b", Shapes.singleton(Shapes.integer()), WithSingletons::getB)
            .build(v -> new WithSingletons(v.get(0), v.get(1)));

    @Value
    public static class StructOfStruct {
        Simple p;
        int q;
    }

    public static final StructShape<StructOfStruct> STRUCT_OF_STRUCT = Shapes.<StructOfStruct>struct("StructOfStruct")
            .field("p", SIMPLE, StructOfStruct::getP)
            .field("q", Shapes.integer(), StructOfStruct::getQ)
            .build(v -> new StructOfStruct(v.get(0), v.<Integer>get(1)));

    @Value
    public static class Scalars {
        long l;
        short s;
        byte by;
        float f;
        boolean flag;
        char c;
    }

    public static final StructShape<Scalars> SCALARS = Shapes.<Scalars>struct("Scalars")
            .field("l", Shapes.longInteger(), Scalars::getL)
            .field("s", Shapes.shortInteger(), Scalars::getS)
            .field("by", Shapes.byteInteger(), Scalars::getBy)
            .field("f", Shapes.singleFloat(), Scalars::getF)
            .field("flag", Shapes.bool(), Scalars::isFlag)
            .field("c", Shapes.character(), Scalars::getC)
            .build(v -> new Scalars(v.<Long>get(0), v.<Short>get(1), v.<Byte>get(2), v.<Float>get(3),
                    v.<Boolean>get(4), v.<Character>get(5)));

    /** A value of a shape together with the row it is written as. */
    @Value
    public static class Sample<T> {
        String label;
        Shape<T> shape;
        T value;
        List<String> row;

        @Override
        public String toString() {
            return label;
        }
    }

    private static <T> Sample<T> sample(String label, Shape<T> shape, T value, String... row) {
        return new Sample<>(label, shape, value, Arrays.asList(row));
    }

    /**
     * One sample per record type used in the tests, plus tuple, pair and newtype combinations.
     */
    public static Stream<Sample<?>> samples() {
        return Stream.of(
                sample("Simple", SIMPLE, new Simple(0, 1), "0", "1"),
                sample("Animal", ANIMAL, new Animal(2, "emu"), "2", "emu"),
                sample("Count", COUNT, new Count(5), "5"),
                sample("Group", GROUP, Group.Mammal, "Mammal"),
                sample("Number", NUMBER, new FloatNumber(1.5), "1.5"),
                sample("Part1", PART1, new Part1("a", "b", Optional.of(new Count(3)), new IntegerNumber(4)),
                        "a", "b", "3", "4"),
                sample("Part2", PART2, new Part2(7), "7"),
                sample("Zoo1", ZOO1, new Zoo1(new Count(9), "platypus"), "9", "platypus"),
                sample("Zoo2", ZOO2, new Zoo2(Group.Bird, Optional.empty()), "Bird", ""),
                sample("WithSingletons", WITH_SINGLETONS,
                        new WithSingletons(Collections.singletonList(0), Collections.singletonList(1)), "0", "1"),
                sample("Scalars", SCALARS, new Scalars(1L, (short) 2, (byte) 3, 4.5f, true, 'c'),
                        "1", "2", "3", "4.5", "true", "c"),
                sample("(Simple, Simple)", SIMPLE_PAIR, Pair.of(new Simple(0, 1), new Simple(2, 3)),
                        "0", "1", "2", "3"),
                sample("(Part1, Part2)", Shapes.pair(PART1, PART2),
                        Pair.of(new Part1("a", "", Optional.empty(), new IntegerNumber(-1)), new Part2(0)),
                        "a", "", "", "-1", "0"),
                sample("nested tuples", Shapes.tuple(SIMPLE, Shapes.tuple(SIMPLE), Shapes.pair(SIMPLE, Shapes.tuple(SIMPLE))),
                        Arrays.<Object>asList(new Simple(0, 1), Collections.singletonList(new Simple(2, 3)),
                                Pair.of(new Simple(4, 5), Collections.singletonList(new Simple(6, 7)))),
                        "0", "1", "2", "3", "4", "5", "6", "7"),
                sample("(int, String)", Shapes.tuple(Shapes.integer(), Shapes.string()), Arrays.<Object>asList(1, "x"),
                        "1", "x"),
                sample("Optional<String>", Shapes.optional(Shapes.string()), Optional.of("x"), "x"),
                sample("Optional<Group>", Shapes.optional(GROUP), Optional.of(Group.Bird), "Bird"),
                sample("newtype of Count", Shapes.newtype("Outer", COUNT, Function.identity(), Function.identity()),
                        new Count(8), "8"));
    }
}
