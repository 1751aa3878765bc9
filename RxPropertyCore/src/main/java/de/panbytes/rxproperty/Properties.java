package de.panbytes.rxproperty;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.function.BinaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Combinators for boolean Properties and for collections of Properties.
 */
public final class Properties {

    private Properties() {
    }

    public static Property<Boolean> negate(Property<Boolean> property) {
        checkNotNull(property, "Property may not be null!");
        return property.map(value -> !value);
    }

    /**
     * Logical AND of the latest values of both Properties.
     */
    public static Property<Boolean> and(Property<Boolean> first, Property<Boolean> second) {
        checkNotNull(first, "First property may not be null!");
        return first.combineLatest(second, (a, b) -> a && b);
    }

    /**
     * Logical OR of the latest values of both Properties.
     */
    public static Property<Boolean> or(Property<Boolean> first, Property<Boolean> second) {
        checkNotNull(first, "First property may not be null!");
        return first.combineLatest(second, (a, b) -> a || b);
    }

    /**
     * Same as {@link #all(Iterable, boolean)}, being {@code true} for no properties.
     */
    public static Property<Boolean> all(Iterable<? extends Property<Boolean>> properties) {
        return all(properties, true);
    }

    /**
     * Logical AND of the latest values of all Properties.
     *
     * @param properties   the Properties to combine.
     * @param valueIfEmpty the constant value if there are no Properties.
     * @return the combined Property.
     */
    public static Property<Boolean> all(Iterable<? extends Property<Boolean>> properties, boolean valueIfEmpty) {
        return fold(properties, valueIfEmpty, Boolean::logicalAnd);
    }

    /**
     * Same as {@link #any(Iterable, boolean)}, being {@code false} for no properties.
     */
    public static Property<Boolean> any(Iterable<? extends Property<Boolean>> properties) {
        return any(properties, false);
    }

    /**
     * Logical OR of the latest values of all Properties.
     *
     * @param properties   the Properties to combine.
     * @param valueIfEmpty the constant value if there are no Properties.
     * @return the combined Property.
     */
    public static Property<Boolean> any(Iterable<? extends Property<Boolean>> properties, boolean valueIfEmpty) {
        return fold(properties, valueIfEmpty, Boolean::logicalOr);
    }

    /**
     * Combines the latest values of all Properties into a list, in iteration order. Built by combining the Properties pairwise from
     * left to right.
     *
     * @param properties the Properties to combine.
     * @param <T>        the value's type.
     * @return the combined Property, holding an empty list forever if there are no Properties.
     */
    public static <T> Property<List<T>> combineLatest(Iterable<? extends Property<? extends T>> properties) {
        checkNotNull(properties, "Properties may not be null!");
        Iterator<? extends Property<? extends T>> iterator = properties.iterator();
        if (!iterator.hasNext()) {
            return Property.<List<T>>constant(ImmutableList.of());
        }
        Property<List<T>> combined = asList(iterator.next());
        while (iterator.hasNext()) {
            combined = combined.combineLatest(iterator.next(), Properties::<T>append);
        }
        return combined;
    }

    /**
     * Zips the values of all Properties into lists, in iteration order. Built by zipping the Properties pairwise from left to right.
     *
     * @param properties the Properties to zip.
     * @param <T>        the value's type.
     * @return the zipped Property, holding an empty list forever if there are no Properties.
     */
    public static <T> Property<List<T>> zip(Iterable<? extends Property<? extends T>> properties) {
        checkNotNull(properties, "Properties may not be null!");
        Iterator<? extends Property<? extends T>> iterator = properties.iterator();
        if (!iterator.hasNext()) {
            return Property.<List<T>>constant(ImmutableList.of());
        }
        Property<List<T>> zipped = asList(iterator.next());
        while (iterator.hasNext()) {
            zipped = zipped.zip(iterator.next(), Properties::<T>append);
        }
        return zipped;
    }

    private static Property<Boolean> fold(Iterable<? extends Property<Boolean>> properties, boolean valueIfEmpty,
        BinaryOperator<Boolean> reducer) {
        checkNotNull(properties, "Properties may not be null!");
        List<Property<Boolean>> list = ImmutableList.copyOf(properties);
        if (list.isEmpty()) {
            return Property.constant(valueIfEmpty);
        }
        return Properties.<Boolean>combineLatest(list).map(values -> values.stream().reduce(reducer).orElse(valueIfEmpty));
    }

    private static <T> Property<List<T>> asList(Property<? extends T> property) {
        checkNotNull(property, "Property may not be null!");
        return property.map(value -> ImmutableList.<T>of(value));
    }

    private static <T> List<T> append(List<T> list, T value) {
        return ImmutableList.<T>builder().addAll(list).add(value).build();
    }
}
