package de.panbytes.rxproperty.field;

import de.panbytes.rxproperty.ObservableValue;
import de.panbytes.rxproperty.Property;
import io.reactivex.Observable;
import io.reactivex.functions.BiPredicate;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The writable side of a {@link Property}: whoever owns the field sets values, everybody else gets the read-only
 * {@link #toProperty() Property}.
 * <p>
 * Values which are equal to the current one (according to the field's comparer) are not propagated. The field never
 * completes. It is thread-safe.
 *
 * @param <T> the value's type.
 */
public final class MutableField<T> implements ObservableValue<T> {

    private final Subject<T> input = PublishSubject.<T>create().toSerialized();
    private final Property<T> property;

    private MutableField(T initialValue, BiPredicate<? super T, ? super T> comparer) {
        this.property = Property.of(initialValue, this.input).distinctUntilChanged(comparer);
    }

    /**
     * @throws NullPointerException if initialValue is {@code null}.
     */
    public static <T> MutableField<T> withInitialValue(T initialValue) {
        return withInitialValue(initialValue, Objects::equals);
    }

    /**
     * Create a field which drops values the comparer considers equal to the current one.
     *
     * @param initialValue the initial value, which may not be {@code null}.
     * @param comparer     {@code true} if two values are the same.
     * @param <T>          the value's type.
     * @return the new field.
     * @throws NullPointerException if any argument is {@code null}.
     */
    public static <T> MutableField<T> withInitialValue(T initialValue, BiPredicate<? super T, ? super T> comparer) {
        checkNotNull(initialValue, "Initial value may not be null!");
        checkNotNull(comparer, "Comparer may not be null!");
        return new MutableField<>(initialValue, comparer);
    }

    /**
     * Create a field holding {@link Optional#empty()}.
     */
    public static <T> MutableField<Optional<T>> initiallyEmpty() {
        return withInitialValue(Optional.empty());
    }

    @Override
    public T getValue() {
        return this.property.getValue();
    }

    /**
     * Sets a new value. Observers of the field's Property are notified before this method returns, unless another
     * thread is setting a value at the same time; its observers are then notified by that thread.
     *
     * @param value the value.
     * @throws NullPointerException if value is {@code null}.
     */
    public void setValue(T value) {
        this.input.onNext(checkNotNull(value, "Value may not be null!"));
    }

    /**
     * Sets the value computed from the current one.
     * <p>
     * Concurrent updates are not atomic: two threads updating at the same time may compute from the same current value.
     *
     * @param update computes the new value.
     */
    public void updateValue(UnaryOperator<T> update) {
        checkNotNull(update, "Update may not be null!");
        setValue(update.apply(getValue()));
    }

    @Override
    public Observable<T> toObservable() {
        return this.property.valuesWithCurrent();
    }

    /**
     * @return the read-only view of this field, always the same instance.
     */
    public Property<T> toProperty() {
        return this.property;
    }

    @Override
    public String toString() {
        return "MutableField[" + getValue() + "]";
    }
}
