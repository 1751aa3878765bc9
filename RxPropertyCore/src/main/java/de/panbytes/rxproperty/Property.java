package de.panbytes.rxproperty;

import de.panbytes.rxproperty.codec.Decoder;
import de.panbytes.rxproperty.codec.Encoder;
import de.panbytes.rxproperty.internal.PropertyCore;
import io.reactivex.Observable;
import io.reactivex.ObservableSource;
import io.reactivex.ObservableTransformer;
import io.reactivex.Scheduler;
import io.reactivex.functions.BiPredicate;
import io.reactivex.subjects.BehaviorSubject;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A read-only value which can be observed for changes.
 * <p>
 * A Property always has a current value, which can be read synchronously by {@link #getValue()}. Its values are streamed by
 * {@link #valuesWithCurrent()} and {@link #valuesWithoutCurrent()}. All observers share exactly one subscription to the underlying
 * source, which is made when the Property is created and which stays alive as long as the Property or one of its streams is
 * reachable, or any observer is attached.
 * <p>
 * Operators like {@link #map(Function)} or {@link #flatMap(Function)} derive new Properties with the same guarantees. They are
 * implemented by lifting RxJava operators, see {@link #lift(ObservableTransformer)}.
 * <p>
 * The Property is thread-safe. Values may not be {@code null}, think about using {@link Optional} as wrapper.
 *
 * @param <T> The type of the values.
 */
public final class Property<T> implements ObservableValue<T> {

    private static final Logger log = LoggerFactory.getLogger(Property.class);

    private final PropertyCore<T> core;

    /**
     * @param unsafeSource a source which has to emit at least one value synchronously on subscription.
     * @throws PropertyContractViolation if the source didn't emit synchronously.
     */
    private Property(ObservableSource<? extends T> unsafeSource) {
        this.core = new PropertyCore<>(unsafeSource);
        log.trace("Created {}.", this);
    }

    /**
     * Create a new Property with an initial value and a source of subsequent values.
     * <p>
     * The source is subscribed to immediately. If it emits values synchronously, they are absorbed before this method returns,
     * so the new Property's value is not necessarily equal to {@code initial}.
     *
     * @param initial the initial value.
     * @param then    the source of subsequent values.
     * @param <T>     the value's type.
     * @return the new Property.
     * @throws NullPointerException if any argument is {@code null}.
     */
    public static <T> Property<T> of(T initial, ObservableSource<? extends T> then) {
        checkNotNull(initial, "Initial value may not be null!");
        checkNotNull(then, "Source may not be null!");
        return new Property<>(Observable.just(initial).concatWith(then));
    }

    /**
     * Create a new Property mirroring the subject's current and subsequent values.
     *
     * @param subject the subject, which has to hold a value.
     * @param <T>     the value's type.
     * @return the new Property.
     * @throws PropertyContractViolation if the subject has no value (e.g. created without default, or completed).
     */
    public static <T> Property<T> of(BehaviorSubject<T> subject) {
        checkNotNull(subject, "Subject may not be null!");
        return new Property<>(subject);
    }

    /**
     * Create a new Property mirroring a value source, e.g. a {@link de.panbytes.rxproperty.field.MutableField}.
     *
     * @param source the source, which has to adhere to the contract of {@link ObservableValue#toObservable()}.
     * @param <T>    the value's type.
     * @return the new Property.
     * @throws PropertyContractViolation if the source doesn't provide its current value synchronously.
     */
    public static <T> Property<T> of(ObservableValue<T> source) {
        checkNotNull(source, "Source may not be null!");
        return new Property<>(source.toObservable());
    }

    /**
     * Create a Property which never changes. Its streams complete right after the value.
     */
    public static <T> Property<T> constant(T value) {
        return of(value, Observable.empty());
    }

    /**
     * Returns the current value.
     * <p>
     * This is a thread-safe operation.
     *
     * @return the current value.
     */
    @Override
    public T getValue() {
        return this.core.read();
    }

    /**
     * Returns the current value and all subsequent values.
     * <ul>
     * <li>On subscribing, the subscriber receives the current value synchronously.</li>
     * <li>Following values are emitted as the Property receives them.</li>
     * <li>The stream completes when the underlying source completes.</li>
     * </ul>
     *
     * @return the values, beginning with the current value.
     */
    public Observable<T> valuesWithCurrent() {
        return this.core.valuesWithCurrent();
    }

    /**
     * Returns the values the Property receives after subscription, skipping the current value.
     *
     * @return the subsequent values.
     */
    public Observable<T> valuesWithoutCurrent() {
        return this.core.valuesWithoutCurrent();
    }

    /**
     * Same as {@link #valuesWithCurrent()}.
     */
    @Override
    public Observable<T> toObservable() {
        return valuesWithCurrent();
    }

    /**
     * Applies an RxJava transformation on {@link #valuesWithCurrent()}, resulting in a Property with the transformation applied on all its
     * values, including the current one.
     * <p>
     * Example, lifting {@link Observable#map(io.reactivex.functions.Function)}: {@code property.lift(values -> values.map(String::valueOf))}
     * <p>
     * The transformation must be guaranteed to emit a value for the current value it receives on subscription! Operators which may drop
     * values, like {@link Observable#filter(io.reactivex.functions.Predicate)}, have to be lifted by {@link #lift(Object, ObservableTransformer)}.
     *
     * @param transform the transformation.
     * @param <R>       the resulting value's type.
     * @return the transformed Property.
     * @throws PropertyContractViolation if the transformation did not emit for the current value.
     */
    public <R> Property<R> lift(ObservableTransformer<T, R> transform) {
        checkNotNull(transform, "Transform may not be null!");
        return new Property<>(transform.apply(valuesWithCurrent()));
    }

    /**
     * Applies an RxJava transformation on {@link #valuesWithoutCurrent()}. The transformation may drop values, as the resulting Property
     * starts with the given initial value.
     * <p>
     * Example, lifting {@link Observable#filter(io.reactivex.functions.Predicate)}: {@code property.lift(0, values -> values.filter(v -> v > 3))}
     *
     * @param initial   the initial value of the resulting Property.
     * @param transform the transformation.
     * @param <R>       the resulting value's type.
     * @return the transformed Property.
     */
    public <R> Property<R> lift(R initial, ObservableTransformer<T, R> transform) {
        checkNotNull(initial, "Initial value may not be null!");
        checkNotNull(transform, "Transform may not be null!");
        return new Property<>(Observable.just(initial).concatWith(transform.apply(valuesWithoutCurrent())));
    }

    /**
     * Applies an RxJava transformation combining {@link #valuesWithCurrent()} of this and another Property, like
     * {@link Observable#combineLatest(ObservableSource, ObservableSource, io.reactivex.functions.BiFunction)}.
     * <p>
     * Same as for {@link #lift(ObservableTransformer)}, the transformation must emit for the pair of current values.
     *
     * @param other     the other Property.
     * @param transform the transformation, receiving this Property's values first.
     * @param <U>       the other Property's value type.
     * @param <R>       the resulting value's type.
     * @return the transformed Property.
     * @throws PropertyContractViolation if the transformation did not emit for the current values.
     */
    public <U, R> Property<R> liftWith(Property<U> other,
        BiFunction<Observable<T>, Observable<U>, ? extends ObservableSource<? extends R>> transform) {
        checkNotNull(other, "Other property may not be null!");
        checkNotNull(transform, "Transform may not be null!");
        return new Property<>(transform.apply(valuesWithCurrent(), other.valuesWithCurrent()));
    }

    /**
     * Applies a transformation which may fail on each value separately. Emissions are wrapped as {@link Result#success(Object)}, a failure
     * becomes {@link Result#failure(Throwable)} - the resulting Property doesn't terminate because of a failed transformation.
     * <p>
     * The transformation must emit at least one value or fail for each value it receives.
     *
     * @param transform the transformation, applied to an {@link Observable} of a single value.
     * @param <R>       the transformation's value type.
     * @return the Property of results.
     */
    public <R> Property<Result<R>> catchingLift(ObservableTransformer<T, R> transform) {
        checkNotNull(transform, "Transform may not be null!");
        return this.<Result<R>>lift(values -> values.concatMap(value -> Observable.wrap(transform.apply(Observable.just(value)))
                                                                               .map(output -> Result.<R>success(output))
                                                                               .doOnError(error -> log.debug(
                                                                                   "Transformation of {} failed.", value, error))
                                                                               .onErrorReturn(error -> Result.<R>failure(error))));
    }

    /**
     * See {@link Observable#map(io.reactivex.functions.Function)}.
     */
    public <R> Property<R> map(Function<? super T, ? extends R> transform) {
        checkNotNull(transform, "Transform may not be null!");
        return this.<R>lift(values -> values.map(transform::apply));
    }

    /**
     * Maps each value to a pair of two extracted values.
     */
    public <A, B> Property<Pair<A, B>> map(Function<? super T, ? extends A> first, Function<? super T, ? extends B> second) {
        checkNotNull(first, "First transform may not be null!");
        checkNotNull(second, "Second transform may not be null!");
        return map(value -> Pair.<A, B>of(first.apply(value), second.apply(value)));
    }

    /**
     * Maps each value to a triple of three extracted values.
     */
    public <A, B, C> Property<Triple<A, B, C>> map(Function<? super T, ? extends A> first, Function<? super T, ? extends B> second,
        Function<? super T, ? extends C> third) {
        checkNotNull(first, "First transform may not be null!");
        checkNotNull(second, "Second transform may not be null!");
        checkNotNull(third, "Third transform may not be null!");
        return map(value -> Triple.<A, B, C>of(first.apply(value), second.apply(value), third.apply(value)));
    }

    /**
     * Replaces every value with the given one.
     */
    public <R> Property<R> mapTo(R value) {
        checkNotNull(value, "Value may not be null!");
        return map(ignored -> value);
    }

    /**
     * Maps each value to a Property and forwards the values of the latest one (see {@link Observable#switchMap(io.reactivex.functions.Function)}).
     * <ul>
     * <li>When a new value is received, the previous inner Property's subscription is disposed.</li>
     * <li>An inner Property's values emitted synchronously during its creation are absorbed: only its settled current value is
     * forwarded, then all its subsequent values.</li>
     * <li>The resulting Property completes when this Property and the latest inner Property have completed.</li>
     * </ul>
     *
     * @param transform the function providing the inner Property for a value.
     * @param <R>       the inner Property's value type.
     * @return the flattened Property.
     */
    public <R> Property<R> flatMap(Function<? super T, ? extends Property<? extends R>> transform) {
        checkNotNull(transform, "Transform may not be null!");
        return this.<R>lift(values -> values.switchMap(value -> {
            log.trace("Switching to inner property for {}.", value);
            return checkNotNull(transform.apply(value), "Transform returned null for %s!", value).valuesWithCurrent();
        }));
    }

    /**
     * Maps each value to a Property and merges the values of up to {@code maxConcurrency} inner Properties (see
     * {@link Observable#flatMap(io.reactivex.functions.Function, int)}).
     * <p>
     * A limit below 1 is corrected to 1, as the resulting Property needs the first inner Property's current value.
     *
     * @param maxConcurrency the maximum number of inner Properties observed at the same time.
     * @param transform      the function providing the inner Property for a value.
     * @param <R>            the inner Property's value type.
     * @return the merged Property.
     */
    public <R> Property<R> mergeMap(int maxConcurrency, Function<? super T, ? extends Property<? extends R>> transform) {
        checkNotNull(transform, "Transform may not be null!");
        if (maxConcurrency < 1) {
            log.debug("Correcting maxConcurrency {} to 1.", maxConcurrency);
        }
        int concurrency = Math.max(maxConcurrency, 1);
        return this.<R>lift(values -> values.flatMap(
            value -> checkNotNull(transform.apply(value), "Transform returned null for %s!", value).valuesWithCurrent(), concurrency));
    }

    /**
     * Maps values, dropping those for which the transform returns {@link Optional#empty()}.
     * <p>
     * The resulting Property's initial value is the transformed current value, or {@code fallback} if that is empty.
     *
     * @param fallback  the initial value, used if the current value is dropped.
     * @param transform the transform.
     * @param <R>       the resulting value's type.
     * @return the transformed Property.
     */
    public <R> Property<R> compactMap(R fallback, Function<? super T, Optional<R>> transform) {
        checkNotNull(fallback, "Fallback may not be null!");
        checkNotNull(transform, "Transform may not be null!");
        return this.<R>lift(values -> values.map(value -> checkNotNull(transform.apply(value), "Transform returned null for %s!", value))
                                            .filter(Optional::isPresent)
                                            .map(Optional::get)
                                            .startWith(fallback));
    }

    /**
     * Filters the values.
     * <p>
     * The resulting Property's initial value is the current value if it is accepted by the predicate, otherwise {@code fallback}.
     *
     * @param fallback  the initial value, used if the current value is rejected.
     * @param predicate the predicate, {@code true} keeps a value.
     * @return the filtered Property.
     */
    public Property<T> filter(T fallback, Predicate<? super T> predicate) {
        checkNotNull(fallback, "Fallback may not be null!");
        checkNotNull(predicate, "Predicate may not be null!");
        return lift(values -> values.filter(predicate::test).startWith(fallback));
    }

    /**
     * Skips the first {@code count} values, counting the current value as the first one.
     *
     * @param count    the number of values to skip.
     * @param fallback the initial value, used if the current value is skipped.
     * @return the Property without the first values.
     * @throws IllegalArgumentException if count is negative.
     */
    public Property<T> skip(long count, T fallback) {
        checkArgument(count >= 0, "Count may not be negative: %s", count);
        checkNotNull(fallback, "Fallback may not be null!");
        return lift(values -> values.skip(count).startWith(fallback));
    }

    /**
     * Takes only the first {@code count} values, counting the current value as the first one, then completes.
     *
     * @param count    the number of values to take.
     * @param fallback the initial value, used if no value is taken at all.
     * @return the limited Property.
     * @throws IllegalArgumentException if count is negative.
     */
    public Property<T> take(long count, T fallback) {
        checkArgument(count >= 0, "Count may not be negative: %s", count);
        checkNotNull(fallback, "Fallback may not be null!");
        return lift(values -> values.take(count).startWith(fallback));
    }

    /**
     * Accumulates the values. The resulting Property's initial value is the accumulation of {@code seed} and the current value.
     *
     * @param seed        the seed for the accumulation.
     * @param accumulator the accumulator.
     * @param <R>         the accumulation's type.
     * @return the accumulating Property.
     */
    public <R> Property<R> scan(R seed, BiFunction<? super R, ? super T, ? extends R> accumulator) {
        checkNotNull(seed, "Seed may not be null!");
        checkNotNull(accumulator, "Accumulator may not be null!");
        return this.<R>lift(values -> values.scan(seed, accumulator::apply).skip(1));
    }

    /**
     * Delivers subsequent values on the given scheduler. The current value is taken over synchronously.
     */
    public Property<T> observeOn(Scheduler scheduler) {
        checkNotNull(scheduler, "Scheduler may not be null!");
        return lift(values -> values.publish(shared -> shared.take(1).mergeWith(shared.skip(1).observeOn(scheduler))));
    }

    /**
     * Suppresses values which are equal to their predecessor.
     */
    public Property<T> distinctUntilChanged() {
        return lift(values -> values.distinctUntilChanged());
    }

    /**
     * Suppresses values which are equal to their predecessor according to the comparer.
     */
    public Property<T> distinctUntilChanged(BiPredicate<? super T, ? super T> comparer) {
        checkNotNull(comparer, "Comparer may not be null!");
        return lift(values -> values.distinctUntilChanged(comparer));
    }

    /**
     * Forwards only values whose key has not been seen before. The current value is always forwarded, as it is the first one.
     *
     * @param keySelector extracts the key of a value.
     * @param <K>         the key's type.
     * @return the Property of unique values.
     */
    public <K> Property<T> uniqueValues(Function<? super T, ? extends K> keySelector) {
        checkNotNull(keySelector, "Key selector may not be null!");
        return lift(values -> Observable.defer(() -> {
            Set<K> seenKeys = ConcurrentHashMap.newKeySet();
            return values.filter(value -> seenKeys.add(checkNotNull(keySelector.apply(value), "Key of %s is null!", value)));
        }));
    }

    /**
     * Pairs each value with its predecessor, as {@code (previous, current)}. The current value is paired with itself.
     */
    public Property<Pair<T, T>> combinePrevious() {
        return this.<Pair<T, T>>lift(values -> Observable.defer(() -> {
            AtomicReference<T> previous = new AtomicReference<>();
            return values.map(value -> {
                T predecessor = previous.getAndSet(value);
                return Pair.of(predecessor != null ? predecessor : value, value);
            });
        }));
    }

    /**
     * Pairs each value with its predecessor, as {@code (previous, current)}.
     *
     * @param initialPrevious the predecessor of the current value.
     * @return the Property of pairs.
     */
    public Property<Pair<T, T>> combinePrevious(T initialPrevious) {
        checkNotNull(initialPrevious, "Initial previous value may not be null!");
        return this.<Pair<T, T>>lift(values -> Observable.defer(() -> {
            AtomicReference<T> previous = new AtomicReference<>(initialPrevious);
            return values.map(value -> Pair.of(previous.getAndSet(value), value));
        }));
    }

    /**
     * See {@link Observable#combineLatest(ObservableSource, ObservableSource, io.reactivex.functions.BiFunction)}.
     */
    public <U> Property<Pair<T, U>> combineLatest(Property<U> other) {
        return this.<U, Pair<T, U>>combineLatest(other, (mine, theirs) -> Pair.of(mine, theirs));
    }

    /**
     * See {@link Observable#combineLatest(ObservableSource, ObservableSource, io.reactivex.functions.BiFunction)}.
     */
    public <U, R> Property<R> combineLatest(Property<U> other, BiFunction<? super T, ? super U, ? extends R> combiner) {
        checkNotNull(combiner, "Combiner may not be null!");
        return this.<U, R>liftWith(other, (mine, theirs) -> Observable.combineLatest(mine, theirs, combiner::apply));
    }

    /**
     * See {@link Observable#zip(ObservableSource, ObservableSource, io.reactivex.functions.BiFunction)}.
     */
    public <U> Property<Pair<T, U>> zip(Property<U> other) {
        return this.<U, Pair<T, U>>zip(other, (mine, theirs) -> Pair.of(mine, theirs));
    }

    /**
     * See {@link Observable#zip(ObservableSource, ObservableSource, io.reactivex.functions.BiFunction)}.
     */
    public <U, R> Property<R> zip(Property<U> other, BiFunction<? super T, ? super U, ? extends R> zipper) {
        checkNotNull(zipper, "Zipper may not be null!");
        return this.<U, R>liftWith(other, (mine, theirs) -> Observable.zip(mine, theirs, zipper::apply));
    }

    /**
     * Maps the values by a transform which may throw, capturing the outcome as {@link Result}.
     */
    public <R> Property<Result<R>> tryMap(io.reactivex.functions.Function<? super T, ? extends R> transform) {
        checkNotNull(transform, "Transform may not be null!");
        return this.<R>catchingLift(values -> values.map(transform));
    }

    /**
     * Decodes the values, capturing failures as {@link Result#failure(Throwable)}.
     */
    public <R> Property<Result<R>> decode(Decoder<? super T, ? extends R> decoder) {
        checkNotNull(decoder, "Decoder may not be null!");
        return this.<R>tryMap(decoder::decode);
    }

    /**
     * Encodes the values, capturing failures as {@link Result#failure(Throwable)}.
     */
    public <R> Property<Result<R>> encode(Encoder<? super T, ? extends R> encoder) {
        checkNotNull(encoder, "Encoder may not be null!");
        return this.<R>tryMap(encoder::encode);
    }

    @Override
    public String toString() {
        return "Property[" + getValue() + "]@" + Integer.toHexString(hashCode());
    }
}
