package de.panbytes.rxproperty;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of a transformation which may fail: either a success carrying a value, or a failure carrying the error.
 * <p>
 * Properties derived by {@link Property#catchingLift(io.reactivex.ObservableTransformer)} carry failures as
 * values of this type instead of terminating.
 *
 * @param <T> the value's type.
 */
public abstract class Result<T> {

    private Result() {
    }

    /**
     * @throws NullPointerException if value is {@code null}.
     */
    public static <T> Result<T> success(T value) {
        return new Success<>(checkNotNull(value, "Value may not be null!"));
    }

    /**
     * @throws NullPointerException if error is {@code null}.
     */
    public static <T> Result<T> failure(Throwable error) {
        return new Failure<>(checkNotNull(error, "Error may not be null!"));
    }

    /**
     * Calls the callable and captures its outcome. A {@code null} return value is captured as failure.
     *
     * @param callable the computation.
     * @param <T>      the value's type.
     * @return the captured outcome.
     */
    public static <T> Result<T> of(Callable<? extends T> callable) {
        checkNotNull(callable, "Callable may not be null!");
        try {
            return success(callable.call());
        } catch (Exception e) {
            return failure(e);
        }
    }

    public abstract boolean isSuccess();

    public final boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the value of a success.
     *
     * @return the value.
     * @throws IllegalStateException if this is a failure; the failure's error is attached as cause.
     */
    public abstract T get();

    /**
     * Returns the error of a failure.
     *
     * @return the error.
     * @throws NoSuchElementException if this is a success.
     */
    public abstract Throwable getError();

    public abstract Optional<T> toOptional();

    public final T orElse(T other) {
        return toOptional().orElse(other);
    }

    public abstract <R> Result<R> map(Function<? super T, ? extends R> mapper);

    public abstract <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure);

    private static final class Success<T> extends Result<T> {

        private final T value;

        private Success(T value) {
            this.value = value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T get() {
            return this.value;
        }

        @Override
        public Throwable getError() {
            throw new NoSuchElementException("Success has no error: " + this);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.of(this.value);
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            checkNotNull(mapper, "Mapper may not be null!");
            return Result.of(() -> mapper.apply(this.value));
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure) {
            return onSuccess.apply(this.value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return new EqualsBuilder().append(this.value, ((Success<?>) o).value).isEquals();
        }

        @Override
        public int hashCode() {
            return new HashCodeBuilder(17, 37).append(this.value).toHashCode();
        }

        @Override
        public String toString() {
            return "Success[" + this.value + "]";
        }
    }

    private static final class Failure<T> extends Result<T> {

        private final Throwable error;

        private Failure(Throwable error) {
            this.error = error;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T get() {
            throw new IllegalStateException("Failure has no value!", this.error);
        }

        @Override
        public Throwable getError() {
            return this.error;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return Result.failure(this.error);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure) {
            return onFailure.apply(this.error);
        }

        // compares errors by identity
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return this.error == ((Failure<?>) o).error;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this.error);
        }

        @Override
        public String toString() {
            return "Failure[" + this.error + "]";
        }
    }
}
