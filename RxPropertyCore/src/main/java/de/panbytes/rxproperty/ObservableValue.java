package de.panbytes.rxproperty;

import io.reactivex.Observable;

/**
 * Something holding a current value, which can be mirrored by {@link Property#of(ObservableValue)}.
 *
 * @param <T> the value's type.
 */
public interface ObservableValue<T> {

    T getValue();

    /**
     * @return the current value, emitted synchronously on subscription, followed by every later value.
     */
    Observable<T> toObservable();
}
