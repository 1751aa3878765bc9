package de.panbytes.rxproperty.internal;

import java.lang.ref.WeakReference;
import java.util.Optional;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A non-owning reference: it can be asked whether its target is still alive, but it never keeps the target alive.
 *
 * @param <T> the target's type.
 */
public final class WeakHandle<T> {

    private final WeakReference<T> reference;

    private WeakHandle(T target) {
        this.reference = new WeakReference<>(target);
    }

    public static <T> WeakHandle<T> of(T target) {
        return new WeakHandle<>(checkNotNull(target, "Target may not be null!"));
    }

    public Optional<T> get() {
        return Optional.ofNullable(this.reference.get());
    }

    public boolean isAlive() {
        return this.reference.get() != null;
    }

    /**
     * Runs the action with the target, if it has not been collected yet.
     *
     * @return true, if the target was alive.
     */
    public boolean ifAlive(Consumer<? super T> action) {
        T target = this.reference.get();
        if (target == null) {
            return false;
        }
        action.accept(target);
        return true;
    }
}
