package de.panbytes.rxproperty.internal;

import de.panbytes.rxproperty.PropertyContractViolation;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Holds the latest value seen by a property.
 * <p>
 * Reads and writes are guarded by the instance's monitor, so a reader never observes a partially written state.
 *
 * @param <T> the value's type.
 */
public final class CurrentValueCache<T> {

    private T value;

    /**
     * Stores a new value. It is visible to {@link #read()} as soon as this method returns.
     *
     * @param value the value, which may not be {@code null}.
     * @throws NullPointerException if value is {@code null}.
     */
    public synchronized void write(T value) {
        this.value = checkNotNull(value, "Value may not be null!");
    }

    /**
     * Returns the latest value.
     *
     * @return the latest value.
     * @throws PropertyContractViolation if no value has been written yet.
     */
    public synchronized T read() {
        if (this.value == null) {
            throw new PropertyContractViolation("Current value has been read before any value was written.");
        }
        return this.value;
    }

    public synchronized boolean isPopulated() {
        return this.value != null;
    }

    @Override
    public synchronized String toString() {
        return "CurrentValueCache[" + this.value + "]";
    }
}
