package de.panbytes.rxproperty.internal;

import io.reactivex.Observable;
import io.reactivex.disposables.Disposable;
import io.reactivex.disposables.SerialDisposable;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Fans out the values of a single upstream subscription to any number of observers.
 * <p>
 * The upstream subscription is reference counted. It is held by the owner (the property handle, until
 * {@link #releaseOwner()} is called) and by every observer attached to {@link #observable()}. When the last of them
 * lets go, the upstream subscription is disposed. A released distributor is not restarted: observers attaching
 * afterwards receive nothing further.
 *
 * @param <T> the value's type.
 */
public final class MulticastDistributor<T> {

    private static final Logger log = LoggerFactory.getLogger(MulticastDistributor.class);

    private final Subject<T> subject = PublishSubject.<T>create().toSerialized();
    private final SerialDisposable upstream = new SerialDisposable();
    private final AtomicInteger references = new AtomicInteger(1);
    private final AtomicBoolean ownerAttached = new AtomicBoolean(true);
    private final Observable<T> observable;

    public MulticastDistributor() {
        this.observable = this.subject.doOnSubscribe(disposable -> this.references.incrementAndGet())
                                      .doFinally(this::release);
    }

    /**
     * Hands the upstream subscription over to this distributor.
     *
     * @param upstream the upstream subscription.
     * @throws IllegalStateException if an upstream has been attached before.
     */
    public void attachUpstream(Disposable upstream) {
        checkNotNull(upstream, "Upstream may not be null!");
        checkState(this.upstream.get() == null, "Upstream has been attached already!");
        this.upstream.set(upstream);
    }

    public void publish(T value) {
        this.subject.onNext(value);
    }

    public void complete() {
        this.subject.onComplete();
    }

    /**
     * Returns the stream of all values published after subscription. Each subscription holds a reference on the
     * upstream subscription until it is disposed or terminated.
     *
     * @return the shared stream.
     */
    public Observable<T> observable() {
        return this.observable;
    }

    /**
     * Drops the owner's reference. Calling this more than once has no further effect.
     */
    public void releaseOwner() {
        if (this.ownerAttached.compareAndSet(true, false)) {
            log.trace("Owner of {} has been released.", this);
            release();
        }
    }

    public int observerCount() {
        return this.references.get() - (this.ownerAttached.get() ? 1 : 0);
    }

    public boolean isReleased() {
        return this.upstream.isDisposed();
    }

    private void release() {
        if (this.references.decrementAndGet() == 0 && !this.upstream.isDisposed()) {
            log.trace("Last reference to {} is gone, releasing upstream subscription.", this);
            this.upstream.dispose();
        }
    }
}
