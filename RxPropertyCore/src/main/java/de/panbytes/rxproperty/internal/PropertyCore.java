package de.panbytes.rxproperty.internal;

import de.panbytes.rxproperty.PropertyContractViolation;
import io.reactivex.Observable;
import io.reactivex.ObservableSource;
import io.reactivex.disposables.Disposable;
import io.reactivex.observers.DisposableObserver;
import io.reactivex.plugins.RxJavaPlugins;
import io.reactivex.subjects.UnicastSubject;
import java.lang.ref.Cleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The state behind a property: a {@link CurrentValueCache} and a {@link MulticastDistributor}, fed by one eager
 * subscription to a source which has to emit at least one value synchronously on subscription.
 * <p>
 * The core is the owner of that subscription. It is referenced by the property and by both streams it hands out, so
 * holding any of them keeps the subscription alive. Once the core has become unreachable, the subscription is released
 * as soon as no observer is attached anymore.
 *
 * @param <T> the value's type.
 */
public final class PropertyCore<T> {

    private static final Logger log = LoggerFactory.getLogger(PropertyCore.class);

    private static final Cleaner OWNER_CLEANER = Cleaner.create();

    private final CurrentValueCache<T> cache = new CurrentValueCache<>();
    private final MulticastDistributor<T> distributor = new MulticastDistributor<>();
    private final Delivery<T> delivery;
    private final Observable<T> valuesWithCurrent;
    private final Observable<T> valuesWithoutCurrent;

    /**
     * Subscribes to the source and absorbs all values it emits synchronously.
     *
     * @param source the source, which has to emit at least one value synchronously.
     * @throws PropertyContractViolation if the source did not emit a value during subscription.
     */
    public PropertyCore(ObservableSource<? extends T> source) {
        checkNotNull(source, "Source may not be null!");

        this.delivery = new Delivery<>(WeakHandle.of(this.cache), this.distributor);
        this.distributor.attachUpstream(this.delivery);
        source.subscribe(this.delivery);

        if (!this.cache.isPopulated()) {
            this.delivery.dispose();
            log.error("Source {} terminated or stayed silent without emitting a current value.", source);
            throw new PropertyContractViolation("The source promised to emit at least one value synchronously, but emitted none.",
                                                this.delivery.failure);
        }

        OWNER_CLEANER.register(this, this.distributor::releaseOwner);

        this.valuesWithCurrent = Observable.defer(this::attachWithCurrent);
        this.valuesWithoutCurrent = Observable.defer(this::attachWithoutCurrent);
    }

    public T read() {
        return this.cache.read();
    }

    /**
     * The current value followed by all subsequent values. Reading the current value and attaching to the distributor
     * happen as one step with respect to deliveries, so no value falls in between.
     */
    public Observable<T> valuesWithCurrent() {
        return this.valuesWithCurrent;
    }

    public Observable<T> valuesWithoutCurrent() {
        return this.valuesWithoutCurrent;
    }

    MulticastDistributor<T> distributor() {
        return this.distributor;
    }

    private Observable<T> attachWithCurrent() {
        UnicastSubject<T> subsequent = UnicastSubject.create();
        T current;
        Disposable attachment;
        synchronized (this.delivery) {
            current = this.cache.read();
            attachment = this.distributor.observable().subscribe(subsequent::onNext, subsequent::onError, subsequent::onComplete);
        }
        // values arriving while the current one is being handled are buffered by the subject
        return Observable.just(current).concatWith(subsequent).doFinally(attachment::dispose);
    }

    private Observable<T> attachWithoutCurrent() {
        return this.distributor.observable();
    }

    /**
     * Writes into the cache first, then forwards to the distributor, so that observers reading the current value
     * from within their callback see the value they were just handed.
     */
    private static final class Delivery<T> extends DisposableObserver<T> {

        private final WeakHandle<CurrentValueCache<T>> cache;
        private final MulticastDistributor<T> distributor;
        private volatile Throwable failure;

        Delivery(WeakHandle<CurrentValueCache<T>> cache, MulticastDistributor<T> distributor) {
            this.cache = cache;
            this.distributor = distributor;
        }

        @Override
        public synchronized void onNext(T value) {
            this.cache.ifAlive(currentValue -> currentValue.write(value));
            this.distributor.publish(value);
        }

        @Override
        public synchronized void onError(Throwable error) {
            // sources are supposed to never fail
            this.failure = error;
            boolean constructed = this.cache.get().map(CurrentValueCache::isPopulated).orElse(true);
            if (constructed) {
                log.error("Property source failed, completing the property instead.", error);
                RxJavaPlugins.onError(error);
            }
            this.distributor.complete();
        }

        @Override
        public synchronized void onComplete() {
            this.distributor.complete();
        }
    }
}
