package de.panbytes.rxproperty.internal;

import de.panbytes.rxproperty.PropertyContractViolation;
import io.reactivex.Observable;
import io.reactivex.observers.TestObserver;
import io.reactivex.plugins.RxJavaPlugins;
import io.reactivex.subjects.PublishSubject;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyCoreTest {

    @AfterEach
    void resetPlugins() {
        RxJavaPlugins.reset();
    }

    @Test
    void shouldAbsorbSynchronousValuesDuringConstruction() {
        PropertyCore<Integer> core = new PropertyCore<>(Observable.just(1, 2, 3));

        assertThat(core.read()).isEqualTo(3);
    }

    @Test
    void shouldFailForSourceWithoutValue() {
        assertThatThrownBy(() -> new PropertyCore<>(Observable.<Integer>empty())).isInstanceOf(PropertyContractViolation.class);
    }

    @Test
    void shouldFailForFailingSourceAndKeepCause() {
        IllegalStateException cause = new IllegalStateException("broken source");

        assertThatThrownBy(() -> new PropertyCore<>(Observable.<Integer>error(cause))).isInstanceOf(PropertyContractViolation.class)
                                                                                      .hasCause(cause);
    }

    @Test
    void shouldDisposeSubscriptionOfSilentSource() {
        PublishSubject<Integer> silent = PublishSubject.create();

        assertThatThrownBy(() -> new PropertyCore<>(silent)).isInstanceOf(PropertyContractViolation.class);
        assertThat(silent.hasObservers()).isFalse();
    }

    @Test
    void shouldReplayCurrentValueAndForwardSubsequentValues() {
        PublishSubject<Integer> subject = PublishSubject.create();
        PropertyCore<Integer> core = new PropertyCore<>(subject.startWith(0));

        TestObserver<Integer> withCurrent = core.valuesWithCurrent().test();
        TestObserver<Integer> withoutCurrent = core.valuesWithoutCurrent().test();
        subject.onNext(1);

        withCurrent.assertValues(0, 1);
        withoutCurrent.assertValues(1);
    }

    @Test
    void shouldWriteCacheBeforeForwarding() {
        PublishSubject<Integer> subject = PublishSubject.create();
        PropertyCore<Integer> core = new PropertyCore<>(subject.startWith(0));
        List<Integer> seenFromCallback = new ArrayList<>();

        core.valuesWithoutCurrent().subscribe(value -> seenFromCallback.add(core.read()));
        subject.onNext(1);
        subject.onNext(2);

        assertThat(seenFromCallback).containsExactly(1, 2);
    }

    @Test
    void shouldCountObservers() {
        PublishSubject<Integer> subject = PublishSubject.create();
        PropertyCore<Integer> core = new PropertyCore<>(subject.startWith(0));

        TestObserver<Integer> first = core.valuesWithCurrent().test();
        TestObserver<Integer> second = core.valuesWithoutCurrent().test();
        assertThat(core.distributor().observerCount()).isEqualTo(2);

        first.dispose();
        second.dispose();
        assertThat(core.distributor().observerCount()).isZero();
        assertThat(core.distributor().isReleased()).isFalse();
        assertThat(subject.hasObservers()).isTrue();
    }

    @Test
    void shouldReportSourceFailureAfterConstructionAndComplete() {
        List<Throwable> reported = new CopyOnWriteArrayList<>();
        RxJavaPlugins.setErrorHandler(reported::add);
        PublishSubject<Integer> subject = PublishSubject.create();
        PropertyCore<Integer> core = new PropertyCore<>(subject.startWith(0));
        TestObserver<Integer> observer = core.valuesWithCurrent().test();
        IllegalStateException failure = new IllegalStateException("late failure");

        subject.onError(failure);

        assertThat(reported).containsExactly(failure);
        observer.assertValues(0).assertNoErrors().assertComplete();
        assertThat(core.read()).isZero();
    }
}
