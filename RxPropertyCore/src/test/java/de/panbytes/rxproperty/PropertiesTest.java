package de.panbytes.rxproperty;

import com.google.common.collect.ImmutableList;
import io.reactivex.subjects.PublishSubject;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesTest {

    @Test
    void shouldNegate() {
        PublishSubject<Boolean> subject = PublishSubject.create();
        Property<Boolean> negated = Properties.negate(Property.of(true, subject));

        assertThat(negated.getValue()).isFalse();
        subject.onNext(false);
        assertThat(negated.getValue()).isTrue();
    }

    @Test
    void shouldCombineWithAndOr() {
        PublishSubject<Boolean> subject = PublishSubject.create();
        Property<Boolean> changing = Property.of(false, subject);
        Property<Boolean> yes = Property.constant(true);

        Property<Boolean> and = Properties.and(changing, yes);
        Property<Boolean> or = Properties.or(changing, Property.constant(false));

        assertThat(and.getValue()).isFalse();
        assertThat(or.getValue()).isFalse();

        subject.onNext(true);

        assertThat(and.getValue()).isTrue();
        assertThat(or.getValue()).isTrue();
    }

    @Test
    void shouldFoldAllAndAny() {
        PublishSubject<Boolean> subject = PublishSubject.create();
        List<Property<Boolean>> properties = Arrays.asList(Property.constant(true), Property.of(false, subject), Property.constant(true));

        Property<Boolean> all = Properties.all(properties);
        Property<Boolean> any = Properties.any(properties);

        assertThat(all.getValue()).isFalse();
        assertThat(any.getValue()).isTrue();

        subject.onNext(true);
        assertThat(all.getValue()).isTrue();
    }

    @Test
    void shouldUseIdentityForNoProperties() {
        List<Property<Boolean>> none = Collections.emptyList();

        assertThat(Properties.all(none).getValue()).isTrue();
        assertThat(Properties.any(none).getValue()).isFalse();
        assertThat(Properties.all(none, false).getValue()).isFalse();
        assertThat(Properties.any(none, true).getValue()).isTrue();
    }

    @Test
    void shouldCombineLatestOfAllProperties() {
        PublishSubject<Integer> subject = PublishSubject.create();
        Property<List<Integer>> combined = Properties.combineLatest(
            Arrays.asList(Property.constant(1), Property.of(2, subject), Property.constant(3)));

        assertThat(combined.getValue()).containsExactly(1, 2, 3);
        subject.onNext(20);
        assertThat(combined.getValue()).containsExactly(1, 20, 3);
    }

    @Test
    void shouldZipAllProperties() {
        PublishSubject<String> first = PublishSubject.create();
        PublishSubject<String> second = PublishSubject.create();
        Property<List<String>> zipped = Properties.zip(ImmutableList.of(Property.of("a", first), Property.of("b", second)));

        assertThat(zipped.getValue()).containsExactly("a", "b");
        first.onNext("c");
        assertThat(zipped.getValue()).containsExactly("a", "b");
        second.onNext("d");
        assertThat(zipped.getValue()).containsExactly("c", "d");
    }

    @Test
    void shouldHoldEmptyListForNoProperties() {
        Property<List<String>> combined = Properties.combineLatest(Collections.<Property<String>>emptyList());

        assertThat(combined.getValue()).isEmpty();
        assertThat(Properties.<String>zip(Collections.emptyList()).getValue()).isEmpty();
    }
}
