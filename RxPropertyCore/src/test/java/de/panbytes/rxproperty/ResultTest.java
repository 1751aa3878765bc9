package de.panbytes.rxproperty;

import java.io.IOException;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    @Test
    void shouldCarryValueOfSuccess() {
        Result<String> result = Result.success("value");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get()).isEqualTo("value");
        assertThat(result.toOptional()).contains("value");
        assertThat(result.orElse("other")).isEqualTo("value");
        assertThatThrownBy(result::getError).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldCarryErrorOfFailure() {
        IOException error = new IOException("unreadable");
        Result<String> result = Result.failure(error);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getError()).isSameAs(error);
        assertThat(result.toOptional()).isEmpty();
        assertThat(result.orElse("other")).isEqualTo("other");
        assertThatThrownBy(result::get).isInstanceOf(IllegalStateException.class).hasCause(error);
    }

    @Test
    void shouldCaptureOutcomeOfCallable() {
        assertThat(Result.of(() -> 42)).isEqualTo(Result.success(42));

        Result<Integer> failed = Result.of(() -> Integer.parseInt("x"));
        assertThat(failed.getError()).isInstanceOf(NumberFormatException.class);

        assertThat(Result.<String>of(() -> null).getError()).isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldMapSuccessAndKeepFailure() {
        IllegalArgumentException error = new IllegalArgumentException();

        assertThat(Result.success(2).map(value -> value * 3)).isEqualTo(Result.success(6));
        assertThat(Result.<Integer>failure(error).map(value -> value * 3)).isEqualTo(Result.failure(error));
        assertThat(Result.success("a").map(value -> {
            throw new IllegalStateException("mapping failed");
        }).isFailure()).isTrue();
    }

    @Test
    void shouldFold() {
        assertThat(Result.success(2).<String>fold(value -> "value " + value, error -> "error")).isEqualTo("value 2");
        assertThat(Result.<Integer>failure(new IOException()).<String>fold(value -> "value " + value, error -> "error")).isEqualTo("error");
    }

    @Test
    void shouldCompareFailuresByErrorIdentity() {
        assertThat(Result.failure(new IOException("same"))).isNotEqualTo(Result.failure(new IOException("same")));
        assertThat(Result.success(1)).hasSameHashCodeAs(Result.success(1));
    }
}
