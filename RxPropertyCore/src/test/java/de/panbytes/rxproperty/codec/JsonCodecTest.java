package de.panbytes.rxproperty.codec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.panbytes.rxproperty.Property;
import de.panbytes.rxproperty.Result;
import io.reactivex.subjects.PublishSubject;
import java.io.IOException;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecTest {

    private final JsonCodec<Point> codec = JsonCodec.forType(Point.class);

    @Test
    void shouldDecodeJson() throws IOException {
        assertThat(this.codec.decode("{\"x\":1,\"y\":2}")).isEqualTo(new Point(1, 2));
    }

    @Test
    void shouldEncodeJson() throws IOException {
        assertThat(this.codec.encode(new Point(3, 4))).isEqualTo("{\"x\":3,\"y\":4}");
    }

    @Test
    void shouldFailForMalformedJson() {
        assertThatThrownBy(() -> this.codec.decode("{\"x\":")).isInstanceOf(IOException.class);
    }

    @Test
    void shouldFailForJsonNull() {
        assertThatThrownBy(() -> this.codec.decode("null")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldDecodePropertyValues() {
        PublishSubject<String> json = PublishSubject.create();
        Property<Result<Point>> points = Property.of("{\"x\":0,\"y\":0}", json).decode(this.codec);

        assertThat(points.getValue()).isEqualTo(Result.success(new Point(0, 0)));

        json.onNext("garbage");
        assertThat(points.getValue().getError()).isInstanceOf(IOException.class);

        json.onNext("{\"x\":5,\"y\":6}");
        assertThat(points.getValue().get()).isEqualTo(new Point(5, 6));
    }

    @Test
    void shouldEncodePropertyValues() {
        Property<Result<String>> encoded = Property.constant(new Point(7, 8)).encode(this.codec);

        assertThat(encoded.getValue().get()).isEqualTo("{\"x\":7,\"y\":8}");
    }

    @JsonPropertyOrder({"x", "y"})
    public static final class Point {

        private final int x;
        private final int y;

        @JsonCreator
        public Point(@JsonProperty("x") int x, @JsonProperty("y") int y) {
            this.x = x;
            this.y = y;
        }

        public int getX() {
            return this.x;
        }

        public int getY() {
            return this.y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Point point = (Point) o;
            return new EqualsBuilder().append(this.x, point.x).append(this.y, point.y).isEquals();
        }

        @Override
        public int hashCode() {
            return new HashCodeBuilder(17, 37).append(this.x).append(this.y).toHashCode();
        }
    }
}
