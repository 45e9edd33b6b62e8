package typegraph.language;

import typegraph.PublicApi;

import java.math.BigDecimal;
import java.util.Objects;

@PublicApi
public class FloatValue implements Value {

    private final BigDecimal value;

    public FloatValue(BigDecimal value) {
        this.value = value;
    }

    public FloatValue(double value) {
        this(BigDecimal.valueOf(value));
    }

    public BigDecimal getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FloatValue && Objects.equals(value, ((FloatValue) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "FloatValue{value=" + value + '}';
    }
}
