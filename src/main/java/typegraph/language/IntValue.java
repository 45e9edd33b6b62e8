package typegraph.language;

import typegraph.PublicApi;

import java.math.BigInteger;
import java.util.Objects;

@PublicApi
public class IntValue implements Value {

    private final BigInteger value;

    public IntValue(BigInteger value) {
        this.value = value;
    }

    public IntValue(long value) {
        this(BigInteger.valueOf(value));
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntValue && Objects.equals(value, ((IntValue) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "IntValue{value=" + value + '}';
    }
}
