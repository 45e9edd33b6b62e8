package typegraph.language;

import typegraph.PublicApi;

@PublicApi
public class BooleanValue implements Value {

    private final boolean value;

    public BooleanValue(boolean value) {
        this.value = value;
    }

    public boolean isValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BooleanValue && value == ((BooleanValue) o).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return "BooleanValue{value=" + value + '}';
    }
}
