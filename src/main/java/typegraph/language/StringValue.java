package typegraph.language;

import typegraph.PublicApi;

import java.util.Objects;

@PublicApi
public class StringValue implements Value {

    private final String value;

    public StringValue(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringValue && Objects.equals(value, ((StringValue) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "StringValue{value='" + value + "'}";
    }
}
