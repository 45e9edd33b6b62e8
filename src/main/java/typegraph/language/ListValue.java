package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@PublicApi
public class ListValue implements Value {

    private final List<Value> values;

    public ListValue(List<Value> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ListValue of(Value... values) {
        return new ListValue(Arrays.asList(values));
    }

    public List<Value> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "ListValue{values=" + values + '}';
    }
}
