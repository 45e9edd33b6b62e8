package typegraph.language;

import typegraph.PublicApi;

@PublicApi
public class NullValue implements Value {

    public static final NullValue Null = new NullValue();

    private NullValue() {
    }

    @Override
    public String toString() {
        return "NullValue";
    }
}
