package typegraph.execution;

import typegraph.Internal;

/**
 * The value a data fetcher produced for a field, before completion. Reactive streams can't carry nulls, so this
 * holder is what travels from fetching to completion.
 */
@Internal
public class FetchedValue {

    private final Object rawFetchedValue;
    private final Object fetchedValue;

    public FetchedValue(Object rawFetchedValue, Object fetchedValue) {
        this.rawFetchedValue = rawFetchedValue;
        this.fetchedValue = fetchedValue;
    }

    public static FetchedValue nullValue() {
        return new FetchedValue(null, null);
    }

    /**
     * @return the value exactly as the data fetcher returned it
     */
    public Object getRawFetchedValue() {
        return rawFetchedValue;
    }

    /**
     * @return the value with any {@link DataFetcherResult} and {@link java.util.Optional} wrapping removed
     */
    public Object getFetchedValue() {
        return fetchedValue;
    }

    @Override
    public String toString() {
        return "FetchedValue{" +
                "rawFetchedValue=" + rawFetchedValue +
                ", fetchedValue=" + fetchedValue +
                '}';
    }
}
