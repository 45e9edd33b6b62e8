package typegraph.execution;

import typegraph.GraphQLError;
import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static typegraph.Assert.assertNotNull;

/**
 * An object that can be returned from a {@link typegraph.schema.DataFetcher} that contains both data and errors to
 * be added to the final result. The paths of these errors are relative to the field being fetched, the engine makes
 * them absolute before it records them.
 *
 * @param <T> The type of the data fetched
 */
@PublicApi
public class DataFetcherResult<T> {

    private final T data;
    private final List<GraphQLError> errors;

    public DataFetcherResult(T data, List<GraphQLError> errors) {
        this.data = data;
        this.errors = Collections.unmodifiableList(new ArrayList<>(assertNotNull(errors)));
    }

    /**
     * @return The data fetched. May be null
     */
    public T getData() {
        return data;
    }

    /**
     * @return errors encountered when fetching data.  May be empty but never null.
     */
    public List<GraphQLError> getErrors() {
        return errors;
    }
}
