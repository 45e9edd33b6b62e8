package typegraph;

import java.util.List;
import java.util.Map;

/**
 * This simple value class represents the result of performing a query execution
 */
@PublicApi
public interface ExecutionResult {

    /**
     * @return the errors that occurred during execution or empty list if there is none
     */
    List<GraphQLError> getErrors();

    /**
     * @param <T> allows type coercion
     *
     * @return the data in the result or null if there is none
     */
    <T> T getData();

    /**
     * The result is rendered as a map with a "data" entry and an "errors" entry, the latter present even
     * when empty.
     *
     * @return a map of the result
     */
    Map<String, Object> toSpecification();
}
