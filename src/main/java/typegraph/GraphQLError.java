package typegraph;

import typegraph.language.SourceLocation;

import java.util.List;
import java.util.Map;

/**
 * The interface describing a field-scoped or request level error that is reported in an {@link ExecutionResult}.
 * <p>
 * Every error carries the path of the result position it belongs to, so errors from concurrently executed
 * branches can always be told apart regardless of the order in which they were recorded.
 */
@PublicApi
public interface GraphQLError {

    /**
     * @return a description of the error intended for the developer as a guide to understand and correct the error
     */
    String getMessage();

    /**
     * @return the location(s) within the query document that are associated with the error
     */
    List<SourceLocation> getLocations();

    /**
     * @return an enum classifying this error
     */
    ErrorType getErrorType();

    /**
     * The path to the field where the error occurred, made of field names (or aliases) and list indices.
     *
     * @return the path in list format, or null when the error is not associated with a result position
     */
    default List<Object> getPath() {
        return null;
    }

    /**
     * @return a map of this error in the shape expected in the response
     */
    default Map<String, Object> toSpecification() {
        return GraphqlErrorHelper.toSpecification(this);
    }
}
