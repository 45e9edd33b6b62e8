package typegraph.execution;

import typegraph.ErrorType;
import typegraph.GraphQLError;
import typegraph.GraphqlErrorHelper;
import typegraph.Internal;
import typegraph.language.Field;
import typegraph.language.SourceLocation;

import java.util.Collections;
import java.util.List;

import static typegraph.Assert.assertNotNull;

/**
 * A {@link GraphQLError} that has been changed from a {@link DataFetcherResult} relative error to an absolute one.
 */
@Internal
class AbsoluteGraphQLError implements GraphQLError {

    private final List<SourceLocation> locations;
    private final List<Object> absolutePath;
    private final String message;
    private final ErrorType errorType;

    AbsoluteGraphQLError(ExecutionStrategyParameters executionStrategyParameters, GraphQLError relativeError) {
        assertNotNull(executionStrategyParameters);
        assertNotNull(relativeError);
        this.absolutePath = createAbsolutePath(executionStrategyParameters, relativeError);
        this.locations = createAbsoluteLocations(relativeError, executionStrategyParameters.getField());
        this.message = relativeError.getMessage();
        this.errorType = relativeError.getErrorType() == null ? ErrorType.ResolverError : relativeError.getErrorType();
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public List<SourceLocation> getLocations() {
        return locations;
    }

    @Override
    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public List<Object> getPath() {
        return absolutePath;
    }

    /**
     * Creating absolute paths follows the following logic:
     * Relative path is null -> Absolute path is the field path
     * Relative path is empty -> Absolute path is the field path
     * Relative path is not empty -> Absolute path is the field path followed by the relative path
     */
    private List<Object> createAbsolutePath(ExecutionStrategyParameters executionStrategyParameters, GraphQLError relativeError) {
        ExecutionPath path = executionStrategyParameters.getPath();
        if (relativeError.getPath() == null) {
            return path.toList();
        }
        return path.append(relativeError.getPath()).toList();
    }

    /**
     * Creating absolute locations follows the following logic:
     * Relative locations is null -> Absolute locations is the field location
     * Relative locations is not null -> Absolute locations is the relative locations
     */
    private List<SourceLocation> createAbsoluteLocations(GraphQLError relativeError, List<Field> fields) {
        if (relativeError.getLocations() != null) {
            return relativeError.getLocations();
        }
        if (fields == null || fields.isEmpty() || fields.get(0).getSourceLocation() == null) {
            return null;
        }
        return Collections.singletonList(fields.get(0).getSourceLocation());
    }

    @Override
    public boolean equals(Object o) {
        return GraphqlErrorHelper.equals(this, o);
    }

    @Override
    public int hashCode() {
        return GraphqlErrorHelper.hashCode(this);
    }
}
