package typegraph.execution;

import typegraph.ErrorType;
import typegraph.GraphQLError;
import typegraph.GraphqlErrorHelper;
import typegraph.PublicApi;
import typegraph.language.SourceLocation;
import typegraph.schema.GraphQLType;
import typegraph.schema.GraphQLTypeUtil;

import java.util.List;

import static java.lang.String.format;

/**
 * Recorded when a resolver returns a value that doesn't fit the declared shape, for example a single object
 * where a list is expected
 */
@PublicApi
public class TypeMismatchError implements GraphQLError {

    private final String message;
    private final List<Object> path;
    private final GraphQLType expectedType;

    public TypeMismatchError(ExecutionPath path, GraphQLType expectedType, Object actualValue) {
        this.path = path.toList();
        this.expectedType = expectedType;
        this.message = format("Can't resolve value (%s) : type mismatch error, expected type %s but got %s",
                path, GraphQLTypeUtil.simplePrint(expectedType), actualValue == null ? "null" : actualValue.getClass().getSimpleName());
    }

    public GraphQLType getExpectedType() {
        return expectedType;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public List<SourceLocation> getLocations() {
        return null;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.TypeMismatch;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public String toString() {
        return "TypeMismatchError{" +
                "path=" + path +
                ", expectedType=" + GraphQLTypeUtil.simplePrint(expectedType) +
                '}';
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
