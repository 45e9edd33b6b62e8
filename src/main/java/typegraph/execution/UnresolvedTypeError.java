package typegraph.execution;

import typegraph.ErrorType;
import typegraph.GraphQLError;
import typegraph.GraphqlErrorHelper;
import typegraph.PublicApi;
import typegraph.language.SourceLocation;

import java.util.List;

import static java.lang.String.format;

@PublicApi
public class UnresolvedTypeError implements GraphQLError {

    private final String message;
    private final List<Object> path;
    private final UnresolvedTypeException exception;

    public UnresolvedTypeError(ExecutionPath path, UnresolvedTypeException exception) {
        this.path = path.toList();
        this.exception = exception;
        this.message = format("Can't resolve '%s'. Abstract type '%s' must resolve to an Object type at runtime. %s",
                path, exception.getAbstractType().getName(), exception.getMessage());
    }

    public UnresolvedTypeException getException() {
        return exception;
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
        return ErrorType.AbstractResolutionError;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public String toString() {
        return "UnresolvedTypeError{" +
                "path=" + path +
                ", exception=" + exception +
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
