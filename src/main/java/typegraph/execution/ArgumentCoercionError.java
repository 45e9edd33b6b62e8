package typegraph.execution;

import typegraph.ErrorType;
import typegraph.GraphQLError;
import typegraph.GraphqlErrorHelper;
import typegraph.PublicApi;
import typegraph.language.Field;
import typegraph.language.SourceLocation;

import java.util.Collections;
import java.util.List;

import static java.lang.String.format;

/**
 * Recorded for every argument value of a field that could not be coerced. The resolver of the field is not called
 * and the field becomes null.
 */
@PublicApi
public class ArgumentCoercionError implements GraphQLError {

    private final String message;
    private final List<Object> path;
    private final List<SourceLocation> locations;
    private final CoercionException exception;

    public ArgumentCoercionError(ExecutionPath path, Field field, CoercionException exception) {
        this.path = path.toList();
        this.exception = exception;
        this.locations = field.getSourceLocation() == null ? null : Collections.singletonList(field.getSourceLocation());
        this.message = format("Invalid argument value (%s) : %s", path, exception.getMessage());
    }

    public CoercionException getException() {
        return exception;
    }

    public List<Object> getInputPath() {
        return exception.getInputPath();
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
        return ErrorType.CoercionError;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public String toString() {
        return "ArgumentCoercionError{" +
                "path=" + path +
                ", message=" + message +
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
