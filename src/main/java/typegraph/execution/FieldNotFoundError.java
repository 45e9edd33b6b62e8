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
 * Recorded when a selection names a field its parent type doesn't define. The response key is set to null.
 */
@PublicApi
public class FieldNotFoundError implements GraphQLError {

    private final String message;
    private final List<Object> path;
    private final List<SourceLocation> locations;

    public FieldNotFoundError(ExecutionPath path, Field field, String parentTypeName) {
        this.path = path.toList();
        this.locations = field.getSourceLocation() == null ? null : Collections.singletonList(field.getSourceLocation());
        this.message = format("Field '%s' is not defined on type '%s' (%s)", field.getName(), parentTypeName, path);
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
        return ErrorType.FieldNotFound;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public String toString() {
        return "FieldNotFoundError{" +
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
