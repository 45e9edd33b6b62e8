package typegraph.execution;

import typegraph.ErrorType;
import typegraph.GraphQLError;
import typegraph.GraphQLException;
import typegraph.PublicApi;
import typegraph.language.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * This is thrown if the schema has no root type for the kind of operation requested, for example a mutation
 * against a schema without a mutation type
 */
@PublicApi
public class MissingRootTypeException extends GraphQLException implements GraphQLError {

    private final List<SourceLocation> sourceLocations;

    public MissingRootTypeException(String message, SourceLocation sourceLocation) {
        super(message);
        this.sourceLocations = sourceLocation == null ? null : Collections.singletonList(sourceLocation);
    }

    @Override
    public List<SourceLocation> getLocations() {
        return sourceLocations;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.OperationNotSupported;
    }
}
