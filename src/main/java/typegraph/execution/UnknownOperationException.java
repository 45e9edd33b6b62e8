package typegraph.execution;

import typegraph.ErrorType;
import typegraph.GraphQLError;
import typegraph.GraphQLException;
import typegraph.PublicApi;
import typegraph.language.SourceLocation;

import java.util.List;

/**
 * The operation to execute can't be determined: the requested name is not in the document, or no name was given
 * and the document holds more or less than one operation.
 */
@PublicApi
public class UnknownOperationException extends GraphQLException implements GraphQLError {

    public UnknownOperationException(String message) {
        super(message);
    }

    @Override
    public List<SourceLocation> getLocations() {
        return null;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.OperationNotSupported;
    }
}
