package typegraph.execution;

import typegraph.ErrorType;
import typegraph.ExecutionResult;
import typegraph.ExecutionResultImpl;
import typegraph.GraphQLError;
import typegraph.GraphQLException;
import typegraph.PublicApi;
import typegraph.language.SourceLocation;

import java.util.List;

/**
 * This Exception indicates that the current execution should be aborted, for example when the execution deadline
 * passes. Nothing further is resolved and the result carries no data.
 */
@PublicApi
public class AbortExecutionException extends GraphQLException implements GraphQLError {

    public AbortExecutionException() {
        super("Execution aborted");
    }

    public AbortExecutionException(String message) {
        super(message);
    }

    public AbortExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public List<SourceLocation> getLocations() {
        return null;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.ExecutionAborted;
    }

    /**
     * @return an {@link ExecutionResult} with no data and this exception as its only error
     */
    public ExecutionResult toExecutionResult() {
        return new ExecutionResultImpl(this);
    }
}
