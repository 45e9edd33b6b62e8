package typegraph.execution;

import typegraph.Internal;

/**
 * This will check that a value is non null when the type definition says it must be and it will throw
 * {@link NonNullableFieldWasNullException} if this is not the case, having recorded the error.
 * <p>
 * See: http://facebook.github.io/graphql/#sec-Errors-and-Non-Nullability
 */
@Internal
public class NonNullableFieldValidator {

    private final ExecutionContext executionContext;
    private final ExecutionStepInfo executionStepInfo;

    public NonNullableFieldValidator(ExecutionContext executionContext, ExecutionStepInfo executionStepInfo) {
        this.executionContext = executionContext;
        this.executionStepInfo = executionStepInfo;
    }

    /**
     * Called to check that a value is non null if the type requires it to be non null
     *
     * @param path   the path to this place
     * @param result the result to check
     * @param <T>    the type of the result
     *
     * @return the result back
     *
     * @throws NonNullableFieldWasNullException if the value is null but the type requires it to be non null
     */
    public <T> T validate(ExecutionPath path, T result) throws NonNullableFieldWasNullException {
        if (result == null && executionStepInfo.isNonNullType()) {
            NonNullableFieldWasNullException nonNullException = new NonNullableFieldWasNullException(executionStepInfo, path);
            executionContext.addError(new NonNullableFieldWasNullError(nonNullException));
            throw nonNullException;
        }
        return result;
    }
}
