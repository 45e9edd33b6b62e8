package typegraph.execution;

import typegraph.GraphQLException;
import typegraph.schema.GraphQLTypeUtil;

import static typegraph.Assert.assertNotNull;

/**
 * This is the exception that's thrown when a non null field resolves to null. It travels up the result tree until
 * it reaches a position that may be null, which then becomes null, or the root, which makes the whole data null.
 */
public class NonNullableFieldWasNullException extends GraphQLException {

    private final ExecutionStepInfo executionStepInfo;
    private final ExecutionPath path;

    public NonNullableFieldWasNullException(ExecutionStepInfo executionStepInfo, ExecutionPath path) {
        super(mkMessage(assertNotNull(executionStepInfo), assertNotNull(path)));
        this.executionStepInfo = executionStepInfo;
        this.path = path;
    }

    private static String mkMessage(ExecutionStepInfo executionStepInfo, ExecutionPath path) {
        ExecutionStepInfo parent = executionStepInfo.getParent();
        if (parent == null || parent.getFieldDefinition() == null) {
            return String.format("Cannot return null for non-nullable type: '%s' (%s)",
                    GraphQLTypeUtil.simplePrint(executionStepInfo.getUnwrappedNonNullType()), path);
        }
        return String.format("Cannot return null for non-nullable type: '%s' within parent '%s' (%s)",
                GraphQLTypeUtil.simplePrint(executionStepInfo.getUnwrappedNonNullType()),
                GraphQLTypeUtil.simplePrint(GraphQLTypeUtil.unwrapAll(parent.getType())), path);
    }

    public ExecutionStepInfo getExecutionStepInfo() {
        return executionStepInfo;
    }

    public ExecutionPath getPath() {
        return path;
    }

    @Override
    public String toString() {
        return "NonNullableFieldWasNullException{" +
                " path=" + path +
                " executionStepInfo=" + executionStepInfo +
                '}';
    }
}
