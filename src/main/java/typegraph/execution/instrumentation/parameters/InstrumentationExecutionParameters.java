package typegraph.execution.instrumentation.parameters;

import typegraph.ExecutionInput;
import typegraph.PublicApi;
import typegraph.execution.instrumentation.InstrumentationState;
import typegraph.schema.GraphQLSchema;

/**
 * Parameters sent to {@link typegraph.execution.instrumentation.Instrumentation} methods
 */
@PublicApi
public class InstrumentationExecutionParameters {
    private final ExecutionInput executionInput;
    private final GraphQLSchema schema;
    private final InstrumentationState instrumentationState;

    public InstrumentationExecutionParameters(ExecutionInput executionInput, GraphQLSchema schema, InstrumentationState instrumentationState) {
        this.executionInput = executionInput;
        this.schema = schema;
        this.instrumentationState = instrumentationState;
    }

    public ExecutionInput getExecutionInput() {
        return executionInput;
    }

    public String getOperation() {
        return executionInput.getOperationName();
    }

    public GraphQLSchema getSchema() {
        return schema;
    }

    @SuppressWarnings("TypeParameterUnusedInFormals")
    public <T extends InstrumentationState> T getInstrumentationState() {
        //noinspection unchecked
        return (T) instrumentationState;
    }
}
