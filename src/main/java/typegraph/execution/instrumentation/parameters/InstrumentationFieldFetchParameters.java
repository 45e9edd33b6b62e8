package typegraph.execution.instrumentation.parameters;

import typegraph.PublicApi;
import typegraph.execution.ExecutionContext;
import typegraph.execution.ExecutionStrategyParameters;
import typegraph.execution.instrumentation.InstrumentationState;
import typegraph.schema.DataFetchingEnvironment;
import typegraph.schema.GraphQLFieldDefinition;

/**
 * Parameters sent to {@link typegraph.execution.instrumentation.Instrumentation} methods
 */
@PublicApi
public class InstrumentationFieldFetchParameters {
    private final ExecutionContext executionContext;
    private final GraphQLFieldDefinition fieldDef;
    private final DataFetchingEnvironment environment;
    private final ExecutionStrategyParameters executionStrategyParameters;

    public InstrumentationFieldFetchParameters(ExecutionContext executionContext, GraphQLFieldDefinition fieldDef, DataFetchingEnvironment environment, ExecutionStrategyParameters executionStrategyParameters) {
        this.executionContext = executionContext;
        this.fieldDef = fieldDef;
        this.environment = environment;
        this.executionStrategyParameters = executionStrategyParameters;
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public GraphQLFieldDefinition getField() {
        return fieldDef;
    }

    public DataFetchingEnvironment getEnvironment() {
        return environment;
    }

    public ExecutionStrategyParameters getExecutionStrategyParameters() {
        return executionStrategyParameters;
    }

    @SuppressWarnings("TypeParameterUnusedInFormals")
    public <T extends InstrumentationState> T getInstrumentationState() {
        //noinspection unchecked
        return (T) executionContext.getInstrumentationState();
    }
}
