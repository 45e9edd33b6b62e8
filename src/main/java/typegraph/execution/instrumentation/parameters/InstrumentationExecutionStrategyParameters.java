package typegraph.execution.instrumentation.parameters;

import typegraph.PublicApi;
import typegraph.execution.ExecutionContext;
import typegraph.execution.ExecutionStrategyParameters;
import typegraph.execution.instrumentation.InstrumentationState;

/**
 * Parameters sent to {@link typegraph.execution.instrumentation.Instrumentation} methods
 */
@PublicApi
public class InstrumentationExecutionStrategyParameters {

    private final ExecutionContext executionContext;
    private final ExecutionStrategyParameters executionStrategyParameters;

    public InstrumentationExecutionStrategyParameters(ExecutionContext executionContext, ExecutionStrategyParameters executionStrategyParameters) {
        this.executionContext = executionContext;
        this.executionStrategyParameters = executionStrategyParameters;
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
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
