package typegraph.execution;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import typegraph.ExecutionResult;
import typegraph.execution.instrumentation.InstrumentationContext;
import typegraph.execution.instrumentation.parameters.InstrumentationExecutionStrategyParameters;

/**
 * The standard graphql execution strategy that runs fields asynchronously non-blocking.
 * <p>
 * All the fields of a selection set are started at once and their values land in the result in selection order.
 * A field that fails does not stop its siblings.
 */
public class AsyncExecutionStrategy extends AbstractAsyncExecutionStrategy {

    /**
     * The standard graphql execution strategy that runs fields asynchronously
     */
    public AsyncExecutionStrategy() {
        super(new SimpleDataFetcherExceptionHandler());
    }

    /**
     * Creates a execution strategy that uses the provided exception handler
     *
     * @param exceptionHandler the exception handler to use
     */
    public AsyncExecutionStrategy(DataFetcherExceptionHandler exceptionHandler) {
        super(exceptionHandler);
    }

    /**
     * Creates a execution strategy that uses the provided exception handler and invokes data fetchers on the
     * given scheduler
     *
     * @param exceptionHandler the exception handler to use
     * @param fetchScheduler   the scheduler to invoke data fetchers on
     */
    public AsyncExecutionStrategy(DataFetcherExceptionHandler exceptionHandler, Scheduler fetchScheduler) {
        super(exceptionHandler, fetchScheduler);
    }

    @Override
    public Mono<ExecutionResult> execute(ExecutionContext executionContext, ExecutionStrategyParameters parameters) {
        InstrumentationContext<ExecutionResult> executionStrategyCtx =
                executionContext.getInstrumentation()
                                .beginExecutionStrategy(
                                        new InstrumentationExecutionStrategyParameters(executionContext, parameters));

        return Async.each(fieldEntries(parameters), (index, e) -> {
                            String fieldName = e.getKey();
                            ExecutionStrategyParameters newParameters = fieldParameters(parameters, e.getValue());

                            return Mono.zip(Mono.just(fieldName), resolveField(executionContext, newParameters));
                        }
        )
                    .as(f -> handleResults(f, executionContext, executionStrategyCtx));
    }
}
