package typegraph.execution;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import typegraph.ExecutionResult;
import typegraph.execution.instrumentation.InstrumentationContext;
import typegraph.execution.instrumentation.parameters.InstrumentationExecutionStrategyParameters;

/**
 * Async non-blocking execution, but serial: only one field at the the time will be resolved.
 * See {@link AsyncExecutionStrategy} for a non serial (parallel) execution of every field.
 * <p>
 * This is the strategy of mutations: a top level field, and everything below it, is complete before the next
 * top level field is fetched. The selection sets below the top level fields run with the query strategy.
 */
public class AsyncSerialExecutionStrategy extends AbstractAsyncExecutionStrategy {

    public AsyncSerialExecutionStrategy() {
        super(new SimpleDataFetcherExceptionHandler());
    }

    public AsyncSerialExecutionStrategy(DataFetcherExceptionHandler exceptionHandler) {
        super(exceptionHandler);
    }

    public AsyncSerialExecutionStrategy(DataFetcherExceptionHandler exceptionHandler, Scheduler fetchScheduler) {
        super(exceptionHandler, fetchScheduler);
    }

    @Override
    public Mono<ExecutionResult> execute(ExecutionContext executionContext, ExecutionStrategyParameters parameters) {

        InstrumentationContext<ExecutionResult> executionStrategyCtx =
                executionContext.getInstrumentation()
                                .beginExecutionStrategy(
                                        new InstrumentationExecutionStrategyParameters(executionContext, parameters));

        return Async.eachSequentially(fieldEntries(parameters), (index, e) -> {
                                          String fieldName = e.getKey();
                                          ExecutionStrategyParameters newParameters = fieldParameters(parameters, e.getValue());

                                          return Mono.zip(Mono.just(fieldName), resolveField(executionContext, newParameters));
                                      }
        )
                    .as(f -> handleResults(f, executionContext, executionStrategyCtx));
    }

}
