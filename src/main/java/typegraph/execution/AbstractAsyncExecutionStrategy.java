package typegraph.execution;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.function.Tuple2;
import typegraph.ExecutionResult;
import typegraph.ExecutionResultImpl;
import typegraph.execution.instrumentation.InstrumentationContext;
import typegraph.language.Field;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public abstract class AbstractAsyncExecutionStrategy extends ExecutionStrategy {

    public AbstractAsyncExecutionStrategy(DataFetcherExceptionHandler dataFetcherExceptionHandler) {
        super(dataFetcherExceptionHandler);
    }

    public AbstractAsyncExecutionStrategy(DataFetcherExceptionHandler dataFetcherExceptionHandler, Scheduler fetchScheduler) {
        super(dataFetcherExceptionHandler, fetchScheduler);
    }

    protected List<Map.Entry<String, List<Field>>> fieldEntries(ExecutionStrategyParameters parameters) {
        return new ArrayList<>(parameters.getFields().entrySet());
    }

    protected ExecutionStrategyParameters fieldParameters(ExecutionStrategyParameters parameters, List<Field> currentField) {
        ExecutionPath fieldPath = parameters.getPath().segment(mkNameForPath(currentField));
        return parameters.transform(builder -> builder.field(currentField).path(fieldPath).parent(parameters));
    }

    /**
     * Assembles the completed fields into the result map. The map keeps the order of the selection, whatever the
     * order the fields completed in, and null values.
     *
     * @param executionResultsByField the completed fields in selection order
     * @param executionContext        contains the top level execution parameters
     * @param executionStrategyCtx    the instrumentation context of this strategy call
     *
     * @return a promise to the result of the selection set
     */
    protected Mono<ExecutionResult> handleResults(Flux<Tuple2<String, ExecutionResult>> executionResultsByField,
                                                  ExecutionContext executionContext,
                                                  InstrumentationContext<ExecutionResult> executionStrategyCtx) {
        return executionResultsByField
                .collectList()
                .<ExecutionResult>map(results -> {
                    Map<String, Object> resolvedValuesByField = new LinkedHashMap<>();
                    for (Tuple2<String, ExecutionResult> result : results) {
                        resolvedValuesByField.put(result.getT1(), result.getT2().getData());
                    }
                    return new ExecutionResultImpl(resolvedValuesByField, null);
                })
                .transform(executionStrategyCtx::instrument);
    }
}
