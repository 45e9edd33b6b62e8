package typegraph.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import typegraph.ExecutionInput;
import typegraph.ExecutionResult;
import typegraph.ExecutionResultImpl;
import typegraph.Internal;
import typegraph.execution.instrumentation.Instrumentation;
import typegraph.execution.instrumentation.InstrumentationState;
import typegraph.language.Document;
import typegraph.language.Field;
import typegraph.language.OperationDefinition;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLSchema;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static typegraph.execution.ExecutionContext.newExecutionContext;
import static typegraph.execution.ExecutionStepInfo.newExecutionStepInfo;
import static typegraph.execution.FieldCollectorParameters.newParameters;

/**
 * Runs one operation of a document: it picks the operation and its root type, applies the variable defaults,
 * hands the top level fields to the strategy of the operation and turns a null that reached the root into a
 * result without data. It also enforces the time limit of the execution.
 */
@Internal
public class Execution {
    private static final Logger log = LoggerFactory.getLogger(Execution.class);

    private final FieldCollector fieldCollector = new FieldCollector();
    private final ExecutionStrategy queryStrategy;
    private final ExecutionStrategy mutationStrategy;
    private final ExecutionStrategy subscriptionStrategy;
    private final Instrumentation instrumentation;
    private final UnknownInputFieldPolicy unknownInputFieldPolicy;

    public Execution(ExecutionStrategy queryStrategy, ExecutionStrategy mutationStrategy, ExecutionStrategy subscriptionStrategy, Instrumentation instrumentation, UnknownInputFieldPolicy unknownInputFieldPolicy) {
        this.queryStrategy = queryStrategy != null ? queryStrategy : new AsyncExecutionStrategy();
        this.mutationStrategy = mutationStrategy != null ? mutationStrategy : new AsyncSerialExecutionStrategy();
        this.subscriptionStrategy = subscriptionStrategy != null ? subscriptionStrategy : new AsyncExecutionStrategy();
        this.instrumentation = instrumentation;
        this.unknownInputFieldPolicy = unknownInputFieldPolicy;
    }

    public Mono<ExecutionResult> execute(Document document, GraphQLSchema graphQLSchema, ExecutionId executionId, ExecutionInput executionInput, InstrumentationState instrumentationState) {
        return Mono.defer(() -> {
            OperationDefinition operationDefinition = getOperation(document, executionInput.getOperationName());

            ValuesResolver valuesResolver = new ValuesResolver(graphQLSchema, unknownInputFieldPolicy);
            Map<String, Object> variables = valuesResolver.applyVariableDefaults(operationDefinition.getVariableDefinitions(),
                                                                                 executionInput.getVariables());

            Duration timeout = executionInput.getTimeout();
            ExecutionDeadline deadline = null;
            if (timeout != null && executionInput.isPartialResults()) {
                deadline = new ExecutionDeadline(timeout, Schedulers.parallel());
            }

            ExecutionContext executionContext = newExecutionContext()
                    .executionId(executionId)
                    .graphQLSchema(graphQLSchema)
                    .queryStrategy(queryStrategy)
                    .mutationStrategy(mutationStrategy)
                    .subscriptionStrategy(subscriptionStrategy)
                    .instrumentation(instrumentation)
                    .instrumentationState(instrumentationState)
                    .fragmentsByName(document.getFragmentsByName())
                    .operationDefinition(operationDefinition)
                    .variables(variables)
                    .root(executionInput.getRoot())
                    .context(executionInput.getContext())
                    .valuesResolver(valuesResolver)
                    .deadline(deadline)
                    .build();

            Mono<ExecutionResult> result = executeOperation(executionContext, operationDefinition);
            if (deadline != null) {
                ExecutionDeadline executionDeadline = deadline;
                return result.doFinally(signal -> executionDeadline.cancel());
            }
            if (timeout != null) {
                return result.timeout(timeout)
                             .onErrorResume(TimeoutException.class, e -> {
                                 log.warn("Execution '{}' aborted after {}ms", executionId, timeout.toMillis());
                                 return Mono.just(new AbortExecutionException("Execution aborted: the time limit of " + timeout.toMillis() + "ms was exceeded", e).toExecutionResult());
                             });
            }
            return result;
        }).onErrorResume(UnknownOperationException.class, e -> Mono.just(new ExecutionResultImpl(e)));
    }

    private Mono<ExecutionResult> executeOperation(ExecutionContext executionContext, OperationDefinition operationDefinition) {
        GraphQLObjectType operationRootType;
        try {
            operationRootType = getOperationRootType(executionContext.getGraphQLSchema(), operationDefinition);
        } catch (MissingRootTypeException e) {
            log.warn(e.getMessage());
            return Mono.just(new ExecutionResultImpl(e));
        }

        FieldCollectorParameters collectorParameters = newParameters()
                .schema(executionContext.getGraphQLSchema())
                .objectType(operationRootType)
                .fragments(executionContext.getFragmentsByName())
                .variables(executionContext.getVariables())
                .valuesResolver(executionContext.getValuesResolver())
                .build();

        Map<String, List<Field>> fields = fieldCollector.collectFields(collectorParameters, operationDefinition.getSelectionSet());

        ExecutionPath path = ExecutionPath.rootPath();
        ExecutionStepInfo executionStepInfo = newExecutionStepInfo().type(operationRootType).path(path).build();

        ExecutionStrategyParameters parameters = ExecutionStrategyParameters.newParameters()
                .executionStepInfo(executionStepInfo)
                .source(executionContext.getRoot())
                .fields(fields)
                .path(path)
                .build();

        OperationDefinition.Operation operation = operationDefinition.getOperation();
        ExecutionStrategy executionStrategy;
        if (operation == OperationDefinition.Operation.MUTATION) {
            executionStrategy = executionContext.getMutationStrategy();
        } else if (operation == OperationDefinition.Operation.SUBSCRIPTION) {
            executionStrategy = executionContext.getSubscriptionStrategy();
        } else {
            executionStrategy = executionContext.getQueryStrategy();
        }
        log.debug("Executing '{}' {} operation: '{}' using '{}' execution strategy", executionContext.getExecutionId(), operation,
                  operationDefinition.getName(), executionStrategy.getClass().getName());

        return executionStrategy.execute(executionContext, parameters)
                                // a null reached the root: there is no data, only errors
                                .onErrorResume(NonNullableFieldWasNullException.class, e -> {
                                    log.debug("'{}' null at non null '{}' reached the root", executionContext.getExecutionId(), e.getPath());
                                    return Mono.just(new ExecutionResultImpl(null, null));
                                })
                                .map(result -> new ExecutionResultImpl(result.getData(), executionContext.getErrors()));
    }

    private static OperationDefinition getOperation(Document document, String operationName) {
        List<OperationDefinition> operations = document.getOperations();
        if (operationName == null) {
            if (operations.size() != 1) {
                throw new UnknownOperationException("Must provide operation name if query contains " + (operations.isEmpty() ? "no" : "multiple") + " operations.");
            }
            return operations.get(0);
        }
        for (OperationDefinition operation : operations) {
            if (operationName.equals(operation.getName())) {
                return operation;
            }
        }
        throw new UnknownOperationException(String.format("Unknown operation named '%s'.", operationName));
    }

    private static GraphQLObjectType getOperationRootType(GraphQLSchema graphQLSchema, OperationDefinition operationDefinition) {
        OperationDefinition.Operation operation = operationDefinition.getOperation();
        if (operation == OperationDefinition.Operation.MUTATION) {
            GraphQLObjectType mutationType = graphQLSchema.getMutationType();
            if (mutationType == null) {
                throw new MissingRootTypeException("Schema is not configured for mutations.", operationDefinition.getSourceLocation());
            }
            return mutationType;
        } else if (operation == OperationDefinition.Operation.SUBSCRIPTION) {
            GraphQLObjectType subscriptionType = graphQLSchema.getSubscriptionType();
            if (subscriptionType == null) {
                throw new MissingRootTypeException("Schema is not configured for subscriptions.", operationDefinition.getSourceLocation());
            }
            return subscriptionType;
        }
        return graphQLSchema.getQueryType();
    }
}
