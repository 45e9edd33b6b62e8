package typegraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import reactor.util.context.ContextView;
import typegraph.execution.AbortExecutionException;
import typegraph.execution.AsyncExecutionStrategy;
import typegraph.execution.AsyncSerialExecutionStrategy;
import typegraph.execution.Execution;
import typegraph.execution.ExecutionId;
import typegraph.execution.ExecutionIdProvider;
import typegraph.execution.ExecutionStrategy;
import typegraph.execution.UnknownInputFieldPolicy;
import typegraph.execution.instrumentation.Instrumentation;
import typegraph.execution.instrumentation.InstrumentationState;
import typegraph.execution.instrumentation.SimpleInstrumentation;
import typegraph.execution.instrumentation.parameters.InstrumentationExecutionParameters;
import typegraph.schema.GraphQLSchema;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import static typegraph.Assert.assertNotNull;
import static typegraph.execution.ExecutionIdProvider.DEFAULT_EXECUTION_ID_PROVIDER;

/**
 * This class is where all query execution begins.  It combines the objects that are needed
 * to make a successful query, with the most important being the {@link GraphQLSchema schema}
 * and the {@link ExecutionStrategy execution strategy}
 * <p>
 * Building this object is very cheap and can be done on each execution if necessary.  Building the schema is often not
 * as cheap, since the whole type graph is walked and checked.
 * <p>
 * The data for a query is returned via {@link ExecutionResult#getData()} and any errors encountered as placed in
 * {@link ExecutionResult#getErrors()}.
 *
 * <h2>Runtime Exceptions</h2>
 * <p>
 * Runtime exceptions can be thrown by the engine if certain situations are encountered.  These are not errors
 * in execution but rather totally unacceptable conditions in which to execute a query.
 * <ul>
 * <li>{@link typegraph.schema.SchemaBuildException} - is thrown if the schema is not valid when built via
 * {@link typegraph.schema.GraphQLSchema.Builder#build()}
 * </li>
 *
 * <li>{@link GraphQLException} - is thrown as a general purpose runtime exception, for example if the code cant
 * access a named field when examining a POJO.
 * </li>
 *
 * <li>{@link AssertException} - is thrown as a low level code assertion exception for truly unexpected code conditions
 * </li>
 *
 * </ul>
 */
@PublicApi
public class TypeGraph {

    private static final Logger log = LoggerFactory.getLogger(TypeGraph.class);

    private final GraphQLSchema graphQLSchema;
    private final ExecutionStrategy queryStrategy;
    private final ExecutionStrategy mutationStrategy;
    private final ExecutionStrategy subscriptionStrategy;
    private final ExecutionIdProvider idProvider;
    private final Instrumentation instrumentation;
    private final UnknownInputFieldPolicy unknownInputFieldPolicy;
    private final Execution execution;

    private TypeGraph(Builder builder) {
        this.graphQLSchema = assertNotNull(builder.graphQLSchema, "graphQLSchema must be non null");
        this.queryStrategy = builder.queryExecutionStrategy;
        this.mutationStrategy = builder.mutationExecutionStrategy;
        this.subscriptionStrategy = builder.subscriptionExecutionStrategy;
        this.idProvider = builder.idProvider;
        this.instrumentation = builder.instrumentation;
        this.unknownInputFieldPolicy = builder.unknownInputFieldPolicy;
        this.execution = new Execution(queryStrategy, mutationStrategy, subscriptionStrategy, instrumentation, unknownInputFieldPolicy);
    }

    /**
     * Helps you build a TypeGraph object ready to execute queries
     *
     * @param graphQLSchema the schema to use
     *
     * @return a builder of TypeGraph objects
     */
    public static Builder newTypeGraph(GraphQLSchema graphQLSchema) {
        return new Builder(graphQLSchema);
    }

    public GraphQLSchema getGraphQLSchema() {
        return graphQLSchema;
    }

    /**
     * This helps you transform the current TypeGraph object into another one by starting a builder with all
     * the current values and allows you to transform it how you want.
     *
     * @param builderConsumer the consumer code that will be given a builder to transform
     *
     * @return a new TypeGraph object based on calling build on that builder
     */
    public TypeGraph transform(Consumer<Builder> builderConsumer) {
        Builder builder = new Builder(graphQLSchema)
                .queryExecutionStrategy(queryStrategy)
                .mutationExecutionStrategy(mutationStrategy)
                .subscriptionExecutionStrategy(subscriptionStrategy)
                .executionIdProvider(idProvider)
                .instrumentation(instrumentation)
                .unknownInputFieldPolicy(unknownInputFieldPolicy);

        builderConsumer.accept(builder);

        return builder.build();
    }

    /**
     * Executes the query and blocks until the result is there
     *
     * @param executionInputBuilder {@link ExecutionInput.Builder}
     *
     * @return an {@link ExecutionResult} which can include errors
     */
    public ExecutionResult execute(ExecutionInput.Builder executionInputBuilder) {
        return execute(executionInputBuilder.build());
    }

    /**
     * Executes the query and blocks until the result is there. This allows a lambda style like :
     * <pre>
     * {@code
     *    ExecutionResult result = typeGraph.execute(input -> input.document(document).root(startingObj));
     * }
     * </pre>
     *
     * @param builderFunction a function that is given a {@link ExecutionInput.Builder}
     *
     * @return an {@link ExecutionResult} which can include errors
     */
    public ExecutionResult execute(UnaryOperator<ExecutionInput.Builder> builderFunction) {
        return execute(builderFunction.apply(ExecutionInput.newExecutionInput()).build());
    }

    /**
     * Executes the query and blocks until the result is there
     *
     * @param executionInput {@link ExecutionInput}
     *
     * @return an {@link ExecutionResult} which can include errors
     */
    public ExecutionResult execute(ExecutionInput executionInput) {
        return executeAsync(executionInput).block();
    }

    /**
     * Executes the query described by the {@link ExecutionInput}. Nothing happens until the returned mono is
     * subscribed to, and every subscription is an execution of its own.
     *
     * @param executionInput {@link ExecutionInput}
     *
     * @return a promise to an {@link ExecutionResult} which can include errors
     */
    public Mono<ExecutionResult> executeAsync(ExecutionInput executionInput) {
        return Mono.deferContextual(c -> Mono.just(new InstrumentationExecutionParameters(executionInput, graphQLSchema, instrumentationState(c))))
                   .doOnSubscribe(s -> log.debug("Executing request. operation name: '{}'. variables '{}'",
                                                 executionInput.getOperationName(),
                                                 executionInput.getVariables()))
                   .flatMap(p -> execute(p)
                           .flatMap(r -> instrumentation.instrumentExecutionResult(r, p))
                           .transform(instrumentation.beginExecution(p)::instrument))
                   .contextWrite(this::withNewInstrumentState)
                   .onErrorResume(AbortExecutionException.class, e -> Mono.just(e.toExecutionResult()));
    }

    private static InstrumentationState instrumentationState(ContextView c) {
        return c.getOrDefault(InstrumentationState.class, null);
    }

    private Context withNewInstrumentState(Context c) {
        InstrumentationState state = instrumentation.createState();
        return state == null ? c : c.put(InstrumentationState.class, state);
    }

    private Mono<ExecutionResult> execute(InstrumentationExecutionParameters parameters) {
        ExecutionInput executionInput = parameters.getExecutionInput();
        ExecutionId executionId = idProvider.provide(executionInput.getDocument(),
                                                     executionInput.getOperationName(),
                                                     executionInput.getContext());

        log.debug("Executing '{}'. operation name: '{}'. variables '{}'", executionId,
                  executionInput.getOperationName(), executionInput.getVariables());
        return execution
                .execute(executionInput.getDocument(), graphQLSchema, executionId, executionInput, parameters.getInstrumentationState())
                .doOnError(t -> log.error(
                        "Execution '{}' threw exception when executing : operation : '{}'. variables '{}'",
                        executionId, executionInput.getOperationName(), executionInput.getVariables(),
                        t))
                .doOnSuccess(result -> {
                    int errorCount = result.getErrors().size();
                    if (errorCount > 0) {
                        log.debug("Execution '{}' completed with '{}' errors", executionId, errorCount);
                    } else {
                        log.debug("Execution '{}' completed with zero errors", executionId);
                    }
                });
    }

    @PublicApi
    public static class Builder {
        private GraphQLSchema graphQLSchema;
        private ExecutionStrategy queryExecutionStrategy = new AsyncExecutionStrategy();
        private ExecutionStrategy mutationExecutionStrategy = new AsyncSerialExecutionStrategy();
        private ExecutionStrategy subscriptionExecutionStrategy = new AsyncExecutionStrategy();
        private ExecutionIdProvider idProvider = DEFAULT_EXECUTION_ID_PROVIDER;
        private Instrumentation instrumentation = SimpleInstrumentation.INSTANCE;
        private UnknownInputFieldPolicy unknownInputFieldPolicy = UnknownInputFieldPolicy.REJECT;

        public Builder(GraphQLSchema graphQLSchema) {
            this.graphQLSchema = graphQLSchema;
        }

        public Builder schema(GraphQLSchema graphQLSchema) {
            this.graphQLSchema = assertNotNull(graphQLSchema, "GraphQLSchema must be non null");
            return this;
        }

        public Builder queryExecutionStrategy(ExecutionStrategy executionStrategy) {
            this.queryExecutionStrategy = assertNotNull(executionStrategy, "Query ExecutionStrategy must be non null");
            return this;
        }

        public Builder mutationExecutionStrategy(ExecutionStrategy executionStrategy) {
            this.mutationExecutionStrategy = assertNotNull(executionStrategy, "Mutation ExecutionStrategy must be non null");
            return this;
        }

        public Builder subscriptionExecutionStrategy(ExecutionStrategy executionStrategy) {
            this.subscriptionExecutionStrategy = assertNotNull(executionStrategy, "Subscription ExecutionStrategy must be non null");
            return this;
        }

        public Builder instrumentation(Instrumentation instrumentation) {
            this.instrumentation = assertNotNull(instrumentation, "Instrumentation must be non null");
            return this;
        }

        public Builder executionIdProvider(ExecutionIdProvider executionIdProvider) {
            this.idProvider = assertNotNull(executionIdProvider, "ExecutionIdProvider must be non null");
            return this;
        }

        /**
         * Decides what happens to input object keys that the input type does not declare
         *
         * @param unknownInputFieldPolicy the policy, {@link UnknownInputFieldPolicy#REJECT} by default
         *
         * @return this builder
         */
        public Builder unknownInputFieldPolicy(UnknownInputFieldPolicy unknownInputFieldPolicy) {
            this.unknownInputFieldPolicy = assertNotNull(unknownInputFieldPolicy, "UnknownInputFieldPolicy must be non null");
            return this;
        }

        public TypeGraph build() {
            assertNotNull(graphQLSchema, "graphQLSchema must be non null");
            return new TypeGraph(this);
        }
    }
}
