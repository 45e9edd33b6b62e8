package typegraph.execution;

import typegraph.GraphQLError;
import typegraph.PublicApi;
import typegraph.execution.instrumentation.Instrumentation;
import typegraph.execution.instrumentation.InstrumentationState;
import typegraph.language.FragmentDefinition;
import typegraph.language.OperationDefinition;
import typegraph.schema.GraphQLSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static typegraph.Assert.assertNotNull;

/**
 * The state of one execution request. Everything apart from the error collection is fixed when the execution
 * starts; errors are accumulated here from every branch of the query, whichever thread completes them.
 */
@PublicApi
public class ExecutionContext {

    private final ExecutionId executionId;
    private final GraphQLSchema graphQLSchema;
    private final ExecutionStrategy queryStrategy;
    private final ExecutionStrategy mutationStrategy;
    private final ExecutionStrategy subscriptionStrategy;
    private final Instrumentation instrumentation;
    private final InstrumentationState instrumentationState;
    private final Map<String, FragmentDefinition> fragmentsByName;
    private final OperationDefinition operationDefinition;
    private final Map<String, Object> variables;
    private final Object root;
    private final Object context;
    private final ValuesResolver valuesResolver;
    private final ExecutionDeadline deadline;

    private final List<GraphQLError> errors = new ArrayList<>();
    private final Set<List<Object>> errorPaths = new HashSet<>();

    private ExecutionContext(Builder builder) {
        this.executionId = assertNotNull(builder.executionId, "executionId can't be null");
        this.graphQLSchema = assertNotNull(builder.graphQLSchema, "graphQLSchema can't be null");
        this.queryStrategy = builder.queryStrategy;
        this.mutationStrategy = builder.mutationStrategy;
        this.subscriptionStrategy = builder.subscriptionStrategy;
        this.instrumentation = assertNotNull(builder.instrumentation, "instrumentation can't be null");
        this.instrumentationState = builder.instrumentationState;
        this.fragmentsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fragmentsByName));
        this.operationDefinition = builder.operationDefinition;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.root = builder.root;
        this.context = builder.context;
        this.valuesResolver = assertNotNull(builder.valuesResolver, "valuesResolver can't be null");
        this.deadline = builder.deadline;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public GraphQLSchema getGraphQLSchema() {
        return graphQLSchema;
    }

    public ExecutionStrategy getQueryStrategy() {
        return queryStrategy;
    }

    public ExecutionStrategy getMutationStrategy() {
        return mutationStrategy;
    }

    public ExecutionStrategy getSubscriptionStrategy() {
        return subscriptionStrategy;
    }

    public Instrumentation getInstrumentation() {
        return instrumentation;
    }

    @SuppressWarnings("TypeParameterUnusedInFormals")
    public <T extends InstrumentationState> T getInstrumentationState() {
        //noinspection unchecked
        return (T) instrumentationState;
    }

    public Map<String, FragmentDefinition> getFragmentsByName() {
        return fragmentsByName;
    }

    public FragmentDefinition getFragment(String name) {
        return fragmentsByName.get(name);
    }

    public OperationDefinition getOperationDefinition() {
        return operationDefinition;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    @SuppressWarnings("unchecked")
    public <T> T getRoot() {
        return (T) root;
    }

    @SuppressWarnings("unchecked")
    public <T> T getContext() {
        return (T) context;
    }

    public ValuesResolver getValuesResolver() {
        return valuesResolver;
    }

    /**
     * @return the deadline after which unresolved fields fail, or null when the execution has none or when the
     * whole execution is aborted instead
     */
    public ExecutionDeadline getDeadline() {
        return deadline;
    }

    /**
     * Records an error. A null for a non null field is reported only once per path: if an error is already
     * known for the path of a {@link NonNullableFieldWasNullError} it is the cause of the null and the new error
     * is dropped.
     *
     * @param error the error to add
     */
    public void addError(GraphQLError error) {
        List<Object> path = error.getPath();
        synchronized (errors) {
            if (error instanceof NonNullableFieldWasNullError && path != null && errorPaths.contains(path)) {
                return;
            }
            errors.add(error);
            if (path != null) {
                errorPaths.add(path);
            }
        }
    }

    /**
     * @return a copy of the errors recorded so far
     */
    public List<GraphQLError> getErrors() {
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }

    public static Builder newExecutionContext() {
        return new Builder();
    }

    public static class Builder {
        private ExecutionId executionId;
        private GraphQLSchema graphQLSchema;
        private ExecutionStrategy queryStrategy;
        private ExecutionStrategy mutationStrategy;
        private ExecutionStrategy subscriptionStrategy;
        private Instrumentation instrumentation;
        private InstrumentationState instrumentationState;
        private Map<String, FragmentDefinition> fragmentsByName = Collections.emptyMap();
        private OperationDefinition operationDefinition;
        private Map<String, Object> variables = Collections.emptyMap();
        private Object root;
        private Object context;
        private ValuesResolver valuesResolver;
        private ExecutionDeadline deadline;

        public Builder executionId(ExecutionId executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder graphQLSchema(GraphQLSchema graphQLSchema) {
            this.graphQLSchema = graphQLSchema;
            return this;
        }

        public Builder queryStrategy(ExecutionStrategy queryStrategy) {
            this.queryStrategy = queryStrategy;
            return this;
        }

        public Builder mutationStrategy(ExecutionStrategy mutationStrategy) {
            this.mutationStrategy = mutationStrategy;
            return this;
        }

        public Builder subscriptionStrategy(ExecutionStrategy subscriptionStrategy) {
            this.subscriptionStrategy = subscriptionStrategy;
            return this;
        }

        public Builder instrumentation(Instrumentation instrumentation) {
            this.instrumentation = instrumentation;
            return this;
        }

        public Builder instrumentationState(InstrumentationState instrumentationState) {
            this.instrumentationState = instrumentationState;
            return this;
        }

        public Builder fragmentsByName(Map<String, FragmentDefinition> fragmentsByName) {
            this.fragmentsByName = fragmentsByName;
            return this;
        }

        public Builder operationDefinition(OperationDefinition operationDefinition) {
            this.operationDefinition = operationDefinition;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables;
            return this;
        }

        public Builder root(Object root) {
            this.root = root;
            return this;
        }

        public Builder context(Object context) {
            this.context = context;
            return this;
        }

        public Builder valuesResolver(ValuesResolver valuesResolver) {
            this.valuesResolver = valuesResolver;
            return this;
        }

        public Builder deadline(ExecutionDeadline deadline) {
            this.deadline = deadline;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
