package typegraph;

import typegraph.language.Document;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertTrue;

/**
 * This represents the series of values that can be input on a graphql query execution: the parsed query document,
 * the operation to run, the variables, the root and context objects handed to data fetchers and the time limit.
 */
@PublicApi
public class ExecutionInput {
    private final Document document;
    private final String operationName;
    private final Object context;
    private final Object root;
    private final Map<String, Object> variables;
    private final Duration timeout;
    private final boolean partialResults;

    private ExecutionInput(Builder builder) {
        this.document = assertNotNull(builder.document, "document can't be null");
        this.operationName = builder.operationName;
        this.context = builder.context;
        this.root = builder.root;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.timeout = builder.timeout;
        this.partialResults = builder.partialResults;
    }

    /**
     * @return the parsed and validated query document
     */
    public Document getDocument() {
        return document;
    }

    /**
     * @return the name of the operation to execute, null when the document holds a single operation
     */
    public String getOperationName() {
        return operationName;
    }

    /**
     * @return the context object to pass to all data fetchers
     */
    public Object getContext() {
        return context;
    }

    /**
     * @return the root object to start the query execution on
     */
    public Object getRoot() {
        return root;
    }

    /**
     * @return the raw variables, coerced lazily where they are used
     */
    public Map<String, Object> getVariables() {
        return variables;
    }

    /**
     * @return how long the execution may take, null for no limit
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * @return true if the fields resolved before the timeout should be delivered instead of aborting the whole execution
     */
    public boolean isPartialResults() {
        return partialResults;
    }

    /**
     * This helps you transform the current ExecutionInput object into another one by starting a builder with all
     * the current values and allows you to transform it how you want.
     *
     * @param builderConsumer the consumer code that will be given a builder to transform
     *
     * @return a new ExecutionInput object based on calling build on that builder
     */
    public ExecutionInput transform(Consumer<Builder> builderConsumer) {
        Builder builder = new Builder()
                .document(this.document)
                .operationName(this.operationName)
                .context(this.context)
                .root(this.root)
                .variables(this.variables)
                .timeout(this.timeout)
                .partialResults(this.partialResults);

        builderConsumer.accept(builder);

        return builder.build();
    }

    @Override
    public String toString() {
        return "ExecutionInput{" +
                "operationName='" + operationName + '\'' +
                ", variables=" + variables +
                ", timeout=" + timeout +
                ", partialResults=" + partialResults +
                '}';
    }

    /**
     * @return a new builder of ExecutionInput objects
     */
    public static Builder newExecutionInput() {
        return new Builder();
    }

    /**
     * Creates a new builder of ExecutionInput objects with the given document
     *
     * @param document the query document
     *
     * @return a new builder of ExecutionInput objects
     */
    public static Builder newExecutionInput(Document document) {
        return new Builder().document(document);
    }

    public static class Builder {

        private Document document;
        private String operationName;
        private Object context;
        private Object root;
        private Map<String, Object> variables = Collections.emptyMap();
        private Duration timeout;
        private boolean partialResults;

        public Builder document(Document document) {
            this.document = document;
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder context(Object context) {
            this.context = context;
            return this;
        }

        public Builder root(Object root) {
            this.root = root;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = assertNotNull(variables, "variables map can't be null");
            return this;
        }

        public Builder timeout(Duration timeout) {
            assertTrue(timeout == null || !timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
            this.timeout = timeout;
            return this;
        }

        public Builder partialResults(boolean partialResults) {
            this.partialResults = partialResults;
            return this;
        }

        public ExecutionInput build() {
            return new ExecutionInput(this);
        }
    }
}
