package typegraph.schema;

import typegraph.PublicApi;
import typegraph.execution.ExecutionId;
import typegraph.execution.ExecutionStepInfo;
import typegraph.language.Field;
import typegraph.language.FragmentDefinition;

import java.util.List;
import java.util.Map;

/**
 * Everything a {@link DataFetcher} is given to produce the raw value of a field
 */
@PublicApi
public interface DataFetchingEnvironment {

    /**
     * @param <T> you decide what type it is
     *
     * @return the current value: the value of the parent field, or the root value for top level fields
     */
    <T> T getSource();

    /**
     * @return the coerced arguments of the field
     */
    Map<String, Object> getArguments();

    boolean containsArgument(String name);

    <T> T getArgument(String name);

    /**
     * @param <T> you decide what type it is
     *
     * @return the application context object passed in with the execution input
     */
    <T> T getContext();

    <T> T getRoot();

    GraphQLFieldDefinition getFieldDefinition();

    /**
     * @return the query fields sharing this response key, the first one being representative
     */
    List<Field> getFields();

    Field getField();

    GraphQLOutputType getFieldType();

    ExecutionStepInfo getExecutionStepInfo();

    GraphQLType getParentType();

    GraphQLSchema getGraphQLSchema();

    Map<String, FragmentDefinition> getFragmentsByName();

    ExecutionId getExecutionId();
}
