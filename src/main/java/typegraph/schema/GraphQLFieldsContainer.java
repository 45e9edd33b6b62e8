package typegraph.schema;

import typegraph.PublicApi;

import java.util.List;

/**
 * Object and interface types, both of which declare output fields
 */
@PublicApi
public interface GraphQLFieldsContainer extends GraphQLOutputType {

    GraphQLFieldDefinition getFieldDefinition(String name);

    List<GraphQLFieldDefinition> getFieldDefinitions();
}
