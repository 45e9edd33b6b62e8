package typegraph.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import typegraph.PublicApi;
import typegraph.introspection.Introspection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertShouldNeverHappen;
import static typegraph.Assert.assertTrue;

/**
 * The registry of every named type reachable from the operation root types, any additional types and the
 * introspection types.
 * <p>
 * A schema is immutable once built and can be shared by any number of concurrent executions. Building it walks the
 * type graph once, binds every name to exactly one definition, checks that every {@link GraphQLTypeReference} names a
 * defined type and that objects and unions honour the contracts of their interfaces and members.
 */
@PublicApi
public class GraphQLSchema {

    private static final Logger log = LoggerFactory.getLogger(GraphQLSchema.class);

    private final GraphQLObjectType queryType;
    private final GraphQLObjectType mutationType;
    private final GraphQLObjectType subscriptionType;
    private final Map<String, GraphQLType> typeMap;
    private final Map<String, List<GraphQLObjectType>> implementationsByInterface;

    private GraphQLSchema(GraphQLObjectType queryType, GraphQLObjectType mutationType, GraphQLObjectType subscriptionType, Map<String, GraphQLType> typeMap) {
        this.queryType = queryType;
        this.mutationType = mutationType;
        this.subscriptionType = subscriptionType;
        this.typeMap = Collections.unmodifiableMap(new LinkedHashMap<>(typeMap));
        this.implementationsByInterface = buildImplementationsMap(typeMap);
    }

    private static Map<String, List<GraphQLObjectType>> buildImplementationsMap(Map<String, GraphQLType> typeMap) {
        Map<String, List<GraphQLObjectType>> result = new LinkedHashMap<>();
        for (GraphQLType type : typeMap.values()) {
            if (!(type instanceof GraphQLObjectType)) {
                continue;
            }
            GraphQLObjectType objectType = (GraphQLObjectType) type;
            for (GraphQLOutputType interfaceType : objectType.getInterfaces()) {
                result.computeIfAbsent(interfaceType.getName(), k -> new ArrayList<>()).add(objectType);
            }
        }
        return result;
    }

    public GraphQLObjectType getQueryType() {
        return queryType;
    }

    public GraphQLObjectType getMutationType() {
        return mutationType;
    }

    public GraphQLObjectType getSubscriptionType() {
        return subscriptionType;
    }

    public boolean isSupportingMutations() {
        return mutationType != null;
    }

    public boolean isSupportingSubscriptions() {
        return subscriptionType != null;
    }

    /**
     * @param typeName the name of the type
     *
     * @return the single definition bound to this name, or null if the schema has no such type
     */
    public GraphQLType getType(String typeName) {
        return typeMap.get(typeName);
    }

    /**
     * @param typeName the name of the type
     *
     * @return the object type bound to this name, or null if the schema has no such type
     *
     * @throws typegraph.AssertException if the name is bound to a type that is not an object type
     */
    public GraphQLObjectType getObjectType(String typeName) {
        GraphQLType type = typeMap.get(typeName);
        if (type == null) {
            return null;
        }
        assertTrue(type instanceof GraphQLObjectType, String.format("You have asked for named object type '%s' but its not an object type but rather a '%s'", typeName, type.getClass().getName()));
        return (GraphQLObjectType) type;
    }

    public Map<String, GraphQLType> getTypeMap() {
        return typeMap;
    }

    public List<GraphQLType> getAllTypesAsList() {
        return new ArrayList<>(typeMap.values());
    }

    /**
     * Replaces a {@link GraphQLTypeReference} by the type it names. Any other type, wrappers included, is returned as is.
     *
     * @param type the type to resolve
     * @param <T>  the expected kind of type
     *
     * @return the concrete type
     */
    @SuppressWarnings("unchecked")
    public <T extends GraphQLType> T resolve(GraphQLType type) {
        if (type instanceof GraphQLTypeReference) {
            return (T) assertNotNull(typeMap.get(type.getName()), String.format("Type '%s' is referenced but is not defined", type.getName()));
        }
        return (T) type;
    }

    /**
     * @param interfaceType the interface
     *
     * An interface does not list its implementations, so they come in the order the registry discovered them: the
     * depth first walk from the query, mutation and subscription types, then the additional types in the order they
     * were added. This order is stable for a given schema, and it is the order {@code isTypeOf} is asked in when
     * resolving the interface.
     *
     * @return the object types declaring the interface, in discovery order
     */
    public List<GraphQLObjectType> getImplementations(GraphQLInterfaceType interfaceType) {
        List<GraphQLObjectType> implementations = implementationsByInterface.get(interfaceType.getName());
        return implementations == null ? Collections.emptyList() : Collections.unmodifiableList(implementations);
    }

    /**
     * @param abstractType an interface or a union
     *
     * @return the implementations of an interface in discovery order (see {@link #getImplementations}) or the
     * members of a union in declaration order
     */
    public List<GraphQLObjectType> getPossibleTypes(GraphQLType abstractType) {
        GraphQLType type = resolve(abstractType);
        if (type instanceof GraphQLInterfaceType) {
            return getImplementations((GraphQLInterfaceType) type);
        }
        if (type instanceof GraphQLUnionType) {
            List<GraphQLObjectType> members = new ArrayList<>();
            for (GraphQLOutputType member : ((GraphQLUnionType) type).getTypes()) {
                GraphQLType resolved = resolve(member);
                if (resolved instanceof GraphQLObjectType) {
                    members.add((GraphQLObjectType) resolved);
                }
            }
            return members;
        }
        return assertShouldNeverHappen(String.format("Type '%s' is not an abstract type", type.getName()));
    }

    public boolean isPossibleType(GraphQLType abstractType, GraphQLObjectType concreteType) {
        for (GraphQLObjectType possibleType : getPossibleTypes(abstractType)) {
            if (possibleType.getName().equals(concreteType.getName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Visits every type reachable from the root types and the additional types once, following type references
     *
     * @param visitor the visitor to call
     */
    public void traverse(TypeVisitor visitor) {
        new SchemaTraverser(this::getType).traverse(typeMap.values(), visitor);
    }

    public static Builder newSchema() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private GraphQLObjectType queryType;
        private GraphQLObjectType mutationType;
        private GraphQLObjectType subscriptionType;
        private final Set<GraphQLType> additionalTypes = new LinkedHashSet<>();

        public Builder query(GraphQLObjectType.Builder builder) {
            return query(builder.build());
        }

        public Builder query(GraphQLObjectType queryType) {
            this.queryType = queryType;
            return this;
        }

        public Builder mutation(GraphQLObjectType.Builder builder) {
            return mutation(builder.build());
        }

        public Builder mutation(GraphQLObjectType mutationType) {
            this.mutationType = mutationType;
            return this;
        }

        public Builder subscription(GraphQLObjectType.Builder builder) {
            return subscription(builder.build());
        }

        public Builder subscription(GraphQLObjectType subscriptionType) {
            this.subscriptionType = subscriptionType;
            return this;
        }

        /**
         * Adds a type that is not reachable from the root types, typically an implementation of an interface that
         * is only ever named by a type reference
         *
         * @param type the type to add
         *
         * @return this builder
         */
        public Builder additionalType(GraphQLType type) {
            this.additionalTypes.add(type);
            return this;
        }

        public Builder additionalTypes(Collection<? extends GraphQLType> types) {
            this.additionalTypes.addAll(types);
            return this;
        }

        /**
         * @return the built schema
         *
         * @throws SchemaBuildException if a name is bound to different definitions, a reference names no type or a
         *                              type breaks the contract of an interface or union
         */
        public GraphQLSchema build() {
            if (queryType == null) {
                throw new SchemaBuildException(Collections.singletonList("A schema must define a query type"));
            }
            List<GraphQLType> roots = new ArrayList<>();
            roots.add(queryType);
            if (mutationType != null) {
                roots.add(mutationType);
            }
            if (subscriptionType != null) {
                roots.add(subscriptionType);
            }
            roots.addAll(additionalTypes);
            roots.addAll(Introspection.getIntrospectionTypes());

            SchemaTypeCollector collector = new SchemaTypeCollector();
            Map<String, GraphQLType> typeMap = collector.collect(roots);
            if (!collector.getProblems().isEmpty()) {
                throw new SchemaBuildException(collector.getProblems());
            }

            GraphQLSchema schema = new GraphQLSchema(queryType, mutationType, subscriptionType, typeMap);
            List<String> problems = new SchemaValidator(schema).validate();
            if (!problems.isEmpty()) {
                throw new SchemaBuildException(problems);
            }
            log.debug("Built schema with {} types", typeMap.size());
            return schema;
        }
    }
}
