package typegraph.execution;

import reactor.core.publisher.Mono;
import typegraph.Internal;
import typegraph.TypeResolutionEnvironment;
import typegraph.language.Field;
import typegraph.schema.GraphQLInterfaceType;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLOutputType;
import typegraph.schema.GraphQLSchema;
import typegraph.schema.GraphQLUnionType;
import typegraph.schema.TypeResolver;

import java.util.Map;

/**
 * Determines the concrete object type of a value in an interface or union position.
 * <p>
 * An explicit {@link TypeResolver} on the abstract type is asked first and its answer must be one of the possible
 * types. Without one, the possible types are asked in order whether the value is theirs and the first that says yes
 * wins: union members in declaration order, interface implementations in the order of
 * {@link GraphQLSchema#getImplementations}. A resolver or predicate that throws fails the resolution like one that finds no type.
 */
@Internal
public class ResolveType {

    public Mono<GraphQLObjectType> resolveType(ExecutionContext executionContext,
                                               Field field,
                                               Object source,
                                               Map<String, Object> arguments,
                                               GraphQLOutputType fieldType) {
        if (fieldType instanceof GraphQLObjectType) {
            return Mono.just((GraphQLObjectType) fieldType);
        }
        TypeResolutionParameters resolutionParams = TypeResolutionParameters.newParameters()
                .abstractType(fieldType)
                .field(field)
                .value(source)
                .argumentValues(arguments)
                .context(executionContext.getContext())
                .schema(executionContext.getGraphQLSchema()).build();
        return Mono.fromCallable(() -> resolveAbstractType(resolutionParams));
    }

    public GraphQLObjectType resolveAbstractType(TypeResolutionParameters params) {
        GraphQLOutputType abstractType = params.getAbstractType();
        GraphQLSchema schema = params.getSchema();
        TypeResolver typeResolver = getTypeResolver(abstractType);
        if (typeResolver != null) {
            TypeResolutionEnvironment env = new TypeResolutionEnvironment(params.getValue(), params.getArgumentValues(), params.getField(), abstractType, schema, params.getContext());
            GraphQLObjectType result;
            try {
                result = typeResolver.getType(env);
            } catch (UnresolvedTypeException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new UnresolvedTypeException(abstractType, e);
            }
            if (result == null) {
                throw new UnresolvedTypeException(abstractType);
            }
            if (!schema.isPossibleType(abstractType, result)) {
                throw new UnresolvedTypeException(abstractType, result);
            }
            return schema.getObjectType(result.getName());
        }
        for (GraphQLObjectType possibleType : schema.getPossibleTypes(abstractType)) {
            if (isTypeOf(abstractType, possibleType, params.getValue())) {
                return possibleType;
            }
        }
        throw new UnresolvedTypeException(String.format("None of the possible types of '%s' recognises the value", abstractType.getName()), abstractType);
    }

    private static boolean isTypeOf(GraphQLOutputType abstractType, GraphQLObjectType possibleType, Object value) {
        try {
            return possibleType.isTypeOf(value);
        } catch (RuntimeException e) {
            throw new UnresolvedTypeException(abstractType, e);
        }
    }

    private static TypeResolver getTypeResolver(GraphQLOutputType abstractType) {
        if (abstractType instanceof GraphQLInterfaceType) {
            return ((GraphQLInterfaceType) abstractType).getTypeResolver();
        }
        if (abstractType instanceof GraphQLUnionType) {
            return ((GraphQLUnionType) abstractType).getTypeResolver();
        }
        return null;
    }
}
