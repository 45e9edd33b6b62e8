package typegraph.schema;

import typegraph.PublicApi;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static typegraph.Assert.assertShouldNeverHappen;

/**
 * A depth first walk over the type graph.
 * <p>
 * Objects and interfaces yield the types of their fields and arguments, objects also yield their interfaces, unions
 * yield their members, input objects the types of their fields and list and non-null wrappers the type they wrap.
 * A visited set keyed by type identity makes sure every distinct type is visited exactly once, however many times it
 * is referenced, and that self-referential and mutually recursive graphs terminate.
 * <p>
 * When the traverser has a reference resolver, {@link GraphQLTypeReference}s are followed to the type they name.
 * Without one they are visited as leaves.
 */
@PublicApi
public class SchemaTraverser {

    private final Function<String, GraphQLType> referenceResolver;

    public SchemaTraverser() {
        this(null);
    }

    public SchemaTraverser(Function<String, GraphQLType> referenceResolver) {
        this.referenceResolver = referenceResolver;
    }

    public void traverse(Collection<? extends GraphQLType> roots, TypeVisitor visitor) {
        Set<GraphQLType> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<GraphQLType> stack = new ArrayDeque<>();
        pushAll(stack, new ArrayList<>(roots), visited);

        while (!stack.isEmpty()) {
            GraphQLType type = follow(stack.pop());
            if (type == null || !visited.add(type)) {
                continue;
            }
            visitor.visit(type);
            pushAll(stack, getChildren(type), visited);
        }
    }

    private GraphQLType follow(GraphQLType type) {
        if (type instanceof GraphQLTypeReference && referenceResolver != null) {
            return referenceResolver.apply(type.getName());
        }
        return type;
    }

    // pushed in reverse so children are visited in declaration order
    private static void pushAll(Deque<GraphQLType> stack, List<GraphQLType> types, Set<GraphQLType> visited) {
        for (int i = types.size() - 1; i >= 0; i--) {
            GraphQLType type = types.get(i);
            if (!visited.contains(type)) {
                stack.push(type);
            }
        }
    }

    /**
     * @param type the type to examine
     *
     * @return the types directly reachable from the given type
     */
    public List<GraphQLType> getChildren(GraphQLType type) {
        List<GraphQLType> children = new ArrayList<>();
        if (type instanceof GraphQLTypeReference) {
            return children;
        }
        switch (type.getKind()) {
            case OBJECT:
                GraphQLObjectType objectType = (GraphQLObjectType) type;
                addFieldTypes(children, objectType.getFieldDefinitions());
                children.addAll(objectType.getInterfaces());
                break;
            case INTERFACE:
                addFieldTypes(children, ((GraphQLInterfaceType) type).getFieldDefinitions());
                break;
            case UNION:
                children.addAll(((GraphQLUnionType) type).getTypes());
                break;
            case INPUT_OBJECT:
                for (GraphQLInputObjectField field : ((GraphQLInputObjectType) type).getFields()) {
                    children.add(field.getType());
                }
                break;
            case LIST:
            case NON_NULL:
                children.add(((GraphQLModifiedType) type).getWrappedType());
                break;
            case SCALAR:
            case ENUM:
                break;
            default:
                return assertShouldNeverHappen("unknown type kind " + type.getKind());
        }
        return children;
    }

    private static void addFieldTypes(List<GraphQLType> children, List<GraphQLFieldDefinition> fieldDefinitions) {
        for (GraphQLFieldDefinition fieldDefinition : fieldDefinitions) {
            children.add(fieldDefinition.getType());
            for (GraphQLArgument argument : fieldDefinition.getArguments()) {
                children.add(argument.getType());
            }
        }
    }
}
