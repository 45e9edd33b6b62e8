package typegraph.introspection;

import typegraph.Internal;
import typegraph.PublicApi;
import typegraph.schema.DataFetcher;
import typegraph.schema.Directives;
import typegraph.schema.GraphQLArgument;
import typegraph.schema.GraphQLDirective;
import typegraph.schema.GraphQLEnumType;
import typegraph.schema.GraphQLEnumValueDefinition;
import typegraph.schema.GraphQLFieldDefinition;
import typegraph.schema.GraphQLFieldsContainer;
import typegraph.schema.GraphQLInputObjectField;
import typegraph.schema.GraphQLInputObjectType;
import typegraph.schema.GraphQLInputType;
import typegraph.schema.GraphQLInterfaceType;
import typegraph.schema.GraphQLList;
import typegraph.schema.GraphQLModifiedType;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLOutputType;
import typegraph.schema.GraphQLScalarType;
import typegraph.schema.GraphQLSchema;
import typegraph.schema.GraphQLType;
import typegraph.schema.GraphQLTypeUtil;
import typegraph.schema.GraphQLUnionType;
import typegraph.schema.TypeKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static typegraph.schema.GraphQLArgument.newArgument;
import static typegraph.schema.GraphQLFieldDefinition.newFieldDefinition;
import static typegraph.schema.GraphQLList.list;
import static typegraph.schema.GraphQLNonNull.nonNull;
import static typegraph.schema.GraphQLObjectType.newObject;
import static typegraph.schema.GraphQLTypeReference.typeRef;
import static typegraph.schema.Scalars.GraphQLBoolean;
import static typegraph.schema.Scalars.GraphQLString;

/**
 * The introspection types. They are ordinary object and enum types, registered in every schema, whose resolvers
 * read the schema itself. Type references met on the way are resolved through the schema before they are exposed.
 */
@PublicApi
public class Introspection {

    public static final GraphQLEnumType __TypeKind = GraphQLEnumType.newEnum()
            .name("__TypeKind")
            .description("An enum describing what kind of type a given __Type is")
            .value("SCALAR", TypeKind.SCALAR, "Indicates this type is a scalar.")
            .value("OBJECT", TypeKind.OBJECT, "Indicates this type is an object. `fields` and `interfaces` are valid fields.")
            .value("INTERFACE", TypeKind.INTERFACE, "Indicates this type is an interface. `fields` and `possibleTypes` are valid fields.")
            .value("UNION", TypeKind.UNION, "Indicates this type is a union. `possibleTypes` is a valid field.")
            .value("ENUM", TypeKind.ENUM, "Indicates this type is an enum. `enumValues` is a valid field.")
            .value("INPUT_OBJECT", TypeKind.INPUT_OBJECT, "Indicates this type is an input object. `inputFields` is a valid field.")
            .value("LIST", TypeKind.LIST, "Indicates this type is a list. `ofType` is a valid field.")
            .value("NON_NULL", TypeKind.NON_NULL, "Indicates this type is a non-null. `ofType` is a valid field.")
            .build();

    public static final GraphQLEnumType __DirectiveLocation = GraphQLEnumType.newEnum()
            .name("__DirectiveLocation")
            .description("An enum describing valid locations where a directive can be placed")
            .value("QUERY", "QUERY", "Indicates the directive is valid on queries.")
            .value("MUTATION", "MUTATION", "Indicates the directive is valid on mutations.")
            .value("SUBSCRIPTION", "SUBSCRIPTION", "Indicates the directive is valid on subscriptions.")
            .value("FIELD", "FIELD", "Indicates the directive is valid on fields.")
            .value("FRAGMENT_DEFINITION", "FRAGMENT_DEFINITION", "Indicates the directive is valid on fragment definitions.")
            .value("FRAGMENT_SPREAD", "FRAGMENT_SPREAD", "Indicates the directive is valid on fragment spreads.")
            .value("INLINE_FRAGMENT", "INLINE_FRAGMENT", "Indicates the directive is valid on inline fragments.")
            .build();

    private static final DataFetcher<Object> inputValueTypeFetcher = environment -> {
        Object source = environment.getSource();
        GraphQLType type = source instanceof GraphQLArgument ? ((GraphQLArgument) source).getType() : ((GraphQLInputObjectField) source).getType();
        return environment.getGraphQLSchema().resolve(type);
    };

    private static final DataFetcher<Object> defaultValueFetcher = environment -> {
        Object source = environment.getSource();
        if (source instanceof GraphQLArgument) {
            GraphQLArgument argument = (GraphQLArgument) source;
            return argument.hasDefaultValue() ? printDefaultValue(argument.getDefaultValue(), argument.getType(), environment.getGraphQLSchema()) : null;
        }
        if (source instanceof GraphQLInputObjectField) {
            GraphQLInputObjectField field = (GraphQLInputObjectField) source;
            return field.hasDefaultValue() ? printDefaultValue(field.getDefaultValue(), field.getType(), environment.getGraphQLSchema()) : null;
        }
        return null;
    };

    public static final GraphQLObjectType __InputValue = newObject()
            .name("__InputValue")
            .field(newFieldDefinition()
                    .name("name")
                    .type(nonNull(GraphQLString)))
            .field(newFieldDefinition()
                    .name("description")
                    .type(GraphQLString))
            .field(newFieldDefinition()
                    .name("type")
                    .type(nonNull(typeRef("__Type")))
                    .dataFetcher(inputValueTypeFetcher))
            .field(newFieldDefinition()
                    .name("defaultValue")
                    .type(GraphQLString)
                    .dataFetcher(defaultValueFetcher))
            .build();

    public static final GraphQLObjectType __Field = newObject()
            .name("__Field")
            .field(newFieldDefinition()
                    .name("name")
                    .type(nonNull(GraphQLString)))
            .field(newFieldDefinition()
                    .name("description")
                    .type(GraphQLString))
            .field(newFieldDefinition()
                    .name("args")
                    .type(nonNull(list(nonNull(__InputValue))))
                    .dataFetcher(environment -> ((GraphQLFieldDefinition) environment.getSource()).getArguments()))
            .field(newFieldDefinition()
                    .name("type")
                    .type(nonNull(typeRef("__Type")))
                    .dataFetcher(environment -> environment.getGraphQLSchema().resolve(((GraphQLFieldDefinition) environment.getSource()).getType())))
            .field(newFieldDefinition()
                    .name("isDeprecated")
                    .type(nonNull(GraphQLBoolean))
                    .dataFetcher(environment -> ((GraphQLFieldDefinition) environment.getSource()).isDeprecated()))
            .field(newFieldDefinition()
                    .name("deprecationReason")
                    .type(GraphQLString))
            .build();

    public static final GraphQLObjectType __EnumValue = newObject()
            .name("__EnumValue")
            .field(newFieldDefinition()
                    .name("name")
                    .type(nonNull(GraphQLString)))
            .field(newFieldDefinition()
                    .name("description")
                    .type(GraphQLString))
            .field(newFieldDefinition()
                    .name("isDeprecated")
                    .type(nonNull(GraphQLBoolean))
                    .dataFetcher(environment -> ((GraphQLEnumValueDefinition) environment.getSource()).isDeprecated()))
            .field(newFieldDefinition()
                    .name("deprecationReason")
                    .type(GraphQLString))
            .build();

    public static final DataFetcher<Object> kindDataFetcher = environment -> {
        GraphQLType type = environment.getSource();
        return type.getKind();
    };

    public static final DataFetcher<Object> descriptionDataFetcher = environment -> {
        Object type = environment.getSource();
        if (type instanceof GraphQLScalarType) {
            return ((GraphQLScalarType) type).getDescription();
        } else if (type instanceof GraphQLObjectType) {
            return ((GraphQLObjectType) type).getDescription();
        } else if (type instanceof GraphQLInterfaceType) {
            return ((GraphQLInterfaceType) type).getDescription();
        } else if (type instanceof GraphQLUnionType) {
            return ((GraphQLUnionType) type).getDescription();
        } else if (type instanceof GraphQLEnumType) {
            return ((GraphQLEnumType) type).getDescription();
        } else if (type instanceof GraphQLInputObjectType) {
            return ((GraphQLInputObjectType) type).getDescription();
        }
        return null;
    };

    public static final DataFetcher<Object> fieldsFetcher = environment -> {
        Object type = environment.getSource();
        if (!(type instanceof GraphQLFieldsContainer)) {
            return null;
        }
        List<GraphQLFieldDefinition> fieldDefinitions = ((GraphQLFieldsContainer) type).getFieldDefinitions();
        if (includeDeprecated(environment.getArgument("includeDeprecated"))) {
            return fieldDefinitions;
        }
        List<GraphQLFieldDefinition> filtered = new ArrayList<>();
        for (GraphQLFieldDefinition fieldDefinition : fieldDefinitions) {
            if (!fieldDefinition.isDeprecated()) {
                filtered.add(fieldDefinition);
            }
        }
        return filtered;
    };

    public static final DataFetcher<Object> interfacesFetcher = environment -> {
        Object type = environment.getSource();
        if (!(type instanceof GraphQLObjectType)) {
            return null;
        }
        GraphQLSchema schema = environment.getGraphQLSchema();
        List<GraphQLType> interfaces = new ArrayList<>();
        for (GraphQLOutputType interfaceType : ((GraphQLObjectType) type).getInterfaces()) {
            interfaces.add(schema.resolve(interfaceType));
        }
        return interfaces;
    };

    public static final DataFetcher<Object> possibleTypesFetcher = environment -> {
        Object type = environment.getSource();
        if (type instanceof GraphQLInterfaceType || type instanceof GraphQLUnionType) {
            return environment.getGraphQLSchema().getPossibleTypes((GraphQLType) type);
        }
        return null;
    };

    public static final DataFetcher<Object> enumValuesFetcher = environment -> {
        Object type = environment.getSource();
        if (!(type instanceof GraphQLEnumType)) {
            return null;
        }
        List<GraphQLEnumValueDefinition> values = ((GraphQLEnumType) type).getValues();
        if (includeDeprecated(environment.getArgument("includeDeprecated"))) {
            return values;
        }
        List<GraphQLEnumValueDefinition> filtered = new ArrayList<>();
        for (GraphQLEnumValueDefinition value : values) {
            if (!value.isDeprecated()) {
                filtered.add(value);
            }
        }
        return filtered;
    };

    public static final DataFetcher<Object> inputFieldsFetcher = environment -> {
        Object type = environment.getSource();
        if (type instanceof GraphQLInputObjectType) {
            return ((GraphQLInputObjectType) type).getFields();
        }
        return null;
    };

    public static final DataFetcher<Object> ofTypeFetcher = environment -> {
        Object type = environment.getSource();
        if (type instanceof GraphQLModifiedType) {
            return environment.getGraphQLSchema().resolve(((GraphQLModifiedType) type).getWrappedType());
        }
        return null;
    };

    public static final GraphQLObjectType __Type = newObject()
            .name("__Type")
            .field(newFieldDefinition()
                    .name("kind")
                    .type(nonNull(__TypeKind))
                    .dataFetcher(kindDataFetcher))
            .field(newFieldDefinition()
                    .name("name")
                    .type(GraphQLString))
            .field(newFieldDefinition()
                    .name("description")
                    .type(GraphQLString)
                    .dataFetcher(descriptionDataFetcher))
            .field(newFieldDefinition()
                    .name("fields")
                    .type(list(nonNull(__Field)))
                    .argument(newArgument()
                            .name("includeDeprecated")
                            .type(GraphQLBoolean)
                            .defaultValue(false))
                    .dataFetcher(fieldsFetcher))
            .field(newFieldDefinition()
                    .name("interfaces")
                    .type(list(nonNull(typeRef("__Type"))))
                    .dataFetcher(interfacesFetcher))
            .field(newFieldDefinition()
                    .name("possibleTypes")
                    .type(list(nonNull(typeRef("__Type"))))
                    .dataFetcher(possibleTypesFetcher))
            .field(newFieldDefinition()
                    .name("enumValues")
                    .type(list(nonNull(__EnumValue)))
                    .argument(newArgument()
                            .name("includeDeprecated")
                            .type(GraphQLBoolean)
                            .defaultValue(false))
                    .dataFetcher(enumValuesFetcher))
            .field(newFieldDefinition()
                    .name("inputFields")
                    .type(list(nonNull(__InputValue)))
                    .dataFetcher(inputFieldsFetcher))
            .field(newFieldDefinition()
                    .name("ofType")
                    .type(typeRef("__Type"))
                    .dataFetcher(ofTypeFetcher))
            .build();

    public static final GraphQLObjectType __Directive = newObject()
            .name("__Directive")
            .field(newFieldDefinition()
                    .name("name")
                    .type(nonNull(GraphQLString)))
            .field(newFieldDefinition()
                    .name("description")
                    .type(GraphQLString))
            .field(newFieldDefinition()
                    .name("locations")
                    .type(nonNull(list(nonNull(__DirectiveLocation)))))
            .field(newFieldDefinition()
                    .name("args")
                    .type(nonNull(list(nonNull(__InputValue))))
                    .dataFetcher(environment -> ((GraphQLDirective) environment.getSource()).getArguments()))
            .build();

    public static final GraphQLObjectType __Schema = newObject()
            .name("__Schema")
            .description("A GraphQL Schema defines the capabilities of a GraphQL server. It exposes all available types and directives on the server, the entry points for query, mutation, and subscription operations.")
            .field(newFieldDefinition()
                    .name("types")
                    .description("A list of all types supported by this server.")
                    .type(nonNull(list(nonNull(__Type))))
                    .dataFetcher(environment -> ((GraphQLSchema) environment.getSource()).getAllTypesAsList()))
            .field(newFieldDefinition()
                    .name("queryType")
                    .description("The type that query operations will be rooted at.")
                    .type(nonNull(__Type)))
            .field(newFieldDefinition()
                    .name("mutationType")
                    .description("If this server supports mutation, the type that mutation operations will be rooted at.")
                    .type(__Type))
            .field(newFieldDefinition()
                    .name("subscriptionType")
                    .description("If this server support subscription, the type that subscription operations will be rooted at.")
                    .type(__Type))
            .field(newFieldDefinition()
                    .name("directives")
                    .description("A list of all directives supported by this server.")
                    .type(nonNull(list(nonNull(__Directive))))
                    .dataFetcher(environment -> Directives.getDirectives()))
            .build();

    public static final GraphQLFieldDefinition SchemaMetaFieldDef = newFieldDefinition()
            .name("__schema")
            .type(nonNull(__Schema))
            .description("Access the current type schema of this server.")
            .dataFetcher(environment -> environment.getGraphQLSchema())
            .build();

    public static final GraphQLFieldDefinition TypeMetaFieldDef = newFieldDefinition()
            .name("__type")
            .type(__Type)
            .description("Request the type information of a single type.")
            .argument(newArgument()
                    .name("name")
                    .type(nonNull(GraphQLString)))
            .dataFetcher(environment -> environment.getGraphQLSchema().getType(environment.<String>getArgument("name")))
            .build();

    public static final GraphQLFieldDefinition TypeNameMetaFieldDef = newFieldDefinition()
            .name("__typename")
            .type(nonNull(GraphQLString))
            .description("The name of the current Object type at runtime.")
            .dataFetcher(environment -> environment.getParentType().getName())
            .build();

    /**
     * @return the introspection types, registered in every schema
     */
    @Internal
    public static List<GraphQLType> getIntrospectionTypes() {
        return Collections.unmodifiableList(Arrays.asList(__Schema, __Type, __Field, __InputValue, __EnumValue, __Directive, __TypeKind, __DirectiveLocation));
    }

    public static boolean isIntrospectionTypeName(String name) {
        return name.startsWith("__");
    }

    /**
     * Looks up a field on the given parent type. {@code __typename} is available on every object type,
     * {@code __schema} and {@code __type} only on the query root.
     *
     * @param schema     the schema
     * @param parentType the object type the field is selected on
     * @param fieldName  the field name
     *
     * @return the field definition, or null if the parent type has no such field
     */
    public static GraphQLFieldDefinition getFieldDef(GraphQLSchema schema, GraphQLFieldsContainer parentType, String fieldName) {
        if (schema.getQueryType() == parentType) {
            if (fieldName.equals(SchemaMetaFieldDef.getName())) {
                return SchemaMetaFieldDef;
            }
            if (fieldName.equals(TypeMetaFieldDef.getName())) {
                return TypeMetaFieldDef;
            }
        }
        if (fieldName.equals(TypeNameMetaFieldDef.getName())) {
            return TypeNameMetaFieldDef;
        }
        return parentType.getFieldDefinition(fieldName);
    }

    private static boolean includeDeprecated(Object argument) {
        return Boolean.TRUE.equals(argument);
    }

    static String printDefaultValue(Object value, GraphQLInputType type, GraphQLSchema schema) {
        if (value == null) {
            return "null";
        }
        GraphQLType unwrapped = schema.resolve(GraphQLTypeUtil.unwrapNonNull(type));
        if (unwrapped instanceof GraphQLEnumType) {
            return ((GraphQLEnumType) unwrapped).serialize(value);
        }
        if (unwrapped instanceof GraphQLList && value instanceof Iterable) {
            GraphQLInputType elementType = (GraphQLInputType) ((GraphQLList) unwrapped).getWrappedType();
            List<String> elements = new ArrayList<>();
            for (Object element : (Iterable<?>) value) {
                elements.add(printDefaultValue(element, elementType, schema));
            }
            return "[" + String.join(", ", elements) + "]";
        }
        if (unwrapped instanceof GraphQLInputObjectType && value instanceof Map) {
            GraphQLInputObjectType inputObjectType = (GraphQLInputObjectType) unwrapped;
            List<String> fields = new ArrayList<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                GraphQLInputObjectField field = inputObjectType.getField(String.valueOf(entry.getKey()));
                GraphQLInputType fieldType = field == null ? GraphQLString : field.getType();
                fields.add(entry.getKey() + ": " + printDefaultValue(entry.getValue(), fieldType, schema));
            }
            return "{" + String.join(", ", fields) + "}";
        }
        if (value instanceof String) {
            return "\"" + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return String.valueOf(value);
    }
}
