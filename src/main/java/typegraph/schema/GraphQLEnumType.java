package typegraph.schema;

import typegraph.PublicApi;
import typegraph.language.EnumValue;
import typegraph.language.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static typegraph.Assert.assertTrue;
import static typegraph.Assert.assertValidName;

/**
 * An enum maps each of its symbol names to exactly one internal value. Results are serialized to the symbol
 * name and query literals are parsed into the internal value.
 */
@PublicApi
public class GraphQLEnumType implements GraphQLOutputType, GraphQLInputType {

    private final String name;
    private final String description;
    private final Map<String, GraphQLEnumValueDefinition> valueDefinitionMap;

    private GraphQLEnumType(String name, String description, Map<String, GraphQLEnumValueDefinition> valueDefinitionMap) {
        this.name = assertValidName(name);
        this.description = description;
        this.valueDefinitionMap = Collections.unmodifiableMap(new LinkedHashMap<>(valueDefinitionMap));
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.ENUM;
    }

    public List<GraphQLEnumValueDefinition> getValues() {
        return new ArrayList<>(valueDefinitionMap.values());
    }

    public GraphQLEnumValueDefinition getValue(String name) {
        return valueDefinitionMap.get(name);
    }

    /**
     * Turns an internal value into its symbol name. A java enum constant whose name is a symbol is accepted too.
     *
     * @param value the raw value a resolver returned
     *
     * @return the symbol name
     *
     * @throws CoercingSerializeException if no symbol maps to the value
     */
    public String serialize(Object value) {
        for (GraphQLEnumValueDefinition valueDefinition : valueDefinitionMap.values()) {
            if (Objects.equals(valueDefinition.getValue(), value)) {
                return valueDefinition.getName();
            }
        }
        if (value instanceof Enum && valueDefinitionMap.containsKey(((Enum<?>) value).name())) {
            return ((Enum<?>) value).name();
        }
        throw new CoercingSerializeException("Invalid input for Enum '" + name + "'. Unknown value '" + value + "'");
    }

    public Object parseValue(Object input) {
        if (input instanceof String) {
            GraphQLEnumValueDefinition valueDefinition = valueDefinitionMap.get(input);
            if (valueDefinition != null) {
                return valueDefinition.getValue();
            }
        }
        throw new CoercingParseValueException("Invalid input for Enum '" + name + "'. No value found for name '" + input + "'");
    }

    public Object parseLiteral(Value input) {
        if (!(input instanceof EnumValue)) {
            throw new CoercingParseLiteralException("Expected AST type 'EnumValue' for Enum '" + name + "' but was '" + input + "'");
        }
        String symbol = ((EnumValue) input).getName();
        GraphQLEnumValueDefinition valueDefinition = valueDefinitionMap.get(symbol);
        if (valueDefinition == null) {
            throw new CoercingParseLiteralException("Invalid input for Enum '" + name + "'. No value found for name '" + symbol + "'");
        }
        return valueDefinition.getValue();
    }

    @Override
    public String toString() {
        return "GraphQLEnumType{name='" + name + "', values=" + valueDefinitionMap.keySet() + '}';
    }

    public static Builder newEnum() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private final Map<String, GraphQLEnumValueDefinition> values = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder value(String name, Object value, String description, String deprecationReason) {
            assertTrue(!values.containsKey(name), String.format("Enum value '%s' is defined more than once", name));
            values.put(name, new GraphQLEnumValueDefinition(name, description, value, deprecationReason));
            return this;
        }

        public Builder value(String name, Object value, String description) {
            return value(name, value, description, null);
        }

        public Builder value(String name, Object value) {
            return value(name, value, null, null);
        }

        /**
         * A symbol whose internal value is its own name
         *
         * @param name the symbol name
         *
         * @return this builder
         */
        public Builder value(String name) {
            return value(name, name, null, null);
        }

        public GraphQLEnumType build() {
            return new GraphQLEnumType(name, description, values);
        }
    }
}
