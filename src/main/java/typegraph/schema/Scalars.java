package typegraph.schema;

import typegraph.PublicApi;
import typegraph.language.BooleanValue;
import typegraph.language.FloatValue;
import typegraph.language.IntValue;
import typegraph.language.StringValue;
import typegraph.language.Value;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * The built-in scalars
 */
@PublicApi
public class Scalars {

    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

    private static boolean isNumberIsh(Object input) {
        return input instanceof Number || input instanceof String;
    }

    private static String typeName(Object input) {
        return input == null ? "null" : input.getClass().getSimpleName();
    }

    public static final GraphQLScalarType GraphQLInt = new GraphQLScalarType("Int", "Built-in Int", new Coercing<Integer, Integer>() {

        private Integer convertImpl(Object input) {
            if (input instanceof Integer) {
                return (Integer) input;
            } else if (isNumberIsh(input)) {
                BigDecimal value;
                try {
                    value = new BigDecimal(input.toString());
                } catch (NumberFormatException e) {
                    return null;
                }
                try {
                    return value.intValueExact();
                } catch (ArithmeticException e) {
                    return null;
                }
            } else {
                return null;
            }
        }

        @Override
        public Integer serialize(Object input) {
            Integer result = convertImpl(input);
            if (result == null) {
                throw new CoercingSerializeException("Expected a value that can be converted to type 'Int' but it was a '" + typeName(input) + "'");
            }
            return result;
        }

        @Override
        public Integer parseValue(Object input) {
            Integer result = convertImpl(input);
            if (result == null || input instanceof String) {
                throw new CoercingParseValueException("Expected type 'Int' but was '" + typeName(input) + "'.");
            }
            return result;
        }

        @Override
        public Integer parseLiteral(Value input) {
            if (!(input instanceof IntValue)) {
                throw new CoercingParseLiteralException("Expected AST type 'IntValue' but was '" + typeName(input) + "'.");
            }
            BigInteger value = ((IntValue) input).getValue();
            if (value.compareTo(INT_MIN) < 0 || value.compareTo(INT_MAX) > 0) {
                throw new CoercingParseLiteralException("Expected value to be in the Integer range but it was '" + value + "'");
            }
            return value.intValue();
        }
    });

    public static final GraphQLScalarType GraphQLFloat = new GraphQLScalarType("Float", "Built-in Float", new Coercing<Double, Double>() {

        private Double convertImpl(Object input) {
            if (isNumberIsh(input)) {
                double value;
                try {
                    value = new BigDecimal(input.toString()).doubleValue();
                } catch (NumberFormatException e) {
                    return null;
                }
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return null;
                }
                return value;
            }
            return null;
        }

        @Override
        public Double serialize(Object input) {
            Double result = convertImpl(input);
            if (result == null) {
                throw new CoercingSerializeException("Expected a value that can be converted to type 'Float' but it was a '" + typeName(input) + "'");
            }
            return result;
        }

        @Override
        public Double parseValue(Object input) {
            Double result = convertImpl(input);
            if (result == null || input instanceof String) {
                throw new CoercingParseValueException("Expected type 'Float' but was '" + typeName(input) + "'.");
            }
            return result;
        }

        @Override
        public Double parseLiteral(Value input) {
            if (input instanceof IntValue) {
                return ((IntValue) input).getValue().doubleValue();
            } else if (input instanceof FloatValue) {
                return ((FloatValue) input).getValue().doubleValue();
            }
            throw new CoercingParseLiteralException("Expected AST type 'IntValue' or 'FloatValue' but was '" + typeName(input) + "'.");
        }
    });

    public static final GraphQLScalarType GraphQLString = new GraphQLScalarType("String", "Built-in String", new Coercing<String, String>() {
        @Override
        public String serialize(Object input) {
            return input.toString();
        }

        @Override
        public String parseValue(Object input) {
            if (!(input instanceof String)) {
                throw new CoercingParseValueException("Expected type 'String' but was '" + typeName(input) + "'.");
            }
            return (String) input;
        }

        @Override
        public String parseLiteral(Value input) {
            if (!(input instanceof StringValue)) {
                throw new CoercingParseLiteralException("Expected AST type 'StringValue' but was '" + typeName(input) + "'.");
            }
            return ((StringValue) input).getValue();
        }
    });

    public static final GraphQLScalarType GraphQLBoolean = new GraphQLScalarType("Boolean", "Built-in Boolean", new Coercing<Boolean, Boolean>() {
        @Override
        public Boolean serialize(Object input) {
            if (input instanceof Boolean) {
                return (Boolean) input;
            } else if (input instanceof String) {
                String value = ((String) input).toLowerCase();
                if (value.equals("true") || value.equals("false")) {
                    return Boolean.parseBoolean(value);
                }
            } else if (input instanceof Number) {
                return ((Number) input).intValue() != 0;
            }
            throw new CoercingSerializeException("Expected a value that can be converted to type 'Boolean' but it was a '" + typeName(input) + "'");
        }

        @Override
        public Boolean parseValue(Object input) {
            if (!(input instanceof Boolean)) {
                throw new CoercingParseValueException("Expected type 'Boolean' but was '" + typeName(input) + "'.");
            }
            return (Boolean) input;
        }

        @Override
        public Boolean parseLiteral(Value input) {
            if (!(input instanceof BooleanValue)) {
                throw new CoercingParseLiteralException("Expected AST type 'BooleanValue' but was '" + typeName(input) + "'.");
            }
            return ((BooleanValue) input).isValue();
        }
    });

    public static final GraphQLScalarType GraphQLID = new GraphQLScalarType("ID", "Built-in ID", new Coercing<Object, Object>() {

        private String convertImpl(Object input) {
            if (input instanceof String || input instanceof Integer || input instanceof Long || input instanceof BigInteger) {
                return input.toString();
            }
            return null;
        }

        @Override
        public String serialize(Object input) {
            String result = convertImpl(input);
            if (result == null) {
                throw new CoercingSerializeException("Expected type 'ID' but was '" + typeName(input) + "'.");
            }
            return result;
        }

        @Override
        public String parseValue(Object input) {
            String result = convertImpl(input);
            if (result == null) {
                throw new CoercingParseValueException("Expected type 'ID' but was '" + typeName(input) + "'.");
            }
            return result;
        }

        @Override
        public String parseLiteral(Value input) {
            if (input instanceof StringValue) {
                return ((StringValue) input).getValue();
            }
            if (input instanceof IntValue) {
                return ((IntValue) input).getValue().toString();
            }
            throw new CoercingParseLiteralException("Expected AST type 'IntValue' or 'StringValue' but was '" + typeName(input) + "'.");
        }
    });
}
