package typegraph.schema;

import typegraph.PublicSpi;
import typegraph.language.Value;

/**
 * The contract a scalar type uses to move values in and out of the engine.
 *
 * @param <I> the internal type the scalar parses into
 * @param <O> the output type the scalar serializes to
 */
@PublicSpi
public interface Coercing<I, O> {

    /**
     * Called to turn a resolver's raw value into the serialized output of the scalar.
     *
     * @param dataFetcherResult the raw value returned by a resolver
     *
     * @return the serialized value
     *
     * @throws CoercingSerializeException if the value can't be serialized
     */
    O serialize(Object dataFetcherResult) throws CoercingSerializeException;

    /**
     * Called to turn a variable value (already deserialized from the transport format) into the internal value.
     *
     * @param input the variable value
     *
     * @return the internal value
     *
     * @throws CoercingParseValueException if the input can't be parsed
     */
    I parseValue(Object input) throws CoercingParseValueException;

    /**
     * Called to turn a query literal into the internal value.
     *
     * @param input the literal
     *
     * @return the internal value
     *
     * @throws CoercingParseLiteralException if the literal can't be parsed
     */
    I parseLiteral(Value input) throws CoercingParseLiteralException;
}
