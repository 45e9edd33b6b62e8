package typegraph.schema;

import typegraph.GraphQLException;
import typegraph.PublicApi;

@PublicApi
public class CoercingParseValueException extends GraphQLException {

    public CoercingParseValueException(String message) {
        super(message);
    }

    public CoercingParseValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
