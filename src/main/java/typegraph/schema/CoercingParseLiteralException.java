package typegraph.schema;

import typegraph.GraphQLException;
import typegraph.PublicApi;

@PublicApi
public class CoercingParseLiteralException extends GraphQLException {

    public CoercingParseLiteralException(String message) {
        super(message);
    }

    public CoercingParseLiteralException(String message, Throwable cause) {
        super(message, cause);
    }
}
