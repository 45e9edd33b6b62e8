package typegraph.schema;

import typegraph.GraphQLException;
import typegraph.PublicApi;

@PublicApi
public class CoercingSerializeException extends GraphQLException {

    public CoercingSerializeException(String message) {
        super(message);
    }

    public CoercingSerializeException(String message, Throwable cause) {
        super(message, cause);
    }
}
