package typegraph;

/**
 * The general purpose runtime exception of the engine.
 */
@PublicApi
public class GraphQLException extends RuntimeException {

    public GraphQLException() {
    }

    public GraphQLException(String message) {
        super(message);
    }

    public GraphQLException(String message, Throwable cause) {
        super(message, cause);
    }

    public GraphQLException(Throwable cause) {
        super(cause);
    }
}
