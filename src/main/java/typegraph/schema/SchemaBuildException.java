package typegraph.schema;

import typegraph.GraphQLException;
import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a schema can't be built: a name bound to different definitions, a reference to an undefined type or a
 * type that breaks the contract of an interface or union. No query can execute against such a schema.
 */
@PublicApi
public class SchemaBuildException extends GraphQLException {

    private final List<String> problems;

    public SchemaBuildException(List<String> problems) {
        super(buildMessage(problems));
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    }

    private static String buildMessage(List<String> problems) {
        StringBuilder message = new StringBuilder("invalid schema:");
        for (String problem : problems) {
            message.append("\n").append(problem);
        }
        return message.toString();
    }

    public List<String> getProblems() {
        return problems;
    }
}
