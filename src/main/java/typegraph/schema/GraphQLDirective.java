package typegraph.schema;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static typegraph.Assert.assertValidName;

/**
 * A directive the executor understands, described so that it can be introspected
 */
@PublicApi
public class GraphQLDirective {

    private final String name;
    private final String description;
    private final List<String> locations;
    private final List<GraphQLArgument> arguments;

    public GraphQLDirective(String name, String description, List<String> locations, List<GraphQLArgument> arguments) {
        this.name = assertValidName(name);
        this.description = description;
        this.locations = Collections.unmodifiableList(new ArrayList<>(locations));
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getLocations() {
        return locations;
    }

    public List<GraphQLArgument> getArguments() {
        return arguments;
    }

    public GraphQLArgument getArgument(String name) {
        for (GraphQLArgument argument : arguments) {
            if (argument.getName().equals(name)) {
                return argument;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "GraphQLDirective{name='" + name + "'}";
    }
}
