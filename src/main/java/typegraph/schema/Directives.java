package typegraph.schema;

import typegraph.PublicApi;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static typegraph.schema.GraphQLArgument.newArgument;
import static typegraph.schema.GraphQLNonNull.nonNull;

/**
 * The directives honoured during field collection
 */
@PublicApi
public class Directives {

    private static final List<String> SELECTION_LOCATIONS = Arrays.asList("FIELD", "FRAGMENT_SPREAD", "INLINE_FRAGMENT");

    public static final GraphQLDirective IncludeDirective = new GraphQLDirective(
            "include",
            "Directs the executor to include this field or fragment only when the `if` argument is true",
            SELECTION_LOCATIONS,
            Collections.singletonList(newArgument()
                    .name("if")
                    .description("Included when true.")
                    .type(nonNull(Scalars.GraphQLBoolean))
                    .build()));

    public static final GraphQLDirective SkipDirective = new GraphQLDirective(
            "skip",
            "Directs the executor to skip this field or fragment when the `if` argument is true.",
            SELECTION_LOCATIONS,
            Collections.singletonList(newArgument()
                    .name("if")
                    .description("Skipped when true.")
                    .type(nonNull(Scalars.GraphQLBoolean))
                    .build()));

    public static List<GraphQLDirective> getDirectives() {
        return Arrays.asList(IncludeDirective, SkipDirective);
    }
}
