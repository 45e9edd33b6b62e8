package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@PublicApi
public class Directive implements Node {

    private final String name;
    private final List<Argument> arguments;
    private final SourceLocation sourceLocation;

    public Directive(String name, List<Argument> arguments, SourceLocation sourceLocation) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.sourceLocation = sourceLocation;
    }

    public static Directive of(String name, Argument... arguments) {
        return new Directive(name, Arrays.asList(arguments), null);
    }

    public String getName() {
        return name;
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public Argument getArgument(String argumentName) {
        for (Argument argument : arguments) {
            if (argument.getName().equals(argumentName)) {
                return argument;
            }
        }
        return null;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "Directive{name='" + name + "', arguments=" + arguments + '}';
    }
}
