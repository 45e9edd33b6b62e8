package typegraph;

import java.util.Collection;

@Internal
public class Assert {

    public static <T> T assertNotNull(T object, String errorMessage) {
        if (object != null) {
            return object;
        }
        throw new AssertException(errorMessage);
    }

    public static <T> T assertNotNull(T object) {
        return assertNotNull(object, "Object required to be not null");
    }

    public static <T> Collection<T> assertNotEmpty(Collection<T> collection, String errorMessage) {
        if (collection == null || collection.isEmpty()) {
            throw new AssertException(errorMessage);
        }
        return collection;
    }

    public static void assertTrue(boolean condition, String errorMessage) {
        if (condition) {
            return;
        }
        throw new AssertException(errorMessage);
    }

    public static <T> T assertShouldNeverHappen(String errorMessage) {
        throw new AssertException("Internal error: should never happen: " + errorMessage);
    }

    public static <T> T assertShouldNeverHappen() {
        throw new AssertException("Internal error: should never happen");
    }

    private static final String invalidNameErrorMessage = "Name must be non-null, non-empty and match [_A-Za-z][_0-9A-Za-z]* - was '%s'";

    /**
     * Validates that the name matches the GraphQL name grammar
     *
     * @param name the name to be validated
     *
     * @return the name if valid
     *
     * @throws AssertException if the name is invalid
     */
    public static String assertValidName(String name) {
        if (name != null && !name.isEmpty() && name.matches("[_A-Za-z][_0-9A-Za-z]*")) {
            return name;
        }
        throw new AssertException(String.format(invalidNameErrorMessage, name));
    }
}
