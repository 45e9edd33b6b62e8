package typegraph.schema;

import typegraph.GraphQLException;
import typegraph.PublicApi;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;

/**
 * The resolver used for fields that declare none. It reads the property named like the field from the parent
 * value: a {@link Map} entry, then a public getter ({@code getX()} or {@code isX()}), then a public field.
 * A missing property resolves to null.
 *
 * @param <T> the type of the fetched value
 */
@PublicApi
public class PropertyDataFetcher<T> implements DataFetcher<T> {

    private final String propertyName;

    public PropertyDataFetcher(String propertyName) {
        this.propertyName = propertyName;
    }

    public static <T> PropertyDataFetcher<T> fetching(String propertyName) {
        return new PropertyDataFetcher<>(propertyName);
    }

    public String getPropertyName() {
        return propertyName;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T get(DataFetchingEnvironment environment) {
        Object source = environment.getSource();
        if (source == null) {
            return null;
        }
        if (source instanceof Map) {
            return (T) ((Map<?, ?>) source).get(propertyName);
        }
        return (T) getPropertyViaGetter(source);
    }

    private Object getPropertyViaGetter(Object object) {
        String capitalized = Character.toUpperCase(propertyName.charAt(0)) + propertyName.substring(1);
        Method getter = findPublicMethod(object.getClass(), "get" + capitalized);
        if (getter == null) {
            getter = findPublicMethod(object.getClass(), "is" + capitalized);
        }
        if (getter != null) {
            try {
                return getter.invoke(object);
            } catch (IllegalAccessException e) {
                throw new GraphQLException(e);
            } catch (InvocationTargetException e) {
                throw new GraphQLException(e.getCause());
            }
        }
        return getPropertyViaField(object);
    }

    private Object getPropertyViaField(Object object) {
        try {
            Field field = object.getClass().getField(propertyName);
            if (Modifier.isStatic(field.getModifiers())) {
                return null;
            }
            return field.get(object);
        } catch (NoSuchFieldException e) {
            return null;
        } catch (IllegalAccessException e) {
            throw new GraphQLException(e);
        }
    }

    private static Method findPublicMethod(Class<?> rootClass, String methodName) {
        Class<?> currentClass = rootClass;
        while (currentClass != null) {
            if (Modifier.isPublic(currentClass.getModifiers())) {
                try {
                    Method method = currentClass.getMethod(methodName);
                    if (!Modifier.isStatic(method.getModifiers())) {
                        return method;
                    }
                } catch (NoSuchMethodException e) {
                    // keep looking up the hierarchy
                }
            }
            currentClass = currentClass.getSuperclass();
        }
        return null;
    }
}
