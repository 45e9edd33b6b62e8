package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@PublicApi
public class ObjectValue implements Value {

    private final List<ObjectField> objectFields;

    public ObjectValue(List<ObjectField> objectFields) {
        this.objectFields = Collections.unmodifiableList(new ArrayList<>(objectFields));
    }

    public static ObjectValue of(ObjectField... objectFields) {
        return new ObjectValue(Arrays.asList(objectFields));
    }

    public List<ObjectField> getObjectFields() {
        return objectFields;
    }

    @Override
    public String toString() {
        return "ObjectValue{objectFields=" + objectFields + '}';
    }
}
