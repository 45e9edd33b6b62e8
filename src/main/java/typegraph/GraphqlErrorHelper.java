package typegraph;

import typegraph.language.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * This little helper allows errors to implement common things like equals and hashcode and the response shape
 */
@Internal
public class GraphqlErrorHelper {

    public static Map<String, Object> toSpecification(GraphQLError error) {
        Map<String, Object> errorMap = new LinkedHashMap<>();
        errorMap.put("message", error.getMessage());
        if (error.getLocations() != null) {
            errorMap.put("locations", locations(error.getLocations()));
        }
        if (error.getPath() != null) {
            errorMap.put("path", error.getPath());
        }
        return errorMap;
    }

    public static List<Map<String, Integer>> locations(List<SourceLocation> locations) {
        List<Map<String, Integer>> result = new ArrayList<>();
        for (SourceLocation location : locations) {
            Map<String, Integer> map = new LinkedHashMap<>();
            map.put("line", location.getLine());
            map.put("column", location.getColumn());
            result.add(map);
        }
        return result;
    }

    public static int hashCode(GraphQLError dis) {
        return Objects.hash(dis.getMessage(), dis.getLocations(), dis.getPath(), dis.getErrorType());
    }

    public static boolean equals(GraphQLError dis, Object o) {
        if (dis == o) {
            return true;
        }
        if (o == null || dis.getClass() != o.getClass()) {
            return false;
        }
        GraphQLError dat = (GraphQLError) o;
        return Objects.equals(dis.getMessage(), dat.getMessage())
                && Objects.equals(dis.getLocations(), dat.getLocations())
                && Objects.equals(dis.getPath(), dat.getPath())
                && dis.getErrorType() == dat.getErrorType();
    }
}
