package typegraph.execution;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static typegraph.Assert.assertNotNull;

/**
 * As an execution proceeds down the result tree it records the path taken: field names (or aliases) and list
 * indices. Paths are immutable, every segment call returns a new path sharing its parent.
 */
@PublicApi
public class ExecutionPath {

    private static final ExecutionPath ROOT_PATH = new ExecutionPath();

    /**
     * All paths start from here
     *
     * @return the root path
     */
    public static ExecutionPath rootPath() {
        return ROOT_PATH;
    }

    private final ExecutionPath parent;
    private final Object segment;
    private final List<Object> pathList;

    private ExecutionPath() {
        parent = null;
        segment = null;
        pathList = Collections.emptyList();
    }

    private ExecutionPath(ExecutionPath parent, Object segment) {
        this.parent = assertNotNull(parent, "Must provide a parent path");
        this.segment = assertNotNull(segment, "Must provide a sub path");
        List<Object> list = new ArrayList<>(parent.pathList);
        list.add(segment);
        this.pathList = Collections.unmodifiableList(list);
    }

    public int getLevel() {
        return pathList.size();
    }

    public ExecutionPath getParent() {
        return parent;
    }

    public boolean isRootPath() {
        return this == ROOT_PATH;
    }

    /**
     * @return the last segment, a String for a field and an Integer for a list index, or null on the root path
     */
    public Object getSegment() {
        return segment;
    }

    public boolean isListSegment() {
        return segment instanceof Integer;
    }

    public ExecutionPath segment(String segment) {
        return new ExecutionPath(this, segment);
    }

    public ExecutionPath segment(int segment) {
        return new ExecutionPath(this, segment);
    }

    /**
     * @param relativePath a list of field names and indices below this path
     *
     * @return a new path made of this path followed by the relative one
     */
    public ExecutionPath append(List<Object> relativePath) {
        ExecutionPath path = this;
        for (Object object : relativePath) {
            if (object instanceof Number) {
                path = path.segment(((Number) object).intValue());
            } else {
                path = path.segment(String.valueOf(object));
            }
        }
        return path;
    }

    /**
     * @return the path as a list of strings and integers, the shape it takes in the response
     */
    public List<Object> toList() {
        return pathList;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return pathList.equals(((ExecutionPath) o).pathList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pathList);
    }

    @Override
    public String toString() {
        if (isRootPath()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Object object : pathList) {
            if (object instanceof Integer) {
                sb.append('[').append(object).append(']');
            } else {
                sb.append('/').append(object);
            }
        }
        return sb.toString();
    }
}
