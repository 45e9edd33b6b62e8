package typegraph.execution;

import typegraph.GraphQLException;
import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when an argument or variable value can't be coerced to its declared input type.
 * <p>
 * The input path locates the offending value inside the argument, starting with the argument name and followed by
 * input field names and list indices. Coercing a composite value reports every failing element, so one exception
 * may carry several {@link #getFailures() failures}.
 */
@PublicApi
public class CoercionException extends GraphQLException {

    private final String reason;
    private final List<Object> inputPath;
    private final List<CoercionException> failures;

    public CoercionException(String reason, List<Object> inputPath) {
        this(reason, inputPath, null);
    }

    public CoercionException(String reason, List<Object> inputPath, Throwable cause) {
        super(mkMessage(reason, inputPath), cause);
        this.reason = reason;
        this.inputPath = Collections.unmodifiableList(new ArrayList<>(inputPath));
        this.failures = Collections.singletonList(this);
    }

    private CoercionException(List<CoercionException> failures) {
        super(mkMessage(failures));
        this.reason = getMessage();
        this.inputPath = Collections.emptyList();
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    /**
     * @param failures the leaf failures, at least one
     *
     * @return the single failure, or an exception carrying all of them
     */
    public static CoercionException aggregate(List<CoercionException> failures) {
        List<CoercionException> leaves = new ArrayList<>();
        for (CoercionException failure : failures) {
            leaves.addAll(failure.getFailures());
        }
        if (leaves.size() == 1) {
            return leaves.get(0);
        }
        return new CoercionException(leaves);
    }

    private static String mkMessage(String reason, List<Object> inputPath) {
        if (inputPath.isEmpty()) {
            return reason;
        }
        return reason + " (at '" + printInputPath(inputPath) + "')";
    }

    private static String mkMessage(List<CoercionException> failures) {
        StringBuilder sb = new StringBuilder();
        sb.append(failures.size()).append(" input values could not be coerced:");
        for (CoercionException failure : failures) {
            sb.append(" ").append(failure.getMessage()).append(";");
        }
        return sb.toString();
    }

    static String printInputPath(List<Object> inputPath) {
        StringBuilder sb = new StringBuilder();
        for (Object segment : inputPath) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(segment);
            }
        }
        return sb.toString();
    }

    public String getReason() {
        return reason;
    }

    public List<Object> getInputPath() {
        return inputPath;
    }

    /**
     * @return the individual coercion failures, this exception itself when it describes a single value
     */
    public List<CoercionException> getFailures() {
        return failures;
    }
}
