package org.dissync.scheduler;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A deferred host update for one function, run when the analyst next looks at that function.
 * <p>
 * Two tasks are equal when operation, arguments and keyword arguments match. The
 * {@value #ORDER_KEY} keyword only orders tasks and takes no part in equality.
 */
public final class UpdateTask {

    public static final String ORDER_KEY = "timestamp";

    @FunctionalInterface
    public interface TaskAction {
        void run() throws Exception;
    }

    private final String operation;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final TaskAction action;

    public UpdateTask(String operation, List<Object> args, Map<String, Object> kwargs, TaskAction action) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.args = List.copyOf(args);
        this.kwargs = new TreeMap<>(kwargs);
        this.action = Objects.requireNonNull(action, "action");
    }

    public UpdateTask(String operation, List<Object> args, TaskAction action) {
        this(operation, args, Map.of(), action);
    }

    public void run() throws Exception {
        action.run();
    }

    public String getOperation() {
        return operation;
    }

    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    private Map<String, Object> identityKwargs() {
        Map<String, Object> identity = new TreeMap<>(kwargs);
        identity.remove(ORDER_KEY);
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdateTask other)) return false;
        return operation.equals(other.operation)
                && args.equals(other.args)
                && identityKwargs().equals(other.identityKwargs());
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, args, identityKwargs());
    }

    @Override
    public String toString() {
        return operation + args + (kwargs.isEmpty() ? "" : kwargs);
    }
}
