package adlab.orchestrator.worker;

import adlab.orchestrator.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps task types to their handlers.
 */
public class TaskHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private final Map<TaskType, TaskHandler> handlers = Collections.synchronizedMap(new EnumMap<>(TaskType.class));

    public TaskHandlerRegistry register(TaskHandler handler) {
        TaskHandler previous = handlers.put(handler.type(), handler);
        if (previous != null) {
            log.warn("Replaced handler for {}: {} -> {}", handler.type().wireName(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            log.debug("Registered handler for {}: {}", handler.type().wireName(),
                    handler.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<TaskHandler> lookup(TaskType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean supports(TaskType type) {
        return handlers.containsKey(type);
    }

    public Set<TaskType> registeredTypes() {
        synchronized (handlers) {
            return Set.copyOf(handlers.keySet());
        }
    }
}
