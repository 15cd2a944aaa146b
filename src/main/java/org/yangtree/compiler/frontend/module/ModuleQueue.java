package org.yangtree.compiler.frontend.module;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Work queue of module names to load. Each name is handed out at most once, so modules
 * discovered through imports and includes are processed iteratively, in discovery order.
 */
public final class ModuleQueue {

    private final Deque<String> pending = new ArrayDeque<>();
    private final Set<String> seen = new LinkedHashSet<>();

    /**
     * Queues a module unless it was registered before.
     *
     * @return {@code true} if the module was newly queued.
     */
    public boolean register(String moduleName) {
        if (!seen.add(moduleName)) {
            return false;
        }
        pending.addLast(moduleName);
        return true;
    }

    public Optional<String> next() {
        return Optional.ofNullable(pending.pollFirst());
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /**
     * Every module ever registered, in registration order.
     */
    public Set<String> registered() {
        return Collections.unmodifiableSet(seen);
    }
}
