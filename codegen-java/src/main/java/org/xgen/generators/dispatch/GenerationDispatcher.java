package org.xgen.generators.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes a hook name to the handler registered under it.
 *
 * <p>Renderers are not known here: a renderer contributes hooks by annotating
 * its methods with {@link GenerationHook}, so adding a target language needs
 * no change to this class. Dispatching a name nothing is registered under is
 * a no-op, which lets a renderer leave out hooks it has no use for.
 *
 * <p>Holds no state between dispatches beyond the registry itself.
 */
public final class GenerationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(GenerationDispatcher.class);

    private final Map<String, HookHandler> hooks = new HashMap<>();

    public GenerationDispatcher register(String name, HookHandler handler) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("hook name is required");
        }
        if (hooks.putIfAbsent(name, handler) != null) {
            throw new IllegalArgumentException("Duplicate hook: " + name);
        }
        return this;
    }

    /**
     * Register every public method of {@code receiver} annotated with {@link GenerationHook}.
     */
    public GenerationDispatcher registerAll(Object receiver) {
        for (Method method : receiver.getClass().getMethods()) {
            GenerationHook hook = method.getAnnotation(GenerationHook.class);
            if (hook == null) {
                continue;
            }
            String name = hook.value().isEmpty() ? method.getName() : hook.value();
            method.setAccessible(true);
            register(name, reflectiveHandler(receiver, method, name));
            logger.debug("Registered hook {} -> {}.{}", name, receiver.getClass().getSimpleName(), method.getName());
        }
        return this;
    }

    public boolean hasHook(String name) {
        return hooks.containsKey(name);
    }

    public Set<String> hookNames() {
        return Collections.unmodifiableSet(hooks.keySet());
    }

    /**
     * Invoke the hook registered under {@code name}. Returns normally when no
     * such hook exists.
     *
     * @throws GenerationException the hook's own failure, unchanged
     */
    public void dispatch(String name, Object... args) throws GenerationException {
        HookHandler handler = hooks.get(name);
        if (handler == null) {
            logger.debug("No hook {}, skipping", name);
            return;
        }
        handler.apply(args);
    }

    private static HookHandler reflectiveHandler(Object receiver, Method method, String name) {
        return args -> {
            try {
                method.invoke(receiver, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof GenerationException ge) {
                    throw ge;
                }
                throw new GenerationException("Hook " + name + " failed: " + cause, cause);
            } catch (IllegalAccessException | IllegalArgumentException e) {
                throw new GenerationException(
                    "Cannot invoke hook %s on %s with %d argument(s)"
                        .formatted(name, receiver.getClass().getName(), args == null ? 0 : args.length), e);
            }
        };
    }
}
