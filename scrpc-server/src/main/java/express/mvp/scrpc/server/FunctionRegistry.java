package express.mvp.scrpc.server;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Name to function table served by an {@link RpcServer}.
 *
 * <p>Registration happens during setup. {@link RpcServer#start()} freezes the registry, after which
 * it is read concurrently by every worker and further registration fails with {@link
 * IllegalStateException}. A name can be registered once; a second registration fails with {@link
 * DuplicateFunctionException} rather than replacing the first.
 *
 * <h2>Intent Hooks</h2>
 *
 * <p>A function registered as {@code <name>_intent} is notified around calls to {@code <name>}: with
 * {@code false} once the call has been accepted, and with {@code true} when the call fails before
 * the function runs. Hooks are ordinary entries and may also be called remotely.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * FunctionRegistry registry = new FunctionRegistry();
 * registry.register("add", args -> (Integer) args[0] + (Integer) args[1]);
 * registry.register(calculator, "multiply");
 * registry.registerAnnotated(new FileService());
 * }</pre>
 */
public final class FunctionRegistry {

    private static final Logger LOGGER = Logger.getLogger(FunctionRegistry.class.getName());

    /** Suffix of the intent hook paired with a function. */
    public static final String INTENT_SUFFIX = "_intent";

    private final Map<String, RemoteFunction> functions = new ConcurrentHashMap<>();

    private volatile boolean frozen;

    /**
     * Registers a function.
     *
     * @param name the name clients call it by
     * @param function the implementation
     * @throws DuplicateFunctionException if {@code name} is taken
     * @throws IllegalStateException if the registry is frozen
     */
    public void register(String name, RemoteFunction function) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(function, "function must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be empty");
        }
        checkNotFrozen();
        if (functions.putIfAbsent(name, function) != null) {
            throw new DuplicateFunctionException(name);
        }
        LOGGER.log(Level.FINE, "Registered function {0}", name);
    }

    /**
     * Registers the public method {@code methodName} of {@code target} under its own name.
     *
     * @param target the object the method is invoked on
     * @param methodName the name of a public, non-overloaded method
     * @throws IllegalArgumentException if no such method exists or it is overloaded
     * @throws DuplicateFunctionException if the name is taken
     */
    public void register(Object target, String methodName) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(methodName, "methodName must not be null");
        List<Method> candidates = new ArrayList<>();
        for (Method method : target.getClass().getMethods()) {
            if (method.getName().equals(methodName) && !Modifier.isStatic(method.getModifiers())) {
                candidates.add(method);
            }
        }
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException(
                    "No public method " + methodName + " on " + target.getClass().getName());
        }
        if (candidates.size() > 1) {
            throw new IllegalArgumentException(
                    "Method " + methodName + " is overloaded on " + target.getClass().getName());
        }
        register(methodName, bind(target, candidates.get(0)));
    }

    /**
     * Registers every public method of {@code target} annotated with {@link RemoteMethod}.
     *
     * @param target the object the methods are invoked on
     * @return the number of functions registered
     * @throws IllegalArgumentException if {@code target} has no annotated methods
     * @throws DuplicateFunctionException if a name is taken
     */
    public int registerAnnotated(Object target) {
        Objects.requireNonNull(target, "target must not be null");
        int registered = 0;
        for (Method method : target.getClass().getMethods()) {
            RemoteMethod annotation = method.getAnnotation(RemoteMethod.class);
            if (annotation == null || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            String name = annotation.value().isBlank() ? method.getName() : annotation.value();
            register(name, bind(target, method));
            registered++;
        }
        if (registered == 0) {
            throw new IllegalArgumentException(
                    "No @RemoteMethod methods on " + target.getClass().getName());
        }
        return registered;
    }

    /**
     * Looks up a function.
     *
     * @param name the function name
     * @return the function, or empty if none is registered under {@code name}
     */
    public Optional<RemoteFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    /**
     * Returns the registered names in sorted order.
     *
     * @return an unmodifiable snapshot of the names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    public int size() {
        return functions.size();
    }

    /**
     * Checks whether registration is closed.
     *
     * @return true once the server using this registry has started
     */
    public boolean isFrozen() {
        return frozen;
    }

    /** Closes registration. Called by {@link RpcServer#start()}. */
    void freeze() {
        frozen = true;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Functions must be registered before the server starts");
        }
    }

    private static RemoteFunction bind(Object target, Method method) {
        // public methods of non-public classes need this
        method.trySetAccessible();
        return args -> {
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        };
    }

    @Override
    public String toString() {
        return "FunctionRegistry" + names();
    }
}
