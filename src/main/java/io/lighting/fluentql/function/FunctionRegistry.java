package io.lighting.fluentql.function;

import io.lighting.fluentql.error.ArityException;
import io.lighting.fluentql.types.TypeCompatibility;
import io.lighting.fluentql.types.TypeMatcher;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Function signatures by name, together with the matcher used to check calls of them.
 * <p>
 * Registration is expected to happen during startup; lookups and calls are safe from any
 * thread afterwards. One name may carry several signatures of different arity.
 */
public final class FunctionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionRegistry.class);

    private static volatile FunctionRegistry global = standard();

    private final Map<String, List<FunctionSignature>> signatures = new ConcurrentHashMap<>();
    private final TypeMatcher matcher;

    public FunctionRegistry(TypeMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * Registry holding the built-in operators and aggregates with strict kind compatibility.
     */
    public static FunctionRegistry standard() {
        return standard(TypeCompatibility.strict());
    }

    public static FunctionRegistry standard(TypeCompatibility compatibility) {
        FunctionRegistry registry = new FunctionRegistry(new TypeMatcher(compatibility));
        for (FunctionSignature signature : Functions.BUILT_INS) {
            registry.register(signature);
        }
        return registry;
    }

    /**
     * Registry used by the operator methods of columns and calls.
     */
    public static FunctionRegistry global() {
        return global;
    }

    /**
     * Replaces the process-wide registry. Must happen before queries are built concurrently.
     */
    public static void install(FunctionRegistry registry) {
        global = Objects.requireNonNull(registry, "registry");
        LOGGER.debug("Installed global function registry with {} function name(s)", registry.signatures.size());
    }

    public FunctionRegistry register(FunctionSignature signature) {
        Objects.requireNonNull(signature, "signature");
        List<FunctionSignature> overloads = signatures.computeIfAbsent(
            normalize(signature.name()),
            ignored -> new CopyOnWriteArrayList<>()
        );
        overloads.removeIf(existing -> existing.arity() == signature.arity());
        overloads.add(signature);
        LOGGER.debug("Registered function signature {}", signature);
        return this;
    }

    public TypeMatcher matcher() {
        return matcher;
    }

    public boolean contains(String name) {
        Objects.requireNonNull(name, "name");
        return signatures.containsKey(normalize(name));
    }

    public Optional<FunctionSignature> signature(String name, int arity) {
        Objects.requireNonNull(name, "name");
        List<FunctionSignature> overloads = signatures.get(normalize(name));
        if (overloads == null) {
            return Optional.empty();
        }
        return overloads.stream().filter(signature -> signature.arity() == arity).findFirst();
    }

    public FunctionCall call(FunctionSignature signature, Object... arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return FunctionCall.of(signature, matcher, Arrays.asList(arguments));
    }

    /**
     * Calls the registered signature of {@code name} whose arity matches the arguments.
     *
     * @throws IllegalArgumentException when no signature is registered under the name
     * @throws ArityException when signatures exist but none takes that many arguments
     */
    public FunctionCall call(String name, Object... arguments) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(arguments, "arguments");
        List<FunctionSignature> overloads = signatures.get(normalize(name));
        if (overloads == null || overloads.isEmpty()) {
            throw new IllegalArgumentException("Unknown function: " + name);
        }
        return signature(name, arguments.length)
            .map(signature -> call(signature, arguments))
            .orElseThrow(() -> new ArityException(name, overloads.get(0).arity(), arguments.length));
    }

    private String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
