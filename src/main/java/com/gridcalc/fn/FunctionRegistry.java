package com.gridcalc.fn;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.Value;
import com.gridcalc.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The single dispatch table for formula functions.
 *
 * Starts with every {@link BuiltinFunction}; callers may register more, or
 * replace a built-in, under any name. Names are case-insensitive.
 *
 * {@link #invoke} is the only place a function runs. It turns an unknown name
 * into {@code #NAME?}, a wrong argument count into {@code #ERR!}, and anything
 * a function throws into {@code #ERR!} plus a throttled log entry.
 */
public final class FunctionRegistry {
    private static final Logger log = LogManager.getLogger(FunctionRegistry.class);

    public static final int VARARGS = Integer.MAX_VALUE;

    /** Arity and behaviour of one registered function. */
    public record FunctionMetadata(String name, int minArgs, int maxArgs, boolean propagatesErrors,
            SheetFunction function) {
    }

    private final Map<String, FunctionMetadata> registry = new ConcurrentHashMap<>();
    private final ErrorRateLimiter limiter;

    public FunctionRegistry() {
        this(1000);
    }

    public FunctionRegistry(long errorLogIntervalMillis) {
        this.limiter = new ErrorRateLimiter(log, errorLogIntervalMillis);
        registerBuiltIns();
    }

    private void registerBuiltIns() {
        for (BuiltinFunction fn : BuiltinFunction.values())
            register(fn.functionName(), fn.minArgs(), fn.maxArgs(), fn.propagatesErrors(), fn.function());
    }

    public FunctionRegistry register(String name, int minArgs, int maxArgs, boolean propagatesErrors,
            SheetFunction function) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Function name must not be empty");
        if (minArgs < 0 || maxArgs < minArgs)
            throw new IllegalArgumentException("Bad arity for " + name + ": " + minArgs + ".." + maxArgs);
        String key = name.trim().toUpperCase(Locale.ROOT);
        registry.put(key, new FunctionMetadata(key, minArgs, maxArgs, propagatesErrors, function));
        return this;
    }

    /** Registers a function taking any number of arguments. */
    public FunctionRegistry register(String name, SheetFunction function) {
        return register(name, 0, VARARGS, true, function);
    }

    public boolean contains(String name) {
        return registry.containsKey(name.toUpperCase(Locale.ROOT));
    }

    public FunctionMetadata getMetadata(String name) {
        return registry.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(registry.keySet()));
    }

    public Value invoke(String name, List<Operand> args) {
        FunctionMetadata meta = getMetadata(name);
        if (meta == null)
            return Value.error(ErrorKind.NAME);
        if (args.size() < meta.minArgs() || args.size() > meta.maxArgs())
            return Value.error(ErrorKind.GENERIC);
        if (meta.propagatesErrors()) {
            for (Operand arg : args) {
                if (!arg.isRange() && arg.scalar().isError())
                    return arg.scalar();
            }
        }
        try {
            Value result = meta.function().apply(args);
            return result != null ? result : Value.error(ErrorKind.GENERIC);
        } catch (Throwable t) {
            limiter.log("Error evaluating function " + meta.name(), t);
            return Value.error(ErrorKind.GENERIC);
        }
    }
}
