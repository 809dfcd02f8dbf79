package com.caprouter.guard;

import java.util.Optional;

/**
 * Outcome of a guarded generation: a validated value, or none, always with its trace.
 * "No value" is an ordinary outcome, not an error.
 */
public class JsonGuardResult<T> {
    private final T value;
    private final JsonGuardTrace trace;

    private JsonGuardResult(T value, JsonGuardTrace trace) {
        this.value = value;
        this.trace = trace;
    }

    public static <T> JsonGuardResult<T> of(T value, JsonGuardTrace trace) {
        return new JsonGuardResult<>(value, trace);
    }

    public static <T> JsonGuardResult<T> empty(JsonGuardTrace trace) {
        return new JsonGuardResult<>(null, trace);
    }

    public boolean isPresent() {
        return value != null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public JsonGuardTrace getTrace() {
        return trace;
    }
}
