package com.kuzur.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.kuzur.debug.Debug;
import com.kuzur.script.errors.NameError;

/**
 * One scope frame: the global frame of a run, or the frame of a single user
 * function call. Lookups walk outward through {@link #parent}; the parent of
 * a call frame is the environment the function was declared in, so scoping
 * is lexical.
 *
 * Blocks ({@code if}/loop bodies, bare braces) do not get a frame of their
 * own; they run in the frame of the enclosing call.
 */
public class Environment {
    private static final String TAG = "Environment";

    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Creates a global (root) frame. */
    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    /** A new function-call frame whose outer scope is this one. */
    public Environment callFrame() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds {@code name} in this frame only, replacing any binding already here. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    /**
     * Assignment as written in source ({@code x = v}). Rebinds {@code name}
     * if this frame already holds it; otherwise creates it here, shadowing
     * any outer binding. Assignment never writes through a function-call
     * boundary, so a function cannot mutate a global by assigning to it.
     */
    public void assign(String name, Value value) {
        if (Debug.get().isEnabled() && !values.containsKey(name) && parent != null && parent.exists(name)) {
            Debug.get().t(TAG, "'" + name + "' shadows an outer binding");
        }
        values.put(name, value);
    }

    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        throw new NameError("Undefined variable '%s'", name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    /** Read-only copy of this frame's bindings, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
