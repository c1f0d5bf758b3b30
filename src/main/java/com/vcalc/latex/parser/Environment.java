package com.vcalc.latex.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.vcalc.latex.EvaluationException;

/**
 * Name to value bindings threaded through one conversion run.
 * Insertion order is kept so dumps list names in definition order.
 */
public class Environment {

    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
    }

    public Environment(Map<String, Value> initial) {
        if (initial != null) {
            values.putAll(initial);
        }
    }

    /** A fresh environment seeded with pi, e, tau, inf, nan and j. */
    public static Environment withDefaults() {
        Environment env = new Environment();
        env.define("pi", Value.real(Math.PI));
        env.define("e", Value.real(Math.E));
        env.define("tau", Value.real(2 * Math.PI));
        env.define("inf", Value.real(Double.POSITIVE_INFINITY));
        env.define("nan", Value.real(Double.NaN));
        env.define("j", Value.complex(Complex.I));
        return env;
    }

    /** Binds or rebinds a name. */
    public void define(String name, Value value) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (value == null) throw new IllegalArgumentException("value must not be null (use Value.none())");
        values.put(name, value);
    }

    public Value get(String name) {
        Value v = values.get(name);
        if (v == null) throw new EvaluationException("name '" + name + "' is not defined");
        return v;
    }

    /** Value bound to name, or null. */
    public Value lookup(String name) {
        return values.get(name);
    }

    public boolean exists(String name) {
        return values.containsKey(name);
    }

    public void assign(String name, Value value) {
        if (!values.containsKey(name)) throw new EvaluationException("name '" + name + "' is not defined");
        define(name, value);
    }

    public void remove(String name) {
        values.remove(name);
    }

    public void putAll(Map<String, Value> more) {
        if (more == null) return;
        for (Map.Entry<String, Value> e : more.entrySet()) {
            define(e.getKey(), e.getValue());
        }
    }

    /** Detached copy; values are immutable so a shallow copy is enough. */
    public Environment snapshot() {
        return new Environment(values);
    }

    public Map<String, Value> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }
}
