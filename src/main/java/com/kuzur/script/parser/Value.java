package com.kuzur.script.parser;

import com.kuzur.script.errors.TypeError;

/**
 * Runtime value. Kuzur is dynamically typed, so every operator and built-in
 * checks the {@link Type} it receives and raises {@link TypeError} for kinds
 * it does not accept.
 *
 * Values are immutable; numbers and booleans behave as copies and strings
 * and functions are shared, which cannot be observed because the language
 * has no mutable composite types.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, FUNC, NULL }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value func(KuzurCallable f) { return new Value(Type.FUNC, f); }
    public static Value nil() { return NIL; }

    public Type getType() { return type; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new TypeError("Expected number, got %s", typeName());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new TypeError("Expected bool, got %s", typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new TypeError("Expected string, got %s", typeName());
        return (String) value;
    }

    public KuzurCallable asFunc() {
        if (type != Type.FUNC) throw new TypeError("Expected function, got %s", typeName());
        return (KuzurCallable) value;
    }

    public boolean isNull() { return type == Type.NULL; }

    /** Lower-case kind name used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL:   return "bool";
            case STRING: return "string";
            case FUNC:   return "function";
            default:     return "null";
        }
    }

    /** The string form used by print, str and string concatenation. */
    public String display() {
        switch (type) {
            case NUMBER: return formatNumber(asNumber());
            case BOOL:   return Boolean.toString(asBool());
            case STRING: return asString();
            case FUNC:   return asFunc().toString();
            default:     return "null";
        }
    }

    /** Integral values print without a fraction: 5 rather than 5.0. */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return Double.toString(d);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return '"' + asString() + '"';
            default:
                return display();
        }
    }
}
