package me.christianrobert.ftranspile.scope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Name-resolution context with a parent chain.
 *
 * <p>Each scope owns a local symbol table keyed by lower-cased name. Lookups walk
 * outward through the parents and the nearest definition wins; definitions only
 * ever touch the local table, so a child can shadow but never modify its ancestors.</p>
 *
 * <p>Scopes are created for every construct with its own declaration region
 * (module, subroutine, function, derived type, associate block) and are mutated
 * while that construct is lowered. Not thread-safe.</p>
 */
public class Scope {

    private final Scope parent;
    private final Map<String, SymbolAttributes> symbols = new LinkedHashMap<>();

    public Scope() {
        this(null);
    }

    private Scope(Scope parent) {
        this.parent = parent;
    }

    /**
     * Creates a new empty scope whose lookups fall back to {@code parent}.
     */
    public static Scope childOf(Scope parent) {
        if (parent == null) {
            throw new IllegalArgumentException("Parent scope cannot be null");
        }
        return new Scope(parent);
    }

    /**
     * Resolves a name through this scope and its ancestors.
     *
     * @param name symbol name, any case
     * @return attributes of the nearest definition, or null if no scope defines the name
     */
    public SymbolAttributes lookup(String name) {
        String key = normalize(name);
        for (Scope s = this; s != null; s = s.parent) {
            SymbolAttributes attrs = s.symbols.get(key);
            if (attrs != null) {
                return attrs;
            }
        }
        return null;
    }

    /**
     * Resolves a name in this scope only.
     */
    public SymbolAttributes lookupLocal(String name) {
        return symbols.get(normalize(name));
    }

    /**
     * Inserts or overwrites a symbol in the local table.
     */
    public void define(String name, SymbolAttributes attrs) {
        if (attrs == null) {
            throw new IllegalArgumentException("Attributes for '" + name + "' cannot be null");
        }
        symbols.put(normalize(name), attrs);
    }

    public boolean isDefinedLocally(String name) {
        return symbols.containsKey(normalize(name));
    }

    public Scope getParent() {
        return parent;
    }

    /**
     * Local symbols in definition order.
     */
    public Map<String, SymbolAttributes> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    private static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Symbol name cannot be null");
        }
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Scope{symbols=" + symbols.keySet() + ", hasParent=" + (parent != null) + "}";
    }
}
