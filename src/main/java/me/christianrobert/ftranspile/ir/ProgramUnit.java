package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.scope.Scope;

/**
 * Common base of modules and subprograms: a named unit owning a scope and a
 * specification section.
 */
public abstract class ProgramUnit extends Node {

    private final String name;
    private final Scope scope;
    private final Section spec;

    protected ProgramUnit(String name, Section spec, Scope scope, Source source, String label) {
        super(source, label);
        this.name = name;
        this.spec = spec != null ? spec : new Section(null);
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    public Scope getScope() {
        return scope;
    }

    public Section getSpec() {
        return spec;
    }
}
