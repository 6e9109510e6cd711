package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.TypedSymbol;

import java.util.List;
import java.util.Map;

/**
 * Module import ({@code USE}), Fortran {@code INCLUDE} or C {@code #include}.
 *
 * <p>{@code symbols} is empty for a whole-module import and lists the selected
 * names for {@code USE m, ONLY: ...}. For includes, {@code module} is the file name.
 * {@code renames} maps local names to the module's names for {@code local => remote}.</p>
 */
public class Import extends Node {

    private final String module;
    private final List<TypedSymbol> symbols;
    private final boolean onlyList;
    private final boolean cImport;
    private final boolean fInclude;
    private final Map<String, String> renames;

    public Import(String module, List<TypedSymbol> symbols, boolean onlyList,
                  boolean cImport, boolean fInclude, Source source, String label) {
        this(module, symbols, Map.of(), onlyList, cImport, fInclude, source, label);
    }

    public Import(String module, List<TypedSymbol> symbols, Map<String, String> renames, boolean onlyList,
                  boolean cImport, boolean fInclude, Source source, String label) {
        super(source, label);
        this.module = module;
        this.symbols = List.copyOf(symbols);
        this.renames = Map.copyOf(renames);
        this.onlyList = onlyList;
        this.cImport = cImport;
        this.fInclude = fInclude;
    }

    public String getModule() {
        return module;
    }

    public List<TypedSymbol> getSymbols() {
        return symbols;
    }

    /**
     * Module-side name of an imported symbol; the local name when it was not renamed.
     */
    public String remoteName(String local) {
        return renames.getOrDefault(local, local);
    }

    public Map<String, String> getRenames() {
        return renames;
    }

    /**
     * True for {@code USE m, ONLY: ...}, even with an empty list.
     */
    public boolean isOnlyList() {
        return onlyList;
    }

    public boolean isCImport() {
        return cImport;
    }

    public boolean isFInclude() {
        return fInclude;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitImport(this);
    }

    @Override
    public String toString() {
        return "Import{module=" + module + ", symbols=" + symbols.size()
                + (cImport ? ", c" : "") + (fInclude ? ", include" : "") + "}";
    }
}
