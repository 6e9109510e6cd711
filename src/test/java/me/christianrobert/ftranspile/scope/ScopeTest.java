package me.christianrobert.ftranspile.scope;

import me.christianrobert.ftranspile.expression.IntLiteral;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for symbol resolution through the scope chain.
 */
class ScopeTest {

    @Test
    void lookupIsCaseInsensitive() {
        Scope scope = new Scope();
        scope.define("Alpha", SymbolAttributes.of(BasicType.REAL));

        assertNotNull(scope.lookup("ALPHA"));
        assertNotNull(scope.lookup("alpha"));
        assertTrue(scope.isDefinedLocally("aLpHa"));
    }

    @Test
    void lookupFallsBackToParent() {
        Scope module = new Scope();
        module.define("n", SymbolAttributes.of(BasicType.INTEGER));
        Scope routine = Scope.childOf(module);

        assertEquals(TypeTag.INTEGER, routine.lookup("n").getTag());
        assertNull(routine.lookupLocal("n"), "Local lookup must not see the parent");
        assertNull(routine.lookup("missing"));
    }

    @Test
    void childShadowsWithoutModifyingParent() {
        Scope module = new Scope();
        module.define("x", SymbolAttributes.of(BasicType.INTEGER));
        Scope routine = Scope.childOf(module);

        routine.define("x", SymbolAttributes.of(BasicType.REAL));

        assertEquals(TypeTag.REAL, routine.lookup("x").getTag());
        assertEquals(TypeTag.INTEGER, module.lookup("x").getTag());
    }

    @Test
    void defineOverwritesLocally() {
        Scope scope = new Scope();
        scope.define("x", SymbolAttributes.deferred());
        scope.define("X", SymbolAttributes.of(BasicType.LOGICAL));

        assertEquals(1, scope.getSymbols().size());
        assertEquals(TypeTag.LOGICAL, scope.lookup("x").getTag());
    }

    @Test
    void rejectsNullArguments() {
        Scope scope = new Scope();
        assertThrows(IllegalArgumentException.class, () -> Scope.childOf(null));
        assertThrows(IllegalArgumentException.class, () -> scope.define("x", null));
        assertThrows(IllegalArgumentException.class, () -> scope.lookup(null));
    }

    @Test
    void functionalUpdateLeavesOriginalUntouched() {
        SymbolAttributes base = SymbolAttributes.builder()
                .dtype(BasicType.REAL)
                .kind(new IntLiteral(8))
                .intent("in")
                .build();

        SymbolAttributes array = base.withShape(List.of(new IntLiteral(10)));

        assertFalse(base.isArray());
        assertNull(base.getShape());
        assertTrue(array.isArray());
        assertEquals("in", array.getIntent(), "Other attributes are carried over");
        assertEquals(base.getKind(), array.getKind());
    }

    @Test
    void importedAttributesRememberTheirModule() {
        SymbolAttributes attrs = SymbolAttributes.deferred().withImported("physics");

        assertTrue(attrs.isImported());
        assertEquals("physics", attrs.getModule());
        assertEquals(TypeTag.DEFERRED, attrs.getTag());
    }

    @Test
    void doublePrecisionMapsToReal() {
        assertEquals(BasicType.REAL, BasicType.fromString("double  precision"));
        assertEquals(BasicType.COMPLEX, BasicType.fromString("complex"));
        assertEquals(TypeTag.REAL, BasicType.COMPLEX.getTag());
        assertEquals(BasicType.DEFERRED, BasicType.fromString("byte"));
    }
}
