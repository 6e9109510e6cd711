package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for rule ordering and information routing in {@link PreprocessingRegistry}.
 */
class PreprocessingRegistryTest {

    private PreprocessingRule upper;
    private PreprocessingRule silent;
    private PreprocessingRegistry registry;

    @BeforeEach
    void setUp() {
        upper = Mockito.mock(PreprocessingRule.class);
        when(upper.getName()).thenReturn("upper");
        when(upper.filter(anyString(), anyList())).thenAnswer(invocation -> {
            List<PreprocessingInfo> info = invocation.getArgument(1);
            info.add(new PreprocessingInfo(1, "original"));
            return invocation.<String>getArgument(0).toUpperCase();
        });

        silent = Mockito.mock(PreprocessingRule.class);
        when(silent.getName()).thenReturn("silent");
        when(silent.filter(anyString(), anyList())).thenAnswer(invocation -> invocation.getArgument(0) + "!");

        registry = new PreprocessingRegistry().register(upper).register(silent);
    }

    @Test
    void filtersRunInRegistrationOrder() {
        // Given
        Map<String, List<PreprocessingInfo>> info = new HashMap<>();

        // When
        String result = registry.filter("abc", info);

        // Then: the second rule sees the first rule's output
        assertEquals("ABC!", result);
        verify(silent).filter(eq("ABC"), anyList());
    }

    @Test
    void onlyRulesThatAlteredLinesGetInformation() {
        Map<String, List<PreprocessingInfo>> info = new HashMap<>();

        registry.filter("abc", info);

        assertEquals(1, info.size());
        assertEquals("original", info.get("upper").get(0).getText());
    }

    @Test
    void postprocessSkipsRulesWithoutInformation() {
        // Given
        SourceFile ir = new SourceFile("x.f90", List.of(), null);
        when(upper.postprocess(any(Node.class), anyList())).thenReturn(ir);
        Map<String, List<PreprocessingInfo>> info = new HashMap<>();
        registry.filter("abc", info);

        // When
        Node result = registry.postprocess(ir, info);

        // Then
        assertSame(ir, result);
        verify(upper).postprocess(ir, info.get("upper"));
        verify(silent, never()).postprocess(any(Node.class), anyList());
    }

    @Test
    void retainOnlyDropsUnlistedRules() {
        registry.retainOnly(List.of("silent"));

        assertEquals(1, registry.getRules().size());
        assertEquals("abc!", registry.filter("abc", new HashMap<>()));
    }

    @Test
    void defaultsContainMacroMarker() {
        assertEquals(1, PreprocessingRegistry.defaults().getRules().size());
        assertInstanceOf(MacroMarkerRule.class, PreprocessingRegistry.defaults().getRules().iterator().next());
    }
}
