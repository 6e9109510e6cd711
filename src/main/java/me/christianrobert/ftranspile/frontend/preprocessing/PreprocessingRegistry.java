package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.ir.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of preprocessing rules, keyed by rule name.
 */
public class PreprocessingRegistry {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingRegistry.class);

    private final Map<String, PreprocessingRule> rules = new LinkedHashMap<>();

    /**
     * Registry with the rules shipped with the front end.
     */
    public static PreprocessingRegistry defaults() {
        PreprocessingRegistry registry = new PreprocessingRegistry();
        registry.register(new MacroMarkerRule());
        return registry;
    }

    public PreprocessingRegistry register(PreprocessingRule rule) {
        rules.put(rule.getName(), rule);
        return this;
    }

    /**
     * Drops every rule whose name is not listed.
     */
    public PreprocessingRegistry retainOnly(Collection<String> names) {
        rules.keySet().retainAll(names);
        return this;
    }

    public Collection<PreprocessingRule> getRules() {
        return Collections.unmodifiableCollection(rules.values());
    }

    /**
     * Runs every rule's filter in registration order. Information is collected into
     * {@code info} under each rule's name.
     */
    public String filter(String source, Map<String, List<PreprocessingInfo>> info) {
        String result = source;
        for (PreprocessingRule rule : rules.values()) {
            List<PreprocessingInfo> collected = new ArrayList<>();
            result = rule.filter(result, collected);
            if (!collected.isEmpty()) {
                log.debug("Preprocessing rule {} altered {} line(s)", rule.getName(), collected.size());
                info.put(rule.getName(), collected);
            }
        }
        return result;
    }

    /**
     * Runs the post-processing of every rule that has information in {@code info}.
     */
    public Node postprocess(Node ir, Map<String, List<PreprocessingInfo>> info) {
        if (info == null) {
            return ir;
        }
        Node result = ir;
        for (PreprocessingRule rule : rules.values()) {
            List<PreprocessingInfo> collected = info.get(rule.getName());
            if (collected != null && !collected.isEmpty()) {
                result = rule.postprocess(result, collected);
            }
        }
        return result;
    }
}
