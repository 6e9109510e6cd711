package me.christianrobert.ftranspile.lint;

import me.christianrobert.ftranspile.ir.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a set of rules over lowered source files.
 */
public class Linter {

    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    private final List<GenericRule> rules;
    private final Map<String, Map<String, Object>> overrides;

    /**
     * @param rules rules to run, in order
     * @param overrides per-rule configuration keyed by rule title; missing options keep their defaults
     */
    public Linter(List<GenericRule> rules, Map<String, Map<String, Object>> overrides) {
        this.rules = new ArrayList<>(rules);
        this.overrides = overrides != null ? overrides : Map.of();
    }

    /**
     * One report per rule, in rule order.
     */
    public List<RuleReport> check(SourceFile file) {
        List<RuleReport> reports = new ArrayList<>();
        for (GenericRule rule : rules) {
            Map<String, Object> config = new HashMap<>(rule.getDefaultConfig());
            config.putAll(overrides.getOrDefault(rule.getTitle(), Map.of()));

            RuleReport report = new RuleReport(rule, file.getPath());
            rule.check(file, report, config);
            if (!report.isEmpty()) {
                log.debug("{} [{}]: {} problem(s) in {}", rule.getTitle(), rule.getType(),
                        report.getProblems().size(), file.getPath());
            }
            reports.add(report);
        }
        return reports;
    }
}
