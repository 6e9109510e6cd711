package me.christianrobert.ftranspile.lint;

import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Problems one rule found in one file.
 */
public class RuleReport {

    private final GenericRule rule;
    private final String filename;
    private final List<Problem> problems = new ArrayList<>();

    public RuleReport(GenericRule rule, String filename) {
        this.rule = rule;
        this.filename = filename;
    }

    /**
     * Records a problem at the given node; the node may be null for file-wide findings.
     */
    public void add(String message, Node location) {
        problems.add(new Problem(message, location));
    }

    public GenericRule getRule() {
        return rule;
    }

    public String getFilename() {
        return filename;
    }

    public List<Problem> getProblems() {
        return Collections.unmodifiableList(problems);
    }

    public boolean isEmpty() {
        return problems.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleReport{rule=" + rule.getTitle() + ", file=" + filename + ", problems=" + problems.size() + "}";
    }

    /**
     * A single finding.
     */
    public static class Problem {

        private final String message;
        private final Node location;

        Problem(String message, Node location) {
            this.message = message;
            this.location = location;
        }

        public String getMessage() {
            return message;
        }

        public Node getLocation() {
            return location;
        }

        /**
         * First source line of the location, or -1 if unknown.
         */
        public int getLine() {
            if (location == null) {
                return -1;
            }
            Source source = location.getSource();
            return source != null ? source.getLineStart() : -1;
        }

        @Override
        public String toString() {
            int line = getLine();
            return (line >= 0 ? "line " + line + ": " : "") + message;
        }
    }
}
