package com.flowsmith.core.compiler;

import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.AiProcessingStep;
import com.flowsmith.core.workflow.ConditionalStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Collapses long {@code includes} disjunctions in filter conditions into one
 * keyword-array membership test. Only runs joined by {@code ||} are touched;
 * conjunctions and mixed operands keep their meaning. Output of this rewrite
 * no longer matches the clause pattern, so running it twice changes nothing.
 */
@Component
public class ConditionSimplifier {

    private static final Logger log = LoggerFactory.getLogger(ConditionSimplifier.class);

    static final int MAX_INCLUDES_CLAUSES = 10;

    private static final Pattern INCLUDES_CLAUSE =
            Pattern.compile("\\(([^()]+)\\)\\.toLowerCase\\(\\)\\.includes\\('((?:[^'\\\\]|\\\\.)+)'\\)");
    private static final Pattern NULL_DEFAULT = Pattern.compile("\\?\\?\\s*''\\s*$");
    private static final Pattern ITEM_FIELD = Pattern.compile("item\\.\\w+");

    public List<WorkflowStep> simplify(List<WorkflowStep> steps) {
        return steps.stream().map(this::simplify).toList();
    }

    WorkflowStep simplify(WorkflowStep step) {
        if (step instanceof TransformStep transform) {
            return simplifyTransform(transform);
        }
        if (step instanceof ScatterGatherStep scatterGather) {
            ScatterGatherStep.Scatter scatter = scatterGather.scatter() == null ? null
                    : new ScatterGatherStep.Scatter(scatterGather.scatter().input(),
                            scatterGather.scatter().itemVariable(), simplify(scatterGather.scatter().steps()));
            ScatterGatherStep.LegacyConfig config = scatterGather.config() == null
                    || scatterGather.config().actions() == null ? scatterGather.config()
                    : new ScatterGatherStep.LegacyConfig(scatterGather.config().data(),
                            scatterGather.config().itemVariable(), simplify(scatterGather.config().actions()));
            return new ScatterGatherStep(scatterGather.id(), scatterGather.stepId(), scatterGather.description(),
                    scatter, scatterGather.gather(), config, scatterGather.outputVariable());
        }
        if (step instanceof ConditionalStep conditional) {
            return new ConditionalStep(conditional.id(), conditional.stepId(), conditional.description(),
                    simplifyExpression(conditional.condition()), simplify(conditional.thenSteps()),
                    simplify(conditional.elseSteps()), conditional.outputVariable());
        }
        if (step instanceof ActionStep || step instanceof AiProcessingStep) {
            return step;
        }
        throw new IllegalArgumentException("Unknown step type: " + step.getClass().getName());
    }

    private TransformStep simplifyTransform(TransformStep transform) {
        if (!"filter".equals(transform.operation())
                || !(transform.config().get("condition") instanceof String condition)) {
            return transform;
        }
        String simplified = simplifyExpression(condition);
        if (simplified.equals(condition)) {
            return transform;
        }
        log.info("Simplified filter condition in step {} ({} -> {} chars)",
                transform.canonicalId(), condition.length(), simplified.length());
        return transform.withConfigEntry("condition", simplified);
    }

    /**
     * Rewrites every run of more than {@value #MAX_INCLUDES_CLAUSES} includes
     * clauses joined only by {@code ||}, at any parenthesis depth. Other
     * operands and the surrounding parentheses are kept as they are.
     *
     * @return the expression unchanged when it holds no such run or is unbalanced
     */
    public static String simplifyExpression(String expression) {
        if (expression == null) {
            return null;
        }
        String grouped = simplifyGroups(expression);
        return grouped == null ? expression : simplifyDisjunction(grouped);
    }

    private static String simplifyGroups(String expression) {
        StringBuilder out = new StringBuilder(expression.length());
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(expression, i);
                if (end < 0) {
                    return null;
                }
                out.append(expression, i, end);
                i = end;
            } else if (c == '(') {
                int close = matchingParen(expression, i);
                if (close < 0) {
                    return null;
                }
                String inner = simplifyExpression(expression.substring(i + 1, close));
                out.append('(').append(inner).append(')');
                i = close + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static String simplifyDisjunction(String expression) {
        List<String> operands = splitTopLevelOr(expression);
        if (operands.size() <= MAX_INCLUDES_CLAUSES) {
            return expression;
        }
        List<String> rebuilt = new ArrayList<>();
        List<Matcher> run = new ArrayList<>();
        List<String> runText = new ArrayList<>();
        boolean changed = false;
        for (String operand : operands) {
            Matcher clause = INCLUDES_CLAUSE.matcher(operand.trim());
            if (clause.matches()) {
                run.add(clause);
                runText.add(operand.trim());
                continue;
            }
            changed |= flushRun(run, runText, rebuilt);
            rebuilt.add(operand.trim());
        }
        changed |= flushRun(run, runText, rebuilt);
        return changed ? String.join(" || ", rebuilt) : expression;
    }

    private static boolean flushRun(List<Matcher> run, List<String> runText, List<String> into) {
        boolean collapse = run.size() > MAX_INCLUDES_CLAUSES;
        if (collapse) {
            into.add(keywordTest(run));
        } else {
            into.addAll(runText);
        }
        run.clear();
        runText.clear();
        return collapse;
    }

    private static String keywordTest(List<Matcher> clauses) {
        Set<String> fields = new LinkedHashSet<>();
        Set<String> keywords = new LinkedHashSet<>();
        for (Matcher clause : clauses) {
            Matcher field = ITEM_FIELD.matcher(clause.group(1));
            fields.add(field.find() ? field.group() : NULL_DEFAULT.matcher(clause.group(1)).replaceFirst("").trim());
            keywords.add(clause.group(2));
        }
        String keywordArray = keywords.stream().map(k -> "'" + k + "'").collect(Collectors.joining(", ", "[", "]"));
        String fieldTests = fields.stream()
                .map(f -> "(" + f + " ?? '').toLowerCase().includes(kw)")
                .collect(Collectors.joining(" || "));
        return keywordArray + ".some(kw => " + fieldTests + ")";
    }

    /**
     * Splits on {@code ||} outside quotes and parentheses. Whitespace around
     * operands is kept.
     */
    private static List<String> splitTopLevelOr(String expression) {
        List<String> operands = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(expression, i);
                if (i < 0) {
                    return List.of(expression);
                }
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && c == '|' && i + 1 < expression.length() && expression.charAt(i + 1) == '|') {
                operands.add(expression.substring(start, i));
                start = i + 2;
                i += 2;
                continue;
            }
            i++;
        }
        operands.add(expression.substring(start));
        return operands;
    }

    private static int matchingParen(String expression, int open) {
        int depth = 0;
        int i = open;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(expression, i);
                if (i < 0) {
                    return -1;
                }
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * @return the index just past the closing quote, or -1 when the literal is unterminated
     */
    private static int skipQuoted(String expression, int openQuote) {
        char quote = expression.charAt(openQuote);
        int i = openQuote + 1;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return -1;
    }
}
