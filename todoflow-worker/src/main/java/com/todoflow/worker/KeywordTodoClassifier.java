package com.todoflow.worker;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.Todo;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Rule-table classifier. Rules are evaluated in order; the first match wins, GENERIC otherwise.
 */
public class KeywordTodoClassifier implements TodoClassifier {

    private static final Pattern NUMBER_OPERATOR_NUMBER = Pattern.compile("\\d+\\s*[+\\-*/]\\s*\\d+");
    private static final List<String> MATH_OPERATORS = List.of("+", "-", "*", "/", "=", "(", ")");
    private static final List<String> MATH_WORDS = List.of("calculate", "compute", "solve", "math");

    private final List<Rule> rules;

    public KeywordTodoClassifier() {
        this(List.of(
            new Rule(ExecutionKind.MATH, KeywordTodoClassifier::looksLikeMath),
            Rule.anyWord(ExecutionKind.FILE, "create", "write", "save", "file"),
            Rule.anyWord(ExecutionKind.RESEARCH, "research", "find", "search", "gather", "analyze"),
            Rule.anyWord(ExecutionKind.PLANNING, "plan", "organize", "schedule", "prioritize")
        ));
    }

    public KeywordTodoClassifier(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public ExecutionKind classify(Todo todo) {
        String content = todo.content();
        for (Rule rule : rules) {
            if (rule.matches().test(content)) {
                return rule.kind();
            }
        }
        return ExecutionKind.GENERIC;
    }

    private static boolean looksLikeMath(String content) {
        if (NUMBER_OPERATOR_NUMBER.matcher(content).find()) {
            return true;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        boolean hasOperator = MATH_OPERATORS.stream().anyMatch(content::contains);
        boolean hasWord = MATH_WORDS.stream().anyMatch(lower::contains);
        return hasOperator && hasWord;
    }

    /**
     * A single classification rule.
     */
    public record Rule(ExecutionKind kind, Predicate<String> matches) {

        /**
         * Rule matching when the lower-cased content contains any of the given words.
         */
        public static Rule anyWord(ExecutionKind kind, String... words) {
            List<String> keywords = List.of(words);
            return new Rule(kind, content -> {
                String lower = content.toLowerCase(Locale.ROOT);
                return keywords.stream().anyMatch(lower::contains);
            });
        }
    }
}
