package com.todoflow.engine.recovery;

import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.RecoveryAction;
import com.todoflow.core.model.Todo;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword rules over the todo content and the error text.
 * At most one suggestion per action; skipping is always offered last.
 */
public class RuleBasedRemediationSuggester implements RemediationSuggester {

    private static final int LONG_CONTENT = 60;
    private static final int MAX_SUGGESTIONS = 3;

    private static final List<String> TRANSIENT_MARKERS =
        List.of("timeout", "timed out", "unavailable", "connection", "temporar", "rate limit");
    private static final List<String> INPUT_MARKERS =
        List.of("invalid", "not found", "missing", "permission", "unknown", "unsupported");

    @Override
    public List<RemediationSuggestion> suggest(Todo todo, ExecutionResult result) {
        String content = todo.content().toLowerCase(Locale.ROOT);
        String error = result.error() == null ? "" : result.error().toLowerCase(Locale.ROOT);
        String feedback = result.feedback().toLowerCase(Locale.ROOT);

        List<RemediationSuggestion> suggestions = new ArrayList<>();
        Set<RecoveryAction> seen = EnumSet.noneOf(RecoveryAction.class);

        if (containsAny(error, TRANSIENT_MARKERS)) {
            add(suggestions, seen, RecoveryAction.RETRY, "Retry the todo; the failure looks transient");
        }
        if (containsAny(error, INPUT_MARKERS)) {
            add(suggestions, seen, RecoveryAction.MODIFY, "Rewrite the todo with the missing details");
        }
        if (todo.content().length() > LONG_CONTENT || content.contains(" and ") || feedback.contains("break")) {
            add(suggestions, seen, RecoveryAction.BREAK_DOWN, "Break the todo down into smaller steps");
        }
        if (suggestions.size() < MAX_SUGGESTIONS - 1) {
            add(suggestions, seen, RecoveryAction.MODIFY, "Clarify the todo and try again");
        }

        List<RemediationSuggestion> ranked = new ArrayList<>(
            suggestions.subList(0, Math.min(suggestions.size(), MAX_SUGGESTIONS - 1)));
        ranked.add(new RemediationSuggestion(RecoveryAction.SKIP, "Skip this todo and continue with the rest of the plan"));
        return ranked;
    }

    private static void add(
            List<RemediationSuggestion> suggestions, Set<RecoveryAction> seen, RecoveryAction action, String text) {
        if (seen.add(action)) {
            suggestions.add(new RemediationSuggestion(action, text));
        }
    }

    private static boolean containsAny(String text, List<String> markers) {
        return markers.stream().anyMatch(text::contains);
    }
}
