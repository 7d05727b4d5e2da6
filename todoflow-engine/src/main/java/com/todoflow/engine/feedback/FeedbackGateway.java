package com.todoflow.engine.feedback;

import com.todoflow.core.exception.ValidationExhaustedException;
import com.todoflow.core.model.ApprovalDecision;
import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.FeedbackKind;
import com.todoflow.core.model.FeedbackRequest;
import com.todoflow.core.model.FeedbackResolution;
import com.todoflow.core.model.FeedbackSummary;
import com.todoflow.core.model.GuidanceAction;
import com.todoflow.core.model.OrchestrationConfig;
import com.todoflow.core.model.RecoveryDecision;
import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.core.model.ValidationDecision;
import com.todoflow.engine.logging.LoggingContext;
import com.todoflow.engine.metrics.TodoflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Predicate;

/**
 * Issues typed feedback requests and always comes back with an answer.
 *
 * Non-interactive gateways answer from defaults without blocking. Interactive gateways
 * ask the responder and wait at most the request timeout; a timeout or a failing responder
 * falls back to the default. Every request is kept in an append-only history.
 *
 * At most one request is outstanding at a time.
 */
public class FeedbackGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FeedbackGateway.class);

    static final String INVALID_INPUT_PREFIX = "Invalid input. ";
    private static final int MAX_SUMMARY_MESSAGE = 100;
    private static final int MAX_RESULT_PREVIEW = 200;

    private static final List<String> APPROVAL_OPTIONS = List.of("yes", "no", "skip", "modify");
    private static final List<String> VALIDATION_OPTIONS = List.of("accept", "retry", "modify", "skip");
    private static final List<String> GUIDANCE_OPTIONS =
        List.of("continue", "skip_current", "reorder", "add_todo", "remove_todo", "pause");
    private static final List<String> ERROR_OPTIONS = List.of("retry", "skip", "modify_todo", "break_down");

    private final OrchestrationConfig config;
    private final FeedbackResponder responder;
    private final TodoflowMetrics metrics;
    private final Clock clock;
    private final ExecutorService responderExecutor;
    private final List<FeedbackRequest> history = new CopyOnWriteArrayList<>();

    public FeedbackGateway(
            OrchestrationConfig config,
            FeedbackResponder responder,
            TodoflowMetrics metrics,
            Clock clock) {
        this.config = config;
        this.responder = responder;
        this.metrics = metrics;
        this.clock = clock;
        this.responderExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "feedback-responder");
            t.setDaemon(true);
            return t;
        });
    }

    // ========== Core operation ==========

    /**
     * Issue a request and return its response.
     *
     * @param kind Request kind, decides the built-in default
     * @param message Text shown to the responder
     * @param context Opaque data passed through to the responder
     * @param options Acceptable response tokens, empty for free text
     * @param defaultResponse Response used on fallback, or null for the kind default
     * @param timeout Maximum wait for the responder, or null to wait indefinitely
     * @return The response; never null
     */
    public synchronized String request(
            FeedbackKind kind,
            String message,
            Map<String, Object> context,
            List<String> options,
            String defaultResponse,
            Duration timeout) {
        FeedbackRequest request = new FeedbackRequest(
            UUID.randomUUID().toString(),
            kind,
            message,
            context,
            options,
            defaultResponse,
            timeout,
            clock.instant()
        );
        history.add(request);

        try (LoggingContext ignored = LoggingContext.forFeedback(kind)) {
            if (!config.interactive()) {
                return resolve(request, nonInteractiveResponse(request), FeedbackResolution.DEFAULTED);
            }
            return askResponder(request);
        }
    }

    private String askResponder(FeedbackRequest request) {
        Future<String> answer = responderExecutor.submit(() -> responder.respond(request));
        try {
            String raw = request.getTimeout().isPresent()
                ? answer.get(request.getTimeout().get().toMillis(), TimeUnit.MILLISECONDS)
                : answer.get();
            String response = raw == null || raw.isBlank() ? request.fallbackResponse() : raw.strip();
            return resolve(request, response, FeedbackResolution.ANSWERED);

        } catch (TimeoutException e) {
            answer.cancel(true);
            log.warn("No response to {} request within {}ms, using '{}'",
                request.getKind(), request.getTimeout().map(Duration::toMillis).orElse(0L),
                request.fallbackResponse());
            return resolve(request, request.fallbackResponse(), FeedbackResolution.TIMED_OUT);

        } catch (ExecutionException e) {
            log.warn("Responder failed on {} request: {}. Using '{}'",
                request.getKind(), e.getCause().getMessage(), request.fallbackResponse());
            return resolve(request, request.fallbackResponse(), FeedbackResolution.RESPONDER_ERROR);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            answer.cancel(true);
            log.warn("Interrupted while waiting for {} response, using '{}'",
                request.getKind(), request.fallbackResponse());
            return resolve(request, request.fallbackResponse(), FeedbackResolution.RESPONDER_ERROR);
        }
    }

    private String nonInteractiveResponse(FeedbackRequest request) {
        if (request.getDefaultResponse().isEmpty()
                && request.getKind() == FeedbackKind.APPROVAL
                && config.autoApproveSimple()) {
            return "yes";
        }
        return request.fallbackResponse();
    }

    private String resolve(FeedbackRequest request, String response, FeedbackResolution resolution) {
        request.recordResponse(response, resolution, clock.instant());
        metrics.feedbackResolved(request.getKind(), resolution);
        log.debug("{} request {} resolved as {}: '{}'",
            request.getKind(), request.getRequestId(), resolution, response);
        return response;
    }

    // ========== Request builders ==========

    public ApprovalDecision requestApproval(Todo todo, ExecutionKind kind) {
        String message = "About to execute todo: '" + todo.content() + "'"
            + "\nExecution type: " + kind
            + "\nProceed with execution?";

        String response = request(
            FeedbackKind.APPROVAL,
            message,
            Map.of("todo_id", todo.id(), "content", todo.content(), "execution_kind", kind.name()),
            APPROVAL_OPTIONS,
            "yes",
            config.defaultTimeout()
        );
        return ApprovalDecision.fromResponse(response);
    }

    public ValidationDecision requestValidation(Todo todo, ExecutionResult result) {
        StringBuilder message = new StringBuilder("Todo '").append(todo.content()).append("' executed with result:");
        if (result.output() != null) {
            message.append('\n').append(truncate(result.output(), MAX_RESULT_PREVIEW));
        }
        message.append("\nSuccess: ").append(result.success());
        message.append("\n\nIs this result acceptable?");

        String response = request(
            FeedbackKind.VALIDATION,
            message.toString(),
            Map.of("todo_id", todo.id(), "success", result.success()),
            VALIDATION_OPTIONS,
            "accept",
            config.defaultTimeout()
        );
        return ValidationDecision.fromResponse(response);
    }

    /**
     * Ask how to proceed with the plan.
     *
     * @param plan All todos in plan order
     * @param currentTodoId The todo that would run next, or null
     */
    public GuidanceAction requestPlanGuidance(List<Todo> plan, String currentTodoId) {
        StringBuilder message = new StringBuilder("Current execution plan:\n");
        for (int i = 0; i < plan.size(); i++) {
            Todo todo = plan.get(i);
            message.append(i + 1).append(". ")
                .append(marker(todo, currentTodoId)).append(' ')
                .append(todo.content())
                .append(" (priority ").append(todo.priority()).append(")\n");
        }
        message.append("\nHow would you like to proceed?");

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("todo_count", plan.size());
        if (currentTodoId != null) {
            context.put("current_todo_id", currentTodoId);
        }

        String response = request(
            FeedbackKind.GUIDANCE,
            message.toString(),
            context,
            GUIDANCE_OPTIONS,
            "continue",
            config.defaultTimeout()
        );
        return GuidanceAction.fromResponse(response);
    }

    public RecoveryDecision requestErrorHandling(Todo todo, String error, List<String> suggestions) {
        StringBuilder message = new StringBuilder("Error executing todo: '").append(todo.content()).append("'\n");
        message.append("Error: ").append(error).append("\n\n");

        List<String> options = new ArrayList<>(ERROR_OPTIONS);
        if (!suggestions.isEmpty()) {
            message.append("Suggested actions:\n");
            for (int i = 0; i < suggestions.size(); i++) {
                message.append(i + 1).append(". ").append(suggestions.get(i)).append('\n');
                options.add(RecoveryDecision.suggestionToken(i));
            }
        }
        message.append("\nHow would you like to handle this error?");

        String response = request(
            FeedbackKind.CHOICE,
            message.toString(),
            Map.of("todo_id", todo.id(), "error", error, "suggestions", suggestions),
            options,
            "retry",
            config.defaultTimeout()
        );
        return RecoveryDecision.fromResponse(response, suggestions.size());
    }

    /**
     * Ask for free text, re-prompting while the validator rejects the answer.
     *
     * @return The first accepted response
     * @throws ValidationExhaustedException if every allowed attempt was rejected
     */
    public String requestInput(String prompt, Map<String, Object> context, Predicate<String> validator) {
        String message = prompt;
        String response = "";
        for (int attempt = 1; attempt <= config.maxInputAttempts(); attempt++) {
            response = request(FeedbackKind.INPUT, message, context, List.of(), null, config.inputTimeout());
            if (validator.test(response)) {
                return response;
            }
            log.info("Input rejected (attempt {}/{})", attempt, config.maxInputAttempts());
            message = INVALID_INPUT_PREFIX + prompt;
        }
        throw new ValidationExhaustedException(prompt, config.maxInputAttempts(), response);
    }

    public String requestInput(String prompt) {
        return requestInput(prompt, Map.of(), response -> true);
    }

    // ========== History ==========

    public List<FeedbackRequest> history() {
        return List.copyOf(history);
    }

    public FeedbackSummary summary() {
        return summary(5);
    }

    public FeedbackSummary summary(int recentCount) {
        List<FeedbackRequest> requests = history();

        Map<FeedbackKind, Integer> byKind = new EnumMap<>(FeedbackKind.class);
        requests.forEach(r -> byKind.merge(r.getKind(), 1, Integer::sum));

        int timedOut = (int) requests.stream().filter(FeedbackRequest::isTimedOut).count();
        double averageSeconds = requests.stream()
            .map(FeedbackRequest::getLatency)
            .flatMap(Optional::stream)
            .mapToDouble(FeedbackGateway::seconds)
            .average()
            .orElse(0.0);

        List<FeedbackSummary.RecentRequest> recent = requests
            .subList(Math.max(0, requests.size() - recentCount), requests.size())
            .stream()
            .map(r -> new FeedbackSummary.RecentRequest(
                r.getRequestId(),
                r.getKind(),
                truncate(r.getMessage(), MAX_SUMMARY_MESSAGE),
                r.getResponse().orElse(null),
                r.getResolution().orElse(null),
                r.getLatency().map(FeedbackGateway::seconds).orElse(null)))
            .toList();

        return new FeedbackSummary(requests.size(), byKind, timedOut, averageSeconds, config.interactive(), recent);
    }

    @Override
    public void close() {
        responderExecutor.shutdownNow();
    }

    private static String marker(Todo todo, String currentTodoId) {
        if (todo.id().equals(currentTodoId)) {
            return "[>]";
        }
        if (todo.status() == TodoStatus.COMPLETED) {
            return "[x]";
        }
        return todo.status() == TodoStatus.FAILED ? "[!]" : "[ ]";
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
