package com.deepansh.assistant.core;

import com.deepansh.assistant.config.AssistantProperties;
import com.deepansh.assistant.exception.InvalidInputException;
import com.deepansh.assistant.exception.ModelAuthException;
import com.deepansh.assistant.exception.ModelRateLimitedException;
import com.deepansh.assistant.exception.ModelUnavailableException;
import com.deepansh.assistant.exception.SessionBusyException;
import com.deepansh.assistant.exception.ToolTimeoutException;
import com.deepansh.assistant.exception.ToolUnavailableException;
import com.deepansh.assistant.llm.ModelGateway;
import com.deepansh.assistant.model.FinalAnswer;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ModelResponse;
import com.deepansh.assistant.model.ToolCallRequest;
import com.deepansh.assistant.model.ToolResult;
import com.deepansh.assistant.tool.ToolCatalog;
import com.deepansh.assistant.tool.ToolClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tool-call loop for the single chat session.
 *
 * Per-turn flow:
 * 1. Validate input and take the session lock
 * 2. Append the user message
 * 3. Model call → tool calls → tool results → repeat, at most max-rounds times
 * 4. Append the final answer, or a system marker when the turn is truncated,
 *    fails or is cancelled
 *
 * Every tool call the model asks for is answered by exactly one tool message
 * before the next model call, whatever happened to the tool.
 *
 * A turn is cancelled only when its thread is interrupted. An HTTP client
 * disconnect does not interrupt the servlet thread, so such a turn still runs
 * to completion and its messages appear on the next history read.
 */
@Service
@Slf4j
public class ChatOrchestrator {

    static final String NO_RESPONSE_YET = "No weather data available yet. Please request weather information first.";
    static final String HISTORY_CLEARED = "Message history cleared. Please request weather information.";
    static final String ROUND_LIMIT_TEXT = "I was unable to complete the request within the allowed steps.";
    static final String CANCELLED_TEXT = "The request was cancelled before it completed.";

    private final ModelGateway modelGateway;
    private final ToolClient toolClient;
    private final ConversationStore store;
    private final AssistantProperties props;
    private final Executor toolCallExecutor;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private final AtomicReference<String> latestResponse = new AtomicReference<>(NO_RESPONSE_YET);

    public ChatOrchestrator(ModelGateway modelGateway,
                            ToolClient toolClient,
                            ConversationStore store,
                            AssistantProperties props,
                            @Qualifier("toolCallExecutor") Executor toolCallExecutor) {
        this.modelGateway = modelGateway;
        this.toolClient = toolClient;
        this.store = store;
        this.props = props;
        this.toolCallExecutor = toolCallExecutor;
    }

    /**
     * Runs one user turn to completion.
     *
     * @throws InvalidInputException the text is blank; nothing is appended
     * @throws SessionBusyException  another turn is in flight
     */
    public FinalAnswer handleUserMessage(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Message is required");
        }
        String input = text.strip();

        acquireSession();
        try {
            TurnContext context = new TurnContext(input);
            log.info("Turn started [input='{}']", input);

            store.append(Message.user(input));
            FinalAnswer answer = executeLoop(context);
            latestResponse.set(answer.getText());

            log.info("Turn complete [status={}, rounds={}, toolCalls={}, latency={}ms, tokens={}]",
                    answer.getStatus(), answer.getRoundsUsed(), context.getExecutedToolCalls().size(),
                    context.getMetrics().elapsedMs(), context.getMetrics().totalTokens());
            context.getMetrics().toolCallRecords().forEach(r ->
                    log.debug("Tool call [{}] took {}ms (success={})", r.toolName(), r.latencyMs(), r.success()));
            return answer;
        } finally {
            sessionLock.unlock();
        }
    }

    /** History for display: everything except system messages, in insertion order. */
    public List<Message> getHistory() {
        return store.snapshot().stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .toList();
    }

    /** Waits for the session like a turn does; clearing twice is the same as clearing once. */
    public void clearHistory() {
        acquireSession();
        try {
            store.clear();
            latestResponse.set(HISTORY_CLEARED);
        } finally {
            sessionLock.unlock();
        }
    }

    public String getLatestResponse() {
        return latestResponse.get();
    }

    public ToolCatalog getToolCatalog() {
        return toolClient.listTools();
    }

    private FinalAnswer executeLoop(TurnContext context) {
        ToolCatalog catalog = toolClient.listTools();
        int maxRounds = Math.max(1, props.getMaxRounds());

        for (int round = 1; round <= maxRounds; round++) {
            if (Thread.currentThread().isInterrupted()) {
                return cancel(context);
            }
            context.setRoundsUsed(round);
            log.info("Round {}/{}", round, maxRounds);

            ModelResponse response;
            try {
                response = modelGateway.complete(store.snapshot(), catalog);
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return cancel(context);
                }
                return fail(context, e);
            }
            context.getMetrics().addTokens(response.getPromptTokens(), response.getCompletionTokens());

            if (response.isFinalText()) {
                store.append(Message.assistant(response.getContent()));
                return answer(context, response.getContent(), FinalAnswer.Status.COMPLETE, null);
            }

            List<ToolCallRequest> calls = response.getToolCalls();
            log.info("Model requested {} tool call(s): {}", calls.size(),
                    calls.stream().map(ToolCallRequest::getToolName).toList());

            store.append(Message.assistantToolCalls(calls));
            context.getExecutedToolCalls().addAll(calls);

            List<ToolResult> results = props.isParallelToolCalls() && calls.size() > 1
                    ? executeParallel(calls, context)
                    : executeSequential(calls, context);
            results.forEach(result -> store.append(Message.tool(result)));

            if (Thread.currentThread().isInterrupted()) {
                return cancel(context);
            }
        }

        log.warn("Round limit ({}) reached without a final answer", maxRounds);
        store.append(Message.system("Turn truncated: no final answer within " + maxRounds + " rounds."));
        return answer(context, ROUND_LIMIT_TEXT, FinalAnswer.Status.INCOMPLETE, null);
    }

    private List<ToolResult> executeSequential(List<ToolCallRequest> calls, TurnContext context) {
        List<ToolResult> results = new ArrayList<>(calls.size());
        for (ToolCallRequest call : calls) {
            results.add(Thread.currentThread().isInterrupted()
                    ? cancelled(call)
                    : executeOne(call, context));
        }
        return results;
    }

    /**
     * Runs the calls on the tool executor and collects the results in request
     * order. If the waiting thread is interrupted, calls that have not finished
     * yet are answered with CANCELLED results and the interrupt is restored.
     */
    private List<ToolResult> executeParallel(List<ToolCallRequest> calls, TurnContext context) {
        List<CompletableFuture<ToolResult>> futures = calls.stream()
                .map(call -> CompletableFuture.supplyAsync(() -> executeOne(call, context), toolCallExecutor))
                .toList();

        List<ToolResult> results = new ArrayList<>(calls.size());
        boolean interrupted = false;

        for (int i = 0; i < calls.size(); i++) {
            ToolCallRequest call = calls.get(i);
            CompletableFuture<ToolResult> future = futures.get(i);

            if (interrupted && !future.isDone()) {
                future.cancel(true);
                results.add(cancelled(call));
                continue;
            }
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                results.add(cancelled(call));
            } catch (ExecutionException e) {
                log.error("Tool [{}] failed unexpectedly", call.getToolName(), e.getCause());
                results.add(ToolResult.failure(ToolResult.ErrorType.APPLICATION,
                                "Tool execution failed: " + e.getCause().getMessage())
                        .withToolCallId(call.getId())
                        .withToolName(call.getToolName()));
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private ToolResult executeOne(ToolCallRequest call, TurnContext context) {
        String toolName = call.getToolName();
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();

        long start = System.currentTimeMillis();
        ToolResult result;
        try {
            result = toolClient.invoke(toolName, arguments);
            if (result == null) {
                result = ToolResult.failure(ToolResult.ErrorType.APPLICATION, "No result from tool: " + toolName);
            }
        } catch (ToolTimeoutException e) {
            result = ToolResult.failure(ToolResult.ErrorType.TIMEOUT, e.getMessage());
        } catch (ToolUnavailableException e) {
            ToolResult.ErrorType type = Thread.currentThread().isInterrupted()
                    ? ToolResult.ErrorType.CANCELLED
                    : ToolResult.ErrorType.UNAVAILABLE;
            result = ToolResult.failure(type, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool [{}] threw unexpectedly", toolName, e);
            result = ToolResult.failure(ToolResult.ErrorType.APPLICATION, "Tool execution failed: " + e.getMessage());
        }
        long latency = System.currentTimeMillis() - start;

        context.getMetrics().recordToolCall(toolName, latency, result.isSuccess());
        if (!result.isSuccess()) {
            log.warn("Tool [{}] failed ({}): {}", toolName, result.getErrorType(), result.getErrorDetail());
        }

        return result.withToolCallId(call.getId()).withToolName(toolName);
    }

    private ToolResult cancelled(ToolCallRequest call) {
        return ToolResult.failure(ToolResult.ErrorType.CANCELLED, "Tool call cancelled")
                .withToolCallId(call.getId())
                .withToolName(call.getToolName());
    }

    private FinalAnswer fail(TurnContext context, RuntimeException e) {
        log.error("Model call failed in round {}: {}", context.getRoundsUsed(), e.getMessage(), e);
        store.append(Message.system("Turn failed: model call error (" + e.getMessage() + ")"));
        return answer(context, degradedText(e), FinalAnswer.Status.FAILED, e.getMessage());
    }

    private FinalAnswer cancel(TurnContext context) {
        log.warn("Turn cancelled in round {}", context.getRoundsUsed());
        store.append(Message.system("Turn abandoned: the request was cancelled."));
        return answer(context, CANCELLED_TEXT, FinalAnswer.Status.FAILED, "cancelled");
    }

    private FinalAnswer answer(TurnContext context, String text, FinalAnswer.Status status, String errorDetail) {
        return FinalAnswer.builder()
                .text(text)
                .status(status)
                .toolCallsExecuted(List.copyOf(context.getExecutedToolCalls()))
                .roundsUsed(context.getRoundsUsed())
                .errorDetail(errorDetail)
                .build();
    }

    private void acquireSession() {
        boolean acquired;
        try {
            long waitMs = props.getSessionBusyWait() != null ? props.getSessionBusyWait().toMillis() : 0;
            acquired = waitMs > 0
                    ? sessionLock.tryLock(waitMs, TimeUnit.MILLISECONDS)
                    : sessionLock.tryLock();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionBusyException("Interrupted while waiting for the session");
        }
        if (!acquired) {
            throw new SessionBusyException("Another message is still being processed");
        }
    }

    private static String degradedText(RuntimeException e) {
        if (e instanceof ModelAuthException) {
            return "The assistant could not authenticate with the language model. Check the configured API key.";
        }
        if (e instanceof ModelRateLimitedException) {
            return "The language model is rate limiting requests. Please try again in a moment.";
        }
        if (e instanceof ModelUnavailableException) {
            return "The language model is currently unavailable. Please try again later.";
        }
        return "Sorry, something went wrong while generating a response.";
    }
}
