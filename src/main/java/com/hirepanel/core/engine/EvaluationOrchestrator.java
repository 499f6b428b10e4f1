package com.hirepanel.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.hirepanel.core.events.EvaluationEvent;
import com.hirepanel.core.events.EventBus;
import com.hirepanel.core.llm.EvaluationResponseMapper;
import com.hirepanel.core.llm.EvaluationSchemaFactory;
import com.hirepanel.core.llm.ModelCallException;
import com.hirepanel.core.llm.ModelClient;
import com.hirepanel.core.llm.ModelRequest;
import com.hirepanel.core.llm.RawModelPayload;
import com.hirepanel.core.logging.MdcContext;
import com.hirepanel.core.metrics.EvaluationMetrics;
import com.hirepanel.core.model.ErrorKind;
import com.hirepanel.core.model.EvaluationOutcome;
import com.hirepanel.core.model.EvaluationRequest;
import com.hirepanel.core.model.Persona;
import com.hirepanel.core.model.PersonaEvaluation;
import com.hirepanel.core.model.PersonaState;
import com.hirepanel.core.model.RunStatus;
import com.hirepanel.core.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one model call per enabled persona and resolves every persona to exactly one
 * {@link EvaluationOutcome}.
 * <p>
 * Each persona runs on its own worker and walks {@link PersonaState} from
 * {@code PENDING} to {@code SUCCESS} or {@code FAILED}, publishing every transition.
 * A semaphore bounds the calls in flight. The model call itself runs on a separate
 * pool so the worker can enforce the per-call timeout and cancel it. A failed persona
 * is never retried. Cancelling the run's token interrupts in-flight calls and
 * resolves every unfinished persona to {@code CANCELLED}.
 */
@Component
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    /** Upper bound on waiting for interrupted workers to publish their final events. */
    private static final long WORKER_DRAIN_SECONDS = 5;

    private final PromptBuilder promptBuilder;
    private final EvaluationSchemaFactory schemaFactory;
    private final ModelClient modelClient;
    private final EventBus eventBus;
    private final EvaluationMetrics metrics;

    private final Set<String> activeCandidates = ConcurrentHashMap.newKeySet();

    @Autowired
    public EvaluationOrchestrator(PromptBuilder promptBuilder, EvaluationSchemaFactory schemaFactory,
                                  ModelClient modelClient, EventBus eventBus, EvaluationMetrics metrics) {
        this.promptBuilder = promptBuilder;
        this.schemaFactory = schemaFactory;
        this.modelClient = modelClient;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Evaluates all requests and blocks until every persona is resolved.
     *
     * @param runId        identifier used for events and logging
     * @param candidateKey identity of the candidate; a second concurrent run for it is rejected
     * @throws EvaluationInProgressException if a run for {@code candidateKey} is already active
     */
    public EvaluationRun run(String runId, String candidateKey, List<EvaluationRequest> requests, RunOptions options) {
        if (!activeCandidates.add(candidateKey)) {
            throw new EvaluationInProgressException(candidateKey);
        }
        try {
            return dispatch(runId, requests, options);
        } finally {
            activeCandidates.remove(candidateKey);
        }
    }

    private EvaluationRun dispatch(String runId, List<EvaluationRequest> requests, RunOptions options) {
        log.info("Dispatching {} persona evaluation(s), concurrency {}, timeout {}s",
                requests.size(), options.concurrency(), options.timeout().toSeconds());
        eventBus.publish(EvaluationEvent.of(EvaluationEvent.RUN_STARTED, runId, null,
                Map.of("personas", requests.size(), "concurrency", options.concurrency())));

        var semaphore = new Semaphore(options.concurrency());
        ExecutorService workers = Executors.newCachedThreadPool(namedThreads("persona-worker"));
        ExecutorService calls = Executors.newCachedThreadPool(namedThreads("model-call"));
        var futures = new LinkedHashMap<String, CompletableFuture<EvaluationOutcome>>();

        CancellationToken.Registration registration = null;
        try {
            for (EvaluationRequest request : requests) {
                String key = request.persona().key();
                if (options.cancellationToken().isCancelled()) {
                    futures.put(key, CompletableFuture.completedFuture(
                            new EvaluationOutcome.Failure(key, ErrorKind.CANCELLED, "Run cancelled before dispatch")));
                    continue;
                }
                futures.put(key, CompletableFuture.supplyAsync(
                        () -> evaluatePersona(runId, request, semaphore, calls, options), workers));
            }

            registration = options.cancellationToken().onCancel(() -> {
                log.warn("Run {} cancelled, aborting in-flight persona calls", runId);
                calls.shutdownNow();
                workers.shutdownNow();
                futures.forEach((key, future) -> future.complete(
                        new EvaluationOutcome.Failure(key, ErrorKind.CANCELLED, "Run cancelled")));
            });

            var outcomes = new ArrayList<EvaluationOutcome>();
            for (var entry : futures.entrySet()) {
                try {
                    outcomes.add(entry.getValue().join());
                } catch (CompletionException | CancellationException e) {
                    log.error("Unexpected error collecting outcome for {}", entry.getKey(), e);
                    outcomes.add(new EvaluationOutcome.Failure(entry.getKey(), ErrorKind.CANCELLED,
                            "Worker terminated: " + e.getMessage()));
                }
            }

            calls.shutdownNow();
            drainWorkers(runId, workers);

            RunStatus status = RunStatus.of(outcomes);
            long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
            log.info("Run {} finished: {} ({} of {} persona(s) failed)", runId, status, failed, outcomes.size());
            metrics.recordRunResult(status);
            eventBus.publish(EvaluationEvent.of(EvaluationEvent.RUN_COMPLETED, runId, null,
                    Map.of("status", status.name(), "failed", failed, "total", outcomes.size())));
            return new EvaluationRun(runId, outcomes, status);
        } finally {
            if (registration != null) {
                registration.remove();
            }
            calls.shutdownNow();
            workers.shutdownNow();
        }
    }

    /**
     * Waits for persona workers to finish so that no persona event or metric is recorded
     * after the run completes. After cancellation the interrupted workers still publish
     * their {@code FAILED} transition.
     */
    private static void drainWorkers(String runId, ExecutorService workers) {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(WORKER_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Run {}: persona workers still running after {}s", runId, WORKER_DRAIN_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run {}: interrupted while waiting for persona workers", runId);
        }
    }

    private EvaluationOutcome evaluatePersona(String runId, EvaluationRequest request, Semaphore semaphore,
                                              ExecutorService calls, RunOptions options) {
        Persona persona = request.persona();
        MdcContext.setPersona(runId, persona.key());
        long startMs = System.currentTimeMillis();
        transition(runId, persona, PersonaState.PENDING);
        try {
            semaphore.acquire();
            try {
                if (options.cancellationToken().isCancelled()) {
                    return fail(runId, persona, ErrorKind.CANCELLED, "Run cancelled", startMs);
                }
                String prompt = promptBuilder.build(request);
                JsonNode schema = schemaFactory.schemaFor(persona);
                transition(runId, persona, PersonaState.PROMPT_BUILT);

                var modelRequest = new ModelRequest(prompt, schema, request.modelName(),
                        request.temperature(), options.timeout());
                Future<RawModelPayload> call = calls.submit(() -> {
                    MdcContext.setPersona(runId, persona.key());
                    try {
                        return modelClient.evaluate(modelRequest);
                    } finally {
                        MdcContext.clear();
                    }
                });
                transition(runId, persona, PersonaState.REQUEST_IN_FLIGHT);

                RawModelPayload payload;
                try {
                    payload = call.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    call.cancel(true);
                    return fail(runId, persona, ErrorKind.TIMEOUT,
                            "No response within " + options.timeout().toSeconds() + "s", startMs);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ModelCallException mce) {
                        return fail(runId, persona, mce.kind(), mce.getMessage(), startMs);
                    }
                    return fail(runId, persona, ErrorKind.BACKEND_UNREACHABLE, String.valueOf(cause), startMs);
                }
                transition(runId, persona, PersonaState.PARSED_OK);

                PersonaEvaluation evaluation = EvaluationResponseMapper.toEvaluation(persona, payload.json());
                transition(runId, persona, PersonaState.VALIDATED);

                long elapsedMs = System.currentTimeMillis() - startMs;
                metrics.recordPersonaDuration(persona.key(), "success", elapsedMs);
                transition(runId, persona, PersonaState.SUCCESS);
                eventBus.publish(EvaluationEvent.of(EvaluationEvent.PERSONA_COMPLETED, runId, persona.key(),
                        Map.of("persona", persona.displayName(),
                               "criteria", evaluation.criterionScores().size(),
                               "elapsedMs", elapsedMs)));
                log.info("{} evaluation complete ({}s)", persona.displayName(),
                        String.format("%.1f", elapsedMs / 1000.0));
                return new EvaluationOutcome.Success(evaluation);
            } finally {
                semaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(runId, persona, ErrorKind.CANCELLED, "Interrupted", startMs);
        } catch (CancellationException | RejectedExecutionException e) {
            return fail(runId, persona, ErrorKind.CANCELLED, "Run cancelled", startMs);
        } catch (ModelCallException e) {
            return fail(runId, persona, e.kind(), e.getMessage(), startMs);
        } catch (RuntimeException e) {
            log.error("Unexpected failure evaluating {}: {}", persona.key(), e.getMessage(), e);
            return fail(runId, persona, ErrorKind.INTERNAL_ERROR, String.valueOf(e), startMs);
        } finally {
            MdcContext.clear();
        }
    }

    private EvaluationOutcome.Failure fail(String runId, Persona persona, ErrorKind kind, String detail, long startMs) {
        long elapsedMs = System.currentTimeMillis() - startMs;
        log.warn("{} evaluation failed [{}]: {}", persona.displayName(), kind, detail);
        metrics.recordPersonaDuration(persona.key(), kind.name().toLowerCase(), elapsedMs);
        metrics.recordPersonaFailure(kind);
        transition(runId, persona, PersonaState.FAILED);
        String safeDetail = detail != null ? detail : kind.name();
        eventBus.publish(EvaluationEvent.of(EvaluationEvent.PERSONA_FAILED, runId, persona.key(),
                Map.of("persona", persona.displayName(),
                       "errorKind", kind.name(),
                       "detail", safeDetail)));
        return new EvaluationOutcome.Failure(persona.key(), kind, safeDetail);
    }

    private void transition(String runId, Persona persona, PersonaState state) {
        log.debug("{} -> {}", persona.key(), state);
        eventBus.publish(EvaluationEvent.of(EvaluationEvent.PERSONA_STATE, runId, persona.key(),
                Map.of("state", state.name())));
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
