package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentHandle;
import com.scriptohio.orchestrator.agent.AgentInvocation;
import com.scriptohio.orchestrator.agent.AgentResult;
import com.scriptohio.orchestrator.agent.AgentUnavailableException;
import com.scriptohio.orchestrator.client.DataSourceException;
import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.SubTask;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a plan of subtasks on the worker pool.
 * <p>
 * Independent subtasks run in parallel; a subtask starts once all of its
 * dependencies have succeeded and receives their payloads under
 * {@code upstream}. Each attempt is guarded by a watchdog that fails it with
 * TIMEOUT and interrupts the worker. An attempt that finds its agent
 * saturated, or whose agent reports itself unavailable, is retried once on
 * the next routing candidate.
 */
@Slf4j
@Service
public class SubtaskExecutor {

    public static final String UPSTREAM = "upstream";
    public static final String CONTEXT = "context";

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final RequestRouter router;
    private final OrchestratorMetrics metrics;
    private final Duration defaultTimeout;

    @Autowired
    public SubtaskExecutor(@Qualifier("orchestratorWorkers") ExecutorService workers, RequestRouter router,
                           OrchestratorMetrics metrics, OrchestratorProperties properties) {
        this(workers, router, metrics, properties.getSubtaskTimeout());
    }

    public SubtaskExecutor(ExecutorService workers, RequestRouter router, OrchestratorMetrics metrics,
                           Duration defaultTimeout) {
        this.workers = workers;
        this.router = router;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(
            new CustomizableThreadFactory("orchestrator-watchdog-"));
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
    }

    public Map<String, SubtaskOutcome> executeAll(List<SubTask> plan, PermissionLevel callerPermission,
                                                  Map<String, Object> userContext, Map<String, Object> context,
                                                  ExecutionControl control) {
        Map<String, CompletableFuture<SubtaskOutcome>> futures = new LinkedHashMap<>();
        for (SubTask subtask : topologicalOrder(plan)) {
            List<CompletableFuture<SubtaskOutcome>> deps = new ArrayList<>();
            for (String dep : subtask.getDependsOn()) {
                deps.add(futures.get(dep));
            }
            CompletableFuture<SubtaskOutcome> future = CompletableFuture
                .allOf(deps.toArray(new CompletableFuture[0]))
                .thenCompose(ignored -> {
                    Map<String, Object> upstream = new LinkedHashMap<>();
                    for (CompletableFuture<SubtaskOutcome> dep : deps) {
                        SubtaskOutcome outcome = dep.join();
                        if (!outcome.isSuccess()) {
                            return CompletableFuture.completedFuture(SubtaskOutcome.failed(subtask,
                                ErrorKind.DEPENDENCY_FAILED,
                                "Dependency " + outcome.getSubtask().getId() + " failed: " + outcome.getErrorKind()));
                        }
                        upstream.put(outcome.getSubtask().getId(), outcome.payload());
                    }
                    return launch(subtask, upstream, callerPermission, userContext, context, control);
                })
                .exceptionally(e -> {
                    log.error("Unexpected failure scheduling subtask {}", subtask.getId(), e);
                    return SubtaskOutcome.failed(subtask, ErrorKind.INTERNAL_AGENT_ERROR, String.valueOf(e.getMessage()));
                });
            futures.put(subtask.getId(), future);
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<String, SubtaskOutcome> outcomes = new LinkedHashMap<>();
        for (SubTask subtask : plan) {
            outcomes.put(subtask.getId(), futures.get(subtask.getId()).join());
        }
        return outcomes;
    }

    private CompletableFuture<SubtaskOutcome> launch(SubTask subtask, Map<String, Object> upstream,
                                                     PermissionLevel callerPermission,
                                                     Map<String, Object> userContext,
                                                     Map<String, Object> context, ExecutionControl control) {
        if (control.isCancelled()) {
            return CompletableFuture.completedFuture(
                SubtaskOutcome.failed(subtask, ErrorKind.CANCELLED, "Request cancelled"));
        }

        RoutingDecision decision;
        try {
            decision = router.route(subtask.getAgentType(), subtask.getAction(), callerPermission);
        } catch (RoutingException e) {
            log.warn("Subtask {} not routed: {} {}", subtask.getId(), e.getKind(), e.getMessage());
            return CompletableFuture.completedFuture(SubtaskOutcome.failed(subtask, e.getKind(), e.getMessage()));
        }

        Map<String, Object> parameters = new HashMap<>(subtask.getParameters());
        if (!upstream.isEmpty()) {
            parameters.put(UPSTREAM, upstream);
        }
        if (context != null) {
            parameters.putIfAbsent(CONTEXT, context);
        }

        AgentInvocation invocation = new AgentInvocation(control.getRequestId(), subtask.getId(), userContext,
            callerPermission, control.flag());
        List<AgentHandle> alternates = decision.alternates();
        return attempt(decision.primary(), subtask, parameters, invocation, control)
            .thenCompose(outcome -> {
                if (outcome.getErrorKind() == ErrorKind.AGENT_UNAVAILABLE && !alternates.isEmpty()) {
                    log.info("Agent {} unavailable, retrying {} on {}",
                        outcome.getAgentId(), subtask.getId(), alternates.get(0).getAgentId());
                    return attempt(alternates.get(0), subtask, parameters, invocation, control);
                }
                return CompletableFuture.completedFuture(outcome);
            });
    }

    private CompletableFuture<SubtaskOutcome> attempt(AgentHandle handle, SubTask subtask,
                                                      Map<String, Object> parameters, AgentInvocation invocation,
                                                      ExecutionControl control) {
        if (!handle.tryAcquire()) {
            return CompletableFuture.completedFuture(outcome(handle, subtask, null, ErrorKind.AGENT_UNAVAILABLE,
                "Agent " + handle.getAgentId() + " is at capacity", 0));
        }

        long start = System.nanoTime();
        CompletableFuture<SubtaskOutcome> promise = new CompletableFuture<>();
        AtomicBoolean started = new AtomicBoolean();
        AtomicBoolean released = new AtomicBoolean();
        Runnable release = () -> {
            if (released.compareAndSet(false, true)) {
                handle.release();
            }
        };

        Future<?> work;
        try {
            work = workers.submit(() -> {
                started.set(true);
                try {
                    AgentResult result = handle.getAgent().execute(subtask.getAction(), parameters, invocation);
                    promise.complete(outcome(handle, subtask, result, null, null, elapsed(start)));
                } catch (CancellationException | InterruptedException e) {
                    promise.complete(outcome(handle, subtask, null, ErrorKind.CANCELLED,
                        "Subtask interrupted", elapsed(start)));
                } catch (AgentUnavailableException e) {
                    log.warn("Agent {} unavailable for {}: {}", handle.getAgentId(), subtask.getAction(), e.getMessage());
                    promise.complete(outcome(handle, subtask, null, ErrorKind.AGENT_UNAVAILABLE,
                        e.getMessage(), elapsed(start)));
                } catch (DataSourceException e) {
                    log.warn("Agent {} data source failed on {}: {} {}", handle.getAgentId(), subtask.getAction(),
                        e.getKind(), e.getMessage());
                    promise.complete(outcome(handle, subtask, null, ErrorKind.INTERNAL_AGENT_ERROR,
                        "Data source " + e.getKind() + ": " + e.getMessage(), elapsed(start)).toBuilder()
                        .sourceError(e.getKind())
                        .build());
                } catch (Exception e) {
                    if (!promise.isDone()) {
                        log.error("Agent {} failed on {}: {}", handle.getAgentId(), subtask.getAction(), e.getMessage(), e);
                    }
                    promise.complete(outcome(handle, subtask, null, ErrorKind.INTERNAL_AGENT_ERROR,
                        e.getClass().getSimpleName() + ": " + e.getMessage(), elapsed(start)));
                } finally {
                    release.run();
                }
            });
        } catch (RejectedExecutionException e) {
            release.run();
            return CompletableFuture.completedFuture(outcome(handle, subtask, null, ErrorKind.AGENT_UNAVAILABLE,
                "Worker pool is full", 0));
        }

        Runnable stop = () -> {
            if (work.cancel(true) && !started.get()) {
                release.run();
            }
        };
        Runnable canceller = () -> {
            if (promise.complete(outcome(handle, subtask, null, ErrorKind.CANCELLED,
                "Request cancelled", elapsed(start)))) {
                stop.run();
            }
        };
        control.onCancel(canceller);

        long timeoutMillis = subtask.getTimeoutMillis() != null ? subtask.getTimeoutMillis() : defaultTimeout.toMillis();
        ScheduledFuture<?> timer = watchdog.schedule(() -> {
            if (promise.complete(outcome(handle, subtask, null, ErrorKind.TIMEOUT,
                "No result within " + timeoutMillis + " ms", elapsed(start)))) {
                log.warn("Subtask {} on {} timed out after {} ms", subtask.getId(), handle.getAgentId(), timeoutMillis);
                stop.run();
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);

        return promise.whenComplete((outcome, error) -> {
            timer.cancel(false);
            control.forget(canceller);
            if (outcome != null && metrics != null) {
                metrics.recordSubtask(handle.getAgentType(), handle.getAgentId(), outcome.getErrorKind(),
                    Duration.ofMillis(outcome.getDurationMillis()));
            }
        });
    }

    // callers validate that dependencies exist and are acyclic
    static List<SubTask> topologicalOrder(List<SubTask> plan) {
        Map<String, SubTask> byId = new LinkedHashMap<>();
        plan.forEach(s -> byId.put(s.getId(), s));
        List<SubTask> ordered = new ArrayList<>();
        Map<String, Boolean> visited = new HashMap<>();
        for (SubTask subtask : plan) {
            visit(subtask, byId, visited, ordered);
        }
        return ordered;
    }

    private static void visit(SubTask subtask, Map<String, SubTask> byId, Map<String, Boolean> visited,
                              List<SubTask> ordered) {
        Boolean state = visited.get(subtask.getId());
        if (Boolean.TRUE.equals(state)) {
            return;
        }
        if (Boolean.FALSE.equals(state)) {
            throw new IllegalArgumentException("Dependency cycle through subtask " + subtask.getId());
        }
        visited.put(subtask.getId(), false);
        for (String dep : subtask.getDependsOn()) {
            SubTask target = byId.get(dep);
            if (target == null) {
                throw new IllegalArgumentException("Subtask " + subtask.getId() + " depends on unknown " + dep);
            }
            visit(target, byId, visited, ordered);
        }
        visited.put(subtask.getId(), true);
        ordered.add(subtask);
    }

    private static SubtaskOutcome outcome(AgentHandle handle, SubTask subtask, AgentResult result,
                                          ErrorKind kind, String error, long durationMillis) {
        return SubtaskOutcome.builder()
            .subtask(subtask)
            .agentId(handle.getAgentId())
            .agentType(handle.getAgentType())
            .agentPermission(handle.getDescriptor().getPermissionLevel())
            .result(result)
            .errorKind(kind)
            .error(error)
            .durationMillis(durationMillis)
            .build();
    }

    private static long elapsed(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
