package com.dealplatform.agents.invoke;

import com.dealplatform.agents.agent.ReasoningAgent;
import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.ReasoningBackend;
import com.dealplatform.common.exception.AgentFailureException;
import com.dealplatform.common.exception.BackendFailureKind;
import com.dealplatform.common.exception.ReasoningBackendException;
import com.dealplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one agent role against the reasoning backend under the shared invocation policy.
 *
 * <p>Every attempt is bounded by {@link AgentInvocationPolicy#timeout()}. Backend failures,
 * timeouts and malformed output are retried with exponential backoff; once the attempt
 * budget is spent the last failure is surfaced as {@link AgentFailureException}. Any other
 * error is not retried.
 */
@Component
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private final ReasoningBackend backend;
    private final AgentInvocationPolicy policy;

    public AgentInvoker(ReasoningBackend backend, AgentInvocationPolicy policy) {
        this.backend = backend;
        this.policy = policy;
    }

    public <C, R> Mono<R> invoke(ReasoningAgent<C, R> agent, C context) {
        AgentRole role = agent.role();
        AtomicInteger attempts = new AtomicInteger();

        Mono<R> attempt = Mono.deferContextual(ctx -> {
            int n = attempts.incrementAndGet();
            String negotiationId = TraceContextUtil.getNegotiationId(ctx);
            TraceContextUtil.withMdc(negotiationId, () ->
                log.info("[AgentInvoker] INVOKE agent={} attempt={}/{} backend={}",
                    agent.agentName(), n, policy.maxAttempts(), backend.name()));

            return backend.invoke(role, agent.describe(context))
                .switchIfEmpty(Mono.error(() -> new ReasoningBackendException(
                    role, BackendFailureKind.MALFORMED_OUTPUT, "backend returned no output")))
                .timeout(policy.timeout())
                .onErrorMap(TimeoutException.class, e -> new ReasoningBackendException(
                    role, BackendFailureKind.TIMEOUT, "no answer within " + policy.timeout(), e))
                .map(output -> agent.parse(context, output))
                .doOnError(ReasoningBackendException.class, e ->
                    TraceContextUtil.withMdc(negotiationId, () ->
                        log.warn("[AgentInvoker] ATTEMPT_FAILED agent={} attempt={} kind={} reason={}",
                            agent.agentName(), n, e.getKind(), e.getMessage())));
        });

        return attempt
            .retryWhen(Retry.backoff(policy.maxAttempts() - 1L, policy.backoff())
                .filter(ReasoningBackendException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .onErrorMap(e -> !(e instanceof AgentFailureException),
                e -> new AgentFailureException(role, attempts.get(), e))
            .doOnError(AgentFailureException.class, e ->
                log.error("[AgentInvoker] EXHAUSTED agent={} attempts={} cause={}",
                    agent.agentName(), e.getAttempts(), e.getCause() != null ? e.getCause().getMessage() : "-"));
    }

    public AgentInvocationPolicy policy() {
        return policy;
    }
}
