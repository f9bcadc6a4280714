package com.hivemind.core.llm;

import com.hivemind.core.action.ActionParser;
import com.hivemind.core.action.AgentAction;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes agent generation requests across providers and models.
 * <p>
 * Each agent role has a preferred cascade of models. The router picks the first model
 * in the cascade with capacity in its trailing 60 s window, reserving a request slot in
 * the same critical section, and fails over on rate limits, auth errors and transient
 * server errors. Token usage is tracked per agent and globally and checked against a
 * spend ceiling before every call.
 */
@Service
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private static final double BUDGET_WARNING_RATIO = 0.8;
    private static final Duration MIN_WAIT = Duration.ofSeconds(1);

    private final Map<String, ModelState> models = new LinkedHashMap<>();
    private final Map<String, List<String>> cascades;
    private final List<String> defaultCascade;
    private final String plannerRole;
    private final int maxRetries;
    private final int escalationThreshold;
    private final double temperature;

    private final ProviderRegistry providers;
    private final ActionParser parser;
    private final HivemindMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Object lock = new Object();
    private final List<Consumer<BudgetStatus>> budgetListeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private TokenUsage globalUsage = TokenUsage.ZERO;
    private final Map<String, TokenUsage> agentUsage = new HashMap<>();
    private final Map<String, Pin> pins = new HashMap<>();
    private final Map<String, Integer> agentFailures = new HashMap<>();
    private final Set<String> escalated = new HashSet<>();
    private double budgetLimitUsd;
    private boolean budgetWarningSent;
    private boolean budgetExceeded;
    private String activeModel = "none";

    private record Pin(String model, PinPolicy policy) {
    }

    public RequestRouter(RouterProperties properties, ProviderRegistry providers, ActionParser parser,
                         HivemindMetrics metrics, Clock clock, Sleeper sleeper) {
        this.providers = providers;
        this.parser = parser;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.cascades = lowerCaseKeys(properties.resolveCascades());
        this.defaultCascade = List.copyOf(properties.resolveDefaultCascade());
        this.plannerRole = properties.getPlannerRole().toLowerCase(Locale.ROOT);
        this.maxRetries = Math.max(1, properties.getMaxRetries());
        this.escalationThreshold = properties.getEscalationThreshold();
        this.temperature = properties.getTemperature();
        this.budgetLimitUsd = properties.getBudgetUsd();

        for (ModelSpec spec : properties.resolveModels()) {
            if (providers.contains(spec.provider())) {
                models.put(spec.name(), new ModelState(spec));
            }
        }
        models.keySet().stream().findFirst().ifPresent(first -> activeModel = first);
        log.info("Model router ready: {} models across {} providers", models.size(), providers.names().size());
    }

    /**
     * Asks the best available model for the agent's next action.
     *
     * @param role agent role name, used to pick the cascade (case-insensitive)
     * @throws BudgetExhaustedException    spend has reached the ceiling
     * @throws ProvidersExhaustedException no provider is configured or every model failed authentication
     * @throws ModelsExhaustedException    every allowed attempt failed
     * @throws InterruptedException        the calling agent thread was interrupted while waiting
     */
    public AgentAction generate(String agentId, String systemPrompt, List<ChatTurn> messages, String role)
            throws InterruptedException {
        if (models.isEmpty()) {
            throw new ProvidersExhaustedException(
                    "No LLM providers initialized. Set an API key for at least one provider.");
        }
        checkBudget();

        int totalAttempts = maxRetries * models.size();
        Throwable lastError = null;

        for (int attempt = 0; attempt < totalAttempts; attempt++) {
            ModelState state;
            Duration wait = Duration.ZERO;
            synchronized (lock) {
                if (allAuthFailed()) {
                    throw new ProvidersExhaustedException(
                            "Every registered model failed authentication; check provider API keys");
                }
                state = select(agentId, role);
                if (state == null) {
                    wait = shortestWait(agentId);
                }
            }
            if (state == null) {
                Duration pause = wait.compareTo(MIN_WAIT) < 0 ? MIN_WAIT : wait;
                log.warn("[{}] All models at capacity, waiting {}s", agentId, pause.toSeconds());
                sleeper.sleep(pause);
                continue;
            }

            Optional<LlmProvider> provider = providers.get(state.spec().provider());
            if (provider.isEmpty()) {
                synchronized (lock) {
                    state.recordError(clock.instant());
                }
                continue;
            }

            GenerationRequest request = new GenerationRequest(state.name(), systemPrompt, messages, temperature, true);
            try {
                return complete(agentId, state, dispatch(provider.get(), request));
            } catch (ProviderException e) {
                lastError = e;
                metrics.recordModelRequest(state.name(), e.kind().tag());
                switch (e.kind()) {
                    case RATE_LIMITED -> {
                        Duration cooldown;
                        synchronized (lock) {
                            cooldown = state.recordRateLimit(clock.instant());
                        }
                        metrics.recordCooldown(state.name(), "rate_limited", cooldown);
                        log.warn("[{}] {} rate-limited, trying next model", agentId, state.name());
                    }
                    case AUTH -> {
                        Duration cooldown;
                        boolean noneLeft;
                        synchronized (lock) {
                            cooldown = state.markAuthFailed(clock.instant());
                            noneLeft = allAuthFailed();
                        }
                        metrics.recordCooldown(state.name(), "auth", cooldown);
                        log.error("[{}] Auth error on {}: {}", agentId, state.name(), e.getMessage());
                        if (noneLeft) {
                            throw new ProvidersExhaustedException(
                                    "Every registered model failed authentication; check provider API keys");
                        }
                    }
                    case NOT_FOUND -> {
                        synchronized (lock) {
                            state.cooldown(clock.instant(), ModelState.NOT_FOUND_COOLDOWN);
                        }
                        metrics.recordCooldown(state.name(), "not_found", ModelState.NOT_FOUND_COOLDOWN);
                        log.warn("[{}] {} not found, cooling down", agentId, state.name());
                    }
                    case INVALID_REQUEST -> {
                        boolean slot;
                        synchronized (lock) {
                            Instant now = clock.instant();
                            slot = state.hasCapacity(now);
                            if (slot) {
                                state.reserveSlot(now);
                            }
                        }
                        if (!slot) {
                            log.warn("[{}] {} rejected the request and has no capacity left, trying next model",
                                    agentId, state.name());
                            continue;
                        }
                        log.warn("[{}] {} rejected the request, retrying without JSON mode", agentId, state.name());
                        try {
                            return complete(agentId, state, dispatch(provider.get(), request.withoutStructuredOutput()));
                        } catch (ProviderException retry) {
                            lastError = retry;
                            log.error("[{}] Retry without JSON mode failed on {}: {}",
                                    agentId, state.name(), retry.getMessage());
                            coolAfterError(state);
                        }
                    }
                    case SERVER -> {
                        coolAfterError(state);
                        Duration backoff = Duration.ofSeconds(1L << (attempt % 3));
                        log.warn("[{}] Server error on {}, retrying in {}s", agentId, state.name(), backoff.toSeconds());
                        sleeper.sleep(backoff);
                    }
                    default -> {
                        log.error("[{}] LLM error ({}): {}", agentId, state.name(), e.getMessage());
                        coolAfterError(state);
                    }
                }
            }
        }

        throw new ModelsExhaustedException(totalAttempts, lastError);
    }

    private ProviderResponse dispatch(LlmProvider provider, GenerationRequest request) {
        Instant start = clock.instant();
        ProviderResponse response;
        try {
            response = provider.generate(request);
        } catch (RuntimeException e) {
            throw ProviderException.from(e);
        }
        metrics.recordModelLatency(request.model(), Duration.between(start, clock.instant()));
        return response;
    }

    private AgentAction complete(String agentId, ModelState state, ProviderResponse response) {
        double cost = state.spec().costFor(response.inputTokens(), response.outputTokens());
        synchronized (lock) {
            state.recordSuccess();
            globalUsage = globalUsage.add(response.inputTokens(), response.outputTokens(), cost);
            agentUsage.merge(agentId, TokenUsage.ZERO.add(response.inputTokens(), response.outputTokens(), cost),
                    (a, b) -> a.add(b.inputTokens(), b.outputTokens(), b.costUsd()));
        }
        metrics.recordModelRequest(state.name(), "success");
        metrics.recordTokens(state.name(), response.inputTokens(), response.outputTokens());
        if (cost > 0) {
            metrics.recordCost(cost);
        }
        log.info("[{}] {} [{}] responded", agentId, state.name(), state.spec().provider());
        return parser.parse(response.text());
    }

    private void coolAfterError(ModelState state) {
        Duration cooldown;
        synchronized (lock) {
            cooldown = state.recordError(clock.instant());
        }
        metrics.recordCooldown(state.name(), "error", cooldown);
    }

    // --- selection (caller holds lock) ---

    private ModelState select(String agentId, String role) {
        Instant now = clock.instant();
        Pin pin = pins.get(agentId);
        if (pin != null && models.containsKey(pin.model())) {
            ModelState pinned = models.get(pin.model());
            if (pin.policy() == PinPolicy.WAIT) {
                if (pinned.isAuthFailed()) {
                    throw new ProvidersExhaustedException(
                            "Pinned model " + pinned.name() + " failed authentication");
                }
                return take(pinned, now);
            }
            if (pinned.hasCapacity(now)) {
                return take(pinned, now);
            }
        }

        for (String name : cascadeFor(agentId, role)) {
            ModelState state = models.get(name);
            if (state != null && state.hasCapacity(now)) {
                if (!name.equals(activeModel)) {
                    log.info("Routing to {} [{}/{}]", name, state.spec().provider(), state.spec().tier());
                }
                return take(state, now);
            }
        }

        for (ModelState state : models.values()) {
            if (state.hasCapacity(now)) {
                log.warn("Fallback to {} (no role-preferred model available)", state.name());
                return take(state, now);
            }
        }
        return null;
    }

    private ModelState take(ModelState state, Instant now) {
        if (!state.hasCapacity(now)) {
            return null;
        }
        state.reserveSlot(now);
        activeModel = state.name();
        return state;
    }

    private List<String> cascadeFor(String agentId, String role) {
        if (escalated.contains(agentId)) {
            return cascades.getOrDefault(plannerRole, defaultCascade);
        }
        String key = role == null ? "" : role.toLowerCase(Locale.ROOT);
        return cascades.getOrDefault(key, defaultCascade);
    }

    private Duration shortestWait(String agentId) {
        Instant now = clock.instant();
        Pin pin = pins.get(agentId);
        Collection<ModelState> candidates = pin != null && pin.policy() == PinPolicy.WAIT && models.containsKey(pin.model())
                ? List.of(models.get(pin.model()))
                : models.values();
        return candidates.stream()
                .map(s -> s.waitTime(now))
                .min(Duration::compareTo)
                .orElse(MIN_WAIT);
    }

    private boolean allAuthFailed() {
        return models.values().stream().allMatch(ModelState::isAuthFailed);
    }

    // --- budget ---

    private void checkBudget() {
        BudgetStatus event = null;
        BudgetExhaustedException exhausted = null;
        synchronized (lock) {
            if (budgetLimitUsd <= 0) {
                return;
            }
            double cost = globalUsage.costUsd();
            double ratio = cost / budgetLimitUsd;
            if (ratio >= 1.0) {
                if (!budgetExceeded) {
                    budgetExceeded = true;
                    log.warn("Budget EXCEEDED: ${} / ${}", String.format("%.4f", cost), String.format("%.2f", budgetLimitUsd));
                    metrics.recordBudgetEvent("exceeded");
                    event = budgetStatusLocked();
                }
                exhausted = new BudgetExhaustedException(budgetLimitUsd, cost);
            } else if (ratio >= BUDGET_WARNING_RATIO && !budgetWarningSent) {
                budgetWarningSent = true;
                log.warn("Budget WARNING: ${} / ${} (80%)", String.format("%.4f", cost), String.format("%.2f", budgetLimitUsd));
                metrics.recordBudgetEvent("warning");
                event = budgetStatusLocked();
            }
        }
        if (event != null) {
            for (Consumer<BudgetStatus> listener : budgetListeners) {
                try {
                    listener.accept(event);
                } catch (Exception e) {
                    log.warn("Budget listener threw: {}", e.getMessage());
                }
            }
        }
        if (exhausted != null) {
            throw exhausted;
        }
    }

    /**
     * Registers a callback for the one-time 80% warning and the first exhaustion.
     */
    public void onBudgetEvent(Consumer<BudgetStatus> listener) {
        budgetListeners.add(listener);
    }

    /**
     * Sets a new ceiling and re-arms the warning, so calls resume after the limit is raised.
     */
    public void setBudget(double limitUsd) {
        synchronized (lock) {
            budgetLimitUsd = limitUsd;
            budgetExceeded = false;
            budgetWarningSent = false;
        }
        log.info("Budget set to ${}", String.format("%.2f", limitUsd));
    }

    public BudgetStatus budgetStatus() {
        synchronized (lock) {
            return budgetStatusLocked();
        }
    }

    private BudgetStatus budgetStatusLocked() {
        double cost = globalUsage.costUsd();
        double pct = budgetLimitUsd > 0 ? cost / budgetLimitUsd * 100 : 0;
        return new BudgetStatus(
                budgetLimitUsd,
                cost,
                Math.max(0, budgetLimitUsd - cost),
                Math.min(pct, 100),
                budgetExceeded,
                budgetWarningSent);
    }

    // --- escalation and pinning ---

    /**
     * Counts a failed agent-loop iteration; at the threshold the agent is routed through the planner cascade.
     */
    public void recordAgentFailure(String agentId) {
        boolean escalatedNow = false;
        synchronized (lock) {
            int failures = agentFailures.merge(agentId, 1, Integer::sum);
            if (failures >= escalationThreshold && escalated.add(agentId)) {
                escalatedNow = true;
            }
        }
        if (escalatedNow) {
            log.warn("[{}] Escalating to {} models after {} consecutive failures",
                    agentId, plannerRole, escalationThreshold);
            metrics.incrementEscalations("consecutive_failures");
        }
    }

    public void recordAgentSuccess(String agentId) {
        boolean deescalated;
        synchronized (lock) {
            agentFailures.remove(agentId);
            deescalated = escalated.remove(agentId);
        }
        if (deescalated) {
            log.info("[{}] De-escalated back to role cascade", agentId);
        }
    }

    public boolean isEscalated(String agentId) {
        synchronized (lock) {
            return escalated.contains(agentId);
        }
    }

    public void pin(String agentId, String model, PinPolicy policy) {
        synchronized (lock) {
            if (!models.containsKey(model)) {
                log.warn("[{}] Pinned to unregistered model {}, the role cascade will be used", agentId, model);
            }
            pins.put(agentId, new Pin(model, policy));
        }
    }

    public void unpin(String agentId) {
        synchronized (lock) {
            pins.remove(agentId);
        }
    }

    // --- status views ---

    public List<ModelStatus> modelStates() {
        synchronized (lock) {
            Instant now = clock.instant();
            List<ModelStatus> states = new ArrayList<>();
            for (ModelState state : models.values()) {
                states.add(state.toStatus(now, state.name().equals(activeModel)));
            }
            return states;
        }
    }

    public TokenUsage globalUsage() {
        synchronized (lock) {
            return globalUsage;
        }
    }

    public TokenUsage agentUsage(String agentId) {
        synchronized (lock) {
            return agentUsage.getOrDefault(agentId, TokenUsage.ZERO);
        }
    }

    public Map<String, TokenUsage> allAgentUsage() {
        synchronized (lock) {
            return Map.copyOf(agentUsage);
        }
    }

    public String activeModel() {
        synchronized (lock) {
            return activeModel;
        }
    }

    public Set<String> providerNames() {
        return providers.names();
    }

    private static Map<String, List<String>> lowerCaseKeys(Map<String, List<String>> source) {
        Map<String, List<String>> result = new HashMap<>();
        source.forEach((k, v) -> result.put(k.toLowerCase(Locale.ROOT), List.copyOf(v)));
        return result;
    }
}
