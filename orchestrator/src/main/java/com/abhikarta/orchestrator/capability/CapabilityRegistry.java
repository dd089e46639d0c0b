package com.abhikarta.orchestrator.capability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared lookup and metrics-instrumented execution for agents and tools.
 *
 * Every call is timed and counted:
 * <pre>
 *   abhikarta.capability.calls{kind, id, status="success|failure|error|not_found"}
 *   abhikarta.capability.duration{kind, id}
 * </pre>
 *
 * {@link #execute} never throws for provider problems; unknown ids, explicit
 * failures and exceptions all come back as {@link CapabilityResult#failure}.
 *
 * @param <T> provider type
 */
public abstract class CapabilityRegistry<T> {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final String kind;
    private final Map<String, T> providers = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    protected CapabilityRegistry(String kind, List<T> all, MeterRegistry meterRegistry) {
        this.kind          = kind;
        this.meterRegistry = meterRegistry;
        for (T provider : all) {
            String id = idOf(provider);
            if (providers.putIfAbsent(id, provider) != null) {
                throw new IllegalStateException("Duplicate " + kind + " id: '" + id + "'");
            }
            log.info("Registered {} '{}'", kind, id);
        }
    }

    protected abstract String idOf(T provider);

    protected abstract CapabilityDescriptor describe(T provider);

    protected abstract Map<String, Object> invoke(T provider, Map<String, Object> input);

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public T get(String id) {
        T provider = id == null ? null : providers.get(id);
        if (provider == null) {
            throw new CapabilityNotFoundException(kind, id);
        }
        return provider;
    }

    public boolean contains(String id) {
        return id != null && providers.containsKey(id);
    }

    /** Registered ids, sorted. */
    public List<String> ids() {
        return providers.keySet().stream().sorted().toList();
    }

    public List<CapabilityDescriptor> list() {
        return providers.values().stream()
                .map(this::describe)
                .sorted(Comparator.comparing(CapabilityDescriptor::id))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    public CapabilityResult execute(String id, Map<String, Object> input) {
        String tagId = id == null ? "unknown" : id;
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            T provider = get(id);
            CapabilityResult result = CapabilityResult.fromProvider(
                    invoke(provider, input == null ? Map.of() : input));
            if (!result.success()) {
                status = "failure";
            }
            return result;
        } catch (CapabilityNotFoundException e) {
            status = "not_found";
            return CapabilityResult.failure(e.getMessage());
        } catch (Exception e) {
            status = "error";
            log.warn("{} '{}' threw: {}", kind, id, e.toString());
            return CapabilityResult.failure(
                    "Unexpected error in " + kind + " '" + id + "': " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("abhikarta.capability.duration",
                    "kind", kind, "id", tagId));
            meterRegistry.counter("abhikarta.capability.calls",
                    "kind", kind, "id", tagId, "status", status).increment();
        }
    }
}
