package com.abhikarta.orchestrator.capability;

import java.util.Map;

/**
 * Normalised outcome of one agent or tool call.
 *
 * @param success true if the provider returned without error
 * @param result  the provider's full result map on success; null on failure
 * @param error   failure message; null on success
 */
public record CapabilityResult(boolean success, Map<String, Object> result, String error) {

    public static CapabilityResult success(Map<String, Object> result) {
        return new CapabilityResult(true, result == null ? Map.of() : result, null);
    }

    public static CapabilityResult failure(String error) {
        return new CapabilityResult(false, null, error);
    }

    /**
     * Interpret a provider's raw return value. An explicit {@code success: false}
     * is a failure; anything else is a success carrying the whole map.
     */
    public static CapabilityResult fromProvider(Map<String, Object> raw) {
        if (raw != null && Boolean.FALSE.equals(raw.get("success"))) {
            Object error = raw.get("error");
            return failure(error == null ? "Capability reported failure" : error.toString());
        }
        return success(raw);
    }
}
