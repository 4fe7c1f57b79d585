package jobstream.broker.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jobstream.broker.model.JobStatus;
import jobstream.broker.util.Json;

/**
 * Payload builders for the job event types. Field names are the ones
 * stream clients already read; optional fields are left out when null.
 */
public final class EventPayloads {

    private EventPayloads() {
    }

    public static ObjectNode status(JobStatus status) {
        return Json.object().put("status", status.wireName());
    }

    public static ObjectNode stepProgress(String step, double pct, Double etaSec) {
        ObjectNode payload = Json.object()
                .put("step", step)
                .put("pct", pct);
        if (etaSec != null) {
            payload.put("eta_sec", etaSec);
        }
        return payload;
    }

    /**
     * @param importance one of {@code low}, {@code medium}, {@code high}
     */
    public static ObjectNode insight(String id, String category, String importance, String message, String step) {
        ObjectNode payload = Json.object()
                .put("id", id)
                .put("category", category)
                .put("importance", importance)
                .put("message", message);
        if (step != null && !step.isEmpty()) {
            payload.put("step", step);
        }
        return payload;
    }

    public static ObjectNode metric(String key, double value, String unit) {
        ObjectNode payload = Json.object()
                .put("key", key)
                .put("value", value);
        if (unit != null && !unit.isEmpty()) {
            payload.put("unit", unit);
        }
        return payload;
    }

    /**
     * @param status one of {@code pass}, {@code warn}, {@code fail}
     */
    public static ObjectNode validation(String ruleId, String status, String message) {
        ObjectNode payload = Json.object()
                .put("rule_id", ruleId)
                .put("status", status);
        if (message != null && !message.isEmpty()) {
            payload.put("message", message);
        }
        return payload;
    }

    public static ObjectNode diffChunk(String section, String summary, String patchId) {
        ObjectNode payload = Json.object()
                .put("section", section)
                .put("summary", summary);
        if (patchId != null && !patchId.isEmpty()) {
            payload.put("patch_id", patchId);
        }
        return payload;
    }

    public static ObjectNode error(String code, String message) {
        return Json.object()
                .put("code", code)
                .put("message", message);
    }

    public static ObjectNode agentStepStarted(String step, String agentName) {
        return Json.object()
                .put("step", step)
                .put("agent_name", agentName);
    }

    public static ObjectNode agentStepCompleted(String step, String agentName, int totalChars) {
        return Json.object()
                .put("step", step)
                .put("agent_name", agentName)
                .put("total_chars", totalChars);
    }

    public static ObjectNode agentChunk(String step, String chunk, int seq, int totalLen) {
        return Json.object()
                .put("step", step)
                .put("chunk", chunk)
                .put("seq", seq)
                .put("total_len", totalLen);
    }

    public static ObjectNode empty() {
        return Json.object();
    }
}
