package com.agentscheduler.core.model;

/**
 * Small heartbeat payload emitted on each phase transition of a running agent.
 * 
 * @param label what is happening, e.g. the step or tool name
 * @param phase coarse phase: step, tool, blocked, delegated_agent
 * @param percent optional completion estimate
 */
public record ProgressPayload(String label, String phase, Integer percent) {

    public static final String PHASE_STEP = "step";
    public static final String PHASE_TOOL = "tool";
    public static final String PHASE_BLOCKED = "blocked";

    public static ProgressPayload of(String label, String phase) {
        return new ProgressPayload(label, phase, null);
    }

    /**
     * Convert to a running progress snapshot.
     */
    public TaskProgress toProgress() {
        if (PHASE_BLOCKED.equals(phase)) {
            return TaskProgress.blocked(label);
        }
        int pct = percent == null ? 0 : Math.max(0, Math.min(100, percent));
        return TaskProgress.running(pct, phase + ": " + label);
    }
}
