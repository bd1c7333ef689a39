package io.agentrecall.memory;

import java.util.Locale;

/**
 * Categories for agent memories.
 *
 * <ul>
 *   <li>{@code INSTRUCTION} — standing instructions ("always answer in French").</li>
 *   <li>{@code PREFERENCE} — user preferences (timezone, tone, format).</li>
 *   <li>{@code STYLE_CORRECTION} — corrections the user made to the agent's writing style.</li>
 *   <li>{@code GENERAL} — facts worth remembering that fit nowhere else.</li>
 *   <li>{@code CONTEXT} — task parameters and working context.</li>
 *   <li>{@code HISTORY} — findings and outcomes from earlier conversations.</li>
 * </ul>
 */
public enum MemoryCategory {
    INSTRUCTION,
    PREFERENCE,
    STYLE_CORRECTION,
    GENERAL,
    CONTEXT,
    HISTORY;

    /**
     * Returns the retrieval tier of this category. Every constant must be listed here.
     */
    public MemoryGroup group() {
        return switch (this) {
            case INSTRUCTION, PREFERENCE, STYLE_CORRECTION -> MemoryGroup.CORE;
            case GENERAL, CONTEXT, HISTORY -> MemoryGroup.CONTEXTUAL;
        };
    }

    public boolean isCore() {
        return group() == MemoryGroup.CORE;
    }

    public static MemoryCategory fromString(String s) {
        if (s == null || s.isBlank()) return GENERAL;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "instruction" -> INSTRUCTION;
            case "preference" -> PREFERENCE;
            case "style_correction", "style-correction" -> STYLE_CORRECTION;
            case "context" -> CONTEXT;
            case "history" -> HISTORY;
            default -> GENERAL;
        };
    }
}
