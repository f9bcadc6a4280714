package com.hivemind.core.llm;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Built-in model roster and per-role preference order, used when configuration
 * does not override them.
 */
public final class ModelCatalog {

    private ModelCatalog() {
    }

    public static final List<ModelSpec> GEMINI_MODELS = List.of(
            new ModelSpec("gemini-3-pro-preview", "gemini", 5, 1.25, 10.00, "premium"),
            new ModelSpec("gemini-3-flash-preview", "gemini", 10, 0.15, 0.60, "standard"),
            new ModelSpec("gemini-2.5-flash", "gemini", 10, 0.15, 0.60, "standard"),
            new ModelSpec("gemini-2.5-pro", "gemini", 5, 1.25, 10.00, "premium"),
            new ModelSpec("gemini-2.0-flash", "gemini", 15, 0.10, 0.40, "fast")
    );

    public static final List<ModelSpec> GROQ_MODELS = List.of(
            new ModelSpec("deepseek-r1-0528", "groq", 30, 0.0, 0.0, "free-reasoning"),
            new ModelSpec("llama-3.3-70b-versatile", "groq", 30, 0.0, 0.0, "free-coding"),
            new ModelSpec("qwen-3-32b", "groq", 30, 0.0, 0.0, "free-reasoning"),
            new ModelSpec("llama-4-scout-17b-16e-instruct", "groq", 30, 0.0, 0.0, "free-coding"),
            new ModelSpec("llama-3.1-8b-instant", "groq", 30, 0.0, 0.0, "free-fast")
    );

    public static final List<ModelSpec> ALL_MODELS = Stream.concat(GEMINI_MODELS.stream(), GROQ_MODELS.stream()).toList();

    /** Preference order per lowercase role name. */
    public static final Map<String, List<String>> ROLE_CASCADES = Map.of(
            "orchestrator", List.of(
                    "gemini-3-pro-preview",
                    "gemini-2.5-pro",
                    "deepseek-r1-0528",
                    "gemini-2.5-flash",
                    "gemini-2.0-flash"),
            "developer", List.of(
                    "llama-3.3-70b-versatile",
                    "llama-4-scout-17b-16e-instruct",
                    "qwen-3-32b",
                    "gemini-2.5-flash",
                    "gemini-2.0-flash",
                    "llama-3.1-8b-instant"),
            "reviewer", List.of(
                    "deepseek-r1-0528",
                    "llama-3.3-70b-versatile",
                    "gemini-2.5-flash",
                    "qwen-3-32b"),
            "tester", List.of(
                    "llama-3.3-70b-versatile",
                    "llama-4-scout-17b-16e-instruct",
                    "gemini-2.5-flash",
                    "gemini-2.0-flash",
                    "llama-3.1-8b-instant")
    );

    /** Cascade for roles without an entry of their own. */
    public static final List<String> DEFAULT_CASCADE = List.of(
            "llama-3.3-70b-versatile",
            "gemini-2.5-flash",
            "qwen-3-32b",
            "gemini-2.0-flash",
            "llama-3.1-8b-instant"
    );

    public static ModelSpec findModel(String name) {
        return ALL_MODELS.stream()
                .filter(m -> m.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
