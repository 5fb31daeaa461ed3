package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.memoria.core.model.TurnAction;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of the clarification stage. {@code style}, {@code skip.explicitCommands} and
 * {@code behavior.checkOptional} are accepted for document compatibility but have no effect;
 * type levels other than {@link Level#NEVER} all allow questions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClarificationConfig(
    boolean enabled,
    Mode mode,
    Behavior behavior,
    Limits limits,
    Style style,
    Skip skip,
    Map<String, TypeSetting> typeSettings,
    LlmSettings llm
) {

    public ClarificationConfig {
        mode = mode == null ? Mode.LOCAL : mode;
        behavior = behavior == null ? Behavior.defaults() : behavior;
        limits = limits == null ? Limits.defaults() : limits;
        style = style == null ? Style.defaults() : style;
        skip = skip == null ? Skip.defaults() : skip;
        typeSettings = typeSettings == null ? defaultTypeSettings() : lowerCaseKeys(typeSettings);
        llm = llm == null ? LlmSettings.gemini(0.2, 500) : llm;
    }

    public static ClarificationConfig defaults() {
        return new ClarificationConfig(
            true,
            Mode.LOCAL,
            Behavior.defaults(),
            Limits.defaults(),
            Style.defaults(),
            Skip.defaults(),
            defaultTypeSettings(),
            LlmSettings.gemini(0.2, 500)
        );
    }

    public ClarificationConfig withMode(Mode updated) {
        return new ClarificationConfig(enabled, updated, behavior, limits, style, skip, typeSettings, llm);
    }

    public ClarificationConfig withEnabled(boolean updated) {
        return new ClarificationConfig(updated, mode, behavior, limits, style, skip, typeSettings, llm);
    }

    public ClarificationConfig withBehavior(Behavior updated) {
        return new ClarificationConfig(enabled, mode, updated, limits, style, skip, typeSettings, llm);
    }

    public ClarificationConfig withLimits(Limits updated) {
        return new ClarificationConfig(enabled, mode, behavior, updated, style, skip, typeSettings, llm);
    }

    public ClarificationConfig withSkip(Skip updated) {
        return new ClarificationConfig(enabled, mode, behavior, limits, style, updated, typeSettings, llm);
    }

    public Optional<TypeSetting> typeSetting(String type) {
        return Optional.ofNullable(typeSettings.get(type.toLowerCase(Locale.ROOT)));
    }

    /**
     * Most questions one memory may queue: the tighter of the turn cap, the per-memory cap and the type's own cap.
     */
    public int perItemQuestionCap(String type) {
        int cap = Math.min(limits.maxQuestionsPerTurn(), limits.maxQuestionsPerMemory());
        return typeSetting(type).map(setting -> Math.min(cap, setting.maxQuestions())).orElse(cap);
    }

    private static Map<String, TypeSetting> lowerCaseKeys(Map<String, TypeSetting> settings) {
        Map<String, TypeSetting> normalized = new LinkedHashMap<>();
        settings.forEach((type, setting) -> normalized.put(type.toLowerCase(Locale.ROOT), setting));
        return Map.copyOf(normalized);
    }

    private static Map<String, TypeSetting> defaultTypeSettings() {
        Map<String, TypeSetting> settings = new LinkedHashMap<>();
        settings.put("event", new TypeSetting(Level.ALWAYS, 3));
        settings.put("todo", new TypeSetting(Level.ALWAYS, 2));
        settings.put("goal", new TypeSetting(Level.ONCE, 2));
        settings.put("relationship", new TypeSetting(Level.ONCE, 1));
        settings.put("preference", new TypeSetting(Level.NEVER, 0));
        settings.put("fact", new TypeSetting(Level.IF_VAGUE, 1));
        return Map.copyOf(settings);
    }

    public enum Mode {
        @JsonProperty("local")
        @JsonEnumDefaultValue
        LOCAL,
        @JsonProperty("hybrid")
        HYBRID,
        @JsonProperty("llm")
        LLM
    }

    public enum Level {
        @JsonProperty("always")
        ALWAYS,
        @JsonProperty("once")
        ONCE,
        @JsonProperty("ifVague")
        IF_VAGUE,
        @JsonProperty("never")
        @JsonEnumDefaultValue
        NEVER
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Behavior(
        boolean checkRequired,
        boolean checkOptional,
        TurnAction whenIncomplete,
        int allowPartialAfter
    ) {

        public Behavior {
            whenIncomplete = whenIncomplete == null ? TurnAction.ASK : whenIncomplete;
            if (allowPartialAfter < 0) {
                throw new IllegalArgumentException("allowPartialAfter must not be negative");
            }
        }

        public static Behavior defaults() {
            return new Behavior(true, false, TurnAction.ASK, 3);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Limits(int maxQuestionsPerTurn, int maxQuestionsPerMemory, int questionTimeoutSeconds) {

        public Limits {
            if (maxQuestionsPerTurn < 0 || maxQuestionsPerMemory < 0) {
                throw new IllegalArgumentException("question limits must not be negative");
            }
        }

        public static Limits defaults() {
            return new Limits(1, 3, 60);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Style(String tone, boolean combineRelated, boolean includeContext) {

        public Style {
            tone = tone == null || tone.isBlank() ? "friendly" : tone;
        }

        public static Style defaults() {
            return new Style("friendly", true, true);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Skip(
        boolean explicitCommands,
        boolean userSaysEnough,
        boolean lowConfidence,
        double lowConfidenceThreshold
    ) {

        public static Skip defaults() {
            return new Skip(true, true, false, 0.5);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypeSetting(Level level, int maxQuestions) {

        public TypeSetting {
            level = level == null ? Level.NEVER : level;
            if (maxQuestions < 0) {
                throw new IllegalArgumentException("type maxQuestions must not be negative");
            }
        }
    }
}
