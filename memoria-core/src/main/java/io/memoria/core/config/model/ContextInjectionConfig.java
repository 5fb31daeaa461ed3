package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextInjectionConfig(
    Injection injection,
    Filter filter,
    Format format,
    Prompts prompts,
    Layers layers,
    PromptStructure promptStructure,
    @JsonProperty("summaryLLM") SummaryLlm summaryLlm,
    Debug debug
) {
    public static final String DEFAULT_SYSTEM_PROMPT = "You are Memoria, a personal assistant that remembers the user. "
        + "Use what you know about the user to give personalized, helpful responses. "
        + "Be friendly, context-aware, and reference what you know about the user when relevant.";

    public ContextInjectionConfig {
        injection = injection == null ? Injection.defaults() : injection;
        filter = filter == null ? Filter.defaults() : filter;
        format = format == null ? Format.defaults() : format;
        prompts = prompts == null ? Prompts.defaults() : prompts;
        layers = layers == null ? Layers.defaults() : layers;
        promptStructure = promptStructure == null ? PromptStructure.defaults() : promptStructure;
        summaryLlm = summaryLlm == null ? SummaryLlm.defaults() : summaryLlm;
        debug = debug == null ? Debug.defaults() : debug;
    }

    public static ContextInjectionConfig defaults() {
        return new ContextInjectionConfig(
            Injection.defaults(),
            Filter.defaults(),
            Format.defaults(),
            Prompts.defaults(),
            Layers.defaults(),
            PromptStructure.defaults(),
            SummaryLlm.defaults(),
            Debug.defaults()
        );
    }

    public ContextInjectionConfig withLayers(Layers updated) {
        return new ContextInjectionConfig(injection, filter, format, prompts, updated, promptStructure, summaryLlm, debug);
    }

    public ContextInjectionConfig withInjection(Injection updated) {
        return new ContextInjectionConfig(updated, filter, format, prompts, layers, promptStructure, summaryLlm, debug);
    }

    public ContextInjectionConfig withFormat(Format updated) {
        return new ContextInjectionConfig(injection, filter, updated, prompts, layers, promptStructure, summaryLlm, debug);
    }

    public enum SortOrder {
        @JsonProperty("relevance")
        RELEVANCE,
        @JsonProperty("recency")
        RECENCY,
        @JsonProperty("type")
        TYPE,
        @JsonProperty("none")
        NONE
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Injection(boolean enabled, int maxMemories, double minRelevance, SortOrder sortBy) {

        public Injection {
            if (maxMemories < 0) {
                throw new IllegalArgumentException("maxMemories must not be negative");
            }
            if (minRelevance < 0 || minRelevance > 1) {
                throw new IllegalArgumentException("minRelevance must be within [0, 1]");
            }
            sortBy = sortBy == null ? SortOrder.RELEVANCE : sortBy;
        }

        public static Injection defaults() {
            return new Injection(true, 10, 0.30, SortOrder.RELEVANCE);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Filter(
        boolean includeFacts,
        boolean includePreferences,
        boolean includeRelationships,
        boolean includeEvents,
        boolean includeGoals,
        boolean includeTodos,
        boolean includeNotes,
        boolean includeWorkingTier,
        boolean includeLongtermTier,
        boolean includeDeepTier
    ) {

        public static Filter defaults() {
            return new Filter(true, true, true, true, true, true, false, true, true, false);
        }

        public List<String> enabledTypes() {
            List<String> types = new ArrayList<>();
            addIf(types, includeFacts, "fact");
            addIf(types, includePreferences, "preference");
            addIf(types, includeRelationships, "relationship");
            addIf(types, includeEvents, "event");
            addIf(types, includeGoals, "goal");
            addIf(types, includeTodos, "todo");
            addIf(types, includeNotes, "note");
            return List.copyOf(types);
        }

        public List<String> enabledTiers() {
            List<String> tiers = new ArrayList<>();
            addIf(tiers, includeWorkingTier, "working");
            addIf(tiers, includeLongtermTier, "longterm");
            addIf(tiers, includeDeepTier, "deep");
            return List.copyOf(tiers);
        }

        private static void addIf(List<String> target, boolean enabled, String value) {
            if (enabled) {
                target.add(value);
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Format(String memoryFormat, boolean groupByType, boolean includeMetadata, String separator) {

        public Format {
            memoryFormat = memoryFormat == null || memoryFormat.isBlank() ? "bullet" : memoryFormat;
            separator = separator == null || separator.isBlank() ? "newline" : separator;
        }

        public static Format defaults() {
            return new Format("bullet", false, false, "newline");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Prompts(
        String systemPrompt,
        String memoryHeader,
        String memoryItemFormat,
        String noMemoriesText,
        String userMessageFormat
    ) {

        public Prompts {
            systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
            memoryHeader = memoryHeader == null ? "Here is what you know about the user:" : memoryHeader;
            memoryItemFormat = memoryItemFormat == null ? "- {{content}}" : memoryItemFormat;
            noMemoriesText = noMemoriesText == null ? "You don't have any memories about this user yet." : noMemoriesText;
            userMessageFormat = userMessageFormat == null ? "User: {{message}}" : userMessageFormat;
        }

        public static Prompts defaults() {
            return new Prompts(null, null, null, null, null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Layers(
        Immediate immediate,
        SessionSummary sessionSummary,
        Profile profile,
        Calendar calendar,
        PastConversations pastConversations
    ) {

        public Layers {
            immediate = immediate == null ? Immediate.defaults() : immediate;
            sessionSummary = sessionSummary == null ? SessionSummary.defaults() : sessionSummary;
            profile = profile == null ? Profile.defaults() : profile;
            calendar = calendar == null ? Calendar.defaults() : calendar;
            pastConversations = pastConversations == null ? PastConversations.defaults() : pastConversations;
        }

        public static Layers defaults() {
            return new Layers(
                Immediate.defaults(),
                SessionSummary.defaults(),
                Profile.defaults(),
                Calendar.defaults(),
                PastConversations.defaults()
            );
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Immediate(boolean enabled, int maxMessages, int tokenBudget, String format) {

        public Immediate {
            requirePositive(maxMessages, "immediate.maxMessages");
            requirePositive(tokenBudget, "immediate.tokenBudget");
            format = format == null || format.isBlank() ? "conversation" : format;
        }

        public static Immediate defaults() {
            return new Immediate(true, 10, 400, "conversation");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SessionSummary(
        boolean enabled,
        int threshold,
        int summarizeCount,
        int tokenBudget,
        boolean cacheEnabled,
        @JsonProperty("cacheTTLMinutes") int cacheTtlMinutes
    ) {

        public SessionSummary {
            requirePositive(summarizeCount, "sessionSummary.summarizeCount");
            requirePositive(tokenBudget, "sessionSummary.tokenBudget");
            if (threshold < 0 || cacheTtlMinutes < 0) {
                throw new IllegalArgumentException("sessionSummary threshold and TTL must not be negative");
            }
        }

        public static SessionSummary defaults() {
            return new SessionSummary(true, 20, 15, 200, true, 30);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Profile(
        boolean enabled,
        int maxMemories,
        int tokenBudget,
        String queryMethod,
        List<String> includeTypes,
        List<String> excludeTypes
    ) {

        public Profile {
            requirePositive(maxMemories, "profile.maxMemories");
            requirePositive(tokenBudget, "profile.tokenBudget");
            queryMethod = queryMethod == null || queryMethod.isBlank() ? "semantic" : queryMethod;
            includeTypes = includeTypes == null ? List.of("fact", "preference", "relationship", "goal") : List.copyOf(includeTypes);
            excludeTypes = excludeTypes == null ? List.of("note", "event") : List.copyOf(excludeTypes);
        }

        public static Profile defaults() {
            return new Profile(true, 10, 300, "semantic", null, null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Calendar(boolean enabled, int lookaheadHours, int tokenBudget, int maxEvents, String format) {

        public Calendar {
            requirePositive(lookaheadHours, "calendar.lookaheadHours");
            requirePositive(tokenBudget, "calendar.tokenBudget");
            requirePositive(maxEvents, "calendar.maxEvents");
            format = format == null || format.isBlank() ? "list" : format;
        }

        public static Calendar defaults() {
            return new Calendar(true, 48, 100, 10, "list");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PastConversations(boolean enabled, int maxDays, int tokenBudget) {

        public PastConversations {
            requirePositive(maxDays, "pastConversations.maxDays");
            requirePositive(tokenBudget, "pastConversations.tokenBudget");
        }

        public static PastConversations defaults() {
            return new PastConversations(true, 7, 200);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PromptStructure(String systemPromptTemplate, Map<String, String> sectionHeaders, List<String> sectionOrder) {

        public PromptStructure {
            systemPromptTemplate = systemPromptTemplate == null ? DEFAULT_SYSTEM_PROMPT : systemPromptTemplate;
            sectionHeaders = sectionHeaders == null ? defaultHeaders() : Map.copyOf(sectionHeaders);
            sectionOrder = sectionOrder == null
                ? List.of("profile", "calendar", "pastConversations", "sessionSummary", "immediate")
                : List.copyOf(sectionOrder);
        }

        public static PromptStructure defaults() {
            return new PromptStructure(null, null, null);
        }

        public String headerFor(String section) {
            String header = sectionHeaders.get(section);
            return header == null || header.isBlank() ? section.toUpperCase() + ":" : header;
        }

        private static Map<String, String> defaultHeaders() {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("profile", "USER PROFILE:");
            headers.put("calendar", "UPCOMING EVENTS:");
            headers.put("pastConversations", "PAST CONVERSATIONS:");
            headers.put("sessionSummary", "SESSION CONTEXT:");
            headers.put("immediate", "RECENT CONVERSATION:");
            return Map.copyOf(headers);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SummaryLlm(String provider, String model, double temperature, int maxTokens, String prompt) {
        public static final String DEFAULT_PROMPT = """
            Summarize the following conversation in 2-3 sentences, focusing on key topics discussed, \
            decisions made, and important facts mentioned.

            Conversation:
            {{messages}}

            Summary:""";

        public SummaryLlm {
            prompt = prompt == null || prompt.isBlank() ? DEFAULT_PROMPT : prompt;
        }

        public static SummaryLlm defaults() {
            return new SummaryLlm("gemini", "gemini-2.0-flash-exp", 0.3, 200, DEFAULT_PROMPT);
        }

        public LlmSettings settings() {
            return new LlmSettings(provider, model, temperature, maxTokens);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Debug(boolean logLayerTokens, boolean logAssembly, boolean logTrimming) {

        public static Debug defaults() {
            return new Debug(true, true, true);
        }
    }

    private static void requirePositive(int value, String field) {
        if (value < 1) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }
}
