package io.memoria.core.disclosure;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.context.AssembledContext;
import io.memoria.core.context.ContextAssembler;
import io.memoria.core.context.TokenEstimator;
import io.memoria.core.context.UserContext;
import io.memoria.core.model.MalformedInputException;
import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.RelevantMemory;
import io.memoria.core.model.SaveDecision;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the reply prompt for one turn: persona, mode directive, hallucination guard, hold
 * directive, layered context (or the flat memory section when no layer has content), save
 * directive and the user's message, in that order.
 */
public final class ContextInjectionService {
    private static final Logger LOG = LoggerFactory.getLogger(ContextInjectionService.class);

    public static final String ANTI_HALLUCINATION_GUARD = """
        You may ONLY reference memories explicitly provided in this prompt.
        You MUST NOT invent past conversations, saved memories, or confirmations.
        If no memory save instruction is present, assume nothing was saved.""";

    static final String DEFAULT_USER_NAME = "this user";

    private final ContextAssembler assembler;
    private final TokenEstimator estimator;

    public ContextInjectionService(ContextAssembler assembler, TokenEstimator estimator) {
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
    }

    public ContextInjectionResult build(ContextInjectionRequest request, ContextInjectionConfig config) {
        if (request.iin() == null || request.iin().isBlank()) {
            throw new MalformedInputException("iin is required");
        }
        ContextInjectionConfig.Prompts prompts = config.prompts();
        String userSection = prompts.userMessageFormat().replace("{{message}}", request.message());
        String userName = request.userName() == null || request.userName().isBlank() ? DEFAULT_USER_NAME : request.userName();
        List<String> enabledTypes = config.filter().enabledTypes();
        List<String> enabledTiers = config.filter().enabledTiers();

        if (!config.injection().enabled()) {
            String system = prompts.systemPrompt().replace("{{userName}}", userName);
            String saveInstruction = SaveTruthGuard.NO_SAVE_DIRECTIVE;
            String full = system + "\n\n" + prompts.noMemoriesText() + "\n\n" + saveInstruction + "\n\n" + userSection;
            return new ContextInjectionResult(
                new PromptParts(system, prompts.noMemoriesText(), saveInstruction, userSection, full),
                ContextMode.NEUTRAL_ACK,
                0,
                0,
                estimator.estimate(full),
                false,
                List.of(),
                List.of(),
                null,
                enabledTypes,
                enabledTiers
            );
        }

        Optional<String> intent = IntentNormalizer.normalize(request.intent());
        ContextMode mode = ContextModeResolver.resolve(intent);

        List<RelevantMemory> selected = MemorySelector.select(request.memories(), config);
        List<RelevantMemory> disclosed = MemoryDisclosureFilter.filter(selected, intent);
        int memoriesFiltered = request.memories().size() - disclosed.size();
        LOG.info("Context injection for {}: intent={}, mode={}, {} of {} memories disclosed",
            request.iin(), intent.orElse("none"), mode.key(), disclosed.size(), request.memories().size());

        SaveDecision decision = request.saveDecision();
        boolean holding = decision != null && decision.holding();
        List<MemoryCard> pendingCards = decision == null ? List.of() : decision.pendingCards();
        Optional<String> hold = HoldDirective.render(decision);
        hold.ifPresent(directive -> LOG.info("Holding for clarification with {} pending cards", pendingCards.size()));

        String guards = mode.directive() + "\n\n" + ANTI_HALLUCINATION_GUARD + hold.map(directive -> "\n\n" + directive).orElse("");
        String system = prompts.systemPrompt().replace("{{userName}}", userName) + "\n\n" + guards;
        String saveInstruction = SaveTruthGuard.directive(decision, request.saveResults());

        String formatted = MemoryFormatter.format(disclosed, config);
        String memoriesSection = disclosed.isEmpty() ? prompts.noMemoriesText() : prompts.memoryHeader() + "\n\n" + formatted;

        AssembledContext layered = assembler.assemble(
            new UserContext(request.iin(), request.message(), request.sessionId(), request.sessionMessages(), disclosed, userName),
            config
        );

        String full;
        if (!layered.isEmpty()) {
            String layeredSystem = config.promptStructure().systemPromptTemplate().replace("{{userName}}", userName);
            full = layeredSystem + "\n\n" + guards + "\n\n" + layered.assembledText() + "\n\n" + saveInstruction + "\n\n" + userSection;
        } else {
            full = system + "\n\n" + memoriesSection + "\n\n" + saveInstruction + "\n\n" + userSection;
        }

        return new ContextInjectionResult(
            new PromptParts(system, memoriesSection, saveInstruction, userSection, full),
            mode,
            disclosed.size(),
            memoriesFiltered,
            estimator.estimate(full),
            holding,
            pendingCards,
            QuickReplyMenu.forTurn(intent, decision, holding),
            layered,
            enabledTypes,
            enabledTiers
        );
    }
}
