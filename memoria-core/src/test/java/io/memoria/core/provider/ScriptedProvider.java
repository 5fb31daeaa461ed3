package io.memoria.core.provider;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Replies with queued texts in order and repeats the last one once the queue is drained.
 */
public final class ScriptedProvider implements CompletionProvider {
    private final String name;
    private final Deque<String> replies;
    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());
    private final List<CompletionParams> params = Collections.synchronizedList(new ArrayList<>());
    private String last = "";

    public ScriptedProvider(String name, String... replies) {
        this.name = name;
        this.replies = new ArrayDeque<>(List.of(replies));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized CompletionResponse complete(String prompt, CompletionParams completionParams) {
        prompts.add(prompt);
        params.add(completionParams);
        if (!replies.isEmpty()) {
            last = replies.poll();
        }
        if (last.startsWith(CompletionResponse.ERROR_PREFIX)) {
            return new CompletionResponse(last, Map.of());
        }
        return new CompletionResponse(last, Map.of("total_tokens", 1));
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    public List<CompletionParams> params() {
        return List.copyOf(params);
    }

    public int calls() {
        return prompts.size();
    }
}
