package com.openforge.clarifier.support;

import com.openforge.clarifier.llm.LlmErrorKind;
import com.openforge.clarifier.llm.LlmException;
import com.openforge.clarifier.llm.LlmProvider;
import com.openforge.clarifier.llm.model.ChatRequest;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * In-memory provider that replays a script of replies and failures and
 * records every request it receives. When the script runs out it repeats the
 * last step.
 */
public class ScriptedLlmProvider implements LlmProvider {

    private final Deque<Function<ChatRequest, String>> steps = new ArrayDeque<>();
    private final List<ChatRequest> requests = new ArrayList<>();
    private Function<ChatRequest, String> last = request -> {
        throw new IllegalStateException("No scripted reply");
    };

    public ScriptedLlmProvider reply(String text) {
        steps.add(request -> text);
        return this;
    }

    public ScriptedLlmProvider fail(LlmErrorKind kind) {
        steps.add(request -> {
            throw new LlmException(kind, "scripted " + kind);
        });
        return this;
    }

    /** Reply chosen from the request, e.g. to answer per model. */
    public ScriptedLlmProvider answer(Function<ChatRequest, String> step) {
        steps.add(step);
        return this;
    }

    @Override
    public synchronized String complete(ChatRequest request, Duration timeout) {
        requests.add(request);
        Function<ChatRequest, String> step = steps.isEmpty() ? last : steps.poll();
        last = step;
        return step.apply(request);
    }

    public synchronized List<ChatRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized int calls() {
        return requests.size();
    }

    public synchronized ChatRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
