package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.llm.CompletionStream;
import com.openforge.mcpchat.llm.StreamingCompletionClient;
import com.openforge.mcpchat.llm.model.Delta;
import com.openforge.mcpchat.llm.model.Message;
import com.openforge.mcpchat.llm.model.Tool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Plays back canned responses, one per stream() call, and records every
 * request it received.
 */
class ScriptedCompletionClient implements StreamingCompletionClient {

    private final Deque<Script> scripts = new ArrayDeque<>();
    private Script repeating;

    final List<List<Message>> requests     = new ArrayList<>();
    final List<List<Tool>>    toolRequests = new ArrayList<>();

    ScriptedCompletionClient respond(Delta... deltas) {
        scripts.add(new Script(List.of(deltas), null, false, null));
        return this;
    }

    /** Delivers the deltas, then fails the way a dropped connection would. */
    ScriptedCompletionClient failAfter(RuntimeException failure, Delta... deltas) {
        scripts.add(new Script(List.of(deltas), failure, false, null));
        return this;
    }

    ScriptedCompletionClient failToOpen(RuntimeException failure) {
        scripts.add(new Script(List.of(), failure, true, null));
        return this;
    }

    /** Runs the action while handing out the first delta. */
    ScriptedCompletionClient respondThen(Runnable onFirstDelta, Delta... deltas) {
        scripts.add(new Script(List.of(deltas), null, false, onFirstDelta));
        return this;
    }

    /** Used once the queued scripts are exhausted, for every remaining call. */
    ScriptedCompletionClient alwaysRespond(Delta... deltas) {
        repeating = new Script(List.of(deltas), null, false, null);
        return this;
    }

    int calls() {
        return requests.size();
    }

    @Override
    public CompletionStream stream(List<Message> messages, List<Tool> tools) {
        requests.add(List.copyOf(messages));
        toolRequests.add(List.copyOf(tools));

        Script script = scripts.isEmpty() ? repeating : scripts.poll();
        if (script == null) {
            throw new AssertionError("Unexpected model call #" + requests.size());
        }
        if (script.failOnOpen()) {
            throw script.failure();
        }
        return new ScriptedStream(script);
    }

    private record Script(List<Delta> deltas, RuntimeException failure, boolean failOnOpen, Runnable onFirstDelta) {}

    private static final class ScriptedStream implements CompletionStream {

        private final Script script;
        private int          position;
        private boolean      closed;

        ScriptedStream(Script script) {
            this.script = script;
        }

        @Override
        public boolean hasNext() {
            if (closed) return false;
            if (position < script.deltas().size()) return true;
            if (script.failure() != null) throw script.failure();
            return false;
        }

        @Override
        public Delta next() {
            if (!hasNext()) throw new NoSuchElementException();
            Delta delta = script.deltas().get(position++);
            if (position == 1 && script.onFirstDelta() != null) {
                script.onFirstDelta().run();
            }
            return delta;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
