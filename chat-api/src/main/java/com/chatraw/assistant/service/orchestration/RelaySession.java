package com.chatraw.assistant.service.orchestration;

import com.chatraw.assistant.model.StreamEvent;
import com.chatraw.assistant.service.orchestration.openai.CompletionFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

class RelaySession {

    private final boolean thinkingEnabled;
    private final StringBuilder answer = new StringBuilder();
    private final StringBuilder thinking = new StringBuilder();
    private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.CONNECTING);

    RelaySession(boolean thinkingEnabled) {
        this.thinkingEnabled = thinkingEnabled;
    }

    List<StreamEvent> accept(CompletionFrame frame) {
        state.compareAndSet(RelayState.CONNECTING, RelayState.STREAMING);
        if (frame.kind() != CompletionFrame.Kind.DELTA) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>(2);
        if (thinkingEnabled && hasText(frame.reasoning())) {
            thinking.append(frame.reasoning());
            events.add(StreamEvent.thinking(frame.reasoning()));
        }
        if (hasText(frame.content())) {
            answer.append(frame.content());
            events.add(StreamEvent.content(frame.content()));
        }
        return events;
    }

    boolean transition(RelayState next) {
        RelayState current = state.get();
        while (current != RelayState.COMPLETING && current != RelayState.FAILED) {
            if (state.compareAndSet(current, next)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    RelayState state() {
        return state.get();
    }

    String answer() {
        return answer.toString();
    }

    String thinking() {
        return thinking.toString();
    }

    boolean hasAnswer() {
        return answer.length() > 0;
    }

    String persistedMessage() {
        return wrap(answer(), thinking());
    }

    static String wrap(String answer, String thinking) {
        if (thinking == null || thinking.isEmpty()) {
            return answer;
        }
        return "<think>\n" + thinking + "\n</think>\n\n" + answer;
    }

    // whitespace-only deltas are kept; only empty strings are dropped
    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
