package com.chatraw.assistant.service.orchestration.openai;

public record CompletionFrame(Kind kind, String content, String reasoning, String detail) {

    public enum Kind {
        DELTA,
        SKIP,
        DONE
    }

    private static final CompletionFrame DONE_FRAME = new CompletionFrame(Kind.DONE, null, null, null);

    public static CompletionFrame delta(String content, String reasoning) {
        return new CompletionFrame(Kind.DELTA, content, reasoning, null);
    }

    public static CompletionFrame skip(String detail) {
        return new CompletionFrame(Kind.SKIP, null, null, detail);
    }

    public static CompletionFrame done() {
        return DONE_FRAME;
    }

    public boolean isDone() {
        return kind == Kind.DONE;
    }
}
