package com.chatraw.assistant.service.retrieval;

import java.util.Comparator;

public record Candidate(String content, double score) {

    public static final Comparator<Candidate> BY_SCORE_DESC = Comparator.comparingDouble(Candidate::score).reversed();

    public Candidate withScore(double newScore) {
        return new Candidate(content, newScore);
    }
}
