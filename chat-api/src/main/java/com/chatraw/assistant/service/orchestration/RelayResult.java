package com.chatraw.assistant.service.orchestration;

import com.chatraw.assistant.service.retrieval.Candidate;

import java.util.List;

public record RelayResult(String content, String thinking, List<Candidate> references) {
}
