package com.chatraw.assistant.service.orchestration;

public enum RelayState {
    CONNECTING,
    STREAMING,
    COMPLETING,
    FAILED
}
