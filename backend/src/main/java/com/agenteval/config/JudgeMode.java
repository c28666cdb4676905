package com.agenteval.config;

public enum JudgeMode {
    DISABLED,
    MOCK,
    LIVE
}
