package com.swipesentinel.core;

import com.swipesentinel.capture.appium.AppiumConfig;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.judge.JudgeConfig;
import com.swipesentinel.session.SessionConfig;
import com.swipesentinel.validation.ValidationConfig;

/**
 * Every component config for one process, built eagerly by {@link AgentConfigLoader}
 * or from the environment.
 */
public record AgentConfig(
        SessionConfig session,
        AppiumConfig appium,
        DecisionEngineConfig decisionEngine,
        ValidationConfig validation,
        JudgeConfig judge,
        PolicyProfile profile) {

    /** All sections from {@code SWIPESENTINEL_*} variables; the built-in profile. */
    public static AgentConfig fromEnvironment() {
        return new AgentConfig(
            SessionConfig.fromEnvironment(),
            AppiumConfig.fromEnvironment(),
            DecisionEngineConfig.fromEnvironment(),
            ValidationConfig.fromEnvironment(),
            JudgeConfig.fromEnvironment(),
            PolicyProfile.defaults());
    }
}
