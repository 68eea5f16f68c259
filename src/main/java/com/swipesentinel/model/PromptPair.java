package com.swipesentinel.model;

/** A profile prompt and its answer, as read from "Prompt: … Answer: …" labels. */
public record PromptPair(String prompt, String answer) {}
