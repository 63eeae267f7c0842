package dev.promptbench.provider;

/** Two independent boolean judgements on a response. */
public record Verdict(boolean ok, boolean other) {}
