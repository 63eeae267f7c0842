package dev.promptbench.stats;

/** Latency of the successful responses of a pair, in seconds. */
public record LatencyStats(double min, double avg, double max, int count) {}
