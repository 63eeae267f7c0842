package dev.promptbench;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

public class PromptBenchUtils {
    public static List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }

        return Arrays.stream(csv.trim().split("\\s*,\\s*")).filter(s -> !s.isEmpty()).toList();
    }

    /** fractional seconds of a duration, at nanosecond precision */
    public static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
