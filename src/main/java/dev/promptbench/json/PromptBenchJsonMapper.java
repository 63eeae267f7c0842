package dev.promptbench.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.SneakyThrows;

/** Centralized ObjectMapper for promptbench. */
public final class PromptBenchJsonMapper {

    private static volatile ObjectMapper instance;

    private PromptBenchJsonMapper() {}

    public static ObjectMapper get() {
        if (instance == null) {
            synchronized (PromptBenchJsonMapper.class) {
                if (instance == null) {
                    instance =
                            new ObjectMapper()
                                    .registerModule(new JavaTimeModule())
                                    .registerModule(new Jdk8Module())
                                    .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                                    .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                                    .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                                    .configure(
                                            DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                                            false);
                }
            }
        }
        return instance;
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return get().writeValueAsString(o);
    }

    @SneakyThrows
    public static <T> T fromJson(String jsonString, Class<T> targetClass) {
        return get().readValue(jsonString, targetClass);
    }
}
