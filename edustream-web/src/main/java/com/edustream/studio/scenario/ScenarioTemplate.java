package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A parameterized problem or fact generator. {@code solve} must be deterministic and free of side
 * effects; everything shown to the viewer is derived from the sampled parameters and its result.
 */
@Getter
@Builder
public class ScenarioTemplate {
    @NonNull
    private final String id;
    private final String category;
    @Singular
    private final List<String> tags;
    private final String diagramType;
    // insertion order is the sampling order
    @Singular
    private final Map<String, ParamSpec> params;
    @NonNull
    private final Function<Params, Solution> solve;
    @NonNull
    private final Function<Params, String> hook;
    @NonNull
    private final Function<Params, String> diagramDescription;
    @NonNull
    private final Function<Params, List<ContentStep>> steps;
    @Builder.Default
    private final BiFunction<Params, Solution, String> explanation = (p, s) -> "";
    @NonNull
    private final EngagementSpec engagement;
    private final TweetFormatter tweet;

    public EngagementFormat engagementFormat() {
        return engagement.format();
    }
}
