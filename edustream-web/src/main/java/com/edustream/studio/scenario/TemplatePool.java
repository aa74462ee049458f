package com.edustream.studio.scenario;

import com.edustream.studio.model.ScriptPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Produces script payloads from the template catalog without any external call.
 * <p>
 * Selection is freshness-first: templates absent from the recency list are preferred, and when
 * every candidate was used recently the one used longest ago wins, so the whole candidate set is
 * covered before anything repeats. All randomness comes from the injected {@link Random}.
 */
@Slf4j
public class TemplatePool {

    private final TemplateRegistry registry;
    private final Random random;

    public TemplatePool(TemplateRegistry registry, Random random) {
        this.registry = registry;
        this.random = random;
    }

    /**
     * @param recentTemplateIds template ids of recent content, most recent first
     */
    public ScriptPayload generate(String topic, String category, String description, List<String> recentTemplateIds) {
        List<ScenarioTemplate> candidates = matchCandidates(topic, category, description);
        ScenarioTemplate template = selectTemplate(candidates, recentTemplateIds);
        log.info("Selected template: {}", template.getId());

        Params params = sampleParameters(template);
        log.debug("Sampled params: {}", params);
        Solution solution = template.getSolve().apply(params);

        ScriptPayload.ScriptPayloadBuilder payload = ScriptPayload.builder()
                .type(template.engagementFormat().getPayloadType())
                .hookText(template.getHook().apply(params))
                .diagramDescription(template.getDiagramDescription().apply(params))
                .contentSteps(template.getSteps().apply(params))
                .explanation(template.getExplanation().apply(params, solution))
                .ctaText(template.engagementFormat().getCallToAction())
                .templateId(template.getId());

        template.getEngagement().apply(params, solution, random, payload);

        String tweet = template.getTweet() != null
                ? template.getTweet().format(params, solution, template.engagementFormat())
                : TweetPools.pick(template.engagementFormat(), random);
        return payload.tweetText(tweet).build();
    }

    /**
     * Templates with the most tags found in {@code "topic category description"}; all templates
     * when no tag matches.
     */
    public List<ScenarioTemplate> matchCandidates(String topic, String category, String description) {
        String searchText = (nullToEmpty(topic) + " " + nullToEmpty(category) + " " + nullToEmpty(description))
                .toLowerCase(Locale.ROOT);

        int maxScore = 0;
        List<ScenarioTemplate> best = new ArrayList<>();
        for (ScenarioTemplate template : registry.all()) {
            int score = (int) template.getTags().stream().filter(searchText::contains).count();
            if (score == 0 || score < maxScore) {
                continue;
            }
            if (score > maxScore) {
                maxScore = score;
                best.clear();
            }
            best.add(template);
        }
        return best.isEmpty() ? registry.all() : best;
    }

    public ScenarioTemplate selectTemplate(List<ScenarioTemplate> candidates, List<String> recentIds) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No templates to choose from");
        }
        if (recentIds == null || recentIds.isEmpty()) {
            return candidates.get(random.nextInt(candidates.size()));
        }

        List<ScenarioTemplate> fresh = candidates.stream()
                .filter(t -> !recentIds.contains(t.getId()))
                .toList();
        if (!fresh.isEmpty()) {
            return fresh.get(random.nextInt(fresh.size()));
        }

        // every candidate is in the list: take the one whose latest use is oldest
        Map<String, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < recentIds.size(); i++) {
            firstIndex.putIfAbsent(recentIds.get(i), i);
        }
        ScenarioTemplate leastRecent = candidates.get(0);
        for (ScenarioTemplate candidate : candidates) {
            if (firstIndex.get(candidate.getId()) > firstIndex.get(leastRecent.getId())) {
                leastRecent = candidate;
            }
        }
        return leastRecent;
    }

    public Params sampleParameters(ScenarioTemplate template) {
        Map<String, Double> values = new LinkedHashMap<>();
        template.getParams().forEach((name, spec) -> values.put(name, spec.sample(random)));
        return new Params(values);
    }

    public TemplateRegistry getRegistry() {
        return registry;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
