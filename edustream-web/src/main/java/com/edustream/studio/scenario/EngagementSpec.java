package com.edustream.studio.scenario;

import com.edustream.studio.model.ScriptPayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * How a template engages the viewer and which answer fields it writes into the payload.
 */
public sealed interface EngagementSpec
        permits EngagementSpec.QuizAbcd, EngagementSpec.Identify, EngagementSpec.TrueFalse, EngagementSpec.Infographic {

    EngagementFormat format();

    void apply(Params params, Solution solution, Random random, ScriptPayload.ScriptPayloadBuilder payload);

    /**
     * Four options, the first one correct, shown in random order.
     */
    record QuizAbcd(BiFunction<Params, Solution, List<String>> options) implements EngagementSpec {

        @Override
        public EngagementFormat format() {
            return EngagementFormat.QUIZ_ABCD;
        }

        public List<String> rawOptions(Params params, Solution solution) {
            return options.apply(params, solution);
        }

        @Override
        public void apply(Params params, Solution solution, Random random, ScriptPayload.ScriptPayloadBuilder payload) {
            QuizOptions.shuffle(rawOptions(params, solution), random).writeTo(payload);
        }
    }

    /**
     * The correct label of a fixed label set, with every other label of the set as a distractor.
     */
    record Identify(BiFunction<Params, Solution, String> correctLabel, List<String> labels) implements EngagementSpec {

        public Identify {
            labels = List.copyOf(labels);
        }

        @Override
        public EngagementFormat format() {
            return EngagementFormat.IDENTIFY;
        }

        public List<String> rawOptions(Params params, Solution solution) {
            String correct = correctLabel.apply(params, solution);
            List<String> options = new ArrayList<>();
            options.add(correct);
            labels.stream().filter(label -> !label.equals(correct)).forEach(options::add);
            return options;
        }

        @Override
        public void apply(Params params, Solution solution, Random random, ScriptPayload.ScriptPayloadBuilder payload) {
            QuizOptions.shuffle(rawOptions(params, solution), random).writeTo(payload);
        }
    }

    record TrueFalse(BiFunction<Params, Solution, String> statement,
                     BiPredicate<Params, Solution> isTrue) implements EngagementSpec {

        @Override
        public EngagementFormat format() {
            return EngagementFormat.TRUE_FALSE;
        }

        @Override
        public void apply(Params params, Solution solution, Random random, ScriptPayload.ScriptPayloadBuilder payload) {
            payload.statement(statement.apply(params, solution))
                    .correctAnswer(isTrue.test(params, solution) ? "True" : "False")
                    .answerOptions(List.of("True", "False"));
        }
    }

    /**
     * No question: a list of key facts and the governing formula.
     */
    record Infographic(BiFunction<Params, Solution, List<String>> keyFacts,
                       BiFunction<Params, Solution, String> formula) implements EngagementSpec {

        @Override
        public EngagementFormat format() {
            return EngagementFormat.INFOGRAPHIC;
        }

        @Override
        public void apply(Params params, Solution solution, Random random, ScriptPayload.ScriptPayloadBuilder payload) {
            payload.keyFacts(keyFacts != null ? keyFacts.apply(params, solution) : List.of())
                    .formula(formula != null ? formula.apply(params, solution) : "");
        }
    }
}
