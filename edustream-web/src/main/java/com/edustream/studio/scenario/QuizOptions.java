package com.edustream.studio.scenario;

import com.edustream.studio.model.ScriptPayload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

/**
 * Four answer options rendered as {@code "A: ..."} to {@code "D: ..."} with the letter of the
 * correct one.
 */
public record QuizOptions(List<String> options, String correctLetter) {

    static final List<String> LETTERS = List.of("A", "B", "C", "D");

    /**
     * Shuffles {@code raw}, whose first element is the correct answer.
     *
     * @throws IllegalStateException if there are not exactly four pairwise distinct options
     */
    public static QuizOptions shuffle(List<String> raw, Random random) {
        if (raw.size() != LETTERS.size()) {
            throw new IllegalStateException("Quiz needs exactly 4 options, got " + raw.size() + ": " + raw);
        }
        if (new HashSet<>(raw).size() != raw.size()) {
            throw new IllegalStateException("Quiz options are not distinct: " + raw);
        }
        String correct = raw.get(0);
        List<String> shuffled = new ArrayList<>(raw);
        Collections.shuffle(shuffled, random);

        List<String> lettered = new ArrayList<>(shuffled.size());
        for (int i = 0; i < shuffled.size(); i++) {
            lettered.add(LETTERS.get(i) + ": " + shuffled.get(i));
        }
        return new QuizOptions(lettered, LETTERS.get(shuffled.indexOf(correct)));
    }

    void writeTo(ScriptPayload.ScriptPayloadBuilder payload) {
        payload.answerOptions(options).correctAnswer(correctLetter);
    }
}
