package com.edustream.studio.scenario;

import java.util.List;
import java.util.Random;

/**
 * Casual caption lines used when a template has no tweet formatter of its own.
 */
final class TweetPools {

    static final List<String> QUIZ = List.of(
            "most engineers get this wrong on their first try",
            "this looks simple but watch out for the trick",
            "my professor used to put this on every exam",
            "how fast can you solve this one?",
            "if you get this right you're ready for your exam",
            "engineering students... can you get this?",
            "quick statics problem. go.",
            "pause and try this before scrolling",
            "this is the kind of problem that separates A students from B students",
            "you either see it instantly or you don't",
            "be honest... did you get it right?",
            "your statics professor is watching. no pressure.",
            "30 seconds. that's all you need.",
            "I failed this type of problem in my first year. don't be like me",
            "real talk... this one is tricky",
            "nobody gets D on this one",
            "comment your answer before checking",
            "tag someone who needs to practice this",
            "this comes up in every FE exam");

    static final List<String> TRUE_FALSE = List.of(
            "true or false? most people guess wrong on this one",
            "this trips up so many engineering students",
            "sounds right... but is it?",
            "your gut feeling might be wrong on this one",
            "one of the most common misconceptions in mechanics",
            "I bet half of you get this wrong",
            "think before you answer this one",
            "this shows up on exams more than you'd think");

    static final List<String> IDENTIFY = List.of(
            "can you identify this point on the curve?",
            "name that point. engineering students should know this",
            "if you can't identify this you need to review your notes",
            "this comes up in every materials science exam",
            "stress-strain basics. do you know your stuff?",
            "how well do you actually know the stress-strain curve?");

    static final List<String> INFOGRAPHIC = List.of(
            "save this for your next exam",
            "one of the most useful concepts in engineering",
            "if your professor didn't explain this well, here you go",
            "bookmark this. you'll need it later",
            "the concept that makes everything else click",
            "engineering fundamentals in one image",
            "I wish someone explained this to me this clearly in school",
            "this is the kind of stuff that shows up on the FE exam");

    private TweetPools() {
    }

    static List<String> forFormat(EngagementFormat format) {
        return switch (format) {
            case QUIZ_ABCD -> QUIZ;
            case IDENTIFY -> IDENTIFY;
            case TRUE_FALSE -> TRUE_FALSE;
            case INFOGRAPHIC -> INFOGRAPHIC;
        };
    }

    static String pick(EngagementFormat format, Random random) {
        List<String> pool = forFormat(format);
        return pool.get(random.nextInt(pool.size()));
    }
}
