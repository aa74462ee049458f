package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import com.edustream.studio.scenario.EngagementSpec.QuizAbcd;

import java.util.List;

import static com.edustream.studio.scenario.Values.fmt;
import static com.edustream.studio.scenario.Values.round;

final class MomentTemplates {

    static final String CATEGORY = "moments";

    private MomentTemplates() {
    }

    static List<ScenarioTemplate> all() {
        return List.of(forceMoment(), coupleMoment());
    }

    static ScenarioTemplate forceMoment() {
        return ScenarioTemplate.builder()
                .id("moment_force")
                .category(CATEGORY)
                .tags(List.of("moment", "force", "torque", "point", "lever arm"))
                .diagramType("fbd")
                .param("force", RangeParam.of(10, 50, 5))
                .param("distance", RangeParam.of(2, 8, 1))
                .param("angle", RangeParam.of(30, 75, 15))
                .solve(p -> Solution.of("moment",
                        round(p.num("force") * p.num("distance") * Math.sin(Math.toRadians(p.num("angle"))), 1)))
                .hook(p -> "Can you calculate the moment?")
                .diagramDescription(p -> "Free body diagram with forces. Lever problem. F = " + fmt(p.num("force"), 0)
                        + " kN at " + fmt(p.num("angle"), 0) + " degrees. Lever arm d = " + fmt(p.num("distance"), 0) + " m.")
                .steps(p -> List.of(
                        new ContentStep("Given: F = " + fmt(p.num("force"), 0) + " kN, d = " + fmt(p.num("distance"), 0)
                                + " m, angle = " + fmt(p.num("angle"), 0) + " deg", "lever arm"),
                        new ContentStep("Find: Moment about the pivot point", "moment")))
                .engagement(new QuizAbcd((p, s) -> {
                    double m = s.num("moment");
                    return List.of(
                            "M = " + fmt(m, 1) + " kNm",
                            // sin(theta) left out
                            "M = " + fmt(p.num("force") * p.num("distance"), 0) + " kNm",
                            "M = " + fmt(round(m * 1.5, 1), 1) + " kNm",
                            "M = " + fmt(round(m / 2, 1), 1) + " kNm");
                }))
                .explanation((p, s) -> "M = F x d x sin(theta) = " + fmt(p.num("force"), 0) + " x "
                        + fmt(p.num("distance"), 0) + " x sin(" + fmt(p.num("angle"), 0) + ") = "
                        + fmt(s.num("moment"), 1) + " kNm")
                .build();
    }

    static ScenarioTemplate coupleMoment() {
        return ScenarioTemplate.builder()
                .id("moment_couple")
                .category(CATEGORY)
                .tags(List.of("moment", "couple", "torque", "pair"))
                .diagramType("fbd")
                .param("force", RangeParam.of(10, 40, 5))
                .param("arm", RangeParam.of(1, 6, 0.5))
                .solve(p -> Solution.of("moment", round(p.num("force") * p.num("arm"), 1)))
                .hook(p -> "Can you find the couple moment?")
                .diagramDescription(p -> "Free body diagram with forces. Two equal and opposite forces of "
                        + fmt(p.num("force"), 0) + " kN separated by " + fmt(p.num("arm"), 1) + "m.")
                .steps(p -> List.of(
                        new ContentStep("Given: Two forces of " + fmt(p.num("force"), 0) + " kN, arm = "
                                + fmt(p.num("arm"), 1) + "m", "couple"),
                        new ContentStep("Find: Couple moment", "moment")))
                .engagement(new QuizAbcd((p, s) -> {
                    double m = s.num("moment");
                    return List.of(
                            "M = " + fmt(m, 1) + " kNm",
                            "M = " + fmt(round(2 * p.num("force") * p.num("arm"), 1), 1) + " kNm",
                            "M = " + fmt(round(m / 2, 1), 1) + " kNm",
                            "M = " + fmt(round(m * 0.7, 1), 1) + " kNm");
                }))
                .explanation((p, s) -> "Couple moment = F x d = " + fmt(p.num("force"), 0) + " x " + fmt(p.num("arm"), 1)
                        + " = " + fmt(s.num("moment"), 1) + " kNm")
                .build();
    }
}
