package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import com.edustream.studio.scenario.EngagementSpec.QuizAbcd;

import java.util.List;

import static com.edustream.studio.scenario.Values.fmt;
import static com.edustream.studio.scenario.Values.round;

/**
 * Free body diagrams: resultants, cable tension and blocks on an incline.
 */
final class ForceTemplates {

    static final String CATEGORY = "force_equilibrium";
    static final double GRAVITY = 9.81;

    private ForceTemplates() {
    }

    static List<ScenarioTemplate> all() {
        return List.of(resultant(), cableTension(), inclinedPlane());
    }

    static ScenarioTemplate resultant() {
        return ScenarioTemplate.builder()
                .id("fbd_resultant")
                .category(CATEGORY)
                .tags(List.of("force", "resultant", "vector", "fbd", "free body", "addition", "rope"))
                .diagramType("fbd")
                .param("f1", RangeParam.of(20, 80, 10))
                .param("f2", RangeParam.of(20, 80, 10))
                .param("angle", RangeParam.of(45, 120, 15))
                .solve(p -> {
                    double f1 = p.num("f1");
                    double f2 = p.num("f2");
                    double cos = Math.cos(Math.toRadians(p.num("angle")));
                    return Solution.of("resultant", round(Math.sqrt(f1 * f1 + f2 * f2 + 2 * f1 * f2 * cos), 1));
                })
                .hook(p -> "Two ropes pull a ring bolt.\nFind the resultant force.")
                .diagramDescription(p -> "Free body diagram with forces. Find the resultant. "
                        + "F1 = " + fmt(p.num("f1"), 0) + " N at 0 degrees. "
                        + "F2 = " + fmt(p.num("f2"), 0) + " N at " + fmt(p.num("angle"), 0) + " degrees.")
                .steps(p -> List.of(
                        new ContentStep("Given: F1 = " + fmt(p.num("f1"), 0) + " N, F2 = " + fmt(p.num("f2"), 0)
                                + " N, angle = " + fmt(p.num("angle"), 0) + " deg", "forces"),
                        new ContentStep("Find: Magnitude of resultant force", "resultant")))
                .engagement(new QuizAbcd((p, s) -> {
                    double r = s.num("resultant");
                    return List.of(
                            "R = " + fmt(r, 1) + " N",
                            "R = " + fmt(p.num("f1") + p.num("f2"), 0) + " N",
                            "R = " + fmt(Math.abs(p.num("f1") - p.num("f2")), 0) + " N",
                            "R = " + fmt(round(r * 1.2, 1), 1) + " N");
                }))
                .explanation((p, s) -> "R = sqrt(F1² + F2² + 2·F1·F2·cosθ) = sqrt(" + fmt(p.num("f1"), 0) + "² + "
                        + fmt(p.num("f2"), 0) + "² + 2·" + fmt(p.num("f1"), 0) + "·" + fmt(p.num("f2"), 0) + "·cos("
                        + fmt(p.num("angle"), 0) + "°)) = " + fmt(s.num("resultant"), 1) + " N")
                .build();
    }

    static ScenarioTemplate cableTension() {
        return ScenarioTemplate.builder()
                .id("fbd_cable_tension")
                .category(CATEGORY)
                .tags(List.of("force", "equilibrium", "cable", "tension", "hanging", "weight"))
                .diagramType("fbd_cables")
                .param("mass", RangeParam.of(10, 50, 5))
                .param("angle", RangeParam.of(30, 60, 5))
                .solve(p -> {
                    double weight = p.num("mass") * GRAVITY;
                    double sin = Math.sin(Math.toRadians(p.num("angle")));
                    return Solution.of(
                            "weight", round(weight, 1),
                            "tension", round(weight / (2 * sin), 1));
                })
                .hook(p -> "Find the cable tension\n(" + fmt(p.num("mass"), 0) + " kg, θ = " + fmt(p.num("angle"), 0) + "°)")
                .diagramDescription(p -> "Hanging weight from two cables. mass = " + fmt(p.num("mass"), 0)
                        + " kg, angle = " + fmt(p.num("angle"), 0) + " degrees from horizontal.")
                .steps(p -> List.of(
                        new ContentStep("Given: mass = " + fmt(p.num("mass"), 0) + " kg, cable angle = "
                                + fmt(p.num("angle"), 0) + "° from horizontal", "cables"),
                        new ContentStep("Find: Tension in each cable", "tension")))
                .engagement(new QuizAbcd((p, s) -> {
                    double t = s.num("tension");
                    return List.of(
                            "T = " + fmt(t, 1) + " N",
                            "T = " + fmt(round(s.num("weight") / 2, 1), 1) + " N",
                            "T = " + fmt(round(t * 0.7, 1), 1) + " N",
                            "T = " + fmt(round(t * 1.4, 1), 1) + " N");
                }))
                .explanation((p, s) -> "Equilibrium: 2T·sin(θ) = W → T = W/(2·sinθ) = " + fmt(s.num("weight"), 1)
                        + "/(2·sin(" + fmt(p.num("angle"), 0) + "°)) = " + fmt(s.num("tension"), 1) + " N")
                .build();
    }

    static ScenarioTemplate inclinedPlane() {
        return ScenarioTemplate.builder()
                .id("fbd_inclined_plane")
                .category(CATEGORY)
                .tags(List.of("force", "incline", "plane", "friction", "fbd", "free body", "block", "slope"))
                .diagramType("fbd")
                .param("mass", RangeParam.of(5, 30, 5))
                // stays below 45 degrees where the normal and parallel components coincide
                .param("angle", RangeParam.of(15, 40, 5))
                .solve(p -> {
                    double weight = p.num("mass") * GRAVITY;
                    double radians = Math.toRadians(p.num("angle"));
                    return Solution.of(
                            "weight", round(weight, 1),
                            "normal", round(weight * Math.cos(radians), 1),
                            "parallel", round(weight * Math.sin(radians), 1));
                })
                .hook(p -> "Find the normal force\n(m = " + fmt(p.num("mass"), 0) + " kg, θ = " + fmt(p.num("angle"), 0) + "°)")
                .diagramDescription(p -> "Free body diagram with forces. W = " + fmt(p.num("mass") * GRAVITY, 0)
                        + " N at 270 degrees. Block on " + fmt(p.num("angle"), 0) + " deg incline. Mass = "
                        + fmt(p.num("mass"), 0) + " kg.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("mass"), 0) + " kg block on " + fmt(p.num("angle"), 0)
                                + " deg incline", "incline"),
                        new ContentStep("Find: Normal force (N) perpendicular to the slope", "normal force")))
                .engagement(new QuizAbcd((p, s) -> List.of(
                        "N = " + fmt(s.num("normal"), 1) + " N",
                        "N = " + fmt(s.num("weight"), 1) + " N",
                        "N = " + fmt(s.num("parallel"), 1) + " N",
                        "N = " + fmt(round(s.num("normal") * 0.75, 1), 1) + " N")))
                .explanation((p, s) -> "N = mg x cos(θ) = " + fmt(p.num("mass"), 0) + " x 9.81 x cos("
                        + fmt(p.num("angle"), 0) + "°) = " + fmt(s.num("normal"), 1) + " N")
                .build();
    }
}
