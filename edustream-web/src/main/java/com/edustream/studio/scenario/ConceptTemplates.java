package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import com.edustream.studio.scenario.EngagementSpec.Infographic;
import com.edustream.studio.scenario.EngagementSpec.QuizAbcd;

import java.util.List;

import static com.edustream.studio.scenario.Values.fmt;
import static com.edustream.studio.scenario.Values.round;

/**
 * Hooke's law, pulleys and gears, each as an infographic and as a quiz.
 */
final class ConceptTemplates {

    static final String CATEGORY = "concepts";

    private ConceptTemplates() {
    }

    static List<ScenarioTemplate> all() {
        return List.of(hookesLawInfo(), hookesLawQuiz(), pulleysInfo(), pulleysQuiz(), gearsInfo(), gearsQuiz());
    }

    private static Solution springForce(Params p) {
        return Solution.of("force", round(p.num("k") * p.num("x"), 1));
    }

    private static Solution pulleyEffort(Params p) {
        double weight = p.num("load") * ForceTemplates.GRAVITY;
        return Solution.of(
                "ma", p.integer("n_pulleys"),
                "effort", round(weight / p.num("n_pulleys"), 1),
                "weight", round(weight, 1));
    }

    private static Solution gearRatio(Params p) {
        return Solution.of(
                "ratio", round(p.num("driven_teeth") / p.num("driver_teeth"), 2),
                "speed_mult", round(p.num("driver_teeth") / p.num("driven_teeth"), 2));
    }

    static ScenarioTemplate hookesLawInfo() {
        return ScenarioTemplate.builder()
                .id("concept_hookes_law_info")
                .category(CATEGORY)
                .tags(List.of("hooke", "spring", "elasticity", "concept", "infographic", "law"))
                .diagramType("infographic")
                .param("k", RangeParam.of(50, 200, 25))
                .param("x", RangeParam.of(0.1, 0.5, 0.05))
                .solve(ConceptTemplates::springForce)
                .hook(p -> "Hooke's Law")
                .diagramDescription(p -> "Infographic: Hooke's Law. Spring diagram. k = " + fmt(p.num("k"), 0)
                        + " N/m, x = " + fmt(p.num("x"), 2) + " m, F = " + fmt(p.num("k") * p.num("x"), 1) + " N.")
                .steps(p -> List.of(
                        new ContentStep("F = kx", "formula"),
                        new ContentStep("k = " + fmt(p.num("k"), 0) + " N/m, x = " + fmt(p.num("x"), 2) + " m", "values")))
                .explanation((p, s) -> "Hooke's Law: Force is proportional to displacement in the elastic region.")
                .engagement(new Infographic(
                        (p, s) -> List.of(
                                "F = kx (force = spring constant x displacement)",
                                "Only valid in the elastic region",
                                "Example: k = " + fmt(p.num("k"), 0) + " N/m, x = " + fmt(p.num("x"), 2) + " m",
                                "F = " + fmt(s.num("force"), 1) + " N"),
                        (p, s) -> "F = kx"))
                .build();
    }

    static ScenarioTemplate hookesLawQuiz() {
        return ScenarioTemplate.builder()
                .id("concept_hookes_law_quiz")
                .category(CATEGORY)
                .tags(List.of("hooke", "spring", "elasticity", "concept", "quiz"))
                .diagramType("infographic")
                .param("k", RangeParam.of(50, 200, 25))
                .param("x", RangeParam.of(0.1, 0.5, 0.05))
                .solve(ConceptTemplates::springForce)
                .hook(p -> "Find the spring force\n(k = " + fmt(p.num("k"), 0) + " N/m)")
                .diagramDescription(p -> "Infographic: Hooke's Law. Spring diagram. k = " + fmt(p.num("k"), 0)
                        + " N/m, x = " + fmt(p.num("x"), 2) + " m.")
                .steps(p -> List.of(
                        new ContentStep("Given: k = " + fmt(p.num("k"), 0) + " N/m, x = " + fmt(p.num("x"), 2) + " m", "spring"),
                        new ContentStep("Find: Force F", "force")))
                .engagement(new QuizAbcd((p, s) -> {
                    double force = s.num("force");
                    return List.of(
                            "F = " + fmt(force, 1) + " N",
                            "F = " + fmt(round(force * 2, 1), 1) + " N",
                            "F = " + fmt(round(force / 2, 1), 1) + " N",
                            // added instead of multiplied
                            "F = " + fmt(round(p.num("k") + p.num("x"), 1), 1) + " N");
                }))
                .explanation((p, s) -> "F = kx = " + fmt(p.num("k"), 0) + " x " + fmt(p.num("x"), 2) + " = "
                        + fmt(s.num("force"), 1) + " N")
                .build();
    }

    static ScenarioTemplate pulleysInfo() {
        return ScenarioTemplate.builder()
                .id("concept_pulleys_info")
                .category(CATEGORY)
                .tags(List.of("pulley", "mechanical advantage", "concept", "infographic", "simple machine"))
                .diagramType("infographic")
                .param("n_pulleys", RangeParam.of(1, 4, 1))
                .param("load", RangeParam.of(50, 200, 25))
                .solve(ConceptTemplates::pulleyEffort)
                .hook(p -> "Pulley Systems")
                .diagramDescription(p -> "Infographic: Pulley system. " + Values.plural(p.integer("n_pulleys"), "pulley")
                        + ", load = " + fmt(p.num("load"), 0) + " kg.")
                .steps(p -> List.of(
                        new ContentStep("MA = number of supporting ropes", "formula"),
                        new ContentStep("Effort = Weight / MA", "calculation")))
                .explanation((p, s) -> "With " + (int) s.num("ma") + " pulleys, MA = " + (int) s.num("ma") + ". Effort = "
                        + fmt(s.num("weight"), 0) + " N / " + (int) s.num("ma") + " = " + fmt(s.num("effort"), 1) + " N")
                .engagement(new Infographic(
                        (p, s) -> List.of(
                                "Mechanical Advantage (MA) = " + (int) s.num("ma"),
                                "Weight = " + fmt(p.num("load"), 0) + " kg x 9.81 = " + fmt(s.num("weight"), 0) + " N",
                                "Effort = " + fmt(s.num("weight"), 0) + " / " + (int) s.num("ma") + " = "
                                        + fmt(s.num("effort"), 1) + " N",
                                "More pulleys = less effort, but more rope to pull"),
                        (p, s) -> "Effort = Weight / MA"))
                .build();
    }

    static ScenarioTemplate pulleysQuiz() {
        return ScenarioTemplate.builder()
                .id("concept_pulleys_quiz")
                .category(CATEGORY)
                .tags(List.of("pulley", "mechanical advantage", "concept", "quiz", "simple machine"))
                .diagramType("infographic")
                .param("n_pulleys", RangeParam.of(2, 4, 1))
                .param("load", RangeParam.of(50, 200, 25))
                .solve(ConceptTemplates::pulleyEffort)
                .hook(p -> "Find the effort force\n(" + p.integer("n_pulleys") + " pulleys, " + fmt(p.num("load"), 0) + " kg)")
                .diagramDescription(p -> "Infographic: Pulley system. " + p.integer("n_pulleys") + " pulleys, load = "
                        + fmt(p.num("load"), 0) + " kg.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + p.integer("n_pulleys") + " pulleys, load = " + fmt(p.num("load"), 0)
                                + " kg", "pulleys"),
                        new ContentStep("Find: Effort force", "effort")))
                .engagement(new QuizAbcd((p, s) -> {
                    double effort = s.num("effort");
                    // with two pulleys, doubling the effort lands on the weight itself
                    double doubled = p.integer("n_pulleys") == 2 ? effort * 1.5 : effort * 2;
                    return List.of(
                            "F = " + fmt(effort, 1) + " N",
                            "F = " + fmt(s.num("weight"), 0) + " N",
                            "F = " + fmt(round(doubled, 1), 1) + " N",
                            "F = " + fmt(round(effort * 0.5, 1), 1) + " N");
                }))
                .explanation((p, s) -> "MA = " + p.integer("n_pulleys") + ". Effort = " + fmt(s.num("weight"), 0) + " / "
                        + p.integer("n_pulleys") + " = " + fmt(s.num("effort"), 1) + " N")
                .build();
    }

    static ScenarioTemplate gearsInfo() {
        return ScenarioTemplate.builder()
                .id("concept_gears_info")
                .category(CATEGORY)
                .tags(List.of("gear", "ratio", "concept", "infographic", "simple machine", "transmission"))
                .diagramType("infographic")
                .param("driver_teeth", RangeParam.of(15, 30, 5))
                .param("driven_teeth", RangeParam.of(40, 80, 10))
                .solve(ConceptTemplates::gearRatio)
                .hook(p -> "Gear Ratios")
                .diagramDescription(p -> "Infographic: Gear ratio. Driver gear " + p.integer("driver_teeth")
                        + " teeth, driven gear " + p.integer("driven_teeth") + " teeth.")
                .steps(p -> List.of(
                        new ContentStep("Gear Ratio = Driven / Driver", "formula"),
                        new ContentStep(p.integer("driven_teeth") + " / " + p.integer("driver_teeth") + " = "
                                + fmt(p.num("driven_teeth") / p.num("driver_teeth"), 2), "calc")))
                .explanation((p, s) -> "Gear ratio = " + p.integer("driven_teeth") + " / " + p.integer("driver_teeth")
                        + " = " + fmt(s.num("ratio"), 2) + ". Output speed = " + fmt(s.num("speed_mult"), 2)
                        + "x input speed, but torque is " + fmt(s.num("ratio"), 2) + "x higher.")
                .engagement(new Infographic(
                        (p, s) -> List.of(
                                "Driver: " + p.integer("driver_teeth") + " teeth, Driven: " + p.integer("driven_teeth") + " teeth",
                                "Gear Ratio = " + fmt(s.num("ratio"), 2) + ":1",
                                "Speed reduction: output is " + fmt(s.num("speed_mult"), 2) + "x input speed",
                                "Torque multiplication: output is " + fmt(s.num("ratio"), 2) + "x input torque"),
                        (p, s) -> "GR = N_driven / N_driver"))
                .build();
    }

    static ScenarioTemplate gearsQuiz() {
        return ScenarioTemplate.builder()
                .id("concept_gears_quiz")
                .category(CATEGORY)
                .tags(List.of("gear", "ratio", "concept", "quiz", "simple machine"))
                .diagramType("infographic")
                .param("driver_teeth", RangeParam.of(15, 30, 5))
                .param("driven_teeth", RangeParam.of(40, 80, 10))
                .solve(ConceptTemplates::gearRatio)
                .hook(p -> "Find the gear ratio")
                .diagramDescription(p -> "Infographic: Gear ratio. Driver gear " + p.integer("driver_teeth")
                        + " teeth, driven gear " + p.integer("driven_teeth") + " teeth.")
                .steps(p -> List.of(
                        new ContentStep("Driver: " + p.integer("driver_teeth") + " teeth, Driven: "
                                + p.integer("driven_teeth") + " teeth", "gears"),
                        new ContentStep("Find: Gear ratio", "ratio")))
                .engagement(new QuizAbcd((p, s) -> {
                    double ratio = s.num("ratio");
                    return List.of(
                            "GR = " + fmt(ratio, 2) + ":1",
                            "GR = " + fmt(s.num("speed_mult"), 2) + ":1",
                            "GR = " + fmt(round(ratio * 2, 2), 2) + ":1",
                            "GR = " + fmt(round(ratio / 2, 2), 2) + ":1");
                }))
                .explanation((p, s) -> "GR = Driven / Driver = " + p.integer("driven_teeth") + " / "
                        + p.integer("driver_teeth") + " = " + fmt(s.num("ratio"), 2) + ":1")
                .build();
    }
}
