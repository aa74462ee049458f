package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import com.edustream.studio.scenario.EngagementSpec.QuizAbcd;

import java.util.List;

import static com.edustream.studio.scenario.Values.fmt;
import static com.edustream.studio.scenario.Values.round;

/**
 * Axial stress, bolt shear and bar elongation.
 */
final class StressTemplates {

    static final String CATEGORY = "stress_strain";

    private StressTemplates() {
    }

    static List<ScenarioTemplate> all() {
        return List.of(axialStress(), boltShear(), elongation());
    }

    /** Area of a circle of the given diameter. */
    static double circleArea(double diameter) {
        return Math.PI * Math.pow(diameter / 2, 2);
    }

    static ScenarioTemplate axialStress() {
        return ScenarioTemplate.builder()
                .id("stress_axial")
                .category(CATEGORY)
                .tags(List.of("stress", "axial", "rod", "bar", "tension", "compression", "cross section"))
                .diagramType("stress")
                .param("force", RangeParam.of(10, 100, 10))
                .param("diameter", RangeParam.of(20, 60, 10))
                .solve(p -> {
                    double area = circleArea(p.num("diameter"));
                    return Solution.of(
                            "area", round(area, 1),
                            "stress", round(p.num("force") * 1000 / area, 1));
                })
                .hook(p -> "Find the axial stress (σ)")
                .diagramDescription(p -> "Axial stress in a circular rod. Force of " + fmt(p.num("force"), 0)
                        + " kN applied to a rod with diameter " + fmt(p.num("diameter"), 0) + " mm.")
                .steps(p -> List.of(
                        new ContentStep("Given: F = " + fmt(p.num("force"), 0) + " kN, diameter = "
                                + fmt(p.num("diameter"), 0) + " mm", "cross section"),
                        new ContentStep("Find: Axial stress (MPa)", "stress")))
                .engagement(new QuizAbcd((p, s) -> {
                    double stress = s.num("stress");
                    double d = p.num("diameter");
                    return List.of(
                            "σ = " + fmt(stress, 1) + " MPa",
                            // area taken as pi * d^2
                            "σ = " + fmt(round(p.num("force") * 1000 / (Math.PI * d * d), 1), 1) + " MPa",
                            "σ = " + fmt(round(stress / 2, 1), 1) + " MPa",
                            "σ = " + fmt(round(stress * 1.5, 1), 1) + " MPa");
                }))
                .explanation((p, s) -> "A = pi*d^2/4 = pi*" + fmt(p.num("diameter"), 0) + "^2/4 = " + fmt(s.num("area"), 1)
                        + " mm^2. sigma = F/A = " + fmt(p.num("force") * 1000, 0) + "/" + fmt(s.num("area"), 1) + " = "
                        + fmt(s.num("stress"), 1) + " MPa")
                .build();
    }

    static ScenarioTemplate boltShear() {
        return ScenarioTemplate.builder()
                .id("stress_shear")
                .category(CATEGORY)
                .tags(List.of("stress", "shear", "pin", "bolt", "connection"))
                .diagramType("shear")
                .param("force", RangeParam.of(10, 80, 5))
                .param("diameter", RangeParam.of(10, 25, 5))
                .param("bolts", RangeParam.of(1, 3, 1))
                .solve(p -> {
                    double area = circleArea(p.num("diameter"));
                    int bolts = p.integer("bolts");
                    return Solution.of(
                            "area_one", round(area, 1),
                            "area_total", round(bolts * area, 1),
                            "shear", round(p.num("force") * 1000 / (bolts * area), 1));
                })
                .hook(p -> "Find the shear stress (τ)\n(" + Values.plural(p.integer("bolts"), "bolt")
                        + ", d = " + fmt(p.num("diameter"), 0) + " mm)")
                .diagramDescription(p -> "Shear stress in a bolt connection. Force of " + fmt(p.num("force"), 0)
                        + " kN on " + Values.plural(p.integer("bolts"), "bolt") + " with diameter "
                        + fmt(p.num("diameter"), 0) + " mm in single shear.")
                .steps(p -> List.of(
                        new ContentStep("Given: F = " + fmt(p.num("force"), 0) + " kN, " + p.integer("bolts")
                                + " bolt(s), d = " + fmt(p.num("diameter"), 0) + " mm", "shear"),
                        new ContentStep("Find: Shear stress in each bolt (MPa)", "shear stress")))
                .engagement(new QuizAbcd((p, s) -> {
                    double shear = s.num("shear");
                    int bolts = p.integer("bolts");
                    // "forgot to divide by the bolt count" only differs with more than one bolt
                    double perBoltError = bolts > 1 ? shear * bolts : shear * 2;
                    return List.of(
                            "τ = " + fmt(shear, 1) + " MPa",
                            "τ = " + fmt(round(perBoltError, 1), 1) + " MPa",
                            "τ = " + fmt(round(shear * 1.5, 1), 1) + " MPa",
                            "τ = " + fmt(round(shear * 0.6, 1), 1) + " MPa");
                }))
                .explanation((p, s) -> "A_bolt = pi*d^2/4 = " + fmt(s.num("area_one"), 1) + " mm^2. τ = F/(n*A) = "
                        + fmt(p.num("force") * 1000, 0) + "/(" + p.integer("bolts") + "*" + fmt(s.num("area_one"), 1)
                        + ") = " + fmt(s.num("shear"), 1) + " MPa")
                .build();
    }

    static ScenarioTemplate elongation() {
        return ScenarioTemplate.builder()
                .id("strain_elongation")
                .category(CATEGORY)
                .tags(List.of("strain", "elongation", "deformation", "bar", "rod", "elastic", "young"))
                .diagramType("stress")
                .param("force", RangeParam.of(20, 100, 10))
                .param("length", RangeParam.of(1, 4, 0.5))
                .param("diameter", RangeParam.of(20, 50, 10))
                // steel
                .param("E", RangeParam.of(200, 200, 1))
                .solve(p -> {
                    double area = circleArea(p.num("diameter"));
                    double delta = (p.num("force") * 1000 * p.num("length") * 1000) / (area * p.num("E") * 1000);
                    return Solution.of("area", round(area, 2), "delta", round(delta, 2));
                })
                .hook(p -> "Find the elongation\nin the bar (δ)")
                .diagramDescription(p -> "Axial elongation of a steel bar under tension. Force of "
                        + fmt(p.num("force"), 0) + " kN on a steel bar, length " + fmt(p.num("length"), 1)
                        + " m, diameter " + fmt(p.num("diameter"), 0) + " mm, modulus E = " + fmt(p.num("E"), 0) + " GPa.")
                .steps(p -> List.of(
                        new ContentStep("Given: F=" + fmt(p.num("force"), 0) + "kN, L=" + fmt(p.num("length"), 1)
                                + "m, d=" + fmt(p.num("diameter"), 0) + "mm, E=" + fmt(p.num("E"), 0) + "GPa", "properties"),
                        new ContentStep("Find: Elongation (mm)", "deformation")))
                .engagement(new QuizAbcd((p, s) -> {
                    double delta = s.num("delta");
                    return List.of(
                            "δ = " + fmt(delta, 2) + " mm",
                            "δ = " + fmt(round(delta * 2, 2), 2) + " mm",
                            "δ = " + fmt(round(delta / 2, 2), 2) + " mm",
                            "δ = " + fmt(round(delta * 1.5, 2), 2) + " mm");
                }))
                .explanation((p, s) -> "delta = PL/AE = (" + fmt(p.num("force") * 1000, 0) + " x "
                        + fmt(p.num("length") * 1000, 0) + ") / (" + fmt(s.num("area"), 1) + " x "
                        + fmt(p.num("E") * 1000, 0) + ") = " + fmt(s.num("delta"), 2) + " mm")
                .build();
    }
}
