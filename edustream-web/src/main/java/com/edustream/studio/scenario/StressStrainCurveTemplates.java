package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import com.edustream.studio.scenario.EngagementSpec.Identify;
import com.edustream.studio.scenario.EngagementSpec.TrueFalse;

import java.util.List;

/**
 * Reading stress-strain curves of three reference materials.
 */
final class StressStrainCurveTemplates {

    static final String CATEGORY = "stress_strain_curve";

    static final String YIELD = "Yield Strength";
    static final String ULTIMATE = "Ultimate Tensile Strength";
    static final String FRACTURE = "Fracture";
    static final String PROPORTIONAL_LIMIT = "Proportional Limit";

    /** Labels a curve can carry; the identify formats use all of them as the answer set. */
    static final List<String> CURVE_POINTS = List.of(YIELD, ULTIMATE, FRACTURE, PROPORTIONAL_LIMIT);

    record Material(String key, String name, int yieldMpa, int ultimateMpa, double fractureStrain,
                    int modulusGpa, String behavior, int proportionalLimitMpa, List<String> points) {

        /** A point present on this material's curve; brittle materials lack some of them. */
        String point(int index) {
            return points.get(index % points.size());
        }
    }

    static final List<Material> MATERIALS = List.of(
            new Material("steel", "Mild Steel", 250, 400, 0.25, 200, "ductile", 220, CURVE_POINTS),
            new Material("aluminum", "Aluminum 6061", 270, 310, 0.12, 69, "ductile", 240, CURVE_POINTS),
            new Material("cast_iron", "Cast Iron", 130, 200, 0.005, 100, "brittle", 120, List.of(ULTIMATE, FRACTURE)));

    record Statement(String text, int materialIndex, boolean isTrue) {
    }

    static final List<Statement> STATEMENTS = List.of(
            new Statement("Mild steel shows a clear yield plateau before strain hardening", 0, true),
            new Statement("Cast iron exhibits significant necking before fracture", 2, false),
            new Statement("Aluminum 6061 has a higher elastic modulus than mild steel", 1, false),
            new Statement("Cast iron fails with very little plastic deformation", 2, true),
            new Statement("Mild steel has greater ductility than cast iron", 0, true),
            new Statement("The elastic modulus of aluminum is about 69 GPa", 1, true));

    private StressStrainCurveTemplates() {
    }

    static List<ScenarioTemplate> all() {
        return List.of(identifyPoint(), trueFalse(), whatsMissing());
    }

    private static Material material(Params p) {
        return MATERIALS.get(p.integer("material_idx"));
    }

    private static Statement statement(Params p) {
        return STATEMENTS.get(p.integer("stmt_idx"));
    }

    static ScenarioTemplate identifyPoint() {
        return ScenarioTemplate.builder()
                .id("ss_curve_identify")
                .category(CATEGORY)
                .tags(List.of("stress", "strain", "curve", "yield", "ultimate", "fracture", "material", "interview"))
                .diagramType("stress_strain_curve")
                .param("material_idx", ChoiceParam.indices(MATERIALS.size()))
                .param("point_idx", ChoiceParam.indices(CURVE_POINTS.size()))
                .solve(p -> Solution.of(
                        "material", material(p).key(),
                        "highlighted_point", material(p).point(p.integer("point_idx"))))
                .hook(p -> "Can you identify\nthis point?")
                .diagramDescription(p -> "Stress-strain curve for " + material(p).name() + ". Highlight point: "
                        + material(p).point(p.integer("point_idx")) + ". Behavior: " + material(p).behavior() + ".")
                .steps(p -> List.of(
                        new ContentStep("Material: " + material(p).name(), "material"),
                        new ContentStep("Identify the highlighted point on the curve", "point")))
                .engagement(new Identify((p, s) -> s.text("highlighted_point"), CURVE_POINTS))
                .explanation((p, s) -> "The highlighted point is the " + s.text("highlighted_point") + " on the "
                        + material(p).name() + " stress-strain curve.")
                .build();
    }

    static ScenarioTemplate trueFalse() {
        return ScenarioTemplate.builder()
                .id("ss_curve_true_false")
                .category(CATEGORY)
                .tags(List.of("stress", "strain", "curve", "material", "true false", "interview", "concept"))
                .diagramType("stress_strain_curve")
                .param("stmt_idx", ChoiceParam.indices(STATEMENTS.size()))
                .solve(p -> Solution.of(
                        "statement", statement(p).text(),
                        "material", MATERIALS.get(statement(p).materialIndex()).key(),
                        "is_true", statement(p).isTrue()))
                .hook(p -> "True or False?\n\"" + statement(p).text() + "\"")
                .diagramDescription(p -> {
                    Material m = MATERIALS.get(statement(p).materialIndex());
                    return "Stress-strain curve for " + m.name() + ". Behavior: " + m.behavior() + ". Show all labels.";
                })
                .steps(p -> List.of(new ContentStep(statement(p).text(), "statement")))
                .engagement(new TrueFalse((p, s) -> s.text("statement"), (p, s) -> s.flag("is_true")))
                .explanation((p, s) -> {
                    Material m = MATERIALS.get(statement(p).materialIndex());
                    return (s.flag("is_true") ? "TRUE" : "FALSE") + ": " + s.text("statement") + ". "
                            + m.name() + " is a " + m.behavior() + " material.";
                })
                .build();
    }

    static ScenarioTemplate whatsMissing() {
        return ScenarioTemplate.builder()
                .id("ss_curve_whats_missing")
                .category(CATEGORY)
                .tags(List.of("stress", "strain", "curve", "material", "interview", "identify"))
                .diagramType("stress_strain_curve")
                .param("material_idx", ChoiceParam.indices(MATERIALS.size()))
                .param("hidden_idx", ChoiceParam.indices(CURVE_POINTS.size()))
                .solve(p -> Solution.of(
                        "material", material(p).key(),
                        "hidden_label", material(p).point(p.integer("hidden_idx"))))
                .hook(p -> "What label\nis missing?")
                .diagramDescription(p -> "Stress-strain curve for " + material(p).name() + ". Hide label: "
                        + material(p).point(p.integer("hidden_idx")) + ". Behavior: " + material(p).behavior() + ".")
                .steps(p -> List.of(
                        new ContentStep("Material: " + material(p).name(), "material"),
                        new ContentStep("One label has been replaced with '?', identify it", "missing")))
                .engagement(new Identify((p, s) -> s.text("hidden_label"), CURVE_POINTS))
                .explanation((p, s) -> "The missing label is the " + s.text("hidden_label") + ".")
                .build();
    }
}
