package com.edustream.studio.scenario;

import com.edustream.studio.model.ContentStep;
import com.edustream.studio.scenario.EngagementSpec.QuizAbcd;

import java.util.List;

import static com.edustream.studio.scenario.Values.fmt;
import static com.edustream.studio.scenario.Values.round;

/**
 * Support reactions of simply supported and cantilever beams.
 */
final class BeamTemplates {

    static final String CATEGORY = "beam_reactions";

    private static final String SIMPLY_SUPPORTED =
            "Pin support at left end (A), roller support at right end (B). ";

    private BeamTemplates() {
    }

    static List<ScenarioTemplate> all() {
        return List.of(centerLoad(), offsetLoad(), twoLoads(), cantileverEndLoad(), cantileverMidLoad(), uniformLoad());
    }

    static ScenarioTemplate centerLoad() {
        return ScenarioTemplate.builder()
                .id("beam_ss_center")
                .category(CATEGORY)
                .tags(List.of("beam", "simply supported", "reaction", "center", "point load", "loading"))
                .diagramType("beam")
                .param("length", RangeParam.of(4, 12, 2))
                .param("load", RangeParam.of(10, 50, 5))
                .solve(p -> Solution.of("ra", p.num("load") / 2, "rb", p.num("load") / 2))
                .hook(p -> "Can you solve this Beam loading analysis problem?")
                .diagramDescription(p -> "Simply supported beam, " + fmt(p.num("length"), 0) + "m length. "
                        + SIMPLY_SUPPORTED
                        + "Point load of " + fmt(p.num("load"), 0) + " kN applied at center ("
                        + fmt(p.num("length") / 2, 0) + "m from each end).")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("length"), 0) + "m beam with "
                                + fmt(p.num("load"), 0) + " kN center load", "load"),
                        new ContentStep("Find: Reaction forces at A and B", "reactions")))
                .engagement(new QuizAbcd((p, s) -> List.of(
                        reactions(s.num("ra"), s.num("rb"), 1),
                        "Ra = " + fmt(p.num("load"), 1) + " kN, Rb = 0 kN",
                        reactions(s.num("ra") + 2, s.num("rb") - 2, 1),
                        reactions(s.num("ra") * 2, s.num("rb") * 2, 1))))
                .explanation((p, s) -> "By symmetry, each support carries half the load: "
                        + fmt(p.num("load"), 0) + " / 2 = " + fmt(s.num("ra"), 1) + " kN each")
                .build();
    }

    static ScenarioTemplate offsetLoad() {
        return ScenarioTemplate.builder()
                .id("beam_ss_offset")
                .category(CATEGORY)
                .tags(List.of("beam", "simply supported", "reaction", "offset", "point load", "loading", "asymmetric"))
                .diagramType("beam")
                .param("length", RangeParam.of(6, 12, 2))
                .param("load", RangeParam.of(10, 40, 5))
                .param("dist_a", RangeParam.of(2, 4, 1))
                .solve(p -> {
                    double load = p.num("load");
                    double length = p.num("length");
                    double distA = p.num("dist_a");
                    return Solution.of(
                            "rb", round(load * distA / length, 1),
                            "ra", round(load * (length - distA) / length, 1));
                })
                .hook(p -> "Can you solve this Beam reaction problem?")
                .diagramDescription(p -> "Simply supported beam, " + fmt(p.num("length"), 0) + "m length. "
                        + SIMPLY_SUPPORTED
                        + "Point load of " + fmt(p.num("load"), 0) + " kN applied at "
                        + fmt(p.num("dist_a"), 0) + "m from left end.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("length"), 0) + "m beam, " + fmt(p.num("load"), 0)
                                + " kN load at " + fmt(p.num("dist_a"), 0) + "m from A", "load position"),
                        new ContentStep("Find: Reaction forces Ra and Rb", "reactions")))
                .engagement(new QuizAbcd((p, s) -> {
                    double ra = s.num("ra");
                    double rb = s.num("rb");
                    // swapping is no distractor when the load sits mid-span
                    String swapped = Math.abs(ra - rb) < 0.5
                            ? reactions(ra + 2, rb - 2, 1)
                            : reactions(rb, ra, 1);
                    return List.of(
                            reactions(ra, rb, 1),
                            swapped,
                            "Ra = " + fmt(p.num("load"), 1) + " kN, Rb = 0 kN",
                            reactions(round(ra * 1.3, 1), round(rb * 0.7, 1), 1));
                }))
                .explanation((p, s) -> "Taking moments about A: Rb = " + fmt(p.num("load"), 0) + " x "
                        + fmt(p.num("dist_a"), 0) + " / " + fmt(p.num("length"), 0) + " = " + fmt(s.num("rb"), 1)
                        + " kN. Ra = " + fmt(p.num("load"), 0) + " - " + fmt(s.num("rb"), 1) + " = "
                        + fmt(s.num("ra"), 1) + " kN")
                .build();
    }

    static ScenarioTemplate twoLoads() {
        return ScenarioTemplate.builder()
                .id("beam_ss_two_loads")
                .category(CATEGORY)
                .tags(List.of("beam", "simply supported", "reaction", "two loads", "point load", "loading", "multiple"))
                .diagramType("beam")
                .param("length", RangeParam.of(8, 12, 2))
                .param("load1", RangeParam.of(10, 30, 5))
                .param("load2", RangeParam.of(10, 30, 5))
                .param("dist1", RangeParam.of(2, 3, 1))
                .param("dist2", RangeParam.of(5, 7, 1))
                .solve(p -> {
                    double load1 = p.num("load1");
                    double load2 = p.num("load2");
                    double moment = load1 * p.num("dist1") + load2 * p.num("dist2");
                    return Solution.of(
                            "rb", round(moment / p.num("length"), 1),
                            "ra", round(load1 + load2 - moment / p.num("length"), 1));
                })
                .hook(p -> "Can you find the beam reactions?")
                .diagramDescription(p -> "Simply supported beam, " + fmt(p.num("length"), 0) + "m length. "
                        + SIMPLY_SUPPORTED
                        + "Point load of " + fmt(p.num("load1"), 0) + " kN at " + fmt(p.num("dist1"), 0) + "m from A. "
                        + "Point load of " + fmt(p.num("load2"), 0) + " kN at " + fmt(p.num("dist2"), 0) + "m from A.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("length"), 0) + "m beam with " + fmt(p.num("load1"), 0)
                                + " kN at " + fmt(p.num("dist1"), 0) + "m and " + fmt(p.num("load2"), 0) + " kN at "
                                + fmt(p.num("dist2"), 0) + "m", "loads"),
                        new ContentStep("Find: Reaction forces at A and B", "reactions")))
                .engagement(new QuizAbcd((p, s) -> {
                    double ra = s.num("ra");
                    double rb = s.num("rb");
                    double load1 = p.num("load1");
                    double load2 = p.num("load2");
                    String swapped = Math.abs(ra - rb) < 0.5
                            ? reactions(ra + 3, rb - 3, 1)
                            : reactions(rb, ra, 1);
                    // "each support takes one load" collides when the reactions already equal the loads
                    boolean loadsMatchReactions = (Math.abs(ra - load1) < 0.5 && Math.abs(rb - load2) < 0.5)
                            || (Math.abs(rb - load1) < 0.5 && Math.abs(ra - load2) < 0.5);
                    String oneLoadEach = loadsMatchReactions
                            ? reactions(ra * 1.5, rb * 0.5, 1)
                            : reactions(load1, load2, 1);
                    return List.of(
                            reactions(ra, rb, 1),
                            swapped,
                            "Ra = " + fmt(load1 + load2, 1) + " kN, Rb = 0 kN",
                            oneLoadEach);
                }))
                .explanation((p, s) -> "Sum moments about A: Rb x " + fmt(p.num("length"), 0) + " = "
                        + fmt(p.num("load1"), 0) + " x " + fmt(p.num("dist1"), 0) + " + "
                        + fmt(p.num("load2"), 0) + " x " + fmt(p.num("dist2"), 0) + ". Rb = "
                        + fmt(s.num("rb"), 1) + " kN, Ra = " + fmt(s.num("ra"), 1) + " kN")
                .build();
    }

    static ScenarioTemplate cantileverEndLoad() {
        return ScenarioTemplate.builder()
                .id("beam_cantilever_end")
                .category(CATEGORY)
                .tags(List.of("beam", "cantilever", "reaction", "end load", "fixed", "moment"))
                .diagramType("beam")
                .param("length", RangeParam.of(2, 8, 1))
                .param("load", RangeParam.of(5, 40, 5))
                .solve(p -> Solution.of("reaction", p.num("load"), "moment", p.num("load") * p.num("length")))
                .hook(p -> "Can you solve this cantilever beam problem?")
                .diagramDescription(p -> "Cantilever beam, " + fmt(p.num("length"), 0) + "m length. "
                        + "Fixed support at left end (A). "
                        + "Point load of " + fmt(p.num("load"), 0) + " kN applied at the free right end.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("length"), 0) + "m cantilever with "
                                + fmt(p.num("load"), 0) + " kN end load", "cantilever"),
                        new ContentStep("Find: Reaction force and moment at A", "reactions")))
                .engagement(new QuizAbcd((p, s) -> {
                    double r = s.num("reaction");
                    double m = s.num("moment");
                    return List.of(
                            fixedEnd(r, m),
                            fixedEnd(r, m / 2),
                            fixedEnd(r / 2, m),
                            fixedEnd(r, m * 2));
                }))
                .explanation((p, s) -> "For a cantilever: R = P = " + fmt(s.num("reaction"), 0) + " kN, M = P x L = "
                        + fmt(p.num("load"), 0) + " x " + fmt(p.num("length"), 0) + " = " + fmt(s.num("moment"), 0) + " kNm")
                .build();
    }

    static ScenarioTemplate cantileverMidLoad() {
        return ScenarioTemplate.builder()
                .id("beam_cantilever_mid")
                .category(CATEGORY)
                .tags(List.of("beam", "cantilever", "reaction", "mid load", "fixed"))
                .diagramType("beam")
                .param("length", RangeParam.of(4, 8, 1))
                .param("load", RangeParam.of(10, 40, 5))
                .param("dist", RangeParam.of(2, 3, 1))
                .solve(p -> Solution.of("reaction", p.num("load"), "moment", p.num("load") * p.num("dist")))
                .hook(p -> "Can you solve this cantilever problem?")
                .diagramDescription(p -> "Cantilever beam, " + fmt(p.num("length"), 0) + "m length. "
                        + "Fixed support at left end (A). "
                        + "Point load of " + fmt(p.num("load"), 0) + " kN applied at " + fmt(p.num("dist"), 0)
                        + "m from the fixed end.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("length"), 0) + "m cantilever, " + fmt(p.num("load"), 0)
                                + " kN at " + fmt(p.num("dist"), 0) + "m from fixed end", "load"),
                        new ContentStep("Find: Reaction force and moment at fixed support", "reactions")))
                .engagement(new QuizAbcd((p, s) -> {
                    double r = s.num("reaction");
                    double m = s.num("moment");
                    return List.of(
                            fixedEnd(r, m),
                            fixedEnd(r, p.num("load") * p.num("length")),
                            fixedEnd(r / 2, m),
                            fixedEnd(r, m / 2));
                }))
                .explanation((p, s) -> "R = P = " + fmt(s.num("reaction"), 0) + " kN (equilibrium). M = P x a = "
                        + fmt(p.num("load"), 0) + " x " + fmt(p.num("dist"), 0) + " = " + fmt(s.num("moment"), 0) + " kNm")
                .build();
    }

    static ScenarioTemplate uniformLoad() {
        return ScenarioTemplate.builder()
                .id("beam_ss_udl")
                .category(CATEGORY)
                .tags(List.of("beam", "simply supported", "reaction", "distributed", "udl", "uniform", "loading"))
                .diagramType("beam")
                .param("length", RangeParam.of(4, 10, 2))
                .param("w", RangeParam.of(2, 10, 1))
                .solve(p -> {
                    double total = p.num("w") * p.num("length");
                    return Solution.of("total_load", total, "ra", total / 2, "rb", total / 2);
                })
                .hook(p -> "Can you solve this distributed load problem?")
                .diagramDescription(p -> "Simply supported beam, " + fmt(p.num("length"), 0) + "m length. "
                        + SIMPLY_SUPPORTED
                        + "Uniformly distributed load of " + fmt(p.num("w"), 0) + " kN/m along entire beam. "
                        + "Total load " + fmt(p.num("w") * p.num("length"), 0) + " kN at center.")
                .steps(p -> List.of(
                        new ContentStep("Given: " + fmt(p.num("length"), 0) + "m beam with UDL of "
                                + fmt(p.num("w"), 0) + " kN/m", "distributed load"),
                        new ContentStep("Find: Reaction forces at A and B", "reactions")))
                .engagement(new QuizAbcd((p, s) -> List.of(
                        reactions(s.num("ra"), s.num("rb"), 0),
                        reactions(p.num("w"), p.num("w"), 0),
                        "Ra = " + fmt(s.num("total_load"), 0) + " kN, Rb = 0 kN",
                        reactions(s.num("ra") + 3, s.num("rb") - 3, 0))))
                .explanation((p, s) -> "Total load = " + fmt(p.num("w"), 0) + " x " + fmt(p.num("length"), 0) + " = "
                        + fmt(s.num("total_load"), 0) + " kN. By symmetry: Ra = Rb = " + fmt(s.num("total_load"), 0)
                        + " / 2 = " + fmt(s.num("ra"), 0) + " kN")
                .build();
    }

    private static String reactions(double ra, double rb, int scale) {
        return "Ra = " + fmt(ra, scale) + " kN, Rb = " + fmt(rb, scale) + " kN";
    }

    private static String fixedEnd(double reaction, double moment) {
        return "R = " + fmt(reaction, 0) + " kN, M = " + fmt(moment, 0) + " kNm";
    }
}
