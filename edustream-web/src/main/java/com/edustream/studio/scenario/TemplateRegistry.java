package com.edustream.studio.scenario;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalog of templates, built once at startup and handed to the {@link TemplatePool}.
 */
@Slf4j
public class TemplateRegistry {

    private final List<ScenarioTemplate> templates;

    public TemplateRegistry(Collection<ScenarioTemplate> templates) {
        Set<String> ids = new HashSet<>();
        for (ScenarioTemplate template : templates) {
            if (!ids.add(template.getId())) {
                throw new IllegalArgumentException("Duplicate template id: " + template.getId());
            }
        }
        this.templates = List.copyOf(templates);
        log.info("Registered {} templates", this.templates.size());
    }

    public static TemplateRegistry builtIn() {
        List<ScenarioTemplate> all = new ArrayList<>();
        all.addAll(BeamTemplates.all());
        all.addAll(ForceTemplates.all());
        all.addAll(StressTemplates.all());
        all.addAll(MomentTemplates.all());
        all.addAll(StressStrainCurveTemplates.all());
        all.addAll(ConceptTemplates.all());
        return new TemplateRegistry(all);
    }

    public List<ScenarioTemplate> all() {
        return templates;
    }

    public Optional<ScenarioTemplate> find(String id) {
        return templates.stream().filter(t -> t.getId().equals(id)).findFirst();
    }

    public int size() {
        return templates.size();
    }
}
