package com.edustream.studio.config;

import com.edustream.studio.scenario.TemplatePool;
import com.edustream.studio.scenario.TemplateRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class ScenarioConfig {

    @Bean
    public Random templateRandom() {
        return new Random();
    }

    @Bean
    public TemplateRegistry templateRegistry() {
        return TemplateRegistry.builtIn();
    }

    @Bean
    public TemplatePool templatePool(TemplateRegistry templateRegistry, Random templateRandom) {
        return new TemplatePool(templateRegistry, templateRandom);
    }
}
