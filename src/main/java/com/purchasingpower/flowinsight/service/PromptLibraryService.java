package com.purchasingpower.flowinsight.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.flowinsight.exception.ConfigurationException;
import com.purchasingpower.flowinsight.model.prompt.PromptTemplate;
import com.purchasingpower.flowinsight.model.prompt.RenderedPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files under {@code classpath:prompts/} and renders
 * them with variables. Use triple braces in templates: model prompts are not HTML.
 *
 * Usage:
 * RenderedPrompt prompt = promptLibrary.render("process-analysis", Map.of(
 *     "metricsText", metricsText,
 *     "industry", "healthcare"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(
                        resource.getInputStream(),
                        PromptTemplate.class
                );

                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {}, task: {})",
                        template.getName(), template.getVersion(), template.getTask());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new ConfigurationException("prompt templates could not be loaded: " + e.getMessage(), "prompts");
        }
    }

    /**
     * Render both parts of a template with the same variables.
     *
     * @throws ConfigurationException if no template has that name
     */
    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);

        if (template == null) {
            throw new ConfigurationException("prompt template not found: " + templateName, "prompts/" + templateName);
        }

        return new RenderedPrompt(
                renderPart(templateName + "#system", template.getSystemPrompt(), variables),
                renderPart(templateName + "#user", template.getUserPrompt(), variables));
    }

    /**
     * Get template metadata (for logging, debugging)
     */
    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private String renderPart(String key, String text, Map<String, Object> variables) {
        if (text == null || text.isBlank()) {
            return "";
        }
        Mustache mustache = compiled.computeIfAbsent(key,
                k -> mustacheFactory.compile(new StringReader(text), k));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);

        return writer.toString().strip();
    }
}
