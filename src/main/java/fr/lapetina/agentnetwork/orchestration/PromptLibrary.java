package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt templates loaded from a markdown file, one template per {@code ## Section}.
 *
 * Every {@link PromptTemplate} must be present; loading fails fast otherwise.
 * Placeholders are {@code {name}} tokens; placeholders without a value are left as is.
 */
public final class PromptLibrary {

    private static final Logger log = LoggerFactory.getLogger(PromptLibrary.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final Map<PromptTemplate, String> templates;

    private PromptLibrary(Map<PromptTemplate, String> templates) {
        this.templates = templates;
    }

    /**
     * Loads templates from the classpath, falling back to the file system.
     *
     * @throws ConfigurationException if the file is missing or lacks a required section
     */
    public static PromptLibrary load(String resource) {
        String classpathResource = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream is = PromptLibrary.class.getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading prompts from classpath: {}", classpathResource);
                return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8), classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read prompts from classpath: " + classpathResource, e);
        }

        Path path = Paths.get(resource);
        if (Files.exists(path)) {
            try {
                log.info("Loading prompts from file: {}", path);
                return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read prompts from: " + path, e);
            }
        }

        throw new ConfigurationException("Prompt file not found: " + resource);
    }

    /**
     * Parses markdown content directly.
     */
    public static PromptLibrary parse(String markdown, String source) {
        Map<String, String> sections = splitSections(markdown);
        Map<PromptTemplate, String> templates = new EnumMap<>(PromptTemplate.class);

        for (PromptTemplate template : PromptTemplate.values()) {
            String body = sections.get(template.getHeading());
            if (body == null || body.isBlank()) {
                throw new ConfigurationException(
                        "Prompt section missing: '" + template.getHeading() + "' in " + source);
            }
            templates.put(template, body);
        }

        log.info("Prompts loaded: source={}, sections={}", source, sections.size());
        return new PromptLibrary(templates);
    }

    private static Map<String, String> splitSections(String markdown) {
        Map<String, String> sections = new LinkedHashMap<>();
        String current = null;
        StringBuilder content = new StringBuilder();

        for (String line : markdown.split("\\R", -1)) {
            if (line.startsWith("## ")) {
                if (current != null) {
                    sections.put(current, content.toString().strip());
                }
                current = line.substring(3).strip();
                content.setLength(0);
            } else if (current != null) {
                content.append(line).append('\n');
            }
        }
        if (current != null) {
            sections.put(current, content.toString().strip());
        }
        return sections;
    }

    /**
     * Raw template text.
     */
    public String template(PromptTemplate template) {
        return templates.get(template);
    }

    /**
     * Template with every known {@code {name}} placeholder replaced.
     */
    public String render(PromptTemplate template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(templates.get(template));
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
