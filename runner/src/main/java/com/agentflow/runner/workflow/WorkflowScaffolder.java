package com.agentflow.runner.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Writes a starter {@code workflow.yml} and {@code prompt.md} from one of
 * the bundled templates under {@code templates/<template>/}.
 */
@Component
public class WorkflowScaffolder {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScaffolder.class);

    public enum Template {
        BASIC("basic"),
        AGENT("agent"),
        TEST_GRADER("test-grader");

        private final String id;

        Template(String id) { this.id = id; }

        public String id() { return id; }

        public static Template parse(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.id.equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown template '" + value
                            + "'; expected one of " + Arrays.stream(values()).map(Template::id).toList()));
        }
    }

    static final List<String> FILES = List.of("workflow.yml", "prompt.md");

    /**
     * @return the directory the files were written to, {@code <baseDir>/<slug>}
     * @throws IllegalStateException if the target directory already holds a workflow
     */
    public Path scaffold(String name, Template template, Path baseDir) {
        String slug = slug(name);
        Path dir = baseDir.resolve(slug);
        if (Files.exists(dir.resolve("workflow.yml"))) {
            throw new IllegalStateException(dir.resolve("workflow.yml") + " already exists");
        }
        try {
            Files.createDirectories(dir);
            for (String file : FILES) {
                String content = template(template, file).replace("{{name}}", name);
                Files.writeString(dir.resolve(file), content, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not scaffold workflow into " + dir, e);
        }
        log.info("Scaffolded '{}' workflow into {}", template.id(), dir);
        return dir;
    }

    static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        return slug.isEmpty() ? "workflow" : slug;
    }

    private static String template(Template template, String file) throws IOException {
        String resource = "/templates/" + template.id() + "/" + file;
        try (InputStream in = WorkflowScaffolder.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled template " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
