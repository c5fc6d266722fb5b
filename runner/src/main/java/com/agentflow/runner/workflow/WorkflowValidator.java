package com.agentflow.runner.workflow;

import com.agentflow.runner.model.Policy;
import com.agentflow.runner.model.StepType;
import com.agentflow.runner.model.WorkflowDefinition;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Validates workflow YAML before anything executes.
 *
 * Checks run in three passes over the parsed tree:
 * <ol>
 *   <li>Syntax: the text must parse as a YAML mapping.</li>
 *   <li>Schema: required fields, types, enums, numeric ranges, unknown keys.</li>
 *   <li>Semantics: unique step ids, complete agent policies, apply_diff sources,
 *       prompt files present on disk.</li>
 * </ol>
 *
 * Every missing agent policy subfield is reported against the owning step
 * id. Validation only reads; it never creates a run directory.
 */
@Component
public class WorkflowValidator {

    private static final Pattern STEP_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
    private static final String  RUN_ID_TOKEN = "${RUN_ID}";

    private static final Set<String> ROOT_KEYS   = Set.of("version", "workflow", "model", "guardrails", "env", "steps");
    private static final Set<String> ENV_KEYS    = Set.of("max_runtime_seconds", "artifacts_dir", "seed");
    private static final Set<String> STEP_KEYS   = Set.of("id", "type", "prompt_file", "command", "policy",
            "available_tools", "inputs", "on_error", "timeout_seconds", "approve", "source_step");
    private static final List<String> POLICY_KEYS = List.of("timeout_seconds", "max_files", "max_edits",
            "allowed_paths", "cmd_allowlist");

    private final YAMLMapper            yaml;
    private final UnaryOperator<String> environment;

    @Autowired
    public WorkflowValidator(YAMLMapper yaml) {
        this(yaml, System::getenv);
    }

    public WorkflowValidator(YAMLMapper yaml, UnaryOperator<String> environment) {
        this.yaml        = yaml;
        this.environment = environment;
    }

    /**
     * Validate workflow text.
     *
     * @param text    raw YAML
     * @param baseDir directory that {@code prompt_file} entries resolve against;
     *                null skips the on-disk check
     */
    public ValidationReport validate(String text, Path baseDir) {
        List<Violation> errors   = new ArrayList<>();
        List<Violation> warnings = new ArrayList<>();

        // ── Pass 1: syntax ───────────────────────────────────────────────────
        JsonNode root;
        try {
            root = yaml.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            errors.add(Violation.at("/", "YAML syntax error: " + e.getOriginalMessage() + location(e)));
            return new ValidationReport(null, errors, warnings);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            errors.add(Violation.at("/", "workflow document is empty"));
            return new ValidationReport(null, errors, warnings);
        }
        if (!root.isObject()) {
            errors.add(Violation.at("/", "workflow document must be a mapping, found " + kind(root)));
            return new ValidationReport(null, errors, warnings);
        }

        // ── Pass 2: schema ───────────────────────────────────────────────────
        checkRoot(root, errors, warnings);

        // ── Pass 3: semantics ────────────────────────────────────────────────
        checkSemantics(root, baseDir, errors, warnings);

        if (!errors.isEmpty()) {
            return new ValidationReport(null, errors, warnings);
        }
        try {
            WorkflowDefinition workflow = yaml.treeToValue(root, WorkflowDefinition.class);
            return new ValidationReport(workflow, errors, warnings);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            errors.add(Violation.at("/", "could not bind workflow: " + e.getMessage()));
            return new ValidationReport(null, errors, warnings);
        }
    }

    // ------------------------------------------------------------------
    // Schema pass
    // ------------------------------------------------------------------

    private void checkRoot(JsonNode root, List<Violation> errors, List<Violation> warnings) {
        unknownKeys(root, ROOT_KEYS, "", errors);

        JsonNode version = root.get("version");
        if (version == null) {
            errors.add(Violation.at("/version", "required property 'version' is missing"));
        } else if (!version.isIntegralNumber()) {
            errors.add(Violation.at("/version", "must be an integer, found " + kind(version)));
        } else if (version.asInt() != WorkflowDefinition.SCHEMA_VERSION) {
            errors.add(Violation.at("/version", "unsupported schema version " + version.asText()
                    + " (expected " + WorkflowDefinition.SCHEMA_VERSION + ")"));
        }

        JsonNode name = root.get("workflow");
        if (name == null) {
            errors.add(Violation.at("/workflow", "required property 'workflow' is missing"));
        } else if (!name.isTextual() || name.asText().isBlank()) {
            errors.add(Violation.at("/workflow", "must be a non-empty string"));
        }

        JsonNode model = root.get("model");
        if (model == null) {
            warnings.add(Violation.at("/model", "no model specified; BEDROCK_MODEL_ID from the environment will be used"));
        } else if (!model.isTextual() || model.asText().isBlank()) {
            errors.add(Violation.at("/model", "must be a non-empty string"));
        } else if (Placeholders.hasPlaceholder(Placeholders.expand(model.asText(), environment))) {
            warnings.add(Violation.at("/model", "'" + model.asText()
                    + "' refers to an unset environment variable; BEDROCK_MODEL_ID will be used"));
        }

        JsonNode guardrails = root.get("guardrails");
        if (guardrails != null) {
            stringArray(guardrails, "/guardrails", null, errors);
        }

        JsonNode env = root.get("env");
        if (env != null) {
            checkEnv(env, errors);
        }

        JsonNode steps = root.get("steps");
        if (steps == null) {
            errors.add(Violation.at("/steps", "required property 'steps' is missing"));
        } else if (!steps.isArray()) {
            errors.add(Violation.at("/steps", "must be an array, found " + kind(steps)));
        } else if (steps.isEmpty()) {
            errors.add(Violation.at("/steps", "must contain at least one step"));
        } else {
            for (int i = 0; i < steps.size(); i++) {
                checkStep(steps.get(i), "/steps/" + i, errors, warnings);
            }
        }
    }

    private void checkEnv(JsonNode env, List<Violation> errors) {
        if (!env.isObject()) {
            errors.add(Violation.at("/env", "must be a mapping, found " + kind(env)));
            return;
        }
        unknownKeys(env, ENV_KEYS, "/env", errors);
        JsonNode maxRuntime = env.get("max_runtime_seconds");
        if (maxRuntime != null) {
            intInRange(maxRuntime, "/env/max_runtime_seconds", null, 1, Integer.MAX_VALUE, errors);
        }
        JsonNode dir = env.get("artifacts_dir");
        if (dir != null && (!dir.isTextual() || dir.asText().isBlank())) {
            errors.add(Violation.at("/env/artifacts_dir", "must be a non-empty string"));
        } else if (dir != null && !runIdOnlyAsLastSegment(dir.asText())) {
            errors.add(Violation.at("/env/artifacts_dir",
                    RUN_ID_TOKEN + " may only appear once, as the last path segment"));
        }
        JsonNode seed = env.get("seed");
        if (seed != null && !seed.isIntegralNumber()) {
            errors.add(Violation.at("/env/seed", "must be an integer, found " + kind(seed)));
        }
    }

    // resume finds a run as <root>/<runId>, so the run id must name the final directory
    static boolean runIdOnlyAsLastSegment(String template) {
        String trimmed = template.replaceAll("[/\\\\]+$", "");
        int first = trimmed.indexOf(RUN_ID_TOKEN);
        if (first < 0) return true;
        return first == trimmed.lastIndexOf(RUN_ID_TOKEN)
                && trimmed.endsWith(RUN_ID_TOKEN)
                && (first == 0 || trimmed.charAt(first - 1) == '/' || trimmed.charAt(first - 1) == '\\');
    }

    private void checkStep(JsonNode step, String at, List<Violation> errors, List<Violation> warnings) {
        if (!step.isObject()) {
            errors.add(Violation.at(at, "step must be a mapping, found " + kind(step)));
            return;
        }
        String stepId = textOrNull(step.get("id"));

        JsonNode id = step.get("id");
        if (id == null) {
            errors.add(Violation.at(at + "/id", "required property 'id' is missing"));
        } else if (!id.isTextual() || !STEP_ID.matcher(id.asText()).matches()) {
            errors.add(Violation.at(at + "/id",
                    "must match " + STEP_ID.pattern() + " (found " + id.asText() + ")"));
        }

        unknownKeys(step, STEP_KEYS, at, errors, stepId);

        JsonNode typeNode = step.get("type");
        StepType type = null;
        if (typeNode == null) {
            errors.add(Violation.forStep(at + "/type", stepId, "required property 'type' is missing"));
        } else {
            type = StepType.fromYaml(typeNode.asText()).orElse(null);
            if (!typeNode.isTextual() || type == null) {
                errors.add(Violation.forStep(at + "/type", stepId, "must be one of "
                        + StepType.acceptedNames() + " (found " + typeNode.asText() + ")"));
                type = null;
            }
        }

        JsonNode onError = step.get("on_error");
        if (onError != null && !("fail".equals(onError.asText()) || "continue".equals(onError.asText()))) {
            errors.add(Violation.forStep(at + "/on_error", stepId,
                    "must be one of [fail, continue] (found " + onError.asText() + ")"));
        }

        JsonNode tools = step.get("available_tools");
        if (tools != null) {
            stringArray(tools, at + "/available_tools", stepId, errors);
        }

        JsonNode inputs = step.get("inputs");
        if (inputs != null) {
            checkInputs(inputs, at + "/inputs", stepId, errors);
        }

        JsonNode timeout = step.get("timeout_seconds");
        if (timeout != null) {
            intInRange(timeout, at + "/timeout_seconds", stepId, 1, Policy.MAX_TIMEOUT_SECONDS, errors);
        }

        JsonNode policy = step.get("policy");
        if (policy != null) {
            checkPolicyShape(policy, at + "/policy", stepId, errors);
        }

        if (type == null) return;

        switch (type) {
            case PROMPT -> requireText(step, "prompt_file", at, stepId, "prompt steps require prompt_file", errors);
            case AGENT -> {
                JsonNode promptFile = step.get("prompt_file");
                if (promptFile != null && (!promptFile.isTextual() || promptFile.asText().isBlank())) {
                    errors.add(Violation.forStep(at + "/prompt_file", stepId, "must be a non-empty string"));
                }
            }
            case COMMAND -> requireText(step, "command", at, stepId, "cmd steps require command", errors);
            case APPLY_DIFF -> {
                JsonNode approve = step.get("approve");
                if (approve == null) {
                    errors.add(Violation.forStep(at + "/approve", stepId,
                            "apply_diff steps require an explicit boolean 'approve'"));
                } else if (!approve.isBoolean()) {
                    errors.add(Violation.forStep(at + "/approve", stepId,
                            "must be a boolean, found " + kind(approve)));
                }
                JsonNode source = step.get("source_step");
                if (source != null && (!source.isTextual() || source.asText().isBlank())) {
                    errors.add(Violation.forStep(at + "/source_step", stepId, "must be a non-empty string"));
                }
            }
            case CUSTOM -> warnings.add(Violation.forStep(at + "/type", stepId,
                    "custom steps fail at run time unless an executor is registered for them"));
        }

        if (type != StepType.AGENT && policy != null) {
            warnings.add(Violation.forStep(at + "/policy", stepId, "policy is only enforced on agent steps"));
        }
        if (type != StepType.COMMAND && timeout != null) {
            warnings.add(Violation.forStep(at + "/timeout_seconds", stepId,
                    "timeout_seconds applies to cmd steps; agent steps use policy.timeout_seconds"));
        }
    }

    private void checkInputs(JsonNode inputs, String at, String stepId, List<Violation> errors) {
        if (!inputs.isObject()) {
            errors.add(Violation.forStep(at, stepId, "must be a mapping, found " + kind(inputs)));
            return;
        }
        JsonNode paths = inputs.get("paths");
        if (paths != null) {
            stringArray(paths, at + "/paths", stepId, errors);
        }
        JsonNode limit = inputs.get("file_size_limit_kb");
        if (limit != null) {
            intInRange(limit, at + "/file_size_limit_kb", stepId, 1, Integer.MAX_VALUE, errors);
        }
    }

    private void checkPolicyShape(JsonNode policy, String at, String stepId, List<Violation> errors) {
        if (!policy.isObject()) {
            errors.add(Violation.forStep(at, stepId, "policy must be a mapping, found " + kind(policy)));
            return;
        }
        unknownKeys(policy, Set.copyOf(POLICY_KEYS), at, errors, stepId);
        JsonNode timeout = policy.get("timeout_seconds");
        if (timeout != null) intInRange(timeout, at + "/timeout_seconds", stepId, 1, Policy.MAX_TIMEOUT_SECONDS, errors);
        JsonNode maxFiles = policy.get("max_files");
        if (maxFiles != null) intInRange(maxFiles, at + "/max_files", stepId, 0, Policy.MAX_FILES, errors);
        JsonNode maxEdits = policy.get("max_edits");
        if (maxEdits != null) intInRange(maxEdits, at + "/max_edits", stepId, 0, Policy.MAX_EDITS, errors);
        JsonNode paths = policy.get("allowed_paths");
        if (paths != null) stringArray(paths, at + "/allowed_paths", stepId, errors);
        JsonNode allowlist = policy.get("cmd_allowlist");
        if (allowlist != null) stringArray(allowlist, at + "/cmd_allowlist", stepId, errors);
    }

    // ------------------------------------------------------------------
    // Semantic pass
    // ------------------------------------------------------------------

    private void checkSemantics(JsonNode root, Path baseDir, List<Violation> errors, List<Violation> warnings) {
        JsonNode steps = root.get("steps");
        if (steps == null || !steps.isArray()) return;

        Map<String, Integer> firstIndex = new HashMap<>();
        Map<String, String>  typeById   = new HashMap<>();

        for (int i = 0; i < steps.size(); i++) {
            JsonNode step = steps.get(i);
            if (!step.isObject()) continue;
            String at     = "/steps/" + i;
            String stepId = textOrNull(step.get("id"));
            StepType type = StepType.fromYaml(textOrNull(step.get("type"))).orElse(null);

            if (stepId != null) {
                Integer prior = firstIndex.putIfAbsent(stepId, i);
                if (prior != null) {
                    errors.add(Violation.forStep(at + "/id", stepId,
                            "duplicate step id (first declared at /steps/" + prior + ")"));
                }
            }

            if (type == StepType.AGENT) {
                checkPolicyComplete(step.get("policy"), at + "/policy", stepId, errors);
            }

            if (type == StepType.APPLY_DIFF) {
                String source = textOrNull(step.get("source_step"));
                if (source != null) {
                    String sourceType = typeById.get(source);
                    if (sourceType == null) {
                        errors.add(Violation.forStep(at + "/source_step", stepId,
                                "source_step '" + source + "' must name an earlier step"));
                    } else if (!StepType.AGENT.yamlName().equals(sourceType)) {
                        errors.add(Violation.forStep(at + "/source_step", stepId,
                                "source_step '" + source + "' must be an agent step"));
                    }
                } else if (!typeById.containsValue(StepType.AGENT.yamlName())) {
                    errors.add(Violation.forStep(at, stepId,
                            "apply_diff requires an earlier agent step to take the diff from"));
                }
            }

            String promptFile = textOrNull(step.get("prompt_file"));
            if (baseDir != null && promptFile != null && !promptFile.isBlank()
                    && (type == StepType.PROMPT || type == StepType.AGENT)) {
                Path resolved = baseDir.resolve(promptFile).normalize();
                if (!Files.isRegularFile(resolved)) {
                    errors.add(Violation.forStep(at + "/prompt_file", stepId,
                            "prompt file not found: " + resolved));
                }
            }

            if (stepId != null && type != null) {
                typeById.putIfAbsent(stepId, type.yamlName());
            }
        }
    }

    private void checkPolicyComplete(JsonNode policy, String at, String stepId, List<Violation> errors) {
        if (policy == null || policy.isNull()) {
            errors.add(Violation.forStep(at, stepId, "agent steps require a policy with "
                    + String.join(", ", POLICY_KEYS)));
            return;
        }
        if (!policy.isObject()) return;   // already reported by the schema pass
        List<String> missing = POLICY_KEYS.stream().filter(k -> !policy.hasNonNull(k)).toList();
        if (!missing.isEmpty()) {
            errors.add(Violation.forStep(at, stepId,
                    "agent policy is incomplete; missing " + String.join(", ", missing)));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void unknownKeys(JsonNode node, Set<String> allowed, String at, List<Violation> errors) {
        unknownKeys(node, allowed, at, errors, null);
    }

    private static void unknownKeys(JsonNode node, Set<String> allowed, String at,
                                    List<Violation> errors, String stepId) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                errors.add(Violation.forStep(at + "/" + name, stepId, "unknown property '" + name + "'"));
            }
        }
    }

    private static void intInRange(JsonNode node, String at, String stepId, int min, int max,
                                   List<Violation> errors) {
        if (!node.isIntegralNumber()) {
            errors.add(Violation.forStep(at, stepId, "must be an integer, found " + kind(node)));
        } else if (node.asLong() < min || node.asLong() > max) {
            String range = max == Integer.MAX_VALUE ? ">= " + min : "in [" + min + ", " + max + "]";
            errors.add(Violation.forStep(at, stepId, "must be " + range + " (found " + node.asText() + ")"));
        }
    }

    private static void stringArray(JsonNode node, String at, String stepId, List<Violation> errors) {
        if (!node.isArray()) {
            errors.add(Violation.forStep(at, stepId, "must be an array of strings, found " + kind(node)));
            return;
        }
        for (int i = 0; i < node.size(); i++) {
            if (!node.get(i).isTextual()) {
                errors.add(Violation.forStep(at + "/" + i, stepId, "must be a string, found " + kind(node.get(i))));
            }
        }
    }

    private static void requireText(JsonNode step, String field, String at, String stepId,
                                    String message, List<Violation> errors) {
        JsonNode value = step.get(field);
        if (value == null || value.isNull()) {
            errors.add(Violation.forStep(at + "/" + field, stepId, message));
        } else if (!value.isTextual() || value.asText().isBlank()) {
            errors.add(Violation.forStep(at + "/" + field, stepId, "must be a non-empty string"));
        }
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String kind(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }

    private static String location(JsonProcessingException e) {
        JsonLocation loc = e.getLocation();
        return loc == null ? "" : " (line " + loc.getLineNr() + ", column " + loc.getColumnNr() + ")";
    }
}
