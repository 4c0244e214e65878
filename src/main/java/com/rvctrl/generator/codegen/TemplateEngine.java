package com.rvctrl.generator.codegen;

import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.signal.SignalIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders the Ctrl and Field artifacts of a control signal.
 *
 * Templates are plain text with {@code {name}} placeholders. Substitution is a single
 * left-to-right pass: replacement text is never rescanned, and braces that do not name a known
 * placeholder are copied through untouched.
 *
 * <ul>
 *   <li>{@code {signal_name}}, {@code {encoding_type}}, {@code {signal_width}}, {@code {generation_time}}</li>
 *   <li>{@code {values_list}}: one {@code val X = Value} line per value</li>
 *   <li>{@code {methods_list}}: one {@code def isX: Seq[String]} accessor per value</li>
 *   <li>{@code {value_mappings}} (Field only): accessor to enumeration member pairs</li>
 * </ul>
 */
public class TemplateEngine {
    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    public static final String SIGNAL_NAME = "signal_name";
    public static final String ENCODING_TYPE = "encoding_type";
    public static final String SIGNAL_WIDTH = "signal_width";
    public static final String GENERATION_TIME = "generation_time";
    public static final String VALUES_LIST = "values_list";
    public static final String METHODS_LIST = "methods_list";
    public static final String VALUE_MAPPINGS = "value_mappings";

    public static final String EXAMPLE_CTRL_TEMPLATE_RESOURCE = "/templates/ctrl-example.scala.tmpl";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_]+)}");

    private static final int INSTRUCTIONS_PER_LINE = 5;

    private final GeneratorConfig config;
    private final CodeFormatter formatter;
    private final Map<ArtifactKind, String> builtInTemplates = new EnumMap<>(ArtifactKind.class);

    public TemplateEngine(GeneratorConfig config) {
        this(config, new CodeFormatter());
    }

    public TemplateEngine(GeneratorConfig config, CodeFormatter formatter) {
        this.config = Objects.requireNonNull(config, "config");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    /**
     * Renders one artifact using the configured template, or the built-in one when none is set.
     */
    public String render(ArtifactKind kind, ControlSignal signal) {
        String code = substitute(resolveTemplate(kind), placeholderValues(kind, signal));
        if (config.isAutoFormat()) {
            code = formatter.format(code);
        }
        log.debug("Rendered {} artifact for {} ({} chars)", kind, signal.getName(), code.length());
        return code;
    }

    public Map<ArtifactKind, String> renderAll(ControlSignal signal) {
        Map<ArtifactKind, String> rendered = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            rendered.put(kind, render(kind, signal));
        }
        return rendered;
    }

    /**
     * Single-pass substitution of {@code {key}} tokens. Unknown keys are left as they are.
     */
    public static String substitute(String template, Map<String, String> replacements) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 256);
        while (matcher.find()) {
            String replacement = replacements.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(
                    replacement != null ? replacement : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    Map<String, String> placeholderValues(ArtifactKind kind, ControlSignal signal) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(SIGNAL_NAME, signal.getName());
        values.put(ENCODING_TYPE, signal.getEncodingType().getLabel());
        values.put(SIGNAL_WIDTH, Integer.toString(signal.getWidth()));
        values.put(GENERATION_TIME, SignalIdGenerator.CREATED_AT_FORMAT.format(LocalDateTime.now(config.getClock())));
        values.put(VALUES_LIST, valuesList(signal));
        values.put(METHODS_LIST, methodsList(signal));
        if (kind == ArtifactKind.FIELD) {
            values.put(VALUE_MAPPINGS, valueMappings(signal));
        }
        return values;
    }

    static String valuesList(ControlSignal signal) {
        StringBuilder sb = new StringBuilder();
        for (String valueName : signal.getValues().keySet()) {
            sb.append("  val ").append(valueName).append(" = Value\n");
        }
        return sb.toString();
    }

    static String methodsList(ControlSignal signal) {
        StringBuilder sb = new StringBuilder();
        signal.getValues().forEach((valueName, instructions) -> {
            if (instructions.isEmpty()) {
                sb.append("  def is").append(valueName).append(": Seq[String] = Seq.empty[String]\n\n");
                return;
            }
            sb.append("  def is").append(valueName).append(": Seq[String] = Seq(\n");
            sb.append(instructionLines(instructions)).append('\n');
            sb.append("  )\n\n");
        });
        return sb.toString();
    }

    /**
     * Quoted instruction names, five per line, lines joined with ",\n".
     */
    private static String instructionLines(List<String> instructions) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < instructions.size(); i += INSTRUCTIONS_PER_LINE) {
            List<String> chunk = instructions.subList(i, Math.min(i + INSTRUCTIONS_PER_LINE, instructions.size()));
            lines.add("    " + chunk.stream().map(name -> "\"" + name + "\"").collect(Collectors.joining(", ")));
        }
        return String.join(",\n", lines);
    }

    static String valueMappings(ControlSignal signal) {
        String name = signal.getName();
        return signal.getValues().keySet().stream()
                .map(valueName -> "    " + name + ".is" + valueName
                        + " -> " + name + ".Values(" + name + "." + valueName + ")")
                .collect(Collectors.joining(",\n"));
    }

    String resolveTemplate(ArtifactKind kind) {
        String custom = config.getTemplate(kind);
        if (custom != null && !custom.isBlank()) {
            return custom;
        }
        return builtInTemplates.computeIfAbsent(kind, k -> loadBuiltInTemplate(k.getDefaultTemplateResource()));
    }

    /**
     * Reads a template bundled on the classpath.
     */
    public static String loadBuiltInTemplate(String resource) {
        try (InputStream in = TemplateEngine.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Built-in template not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read built-in template " + resource, e);
        }
    }
}
