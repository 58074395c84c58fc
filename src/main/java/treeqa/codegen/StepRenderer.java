package treeqa.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.Step;
import treeqa.model.StepKind;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static treeqa.codegen.RenderRule.forKind;

/**
 * Turns recorded steps into Java source calling the {@code UiPlayer} DSL.
 *
 * <p>Each step goes through an ordered rule table keyed by {@link StepKind};
 * kinds without a rule become a comment placeholder. A step's warning is
 * appended as a trailing {@code // } comment. The output depends only on the
 * steps and the {@link TemplateContext}.
 */
public class StepRenderer {

    private static final Logger log = LoggerFactory.getLogger(StepRenderer.class);

    static final String INDENT = "        ";

    private final List<RenderRule> rules;
    private final Map<TestFramework, String> templates = new EnumMap<>(TestFramework.class);

    public StepRenderer() {
        this(defaultRules());
    }

    /** Package-private: lets tests run with a reduced or custom rule table. */
    StepRenderer(List<RenderRule> rules) {
        this.rules = List.copyOf(rules);
    }

    // ── Rendering ─────────────────────────────────────────────────────────

    /** Renders a complete test class. */
    public String render(List<Step> steps, TemplateContext ctx) {
        String body = renderSteps(steps);
        String text = template(ctx.framework())
                .replace("{Package}", ctx.packageName())
                .replace("{ClassName}", ctx.className())
                .replace("{BaseClass}", ctx.baseClass())
                .replace("{TestMethod}", ctx.methodName())
                .replace("{Steps}", body);
        log.debug("Rendered {} steps into {}.{}", steps.size(), ctx.packageName(), ctx.className());
        return text;
    }

    /** Renders the statements only, one per line, indented for a method body. */
    public String renderSteps(List<Step> steps) {
        List<String> lines = new ArrayList<>(steps.size());
        for (Step step : steps) {
            lines.add(INDENT + renderStep(step));
        }
        return String.join("\n", lines);
    }

    String renderStep(Step step) {
        String statement = null;
        for (RenderRule rule : rules) {
            if (rule.matches().test(step)) {
                statement = rule.format().apply(step);
                break;
            }
        }
        if (statement == null) {
            statement = "// Unsupported step: " + step.kind();
        }
        if (step.hasWarning()) {
            statement += " // " + singleLine(step.warning());
        }
        return statement;
    }

    // ── Rule table ────────────────────────────────────────────────────────

    static List<RenderRule> defaultRules() {
        return List.of(
                forKind(StepKind.CLICK,          s -> call("click", s)),
                forKind(StepKind.RIGHT_CLICK,    s -> call("rightClick", s)),
                forKind(StepKind.DOUBLE_CLICK,   s -> call("doubleClick", s)),
                forKind(StepKind.HOVER,          s -> call("hover", s)),
                forKind(StepKind.TYPE_TEXT,      s -> call("typeText", s, literal(s.parameter()))),
                forKind(StepKind.KEY_PRESS,      s -> "ui.keyPress(" + literal(s.parameter()) + ");"),
                forKind(StepKind.SCROLL,         StepRenderer::scroll),
                forKind(StepKind.SELECT_ITEM,    s -> call("selectItem", s, literal(s.parameter()))),
                forKind(StepKind.ASSERT_TEXT,    s -> call("assertText", s, literal(s.parameter()))),
                forKind(StepKind.ASSERT_CHECKED, s -> call("assertChecked", s,
                        String.valueOf(Boolean.parseBoolean(s.parameter())))),
                forKind(StepKind.ASSERT_VISIBLE, s -> call("assertVisible", s)),
                forKind(StepKind.ASSERT_ENABLED, s -> call("assertEnabled", s)));
    }

    private static String call(String method, Step step, String... extraArgs) {
        StringBuilder sb = new StringBuilder("ui.").append(method).append('(')
                .append(literal(step.locator().value()));
        for (String arg : extraArgs) sb.append(", ").append(arg);
        return sb.append(");").toString();
    }

    private static String scroll(Step step) {
        String delta = step.parameter() == null ? "" : step.parameter();
        String[] parts = delta.split(",");
        if (parts.length != 2) {
            return "// Unsupported step: SCROLL with delta '" + singleLine(delta) + "'";
        }
        try {
            double dx = Double.parseDouble(parts[0].trim());
            double dy = Double.parseDouble(parts[1].trim());
            return call("scroll", step, number(dx), number(dy));
        } catch (NumberFormatException e) {
            return "// Unsupported step: SCROLL with delta '" + singleLine(delta) + "'";
        }
    }

    // ── Java source helpers ───────────────────────────────────────────────

    /** Quotes and escapes a value as a Java string literal; {@code null} becomes {@code ""}. */
    static String literal(String value) {
        return "\"" + escape(value == null ? "" : value) + "\"";
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    /** Formats a delta as a Java double literal without a trailing {@code .0} noise for integers. */
    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%s", value);
    }

    private static String singleLine(String text) {
        return text.replace("\r", " ").replace("\n", " ");
    }

    // ── Templates ─────────────────────────────────────────────────────────

    private synchronized String template(TestFramework framework) {
        return templates.computeIfAbsent(framework, StepRenderer::loadTemplate);
    }

    private static String loadTemplate(TestFramework framework) {
        try (InputStream is = StepRenderer.class.getResourceAsStream(framework.templateResource())) {
            if (is == null) {
                log.warn("Template {} not found on classpath, using built-in template", framework.templateResource());
                return framework.builtInTemplate();
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read template {}, using built-in template: {}",
                    framework.templateResource(), e.getMessage());
            return framework.builtInTemplate();
        }
    }
}
