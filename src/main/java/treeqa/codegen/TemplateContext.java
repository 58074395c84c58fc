package treeqa.codegen;

import java.util.Objects;

/**
 * Values substituted into a class template around the rendered steps.
 *
 * @param packageName {@code {Package}}
 * @param className   {@code {ClassName}}
 * @param methodName  {@code {TestMethod}}
 * @param baseClass   {@code {BaseClass}}, a fully qualified class name
 * @param framework   selects the template
 */
public record TemplateContext(String packageName, String className, String methodName,
                              String baseClass, TestFramework framework) {

    public TemplateContext {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(baseClass, "baseClass");
        Objects.requireNonNull(framework, "framework");
    }

    /**
     * Context for a recorded scenario: class {@code Recorded_<scenario>_Test},
     * method {@code scenario_<scenario>[_<timestamp>]}.
     *
     * @param timestamp formatted recording time, or {@code null} to leave it out of the method name
     */
    public static TemplateContext forScenario(String packageName, String scenario, String timestamp,
                                              String baseClass, TestFramework framework) {
        String id = toIdentifier(scenario);
        String method = "scenario_" + id + (timestamp != null ? "_" + toIdentifier(timestamp) : "");
        return new TemplateContext(packageName, "Recorded_" + id + "_Test", method, baseClass, framework);
    }

    /** Replaces every character that cannot appear in a Java identifier with {@code _}. */
    public static String toIdentifier(String raw) {
        if (raw == null || raw.isBlank()) return "_";
        StringBuilder sb = new StringBuilder(raw.length() + 1);
        String s = raw.trim();
        if (!Character.isJavaIdentifierStart(s.charAt(0))) sb.append('_');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append(Character.isJavaIdentifierPart(c) ? c : '_');
        }
        return sb.toString();
    }
}
