package treeqa.codegen;

import java.util.Locale;

/** Test framework a rendered scenario targets; selects the class template. */
public enum TestFramework {

    TESTNG("/templates/testng.template", """
            package {Package};

            import org.testng.annotations.Test;
            import treeqa.player.UiPlayer;

            class {ClassName} extends {BaseClass} {

                @Test
                public void {TestMethod}() {
                    UiPlayer ui = ui();

            {Steps}
                }
            }
            """),

    JUNIT5("/templates/junit5.template", """
            package {Package};

            import org.junit.jupiter.api.Test;
            import treeqa.player.UiPlayer;

            class {ClassName} extends {BaseClass} {

                @Test
                void {TestMethod}() {
                    UiPlayer ui = ui();

            {Steps}
                }
            }
            """);

    private final String templateResource;
    private final String builtInTemplate;

    TestFramework(String templateResource, String builtInTemplate) {
        this.templateResource = templateResource;
        this.builtInTemplate = builtInTemplate;
    }

    public String templateResource() {
        return templateResource;
    }

    /** Used when {@link #templateResource()} is missing from the classpath. */
    public String builtInTemplate() {
        return builtInTemplate;
    }

    /**
     * Parses a config value such as {@code testng} or {@code junit5}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static TestFramework fromName(String name) {
        String n = name.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (TestFramework f : values()) {
            if (f.name().replace("_", "").equals(n)) return f;
        }
        if ("JUNIT".equals(n) || "JUPITER".equals(n)) return JUNIT5;
        throw new IllegalArgumentException("Unknown test framework: " + name);
    }
}
