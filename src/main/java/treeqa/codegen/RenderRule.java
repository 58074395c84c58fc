package treeqa.codegen;

import treeqa.model.Step;
import treeqa.model.StepKind;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the renderer's dispatch table: the first rule whose predicate
 * accepts a step formats it as a single statement (without indentation or
 * trailing warning comment).
 */
public record RenderRule(String name, Predicate<Step> matches, Function<Step, String> format) {

    public static RenderRule forKind(StepKind kind, Function<Step, String> format) {
        return new RenderRule(kind.name(), s -> s.kind() == kind, format);
    }
}
