package treeqa.recorder.assertion;

import treeqa.model.StepKind;

/** What an extractor read from a control: the assertion kind and the expected value. */
public record AssertionValue(StepKind kind, String value) {

    public AssertionValue {
        if (!kind.isAssertion()) {
            throw new IllegalArgumentException("Not an assertion kind: " + kind);
        }
    }
}
