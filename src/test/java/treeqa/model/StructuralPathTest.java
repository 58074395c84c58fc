package treeqa.model;

import org.testng.annotations.Test;
import treeqa.TestTrees;
import treeqa.snapshot.SnapshotNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StructuralPathTest {

    @Test(description = "Index counts only siblings sharing the type tag")
    public void sameTypeIndex() {
        TestTrees.Login t = TestTrees.login();

        assertThat(StructuralPath.of(t.help)).isEqualTo("StackPanel[0]/StackPanel[0]/Button[2]");
        assertThat(StructuralPath.of(t.status)).isEqualTo("StackPanel[0]/TextBlock[1]");
        assertThat(StructuralPath.of(t.rememberMe)).isEqualTo("StackPanel[0]/CheckBox[0]");
    }

    @Test(description = "The root boundary is never part of a path")
    public void rootExcluded() {
        TestTrees.Login t = TestTrees.login();
        assertThat(StructuralPath.of(t.window)).isEmpty();
        assertThat(StructuralPath.of(t.panel)).isEqualTo("StackPanel[0]");
    }

    @Test(description = "Unrelated sibling churn does not change a same-type index")
    public void resilientToOtherTypes() {
        TestTrees.Login t = TestTrees.login();
        String before = StructuralPath.of(t.cancel);
        t.buttons.child(new SnapshotNode("Separator"));

        assertThat(StructuralPath.of(t.cancel)).isEqualTo(before);
    }

    @Test
    public void parseSegments() {
        assertThat(StructuralPath.parse("Panel[0]/Button[12]"))
                .containsExactly(new StructuralPath.Segment("Panel", 0), new StructuralPath.Segment("Button", 12));
    }

    @Test(description = "Type tags may hold any character except separators and brackets")
    public void parseNonIdentifierTags() {
        assertThat(StructuralPath.parse("ItemsRepeater`1[0]/ui:Button[2]/Push Button[1]"))
                .containsExactly(new StructuralPath.Segment("ItemsRepeater`1", 0),
                        new StructuralPath.Segment("ui:Button", 2),
                        new StructuralPath.Segment("Push Button", 1));
        assertThatThrownBy(() -> StructuralPath.parse("Grid[0]]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test(description = "Malformed paths are rejected with a descriptive message")
    public void parseRejectsMalformed() {
        assertThatThrownBy(() -> StructuralPath.parse("Panel[0]/Button[x]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Button[x]");
        assertThatThrownBy(() -> StructuralPath.parse("Panel[0]//Button[1]"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StructuralPath.parse("Button[99999999999]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void looksLikePath() {
        assertThat(StructuralPath.looksLikePath("LoginButton")).isFalse();
        assertThat(StructuralPath.looksLikePath("Button[0]")).isTrue();
        assertThat(StructuralPath.looksLikePath("a/b")).isTrue();
    }
}
