package treeqa.snapshot;

import org.testng.annotations.Test;
import treeqa.TestTrees;
import treeqa.model.StructuralPath;
import treeqa.model.TreeNode;
import treeqa.model.TreeTraversal;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TreeSnapshotIOTest {

    @Test(description = "Fixture loads with parent links restored")
    public void readResourceLinksParents() throws IOException {
        SnapshotNode root = TreeSnapshotIO.readResource("/trees/login.json");

        assertThat(root.isRootBoundary()).isTrue();
        TreeNode help = root.snapshotChildren().get(0).snapshotChildren().get(4).snapshotChildren().get(2);
        assertThat(help.property("content")).isEqualTo("Help");
        assertThat(StructuralPath.of(help)).isEqualTo("StackPanel[0]/StackPanel[0]/Button[2]");
        assertThat(help.bounds()).isNotNull();
        assertThat(help.bounds().width()).isEqualTo(100.0);
    }

    @Test(description = "Absent id and name read as empty strings")
    public void missingIdentityIsEmpty() throws IOException {
        SnapshotNode root = TreeSnapshotIO.fromJson("{\"type\":\"Window\",\"children\":[{\"type\":\"Button\"}]}");
        TreeNode button = root.orderedChildren().get(0);

        assertThat(button.stableId()).isEmpty();
        assertThat(button.displayName()).isEmpty();
        assertThat(button.hasStableId()).isFalse();
        assertThat(button.boundsKnown()).isFalse();
        assertThat(button.parent()).containsSame(root);
    }

    @Test(description = "Snapshots failing schema validation are rejected")
    public void invalidSnapshotRejected() {
        assertThatThrownBy(() -> TreeSnapshotIO.readResource("/trees/invalid.json"))
                .isInstanceOf(TreeSnapshotIO.SnapshotValidationException.class)
                .hasMessageContaining("Schema validation failed");
    }

    @Test
    public void missingResource() {
        assertThatThrownBy(() -> TreeSnapshotIO.readResource("/trees/nope.json"))
                .isInstanceOf(IOException.class);
    }

    @Test(description = "A captured tree written to disk reads back with the same structure")
    public void captureWriteRead() throws IOException {
        TestTrees.Login t = TestTrees.login();
        SnapshotNode copy = TreeSnapshotIO.capture(t.window);
        Path tmp = Files.createTempFile("treeqa-snapshot-", ".json");
        try {
            TreeSnapshotIO.write(copy, tmp);
            SnapshotNode loaded = TreeSnapshotIO.read(tmp);

            assertThat(TreeTraversal.stableIds(loaded)).isEqualTo(TreeTraversal.stableIds(t.window));
            assertThat(TreeTraversal.preOrder(loaded)).hasSameSizeAs(TreeTraversal.preOrder(t.window));
            assertThat(Files.readString(tmp)).doesNotContain("parent");
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Test
    public void removeChildDetaches() {
        TestTrees.Login t = TestTrees.login();
        assertThat(t.buttons.removeChild(t.help)).isTrue();
        assertThat(t.help.parent()).isEmpty();
        assertThat(t.buttons.orderedChildren()).doesNotContain(t.help);
    }
}
