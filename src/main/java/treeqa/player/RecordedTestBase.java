package treeqa.player;

import treeqa.model.TreeAccess;

/**
 * Default base class of generated tests. Subclasses bind the tree under test
 * and the input driver; generated methods call {@link #ui()}.
 */
public abstract class RecordedTestBase {

    /** Tree of the application window under test. */
    protected abstract TreeAccess tree();

    protected abstract InteractionDriver driver();

    protected PlayerConfig playerConfig() {
        return new PlayerConfig();
    }

    protected UiPlayer ui() {
        return new UiPlayer(tree(), driver(), playerConfig());
    }
}
