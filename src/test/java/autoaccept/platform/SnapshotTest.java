package autoaccept.platform;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

import static autoaccept.platform.FakeNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link Snapshot} handle tracking and for {@link NodeAccess}.
 */
public class SnapshotTest {

    private FakeTree tree;

    @BeforeMethod
    public void setUp() {
        tree = new FakeTree(Screens.shareDialog("Share one app"));
    }

    // ── Queries ───────────────────────────────────────────────────────────

    @Test
    public void queryByViewIdFindsNode() {
        try (Snapshot snapshot = tree.open()) {
            List<UiNode> hits = snapshot.query(MatchCriteria.viewId(Screens.SELECTOR_ID));

            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).className()).isEqualTo("android.widget.Spinner");
        }
        assertThat(tree.live()).isZero();
    }

    @Test(description = "first() keeps only the winner; other candidates are released right away")
    public void firstReleasesOtherCandidates() {
        try (Snapshot snapshot = tree.open()) {
            Optional<UiNode> hit = snapshot.first(MatchCriteria.text("share"));

            assertThat(hit).isPresent();
            assertThat(snapshot.liveCount()).as("root + winner").isEqualTo(2);
            assertThat(tree.live()).isEqualTo(2);
        }
        assertThat(tree.live()).isZero();
    }

    @Test
    public void traversalFindsStructuralMatch() {
        try (Snapshot snapshot = tree.open()) {
            List<UiNode> spinners = snapshot.query(MatchCriteria.structure("spinner", true, true));

            assertThat(spinners).hasSize(1);
            assertThat(spinners.get(0).viewId()).isEqualTo(Screens.SELECTOR_ID);
            assertThat(snapshot.liveCount()).isEqualTo(2);
        }
        assertThat(tree.live()).isZero();
        assertThat(tree.staleAccesses()).isZero();
    }

    @Test
    public void existsLeavesNothingBehind() {
        try (Snapshot snapshot = tree.open()) {
            assertThat(snapshot.exists(MatchCriteria.viewId(Screens.CONFIRM_ID))).isTrue();
            assertThat(snapshot.exists(MatchCriteria.viewId("android:id/none"))).isFalse();
            assertThat(snapshot.liveCount()).isEqualTo(1);
        }
    }

    @Test(description = "Display text falls back to the first child with text")
    public void displayTextReadsChildText() {
        try (Snapshot snapshot = tree.open()) {
            UiNode spinner = snapshot.first(MatchCriteria.viewId(Screens.SELECTOR_ID)).orElseThrow();

            assertThat(spinner.text()).isNull();
            assertThat(snapshot.displayText(spinner)).isEqualTo("Share one app");
            assertThat(snapshot.liveCount()).isEqualTo(2);
        }
    }

    // ── Release ───────────────────────────────────────────────────────────

    @Test
    public void releaseIsIdempotent() {
        try (Snapshot snapshot = tree.open()) {
            UiNode hit = snapshot.first(MatchCriteria.viewId(Screens.SELECTOR_ID)).orElseThrow();

            snapshot.release(hit);
            snapshot.release(hit);

            assertThat(snapshot.releasedCount()).isEqualTo(1);
        }
        assertThat(tree.doubleReleases()).isZero();
        assertThat(tree.live()).isZero();
    }

    @Test(description = "The root stays valid until the snapshot is closed")
    public void rootSurvivesExplicitRelease() {
        Snapshot snapshot = tree.open();
        snapshot.release(snapshot.root());

        assertThat(tree.live()).isEqualTo(1);
        assertThat(snapshot.exists(MatchCriteria.viewId(Screens.SELECTOR_ID))).isTrue();

        snapshot.close();
        snapshot.close();

        assertThat(snapshot.isClosed()).isTrue();
        assertThat(tree.live()).isZero();
        assertThat(tree.doubleReleases()).isZero();
    }

    @Test(description = "Release faults from stale handles are absorbed")
    public void releaseFaultIsSwallowed() {
        UiNode root = mock(UiNode.class);
        UiNode stale = mock(UiNode.class);
        when(root.findByViewId("app:id/x")).thenReturn(List.of(stale));
        doThrow(new IllegalStateException("already recycled")).when(stale).release();

        Snapshot snapshot = FakeTree.snapshotOf(root);
        UiNode hit = snapshot.first(MatchCriteria.viewId("app:id/x")).orElseThrow();

        snapshot.release(hit);
        snapshot.close();

        verify(stale).release();
        verify(root).release();
        assertThat(snapshot.releasedCount()).isEqualTo(2);
    }

    @Test
    public void queriesAfterCloseAreRejected() {
        Snapshot snapshot = tree.open();
        snapshot.close();

        assertThatThrownBy(() -> snapshot.query(MatchCriteria.text("Share")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test(description = "A query fault midway still lets close() return every handle")
    public void faultMidTraversalLeaksNothing() {
        FakeTree deep = new FakeTree(node("android.widget.FrameLayout").children(
                node("android.widget.LinearLayout").children(node("android.widget.TextView").text("a")),
                node("android.widget.LinearLayout").children(node("android.widget.TextView").text("b"))));
        Snapshot snapshot = deep.open();
        snapshot.first(MatchCriteria.text("a")).orElseThrow();
        deep.failQueriesWith(new IllegalStateException("window gone"));

        assertThatThrownBy(() -> snapshot.query(MatchCriteria.structure("Button", null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("window gone");

        snapshot.close();
        assertThat(deep.live()).isZero();
    }

    // ── NodeAccess ────────────────────────────────────────────────────────

    @Test(description = "At most one snapshot is live at a time")
    public void nodeAccessAllowsOneLiveSnapshot() {
        NodeAccess access = new NodeAccess(tree);

        Snapshot first = access.acquireSnapshot().orElseThrow();
        assertThat(access.isSnapshotLive()).isTrue();
        assertThatThrownBy(access::acquireSnapshot).isInstanceOf(IllegalStateException.class);

        first.close();
        assertThat(access.isSnapshotLive()).isFalse();
        try (Snapshot second = access.acquireSnapshot().orElseThrow()) {
            assertThat(second.root()).isNotNull();
        }
        assertThat(tree.live()).isZero();
    }

    @Test
    public void nodeAccessReturnsEmptyWithoutWindow() {
        tree.show(null);
        NodeAccess access = new NodeAccess(tree);

        assertThat(access.acquireSnapshot()).isEmpty();
        assertThat(access.isSnapshotLive()).isFalse();
    }

    @Test
    public void nodeAccessResetsAfterPlatformFault() {
        UiPlatform broken = mock(UiPlatform.class);
        when(broken.rootInActiveWindow()).thenThrow(new IllegalStateException("service disconnected"));
        NodeAccess access = new NodeAccess(broken);

        assertThatThrownBy(access::acquireSnapshot).isInstanceOf(IllegalStateException.class)
                .hasMessage("service disconnected");
        assertThat(access.isSnapshotLive()).isFalse();
    }
}
