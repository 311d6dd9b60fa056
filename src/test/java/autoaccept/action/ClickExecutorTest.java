package autoaccept.action;

import autoaccept.platform.FakeTree;
import autoaccept.platform.NodeAction;
import autoaccept.platform.Snapshot;
import autoaccept.platform.UiNode;

import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ClickExecutor} using Mockito node mocks.
 */
public class ClickExecutorTest {

    @Mock private UiNode root;
    @Mock private UiNode node;
    @Mock private UiNode parent;

    private AutoCloseable mocks;
    private Snapshot snapshot;
    private ClickExecutor clicker;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        snapshot = FakeTree.snapshotOf(root);
        clicker = new ClickExecutor(0, 0);
        when(node.className()).thenReturn("android.widget.Button");
    }

    @AfterMethod
    public void tearDown() throws Exception {
        snapshot.close();
        mocks.close();
    }

    // ── Basic path ───────────────────────────────────────────────────────

    @Test
    public void plainClickIsEnough() {
        when(node.performAction(NodeAction.CLICK)).thenReturn(true);

        assertThat(clicker.click(snapshot, node, false)).isTrue();
        verify(node, never()).performAction(NodeAction.ACCESSIBILITY_FOCUS);
    }

    @Test(description = "A refused click is retried once after accessibility focus")
    public void retriesAfterAccessibilityFocus() {
        when(node.performAction(NodeAction.CLICK)).thenReturn(false, true);
        when(node.performAction(NodeAction.ACCESSIBILITY_FOCUS)).thenReturn(true);

        assertThat(clicker.click(snapshot, node, false)).isTrue();

        InOrder order = inOrder(node);
        order.verify(node).performAction(NodeAction.CLICK);
        order.verify(node).performAction(NodeAction.ACCESSIBILITY_FOCUS);
        order.verify(node).performAction(NodeAction.CLICK);
    }

    @Test(description = "Without escalation nothing beyond focus-and-click is tried")
    public void noEscalationForPlainTargets() {
        assertThat(clicker.click(snapshot, node, false)).isFalse();

        verify(node, never()).performAction(NodeAction.LONG_CLICK);
        verify(node, never()).performAction(NodeAction.FOCUS);
        verify(node, never()).parent();
    }

    // ── Escalated path ───────────────────────────────────────────────────

    @Test
    public void escalatesToLongClick() {
        when(node.performAction(NodeAction.LONG_CLICK)).thenReturn(true);

        assertThat(clicker.click(snapshot, node, true)).isTrue();
        verify(node, never()).parent();
    }

    @Test
    public void escalatesToInputFocusThenClick() {
        when(node.performAction(NodeAction.FOCUS)).thenReturn(true);
        when(node.performAction(NodeAction.CLICK)).thenReturn(false, true);

        assertThat(clicker.click(snapshot, node, true)).isTrue();
        verify(node, times(2)).performAction(NodeAction.CLICK);
        verify(node).performAction(NodeAction.LONG_CLICK);
    }

    @Test(description = "Delegates to a clickable parent and releases the parent handle")
    public void delegatesToClickableParent() {
        when(node.parent()).thenReturn(parent);
        when(parent.isClickable()).thenReturn(true);
        when(parent.performAction(NodeAction.CLICK)).thenReturn(true);

        assertThat(clicker.click(snapshot, node, true)).isTrue();

        verify(parent).performAction(NodeAction.CLICK);
        verify(parent).release();
        verify(parent, never()).performAction(NodeAction.LONG_CLICK);
    }

    @Test
    public void doesNotClickNonClickableParent() {
        when(node.parent()).thenReturn(parent);

        assertThat(clicker.click(snapshot, node, true)).isFalse();

        verify(parent, never()).performAction(any());
        verify(parent).release();
    }

    // ── Faults ────────────────────────────────────────────────────────────

    @Test(description = "Platform faults are reported as a failed click")
    public void platformFaultIsAbsorbed() {
        when(node.performAction(NodeAction.CLICK)).thenThrow(new IllegalStateException("node recycled"));

        assertThat(clicker.click(snapshot, node, true)).isFalse();
    }

    @Test
    public void nullNodeIsNotClicked() {
        assertThat(clicker.click(snapshot, null, true)).isFalse();
    }
}
