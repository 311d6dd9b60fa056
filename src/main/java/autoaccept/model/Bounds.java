package autoaccept.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Screen rectangle of a UI node, in absolute pixels
 * ({@code left}/{@code top} inclusive, {@code right}/{@code bottom} exclusive).
 */
public final class Bounds {

    private final int left;
    private final int top;
    private final int right;
    private final int bottom;

    @JsonCreator
    public Bounds(@JsonProperty("left") int left,
                  @JsonProperty("top") int top,
                  @JsonProperty("right") int right,
                  @JsonProperty("bottom") int bottom) {
        this.left   = left;
        this.top    = top;
        this.right  = right;
        this.bottom = bottom;
    }

    @JsonProperty("left")   public int getLeft()   { return left; }
    @JsonProperty("top")    public int getTop()    { return top; }
    @JsonProperty("right")  public int getRight()  { return right; }
    @JsonProperty("bottom") public int getBottom() { return bottom; }

    public int width()  { return right - left; }
    public int height() { return bottom - top; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bounds b)) return false;
        return left == b.left && top == b.top && right == b.right && bottom == b.bottom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    @Override
    public String toString() {
        return String.format("[%d,%d][%d,%d]", left, top, right, bottom);
    }
}
