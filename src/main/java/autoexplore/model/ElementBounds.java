package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Pixel rectangle of a widget on the device screen, as reported by the
 * screen provider at capture time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementBounds {

    @JsonProperty("x")
    private int x;

    @JsonProperty("y")
    private int y;

    @JsonProperty("width")
    private int width;

    @JsonProperty("height")
    private int height;

    public ElementBounds() {}

    public ElementBounds(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX()      { return x; }
    public int getY()      { return y; }
    public int getWidth()  { return width; }
    public int getHeight() { return height; }

    @JsonIgnore public int getCenterX() { return x + width / 2; }
    @JsonIgnore public int getCenterY() { return y + height / 2; }
    @JsonIgnore public int getRight()   { return x + width; }
    @JsonIgnore public int getBottom()  { return y + height; }

    /** True when the rectangle has a positive area. */
    @JsonIgnore
    public boolean hasArea() {
        return width > 0 && height > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementBounds)) return false;
        ElementBounds that = (ElementBounds) o;
        return x == that.x && y == that.y && width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("ElementBounds{x=%d, y=%d, w=%d, h=%d}", x, y, width, height);
    }
}
