package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A scrollable region of a screen (list, pager, scroll view).
 *
 * <p>{@code fullyScrolled} is set once scrolling stops revealing new
 * elements or the per-container scroll cap is reached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrollableContainer {

    @JsonProperty("elementId")
    private String elementId;

    @JsonProperty("resourceId")
    private String resourceId;

    @JsonProperty("className")
    private String className;

    @JsonProperty("bounds")
    private ElementBounds bounds;

    @JsonProperty("direction")
    private ScrollDirection direction = ScrollDirection.VERTICAL;

    @JsonProperty("fullyScrolled")
    private boolean fullyScrolled;

    @JsonProperty("scrollCount")
    private int scrollCount;

    @JsonProperty("discoveredElements")
    private List<String> discoveredElements = new ArrayList<>();

    public ScrollableContainer() {}

    public ScrollableContainer(String resourceId, String className, ElementBounds bounds,
                               ScrollDirection direction) {
        this.elementId  = ScreenIdentity.elementId(resourceId, null, className, bounds);
        this.resourceId = resourceId;
        this.className  = className;
        this.bounds     = bounds;
        this.direction  = direction;
    }

    public String          getElementId()          { return elementId; }
    public String          getResourceId()         { return resourceId; }
    public String          getClassName()          { return className; }
    public ElementBounds   getBounds()             { return bounds; }
    public ScrollDirection getDirection()          { return direction; }
    public boolean         isFullyScrolled()       { return fullyScrolled; }
    public int             getScrollCount()        { return scrollCount; }
    public List<String>    getDiscoveredElements() { return discoveredElements; }

    public void setElementId(String id)               { this.elementId = id; }
    public void setResourceId(String resourceId)      { this.resourceId = resourceId; }
    public void setClassName(String className)        { this.className = className; }
    public void setBounds(ElementBounds bounds)       { this.bounds = bounds; }
    public void setDirection(ScrollDirection dir)     { this.direction = dir; }
    public void setFullyScrolled(boolean scrolled)    { this.fullyScrolled = scrolled; }
    public void setScrollCount(int count)             { this.scrollCount = count; }
    public void setDiscoveredElements(List<String> l) { this.discoveredElements = l; }

    /** Records one scroll gesture against this container and returns the new count. */
    public int incrementScrollCount() {
        return ++scrollCount;
    }

    @Override
    public String toString() {
        return String.format("ScrollableContainer{id='%s', dir=%s, scrolled=%s, discovered=%d}",
                elementId, direction, fullyScrolled, discoveredElements.size());
    }
}
