package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An interactive widget on a {@link Screen}.
 *
 * <p>The {@code elementId} is only unique within its owning screen; use
 * {@link ScreenIdentity#compositeKey(String, String)} whenever an element must
 * be tracked across the whole run.
 *
 * <p>Identity fields are fixed at capture time. {@code explored},
 * {@code leadsToScreen} and {@code actionType} are updated by the engine as
 * outcomes are observed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClickableElement {

    @JsonProperty("elementId")
    private String elementId;

    @JsonProperty("resourceId")
    private String resourceId;

    @JsonProperty("text")
    private String text;

    @JsonProperty("contentDescription")
    private String contentDescription;

    @JsonProperty("className")
    private String className;

    @JsonProperty("bounds")
    private ElementBounds bounds;

    @JsonProperty("explored")
    private boolean explored;

    @JsonProperty("leadsToScreen")
    private String leadsToScreen;

    @JsonProperty("actionType")
    private ClickableActionType actionType = ClickableActionType.UNKNOWN;

    public ClickableElement() {}

    /**
     * Creates an element and derives its id from the identity fields via
     * {@link ScreenIdentity#elementId}.
     */
    public ClickableElement(String resourceId, String text, String contentDescription,
                            String className, ElementBounds bounds) {
        this(ScreenIdentity.elementId(resourceId, text, className, bounds),
                resourceId, text, contentDescription, className, bounds);
    }

    public ClickableElement(String elementId, String resourceId, String text, String contentDescription,
                            String className, ElementBounds bounds) {
        this.elementId          = elementId;
        this.resourceId         = resourceId;
        this.text               = text;
        this.contentDescription = contentDescription;
        this.className          = className;
        this.bounds             = bounds;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String              getElementId()          { return elementId; }
    public String              getResourceId()         { return resourceId; }
    public String              getText()               { return text; }
    public String              getContentDescription() { return contentDescription; }
    public String              getClassName()          { return className == null ? "" : className; }
    public ElementBounds       getBounds()             { return bounds; }
    public boolean             isExplored()            { return explored; }
    public String              getLeadsToScreen()      { return leadsToScreen; }
    public ClickableActionType getActionType()         { return actionType; }

    @JsonIgnore public int getCenterX() { return bounds == null ? 0 : bounds.getCenterX(); }
    @JsonIgnore public int getCenterY() { return bounds == null ? 0 : bounds.getCenterY(); }

    /** Class name without its package, e.g. {@code Button} for {@code android.widget.Button}. */
    @JsonIgnore
    public String getSimpleClassName() {
        String cls = getClassName();
        int dot = cls.lastIndexOf('.');
        return dot >= 0 ? cls.substring(dot + 1) : cls;
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    @JsonIgnore
    public boolean hasResourceId() {
        return resourceId != null && !resourceId.isEmpty();
    }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setElementId(String id)                 { this.elementId = id; }
    public void setResourceId(String resourceId)        { this.resourceId = resourceId; }
    public void setText(String text)                    { this.text = text; }
    public void setContentDescription(String desc)      { this.contentDescription = desc; }
    public void setClassName(String className)          { this.className = className; }
    public void setBounds(ElementBounds bounds)         { this.bounds = bounds; }
    public void setExplored(boolean explored)           { this.explored = explored; }
    public void setLeadsToScreen(String screenId)       { this.leadsToScreen = screenId; }
    public void setActionType(ClickableActionType type) { this.actionType = type; }

    @Override
    public String toString() {
        return String.format("ClickableElement{id='%s', text='%s', class='%s', %s}",
                elementId, text, getSimpleClassName(), bounds);
    }
}
