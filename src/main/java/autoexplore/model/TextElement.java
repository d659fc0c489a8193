package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Non-interactive text on a screen. Used by the screen classifiers
 * (login, meta pages) rather than as an exploration target.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextElement {

    @JsonProperty("elementId")
    private String elementId;

    @JsonProperty("resourceId")
    private String resourceId;

    @JsonProperty("text")
    private String text;

    @JsonProperty("className")
    private String className;

    @JsonProperty("bounds")
    private ElementBounds bounds;

    public TextElement() {}

    public TextElement(String resourceId, String text, String className, ElementBounds bounds) {
        this.elementId  = ScreenIdentity.elementId(resourceId, text, className, bounds);
        this.resourceId = resourceId;
        this.text       = text;
        this.className  = className;
        this.bounds     = bounds;
    }

    public String        getElementId()  { return elementId; }
    public String        getResourceId() { return resourceId; }
    public String        getText()       { return text == null ? "" : text; }
    public String        getClassName()  { return className; }
    public ElementBounds getBounds()     { return bounds; }

    public void setElementId(String id)          { this.elementId = id; }
    public void setResourceId(String resourceId) { this.resourceId = resourceId; }
    public void setText(String text)             { this.text = text; }
    public void setClassName(String className)   { this.className = className; }
    public void setBounds(ElementBounds bounds)  { this.bounds = bounds; }
}
