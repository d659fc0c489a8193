package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Editable field on a screen. Never typed into by the explorer. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InputField {

    @JsonProperty("elementId")
    private String elementId;

    @JsonProperty("resourceId")
    private String resourceId;

    @JsonProperty("hint")
    private String hint;

    @JsonProperty("className")
    private String className;

    @JsonProperty("bounds")
    private ElementBounds bounds;

    @JsonProperty("password")
    private boolean password;

    public InputField() {}

    public InputField(String resourceId, String hint, String className, ElementBounds bounds, boolean password) {
        this.elementId  = ScreenIdentity.elementId(resourceId, hint, className, bounds);
        this.resourceId = resourceId;
        this.hint       = hint;
        this.className  = className;
        this.bounds     = bounds;
        this.password   = password;
    }

    public String        getElementId()  { return elementId; }
    public String        getResourceId() { return resourceId; }
    public String        getHint()       { return hint; }
    public String        getClassName()  { return className; }
    public ElementBounds getBounds()     { return bounds; }
    public boolean       isPassword()    { return password; }

    public void setElementId(String id)          { this.elementId = id; }
    public void setResourceId(String resourceId) { this.resourceId = resourceId; }
    public void setHint(String hint)             { this.hint = hint; }
    public void setClassName(String className)   { this.className = className; }
    public void setBounds(ElementBounds bounds)  { this.bounds = bounds; }
    public void setPassword(boolean password)    { this.password = password; }
}
