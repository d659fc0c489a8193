package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A problem observed during exploration. Issues are collected on the run
 * state instead of being thrown, so the full history survives whatever ends
 * the run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplorationIssue {

    @JsonProperty("screenId")
    private String screenId;

    @JsonProperty("elementId")
    private String elementId;

    @JsonProperty("type")
    private IssueType type;

    @JsonProperty("description")
    private String description;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("elementText")
    private String elementText;

    @JsonProperty("elementResourceId")
    private String elementResourceId;

    @JsonProperty("elementBounds")
    private ElementBounds elementBounds;

    public ExplorationIssue() {}

    public ExplorationIssue(String screenId, String elementId, IssueType type,
                            String description, Instant timestamp) {
        this.screenId    = screenId;
        this.elementId   = elementId;
        this.type        = type;
        this.description = description;
        this.timestamp   = timestamp;
    }

    /** Copies the identifying details of {@code element} onto this issue. */
    public ExplorationIssue withElement(ClickableElement element) {
        if (element != null) {
            this.elementText       = element.getText();
            this.elementResourceId = element.getResourceId();
            this.elementBounds     = element.getBounds();
        }
        return this;
    }

    public String        getScreenId()          { return screenId; }
    public String        getElementId()         { return elementId; }
    public IssueType     getType()              { return type; }
    public String        getDescription()       { return description; }
    public Instant       getTimestamp()         { return timestamp; }
    public String        getElementText()       { return elementText; }
    public String        getElementResourceId() { return elementResourceId; }
    public ElementBounds getElementBounds()     { return elementBounds; }

    public void setScreenId(String screenId)              { this.screenId = screenId; }
    public void setElementId(String elementId)            { this.elementId = elementId; }
    public void setType(IssueType type)                   { this.type = type; }
    public void setDescription(String description)        { this.description = description; }
    public void setTimestamp(Instant timestamp)           { this.timestamp = timestamp; }
    public void setElementText(String text)               { this.elementText = text; }
    public void setElementResourceId(String resourceId)   { this.elementResourceId = resourceId; }
    public void setElementBounds(ElementBounds bounds)    { this.elementBounds = bounds; }

    @Override
    public String toString() {
        return String.format("ExplorationIssue{%s screen=%s element=%s: %s}",
                type, screenId, elementId, description);
    }
}
