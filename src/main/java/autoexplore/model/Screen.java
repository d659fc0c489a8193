package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A deduplicated UI state of the target application.
 *
 * <p>The id is fixed at creation from {@code (packageName, activity)} and never
 * changes during a run. On revisit the engine bumps {@link #getVisitCount()}
 * and merges any elements it had not seen before via {@link #mergeFrom(Screen)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Screen {

    @JsonProperty("screenId")
    private String screenId;

    @JsonProperty("packageName")
    private String packageName;

    @JsonProperty("activity")
    private String activity;

    @JsonProperty("clickableElements")
    private List<ClickableElement> clickableElements = new ArrayList<>();

    @JsonProperty("scrollableContainers")
    private List<ScrollableContainer> scrollableContainers = new ArrayList<>();

    @JsonProperty("textElements")
    private List<TextElement> textElements = new ArrayList<>();

    @JsonProperty("inputFields")
    private List<InputField> inputFields = new ArrayList<>();

    @JsonProperty("visitCount")
    private int visitCount = 1;

    @JsonProperty("firstSeen")
    private Instant firstSeen;

    @JsonIgnore
    private List<String> stateSignature;

    public Screen() {}

    public Screen(String packageName, String activity) {
        this.screenId    = ScreenIdentity.screenId(packageName, activity);
        this.packageName = packageName;
        this.activity    = activity;
        this.firstSeen   = Instant.now();
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String                    getScreenId()             { return screenId; }
    public String                    getPackageName()          { return packageName; }
    public String                    getActivity()             { return activity == null ? "" : activity; }
    public List<ClickableElement>    getClickableElements()    { return clickableElements; }
    public List<ScrollableContainer> getScrollableContainers() { return scrollableContainers; }
    public List<TextElement>         getTextElements()         { return textElements; }
    public List<InputField>          getInputFields()          { return inputFields; }
    public int                       getVisitCount()           { return visitCount; }
    public Instant                   getFirstSeen()            { return firstSeen; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setScreenId(String id)                          { this.screenId = id; }
    public void setPackageName(String pkg)                      { this.packageName = pkg; }
    public void setActivity(String activity)                    { this.activity = activity; }
    public void setClickableElements(List<ClickableElement> l)  { this.clickableElements = l; }
    public void setScrollableContainers(List<ScrollableContainer> l) { this.scrollableContainers = l; }
    public void setTextElements(List<TextElement> l)            { this.textElements = l; }
    public void setInputFields(List<InputField> l)              { this.inputFields = l; }
    public void setVisitCount(int count)                        { this.visitCount = count; }
    public void setFirstSeen(Instant t)                         { this.firstSeen = t; }

    // ── Fluent builders used by screen providers ─────────────────────────

    public Screen addClickable(ClickableElement element) {
        clickableElements.add(element);
        return this;
    }

    public Screen addScrollable(ScrollableContainer container) {
        scrollableContainers.add(container);
        return this;
    }

    public Screen addText(TextElement element) {
        textElements.add(element);
        return this;
    }

    public Screen addInput(InputField field) {
        inputFields.add(field);
        return this;
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public Optional<ClickableElement> findElement(String elementId) {
        return clickableElements.stream()
                .filter(e -> e.getElementId().equals(elementId))
                .findFirst();
    }

    public Optional<ScrollableContainer> findContainer(String elementId) {
        return scrollableContainers.stream()
                .filter(c -> c.getElementId().equals(elementId))
                .findFirst();
    }

    /** Element ids of all clickable elements, in capture order. */
    @JsonIgnore
    public List<String> getClickableIds() {
        List<String> ids = new ArrayList<>(clickableElements.size());
        for (ClickableElement e : clickableElements) ids.add(e.getElementId());
        return ids;
    }

    public int incrementVisit() {
        return ++visitCount;
    }

    /**
     * Element ids that define this screen's learning state: the sorted ids of
     * the first capture. Elements merged in later do not change it.
     */
    @JsonIgnore
    public List<String> getStateSignature() {
        if (stateSignature != null) return stateSignature;
        List<String> ids = getClickableIds();
        Collections.sort(ids);
        return ids;
    }

    /**
     * Adds elements and containers from a fresh capture of the same screen
     * that are not yet known. Existing entries keep their flags but take the
     * fresh bounds, since layouts shift between visits.
     *
     * @return the ids of newly added clickable elements
     */
    public List<String> mergeFrom(Screen fresh) {
        if (stateSignature == null) {
            stateSignature = Collections.unmodifiableList(getStateSignature());
        }
        List<String> added = new ArrayList<>();
        for (ClickableElement e : fresh.getClickableElements()) {
            Optional<ClickableElement> known = findElement(e.getElementId());
            if (known.isPresent()) {
                if (e.getBounds() != null) known.get().setBounds(e.getBounds());
            } else {
                clickableElements.add(e);
                added.add(e.getElementId());
            }
        }
        for (ScrollableContainer c : fresh.getScrollableContainers()) {
            Optional<ScrollableContainer> known = findContainer(c.getElementId());
            if (known.isPresent()) {
                if (c.getBounds() != null) known.get().setBounds(c.getBounds());
            } else {
                scrollableContainers.add(c);
            }
        }
        return added;
    }

    @Override
    public String toString() {
        return String.format("Screen{id='%s', activity='%s', clickables=%d, scrollables=%d, visits=%d}",
                screenId, activity, clickableElements.size(), scrollableContainers.size(), visitCount);
    }
}
