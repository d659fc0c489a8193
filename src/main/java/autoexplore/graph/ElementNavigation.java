package autoexplore.graph;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Every destination ever observed for one trigger element on one screen.
 *
 * <p>An element that led to two or more different screens is
 * <em>conditional</em> (for example a profile tab that shows a login wall
 * until the user signs in). All destinations are kept with their
 * occurrence counts; a later observation never overwrites an earlier one.
 */
public class ElementNavigation {

    private final String fromScreen;
    private final String elementId;
    private final Map<String, Integer> destinations = new LinkedHashMap<>();
    private final Set<String> blockerDestinations = new LinkedHashSet<>();
    private final Instant firstSeen;
    private int tapCount;

    ElementNavigation(String fromScreen, String elementId, Instant firstSeen) {
        this.fromScreen = fromScreen;
        this.elementId  = elementId;
        this.firstSeen  = firstSeen;
    }

    void addDestination(String toScreen) {
        destinations.merge(toScreen, 1, Integer::sum);
        tapCount++;
    }

    void markBlocker(String toScreen) {
        blockerDestinations.add(toScreen);
    }

    public String  getFromScreen() { return fromScreen; }
    public String  getElementId()  { return elementId; }
    public Instant getFirstSeen()  { return firstSeen; }
    public int     getTapCount()   { return tapCount; }

    /** Destination screen id to number of times it was observed, in first-seen order. */
    public Map<String, Integer> getDestinations() {
        return Collections.unmodifiableMap(destinations);
    }

    public Set<String> getBlockerDestinations() {
        return Collections.unmodifiableSet(blockerDestinations);
    }

    public int getOccurrences(String toScreen) {
        return destinations.getOrDefault(toScreen, 0);
    }

    public int getTotalOccurrences() {
        int total = 0;
        for (int count : destinations.values()) total += count;
        return total;
    }

    public boolean isConditional() {
        return destinations.size() >= 2;
    }

    /** Most frequently observed destination; earliest wins a tie. */
    public String getMostVisitedDestination() {
        String best = null;
        int bestCount = -1;
        for (Map.Entry<String, Integer> e : destinations.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        destinations.forEach((dest, count) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(dest).append('=').append(count);
            if (blockerDestinations.contains(dest)) sb.append(" [BLOCKER]");
        });
        return String.format("ElementNavigation{%s:%s -> {%s}%s}",
                fromScreen, elementId, sb, isConditional() ? " [CONDITIONAL]" : "");
    }
}
