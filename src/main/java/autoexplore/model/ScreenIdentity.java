package autoexplore.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic identities for screens and elements.
 *
 * <p>Screen ids are derived only from the (package, activity) pair so that
 * dynamic content (clock text, counters, feed items) never splits one
 * logical screen into many. Element ids are stable per screen and combine
 * resource id, short text and widget class; anonymous widgets additionally
 * carry a coarse bounds signature so siblings stay distinct.
 */
public final class ScreenIdentity {

    private static final int HASH_LENGTH       = 16;
    private static final int MAX_TEXT_LENGTH   = 30;
    private static final int TEXT_PREFIX       = 20;
    private static final int CENTER_GRID_PX    = 10;
    private static final int SIZE_GRID_PX      = 20;

    private ScreenIdentity() {}

    /** Returns the 16-hex-char id of the screen shown by {@code activity} in {@code packageName}. */
    public static String screenId(String packageName, String activity) {
        return sha256(nullToEmpty(packageName) + "|" + nullToEmpty(activity)).substring(0, HASH_LENGTH);
    }

    /**
     * Builds a per-screen element id.
     *
     * @param resourceId full resource id ({@code pkg:id/name}) or {@code null}
     * @param text       visible text or {@code null}
     * @param className  widget class
     * @param bounds     on-screen rectangle, used only for anonymous widgets
     */
    public static String elementId(String resourceId, String text, String className, ElementBounds bounds) {
        boolean hasResource = resourceId != null && !resourceId.isEmpty();
        boolean hasText     = text != null && !text.isEmpty();

        List<String> parts = new ArrayList<>();
        if (hasResource) {
            parts.add(resourceId.substring(resourceId.lastIndexOf('/') + 1));
        }
        if (hasText && text.length() < MAX_TEXT_LENGTH) {
            parts.add(text.length() > TEXT_PREFIX ? text.substring(0, TEXT_PREFIX) : text);
        }
        String cls = nullToEmpty(className);
        parts.add(cls.substring(cls.lastIndexOf('.') + 1));

        if (!hasResource && !hasText && bounds != null) {
            parts.add(boundsSignature(bounds));
        }

        return String.join("_", parts)
                .replaceAll("[^a-zA-Z0-9_]", "")
                .toLowerCase();
    }

    /** Run-wide key for an element: {@code screenId:elementId}. */
    public static String compositeKey(String screenId, String elementId) {
        return screenId + ":" + elementId;
    }

    /** Lower-case hex SHA-256 of {@code input} (UTF-8). */
    public static String sha256(String input) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String boundsSignature(ElementBounds b) {
        long cx = Math.round(b.getCenterX() / (double) CENTER_GRID_PX) * CENTER_GRID_PX;
        long cy = Math.round(b.getCenterY() / (double) CENTER_GRID_PX) * CENTER_GRID_PX;
        long w  = Math.round(b.getWidth()   / (double) SIZE_GRID_PX) * SIZE_GRID_PX;
        long h  = Math.round(b.getHeight()  / (double) SIZE_GRID_PX) * SIZE_GRID_PX;
        return cx + "_" + cy + "_" + w + "x" + h;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
