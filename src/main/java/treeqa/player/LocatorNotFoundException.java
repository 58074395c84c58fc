package treeqa.player;

import java.util.List;

/**
 * No lookup strategy matched a locator. Carries the attempted locator and
 * every stable id the tree declared so a human can repair the test.
 */
public class LocatorNotFoundException extends TreeQAException {

    private final String locator;
    private final List<String> availableIds;

    public LocatorNotFoundException(String locator, List<String> availableIds, String detail) {
        super(buildMessage(locator, availableIds, detail));
        this.locator = locator;
        this.availableIds = List.copyOf(availableIds);
    }

    public String locator() {
        return locator;
    }

    public List<String> availableIds() {
        return availableIds;
    }

    private static String buildMessage(String locator, List<String> ids, String detail) {
        StringBuilder sb = new StringBuilder("Control not found: '").append(locator).append("'.");
        if (detail != null && !detail.isBlank()) {
            sb.append(' ').append(detail);
            if (!detail.endsWith(".")) sb.append('.');
        }
        sb.append(" Available stable ids: ")
          .append(ids.isEmpty() ? "(none)" : String.join(", ", ids))
          .append('.');
        return sb.toString();
    }
}
