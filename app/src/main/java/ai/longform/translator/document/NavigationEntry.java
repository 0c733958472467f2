package ai.longform.translator.document;

/**
 * Table-of-contents entry pointing at a container by id.
 */
public record NavigationEntry(String containerId, String label) {

    public NavigationEntry {
        if (containerId == null || containerId.isBlank()) {
            throw new IllegalArgumentException("containerId must not be blank");
        }
        label = label == null ? "" : label;
    }

    public NavigationEntry withLabel(String newLabel) {
        return new NavigationEntry(containerId, newLabel);
    }
}
