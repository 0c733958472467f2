package ai.longform.translator.assemble;

import ai.longform.translator.document.NavigationEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites table-of-contents labels to the translated container titles.
 */
public class NavigationPatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(NavigationPatcher.class);
    private static final Pattern NUMBER_PREFIX = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)*\\.?\\s+)");

    public List<NavigationEntry> patch(List<NavigationEntry> navigation, Map<String, String> derivedTitles) {
        List<NavigationEntry> patched = new ArrayList<>(navigation.size());
        for (NavigationEntry entry : navigation) {
            String title = derivedTitles.get(entry.containerId());
            if (title == null || title.isBlank()) {
                LOGGER.debug("No derived title for navigation entry {}", entry.containerId());
                patched.add(entry);
                continue;
            }
            patched.add(entry.withLabel(label(entry.label(), title.strip())));
        }
        return List.copyOf(patched);
    }

    String label(String originalLabel, String title) {
        Matcher matcher = NUMBER_PREFIX.matcher(originalLabel == null ? "" : originalLabel);
        if (!matcher.find()) {
            return title;
        }
        String prefix = matcher.group(1);
        if (title.startsWith(prefix.strip())) {
            return title;
        }
        return prefix + title;
    }
}
