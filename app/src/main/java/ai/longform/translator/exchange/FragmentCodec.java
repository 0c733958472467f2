package ai.longform.translator.exchange;

import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.plan.TaskVariant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts units to id-tagged fragments and parses translated fragments back out of a model
 * response.
 *
 * <pre>
 * &lt;segments&gt;
 * &lt;seg id="c1-u1" kind="heading"&gt;Chapter One&lt;/seg&gt;
 * &lt;seg id="c1-u2" kind="paragraph"&gt;It was a dark night.&lt;/seg&gt;
 * &lt;/segments&gt;
 * </pre>
 */
public class FragmentCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentCodec.class);
    private static final String BATCH_OPEN = "<segments>";
    private static final String BATCH_CLOSE = "</segments>";
    private static final Pattern FRAGMENT = Pattern.compile(
            "<seg\\s+id\\s*=\\s*\"([^\"]*)\"[^>]*>(.*?)</seg\\s*>", Pattern.DOTALL);
    private static final Pattern OPENING_TAG = Pattern.compile("<seg[\\s>]");
    private static final Pattern CLOSING_TAG = Pattern.compile("</seg\\s*>");

    private final ResponseCleaner cleaner;

    public FragmentCodec() {
        this(new ResponseCleaner());
    }

    public FragmentCodec(ResponseCleaner cleaner) {
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
    }

    public String fragment(ContentUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return "<seg id=\"" + escape(unit.id()) + "\" kind=\"" + unit.kind().wireName() + "\">"
                + escape(unit.sourceText()) + "</seg>";
    }

    /**
     * Fragment plus its line separator, the unit of cost used by the planner.
     */
    public String fragmentLine(ContentUnit unit) {
        return fragment(unit) + "\n";
    }

    public String batchWrapper() {
        return BATCH_OPEN + "\n" + BATCH_CLOSE;
    }

    public String serialize(TaskVariant variant, Collection<ContentUnit> units) {
        Objects.requireNonNull(variant, "variant");
        StringBuilder body = new StringBuilder();
        units.forEach(unit -> body.append(fragmentLine(unit)));
        return switch (variant) {
            case BATCH -> BATCH_OPEN + "\n" + body + BATCH_CLOSE;
            case SPLIT, FIX -> body.toString().stripTrailing();
        };
    }

    /**
     * Parses a raw response. Every expected id is a key of the result; ids the model dropped map
     * to {@link Optional#empty()}.
     */
    public Map<String, Optional<String>> deserialize(TaskVariant variant, List<String> expectedIds, String response)
            throws MalformedResponseException {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(expectedIds, "expectedIds");
        if (response == null || response.isBlank()) {
            throw new MalformedResponseException("Empty response");
        }
        String cleaned = cleaner.clean(response);
        if (variant == TaskVariant.BATCH && !(cleaned.contains(BATCH_OPEN) && cleaned.contains(BATCH_CLOSE))) {
            throw new MalformedResponseException("Batch response is missing the " + BATCH_OPEN + " wrapper");
        }
        int opened = count(OPENING_TAG, cleaned);
        int closed = count(CLOSING_TAG, cleaned);
        if (opened != closed) {
            throw new MalformedResponseException("Unbalanced fragments: " + opened + " opened, " + closed + " closed");
        }

        Map<String, String> found = new HashMap<>();
        Matcher matcher = FRAGMENT.matcher(cleaned);
        int parsed = 0;
        while (matcher.find()) {
            parsed++;
            String id = unescape(matcher.group(1));
            if (!expectedIds.contains(id)) {
                LOGGER.debug("Ignoring unrequested fragment {}", id);
                continue;
            }
            if (found.putIfAbsent(id, unescape(matcher.group(2)).strip()) != null) {
                LOGGER.debug("Ignoring duplicate fragment {}", id);
            }
        }
        if (parsed == 0) {
            throw new MalformedResponseException("No fragments found in response");
        }

        Map<String, Optional<String>> result = new LinkedHashMap<>();
        for (String id : expectedIds) {
            result.put(id, Optional.ofNullable(found.get(id)));
        }
        return result;
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    static String unescape(String text) {
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
