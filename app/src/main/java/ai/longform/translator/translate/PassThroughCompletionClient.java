package ai.longform.translator.translate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client used for dry-run scenarios: answers every fragment of the prompt with its source text,
 * so no remote API is invoked. Instructions around the payload are not echoed.
 */
public class PassThroughCompletionClient implements CompletionClient {

    private static final Pattern FRAGMENT = Pattern.compile("(<seg\\s[^>]*>)(.*?)(</seg>)", Pattern.DOTALL);

    private final String textPrefix;

    public PassThroughCompletionClient() {
        this("");
    }

    protected PassThroughCompletionClient(String textPrefix) {
        this.textPrefix = textPrefix == null ? "" : textPrefix;
    }

    @Override
    public String complete(String prompt) {
        StringBuilder response = new StringBuilder("<segments>\n");
        Matcher matcher = FRAGMENT.matcher(prompt == null ? "" : prompt);
        while (matcher.find()) {
            response.append(matcher.group(1))
                    .append(textPrefix)
                    .append(matcher.group(2))
                    .append(matcher.group(3))
                    .append('\n');
        }
        return response.append("</segments>").toString();
    }
}
