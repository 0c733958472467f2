package ai.longform.translator.exchange;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips the outer wrappers models like to add around an answer. Rules are applied repeatedly
 * until none of them matches.
 */
public class ResponseCleaner {

    private static final List<WrapperRule> RULES = List.of(
            new WrapperRule("code-fence", Pattern.compile("^```[\\w+-]*[ \\t]*\\R(.*?)\\R?```$", Pattern.DOTALL)),
            new WrapperRule("envelope", Pattern.compile(
                    "^<(output|translation|translations|response|result)>(.*)</\\1>$", Pattern.DOTALL), 2),
            new WrapperRule("preamble", Pattern.compile("^[^<\\r\\n]*:[ \\t]*\\R(.*)$", Pattern.DOTALL)));

    public String clean(String response) {
        if (response == null) {
            return "";
        }
        String current = response.strip();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (WrapperRule rule : RULES) {
                String unwrapped = rule.unwrap(current);
                if (unwrapped != null) {
                    current = unwrapped.strip();
                    changed = true;
                }
            }
        }
        return current;
    }

    private record WrapperRule(String name, Pattern pattern, int group) {

        private WrapperRule(String name, Pattern pattern) {
            this(name, pattern, 1);
        }

        private String unwrap(String text) {
            Matcher matcher = pattern.matcher(text);
            return matcher.matches() ? matcher.group(group) : null;
        }
    }
}
