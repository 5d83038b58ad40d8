package com.phillippitts.mathspeech.service.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills rule output templates from a match.
 *
 * <p>Placeholder grammar:
 * <ul>
 *   <li>{@code ${name}} - named capture group</li>
 *   <li>{@code $N} - positional group, {@code $0} is the whole match</li>
 *   <li>{@code $$} - a literal dollar sign</li>
 * </ul>
 * A referenced group that did not participate in the match renders as the empty string.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\$\\$|\\$\\{([A-Za-z][A-Za-z0-9]*)\\}|\\$(\\d+)");

    private TemplateRenderer() {
    }

    /** Reference to a group from a template. Exactly one of name or index is set. */
    public record Placeholder(String name, int index) {

        public boolean isNamed() {
            return name != null;
        }

        @Override
        public String toString() {
            return isNamed() ? "${" + name + "}" : "$" + index;
        }
    }

    /**
     * Lists the group references in a template, in order of appearance.
     */
    public static List<Placeholder> placeholders(String template) {
        List<Placeholder> result = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            if (m.group(1) != null) {
                result.add(new Placeholder(m.group(1), -1));
            } else if (m.group(2) != null) {
                result.add(new Placeholder(null, Integer.parseInt(m.group(2))));
            }
        }
        return result;
    }

    /**
     * Renders a template for one match.
     *
     * @param template validated template
     * @param match    matcher positioned on the match whose groups supply the values
     * @return rendered replacement text
     */
    public static String render(String template, Matcher match) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 16);
        int last = 0;
        while (m.find()) {
            out.append(template, last, m.start());
            if (m.group(1) != null) {
                out.append(nullToEmpty(match.group(m.group(1))));
            } else if (m.group(2) != null) {
                out.append(nullToEmpty(match.group(Integer.parseInt(m.group(2)))));
            } else {
                out.append('$');
            }
            last = m.end();
        }
        out.append(template, last, template.length());
        return out.toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
