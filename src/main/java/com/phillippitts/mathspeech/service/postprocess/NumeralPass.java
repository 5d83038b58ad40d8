package com.phillippitts.mathspeech.service.postprocess;

import com.phillippitts.mathspeech.util.NumberWords;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands numeral markers emitted by rule templates.
 *
 * <ul>
 *   <li>{@code [[num:42]]} becomes "forty-two"; non-numeric content is emitted as is</li>
 *   <li>{@code [[ord:3]]} becomes "third"; non-numeric content becomes "n-th"</li>
 * </ul>
 * Markers with empty or whitespace content are left untouched.
 */
public class NumeralPass implements TextPass {

    private static final Pattern MARKER =
            Pattern.compile("\\[\\[(num|ord):([+\\-]?[A-Za-z0-9][A-Za-z0-9.,]*)]]");

    @Override
    public String name() {
        return "numeral";
    }

    @Override
    public String apply(String text) {
        if (text.indexOf("[[") < 0) {
            return text;
        }
        Matcher m = MARKER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(expand(m.group(1), m.group(2))));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String expand(String kind, String content) {
        if ("ord".equals(kind)) {
            return NumberWords.ordinal(content).orElse(content + "-th");
        }
        return NumberWords.cardinal(content).orElse(content);
    }
}
