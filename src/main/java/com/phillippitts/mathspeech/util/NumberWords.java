package com.phillippitts.mathspeech.util;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Spells numbers as English words.
 *
 * <pre>
 * NumberWords.cardinal("1,204")  -> "one thousand two hundred four"
 * NumberWords.cardinal("-3.14")  -> "negative three point one four"
 * NumberWords.ordinal("21")      -> "twenty-first"
 * </pre>
 */
public final class NumberWords {

    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(?:\\.\\d+)?");
    private static final int MAX_GROUPED_DIGITS = 18;

    private static final String[] ONES = {
            "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
            "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen",
            "seventeen", "eighteen", "nineteen"
    };
    private static final String[] TENS = {
            "", "", "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety"
    };
    private static final String[] SCALES = {
            "", "thousand", "million", "billion", "trillion", "quadrillion", "quintillion"
    };

    private NumberWords() {
        // Utility class - prevent instantiation
    }

    /**
     * Cardinal words for a numeral. Thousands separators are ignored; a fractional part is read
     * digit by digit after "point".
     *
     * @param numeral digits with optional sign, commas and decimal part
     * @return words, or empty if the input is not a numeral
     */
    public static Optional<String> cardinal(String numeral) {
        String n = strip(numeral);
        if (!NUMBER.matcher(n).matches()) {
            return Optional.empty();
        }
        StringBuilder out = new StringBuilder();
        if (n.charAt(0) == '-') {
            out.append("negative ");
            n = n.substring(1);
        } else if (n.charAt(0) == '+') {
            n = n.substring(1);
        }
        int dot = n.indexOf('.');
        String whole = dot < 0 ? n : n.substring(0, dot);
        out.append(wholeNumber(whole));
        if (dot >= 0) {
            out.append(" point");
            for (char c : n.substring(dot + 1).toCharArray()) {
                out.append(' ').append(ONES[c - '0']);
            }
        }
        return Optional.of(out.toString());
    }

    /**
     * Ordinal words for a non-negative integer numeral.
     *
     * @return words such as "third" or "one hundredth", or empty if the input is not a
     *         non-negative integer
     */
    public static Optional<String> ordinal(String numeral) {
        String n = strip(numeral);
        if (n.startsWith("+")) {
            n = n.substring(1);
        }
        if (n.isEmpty() || !n.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        String words = wholeNumber(n);
        int split = Math.max(words.lastIndexOf(' '), words.lastIndexOf('-'));
        String head = words.substring(0, split + 1);
        String last = words.substring(split + 1);
        return Optional.of(head + ordinalWord(last));
    }

    private static String strip(String numeral) {
        return numeral == null ? "" : numeral.trim().replace(",", "");
    }

    private static String wholeNumber(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > MAX_GROUPED_DIGITS) {
            StringBuilder out = new StringBuilder();
            for (char c : trimmed.toCharArray()) {
                if (out.length() > 0) {
                    out.append(' ');
                }
                out.append(ONES[c - '0']);
            }
            return out.toString();
        }
        long value = Long.parseLong(trimmed);
        if (value == 0) {
            return ONES[0];
        }
        StringBuilder out = new StringBuilder();
        int scale = 0;
        while (value > 0) {
            int group = (int) (value % 1000);
            if (group > 0) {
                String words = belowThousand(group) + (SCALES[scale].isEmpty() ? "" : " " + SCALES[scale]);
                out.insert(0, out.length() == 0 ? words : words + " ");
            }
            value /= 1000;
            scale++;
        }
        return out.toString();
    }

    private static String belowThousand(int n) {
        StringBuilder out = new StringBuilder();
        if (n >= 100) {
            out.append(ONES[n / 100]).append(" hundred");
            n %= 100;
            if (n > 0) {
                out.append(' ');
            }
        }
        if (n >= 20) {
            out.append(TENS[n / 10]);
            if (n % 10 > 0) {
                out.append('-').append(ONES[n % 10]);
            }
        } else if (n > 0) {
            out.append(ONES[n]);
        }
        return out.toString();
    }

    private static String ordinalWord(String word) {
        return switch (word) {
            case "one" -> "first";
            case "two" -> "second";
            case "three" -> "third";
            case "five" -> "fifth";
            case "eight" -> "eighth";
            case "nine" -> "ninth";
            case "twelve" -> "twelfth";
            default -> word.endsWith("y")
                    ? word.substring(0, word.length() - 1) + "ieth"
                    : word + "th";
        };
    }
}
