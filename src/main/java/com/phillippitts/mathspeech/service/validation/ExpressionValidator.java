package com.phillippitts.mathspeech.service.validation;

import com.phillippitts.mathspeech.config.properties.ConversionProperties;
import com.phillippitts.mathspeech.exception.InvalidExpressionException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects input that must never reach the analyzer.
 *
 * <p>Checks, in order: blank input, length over the configured maximum, embedded null bytes,
 * commands that would read or write files or redefine macros in a TeX engine, command names
 * longer than {@value #MAX_COMMAND_NAME} characters, and long runs of a single structural
 * character.
 */
@Component
public class ExpressionValidator {

    static final int MAX_COMMAND_NAME = 50;
    static final int MAX_REPEATED_RUN = 1000;

    private static final List<String> FORBIDDEN_COMMANDS = List.of(
            "input", "include", "write", "immediate", "expandafter", "csname",
            "def", "gdef", "edef", "xdef", "catcode", "uppercase", "lowercase", "openout", "read");

    private static final Pattern FORBIDDEN = Pattern.compile(
            "\\\\(" + String.join("|", FORBIDDEN_COMMANDS) + ")(?![a-zA-Z])");
    private static final Pattern LONG_COMMAND = Pattern.compile("\\\\[a-zA-Z]{" + (MAX_COMMAND_NAME + 1) + ",}");
    private static final Pattern REPEATED_RUN = Pattern.compile("([{}\\\\$])\\1{" + MAX_REPEATED_RUN + ",}");

    private final ConversionProperties props;

    public ExpressionValidator(ConversionProperties props) {
        this.props = props;
    }

    /**
     * @param expression raw expression
     * @throws InvalidExpressionException when any check fails
     */
    public void validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidExpressionException("Expression is empty");
        }
        int length = expression.length();
        if (length > props.getMaxExpressionLength()) {
            throw new InvalidExpressionException(length,
                    "Expression too long. Max: " + props.getMaxExpressionLength() + " chars");
        }
        if (expression.indexOf('\0') >= 0) {
            throw new InvalidExpressionException(length, "Expression contains null bytes");
        }
        Matcher forbidden = FORBIDDEN.matcher(expression);
        if (forbidden.find()) {
            throw new InvalidExpressionException(length, "Command not allowed: \\" + forbidden.group(1));
        }
        if (LONG_COMMAND.matcher(expression).find()) {
            throw new InvalidExpressionException(length,
                    "Command name longer than " + MAX_COMMAND_NAME + " characters");
        }
        Matcher run = REPEATED_RUN.matcher(expression);
        if (run.find()) {
            throw new InvalidExpressionException(length,
                    "Character '" + run.group(1) + "' repeated more than " + MAX_REPEATED_RUN + " times");
        }
    }
}
