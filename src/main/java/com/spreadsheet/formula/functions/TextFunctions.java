package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluation.TypeCoercion;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.spreadsheet.formula.functions.FunctionDefinition.VARIADIC;
import static com.spreadsheet.formula.functions.FunctionSupport.error;
import static com.spreadsheet.formula.functions.FunctionSupport.flatten;
import static com.spreadsheet.formula.functions.FunctionSupport.integer;
import static com.spreadsheet.formula.functions.FunctionSupport.optional;
import static com.spreadsheet.formula.functions.FunctionSupport.text;

/**
 * String functions. Positions are 1-based; numbers are converted to their display text
 * first, so LEN(1.50) is 3.
 */
final class TextFunctions {

    private static final FormulaValue ONE = FormulaValue.number(1);
    private static final Pattern CURRENCY = Pattern.compile("^[$€£¥]?\\s*([\\d,.+-]+)\\s*[$€£¥]?$");

    private TextFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("LEN", 1, 1, args -> FormulaValue.number(text(args.get(0)).length()));
        registry.register("UPPER", 1, 1, args -> FormulaValue.string(text(args.get(0)).toUpperCase(Locale.ROOT)));
        registry.register("LOWER", 1, 1, args -> FormulaValue.string(text(args.get(0)).toLowerCase(Locale.ROOT)));
        registry.register("TRIM", 1, 1, args -> FormulaValue.string(text(args.get(0)).trim().replaceAll("\\s+", " ")));
        registry.register("CONCATENATE", 1, VARIADIC, TextFunctions::concatenate);
        registry.register("LEFT", 1, 2, TextFunctions::left);
        registry.register("RIGHT", 1, 2, TextFunctions::right);
        registry.register("MID", 3, 3, TextFunctions::mid);
        registry.register("FIND", 2, 3, args -> find(args, false));
        registry.register("SEARCH", 2, 3, args -> find(args, true));
        registry.register("SUBSTITUTE", 3, 4, TextFunctions::substitute);
        registry.register("REPLACE", 4, 4, TextFunctions::replace);
        registry.register("VALUE", 1, 1, TextFunctions::value);
    }

    private static FormulaValue concatenate(List<FormulaValue> args) {
        return FormulaValue.string(flatten(args).stream()
                .map(FormulaValue::toDisplayString)
                .collect(Collectors.joining()));
    }

    private static int count(List<FormulaValue> args, int index) {
        int count = integer(optional(args, index, ONE));
        if (count < 0) {
            throw error(ErrorKind.VALUE, "num_chars must be non-negative");
        }
        return count;
    }

    private static FormulaValue left(List<FormulaValue> args) {
        String text = text(args.get(0));
        return FormulaValue.string(text.substring(0, Math.min(count(args, 1), text.length())));
    }

    private static FormulaValue right(List<FormulaValue> args) {
        String text = text(args.get(0));
        return FormulaValue.string(text.substring(text.length() - Math.min(count(args, 1), text.length())));
    }

    private static FormulaValue mid(List<FormulaValue> args) {
        String text = text(args.get(0));
        int start = integer(args.get(1));
        if (start < 1) {
            throw error(ErrorKind.VALUE, "start_num must be at least 1");
        }
        int length = count(args, 2);
        int from = Math.min(start - 1, text.length());
        int to = (int) Math.min((long) from + length, text.length());
        return FormulaValue.string(text.substring(from, to));
    }

    /**
     * FIND is case-sensitive and literal; SEARCH ignores case and understands the
     * ? and * wildcards.
     */
    private static FormulaValue find(List<FormulaValue> args, boolean search) {
        String needle = text(args.get(0));
        String haystack = text(args.get(1));
        int start = integer(optional(args, 2, ONE));
        int lastStart = needle.isEmpty() ? haystack.length() + 1 : haystack.length();
        if (start < 1 || start > lastStart) {
            throw error(ErrorKind.VALUE, "start_num is outside the text");
        }
        if (!search) {
            int position = haystack.indexOf(needle, start - 1);
            if (position < 0) {
                throw error(ErrorKind.VALUE, "Text not found");
            }
            return FormulaValue.number(position + 1);
        }
        Matcher matcher = wildcardPattern(needle).matcher(haystack);
        if (!matcher.find(start - 1)) {
            throw error(ErrorKind.VALUE, "Text not found");
        }
        return FormulaValue.number(matcher.start() + 1);
    }

    private static Pattern wildcardPattern(String needle) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : needle.toCharArray()) {
            if (c == '?' || c == '*') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '?' ? "." : ".*?");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private static FormulaValue substitute(List<FormulaValue> args) {
        String text = text(args.get(0));
        String oldText = text(args.get(1));
        String newText = text(args.get(2));
        if (oldText.isEmpty()) {
            return FormulaValue.string(text);
        }
        if (args.size() < 4) {
            return FormulaValue.string(text.replace(oldText, newText));
        }
        int instance = integer(args.get(3));
        if (instance < 1) {
            throw error(ErrorKind.VALUE, "instance_num must be at least 1");
        }
        int position = -oldText.length();
        for (int seen = 0; seen < instance; seen++) {
            position = text.indexOf(oldText, position + oldText.length());
            if (position < 0) {
                return FormulaValue.string(text);
            }
        }
        return FormulaValue.string(text.substring(0, position) + newText + text.substring(position + oldText.length()));
    }

    private static FormulaValue replace(List<FormulaValue> args) {
        String text = text(args.get(0));
        int start = integer(args.get(1));
        int length = integer(args.get(2));
        String newText = text(args.get(3));
        if (start < 1) {
            throw error(ErrorKind.VALUE, "start_num must be at least 1");
        }
        if (length < 0) {
            throw error(ErrorKind.VALUE, "num_chars must be non-negative");
        }
        int from = Math.min(start - 1, text.length());
        int to = (int) Math.min((long) from + length, text.length());
        return FormulaValue.string(text.substring(0, from) + newText + text.substring(to));
    }

    /**
     * Text to number, accepting "50%", thousands separators and a currency symbol.
     */
    private static FormulaValue value(List<FormulaValue> args) {
        FormulaValue arg = FunctionSupport.scalar(args.get(0));
        if (arg.isNumber()) {
            return arg;
        }
        String text = text(arg).trim();
        if (text.isEmpty()) {
            return FormulaValue.number(0);
        }
        if (text.endsWith("%")) {
            String digits = text.substring(0, text.length() - 1).trim().replace(",", "");
            if (TypeCoercion.isNumeric(digits)) {
                return FormulaValue.number(Double.parseDouble(digits) / 100);
            }
            throw error(ErrorKind.VALUE, "Cannot convert text to number: " + text);
        }
        Matcher currency = CURRENCY.matcher(text);
        String digits = currency.matches() ? currency.group(1).replace(",", "") : text.replace(",", "");
        if (TypeCoercion.isNumeric(digits)) {
            return FormulaValue.number(Double.parseDouble(digits));
        }
        throw error(ErrorKind.VALUE, "Cannot convert text to number: " + text);
    }
}
