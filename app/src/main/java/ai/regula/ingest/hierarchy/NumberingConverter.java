package ai.regula.ingest.hierarchy;

import java.util.Locale;

/**
 * Converts chapter and section labels (arabic digits, roman numerals, single letters) into integer ordinals.
 */
public final class NumberingConverter {

    private NumberingConverter() {
    }

    /**
     * Resolves a label to an ordinal.
     *
     * <p>Single lowercase letters are list markers in legal texts, so {@code "i"} or {@code "c"} resolve to their
     * alphabet position before roman numerals are considered. Single uppercase letters resolve as roman numerals when
     * they are one ({@code "C"} is 100) and as alphabet positions otherwise ({@code "B"} is 2).</p>
     *
     * @param label    label as printed in the source, may be empty
     * @param fallback value returned when the label cannot be interpreted
     * @return the ordinal, or {@code fallback}
     */
    public static int toOrdinal(String label, int fallback) {
        if (label == null || label.isEmpty()) {
            return fallback;
        }
        if (isDigits(label)) {
            try {
                return Integer.parseInt(label);
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
        if (label.length() == 1) {
            char ch = label.charAt(0);
            if (ch >= 'a' && ch <= 'z') {
                return ch - 'a' + 1;
            }
        }
        int roman = romanToArabic(label);
        if (roman > 0) {
            return roman;
        }
        if (label.length() == 1) {
            char ch = label.charAt(0);
            if (ch >= 'A' && ch <= 'Z') {
                return ch - 'A' + 1;
            }
        }
        return fallback;
    }

    /**
     * Subtractive-notation roman numeral parse, case-insensitive.
     *
     * @return the value, or 0 for empty input or any character outside {@code IVXLCDM}
     */
    public static int romanToArabic(String roman) {
        if (roman == null || roman.isEmpty()) {
            return 0;
        }
        String upper = roman.toUpperCase(Locale.ROOT);
        int total = 0;
        for (int i = 0; i < upper.length(); i++) {
            int current = romanValue(upper.charAt(i));
            if (current == 0) {
                return 0;
            }
            if (i + 1 < upper.length()) {
                int next = romanValue(upper.charAt(i + 1));
                if (next > 0 && current < next) {
                    total -= current;
                    continue;
                }
            }
            total += current;
        }
        return total;
    }

    public static boolean isRomanNumeral(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        String upper = value.toUpperCase(Locale.ROOT);
        for (int i = 0; i < upper.length(); i++) {
            if (romanValue(upper.charAt(i)) == 0) {
                return false;
            }
        }
        return true;
    }

    private static int romanValue(char ch) {
        return switch (ch) {
            case 'I' -> 1;
            case 'V' -> 5;
            case 'X' -> 10;
            case 'L' -> 50;
            case 'C' -> 100;
            case 'D' -> 500;
            case 'M' -> 1000;
            default -> 0;
        };
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }
}
