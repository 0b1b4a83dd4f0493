package ai.regula.ingest.detect;

import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.PatternBridge;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the jurisdiction-specific citation of a document in its opening lines.
 */
public final class IdentifierExtractor {

    private static final Pattern UK_CHAPTER_CITATION = Pattern.compile("\\[(\\d{4})\\s+c\\.\\s*(\\d+)\\]");
    private static final Pattern UK_SI_SHORT = Pattern.compile("S\\.?I\\.?\\s+(\\d{4})/(\\d+)");
    private static final Pattern UK_SI_LONG =
            Pattern.compile("(?i)Statutory\\s+Instruments?\\s+(\\d{4})\\s+No\\.\\s*(\\d+)");

    private static final Pattern CO_SECTION = Pattern.compile("(?:Section|§)\\s*(\\d+-\\d+-\\d+)");
    private static final Pattern CT_SECTION = Pattern.compile("(?i)(?:Section|Sec\\.|§)\\s*(\\d+-\\d+)");
    private static final Pattern TX_SECTION = Pattern.compile("(?i)(?:Section|Sec\\.|§)\\s*(\\d+\\.\\d+)");
    private static final Pattern UT_SECTION = Pattern.compile("(?:Section|§)\\s*(\\d+-\\d+-\\d+)");
    private static final Pattern IA_SECTION = Pattern.compile("(?:Section|§)\\s*(\\d+[A-Z]\\.\\d+)");
    private static final Pattern VA_TITLE_CHAPTER = Pattern.compile("(?i)Title\\s+59\\.1\\s+Chapter\\s+(\\d+)");
    private static final Pattern CA_TITLE = Pattern.compile("TITLE\\s+([\\d.]+)");
    private static final Pattern EU_IDENTIFIER = Pattern.compile("\\(E[UC]\\)\\s*(?:No\\s*)?(\\d+/\\d+)");

    private IdentifierExtractor() {
    }

    public static String extract(DocumentFormat format, Optional<PatternBridge> bridge, List<String> lines) {
        return switch (format) {
            case UK -> extractUk(lines);
            case US -> extractUs(bridge.map(PatternBridge::jurisdiction).orElse(""), lines);
            default -> extractEu(lines);
        };
    }

    static String extractUk(List<String> lines) {
        for (String line : head(lines, 30)) {
            Matcher citation = UK_CHAPTER_CITATION.matcher(line);
            if (citation.find()) {
                return citation.group(1) + " c. " + citation.group(2);
            }
            Matcher shortSi = UK_SI_SHORT.matcher(line);
            if (shortSi.find()) {
                return "S.I. " + shortSi.group(1) + "/" + shortSi.group(2);
            }
            Matcher longSi = UK_SI_LONG.matcher(line);
            if (longSi.find()) {
                return "S.I. " + longSi.group(1) + "/" + longSi.group(2);
            }
        }
        return "";
    }

    static String extractUs(String jurisdiction, List<String> lines) {
        String stateIdentifier = switch (jurisdiction) {
            case "US-CO" -> scan(lines, CO_SECTION, "C.R.S. § ", List.of("C.R.S."), "C.R.S. § 6-1-1301 et seq.");
            case "US-CT" -> scan(lines, CT_SECTION, "Conn. Gen. Stat. § ", List.of("Conn. Gen. Stat.", "CGS"),
                    "Conn. Gen. Stat. § 42-515 et seq.");
            case "US-TX" -> scan(lines, TX_SECTION, "Tex. Bus. & Com. Code § ", List.of("Tex. Bus.", "Texas Business"),
                    "Tex. Bus. & Com. Code § 541.001 et seq.");
            case "US-UT" -> scan(lines, UT_SECTION, "U.C.A. § ", List.of("U.C.A.", "Utah Code"),
                    "U.C.A. § 13-61-101 et seq.");
            case "US-IA" -> scan(lines, IA_SECTION, "Iowa Code § ", List.of("Iowa Code"),
                    "Iowa Code § 715D.1 et seq.");
            default -> "";
        };
        if (!stateIdentifier.isEmpty()) {
            return stateIdentifier;
        }

        for (String line : head(lines, 20)) {
            if (line.contains("Title 59.1") || line.contains("TITLE 59.1")) {
                if (line.contains("Chapter 53") || line.contains("CHAPTER 53")) {
                    return "Va. Code Ann. § 59.1-575 et seq.";
                }
                Matcher titleChapter = VA_TITLE_CHAPTER.matcher(line);
                if (titleChapter.find()) {
                    return "Va. Code Ann. Title 59.1 Chapter " + titleChapter.group(1);
                }
            }
            if (line.contains("Section 59.1-") || line.contains("§ 59.1-")) {
                return "Va. Code Ann. § 59.1";
            }
        }
        for (String line : head(lines, 20)) {
            if (line.contains("TITLE")) {
                Matcher title = CA_TITLE.matcher(line);
                if (title.find()) {
                    return "Cal. Civ. Code Title " + title.group(1);
                }
            }
            if (line.contains("Section 1798")) {
                return "Cal. Civ. Code § 1798";
            }
        }
        return "";
    }

    static String extractEu(List<String> lines) {
        for (String line : head(lines, 10)) {
            if (line.contains("(EU)") || line.contains("(EC)")) {
                Matcher matcher = EU_IDENTIFIER.matcher(line);
                if (matcher.find()) {
                    return "(EU) " + matcher.group(1);
                }
            }
        }
        return "";
    }

    private static String scan(List<String> lines, Pattern section, String prefix, List<String> markers,
                               String fallback) {
        for (String line : head(lines, 20)) {
            Matcher matcher = section.matcher(line);
            if (matcher.find()) {
                return prefix + matcher.group(1);
            }
            for (String marker : markers) {
                if (line.contains(marker)) {
                    return fallback;
                }
            }
        }
        return "";
    }

    private static List<String> head(List<String> lines, int count) {
        return lines.subList(0, Math.min(count, lines.size()));
    }
}
