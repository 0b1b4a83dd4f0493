package ai.regula.ingest.hierarchy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heuristic hierarchy inference from numbering markers and header lines.
 *
 * <p>Numbering styles present in the text are ranked upper roman, arabic, upper letter, lower letter, lower roman,
 * and each style found is given the next depth. Documents without any numbering are split on header lines
 * (all-caps, {@code CHAPTER 1}-style keywords, or lines underlined with {@code ---}).</p>
 */
public class DefaultGenericHierarchyParser implements GenericHierarchyParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultGenericHierarchyParser.class);

    private static final Pattern ARABIC_DOT = Pattern.compile("^(\\d+)\\.\\s+");
    private static final Pattern ARABIC_PAREN = Pattern.compile("^\\((\\d+)\\)\\s+");
    private static final Pattern ARABIC_CLOSE_PAREN = Pattern.compile("^(\\d+)\\)\\s+");
    private static final Pattern LOWER_LETTER_PAREN = Pattern.compile("^\\(([a-z])\\)\\s+");
    private static final Pattern LOWER_LETTER_DOT = Pattern.compile("^([a-z])\\.\\s+");
    private static final Pattern UPPER_LETTER_PAREN = Pattern.compile("^\\(([A-Z])\\)\\s+");
    private static final Pattern UPPER_LETTER_DOT = Pattern.compile("^([A-Z])\\.\\s+");
    private static final Pattern LOWER_ROMAN_PAREN = Pattern.compile("^\\(([ivxlcdm]+)\\)\\s+");
    private static final Pattern LOWER_ROMAN_DOT = Pattern.compile("^([ivxlcdm]+)\\.\\s+");
    private static final Pattern UPPER_ROMAN_PAREN = Pattern.compile("^\\(([IVXLCDM]+)\\)\\s+");
    private static final Pattern UPPER_ROMAN_DOT = Pattern.compile("^([IVXLCDM]+)\\.\\s+");

    private static final Pattern ALL_CAPS_HEADER = Pattern.compile("^[A-Z][A-Z\\s]{3,}[A-Z]$");
    private static final Pattern KEYWORD_HEADER =
            Pattern.compile("^(?:CHAPTER|SECTION|PART|TITLE|ARTICLE)\\s+(?:\\d+|[IVXLCDM]+)");
    private static final Pattern UNDERLINE = Pattern.compile("^[-=]{3,}$");

    private static final Pattern QUOTED_MEANS =
            Pattern.compile("[\"“”'‘’]([^\"“”'‘’]+)[\"“”'‘’]\\s+(?:means?|shall\\s+mean)");
    private static final Pattern QUOTED_REFERS_TO =
            Pattern.compile("[\"“”'‘’]([^\"“”'‘’]+)[\"“”'‘’]\\s+(?:refers?\\s+to|has\\s+the\\s+(?:same\\s+)?meaning)");
    private static final Pattern COLON_DEFINITION = Pattern.compile("^([A-Z][a-zA-Z\\s]+):\\s+");

    private static final List<NumberType> DEPTH_ORDER = List.of(
            NumberType.UPPER_ROMAN,
            NumberType.ARABIC,
            NumberType.UPPER_LETTER,
            NumberType.LOWER_LETTER,
            NumberType.LOWER_ROMAN);

    private static final List<Pattern> MARKER_PATTERNS = List.of(
            UPPER_ROMAN_DOT, UPPER_ROMAN_PAREN,
            ARABIC_DOT, ARABIC_PAREN, ARABIC_CLOSE_PAREN,
            UPPER_LETTER_DOT, UPPER_LETTER_PAREN,
            LOWER_LETTER_DOT, LOWER_LETTER_PAREN,
            LOWER_ROMAN_DOT, LOWER_ROMAN_PAREN);

    @Override
    public GenericDocument parse(String text) {
        if (text == null || text.isEmpty()) {
            return new GenericDocument("", List.of(), List.of(), List.of("Empty document"));
        }
        List<String> lines = List.of(text.split("\n", -1));
        List<String> warnings = new ArrayList<>();

        String title = detectTitle(lines, warnings);
        Map<NumberType, Integer> depths = detectDepths(lines, warnings);
        List<LeveledSection> sections = depths.isEmpty()
                ? extractSectionsByHeaders(lines, warnings)
                : extractNumberedSections(lines, depths);
        List<GenericDefinition> definitions = extractDefinitions(lines, warnings);

        LOGGER.debug("Generic inference found {} sections and {} definitions across {} depth levels",
                sections.size(), definitions.size(), depths.size());
        return new GenericDocument(title, sections, definitions, warnings);
    }

    private String detectTitle(List<String> lines, List<String> warnings) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (ALL_CAPS_HEADER.matcher(line).matches() && line.length() > 5) {
                return line;
            }
            if (line.length() > 10 && i < 5) {
                return line;
            }
        }
        warnings.add("Could not detect document title");
        return "";
    }

    private Map<NumberType, Integer> detectDepths(List<String> lines, List<String> warnings) {
        Map<NumberType, Integer> counts = new EnumMap<>(NumberType.class);
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            countIf(counts, NumberType.ARABIC, trimmed, ARABIC_DOT, ARABIC_PAREN);
            countIf(counts, NumberType.LOWER_LETTER, trimmed, LOWER_LETTER_PAREN, LOWER_LETTER_DOT);
            countIf(counts, NumberType.UPPER_LETTER, trimmed, UPPER_LETTER_PAREN, UPPER_LETTER_DOT);
            countIf(counts, NumberType.LOWER_ROMAN, trimmed, LOWER_ROMAN_PAREN, LOWER_ROMAN_DOT);
            countIf(counts, NumberType.UPPER_ROMAN, trimmed, UPPER_ROMAN_PAREN, UPPER_ROMAN_DOT);
        }

        Map<NumberType, Integer> depths = new EnumMap<>(NumberType.class);
        int depth = 0;
        for (NumberType type : DEPTH_ORDER) {
            if (counts.getOrDefault(type, 0) > 0) {
                depths.put(type, depth++);
            }
        }
        if (depths.isEmpty()) {
            warnings.add("Could not detect document hierarchy");
        }
        return depths;
    }

    private static void countIf(Map<NumberType, Integer> counts, NumberType type, String line,
                                Pattern first, Pattern second) {
        if (first.matcher(line).find() || second.matcher(line).find()) {
            counts.merge(type, 1, Integer::sum);
        }
    }

    private List<LeveledSection> extractNumberedSections(List<String> lines, Map<NumberType, Integer> depths) {
        List<LeveledSection> sections = new ArrayList<>();
        SectionDraft current = null;

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (current != null) {
                    current.content.append('\n');
                }
                continue;
            }

            Marker marker = detectMarker(trimmed);
            if (marker != null) {
                if (current != null) {
                    sections.add(current.build());
                }
                current = new SectionDraft(depths.getOrDefault(marker.type(), 0), marker.number(),
                        sectionTitle(trimmed), marker.type());
            } else if (current != null) {
                current.content.append(trimmed).append('\n');
            } else if (ALL_CAPS_HEADER.matcher(trimmed).matches() || KEYWORD_HEADER.matcher(trimmed).find()) {
                current = new SectionDraft(0, "", trimmed, NumberType.UNKNOWN);
            }
        }

        if (current != null) {
            sections.add(current.build());
        }
        return sections;
    }

    private List<LeveledSection> extractSectionsByHeaders(List<String> lines, List<String> warnings) {
        List<LeveledSection> sections = new ArrayList<>();
        SectionDraft current = null;

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty()) {
                if (current != null) {
                    current.content.append('\n');
                }
                continue;
            }

            boolean header = ALL_CAPS_HEADER.matcher(trimmed).matches()
                    || KEYWORD_HEADER.matcher(trimmed).find()
                    || (i + 1 < lines.size() && UNDERLINE.matcher(lines.get(i + 1).trim()).matches());
            if (header) {
                if (current != null) {
                    sections.add(current.build());
                }
                current = new SectionDraft(0, "", trimmed, NumberType.UNKNOWN);
            } else if (current != null && !UNDERLINE.matcher(trimmed).matches()) {
                current.content.append(trimmed).append('\n');
            }
        }

        if (current != null) {
            sections.add(current.build());
        }
        if (sections.isEmpty()) {
            warnings.add("Could not detect any sections in document");
        }
        return sections;
    }

    private List<GenericDefinition> extractDefinitions(List<String> lines, List<String> warnings) {
        List<GenericDefinition> definitions = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher means = QUOTED_MEANS.matcher(trimmed);
            if (means.find()) {
                definitions.add(new GenericDefinition(means.group(1), trimmed.substring(means.end()).trim()));
                continue;
            }
            Matcher refersTo = QUOTED_REFERS_TO.matcher(trimmed);
            if (refersTo.find()) {
                definitions.add(new GenericDefinition(refersTo.group(1), trimmed.substring(refersTo.end()).trim()));
                continue;
            }
            Matcher colon = COLON_DEFINITION.matcher(trimmed);
            if (colon.find()) {
                definitions.add(new GenericDefinition(colon.group(1).trim(), trimmed.substring(colon.end())));
            }
        }
        if (definitions.isEmpty()) {
            warnings.add("No definitions detected in document");
        }
        return definitions;
    }

    private static Marker detectMarker(String line) {
        String number = firstGroup(UPPER_ROMAN_DOT, line);
        if (number == null) {
            number = firstGroup(UPPER_ROMAN_PAREN, line);
        }
        if (number != null) {
            return new Marker(NumberType.UPPER_ROMAN, number);
        }
        number = firstGroup(ARABIC_DOT, line);
        if (number == null) {
            number = firstGroup(ARABIC_PAREN, line);
        }
        if (number != null) {
            return new Marker(NumberType.ARABIC, number);
        }
        number = firstGroup(UPPER_LETTER_DOT, line);
        if (number == null) {
            number = firstGroup(UPPER_LETTER_PAREN, line);
        }
        if (number != null) {
            return new Marker(NumberType.UPPER_LETTER, number);
        }
        number = firstGroup(LOWER_LETTER_DOT, line);
        if (number == null) {
            number = firstGroup(LOWER_LETTER_PAREN, line);
        }
        if (number != null) {
            return new Marker(NumberType.LOWER_LETTER, number);
        }
        number = firstGroup(LOWER_ROMAN_DOT, line);
        if (number == null) {
            number = firstGroup(LOWER_ROMAN_PAREN, line);
        }
        if (number != null && NumberingConverter.isRomanNumeral(number)) {
            return new Marker(NumberType.LOWER_ROMAN, number);
        }
        return null;
    }

    private static String firstGroup(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String sectionTitle(String line) {
        for (Pattern pattern : MARKER_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                String title = line.substring(matcher.end()).trim();
                for (String prefix : List.of("- ", "– ", "— ")) {
                    if (title.startsWith(prefix)) {
                        title = title.substring(prefix.length());
                        break;
                    }
                }
                return title;
            }
        }
        return "";
    }

    private record Marker(NumberType type, String number) {
    }

    private static final class SectionDraft {
        private final int level;
        private final String number;
        private final String title;
        private final NumberType numberType;
        private final StringBuilder content = new StringBuilder();

        private SectionDraft(int level, String number, String title, NumberType numberType) {
            this.level = level;
            this.number = number;
            this.title = title;
            this.numberType = numberType;
        }

        private LeveledSection build() {
            return new LeveledSection(level, number, title, content.toString().trim(), numberType);
        }
    }
}
