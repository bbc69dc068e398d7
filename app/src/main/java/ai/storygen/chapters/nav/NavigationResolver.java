package ai.storygen.chapters.nav;

import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.model.ExtractionErrorKind;
import ai.storygen.chapters.segment.ChapterPatterns;
import ai.storygen.chapters.util.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves navigation entries into chapter descriptors ordered by chapter designator.
 *
 * <p>Some books list the chapter number and the chapter subtitle as two entries pointing at the same document;
 * such entries are joined into one label before it is parsed. Front and back matter entries such as "Cover" or
 * "Dedication" are dropped.
 */
public class NavigationResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(NavigationResolver.class);

    private static final String PROLOGUE_SEQ = "PROLOGUE";
    private static final String EPILOGUE_SEQ = "EPILOGUE";

    public List<ChapterDescriptor> resolve(List<NavigationEntry> entries) {
        Map<String, List<String>> labelsBySource = new LinkedHashMap<>();
        for (NavigationEntry entry : entries) {
            String label = TextNormalizer.normalizeSpacing(entry.label());
            if (ChapterPatterns.isBlacklistedTitle(label)) {
                LOGGER.debug("Skipping navigation entry \"{}\"", label);
                continue;
            }
            labelsBySource.computeIfAbsent(documentOf(entry.source()), key -> new ArrayList<>()).add(label);
        }

        List<ChapterDescriptor> descriptors = new ArrayList<>(labelsBySource.size());
        for (Map.Entry<String, List<String>> grouped : labelsBySource.entrySet()) {
            String joinedLabel = TextNormalizer.normalizeSpacing(String.join(" ", grouped.getValue()));
            if (joinedLabel.isEmpty() || ChapterPatterns.isBlacklistedTitle(joinedLabel)) {
                continue;
            }
            descriptors.add(parseLabel(joinedLabel, grouped.getKey()));
        }
        if (descriptors.isEmpty()) {
            throw new ChapterExtractionException(ExtractionErrorKind.EMPTY_NAVIGATION,
                    "No chapter entries found among " + entries.size() + " navigation entries");
        }
        return descriptors.stream()
                .sorted(Comparator.comparing(ChapterDescriptor::sortKey))
                .collect(Collectors.toList());
    }

    static ChapterDescriptor parseLabel(String label, String source) {
        List<String> tokens = TextNormalizer.tokens(label);
        if (!tokens.isEmpty() && tokens.get(0).equalsIgnoreCase("chapter")) {
            tokens = tokens.subList(1, tokens.size());
        }
        if (tokens.isEmpty()) {
            return new ChapterDescriptor("", "", source);
        }
        String seq = normalizeSeq(tokens.get(0));
        String name = String.join(" ", tokens.subList(1, tokens.size()));
        return new ChapterDescriptor(seq, name, source);
    }

    static String normalizeSeq(String token) {
        String seq = token.endsWith(":") ? token.substring(0, token.length() - 1) : token;
        String lower = seq.toLowerCase(Locale.ROOT);
        if (lower.startsWith("prologue")) {
            return PROLOGUE_SEQ;
        }
        if (lower.startsWith("epilogue")) {
            return EPILOGUE_SEQ;
        }
        return seq;
    }

    private static String documentOf(String source) {
        int fragment = source.indexOf('#');
        return fragment < 0 ? source : source.substring(0, fragment);
    }
}
