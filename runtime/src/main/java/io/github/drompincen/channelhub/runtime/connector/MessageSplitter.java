package io.github.drompincen.channelhub.runtime.connector;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long replies for platforms with a per-message character limit. Prefers paragraph breaks,
 * then line breaks, then sentence ends, then spaces; a break point is only used if it keeps at least
 * 30% of the limit in the current chunk. Falls back to a hard cut.
 */
public final class MessageSplitter {

    private static final double MIN_FILL = 0.3;

    private MessageSplitter() {}

    public static List<String> split(String text, int maxLength) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) return chunks;
        if (text.length() <= maxLength) {
            chunks.add(text);
            return chunks;
        }

        double threshold = maxLength * MIN_FILL;
        String remaining = text;
        while (!remaining.isEmpty()) {
            if (remaining.length() <= maxLength) {
                chunks.add(remaining);
                break;
            }
            String window = remaining.substring(0, maxLength);

            int at = window.lastIndexOf("\n\n");
            if (at > threshold) {
                chunks.add(remaining.substring(0, at).stripTrailing());
                remaining = remaining.substring(at + 2).stripLeading();
                continue;
            }
            at = window.lastIndexOf('\n');
            if (at > threshold) {
                chunks.add(remaining.substring(0, at).stripTrailing());
                remaining = remaining.substring(at + 1).stripLeading();
                continue;
            }
            at = Math.max(window.lastIndexOf(". "), Math.max(window.lastIndexOf("! "), window.lastIndexOf("? ")));
            if (at > threshold) {
                chunks.add(remaining.substring(0, at + 1).stripTrailing());
                remaining = remaining.substring(at + 2).stripLeading();
                continue;
            }
            at = window.lastIndexOf(' ');
            if (at > threshold) {
                chunks.add(remaining.substring(0, at).stripTrailing());
                remaining = remaining.substring(at + 1).stripLeading();
                continue;
            }
            chunks.add(window);
            remaining = remaining.substring(maxLength);
        }
        chunks.removeIf(String::isEmpty);
        return chunks;
    }

    /** Prefixes every chunk after the first with {@code [i/n]} and a newline when there are several. */
    public static List<String> label(List<String> chunks) {
        if (chunks.size() <= 1) return chunks;
        List<String> labelled = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            labelled.add(i == 0 ? chunks.get(i) : "[" + (i + 1) + "/" + chunks.size() + "]\n" + chunks.get(i));
        }
        return labelled;
    }
}
