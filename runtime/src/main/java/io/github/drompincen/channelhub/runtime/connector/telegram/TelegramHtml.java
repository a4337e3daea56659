package io.github.drompincen.channelhub.runtime.connector.telegram;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts agent output to Telegram's HTML parse mode. Only the tags Telegram accepts survive;
 * everything else is escaped, and common markdown is mapped onto those tags.
 */
final class TelegramHtml {

    private static final Pattern ALLOWED_TAG = Pattern.compile(
            "</?(?:b|i|u|s|code|pre|a|tg-spoiler|tg-emoji|blockquote)(?:\\s[^>]*)?/?>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]*>");

    private static final Pattern CODE_BLOCK = Pattern.compile("```\\w*\\n?([\\s\\S]*?)```");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*(.+?)\\*\\*");
    private static final Pattern BOLD_UNDERSCORES = Pattern.compile("__(.+?)__");
    private static final Pattern ITALIC_UNDERSCORE = Pattern.compile("(?<![a-zA-Z0-9])_([^_]+)_(?![a-zA-Z0-9])");
    private static final Pattern ITALIC_STAR = Pattern.compile("(?<!\\*)\\*([^*]+)\\*(?!\\*)");
    private static final Pattern STRIKE = Pattern.compile("~~(.+?)~~");

    private TelegramHtml() {}

    static String toHtml(String content) {
        StringBuilder escaped = new StringBuilder(content.length() + 16);
        Matcher tags = ALLOWED_TAG.matcher(content);
        int last = 0;
        while (tags.find()) {
            escaped.append(escape(content.substring(last, tags.start())));
            escaped.append(tags.group());
            last = tags.end();
        }
        escaped.append(escape(content.substring(last)));

        String html = CODE_BLOCK.matcher(escaped).replaceAll("<pre>$1</pre>");
        html = INLINE_CODE.matcher(html).replaceAll("<code>$1</code>");
        html = BOLD_STARS.matcher(html).replaceAll("<b>$1</b>");
        html = BOLD_UNDERSCORES.matcher(html).replaceAll("<b>$1</b>");
        html = ITALIC_UNDERSCORE.matcher(html).replaceAll("<i>$1</i>");
        html = ITALIC_STAR.matcher(html).replaceAll("<i>$1</i>");
        return STRIKE.matcher(html).replaceAll("<s>$1</s>");
    }

    /** Plain-text fallback when Telegram rejects the HTML. */
    static String stripTags(String content) {
        return ANY_TAG.matcher(content).replaceAll("")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
