package com.event.resolution.text;

import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Picks the first complete emoji out of a free-text emoji cell.
 *
 * <p>A complete emoji is a regional-indicator flag pair, or a base pictograph followed by an
 * optional variation selector, keycap mark, skin-tone modifier and tag characters, plus any
 * zero-width-joiner continuations. Digits, {@code #} and {@code *} only count when followed by
 * a variation selector or keycap mark. Box and square glyphs render poorly and are rejected.</p>
 */
public final class EmojiSelector {

    private static final Set<String> BLOCKED = Set.of(
            "⬜", "□", "◻", "⬛", "■", "▪", "▫", "◼", "◾",
            "◽", "◿", "▢", "▣", "▤", "▥", "▦", "▧", "▨", "▩");

    private static final int ZWJ = 0x200D;
    private static final int KEYCAP = 0x20E3;

    private EmojiSelector() {
    }

    /**
     * Returns the first usable emoji in {@code text}, else {@code fallback} (which may be null).
     * Only the first emoji is considered; a blocked first emoji falls back directly.
     */
    public static String select(String text, String fallback) {
        String first = findFirst(text);
        if (!first.isEmpty() && !BLOCKED.contains(first)) {
            return first;
        }
        return fallback;
    }

    /**
     * Returns the first complete emoji sequence in {@code text}, or an empty string.
     */
    public static String findFirst(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int end = matchAt(text, i, cp);
            if (end > i) {
                return text.substring(i, end);
            }
            i += Character.charCount(cp);
        }
        return "";
    }

    private static int matchAt(String text, int start, int cp) {
        int next = start + Character.charCount(cp);
        if (isRegionalIndicator(cp) && next < text.length() && isRegionalIndicator(text.codePointAt(next))) {
            return next + Character.charCount(text.codePointAt(next));
        }
        if (isKeycapBase(cp)) {
            int after = next < text.length() ? text.codePointAt(next) : -1;
            if (!isVariationSelector(after) && after != KEYCAP) {
                return start;
            }
        } else if (!isPictograph(cp)) {
            return start;
        }
        int pos = consumeModifiers(text, next);
        while (pos < text.length() && text.codePointAt(pos) == ZWJ) {
            int joinedStart = pos + 1;
            if (joinedStart >= text.length() || !isPictograph(text.codePointAt(joinedStart))) {
                break;
            }
            pos = consumeModifiers(text, joinedStart + Character.charCount(text.codePointAt(joinedStart)));
        }
        return pos;
    }

    private static int consumeModifiers(String text, int pos) {
        pos = consumeIf(text, pos, EmojiSelector::isVariationSelector);
        pos = consumeIf(text, pos, cp -> cp == KEYCAP);
        pos = consumeIf(text, pos, EmojiSelector::isSkinTone);
        while (pos < text.length() && isTag(text.codePointAt(pos))) {
            pos += Character.charCount(text.codePointAt(pos));
        }
        return pos;
    }

    private static int consumeIf(String text, int pos, IntPredicate predicate) {
        if (pos < text.length() && predicate.test(text.codePointAt(pos))) {
            return pos + Character.charCount(text.codePointAt(pos));
        }
        return pos;
    }

    static boolean isPictograph(int cp) {
        return (cp >= 0x1F000 && cp <= 0x1FAFF)
                || (cp >= 0x2600 && cp <= 0x27BF)
                || (cp >= 0x2300 && cp <= 0x23FF)
                || (cp >= 0x2B05 && cp <= 0x2B55)
                || (cp >= 0x2194 && cp <= 0x21AA)
                || (cp >= 0x2934 && cp <= 0x2935)
                || cp == 0x25AA || cp == 0x25AB || cp == 0x25B6 || cp == 0x25C0
                || (cp >= 0x25FB && cp <= 0x25FE)
                || cp == 0x00A9 || cp == 0x00AE || cp == 0x203C || cp == 0x2049
                || cp == 0x2122 || cp == 0x2139 || cp == 0x24C2
                || cp == 0x3030 || cp == 0x303D || cp == 0x3297 || cp == 0x3299;
    }

    private static boolean isRegionalIndicator(int cp) {
        return cp >= 0x1F1E6 && cp <= 0x1F1FF;
    }

    private static boolean isKeycapBase(int cp) {
        return (cp >= '0' && cp <= '9') || cp == '#' || cp == '*';
    }

    private static boolean isVariationSelector(int cp) {
        return cp == 0xFE0E || cp == 0xFE0F;
    }

    private static boolean isSkinTone(int cp) {
        return cp >= 0x1F3FB && cp <= 0x1F3FF;
    }

    private static boolean isTag(int cp) {
        return cp >= 0xE0020 && cp <= 0xE007F;
    }
}
