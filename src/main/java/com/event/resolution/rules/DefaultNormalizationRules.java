package com.event.resolution.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Built-in rule sets for tags, over-capitalized titles and short display names.
 */
public final class DefaultNormalizationRules {

    private static final String CONNECTIVE_WORDS = "A|And|Of|The|Or|In|At|On|For|To|With|From|By";
    private static final String WEEKDAYS = "Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday";
    private static final int LONG_NAME_LENGTH = 40;

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Engine for the tag steps that run before rewrite-rule lookup.
     */
    public static NormalizationEngine createTagSplitEngine() {
        return new NormalizationEngine(getTagSplitRules());
    }

    /**
     * Engine for the tag steps that run after rewrite-rule lookup.
     */
    public static NormalizationEngine createTagCasingEngine() {
        return new NormalizationEngine(getTagCasingRules());
    }

    /**
     * Engine that repairs a title-cased event name.
     */
    public static NormalizationEngine createTitleRepairEngine() {
        return new NormalizationEngine(getTitleRepairRules());
    }

    /**
     * Engine that derives a short display name from an event name.
     */
    public static NormalizationEngine createShortNameEngine() {
        return new NormalizationEngine(getShortNameRules());
    }

    /**
     * Word splitting and name-prefix repair for raw hashtag fragments.
     */
    public static List<NormalizationRule> getTagSplitRules() {
        return List.of(
                // "LiveMusic" -> "Live Music", "NYCMarathon" -> "NYC Marathon"
                NormalizationRule.builder()
                        .name("tag-camel-case")
                        .pattern("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                // "Carrie2" -> "Carrie 2"
                NormalizationRule.builder()
                        .name("tag-digit-spacing")
                        .pattern("([a-zA-Z])(\\d+)")
                        .replacement("$1 $2")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("tag-mc-prefix")
                        .pattern("\\bMc\\s+([A-Z])")
                        .replacement("Mc$1")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("tag-o-prefix")
                        .pattern("\\bO\\s+([A-Z])")
                        .replacement("O'$1")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("tag-saint")
                        .pattern("\\bSt\\s+([A-Z])")
                        .replacement("St. $1")
                        .priority(40)
                        .build()
        );
    }

    /**
     * Casing fixes applied to a tag once its final wording is known.
     */
    public static List<NormalizationRule> getTagCasingRules() {
        return List.of(
                connectiveWordRule(10),

                NormalizationRule.builder()
                        .name("tag-number-k")
                        .pattern("\\b(\\d+)\\s+K\\b")
                        .replacement("$1K")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("tag-number-d")
                        .pattern("\\b(\\d+)\\s+D\\b")
                        .replacement("$1D")
                        .priority(20)
                        .build(),

                ordinalSuffixRule(30),

                // "Q&a" -> "Q&A"
                NormalizationRule.builder()
                        .name("tag-ampersand")
                        .pattern("\\b([A-Z])&([a-z])\\b")
                        .replacement(m -> m.group(1) + "&" + m.group(2).toUpperCase(Locale.ROOT))
                        .priority(40)
                        .build()
        );
    }

    /**
     * Repairs for words that title-casing gets wrong.
     */
    public static List<NormalizationRule> getTitleRepairRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("title-apostrophe")
                        .pattern("[\u2018\u2019]")
                        .replacement("'")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("title-possessive-s")
                        .pattern("['\u2019]S\\b")
                        .replacement("'s")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("title-contraction-t")
                        .pattern("['\u2019]T\\b")
                        .replacement("'t")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("title-contraction-d")
                        .pattern("['\u2019]D\\b")
                        .replacement("'d")
                        .priority(20)
                        .build(),

                connectiveWordRule(30),

                NormalizationRule.builder()
                        .name("title-with-shorthand")
                        .pattern("\\bW/")
                        .replacement("w/")
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("title-roman-numeral")
                        .pattern("\\b(I|Ii|Iii|Iv|V|Vi|Vii|Viii|Ix|X|Xi|Xii)\\b")
                        .replacement(m -> m.group(1).toUpperCase(Locale.ROOT))
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("title-film-format")
                        .pattern("\\b(35|65|70)Mm\\b")
                        .replacement("$1mm")
                        .priority(60)
                        .build(),

                ordinalSuffixRule(70),

                // "Dj" -> "DJ", "Tv" -> "TV"
                NormalizationRule.builder()
                        .name("title-two-consonants")
                        .pattern("\\b([BCDFGHJKLMNPQRSTVWXYZ])([bcdfghjklmnpqrstvwxyz])\\b")
                        .replacement(m -> m.group().toUpperCase(Locale.ROOT))
                        .priority(80)
                        .build()
        );
    }

    /**
     * Strips category prefixes, performer and venue suffixes, asides and date ranges.
     */
    public static List<NormalizationRule> getShortNameRules() {
        List<NormalizationRule> rules = new ArrayList<>();

        String[] prefixes = {
                "^Exhibition\\s*[\u2013:\\-]\\s*",
                "^Talks?\\s*[:\\-]\\s*",
                "^Screening\\s*[:\\-]\\s*",
                "^Performance\\s*[:\\-]\\s*",
                "^Concert\\s*[:\\-]\\s*",
                "^Event\\s*[:\\-]\\s*"
        };
        for (int i = 0; i < prefixes.length; i++) {
            rules.add(NormalizationRule.builder()
                    .name("short-prefix-" + i)
                    .pattern(prefixes[i])
                    .replacement("")
                    .caseInsensitive()
                    .priority(10)
                    .build());
        }

        // "Film Night: Movie Name" -> "Movie Name" for long names with a real subtitle
        rules.add(NormalizationRule.builder()
                .name("short-subtitle")
                .pattern("^[^:]*:(.*)$")
                .flags(Pattern.DOTALL)
                .replacement(m -> m.group(1).strip())
                .when(s -> s.length() > LONG_NAME_LENGTH && s.contains(":")
                        && s.substring(s.indexOf(':') + 1).strip().length() > 3)
                .priority(20)
                .build());

        rules.add(NormalizationRule.builder()
                .name("short-trailing-clause")
                .pattern("\\s+[\u2013\\-]\\s+.*$")
                .replacement("")
                .when(s -> s.length() > LONG_NAME_LENGTH)
                .priority(30)
                .build());

        rules.add(suffixRule("short-parenthetical", "\\s*\\([^)]*\\)", false, 40));
        rules.add(suffixRule("short-qa-with", "\\s*[-\u2013]\\s*Q&A\\s+with\\s+.*$", false, 50));
        rules.add(suffixRule("short-pipe-with", "\\s*\\\\?\\s*\\|\\s*with\\s+.*$", false, 51));
        rules.add(suffixRule("short-w-slash", "\\s+w/\\s+.*$", false, 52));
        rules.add(suffixRule("short-with", "\\s+with\\s+.*$", true, 53));
        rules.add(suffixRule("short-at-venue", "\\s+at\\s+.*$", true, 54));
        rules.add(suffixRule("short-at-sign", "\\s*@.*$", false, 55));
        rules.add(suffixRule("short-in-nyc", "\\s+in\\s+NYC\\s*[-\u2013].*$", false, 56));
        rules.add(suffixRule("short-weekday-range", "\\s*[-\u2013]\\s*(?:" + WEEKDAYS + "),?\\s+.*$", false, 57));

        rules.add(NormalizationRule.builder()
                .name("short-collapse-spaces")
                .pattern("\\s+")
                .replacement(" ")
                .priority(90)
                .build());

        return List.copyOf(rules);
    }

    /**
     * Lowercases connective words anywhere except at the start of the text.
     */
    public static NormalizationRule connectiveWordRule(int priority) {
        return NormalizationRule.builder()
                .name("connective-words")
                .pattern("(?<!^)\\b(" + CONNECTIVE_WORDS + ")\\b")
                .replacement(m -> m.group(1).toLowerCase(Locale.ROOT))
                .priority(priority)
                .build();
    }

    /**
     * "38Th" -> "38th", "1St" -> "1st".
     */
    public static NormalizationRule ordinalSuffixRule(int priority) {
        return NormalizationRule.builder()
                .name("ordinal-suffix")
                .pattern("(\\d+)(St|Nd|Rd|Th)\\b")
                .replacement(m -> m.group(1) + m.group(2).toLowerCase(Locale.ROOT))
                .priority(priority)
                .build();
    }

    private static NormalizationRule suffixRule(String name, String pattern, boolean caseInsensitive, int priority) {
        NormalizationRule.Builder builder = NormalizationRule.builder()
                .name(name)
                .pattern(pattern)
                .replacement("")
                .priority(priority);
        if (caseInsensitive) {
            builder.caseInsensitive();
        }
        return builder.build();
    }
}
