package com.event.resolution.text;

import com.event.resolution.rules.DefaultNormalizationRules;
import com.event.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixes over-capitalized event titles and derives short display names.
 * Applied once per finalized event, never per row.
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private static final int MIN_RECASE_LENGTH = 5;
    private static final double UPPERCASE_RATIO = 0.5;

    private final NormalizationEngine titleRepairEngine;
    private final NormalizationEngine shortNameEngine;

    public NameNormalizer() {
        this(DefaultNormalizationRules.createTitleRepairEngine(), DefaultNormalizationRules.createShortNameEngine());
    }

    public NameNormalizer(NormalizationEngine titleRepairEngine, NormalizationEngine shortNameEngine) {
        this.titleRepairEngine = titleRepairEngine;
        this.shortNameEngine = shortNameEngine;
    }

    /**
     * Title-cases names whose letters are mostly uppercase, then repairs the words that
     * title-casing breaks. Other names are returned unchanged.
     */
    public String normalize(String name) {
        if (name == null || !isMostlyUppercase(name)) {
            return name;
        }
        String result = titleRepairEngine.apply(titleCase(name));
        log.debug("Recased mostly-caps name '{}' -> '{}'", name, result);
        return result;
    }

    /**
     * Derives the abbreviated display name. Always applied, independent of recasing.
     */
    public String shortName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return shortNameEngine.apply(name).strip();
    }

    static boolean isMostlyUppercase(String name) {
        if (name.length() <= MIN_RECASE_LENGTH) {
            return false;
        }
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return letters > 0 && (double) upper / letters > UPPERCASE_RATIO;
    }

    /**
     * Uppercases the first letter of every run of letters and lowercases the rest.
     * Any non-letter, including an apostrophe or digit, starts a new run.
     */
    static String titleCase(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean previousLetter = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toTitleCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }
}
