package com.event.resolution.rules;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rule for rewriting event text using regex pattern matching.
 * Rules have priority ordering, an optional guard on the whole input, and either a
 * template replacement ({@code $1} style) or a computed one.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Function<MatchResult, String> replacer;
    private final Predicate<String> condition;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, builder.flags);
        this.replacement = builder.replacement;
        this.replacer = builder.replacer;
        this.condition = builder.condition;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Checks whether the rule's guard accepts the given input.
     * Rules without a guard apply to every input.
     */
    public boolean appliesTo(String input) {
        return condition == null || condition.test(input);
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        if (!appliesTo(input)) {
            return input;
        }
        Matcher matcher = pattern.matcher(input);
        if (replacer != null) {
            return matcher.replaceAll(m -> Matcher.quoteReplacement(replacer.apply(m)));
        }
        return matcher.replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private Function<MatchResult, String> replacer;
        private Predicate<String> condition;
        private int flags;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder replacement(Function<MatchResult, String> replacer) {
            this.replacer = replacer;
            return this;
        }

        public Builder caseInsensitive() {
            this.flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            return this;
        }

        public Builder flags(int flags) {
            this.flags |= flags;
            return this;
        }

        /**
         * Only rewrite inputs accepted by the given predicate.
         */
        public Builder when(Predicate<String> condition) {
            this.condition = condition;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            if (replacement == null && replacer == null) {
                throw new NullPointerException("replacement is required");
            }
            return new NormalizationRule(this);
        }
    }
}
