package com.groundtruth.extractor.config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Immutable pattern and vocabulary tables shared by every detector. Built once per run and
 * passed explicitly; nothing here is mutated after construction.
 */
public record DetectionConfig(
        Pattern email,
        Pattern uuid,
        Pattern ipv4,
        Pattern url,
        Pattern iso8601,
        Pattern linkColumn,
        List<String> emailHints,
        List<String> phoneHints,
        List<String> uuidHints,
        List<String> timeKeywords,
        List<String> linkSourceRanks,
        List<String> linkTargetRanks,
        int minPhoneDigits,
        int maxPhoneDigits,
        long epochMillisThreshold,
        long epochLowerBound,
        long epochUpperBound,
        int maxRelationalPairs
) {
    public static final Pattern EMAIL =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    public static final Pattern UUID =
            Pattern.compile("\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b");
    public static final Pattern IPV4 =
            Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");
    public static final Pattern URL =
            Pattern.compile("https?://(?:[-\\w.]|%[\\da-fA-F]{2})+");
    public static final Pattern ISO8601 =
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}(?:[ T]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})?)?\\b");
    public static final Pattern LINK_COLUMN =
            Pattern.compile("(?:^|_)(user|sender|from|src|author|owner|recipient|to|dst|peer).*_?id$",
                    Pattern.CASE_INSENSITIVE);

    public DetectionConfig {
        emailHints = List.copyOf(emailHints);
        phoneHints = List.copyOf(phoneHints);
        uuidHints = List.copyOf(uuidHints);
        timeKeywords = List.copyOf(timeKeywords);
        linkSourceRanks = List.copyOf(linkSourceRanks);
        linkTargetRanks = List.copyOf(linkTargetRanks);
        if (minPhoneDigits < 1 || maxPhoneDigits < minPhoneDigits) {
            throw new IllegalArgumentException(
                    "Invalid phone digit range [" + minPhoneDigits + "," + maxPhoneDigits + "]");
        }
        if (epochUpperBound <= epochLowerBound) {
            throw new IllegalArgumentException(
                    "Invalid epoch window (" + epochLowerBound + "," + epochUpperBound + ")");
        }
        if (maxRelationalPairs < 1) {
            throw new IllegalArgumentException("maxRelationalPairs must be positive: " + maxRelationalPairs);
        }
    }

    public static DetectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .emailHints(emailHints)
                .phoneHints(phoneHints)
                .uuidHints(uuidHints)
                .timeKeywords(timeKeywords)
                .phoneDigits(minPhoneDigits, maxPhoneDigits)
                .epochWindow(epochLowerBound, epochUpperBound)
                .maxRelationalPairs(maxRelationalPairs);
    }

    public static class Builder {
        private List<String> emailHints = List.of("email", "e_mail", "mail");
        private List<String> phoneHints = List.of("phone", "tel", "mobile", "msisdn");
        private List<String> uuidHints = List.of("uuid", "guid");
        private List<String> timeKeywords =
                List.of("time", "date", "timestamp", "created", "modified", "updated", "duration");
        private int minPhoneDigits = 10;
        private int maxPhoneDigits = 15;
        // 2000-01-01T00:00:00Z and 2030-01-01T00:00:00Z, both exclusive
        private long epochLowerBound = 946_684_800L;
        private long epochUpperBound = 1_893_456_000L;
        private int maxRelationalPairs = 2;

        public Builder emailHints(List<String> hints) {
            this.emailHints = hints;
            return this;
        }

        public Builder phoneHints(List<String> hints) {
            this.phoneHints = hints;
            return this;
        }

        public Builder uuidHints(List<String> hints) {
            this.uuidHints = hints;
            return this;
        }

        public Builder timeKeywords(List<String> keywords) {
            this.timeKeywords = keywords;
            return this;
        }

        public Builder phoneDigits(int min, int max) {
            this.minPhoneDigits = min;
            this.maxPhoneDigits = max;
            return this;
        }

        public Builder epochWindow(long lowerExclusive, long upperExclusive) {
            this.epochLowerBound = lowerExclusive;
            this.epochUpperBound = upperExclusive;
            return this;
        }

        public Builder maxRelationalPairs(int maxRelationalPairs) {
            this.maxRelationalPairs = maxRelationalPairs;
            return this;
        }

        /**
         * Applies every non-null field of the settings over the current values.
         */
        public Builder settings(DetectionSettings settings) {
            if (settings.emailHints() != null) emailHints(settings.emailHints());
            if (settings.phoneHints() != null) phoneHints(settings.phoneHints());
            if (settings.uuidHints() != null) uuidHints(settings.uuidHints());
            if (settings.timeKeywords() != null) timeKeywords(settings.timeKeywords());
            if (settings.minPhoneDigits() != null) minPhoneDigits = settings.minPhoneDigits();
            if (settings.maxPhoneDigits() != null) maxPhoneDigits = settings.maxPhoneDigits();
            if (settings.epochLowerBound() != null) epochLowerBound = settings.epochLowerBound();
            if (settings.epochUpperBound() != null) epochUpperBound = settings.epochUpperBound();
            if (settings.maxRelationalPairs() != null) maxRelationalPairs(settings.maxRelationalPairs());
            return this;
        }

        public DetectionConfig build() {
            return new DetectionConfig(
                    EMAIL, UUID, IPV4, URL, ISO8601, LINK_COLUMN,
                    emailHints, phoneHints, uuidHints, timeKeywords,
                    List.of("sender", "from", "src", "author", "owner", "user"),
                    List.of("recipient", "to", "dst", "peer", "user"),
                    minPhoneDigits, maxPhoneDigits,
                    1_000_000_000_000L,
                    epochLowerBound, epochUpperBound,
                    maxRelationalPairs);
        }
    }
}
