package com.questrail.lockstep.generator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters handed to a {@link SequenceGenerator}.
 *
 * <ul>
 *   <li>{@code maxLength} - upper bound on the number of generated operations</li>
 *   <li>{@code startLevel} - levels the system is advanced before the first call</li>
 *   <li>{@code proposalWeight} - relative weight (0..100) of propose calls among
 *       generated operations</li>
 *   <li>{@code options} - free-form domain options, interpreted by the generator</li>
 * </ul>
 */
public record GeneratorConfig(
    int maxLength,
    long startLevel,
    int proposalWeight,
    Map<String, String> options
) {
    public GeneratorConfig {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0");
        }
        if (startLevel < 0) {
            throw new IllegalArgumentException("startLevel must be >= 0");
        }
        if (proposalWeight < 0 || proposalWeight > 100) {
            throw new IllegalArgumentException("proposalWeight must be within 0..100");
        }
        Objects.requireNonNull(options, "options");
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public Optional<String> option(String key) {
        return Optional.ofNullable(options.get(key));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxLength = 100;
        private long startLevel = 0;
        private int proposalWeight = 50;
        private final Map<String, String> options = new LinkedHashMap<>();

        public Builder withMaxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder withStartLevel(long startLevel) {
            this.startLevel = startLevel;
            return this;
        }

        public Builder withProposalWeight(int proposalWeight) {
            this.proposalWeight = proposalWeight;
            return this;
        }

        public Builder withOption(String key, String value) {
            options.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(maxLength, startLevel, proposalWeight, options);
        }
    }
}
