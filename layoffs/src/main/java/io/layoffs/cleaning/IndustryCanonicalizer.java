package io.layoffs.cleaning;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites industry variants to one label. Rules are tried in order and the first whose prefix matches
 * (ignoring case) wins; values no rule matches pass through unchanged.
 */
public final class IndustryCanonicalizer {
    public record PrefixRule(String prefix, String label) {
        public PrefixRule {
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(label, "label");
            if (prefix.isBlank()) throw new IllegalArgumentException("prefix must not be blank");
            if (label.isBlank()) throw new IllegalArgumentException("label must not be blank");
        }

        boolean matches(String value) {
            return value.regionMatches(true, 0, prefix, 0, prefix.length());
        }
    }

    private final List<PrefixRule> rules;

    public IndustryCanonicalizer(List<PrefixRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /** The variants seen in the layoffs data: "Crypto", "CryptoCurrency", "Crypto Currency". */
    public static IndustryCanonicalizer defaults() {
        return new IndustryCanonicalizer(List.of(new PrefixRule("Crypto", "Crypto")));
    }

    /**
     * Parses {@code PREFIX=LABEL} entries; order is kept. A bare {@code PREFIX} maps to itself.
     *
     * @throws IllegalArgumentException on an empty prefix or label
     */
    public static IndustryCanonicalizer parse(List<String> entries) {
        List<PrefixRule> rules = new ArrayList<>(entries.size());
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) continue;
            int eq = entry.indexOf('=');
            String prefix = (eq < 0 ? entry : entry.substring(0, eq)).trim();
            String label = (eq < 0 ? prefix : entry.substring(eq + 1)).trim();
            rules.add(new PrefixRule(prefix, label));
        }
        return new IndustryCanonicalizer(rules);
    }

    public String canonicalize(String industry) {
        if (industry == null) return null;
        for (PrefixRule rule : rules) {
            if (rule.matches(industry)) return rule.label();
        }
        return industry;
    }

    public List<PrefixRule> rules() { return rules; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PrefixRule r : rules) {
            if (sb.length() > 0) sb.append(',');
            sb.append(r.prefix()).append('=').append(r.label());
        }
        return sb.length() == 0 ? "<none>" : sb.toString();
    }
}
