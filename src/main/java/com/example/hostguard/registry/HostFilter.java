package com.example.hostguard.registry;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate composition for {@link HostRegistry#filter(HostFilter)}. Every
 * criterion left null matches everything.
 */
@Value
@Builder
public class HostFilter {

    String environment;
    String group;
    HostSource source;
    /** Case-insensitive regular expression searched within the hostname */
    String pattern;

    public static HostFilter all() {
        return HostFilter.builder().build();
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if the pattern is not a valid regex
     */
    public Predicate<Host> toPredicate() {
        Pattern compiled = pattern != null && !pattern.isBlank()
                ? Pattern.compile(pattern, Pattern.CASE_INSENSITIVE) : null;
        return host -> {
            if (environment != null && !environment.equalsIgnoreCase(host.getEnvironment())) return false;
            if (group != null && host.getGroups().stream().noneMatch(group::equalsIgnoreCase)) return false;
            if (source != null && host.getSource() != source) return false;
            return compiled == null || compiled.matcher(host.getHostname()).find();
        };
    }

    /** Stable key for caching filter results. */
    public String cacheKey() {
        return String.join("|",
                environment == null ? "" : environment.toLowerCase(Locale.ROOT),
                group == null ? "" : group.toLowerCase(Locale.ROOT),
                source == null ? "" : source.getTag(),
                pattern == null ? "" : pattern);
    }
}
