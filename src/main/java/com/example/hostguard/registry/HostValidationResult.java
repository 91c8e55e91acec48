package com.example.hostguard.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of {@link HostRegistry#validate(String)}. Suggestions are only
 * present when the query did not resolve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostValidationResult {

    private boolean valid;
    private Host host;
    private String originalQuery;

    @Builder.Default
    private List<HostSuggestion> suggestions = new ArrayList<>();

    private String errorMessage;

    public static HostValidationResult valid(Host host, String query) {
        return HostValidationResult.builder()
                .valid(true)
                .host(host)
                .originalQuery(query)
                .build();
    }

    public static HostValidationResult invalid(String query, List<HostSuggestion> suggestions, String errorMessage) {
        return HostValidationResult.builder()
                .valid(false)
                .originalQuery(query)
                .suggestions(new ArrayList<>(suggestions))
                .errorMessage(errorMessage)
                .build();
    }

    @JsonIgnore
    public String getSuggestionText() {
        if (valid) {
            return String.format("Host '%s' is valid", host.getHostname());
        }
        if (suggestions.isEmpty()) {
            return String.format("Host '%s' not found. No similar hosts in inventory.", originalQuery);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Host '%s' not found in inventory.%n", originalQuery));
        sb.append("Did you mean one of these?");
        for (HostSuggestion suggestion : suggestions) {
            sb.append(String.format("%n  - %s (%d%% match)", suggestion.hostname(),
                    Math.round(suggestion.score() * 100)));
        }
        return sb.toString();
    }
}
