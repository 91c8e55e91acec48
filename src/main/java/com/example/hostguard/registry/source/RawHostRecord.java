package com.example.hostguard.registry.source;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A host as an inventory source reports it, before it is merged into the
 * registry.
 */
@Value
@Builder
public class RawHostRecord {

    String name;
    String address;
    @Singular
    List<String> aliases;
    @Singular
    List<String> groups;
    String environment;
    @Singular("metadataEntry")
    Map<String, String> metadata;
}
