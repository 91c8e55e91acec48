package com.example.hostguard.support;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

public final class Fixtures {

    private Fixtures() {}

    public static Path inventory(String name) {
        URL url = Fixtures.class.getResource("/inventory/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
