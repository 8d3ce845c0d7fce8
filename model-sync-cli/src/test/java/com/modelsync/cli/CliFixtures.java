package com.modelsync.cli;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Paths of the fixture files on the test classpath.
 */
final class CliFixtures {

    private CliFixtures() {
    }

    static Path fixture(String name) {
        URL url = CliFixtures.class.getClassLoader().getResource("fixtures/" + name);
        if (url == null) {
            throw new IllegalStateException("Missing fixture " + name);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid fixture location " + url, e);
        }
    }
}
