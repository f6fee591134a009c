package com.sandkev.poolfees.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {
    private Fixtures() {}

    public static String read(String resource) {
        try (InputStream is = Fixtures.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found on classpath: " + resource);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + resource, e);
        }
    }
}
