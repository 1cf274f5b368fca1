package com.martian.mro.loader;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Include search path configuration. The {@code mro.path} system property wins over the {@code
 * MROPATH} environment variable; both hold directories separated by {@link File#pathSeparator}.
 */
public final class MroPath {
    static final String PROPERTY = "mro.path";
    static final String ENV = "MROPATH";

    private MroPath() {}

    public static List<Path> fromEnvironment() {
        String value = System.getProperty(PROPERTY);
        if (value == null) {
            value = System.getenv(ENV);
        }
        return parse(value);
    }

    public static List<Path> parse(String value) {
        List<Path> paths = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return paths;
        }
        for (String entry : value.split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                paths.add(Path.of(entry.trim()));
            }
        }
        return paths;
    }
}
