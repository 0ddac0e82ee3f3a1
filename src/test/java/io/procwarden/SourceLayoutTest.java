package io.procwarden;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class SourceLayoutTest {
    @Test
    void mainSourcesKeepDocCommentsInPackageInfoOnly() throws Exception {
        Path mainSources = Path.of("src", "main", "java");
        Assumptions.assumeTrue(Files.isDirectory(mainSources));

        List<Path> sources;
        try (Stream<Path> files = Files.walk(mainSources)) {
            sources = files.filter(p -> p.toString().endsWith(".java")).toList();
        }
        List<String> offenders = new ArrayList<>();
        for (Path file : sources) {
            if (!file.getFileName().toString().equals("package-info.java") && read(file).contains("/**")) {
                offenders.add(mainSources.relativize(file).toString());
            }
        }

        Assertions.assertTrue(offenders.isEmpty(), () -> "doc comments outside package-info: " + offenders);
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
