package com.edafunc.service;

import lombok.extern.slf4j.Slf4j;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the routing file for a handler.
 *
 * Lookup order:
 *   1. eda.routing.file, when set (no fallback if it does not exist)
 *   2. routing.yaml in the handler class's directory
 *      (exploded classes: the package directory; jar: the jar's directory)
 *   3. routing.yaml in the working directory
 */
@Slf4j
public final class RoutingFileLocator {

    public static final String FILE_NAME = "routing.yaml";

    private RoutingFileLocator() {
    }

    public static Optional<Path> locate(String configuredFile, Class<?> handlerClass, Path workingDirectory) {
        if (configuredFile != null && !configuredFile.isBlank()) {
            Path configured = Path.of(configuredFile);
            return Files.isRegularFile(configured) ? Optional.of(configured) : Optional.empty();
        }

        List<Path> candidates = new ArrayList<>(handlerDirectories(handlerClass));
        if (workingDirectory != null) {
            candidates.add(workingDirectory);
        }
        return candidates.stream()
                .map(dir -> dir.resolve(FILE_NAME))
                .filter(Files::isRegularFile)
                .findFirst();
    }

    static List<Path> handlerDirectories(Class<?> handlerClass) {
        if (handlerClass == null) {
            return List.of();
        }
        try {
            CodeSource codeSource = handlerClass.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                return List.of();
            }
            Path location = Path.of(codeSource.getLocation().toURI());
            if (Files.isDirectory(location)) {
                Package pkg = handlerClass.getPackage();
                String packagePath = pkg == null ? "" : pkg.getName().replace('.', '/');
                return packagePath.isEmpty() ? List.of(location) : List.of(location.resolve(packagePath), location);
            }
            Path parent = location.getParent();
            return parent == null ? List.of() : List.of(parent);
        } catch (URISyntaxException | SecurityException | IllegalArgumentException e) {
            log.debug("Cannot resolve code source of handler {}: {}", handlerClass.getName(), e.getMessage());
            return List.of();
        }
    }
}
