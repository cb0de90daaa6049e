package com.marco.orchestrator.module.fs;

import com.marco.orchestrator.module.ModuleExecutionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Resolves user-supplied paths inside a fixed root directory.
 *
 * Relative paths are taken from the root; absolute paths are accepted only
 * when they already point inside it. Anything that normalises, or follows
 * symlinks on itself or its nearest existing ancestor, to a location outside
 * the root is refused.
 */
final class RootedPaths {

    private final Path root;

    RootedPaths(Path root) {
        try {
            Files.createDirectories(root);
            this.root = root.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("File-system root is not usable: " + root, e);
        }
    }

    Path root() {
        return root;
    }

    /**
     * @throws ModuleExecutionException REJECTED if the path escapes the root or is malformed
     */
    Path resolve(String userPath) {
        if (userPath == null || userPath.isBlank()) {
            return root;
        }
        Path candidate;
        try {
            candidate = root.resolve(userPath.strip()).normalize();
        } catch (InvalidPathException e) {
            throw new ModuleExecutionException(ModuleExecutionException.Kind.REJECTED,
                    "Invalid path '" + userPath + "': " + e.getReason());
        }
        if (!candidate.startsWith(root)) {
            throw outside(userPath);
        }
        // A path that does not exist yet is judged by the ancestor it will be created under.
        Path existing = candidate;
        while (!Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        try {
            if (!existing.toRealPath().startsWith(root)) {
                throw outside(userPath);
            }
        } catch (NoSuchFileException e) {
            throw new ModuleExecutionException(ModuleExecutionException.Kind.REJECTED,
                    "Path '" + userPath + "' is a broken symbolic link", e);
        } catch (IOException e) {
            throw new ModuleExecutionException(ModuleExecutionException.Kind.FAILED,
                    "Cannot resolve '" + userPath + "': " + e.getMessage(), e);
        }
        return candidate;
    }

    /** True when {@code path} exists and its real location is inside the root. */
    boolean isInside(Path path) {
        try {
            return path.toRealPath().startsWith(root);
        } catch (IOException e) {
            return false;
        }
    }

    /** Path as shown to the user: relative to the root, "." for the root itself. */
    String display(Path path) {
        Path rel = root.relativize(path);
        return rel.toString().isEmpty() ? "." : rel.toString().replace('\\', '/');
    }

    private static ModuleExecutionException outside(String userPath) {
        return new ModuleExecutionException(ModuleExecutionException.Kind.REJECTED,
                "Path '" + userPath + "' is outside the allowed root");
    }
}
