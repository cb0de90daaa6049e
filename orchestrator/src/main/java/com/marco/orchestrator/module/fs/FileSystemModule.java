package com.marco.orchestrator.module.fs;

import com.marco.orchestrator.config.MarcoProperties;
import com.marco.orchestrator.intent.ParamSpec;
import com.marco.orchestrator.intent.ParamType;
import com.marco.orchestrator.module.ExecutionResult;
import com.marco.orchestrator.module.McpModule;
import com.marco.orchestrator.module.ModuleExecutionException;
import com.marco.orchestrator.module.ModuleExecutionException.Kind;
import com.marco.orchestrator.registry.ActionSpec;
import com.marco.orchestrator.registry.CapabilityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Local file-system module ("fs"), confined to {@code marco.fs.root}.
 *
 * Read actions are idempotent; {@code write_file} and {@code delete_file}
 * are declared destructive, so the orchestrator only runs them after the
 * user confirmed.
 */
@Component
public class FileSystemModule implements McpModule {

    private static final Logger log = LoggerFactory.getLogger(FileSystemModule.class);

    public static final String NAME = "fs";
    public static final String FACT_LAST_PATH = "last_path";

    private static final CapabilityDescriptor DESCRIPTOR = CapabilityDescriptor
            .builder(NAME, "Local files and directories under the configured root.")
            .action(ActionSpec.readOnly("list_dir", "List the entries of a directory (default: the root).",
                    ParamSpec.optional("path", ParamType.STRING, "directory to list")))
            .action(ActionSpec.readOnly("read_file", "Read a text file.",
                    ParamSpec.required("path", ParamType.STRING, "file to read")))
            .action(ActionSpec.readOnly("find_pattern", "Search text files for lines matching a regular expression.",
                    ParamSpec.required("pattern", ParamType.STRING, "regular expression"),
                    ParamSpec.optional("path", ParamType.STRING, "directory or file to search")))
            .destructiveAction(ActionSpec.mutating("write_file", "Create or overwrite a text file.",
                    ParamSpec.required("path", ParamType.STRING, "file to write"),
                    ParamSpec.required("content", ParamType.STRING, "full new content")))
            .destructiveAction(ActionSpec.mutating("delete_file", "Delete a file or an empty directory.",
                    ParamSpec.required("path", ParamType.STRING, "file to delete")))
            .build();

    private final RootedPaths paths;
    private final long        maxReadBytes;
    private final int         maxMatches;

    @Autowired
    public FileSystemModule(MarcoProperties properties) {
        this(Paths.get(properties.getFs().getRoot()),
             properties.getFs().getMaxReadBytes(),
             properties.getFs().getMaxMatches());
    }

    public FileSystemModule(Path root, long maxReadBytes, int maxMatches) {
        this.paths        = new RootedPaths(root);
        this.maxReadBytes = maxReadBytes;
        this.maxMatches   = maxMatches;
        log.info("fs module rooted at {}", paths.root());
    }

    @Override
    public CapabilityDescriptor capabilities() {
        return DESCRIPTOR;
    }

    @Override
    public ExecutionResult execute(String action, Map<String, Object> parameters) {
        try {
            return switch (action) {
                case "list_dir"     -> listDir(str(parameters, "path"));
                case "read_file"    -> readFile(str(parameters, "path"));
                case "find_pattern" -> findPattern(str(parameters, "pattern"), str(parameters, "path"));
                case "write_file"   -> writeFile(str(parameters, "path"), str(parameters, "content"));
                case "delete_file"  -> deleteFile(str(parameters, "path"));
                default -> throw new ModuleExecutionException(Kind.REJECTED, "Unknown fs action: " + action);
            };
        } catch (NoSuchFileException e) {
            throw new ModuleExecutionException(Kind.REJECTED, "No such file or directory: " + e.getFile(), e);
        } catch (IOException e) {
            throw new ModuleExecutionException(Kind.FAILED, action + " failed: " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new ModuleExecutionException(Kind.FAILED, action + " failed: " + e.getCause().getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    private ExecutionResult listDir(String path) throws IOException {
        Path dir = paths.resolve(path);
        if (!Files.isDirectory(dir)) {
            throw new ModuleExecutionException(Kind.REJECTED, "Not a directory: " + paths.display(dir));
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.sorted(Comparator.comparing(Path::getFileName)).toList()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", child.getFileName().toString());
                entry.put("type", Files.isDirectory(child) ? "dir" : "file");
                entry.put("size", Files.isDirectory(child) ? 0L : Files.size(child));
                entries.add(entry);
            }
        }
        String shown = paths.display(dir);
        return ExecutionResult.withFacts("%d entries in %s".formatted(entries.size(), shown),
                entries, Map.of(FACT_LAST_PATH, shown));
    }

    private ExecutionResult readFile(String path) throws IOException {
        Path file = paths.resolve(path);
        if (Files.isDirectory(file)) {
            throw new ModuleExecutionException(Kind.REJECTED, paths.display(file) + " is a directory");
        }
        long size = Files.size(file);
        if (size > maxReadBytes) {
            throw new ModuleExecutionException(Kind.REJECTED,
                    "%s is %d bytes, over the %d byte read limit".formatted(paths.display(file), size, maxReadBytes));
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new ModuleExecutionException(Kind.REJECTED, paths.display(file) + " is not a UTF-8 text file", e);
        }
        String shown = paths.display(file);
        return ExecutionResult.withFacts("Read %s (%d bytes)".formatted(shown, size),
                content, Map.of(FACT_LAST_PATH, shown));
    }

    private ExecutionResult findPattern(String pattern, String path) throws IOException {
        Pattern regex;
        try {
            regex = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ModuleExecutionException(Kind.REJECTED, "Invalid pattern: " + e.getDescription(), e);
        }
        Path start = paths.resolve(path);
        List<Map<String, Object>> matches = new ArrayList<>();
        boolean truncated = false;

        List<Path> files;
        try (Stream<Path> walk = Files.walk(start)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        }
        for (Path file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ModuleExecutionException(Kind.FAILED, "find_pattern interrupted");
            }
            if (!paths.isInside(file)) {
                log.debug("Skipping {}: symbolic link leads outside the root", file);
                continue;
            }
            if (Files.size(file) > maxReadBytes) continue;
            truncated = scan(file, regex, matches);
            if (truncated) break;
        }

        String shown = paths.display(start);
        String summary = "%d match(es) for /%s/ under %s%s".formatted(
                matches.size(), pattern, shown, truncated ? " (truncated)" : "");
        return ExecutionResult.withFacts(summary, matches, Map.of(FACT_LAST_PATH, shown));
    }

    /** @return true once the match limit is reached */
    private boolean scan(Path file, Pattern regex, List<Map<String, Object>> matches) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (regex.matcher(line).find()) {
                    matches.add(Map.of("path", paths.display(file), "line", lineNo, "text", line.strip()));
                    if (matches.size() >= maxMatches) return true;
                }
            }
        } catch (CharacterCodingException e) {
            // binary file
            log.debug("Skipping non-text file {}", file);
        }
        return false;
    }

    private ExecutionResult writeFile(String path, String content) throws IOException {
        Path file = paths.resolve(path);
        if (file.equals(paths.root()) || Files.isDirectory(file)) {
            throw new ModuleExecutionException(Kind.REJECTED, paths.display(file) + " is a directory");
        }
        Files.createDirectories(file.getParent());
        byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
        Files.write(file, bytes);
        String shown = paths.display(file);
        log.info("Wrote {} ({} bytes)", shown, bytes.length);
        return ExecutionResult.withFacts("Wrote %s (%d bytes)".formatted(shown, bytes.length),
                null, Map.of(FACT_LAST_PATH, shown));
    }

    private ExecutionResult deleteFile(String path) throws IOException {
        Path file = paths.resolve(path);
        if (file.equals(paths.root())) {
            throw new ModuleExecutionException(Kind.REJECTED, "Refusing to delete the root directory");
        }
        try {
            Files.delete(file);
        } catch (DirectoryNotEmptyException e) {
            throw new ModuleExecutionException(Kind.REJECTED, paths.display(file) + " is a non-empty directory", e);
        }
        String shown = paths.display(file);
        log.info("Deleted {}", shown);
        return ExecutionResult.withFacts("Deleted " + shown, null, Map.of(FACT_LAST_PATH, shown));
    }

    private static String str(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value == null ? null : value.toString();
    }
}
