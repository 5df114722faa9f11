package com.sqlsignal.core.util;

import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.determinism.Canonical;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads {@code .sql} files into {@link SourceUnit}s.
 *
 * <p>The object name and type come from the first {@code CREATE}/{@code ALTER} header in the file;
 * files without one are named after the file and treated as procedures.
 */
public final class SqlSourceLoader {

    private static final String SQL_EXTENSION = "sql";

    private static final Pattern HEADER = Pattern.compile(
        "\\b(?:CREATE|ALTER)\\s+(?:OR\\s+ALTER\\s+)?(PROCEDURE|PROC|FUNCTION|TRIGGER|VIEW)\\s+"
            + "((?:\\[[^\\]]+\\]|\"[^\"]+\"|[\\w@#$]+)(?:\\s*\\.\\s*(?:\\[[^\\]]+\\]|\"[^\"]+\"|[\\w@#$]+))*)",
        Pattern.CASE_INSENSITIVE);

    private SqlSourceLoader() {
        // Utility class
    }

    /**
     * Loads every path in order; directories contribute their {@code .sql} files sorted by path.
     *
     * @param paths files or directories
     * @return source units in load order
     * @throws IOException if a file cannot be read or a path does not exist
     */
    public static List<SourceUnit> load(List<Path> paths) throws IOException {
        List<SourceUnit> units = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                for (Path file : findSqlFiles(path)) {
                    units.add(loadFile(file));
                }
            } else if (Files.isRegularFile(path)) {
                units.add(loadFile(path));
            } else {
                throw new IOException("Path does not exist: " + path);
            }
        }
        return units;
    }

    /**
     * Finds {@code .sql} files below a directory, sorted by path.
     *
     * @param rootPath directory to walk
     * @return sorted list of SQL files
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findSqlFiles(Path rootPath) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> SQL_EXTENSION.equalsIgnoreCase(getExtension(path)))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads one file as a source unit.
     *
     * @param file SQL file
     * @return source unit named after its header or file name
     * @throws IOException if reading fails
     */
    public static SourceUnit loadFile(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        Matcher matcher = HEADER.matcher(text);
        if (matcher.find()) {
            return SourceUnit.of(headerName(matcher.group(2)), objectType(matcher.group(1)), text);
        }
        return SourceUnit.of(stripExtension(file.getFileName().toString()), "procedure", text);
    }

    static String objectType(String keyword) {
        String upper = keyword.toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "PROC", "PROCEDURE" -> "procedure";
            default -> upper.toLowerCase(Locale.ROOT);
        };
    }

    private static String headerName(String raw) {
        return Canonical.unquote(raw);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    private static String stripExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
