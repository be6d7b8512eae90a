package com.zzf.workspace.core.fs;

import com.zzf.workspace.core.workspace.PathSandbox;
import com.zzf.workspace.core.workspace.error.FileTooLargeException;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import com.zzf.workspace.core.workspace.error.WorkspaceIoException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * {@link FilesystemBackend} over the local disk, rooted at a {@link PathSandbox}.
 */
@Slf4j
public final class LocalFilesystemBackend implements FilesystemBackend {
    private static final int BINARY_SNIFF_BYTES = 8000;

    private final PathSandbox sandbox;
    private final long maxFileSizeBytes;

    public LocalFilesystemBackend(PathSandbox sandbox, int maxFileSizeMb) {
        this.sandbox = sandbox;
        this.maxFileSizeBytes = maxFileSizeMb <= 0 ? Long.MAX_VALUE : maxFileSizeMb * 1024L * 1024L;
    }

    @Override
    public String read(String path) {
        return read(path, 0, 0);
    }

    @Override
    public String read(String path, int offset, int limit) {
        String normalized = PathSandbox.normalize(path);
        Path host = sandbox.resolveToHost(normalized);
        try {
            if (Files.isDirectory(host)) {
                throw new InvalidToolArgumentsException("Not a file: " + normalized);
            }
            long size = Files.size(host);
            if (size > maxFileSizeBytes) {
                throw new FileTooLargeException(normalized, size, maxFileSizeBytes);
            }
            String content = decode(Files.readAllBytes(host));
            if (offset <= 0 && limit <= 0) {
                return content;
            }
            String[] lines = content.split("\r?\n", -1);
            int start = Math.min(Math.max(0, offset), lines.length);
            int end = limit <= 0 ? lines.length : (int) Math.min((long) start + limit, lines.length);
            return String.join("\n", Arrays.asList(lines).subList(start, end));
        } catch (NoSuchFileException e) {
            throw new WorkspaceIoException("File not found: " + normalized);
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to read " + normalized, e);
        }
    }

    @Override
    public void write(String path, String content) {
        String normalized = PathSandbox.normalize(path);
        Path host = sandbox.resolveToHost(normalized);
        try {
            Files.writeString(host, content == null ? "" : content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to write " + normalized, e);
        }
    }

    @Override
    public int edit(String path, String oldString, String newString, boolean replaceAll) {
        if (oldString == null || oldString.isEmpty()) {
            throw new InvalidToolArgumentsException("old_string must not be empty");
        }
        if (oldString.equals(newString)) {
            throw new InvalidToolArgumentsException("old_string and new_string must be different");
        }
        String normalized = PathSandbox.normalize(path);
        String content = read(normalized);
        int occurrences = countOccurrences(content, oldString);
        if (occurrences == 0) {
            throw new InvalidToolArgumentsException("old_string not found in " + normalized);
        }
        if (occurrences > 1 && !replaceAll) {
            throw new InvalidToolArgumentsException("old_string found " + occurrences
                    + " times in " + normalized + "; add context or set replace_all");
        }
        String updated = replaceAll
                ? content.replace(oldString, newString == null ? "" : newString)
                : replaceFirstLiteral(content, oldString, newString == null ? "" : newString);
        write(normalized, updated);
        return replaceAll ? occurrences : 1;
    }

    @Override
    public FileStat stat(String path) {
        String normalized = PathSandbox.normalize(path);
        return findStat(normalized).orElseThrow(() -> new WorkspaceIoException("File not found: " + normalized));
    }

    @Override
    public Optional<FileStat> findStat(String path) {
        String normalized = PathSandbox.normalize(path);
        Path host = sandbox.resolveToHost(normalized);
        try {
            BasicFileAttributes attrs = Files.readAttributes(host, BasicFileAttributes.class);
            return Optional.of(new FileStat(
                    normalized,
                    attrs.isDirectory(),
                    attrs.size(),
                    attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS),
                    attrs.lastModifiedTime().toInstant(),
                    attrs.creationTime().toInstant()
            ));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to stat " + normalized, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(sandbox.resolveToHost(path));
    }

    @Override
    public List<FileInfo> lsInfo(String path) {
        String normalized = PathSandbox.normalize(path);
        Path host = sandbox.resolveToHost(normalized);
        List<FileInfo> out = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(host)) {
            for (Path entry : entries) {
                out.add(toInfo(entry));
            }
        } catch (NoSuchFileException e) {
            throw new WorkspaceIoException("Directory not found: " + normalized);
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to list " + normalized, e);
        }
        out.sort(Comparator.comparing(FileInfo::getPath));
        return out;
    }

    @Override
    public List<FileInfo> globInfo(String glob, String path) {
        String normalized = PathSandbox.normalize(path == null || path.isBlank() ? "/" : path);
        Path base = sandbox.resolveToHost(normalized);
        String pattern = glob == null || glob.isBlank() ? "**/*" : glob.trim();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        // "**/" needs at least one directory in java globs; retry without it for top-level entries
        PathMatcher topLevel = pattern.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3))
                : null;
        if (!Files.isDirectory(base)) {
            return new ArrayList<>();
        }
        List<FileInfo> out = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(base)) {
            walk.filter(p -> !p.equals(base)).forEach(p -> {
                Path rel = base.relativize(p);
                if (matcher.matches(rel) || (topLevel != null && topLevel.matches(rel))) {
                    out.add(toInfo(p));
                }
            });
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to glob " + normalized, e);
        }
        out.sort(Comparator.comparing(FileInfo::getPath));
        return out;
    }

    @Override
    public List<GrepMatch> grepRaw(String regex, String path, String glob) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex == null ? "" : regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidToolArgumentsException("Invalid regex: " + e.getDescription());
        }
        String normalized = PathSandbox.normalize(path == null || path.isBlank() ? "/" : path);
        Path base = sandbox.resolveToHost(normalized);
        if (!Files.exists(base)) {
            throw new WorkspaceIoException("Path not found: " + normalized);
        }
        String include = glob == null || glob.isBlank() ? null : glob.trim();
        PathMatcher matcher = include == null ? null : FileSystems.getDefault().getPathMatcher("glob:" + include);
        PathMatcher topLevel = include != null && include.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + include.substring(3))
                : null;

        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(base)) {
            walk.filter(Files::isRegularFile).forEach(p -> {
                Path rel = Files.isDirectory(base) ? base.relativize(p) : p.getFileName();
                if (matcher == null || matcher.matches(rel) || (topLevel != null && topLevel.matches(rel))) {
                    files.add(p);
                }
            });
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to walk " + normalized, e);
        }
        files.sort(Comparator.naturalOrder());

        List<GrepMatch> out = new ArrayList<>();
        for (Path file : files) {
            byte[] bytes;
            try {
                if (Files.size(file) > maxFileSizeBytes) {
                    continue;
                }
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                log.debug("fs.grep.skip path={} err={}", file, e.toString());
                continue;
            }
            if (looksBinary(bytes)) {
                continue;
            }
            String workspacePath = sandbox.toWorkspacePath(file);
            String[] lines = decode(bytes).split("\r?\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (pattern.matcher(lines[i]).find()) {
                    out.add(new GrepMatch(workspacePath, i + 1, lines[i]));
                }
            }
        }
        return out;
    }

    @Override
    public void delete(String path, boolean recursive) {
        String normalized = PathSandbox.normalize(path);
        if ("/".equals(normalized)) {
            throw new InvalidToolArgumentsException("Refusing to delete the workspace root");
        }
        Path host = sandbox.resolveToHost(normalized);
        try {
            if (Files.isDirectory(host) && recursive) {
                deleteTree(host);
            } else {
                Files.delete(host);
            }
        } catch (NoSuchFileException e) {
            throw new WorkspaceIoException("File not found: " + normalized);
        } catch (DirectoryNotEmptyException e) {
            throw new InvalidToolArgumentsException("Directory not empty: " + normalized + "; set recursive=true to remove it");
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to delete " + normalized, e);
        }
    }

    @Override
    public void mkdir(String path, boolean recursive) {
        String normalized = PathSandbox.normalize(path);
        Path host = sandbox.resolveToHost(normalized);
        try {
            if (recursive) {
                Files.createDirectories(host);
            } else {
                Files.createDirectory(host);
            }
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to create directory " + normalized, e);
        }
    }

    private FileInfo toInfo(Path host) {
        boolean dir = Files.isDirectory(host);
        long size = 0L;
        if (!dir) {
            try {
                size = Files.size(host);
            } catch (IOException e) {
                log.debug("fs.size.fail path={} err={}", host, e.toString());
            }
        }
        return new FileInfo(sandbox.toWorkspacePath(host), dir, size);
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Lenient UTF-8: malformed sequences become U+FFFD instead of failing the read.
     */
    static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static boolean looksBinary(byte[] bytes) {
        int n = Math.min(bytes.length, BINARY_SNIFF_BYTES);
        for (int i = 0; i < n; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static int countOccurrences(String content, String needle) {
        int count = 0;
        int idx = content.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = content.indexOf(needle, idx + needle.length());
        }
        return count;
    }

    private static String replaceFirstLiteral(String content, String oldString, String newString) {
        int idx = content.indexOf(oldString);
        return content.substring(0, idx) + newString + content.substring(idx + oldString.length());
    }
}
