package com.zzf.workspace.core.fs;

import java.util.List;
import java.util.Optional;

/**
 * File access inside one workspace root. Every path argument and every returned path
 * is a workspace path ({@code /a/b.txt}); implementations reject anything outside the
 * root and wrap I/O failures in {@code WorkspaceIoException}.
 */
public interface FilesystemBackend {

    String read(String path);

    /**
     * Reads {@code limit} lines starting at the 0-based {@code offset}. A non-positive
     * limit reads to the end.
     */
    String read(String path, int offset, int limit);

    void write(String path, String content);

    /**
     * Replaces {@code oldString}; fails when it is absent, or ambiguous without
     * {@code replaceAll}.
     *
     * @return number of replaced occurrences
     */
    int edit(String path, String oldString, String newString, boolean replaceAll);

    FileStat stat(String path);

    Optional<FileStat> findStat(String path);

    boolean exists(String path);

    List<FileInfo> lsInfo(String path);

    /**
     * Files and directories under {@code path} whose path relative to it matches
     * {@code glob}. Directories are included, flagged as such.
     */
    List<FileInfo> globInfo(String glob, String path);

    /**
     * Lines matching {@code regex} in the text files under {@code path} (or in {@code path}
     * itself when it is a file), optionally filtered by {@code glob} relative to it.
     * Binary files are skipped.
     */
    List<GrepMatch> grepRaw(String regex, String path, String glob);

    void delete(String path, boolean recursive);

    void mkdir(String path, boolean recursive);
}
