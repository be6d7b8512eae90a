package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import com.zzf.workspace.core.workspace.error.OperationCancelledException;
import com.zzf.workspace.core.workspace.error.PathTraversalException;
import com.zzf.workspace.core.workspace.error.ReadRequiredException;
import com.zzf.workspace.core.workspace.error.StaleReadException;
import com.zzf.workspace.core.workspace.error.WorkspaceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.AdditionalAnswers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class FilesystemToolsTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private WorkspaceRuntime workspace;
    private Path fsRoot;

    @BeforeEach
    void setUp() {
        workspace = TestWorkspaces.create(tempDir);
        fsRoot = workspace.getFilesystemRootDir();
    }

    private JsonNode run(Tool tool, ObjectNode args, String operationId) {
        return tool.execute(args, TestWorkspaces.context(operationId)).join().getData();
    }

    private Throwable failure(Tool tool, ObjectNode args, String operationId) {
        CompletionException e = assertThrows(CompletionException.class,
                () -> tool.execute(args, TestWorkspaces.context(operationId)).join());
        return e.getCause();
    }

    private ObjectNode args() {
        return mapper.createObjectNode();
    }

    @Test
    void readFileReturnsContentAndWindow() throws Exception {
        Files.writeString(fsRoot.resolve("a.txt"), "one\ntwo\nthree");
        ReadFileTool read = new ReadFileTool(workspace, mapper);

        JsonNode whole = run(read, args().put("path", "a.txt"), "op");
        JsonNode window = run(read, args().put("path", "/a.txt").put("offset", 1).put("limit", 1), "op");

        assertEquals("/a.txt", whole.get("path").asText());
        assertEquals("one\ntwo\nthree", whole.get("content").asText());
        assertEquals("two", window.get("content").asText());
    }

    @Test
    void editWithoutReadIsRejected() throws Exception {
        Files.writeString(fsRoot.resolve("a.txt"), "hello");
        EditFileTool edit = new EditFileTool(workspace, mapper);

        Throwable cause = failure(edit, args().put("path", "/a.txt").put("old_string", "hello").put("new_string", "bye"), "op");

        assertInstanceOf(ReadRequiredException.class, cause);
        assertEquals("hello", Files.readString(fsRoot.resolve("a.txt")));
    }

    @Test
    void readThenEditSucceedsAndOwnEditStaysFresh() throws Exception {
        Files.writeString(fsRoot.resolve("a.txt"), "alpha beta");
        ReadFileTool read = new ReadFileTool(workspace, mapper);
        EditFileTool edit = new EditFileTool(workspace, mapper);

        run(read, args().put("path", "/a.txt"), "op");
        JsonNode first = run(edit, args().put("path", "/a.txt").put("old_string", "alpha").put("new_string", "gamma"), "op");
        JsonNode second = run(edit, args().put("path", "/a.txt").put("old_string", "beta").put("new_string", "delta"), "op");

        assertEquals(1, first.get("occurrences").asInt());
        assertEquals(1, second.get("occurrences").asInt());
        assertEquals("gamma delta", Files.readString(fsRoot.resolve("a.txt")));
    }

    @Test
    void externalChangeAfterReadMakesEditStale() throws Exception {
        Files.writeString(fsRoot.resolve("a.txt"), "v1");
        ReadFileTool read = new ReadFileTool(workspace, mapper);
        EditFileTool edit = new EditFileTool(workspace, mapper);

        run(read, args().put("path", "/a.txt"), "op");
        Files.writeString(fsRoot.resolve("a.txt"), "v1 changed elsewhere");

        Throwable cause = failure(edit, args().put("path", "/a.txt").put("old_string", "v1").put("new_string", "v2"), "op");
        assertInstanceOf(StaleReadException.class, cause);
    }

    @Test
    void readInOneOperationDoesNotCoverAnother() throws Exception {
        Files.writeString(fsRoot.resolve("a.txt"), "x");
        run(new ReadFileTool(workspace, mapper), args().put("path", "/a.txt"), "op-a");

        Throwable cause = failure(new DeleteFileTool(workspace, mapper), args().put("path", "/a.txt"), "op-b");

        assertInstanceOf(ReadRequiredException.class, cause);
        assertTrue(Files.exists(fsRoot.resolve("a.txt")));
    }

    @Test
    void writeFileCreatesParentsAndRespectsOverwrite() throws Exception {
        WriteFileTool write = new WriteFileTool(workspace, mapper);

        JsonNode created = run(write, args().put("path", "/deep/dir/new.txt").put("content", "first"), "op");
        Throwable refused = failure(write, args().put("path", "/deep/dir/new.txt").put("content", "second"), "op");
        JsonNode replaced = run(write, args().put("path", "/deep/dir/new.txt").put("content", "third").put("overwrite", true), "op");

        assertFalse(created.get("overwritten").asBoolean());
        assertInstanceOf(InvalidToolArgumentsException.class, refused);
        assertTrue(replaced.get("overwritten").asBoolean());
        assertEquals("third", Files.readString(fsRoot.resolve("deep/dir/new.txt")));
    }

    @Test
    void writeFileWithoutParentCreationFailsForMissingDirectory() {
        WriteFileTool write = new WriteFileTool(workspace, mapper);

        Throwable cause = failure(write, args().put("path", "/missing/a.txt").put("content", "x").put("create_parent_dirs", false), "op");

        assertEquals("io_error", ((WorkspaceException) cause).getCode());
    }

    @Test
    void deleteAfterReadRemovesFile() throws Exception {
        Files.writeString(fsRoot.resolve("gone.txt"), "bye");
        run(new ReadFileTool(workspace, mapper), args().put("path", "/gone.txt"), "op");

        JsonNode out = run(new DeleteFileTool(workspace, mapper), args().put("path", "/gone.txt"), "op");

        assertTrue(out.get("deleted").asBoolean());
        assertFalse(Files.exists(fsRoot.resolve("gone.txt")));
    }

    @Test
    void mkdirStatAndLs() throws Exception {
        run(new MkdirTool(workspace, mapper), args().put("path", "/src/main"), "op");
        Files.writeString(fsRoot.resolve("src/main/App.java"), "class App {}");

        JsonNode stat = run(new StatTool(workspace, mapper), args().put("path", "/src/main/App.java"), "op");
        JsonNode ls = run(new LsTool(workspace, mapper), args().put("path", "/src/main"), "op");

        assertFalse(stat.get("is_dir").asBoolean());
        assertEquals(12, stat.get("size").asInt());
        assertTrue(stat.hasNonNull("modified_at"));
        assertEquals(1, ls.get("entries").size());
        assertEquals("/src/main/App.java", ls.get("entries").get(0).get("path").asText());
        assertFalse(ls.get("entries").get(0).get("is_dir").asBoolean());
    }

    @Test
    void globFindsMatchesUnderPath() throws Exception {
        Files.createDirectories(fsRoot.resolve("docs/api"));
        Files.writeString(fsRoot.resolve("docs/index.md"), "i");
        Files.writeString(fsRoot.resolve("docs/api/rest.md"), "r");
        Files.writeString(fsRoot.resolve("docs/api/schema.json"), "{}");

        JsonNode out = run(new GlobTool(workspace, mapper), args().put("pattern", "**/*.md").put("path", "/docs"), "op");

        assertEquals("**/*.md", out.get("pattern").asText());
        List<String> paths = new ArrayList<>();
        out.get("matches").forEach(m -> paths.add(m.get("path").asText()));
        assertEquals(List.of("/docs/api/rest.md", "/docs/index.md"), paths);
    }

    @Test
    void listTreeMarksDirectoriesAndHonoursDepth() throws Exception {
        Files.createDirectories(fsRoot.resolve("a/b/c"));
        Files.writeString(fsRoot.resolve("a/top.txt"), "t");
        Files.writeString(fsRoot.resolve("a/b/c/leaf.txt"), "l");
        ListTreeTool tree = new ListTreeTool(workspace, mapper);

        JsonNode full = run(tree, args().put("path", "/"), "op");
        JsonNode shallow = run(tree, args().put("path", "/").put("max_depth", 0), "op");

        List<String> fullPaths = new ArrayList<>();
        full.get("entries").forEach(e -> fullPaths.add(e.get("path").asText()));
        assertEquals(List.of("/a/", "/a/b/", "/a/b/c/", "/a/b/c/leaf.txt", "/a/top.txt"), fullPaths);
        assertEquals(1, shallow.get("entries").size());
        assertEquals("/a/", shallow.get("entries").get(0).get("path").asText());
        assertTrue(shallow.get("entries").get(0).get("is_dir").asBoolean());
    }

    @Test
    void traversalIsRejected() {
        Throwable cause = failure(new ReadFileTool(workspace, mapper), args().put("path", "../../etc/passwd"), "op");

        assertInstanceOf(PathTraversalException.class, cause);
    }

    @Test
    void cancelledContextFailsFast() {
        ToolCallContext ctx = TestWorkspaces.context("op");
        ctx.getSignal().cancel("user aborted");

        OperationCancelledException e = assertThrows(OperationCancelledException.class,
                () -> new LsTool(workspace, mapper).execute(args(), ctx));
        assertEquals("user aborted", e.getMessage());
    }

    @Test
    void missingRequiredArgumentIsInvalid() {
        Throwable cause = failure(new StatTool(workspace, mapper), args(), "op");

        assertInstanceOf(InvalidToolArgumentsException.class, cause);
    }

    @Test
    void readFileToleratesInvalidUtf8() throws Exception {
        Files.write(fsRoot.resolve("mixed.txt"), new byte[]{'o', 'k', ' ', (byte) 0xFF, (byte) 0xFE, ' ', 'e', 'n', 'd'});

        JsonNode out = run(new ReadFileTool(workspace, mapper), args().put("path", "/mixed.txt"), "op");

        String content = out.get("content").asText();
        assertTrue(content.startsWith("ok "));
        assertTrue(content.endsWith(" end"));
        assertTrue(content.indexOf(0xFFFD) >= 0);
    }

    @Test
    void readAndEditAgreeOnEquivalentPathSpellings() throws Exception {
        Files.createDirectories(fsRoot.resolve("a"));
        Files.writeString(fsRoot.resolve("a/b.txt"), "before");

        run(new ReadFileTool(workspace, mapper), args().put("path", "/a/b.txt"), "op");
        JsonNode out = run(new EditFileTool(workspace, mapper),
                args().put("path", "a//./b.txt").put("old_string", "before").put("new_string", "after"), "op");

        assertEquals("/a/b.txt", out.get("path").asText());
        assertEquals("after", Files.readString(fsRoot.resolve("a/b.txt")));
    }

    @Test
    void grepReportsMatchingLinesAndSkipsBinaryFiles() throws Exception {
        Files.createDirectories(fsRoot.resolve("src"));
        Files.writeString(fsRoot.resolve("src/App.java"), "class App {\n  // TODO wire login\n}\n");
        Files.writeString(fsRoot.resolve("src/notes.md"), "TODO: docs\n");
        Files.write(fsRoot.resolve("src/blob.bin"), new byte[]{'T', 'O', 'D', 'O', 0, 1, 2});
        GrepTool grep = new GrepTool(workspace, mapper);

        JsonNode all = run(grep, args().put("pattern", "TODO"), "op");
        JsonNode javaOnly = run(grep, args().put("pattern", "TODO\\s+\\w+").put("path", "/src").put("glob", "**/*.java"), "op");

        assertEquals(2, all.get("matches").size());
        assertEquals(1, javaOnly.get("matches").size());
        JsonNode match = javaOnly.get("matches").get(0);
        assertEquals("/src/App.java", match.get("path").asText());
        assertEquals(2, match.get("line").asInt());
        assertEquals("  // TODO wire login", match.get("text").asText());
    }

    @Test
    void grepTruncatesToLimit() throws Exception {
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            lines.append("hit ").append(i).append('\n');
        }
        Files.writeString(fsRoot.resolve("many.txt"), lines.toString());

        Tool.Result result = new GrepTool(workspace, mapper)
                .execute(args().put("pattern", "hit").put("limit", 3), TestWorkspaces.context("op")).join();

        assertEquals(3, result.getData().get("matches").size());
        assertEquals(Boolean.TRUE, result.getMetadata().get("truncated"));
    }

    @Test
    void grepRejectsInvalidRegex() {
        Throwable cause = failure(new GrepTool(workspace, mapper), args().put("pattern", "("), "op");

        assertInstanceOf(InvalidToolArgumentsException.class, cause);
    }

    @Test
    void rmdirRemovesOnlyEmptyDirectoriesUnlessRecursive() throws Exception {
        Files.createDirectories(fsRoot.resolve("empty"));
        Files.createDirectories(fsRoot.resolve("full/sub"));
        Files.writeString(fsRoot.resolve("full/sub/x.txt"), "x");
        RmdirTool rmdir = new RmdirTool(workspace, mapper);

        JsonNode empty = run(rmdir, args().put("path", "/empty"), "op");
        Throwable refused = failure(rmdir, args().put("path", "/full"), "op");
        JsonNode full = run(rmdir, args().put("path", "/full").put("recursive", true), "op");
        JsonNode missing = run(rmdir, args().put("path", "/never"), "op");

        assertTrue(empty.get("deleted").asBoolean());
        assertFalse(Files.exists(fsRoot.resolve("empty")));
        assertInstanceOf(InvalidToolArgumentsException.class, refused);
        assertTrue(full.get("deleted").asBoolean());
        assertFalse(Files.exists(fsRoot.resolve("full")));
        assertFalse(missing.get("deleted").asBoolean());
    }

    @Test
    void rmdirRefusesFilesAndTheRoot() throws Exception {
        Files.writeString(fsRoot.resolve("file.txt"), "x");
        RmdirTool rmdir = new RmdirTool(workspace, mapper);

        assertInstanceOf(InvalidToolArgumentsException.class, failure(rmdir, args().put("path", "/file.txt"), "op"));
        assertInstanceOf(InvalidToolArgumentsException.class, failure(rmdir, args().put("path", "/").put("recursive", true), "op"));
        assertTrue(Files.exists(fsRoot.resolve("file.txt")));
    }

    @Test
    void listFilesIsListTreeUnderAnotherName() throws Exception {
        Files.createDirectories(fsRoot.resolve("a/b"));
        Files.writeString(fsRoot.resolve("a/b/c.txt"), "c");
        ListFilesTool listFiles = new ListFilesTool(workspace, mapper);

        JsonNode alias = run(listFiles, args().put("path", "/"), "op");
        JsonNode tree = run(new ListTreeTool(workspace, mapper), args().put("path", "/"), "op");

        assertEquals("list_files", listFiles.getId());
        assertEquals(tree, alias);
    }

    @Test
    void readOnlyWorkspaceRefusesMutationsButServesReads() throws Exception {
        WorkspaceRuntime readOnly = TestWorkspaces.init(TestWorkspaces.builder(tempDir).readOnly(true));
        Files.writeString(readOnly.getFilesystemRootDir().resolve("keep.txt"), "keep");

        Throwable write = failure(new WriteFileTool(readOnly, mapper), args().put("path", "/new.txt").put("content", "x"), "op");
        Throwable mkdir = failure(new MkdirTool(readOnly, mapper), args().put("path", "/dir"), "op");
        JsonNode read = run(new ReadFileTool(readOnly, mapper), args().put("path", "/keep.txt"), "op");
        Throwable delete = failure(new DeleteFileTool(readOnly, mapper), args().put("path", "/keep.txt"), "op");

        assertEquals("read_only", ((WorkspaceException) write).getCode());
        assertEquals("read_only", ((WorkspaceException) mkdir).getCode());
        assertEquals("read_only", ((WorkspaceException) delete).getCode());
        assertEquals("keep", read.get("content").asText());
        assertFalse(Files.exists(readOnly.getFilesystemRootDir().resolve("new.txt")));
        assertFalse(Files.exists(readOnly.getFilesystemRootDir().resolve("dir")));
        assertTrue(Files.exists(readOnly.getFilesystemRootDir().resolve("keep.txt")));
    }

    @Test
    void cancellationWhileWritingLeavesFileUntouched() throws Exception {
        FilesystemBackend real = workspace.getFilesystemBackend();
        FilesystemBackend backend = mock(FilesystemBackend.class, AdditionalAnswers.delegatesTo(real));
        CountDownLatch checking = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            checking.countDown();
            release.await(10, TimeUnit.SECONDS);
            return real.exists(invocation.getArgument(0));
        }).when(backend).exists(anyString());
        WorkspaceRuntime slow = TestWorkspaces.init(TestWorkspaces.builder(tempDir).filesystemBackend(backend));
        ToolCallContext ctx = TestWorkspaces.context("op");

        CompletableFuture<Tool.Result> future = new WriteFileTool(slow, mapper)
                .execute(args().put("path", "/late.txt").put("content", "x"), ctx);
        assertTrue(checking.await(10, TimeUnit.SECONDS));
        ctx.getSignal().cancel("Timed out");
        release.countDown();

        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(OperationCancelledException.class, e.getCause());
        verify(backend, never()).write(anyString(), anyString());
        assertFalse(Files.exists(fsRoot.resolve("late.txt")));
    }
}
