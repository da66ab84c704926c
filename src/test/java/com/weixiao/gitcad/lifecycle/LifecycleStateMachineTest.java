package com.weixiao.gitcad.lifecycle;

import com.weixiao.gitcad.archive.ArchiveTransformer;
import com.weixiao.gitcad.archive.ChangeFile;
import com.weixiao.gitcad.config.ConfigLoader;
import com.weixiao.gitcad.config.RepositoryConfig;
import com.weixiao.gitcad.lock.FakeLfsServer;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Repository;
import com.weixiao.gitcad.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.weixiao.gitcad.GitCadTestUtil.randomBytes;
import static com.weixiao.gitcad.GitCadTestUtil.readZip;
import static com.weixiao.gitcad.GitCadTestUtil.text;
import static com.weixiao.gitcad.GitCadTestUtil.writeZip;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LifecycleStateMachine 测试")
class LifecycleStateMachineTest {

    private static final String OLD = "1111111111111111111111111111111111111111";
    private static final String NEW = "2222222222222222222222222222222222222222";
    private static final String ZERO = "0000000000000000000000000000000000000000";
    private static final String PART_CHANGEFILE = "part_uncompressed/.changefile";
    private static final String PART_MARKER = "part_uncompressed/.lockfile";

    @TempDir
    Path dir;

    private Repository repo;
    private FakeGitClient git;
    private FakeLfsServer server;
    private ByteArrayOutputStream errBytes;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(dir.resolve(".git"));
        repo = new Repository(dir);
        git = new FakeGitClient();
        server = new FakeLfsServer();
        errBytes = new ByteArrayOutputStream();
    }

    private int dispatch(LifecycleEvent event, String actor) {
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return new LifecycleStateMachine(repo, git, server.as(actor == null ? "nobody" : actor), err).dispatch(event, actor);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private static Map<String, byte[]> members(long seed) {
        Map<String, byte[]> m = new LinkedHashMap<>();
        m.put("Document.xml", text("<Document id=\"" + seed + "\"/>"));
        m.put("PartShape.brp", randomBytes(8 * 1024, seed));
        return m;
    }

    /** 写归档、导出、再把归档清空成"已导出"的空壳，返回原始成员。 */
    private Map<String, byte[]> exportedArchive(String name, long seed) throws Exception {
        Map<String, byte[]> m = members(seed);
        Path archive = writeZip(dir.resolve(name), m);
        ArchiveTransformer t = new ArchiveTransformer(new ArchivePaths(dir, RepositoryConfig.defaults()));
        assertThat(t.export(archive).isOk()).isTrue();
        Files.write(archive, new byte[0]);
        return m;
    }

    private static void assertSameMembers(Map<String, byte[]> actual, Map<String, byte[]> expected) {
        assertThat(actual.keySet()).containsExactlyInAnyOrderElementsOf(expected.keySet());
        expected.forEach((k, v) -> assertThat(actual.get(k)).as(k).isEqualTo(v));
    }

    @Nested
    @DisplayName("pre-commit")
    class PreCommit {

        @Test
        @DisplayName("暂存了非空的归档时拒绝提交并指出文件名")
        void nonEmptyArchiveBlocked() throws Exception {
            writeZip(dir.resolve("part.FCStd"), members(1));
            git.staged = List.of("part.FCStd");

            int code = dispatch(new LifecycleEvent.PreCommit(), "alice");

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(err()).contains("part.FCStd").contains("not empty");
        }

        @Test
        @DisplayName("归档为空壳且持有锁时放行")
        void emptyArchiveWithLockAllowed() throws Exception {
            exportedArchive("part.FCStd", 1);
            server.put(PART_MARKER, "alice");
            git.staged = List.of("part.FCStd", PART_CHANGEFILE, "part_uncompressed/Document.xml");

            assertThat(dispatch(new LifecycleEvent.PreCommit(), "alice")).isEqualTo(ExitCodes.OK);
        }

        @Test
        @DisplayName("要求锁但没有用户名时以配置错误拒绝")
        void missingActorBlocked() throws Exception {
            exportedArchive("part.FCStd", 1);
            git.staged = List.of(PART_CHANGEFILE);

            int code = dispatch(new LifecycleEvent.PreCommit(), null);

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(err()).contains("git config user.name");
        }

        @Test
        @DisplayName("锁在别人手里时拒绝提交")
        void lockHeldByOtherBlocked() throws Exception {
            exportedArchive("part.FCStd", 1);
            server.put(PART_MARKER, "bob");
            git.staged = List.of(PART_CHANGEFILE);

            int code = dispatch(new LifecycleEvent.PreCommit(), "alice");

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(err()).contains("don't have a lock on part.FCStd");
        }

        @Test
        @DisplayName("锁列表中的路径使用反斜杠时同样识别为持锁")
        void backslashLockPathRecognized() throws Exception {
            exportedArchive("part.FCStd", 1);
            server.put("part_uncompressed\\.lockfile", "alice");
            git.staged = List.of(PART_CHANGEFILE);

            assertThat(dispatch(new LifecycleEvent.PreCommit(), "alice")).isEqualTo(ExitCodes.OK);
        }

        @Test
        @DisplayName("不要求锁时只检查归档是否为空壳")
        void lockNotRequired() throws Exception {
            ConfigLoader.save(dir, RepositoryConfig.defaults().toBuilder().requireLock(false).build());
            exportedArchive("part.FCStd", 1);
            git.staged = List.of("part.FCStd", PART_CHANGEFILE);

            assertThat(dispatch(new LifecycleEvent.PreCommit(), null)).isEqualTo(ExitCodes.OK);
        }

        @Test
        @DisplayName("未预期的异常转为 FATAL")
        void unexpectedExceptionIsFatal() {
            git = new FakeGitClient() {
                @Override
                public Result<List<String>> stagedPaths() {
                    throw new IllegalStateException("boom");
                }
            };

            assertThat(dispatch(new LifecycleEvent.PreCommit(), "alice")).isEqualTo(ExitCodes.FATAL);
            assertThat(err()).contains("boom");
        }
    }

    @Nested
    @DisplayName("post-checkout / post-merge / post-rewrite")
    class PostEvents {

        @Test
        @DisplayName("切换分支后重建变化的归档，并先调用 lfs 钩子与 pull")
        void postCheckoutImportsChanged() throws Exception {
            Map<String, byte[]> original = exportedArchive("part.FCStd", 1);
            git.changed.put(OLD + ".." + NEW, List.of(PART_CHANGEFILE, "part_uncompressed/Document.xml"));

            int code = dispatch(new LifecycleEvent.PostCheckout(OLD, NEW, "1"), null);

            assertThat(code).isEqualTo(ExitCodes.OK);
            assertSameMembers(readZip(dir.resolve("part.FCStd")), original);
            assertThat(git.lfsCalls).containsExactly("post-checkout " + OLD + " " + NEW + " 1", "pull");
        }

        @Test
        @DisplayName("检出文件（flag=0）时不导入")
        void postCheckoutFileCheckoutSkipped() throws Exception {
            exportedArchive("part.FCStd", 1);
            git.changed.put(OLD + ".." + NEW, List.of(PART_CHANGEFILE));

            assertThat(dispatch(new LifecycleEvent.PostCheckout(OLD, NEW, "0"), null)).isEqualTo(ExitCodes.OK);
            assertThat(Files.size(dir.resolve("part.FCStd"))).isZero();
        }

        @Test
        @DisplayName("rebase 进行中时跳过，由 post-rewrite 处理")
        void postCheckoutDuringRebaseSkipped() throws Exception {
            exportedArchive("part.FCStd", 1);
            git.changed.put(OLD + ".." + NEW, List.of(PART_CHANGEFILE));
            Files.createDirectories(dir.resolve(".git/rebase-apply"));

            assertThat(dispatch(new LifecycleEvent.PostCheckout(OLD, NEW, "1"), null)).isEqualTo(ExitCodes.OK);
            assertThat(Files.size(dir.resolve("part.FCStd"))).isZero();
        }

        @Test
        @DisplayName("旧 ref 全零（首次检出）时扫描整个工作区")
        void postCheckoutInitialCloneScansTree() throws Exception {
            Map<String, byte[]> original = exportedArchive("part.FCStd", 1);

            assertThat(dispatch(new LifecycleEvent.PostCheckout(ZERO, NEW, "1"), null)).isEqualTo(ExitCodes.OK);
            assertSameMembers(readZip(dir.resolve("part.FCStd")), original);
        }

        @Test
        @DisplayName("lfs 失败只警告，不影响导入")
        void lfsFailureIsOnlyAWarning() throws Exception {
            Map<String, byte[]> original = exportedArchive("part.FCStd", 1);
            git.lfsFails = true;
            git.changed.put(OLD + ".." + NEW, List.of(PART_CHANGEFILE));

            assertThat(dispatch(new LifecycleEvent.PostCheckout(OLD, NEW, "1"), null)).isEqualTo(ExitCodes.OK);
            assertThat(err()).contains("warning:");
            assertSameMembers(readZip(dir.resolve("part.FCStd")), original);
        }

        @Test
        @DisplayName("没有 ORIG_HEAD 时 post-merge 什么也不做")
        void postMergeWithoutOrigHead() throws Exception {
            exportedArchive("part.FCStd", 1);
            git.origHead = false;

            assertThat(dispatch(new LifecycleEvent.PostMerge("0"), null)).isEqualTo(ExitCodes.OK);
            assertThat(Files.size(dir.resolve("part.FCStd"))).isZero();
        }

        @Test
        @DisplayName("一个归档导入失败时其余照常导入，退出码为 BLOCKED")
        void postMergeContinuesAfterFailure() throws Exception {
            exportedArchive("bad.FCStd", 1);
            Map<String, byte[]> good = exportedArchive("part.FCStd", 2);
            Files.writeString(dir.resolve("bad_uncompressed/binaries_1.zip"), "garbage", StandardCharsets.UTF_8);
            git.changed.put("ORIG_HEAD..HEAD", List.of("bad_uncompressed/.changefile", PART_CHANGEFILE));

            int code = dispatch(new LifecycleEvent.PostMerge("0"), null);

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(err()).contains("bad.FCStd");
            assertSameMembers(readZip(dir.resolve("part.FCStd")), good);
        }

        @Test
        @DisplayName(".changefile 指向仓库外的路径时拒绝导入，不写任何文件")
        void changefileOutsideRepoRejected() throws Exception {
            exportedArchive("part.FCStd", 1);
            String outside = "../" + dir.getFileName() + "-escaped.FCStd";
            ChangeFile.write(dir.resolve(PART_CHANGEFILE), outside, "0");
            Path escaped = dir.resolve(outside).normalize();

            int code = dispatch(new LifecycleEvent.PostRewrite("rebase", ""), null);

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(escaped).doesNotExist();
            assertThat(err()).contains(outside);
        }

        @Test
        @DisplayName(".changefile 指向的归档不映射到所在目录时拒绝导入")
        void changefileNamingOtherArchiveRejected() throws Exception {
            exportedArchive("part.FCStd", 1);
            ChangeFile.write(dir.resolve(PART_CHANGEFILE), "other.FCStd", "0");

            int code = dispatch(new LifecycleEvent.PostRewrite("rebase", ""), null);

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(dir.resolve("other.FCStd")).doesNotExist();
            assertThat(Files.size(dir.resolve("part.FCStd"))).isZero();
        }

        @Test
        @DisplayName("post-rewrite：amend 不导入，rebase 重建全部归档")
        void postRewrite() throws Exception {
            Map<String, byte[]> original = exportedArchive("part.FCStd", 1);

            assertThat(dispatch(new LifecycleEvent.PostRewrite("amend", OLD + " " + NEW + "\n"), null)).isEqualTo(ExitCodes.OK);
            assertThat(Files.size(dir.resolve("part.FCStd"))).isZero();

            assertThat(dispatch(new LifecycleEvent.PostRewrite("rebase", OLD + " " + NEW + "\n"), null)).isEqualTo(ExitCodes.OK);
            assertSameMembers(readZip(dir.resolve("part.FCStd")), original);
        }
    }

    @Nested
    @DisplayName("pre-push")
    class PrePush {

        private LifecycleEvent.PrePush push(String... lines) {
            return new LifecycleEvent.PrePush("origin", "git@example.com:team/cad.git", List.of(lines));
        }

        @Test
        @DisplayName("推送的归档都由当前用户持锁时放行")
        void allLockedAllowed() throws Exception {
            exportedArchive("part.FCStd", 1);
            server.put(PART_MARKER, "alice");
            git.pushed.put(NEW, List.of(PART_CHANGEFILE));

            assertThat(dispatch(push("refs/heads/main " + NEW + " refs/heads/main " + OLD), "alice")).isEqualTo(ExitCodes.OK);
            assertThat(git.lfsCalls).containsExactly("pre-push origin git@example.com:team/cad.git");
        }

        @Test
        @DisplayName("有归档未持锁时拒绝推送")
        void unlockedArchiveBlocked() throws Exception {
            exportedArchive("part.FCStd", 1);
            server.put(PART_MARKER, "bob");
            git.pushed.put(NEW, List.of(PART_CHANGEFILE));

            int code = dispatch(push("refs/heads/main " + NEW + " refs/heads/main " + OLD), "alice");

            assertThat(code).isEqualTo(ExitCodes.BLOCKED);
            assertThat(err()).contains("part.FCStd");
        }

        @Test
        @DisplayName("删除远端分支与格式错误的行不检查")
        void deletionsAndMalformedSkipped() throws Exception {
            exportedArchive("part.FCStd", 1);
            git.pushed.put(ZERO, List.of(PART_CHANGEFILE));

            int code = dispatch(push("(delete) " + ZERO + " refs/heads/old " + OLD, "garbage line"), "alice");

            assertThat(code).isEqualTo(ExitCodes.OK);
        }

        @Test
        @DisplayName("要求锁但没有用户名时拒绝")
        void missingActorBlocked() throws Exception {
            git.pushed.put(NEW, List.of(PART_CHANGEFILE));
            assertThat(dispatch(push("refs/heads/main " + NEW + " refs/heads/main " + ZERO), null)).isEqualTo(ExitCodes.BLOCKED);
        }

        @Test
        @DisplayName("不要求锁时直接放行")
        void lockNotRequired() throws Exception {
            ConfigLoader.save(dir, RepositoryConfig.defaults().toBuilder().requireLock(false).build());
            exportedArchive("part.FCStd", 1);
            git.pushed.put(NEW, List.of(PART_CHANGEFILE));

            assertThat(dispatch(push("refs/heads/main " + NEW + " refs/heads/main " + OLD), null)).isEqualTo(ExitCodes.OK);
        }
    }
}
