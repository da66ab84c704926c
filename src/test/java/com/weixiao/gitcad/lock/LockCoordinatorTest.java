package com.weixiao.gitcad.lock;

import com.weixiao.gitcad.config.RepositoryConfig;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LockCoordinator 测试")
class LockCoordinatorTest {

    private static final Path PART = Path.of("part.FCStd");
    private static final String MARKER = "part_uncompressed/.lockfile";

    @TempDir
    Path repo;

    private ArchivePaths paths;
    private FakeLfsServer server;

    @BeforeEach
    void setUp() {
        paths = new ArchivePaths(repo, RepositoryConfig.defaults());
        server = new FakeLfsServer();
    }

    private LockCoordinator as(String actor) {
        return new LockCoordinator(paths, server.as(actor));
    }

    @Test
    @DisplayName("alice 加锁后 bob 被拒绝，bob 强制夺锁后 alice 被拒绝")
    void mutualExclusionAndSteal() {
        assertThat(as("alice").acquire(PART, "alice", false).isOk()).isTrue();

        Result<String> bob = as("bob").acquire(PART, "bob", false);
        assertThat(bob.getKind()).isEqualTo(ErrorKind.ALREADY_LOCKED);
        assertThat(bob.getFailure().getOwner()).isEqualTo("alice");

        assertThat(as("bob").acquire(PART, "bob", true).isOk()).isTrue();
        assertThat(as("bob").isLockedBy(PART, "bob").getValue()).isTrue();
        assertThat(as("alice").isLockedBy(PART, "alice").getValue()).isFalse();

        Result<String> alice = as("alice").acquire(PART, "alice", false);
        assertThat(alice.getKind()).isEqualTo(ErrorKind.ALREADY_LOCKED);
        assertThat(alice.getFailure().getOwner()).isEqualTo("bob");
    }

    @Test
    @DisplayName("加锁时创建并暂存代理锁文件，锁定的是代理锁文件")
    void acquire_createsAndStagesMarker() {
        Result<String> result = as("alice").acquire(PART, "alice", false);

        assertThat(result.getValue()).isEqualTo(MARKER);
        assertThat(Files.exists(repo.resolve(MARKER))).isTrue();
        assertThat(server.getCalls()).contains(List.of("git", "add", MARKER), List.of("git", "lfs", "lock", MARKER));
        assertThat(server.getLocks()).containsKey(MARKER);
    }

    @Test
    @DisplayName("自己已持有锁时再次加锁直接成功")
    void acquire_alreadyOwn() {
        as("alice").acquire(PART, "alice", false);
        int lockCalls = countLockCalls();

        assertThat(as("alice").acquire(PART, "alice", false).isOk()).isTrue();
        assertThat(countLockCalls()).isEqualTo(lockCalls);
    }

    @Test
    @DisplayName("旧版 git-lfs 不支持 --json 时退回文本解析")
    void listActive_textFallback() {
        server.withoutJson();
        server.put(MARKER, "carol");

        Result<List<LockRecord>> records = as("alice").listActive();

        assertThat(records.getValue()).extracting(LockRecord::getOwner).containsExactly("carol");
        Result<String> denied = as("alice").acquire(PART, "alice", false);
        assertThat(denied.getFailure().getOwner()).isEqualTo("carol");
    }

    @Test
    @DisplayName("释放锁；未锁定时返回 NOT_LOCKED")
    void release() {
        as("alice").acquire(PART, "alice", false);

        assertThat(as("alice").release(PART, "alice", false).isOk()).isTrue();
        assertThat(server.getLocks()).isEmpty();
        assertThat(as("alice").release(PART, "alice", false).getKind()).isEqualTo(ErrorKind.NOT_LOCKED);
    }

    @Test
    @DisplayName("不能不加 force 释放他人的锁")
    void release_othersLockNeedsForce() {
        as("alice").acquire(PART, "alice", false);

        assertThat(as("bob").release(PART, "bob", false).getKind()).isEqualTo(ErrorKind.COMMAND_FAILED);
        assertThat(as("bob").release(PART, "bob", true).isOk()).isTrue();
    }

    @Test
    @DisplayName("锁原语超时返回 TIMEOUT 而不是成功")
    void timeout() {
        server.timingOut();
        assertThat(as("alice").acquire(PART, "alice", false).getKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(as("alice").isLockedBy(PART, "alice").getKind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    @DisplayName("列出锁时按工作区中的归档标出对应文件")
    void listWithArchives() throws Exception {
        Files.write(repo.resolve("part.FCStd"), new byte[0]);
        server.put(MARKER, "alice");
        server.put("somewhere/else/.lockfile", "bob");

        List<LockRecord> records = as("alice").listWithArchives().getValue();

        assertThat(records).extracting(LockRecord::getArchive).containsExactly("part.FCStd", null);
    }

    private int countLockCalls() {
        return (int) server.getCalls().stream().filter(c -> c.size() > 2 && c.get(2).equals("lock")).count();
    }
}
