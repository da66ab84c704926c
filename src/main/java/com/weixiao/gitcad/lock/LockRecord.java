package com.weixiao.gitcad.lock;

import lombok.Value;

/**
 * 一条活动锁：被锁路径（代理锁文件，相对仓库根）、持有者、锁 id（可能为空串）。
 * archive 为按正向映射匹配出的归档；工作区中找不到对应归档时为 null。
 */
@Value
public class LockRecord {
    String path;
    String owner;
    String lockId;
    String archive;

    public LockRecord(String path, String owner, String lockId) {
        this(path, owner, lockId, null);
    }

    public LockRecord(String path, String owner, String lockId, String archive) {
        this.path = path;
        this.owner = owner;
        this.lockId = lockId;
        this.archive = archive;
    }

    /** 被锁路径的 POSIX 形式，用于与 {@code ArchivePaths#lockfileRelative} 比较。 */
    public String getPosixPath() {
        return path.replace('\\', '/');
    }

    public LockRecord withArchive(String archive) {
        return new LockRecord(path, owner, lockId, archive);
    }
}
