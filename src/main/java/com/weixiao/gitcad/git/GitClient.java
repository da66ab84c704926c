package com.weixiao.gitcad.git;

import com.weixiao.gitcad.result.Result;

import java.util.List;
import java.util.Optional;

/**
 * 生命周期所需的 git 操作。路径均为相对仓库根的 POSIX 路径。
 */
public interface GitClient {

    /** 已暂存的新增 / 修改路径（不含删除）。 */
    Result<List<String>> stagedPaths();

    /** 两个提交之间变化的路径。 */
    Result<List<String>> changedPaths(String oldRev, String newRev);

    /**
     * 一次推送涉及的提交中变化的路径。
     * remoteOid 全零（新分支）时取本地有、任何远端都没有的提交。
     */
    Result<List<String>> pushedPaths(String localOid, String remoteOid);

    /** 修订是否存在（如 ORIG_HEAD）。 */
    boolean revisionExists(String rev);

    /** git config user.name；未配置时为空。 */
    Optional<String> userName();

    /** git config core.hooksPath；未配置时为空。 */
    Optional<String> hooksPath();

    /** 调用 git lfs 自带的同名钩子（git lfs post-checkout ... 等）。 */
    Result<Void> runLfsHook(String hookName, List<String> args, String stdin);

    /** git lfs pull，取回当前检出所需的 LFS 对象。 */
    Result<Void> lfsPull();
}
