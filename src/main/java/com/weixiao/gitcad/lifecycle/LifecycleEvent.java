package com.weixiao.gitcad.lifecycle;

import lombok.Value;

import java.util.List;

/**
 * git 钩子事件，每种钩子一个变体，参数与 githooks(5) 约定一致。
 */
public interface LifecycleEvent {

    /** 事件名，同钩子名（如 "post-checkout"）。 */
    String hookName();

    @Value
    class PreCommit implements LifecycleEvent {
        @Override
        public String hookName() {
            return "pre-commit";
        }
    }

    /** branchFlag 为 "1" 表示切换分支，"0" 表示检出文件。 */
    @Value
    class PostCheckout implements LifecycleEvent {
        String oldRef;
        String newRef;
        String branchFlag;

        @Override
        public String hookName() {
            return "post-checkout";
        }
    }

    @Value
    class PostMerge implements LifecycleEvent {
        String squash;

        @Override
        public String hookName() {
            return "post-merge";
        }
    }

    /** kind 为 "amend" 或 "rebase"；stdin 为 git 传入的 &lt;old&gt; &lt;new&gt; 列表。 */
    @Value
    class PostRewrite implements LifecycleEvent {
        String kind;
        String stdin;

        @Override
        public String hookName() {
            return "post-rewrite";
        }
    }

    @Value
    class PrePush implements LifecycleEvent {
        String remoteName;
        String remoteUrl;
        List<String> refLines;

        @Override
        public String hookName() {
            return "pre-push";
        }
    }
}
