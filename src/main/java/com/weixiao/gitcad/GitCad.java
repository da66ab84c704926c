package com.weixiao.gitcad;

import com.weixiao.gitcad.command.ExportCommand;
import com.weixiao.gitcad.command.ImportCommand;
import com.weixiao.gitcad.command.InstallCommand;
import com.weixiao.gitcad.command.LockCommand;
import com.weixiao.gitcad.command.LocksCommand;
import com.weixiao.gitcad.command.PostCheckoutCommand;
import com.weixiao.gitcad.command.PostMergeCommand;
import com.weixiao.gitcad.command.PostRewriteCommand;
import com.weixiao.gitcad.command.PreCommitCommand;
import com.weixiao.gitcad.command.PrePushCommand;
import com.weixiao.gitcad.command.UnlockCommand;
import com.weixiao.gitcad.git.GitClient;
import com.weixiao.gitcad.git.ProcessGitClient;
import com.weixiao.gitcad.lock.CommandRunner;
import com.weixiao.gitcad.lock.ProcessCommandRunner;
import com.weixiao.gitcad.repo.Repository;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * gitcad - 让 FreeCAD 归档（.FCStd）可以放进 git 的命令行入口。
 * 子命令分两类：git 钩子（pre-commit、post-checkout 等，由 install 写入的钩子脚本调用）与手动工具（export、lock 等）。
 * <p>
 * 工作目录（-C）与当前用户（--actor）由本类统一提供，子命令通过 @ParentCommand 获取。
 */
@Command(name = "gitcad", mixinStandardHelpOptions = true, description = "gitcad - FreeCAD 归档的 git 集成")
public class GitCad implements Runnable {

    @Option(names = {"-C", "--directory"}, paramLabel = "PATH",
            description = "以指定路径作为工作目录执行命令（默认为当前目录），子命令据此查找仓库根")
    private Path workingDirectory;

    @Option(names = "--actor", paramLabel = "NAME",
            description = "当前用户名，用于锁检查；默认取 git config user.name")
    private String actor;

    private final CommandRunner runner;

    public GitCad() {
        this(new ProcessCommandRunner());
    }

    public GitCad(CommandRunner runner) {
        this.runner = runner;
    }

    /**
     * 未指定子命令时打印用法说明。
     */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 返回命令的起始路径（工作目录），子命令从此路径向上查找 .git。
     *
     * @return 已规范化的绝对路径，不会为 null
     */
    public Path getStartPath() {
        Path base = workingDirectory != null ? workingDirectory : Paths.get("");
        return base.toAbsolutePath().normalize();
    }

    /** 外部命令执行器（git / git lfs）。 */
    public CommandRunner getRunner() {
        return runner;
    }

    /** 仓库对应的 git 客户端。 */
    public GitClient gitClient(Repository repo) {
        return new ProcessGitClient(repo.getRoot(), runner);
    }

    /**
     * 当前用户：--actor 优先，否则 git config user.name；都没有时返回 null。
     */
    public String resolveActor(Repository repo) {
        if (actor != null && !actor.isBlank()) {
            return actor.trim();
        }
        return gitClient(repo).userName().orElse(null);
    }

    /**
     * 创建配置好的 CommandLine 实例，包含所有已注册的子命令。
     * 这是执行 gitcad 命令的统一入口点，供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(new ProcessCommandRunner());
    }

    /** 同 {@link #createCommandLine()}，外部命令改由 runner 执行。 */
    public static CommandLine createCommandLine(CommandRunner runner) {
        return new CommandLine(new GitCad(runner))
                .addSubcommand("export", new ExportCommand())
                .addSubcommand("import", new ImportCommand())
                .addSubcommand("lock", new LockCommand())
                .addSubcommand("unlock", new UnlockCommand())
                .addSubcommand("locks", new LocksCommand())
                .addSubcommand("install", new InstallCommand())
                .addSubcommand("pre-commit", new PreCommitCommand())
                .addSubcommand("post-checkout", new PostCheckoutCommand())
                .addSubcommand("post-merge", new PostMergeCommand())
                .addSubcommand("post-rewrite", new PostRewriteCommand())
                .addSubcommand("pre-push", new PrePushCommand());
    }

    /**
     * 主入口方法。
     * 若需调试日志：-Dgitcad.debug=true 或环境变量 GITCAD_DEBUG=true，或 -Dgitcad.log.level=DEBUG。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("gitcad.debug"))
                || "true".equalsIgnoreCase(System.getenv("GITCAD_DEBUG"))) {
            System.setProperty("gitcad.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
