package com.weixiao.gitcad.command;

import com.weixiao.gitcad.config.ConfigLoader;
import com.weixiao.gitcad.config.RepositoryConfig;
import com.weixiao.gitcad.lifecycle.ExitCodes;
import com.weixiao.gitcad.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

/**
 * gitcad install - 在 .git/hooks 写入调用 gitcad 的钩子脚本，并在没有配置文件时写入默认配置。
 * 已存在且不是由 gitcad 写入的钩子不会被覆盖，除非指定 --force。
 */
@Command(name = "install", mixinStandardHelpOptions = true, description = "安装 git 钩子与默认配置")
public class InstallCommand extends RepoCommand {

    private static final Logger log = LoggerFactory.getLogger(InstallCommand.class);

    static final List<String> HOOKS = List.of("pre-commit", "post-checkout", "post-merge", "post-rewrite", "pre-push");
    static final String MARKER = "# installed by gitcad";

    @Option(names = {"-f", "--force"}, description = "覆盖已存在的钩子")
    private boolean force;

    @Option(names = "--executable", paramLabel = "CMD", defaultValue = "gitcad", description = "钩子中调用的 gitcad 命令")
    private String executable;

    @Override
    protected int execute(Repository repo) throws IOException {
        Path hooksDir = gitCad.gitClient(repo).hooksPath()
                .map(p -> repo.getRoot().resolve(p).normalize())
                .orElse(repo.getHooksDir());
        log.debug("installing hooks into {}", hooksDir);
        Files.createDirectories(hooksDir);
        int code = ExitCodes.OK;
        for (String hook : HOOKS) {
            Path file = hooksDir.resolve(hook);
            if (Files.exists(file) && !force && !Files.readString(file, StandardCharsets.UTF_8).contains(MARKER)) {
                System.err.println("error: " + hook + " hook already exists; use --force to replace it");
                code = ExitCodes.BLOCKED;
                continue;
            }
            String script = "#!/bin/sh\n" + MARKER + "\nexec " + executable + " " + hook + " \"$@\"\n";
            Files.writeString(file, script, StandardCharsets.UTF_8);
            makeExecutable(file);
            log.debug("wrote hook {}", file);
            System.out.println("installed " + hook + " hook");
        }
        if (!ConfigLoader.hasConfig(repo.getRoot())) {
            ConfigLoader.save(repo.getRoot(), RepositoryConfig.defaults());
            System.out.println("wrote default config " + repo.getRoot().relativize(ConfigLoader.configPath(repo.getRoot())));
        }
        return code;
    }

    private static void makeExecutable(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            // 非 POSIX 文件系统（Windows），git for Windows 不看执行位
            log.debug("cannot set permissions on {}: {}", file, e.getMessage());
        }
    }
}
