package com.weixiao.gitcad.result;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Result 测试")
class ResultTest {

    @Test
    @DisplayName("失败经 map 原样传递，成功时转换值")
    void mapPassesFailureThrough() {
        Result<Integer> ok = Result.success(21);
        Result<Integer> bad = Result.failure(ErrorKind.NOT_FOUND, "archive not found: a.FCStd");

        assertThat(ok.map(v -> v * 2).getValue()).isEqualTo(42);
        Result<String> mapped = bad.map(String::valueOf);
        assertThat(mapped.isOk()).isFalse();
        assertThat(mapped.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(mapped.getFailure().getMessage()).isEqualTo("archive not found: a.FCStd");
    }

    @Test
    @DisplayName("ALREADY_LOCKED 携带持有者")
    void alreadyLockedCarriesOwner() {
        Result<String> r = Result.failure(Failure.alreadyLocked("bob", "part.FCStd is already locked by bob"));

        assertThat(r.getKind()).isEqualTo(ErrorKind.ALREADY_LOCKED);
        assertThat(r.getFailure().getOwner()).isEqualTo("bob");
        assertThat(Failure.of(ErrorKind.TIMEOUT, "slow").getOwner()).isNull();
    }

    @Test
    @DisplayName("误用：对失败取值、对成功 castFailure 抛 IllegalStateException")
    void misuseThrows() {
        Result<String> bad = Result.failure(ErrorKind.IO_ERROR, "disk full");

        assertThatThrownBy(bad::getValue).isInstanceOf(IllegalStateException.class).hasMessageContaining("disk full");
        assertThatThrownBy(() -> Result.success("x").castFailure()).isInstanceOf(IllegalStateException.class);
        assertThat(Result.success("x").getFailure()).isNull();
    }
}
