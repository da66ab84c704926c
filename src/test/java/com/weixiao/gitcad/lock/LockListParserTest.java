package com.weixiao.gitcad.lock;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LockListParser 测试")
class LockListParserTest {

    @Test
    @DisplayName("解析 --json 输出")
    void parseJson() {
        String json = "[{\"id\":\"17\",\"path\":\"parts/bracket_uncompressed/.lockfile\","
                + "\"owner\":{\"name\":\"alice\"},\"locked_at\":\"2024-03-01T10:00:00Z\"}]";
        List<LockRecord> records = LockListParser.parseJson(json);
        assertThat(records).containsExactly(new LockRecord("parts/bracket_uncompressed/.lockfile", "alice", "17"));
    }

    @Test
    @DisplayName("空数组解析为空列表，非数组抛异常")
    void parseJson_edgeCases() {
        assertThat(LockListParser.parseJson("[]")).isEmpty();
        assertThatThrownBy(() -> LockListParser.parseJson("Locked files:")).isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> LockListParser.parseJson("{\"locks\":[]}")).isInstanceOf(JsonParseException.class);
    }

    @Test
    @DisplayName("文本输出：制表符分隔、空白分隔、多余字段与分隔行")
    void parseText() {
        String output = "a_uncompressed/.lockfile\talice\tID:1\n"
                + "-----------------\n"
                + "b_uncompressed/.lockfile    bob      ID:2   extra trailing fields\n"
                + "\n"
                + "c_uncompressed/.lockfile carol\n"
                + "garbage\n";
        List<LockRecord> records = LockListParser.parseText(output);
        assertThat(records).containsExactly(
                new LockRecord("a_uncompressed/.lockfile", "alice", "1"),
                new LockRecord("b_uncompressed/.lockfile", "bob", "2"),
                new LockRecord("c_uncompressed/.lockfile", "carol", ""));
    }

    @Test
    @DisplayName("从错误信息中尽力取出持有者，取不到时为 another user")
    void ownerFromError() {
        assertThat(LockListParser.ownerFromError("Locking x failed: already locked by alice")).isEqualTo("alice");
        assertThat(LockListParser.ownerFromError("Lock exists: locked by 'bob'.")).isEqualTo("bob");
        assertThat(LockListParser.ownerFromError("Lock exists")).isEqualTo("another user");
        assertThat(LockListParser.ownerFromError(null)).isEqualTo("another user");
    }

    @Test
    @DisplayName("识别 already locked 与 not locked")
    void classifiesErrors() {
        assertThat(LockListParser.isAlreadyLocked("Locking failed: Already locked by x")).isTrue();
        assertThat(LockListParser.isAlreadyLocked("permission denied")).isFalse();
        assertThat(LockListParser.isNotLocked("Unable to unlock: no matching locks found")).isTrue();
        assertThat(LockListParser.isNotLocked("file is not locked")).isTrue();
    }
}
