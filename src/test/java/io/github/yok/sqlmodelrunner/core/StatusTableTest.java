package io.github.yok.sqlmodelrunner.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.sqlmodelrunner.exception.StatementExecutionException;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatusTableTest {

    @Test
    void コンストラクタ_正常ケース_全モデルがPENDINGで実行順に保持されること() {
        StatusTable table = new StatusTable(List.of("b", "a"));

        assertEquals(List.of("b", "a"), table.namesWithStatus(ModelStatus.PENDING));
        assertEquals("b", table.snapshot().get(0).getModelName());
    }

    @Test
    void markSucceeded_正常ケース_RUNNINGから遷移する_経過時間が記録されること() {
        StatusTable table = new StatusTable(List.of("a"));
        table.markRunning("a");
        table.markSucceeded("a", 12L);

        ExecutionRecord record = table.snapshot().get(0);
        assertEquals(ModelStatus.SUCCEEDED, record.getStatus());
        assertEquals(12L, record.getElapsedMillis());
        assertNull(record.getError());
    }

    @Test
    void markFailed_正常ケース_RUNNINGから遷移する_エラーが記録されること() {
        StatusTable table = new StatusTable(List.of("a"));
        StatementExecutionException error =
                new StatementExecutionException("a", "CREATE ...", "boom", null);
        table.markRunning("a");
        table.markFailed("a", error, 3L);

        ExecutionRecord record = table.snapshot().get(0);
        assertEquals(ModelStatus.FAILED, record.getStatus());
        assertSame(error, record.getError());
        assertEquals("CREATE ...", record.getFailedStatement());
    }

    @Test
    void markSkipped_正常ケース_PENDINGから遷移する_ブロック元と理由が記録されること() {
        StatusTable table = new StatusTable(List.of("a"));
        table.markSkipped("a", "up", "upstream model did not succeed");

        ExecutionRecord record = table.snapshot().get(0);
        assertEquals(ModelStatus.SKIPPED, record.getStatus());
        assertEquals("up", record.getBlockedBy());
        assertEquals("upstream model did not succeed", record.getSkipReason());
    }

    @Test
    void markSkipped_異常ケース_RUNNINGのモデル_IllegalStateExceptionが送出されること() {
        StatusTable table = new StatusTable(List.of("a"));
        table.markRunning("a");
        assertThrows(IllegalStateException.class, () -> table.markSkipped("a", null, "x"));
    }

    @Test
    void markSucceeded_異常ケース_PENDINGのモデル_IllegalStateExceptionが送出されること() {
        StatusTable table = new StatusTable(List.of("a"));
        assertThrows(IllegalStateException.class, () -> table.markSucceeded("a", 0L));
    }

    @Test
    void markRunning_異常ケース_終了済みのモデル_IllegalStateExceptionが送出されること() {
        StatusTable table = new StatusTable(List.of("a"));
        table.markRunning("a");
        table.markSucceeded("a", 0L);
        assertThrows(IllegalStateException.class, () -> table.markRunning("a"));
    }

    @Test
    void statusOf_異常ケース_未登録のモデル_IllegalArgumentExceptionが送出されること() {
        StatusTable table = new StatusTable(List.of("a"));
        assertThrows(IllegalArgumentException.class, () -> table.statusOf("zzz"));
    }
}
