package io.github.yok.sqlmodelrunner.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.exception.ModelParseException;
import io.github.yok.sqlmodelrunner.model.Model;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelLoaderTest {

    @TempDir
    Path tempDir;

    private final ModelLoader loader = new ModelLoader();

    @Test
    void load_正常ケース_sqlファイルのみ_ファイル名順に読み込まれること() throws Exception {
        Files.writeString(tempDir.resolve("b_model.sql"), "SELECT 2", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("a_model.SQL"), "SELECT 1", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("README.md"), "# docs", StandardCharsets.UTF_8);
        Path sub = Files.createDirectory(tempDir.resolve("nested"));
        Files.writeString(sub.resolve("c_model.sql"), "SELECT 3", StandardCharsets.UTF_8);

        List<Model> models = loader.load(tempDir);

        assertEquals(List.of("a_model", "b_model"),
                models.stream().map(Model::getName).collect(Collectors.toList()));
    }

    @Test
    void load_正常ケース_空ディレクトリ_空リストが返ること() {
        assertTrue(loader.load(tempDir).isEmpty());
    }

    @Test
    void load_正常ケース_UTF8の日本語コメント_そのまま本文に保持されること() throws Exception {
        Files.writeString(tempDir.resolve("m.sql"), "-- 売上集計\nSELECT 1",
                StandardCharsets.UTF_8);

        Model model = loader.load(tempDir).get(0);

        assertEquals("-- 売上集計\nSELECT 1", model.getBody());
    }

    @Test
    void load_異常ケース_ディレクトリが存在しない_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class, () -> loader.load(tempDir.resolve("none")));
    }

    @Test
    void load_異常ケース_不正なモデルを含む_ModelParseExceptionが送出されること() throws Exception {
        Files.writeString(tempDir.resolve("bad.sql"), "-- materialized: bogus\nSELECT 1",
                StandardCharsets.UTF_8);

        ModelParseException ex =
                assertThrows(ModelParseException.class, () -> loader.load(tempDir));
        assertTrue(ex.getSourcePath().endsWith("bad.sql"));
    }
}
