package io.github.yok.dataporter.explain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.ExplainConfig;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class ExplainOptionsTest {

    @Test
    void from_正常ケース_出力先省略時は設定値が使われること() {
        ExplainOptions options = ExplainOptions.from(
                CommandLineOptions.parse("explain", "--file", "plan.txt"), new ExplainConfig());

        assertEquals(Paths.get("plan.txt"), options.getInputFile());
        assertEquals(Paths.get("explain_plan.png"), options.getOutputFile());
        assertTrue(options.isRenderChart());
    }

    @Test
    void from_正常ケース_出力先と描画無効を指定する_指定値が使われること() {
        ExplainOptions options = ExplainOptions.from(CommandLineOptions.parse("explain", "-f",
                "plan.txt", "-o", "out/x.png", "--no-chart"), new ExplainConfig());

        assertEquals(Paths.get("out/x.png"), options.getOutputFile());
        assertFalse(options.isRenderChart());
    }

    @Test
    void from_異常ケース_file未指定_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ExplainOptions.from(CommandLineOptions.parse("explain"),
                        new ExplainConfig()));
        assertEquals("Missing required option --file", ex.getMessage());
    }
}
