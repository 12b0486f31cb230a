package io.github.yok.dataporter.explain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.dataporter.config.ExplainConfig;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TimelineChartRendererTest {

    private TimelineChartRenderer renderer;

    @BeforeEach
    void setup() {
        // フォントが使えないヘッドレス環境では描画テストを行わない
        Assumptions.assumeTrue(fontsAvailable());
        ExplainConfig config = new ExplainConfig();
        config.setWidth(900);
        config.setHeight(600);
        renderer = new TimelineChartRenderer(config);
    }

    private static boolean fontsAvailable() {
        try {
            System.setProperty("java.awt.headless", "true");
            BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
            image.createGraphics().getFontMetrics().stringWidth("x");
            return true;
        } catch (Throwable t) {
            return false;
        }
    }

    private static TimelineChartLayout layout() {
        PlanSummary summary = new ExplainPlanAnalyzer().analyze(List.of(
                "Sort  (cost=1.0..2.0 rows=10 width=4) (actual time=5.000..6.000 rows=10 loops=1)",
                "  Sort Method: quicksort  Memory: 25kB",
                "  ->  Seq Scan on t  (cost=0.0..1.0 rows=10 width=4)"
                        + " (actual time=0.010..4.000 rows=10 loops=1)",
                "Planning Time: 0.100 ms", "Execution Time: 6.500 ms"));
        return TimelineChartLayout.of(summary, 20);
    }

    @Test
    void draw_正常ケース_設定サイズの画像が生成されること() {
        BufferedImage image = renderer.draw(layout());

        assertEquals(900, image.getWidth());
        assertEquals(600, image.getHeight());
    }

    @Test
    void render_正常ケース_親ディレクトリを作成してPNGが書き出されること(@TempDir Path dir)
            throws Exception {
        Path output = dir.resolve("out/plan.png");

        renderer.render(layout(), output);

        assertTrue(Files.size(output) > 0);
        BufferedImage read = ImageIO.read(output.toFile());
        assertEquals(900, read.getWidth());
    }

    @Test
    void render_正常ケース_操作なしのレイアウトでも画像が書き出されること(@TempDir Path dir)
            throws Exception {
        Path output = dir.resolve("empty.png");

        renderer.render(TimelineChartLayout.of(new TimelineBuilder().build(), 20), output);

        assertTrue(Files.exists(output));
    }
}
