package io.github.yok.dataporter.explain;

import io.github.yok.dataporter.config.ExplainConfig;
import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Composite;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Stroke;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.List;
import java.util.Locale;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Draws a {@link TimelineChartLayout} as a PNG timeline with Java2D.
 *
 * <p>
 * The image is sized as a 10 x 6 inch figure; point sizes are scaled with the configured pixel
 * width. The left 30% holds the wrapped operation labels and the bottom 30% the legend. Each
 * operation is a colored horizontal segment from its start to its end time with dotted guides down
 * to the x axis, a translucent bubble sized by its row count, the row/loop counts and, when
 * present, its sort annotation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimelineChartRenderer {

    private static final String TITLE = "PostgreSQL EXPLAIN ANALYZE output visualization";

    // matplotlib "tab10"
    private static final Color[] PALETTE = {new Color(0x1f77b4), new Color(0xff7f0e),
            new Color(0x2ca02c), new Color(0xd62728), new Color(0x9467bd), new Color(0x8c564b),
            new Color(0xe377c2), new Color(0x7f7f7f), new Color(0xbcbd22), new Color(0x17becf)};

    private static final Color GRID = new Color(0xd3d3d3);

    private static final double FIGURE_WIDTH_PT = 720d;

    private final ExplainConfig explainConfig;

    /**
     * Renders the layout and writes it as PNG.
     *
     * @param layout chart layout
     * @param output destination file (parent directories are created)
     * @throws IOException if the image cannot be written
     */
    public void render(TimelineChartLayout layout, Path output) throws IOException {
        BufferedImage image = draw(layout);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, "png", output.toFile())) {
            throw new IOException("No PNG writer available for " + output);
        }
        log.info("Timeline written: {}", output.toAbsolutePath());
    }

    /**
     * Draws the layout into a new image.
     *
     * @param layout chart layout
     * @return rendered image
     */
    BufferedImage draw(TimelineChartLayout layout) {
        int width = explainConfig.getWidth();
        int height = explainConfig.getHeight();
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING,
                    RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            new Plot(g, layout, width, height).paint();
        } finally {
            g.dispose();
        }
        return img;
    }

    /**
     * Coordinate mapping and drawing for one image.
     */
    private static final class Plot {

        private final Graphics2D g;
        private final TimelineChartLayout layout;
        private final double scale;
        private final int left;
        private final int right;
        private final int top;
        private final int bottom;
        private final int height;
        private final Font smallFont;
        private final Font titleFont;

        Plot(Graphics2D g, TimelineChartLayout layout, int width, int height) {
            this.g = g;
            this.layout = layout;
            this.scale = width / FIGURE_WIDTH_PT;
            this.height = height;
            this.left = (int) (width * 0.3);
            this.right = (int) (width * 0.9);
            this.top = (int) (height * 0.12);
            this.bottom = (int) (height * 0.7);
            this.smallFont = new Font(Font.SANS_SERIF, Font.PLAIN, pt(6));
            this.titleFont = new Font(Font.SANS_SERIF, Font.PLAIN, pt(10));
        }

        void paint() {
            drawFrame();
            for (TimelineChartLayout.Entry entry : layout.getEntries()) {
                drawEntry(entry);
            }
            layout.getPlanningTimeMs().ifPresent(
                    ms -> drawMarker(ms, String.format(Locale.US, "Planning Time:\n%.2f ms", ms),
                            pt(20), false));
            layout.getExecutionTimeMs().ifPresent(ms -> drawMarker(ms,
                    String.format(Locale.US, "Total Execution Time:\n%.2f ms", ms), pt(10),
                    true));
            drawLegend();
        }

        private void drawFrame() {
            g.setColor(Color.BLACK);
            g.setFont(titleFont);
            FontMetrics fm = g.getFontMetrics();
            int titleX = (left + right - fm.stringWidth(TITLE)) / 2;
            g.drawString(TITLE, titleX, top - pt(6));

            g.setStroke(new BasicStroke((float) scale * 0.8f));
            g.drawRect(left, top, right - left, bottom - top);

            g.setFont(smallFont);
            fm = g.getFontMetrics();
            DecimalFormat tickFormat = new DecimalFormat("#,##0.##");
            double step = niceStep(layout.getXMaxMs() / 6d);
            for (double v = 0d; v <= layout.getXMaxMs(); v += step) {
                int x = x(v);
                g.drawLine(x, bottom, x, bottom + pt(3));
                String label = tickFormat.format(v);
                g.drawString(label, x - fm.stringWidth(label) / 2, bottom + pt(3) + fm.getAscent());
            }
            String xLabel = "Run Time (ms)";
            g.drawString(xLabel, (left + right - fm.stringWidth(xLabel)) / 2,
                    bottom + pt(5) + 2 * fm.getHeight());

            List<List<String>> ticks = layout.getTickLabels();
            for (int i = 0; i < ticks.size(); i++) {
                int y = y(i);
                g.drawLine(left - pt(3), y, left, y);
                List<String> lines = ticks.get(i);
                int lineY = y - (lines.size() * fm.getHeight()) / 2 + fm.getAscent();
                for (String line : lines) {
                    g.drawString(line, left - pt(5) - fm.stringWidth(line), lineY);
                    lineY += fm.getHeight();
                }
            }

            String yLabel = "Query Parts";
            Graphics2D rotated = (Graphics2D) g.create();
            try {
                rotated.rotate(-Math.PI / 2);
                rotated.drawString(yLabel, -(top + bottom + fm.stringWidth(yLabel)) / 2,
                        pt(12));
            } finally {
                rotated.dispose();
            }
        }

        private void drawEntry(TimelineChartLayout.Entry entry) {
            Color color = PALETTE[entry.getPosition() % PALETTE.length];
            int y = y(entry.getPosition());
            int x0 = x(entry.getStartMs());
            int x1 = x(entry.getEndMs());
            int xMid = x(entry.getMidMs());

            Stroke dotted = new BasicStroke((float) scale * 0.8f, BasicStroke.CAP_BUTT,
                    BasicStroke.JOIN_MITER, 10f, new float[] {pt(1), pt(2)}, 0f);
            g.setStroke(dotted);
            g.setColor(GRID);
            g.draw(new Line2D.Double(left, y, right, y));

            Composite opaque = g.getComposite();
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.7f));
            g.setColor(color);
            int guideTop = y(entry.getPosition() + 0.4);
            g.draw(new Line2D.Double(x0, bottom, x0, guideTop));
            g.draw(new Line2D.Double(x1, bottom, x1, guideTop));
            g.setComposite(opaque);

            g.setStroke(new BasicStroke((float) scale * 1.5f));
            g.drawLine(x0, y, x1, y);
            g.drawLine(x0, y - pt(5), x0, y + pt(5));
            g.drawLine(x1, y - pt(5), x1, y + pt(5));

            g.setFont(smallFont);
            FontMetrics fm = g.getFontMetrics();
            if (!entry.getSortAnnotation().isEmpty()) {
                g.setColor(Color.BLACK);
                int lineY = y + fm.getAscent();
                for (String line : entry.getSortAnnotation().split("\n", -1)) {
                    g.drawString(line, xMid - fm.stringWidth(line) / 2, lineY);
                    lineY += fm.getHeight();
                }
            }

            int bubbleY = y(entry.getPosition() + 0.3);
            double diameter = Math.sqrt(entry.getBubbleArea()) * scale;
            if (diameter > 0d) {
                g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.5f));
                g.setColor(color);
                g.fill(new Ellipse2D.Double(xMid - diameter / 2d, bubbleY - diameter / 2d,
                        diameter, diameter));
                g.setComposite(opaque);
            }
            g.setColor(Color.BLACK);
            String[] bubbleLines = entry.getBubbleText().split("\n");
            int lineY = bubbleY - (bubbleLines.length * fm.getHeight()) / 2 + fm.getAscent();
            for (String line : bubbleLines) {
                g.drawString(line, xMid, lineY);
                lineY += fm.getHeight();
            }
        }

        private void drawMarker(double ms, String text, int textOffset, boolean alignRight) {
            int topPosition = layout.getPositionCount() - 1;
            int px = x(ms);
            int py = y(topPosition);
            int tx = x(ms) + textOffset;
            int ty = y(topPosition + 0.2);
            g.setFont(smallFont);
            FontMetrics fm = g.getFontMetrics();
            String[] lines = text.split("\n");
            int textWidth = 0;
            for (String line : lines) {
                textWidth = Math.max(textWidth, fm.stringWidth(line));
            }
            int textX = alignRight ? tx - textWidth : tx;
            g.setColor(Color.RED);
            g.setStroke(new BasicStroke((float) scale * 0.8f));
            g.drawLine(tx, ty, px, py);
            g.setColor(Color.BLACK);
            int lineY = ty - lines.length * fm.getHeight();
            for (String line : lines) {
                lineY += fm.getHeight();
                g.drawString(line, textX, lineY);
            }
        }

        private void drawLegend() {
            g.setFont(smallFont);
            FontMetrics fm = g.getFontMetrics();
            List<TimelineChartLayout.Entry> legend = layout.legendEntries();
            int rowHeight = fm.getHeight();
            int maxWidth = 0;
            for (TimelineChartLayout.Entry entry : legend) {
                maxWidth = Math.max(maxWidth, fm.stringWidth(entry.getLabel()));
            }
            int boxWidth = maxWidth + pt(30);
            int x = (left + right - boxWidth) / 2;
            int y = bottom + pt(5) + 3 * fm.getHeight();
            if (legend.isEmpty() || y >= height) {
                return;
            }
            g.setColor(GRID);
            g.setStroke(new BasicStroke((float) scale * 0.5f));
            g.drawRect(x, y, boxWidth, rowHeight * legend.size() + pt(4));
            int rowY = y + pt(2);
            for (TimelineChartLayout.Entry entry : legend) {
                Color color = PALETTE[entry.getPosition() % PALETTE.length];
                int midY = rowY + rowHeight / 2;
                g.setColor(color);
                g.setStroke(new BasicStroke((float) scale * 1.5f));
                g.drawLine(x + pt(4), midY, x + pt(20), midY);
                g.setColor(Color.BLACK);
                g.drawString(entry.getLabel(), x + pt(25), rowY + fm.getAscent());
                rowY += rowHeight;
            }
        }

        private int x(double ms) {
            return left + (int) Math.round(ms / layout.getXMaxMs() * (right - left));
        }

        private int y(double position) {
            // positions -0.5 .. count-0.5 span the plot area, position 0 at the bottom
            double span = Math.max(1, layout.getPositionCount());
            double ratio = (position + 0.5d) / span;
            return bottom - (int) Math.round(ratio * (bottom - top));
        }

        private int pt(double points) {
            return (int) Math.round(points * scale);
        }

        private static double niceStep(double raw) {
            double magnitude = Math.pow(10, Math.floor(Math.log10(raw)));
            double residual = raw / magnitude;
            if (residual > 5) {
                return 10 * magnitude;
            }
            if (residual > 2) {
                return 5 * magnitude;
            }
            if (residual > 1) {
                return 2 * magnitude;
            }
            return magnitude;
        }
    }
}
