package io.github.yok.dataporter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.Test;

class SizeFormatUtilTest {

    @Test
    void formatSize_正常ケース_単位付き整数を指定する_桁区切りと空白が入ること() {
        assertEquals("1,234 kB", SizeFormatUtil.formatSize("1234kB"));
        assertEquals("25 kB", SizeFormatUtil.formatSize("25kB"));
        assertEquals("1,048,576 MB", SizeFormatUtil.formatSize("1048576MB"));
    }

    @Test
    void formatSize_正常ケース_空白区切りと小数を指定する_小数部が保持されること() {
        assertEquals("1,234.5 MB", SizeFormatUtil.formatSize("1234.5 MB"));
        assertEquals("0 B", SizeFormatUtil.formatSize("0B"));
    }

    @Test
    void formatSize_正常ケース_サイズでない文字列を指定する_そのまま返ること() {
        assertEquals("kB", SizeFormatUtil.formatSize("kB"));
        assertEquals("1234", SizeFormatUtil.formatSize("1234"));
        assertEquals("12 34kB", SizeFormatUtil.formatSize("12 34kB"));
        assertEquals("", SizeFormatUtil.formatSize(""));
        assertNull(SizeFormatUtil.formatSize(null));
    }

    @Test
    void formatSize_正常ケース_桁数の大きい数値を指定する_桁あふれしないこと() {
        assertEquals("12,345,678,901,234,567,890 kB",
                SizeFormatUtil.formatSize("12345678901234567890kB"));
    }
}
