package com.memindex.hash;

import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 词项编号排序测试
 */
class TermIdSorterTest {

    @Test
    @DisplayName("随机词项排序结果与 UTF-8 字节序一致")
    void testSortMatchesUtf8Order() {
        CharBlockPool pool = new CharBlockPool(12, 1000, new BytesUsedCounter());
        Random random = new Random(7);
        int count = 500;
        String[] terms = new String[count];
        int[] textStarts = new int[count];
        for (int i = 0; i < count; i++) {
            StringBuilder builder = new StringBuilder();
            int length = 1 + random.nextInt(6);
            for (int j = 0; j < length; j++) {
                switch (random.nextInt(3)) {
                    case 0 -> builder.append((char) ('a' + random.nextInt(26)));
                    case 1 -> builder.append((char) (0xE000 + random.nextInt(0x1000)));
                    default -> builder.appendCodePoint(0x10000 + random.nextInt(0x1000));
                }
            }
            terms[i] = builder.toString();
            char[] chars = terms[i].toCharArray();
            textStarts[i] = pool.addText(chars, 0, chars.length);
        }

        int[] ids = new int[count];
        for (int i = 0; i < count; i++) {
            ids[i] = i;
        }
        TermIdSorter.sort(ids, count, textStarts, pool);

        for (int i = 1; i < count; i++) {
            byte[] previous = terms[ids[i - 1]].getBytes(StandardCharsets.UTF_8);
            byte[] current = terms[ids[i]].getBytes(StandardCharsets.UTF_8);
            assertTrue(Arrays.compareUnsigned(previous, current) <= 0,
                "位置 " + i + " 顺序错误: " + terms[ids[i - 1]] + " > " + terms[ids[i]]);
        }
    }

    @Test
    @DisplayName("只排序前 count 项")
    void testSortPrefixOnly() {
        CharBlockPool pool = new CharBlockPool(8, 10, new BytesUsedCounter());
        String[] terms = {"c", "b", "a"};
        int[] textStarts = new int[terms.length];
        for (int i = 0; i < terms.length; i++) {
            textStarts[i] = pool.addText(terms[i].toCharArray(), 0, 1);
        }
        int[] ids = {0, 1, 2};
        TermIdSorter.sort(ids, 2, textStarts, pool);
        assertArrayEquals(new int[]{1, 0, 2}, ids);

        assertThrows(IllegalArgumentException.class, () -> TermIdSorter.sort(ids, 4, textStarts, pool));
    }
}
