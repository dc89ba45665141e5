package com.memindex.hash;

import com.memindex.pool.CharBlockPool;

/**
 * 按词项文本排序词项编号，刷新前使用。
 *
 * 三数取中的快速排序，小区间改用插入排序。比较直接读取字符池，不为词项创建字符串。
 */
public final class TermIdSorter {
    private static final int INSERTION_SORT_THRESHOLD = 16;

    private TermIdSorter() {
        // 工具类，禁止实例化
    }

    /**
     * 对 termIds 的前 count 项原地排序。
     *
     * @param termIds 词项编号
     * @param count 参与排序的个数
     * @param textStarts 词项编号到文本起点的映射
     * @param charPool 文本所在字符池
     */
    public static void sort(int[] termIds, int count, int[] textStarts, CharBlockPool charPool) {
        if (count < 0 || count > termIds.length) {
            throw new IllegalArgumentException("排序个数越界: " + count);
        }
        quickSort(termIds, 0, count - 1, textStarts, charPool);
    }

    private static void quickSort(int[] ids, int low, int high, int[] textStarts, CharBlockPool pool) {
        while (high - low >= INSERTION_SORT_THRESHOLD) {
            int middle = (low + high) >>> 1;
            if (compare(ids[middle], ids[low], textStarts, pool) < 0) {
                swap(ids, middle, low);
            }
            if (compare(ids[high], ids[low], textStarts, pool) < 0) {
                swap(ids, high, low);
            }
            if (compare(ids[high], ids[middle], textStarts, pool) < 0) {
                swap(ids, high, middle);
            }
            int pivot = ids[middle];
            int left = low;
            int right = high;
            while (left <= right) {
                while (compare(ids[left], pivot, textStarts, pool) < 0) {
                    left++;
                }
                while (compare(ids[right], pivot, textStarts, pool) > 0) {
                    right--;
                }
                if (left <= right) {
                    swap(ids, left, right);
                    left++;
                    right--;
                }
            }
            // 先递归较短的一半，控制栈深
            if (right - low < high - left) {
                quickSort(ids, low, right, textStarts, pool);
                low = left;
            } else {
                quickSort(ids, left, high, textStarts, pool);
                high = right;
            }
        }
        insertionSort(ids, low, high, textStarts, pool);
    }

    private static void insertionSort(int[] ids, int low, int high, int[] textStarts, CharBlockPool pool) {
        for (int i = low + 1; i <= high; i++) {
            int current = ids[i];
            int j = i - 1;
            while (j >= low && compare(ids[j], current, textStarts, pool) > 0) {
                ids[j + 1] = ids[j];
                j--;
            }
            ids[j + 1] = current;
        }
    }

    private static int compare(int leftId, int rightId, int[] textStarts, CharBlockPool pool) {
        if (leftId == rightId) {
            return 0;
        }
        return pool.compareText(textStarts[leftId], textStarts[rightId]);
    }

    private static void swap(int[] ids, int i, int j) {
        int tmp = ids[i];
        ids[i] = ids[j];
        ids[j] = tmp;
    }
}
