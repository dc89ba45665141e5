package com.memindex.hash;

import com.memindex.error.EmptyTermException;
import com.memindex.error.OversizedTermException;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 词项哈希表测试
 */
class TermHashTableTest {

    private BytesUsedCounter counter;
    private CharBlockPool charPool;
    private List<Integer> createdTermIds;
    private TermHashTable<PostingsArray> table;

    private final PostingFactory<PostingsArray> factory = new PostingFactory<>() {
        @Override
        public PostingsArray newPostingsArray(int size) {
            return new PostingsArray(size);
        }

        @Override
        public void newPosting(PostingsArray postings, int termId) {
            createdTermIds.add(termId);
            postings.intStarts[termId] = termId * 2;
            postings.byteStarts[termId] = termId * 5;
        }
    };

    @BeforeEach
    void setUp() {
        counter = new BytesUsedCounter();
        charPool = new CharBlockPool(10, 1 << 16, counter);
        createdTermIds = new ArrayList<>();
        table = new TermHashTable<>(charPool, factory, 4, 0.7f, 2, 255, counter);
    }

    private int add(String term) {
        return table.findOrCreate(term.toCharArray(), 0, term.length());
    }

    @Test
    @DisplayName("新词项返回非负编号，重复词项返回 -(id+1)")
    void testFindOrCreate() {
        assertEquals(0, add("apple"));
        assertEquals(1, add("banana"));
        assertEquals(-1, add("apple"));
        assertEquals(-2, add("banana"));
        assertEquals(2, add("cherry"));

        assertEquals(3, table.size());
        assertEquals(List.of(0, 1, 2), createdTermIds, "每个新词项只初始化一次");
        assertEquals("banana", table.termText(1));
        assertEquals(1, table.find("banana"));
        assertEquals(-1, table.find("durian"));
    }

    @Test
    @DisplayName("扩容后词项编号与句柄保持不变")
    void testRehashKeepsIdsStable() {
        Map<String, Integer> ids = new HashMap<>();
        Map<Integer, PostingHandle> handles = new HashMap<>();
        for (int i = 0; i < 5000; i++) {
            String term = "term" + i;
            int termId = add(term);
            assertEquals(i, termId);
            ids.put(term, termId);
            handles.put(termId, table.handle(termId));
        }
        assertTrue(table.capacity() >= 5000 / 0.7f, "槽位数应随负载因子扩容");
        assertEquals(0, Integer.bitCount(table.capacity()) - 1, "槽位数必须是 2 的幂");

        for (Map.Entry<String, Integer> entry : ids.entrySet()) {
            int termId = entry.getValue();
            assertEquals(-(termId + 1), add(entry.getKey()));
            assertEquals(entry.getKey(), table.termText(termId));
            assertEquals(handles.get(termId), table.handle(termId));
        }
        assertEquals(5000, table.size());
    }

    @Test
    @DisplayName("空词项与超长词项被拒绝且表不变")
    void testEmptyAndOversizedTerms() {
        add("keep");
        long bytesBefore = counter.get();
        int highWaterBefore = charPool.highWaterMark();

        assertThrows(EmptyTermException.class, () -> add(""));
        String oversized = "x".repeat(256);
        OversizedTermException exception = assertThrows(OversizedTermException.class, () -> add(oversized));
        assertTrue(exception.isRecoverable());

        assertEquals(1, table.size());
        assertEquals(bytesBefore, counter.get());
        assertEquals(highWaterBefore, charPool.highWaterMark());
        // 恰好等于上限的词项可以加入
        assertEquals(1, add("y".repeat(255)));
    }

    @Test
    @DisplayName("最大词项长度不超过字符块可容纳的长度")
    void testMaxTermLengthClampedByCharBlock() {
        CharBlockPool smallPool = new CharBlockPool(4, 100, counter);
        TermHashTable<PostingsArray> small = new TermHashTable<>(smallPool, factory, 4, 0.7f, 2, 255, counter);
        assertEquals(15, small.maxTermLength());
        assertThrows(OversizedTermException.class,
            () -> small.findOrCreate("abcdefghijklmnop".toCharArray(), 0, 16));
    }

    @Test
    @DisplayName("共享字符池的第二张表以文本偏移建立别名")
    void testFindOrCreateByTextStart() {
        TermHashTable<PostingsArray> follower = new TermHashTable<>(charPool, factory, 4, 0.7f, 2, 255, counter);
        add("alpha");
        add("beta");
        int highWater = charPool.highWaterMark();

        int alphaStart = table.handle(0).textStart();
        int betaStart = table.handle(1).textStart();
        assertEquals(0, follower.findOrCreateByTextStart(betaStart));
        assertEquals(1, follower.findOrCreateByTextStart(alphaStart));
        assertEquals(-1, follower.findOrCreateByTextStart(betaStart));

        assertEquals(highWater, charPool.highWaterMark(), "别名模式不复制文本");
        assertEquals("beta", follower.termText(0));
        assertEquals(0, follower.find("beta"));
    }

    @Test
    @DisplayName("clear 后表为空，稀疏时收缩槽位")
    void testClearAndShrink() {
        for (int i = 0; i < 1000; i++) {
            add("w" + i);
        }
        int grown = table.capacity();
        long beforeClear = counter.get();

        table.clear();
        assertEquals(0, table.size());
        assertEquals(-1, table.find("w1"));
        // 原有 1000 个词项不少于 grown/8，第一次 clear 不收缩
        assertEquals(grown, table.capacity());
        assertEquals(beforeClear, counter.get());

        table.clear();
        assertEquals(4, table.capacity(), "连续清空空表应收缩回初始容量");
        assertTrue(counter.get() < beforeClear);

        // 清空后编号重新从 0 开始
        assertEquals(0, add("w999"));
    }

    @Test
    @DisplayName("clear(true) 释放倒排数组与槽位，计数器只剩初始槽位与字符池")
    void testClearReleasingMemory() {
        for (int i = 0; i < 1000; i++) {
            add("w" + i);
        }
        long charPoolBytes = (long) charPool.blockCount() * charPool.blockSize() * Character.BYTES;
        assertTrue(counter.get() > charPoolBytes + 1000L * 4 * Integer.BYTES);

        table.clear(true);
        assertEquals(0, table.size());
        assertNull(table.postings());
        assertEquals(4, table.capacity());
        assertEquals(charPoolBytes + 4 * Integer.BYTES, counter.get());

        // 释放后仍可继续使用，倒排数组按初始大小重建
        assertEquals(0, add("fresh"));
        assertEquals(0, table.find("fresh"));
        assertTrue(table.postings().size < 1000);
    }

    @Test
    @DisplayName("按码点顺序返回词项编号")
    void testSortedTermIds() {
        String emoji = new String(Character.toChars(0x1F600));
        String[] terms = {"pear", "\uFB01", emoji, "apple", "app", "zebra", "Zebra", "\u00E9clair"};
        for (String term : terms) {
            add(term);
        }
        List<String> sorted = new ArrayList<>();
        for (int termId : table.sortedTermIds()) {
            sorted.add(table.termText(termId));
        }
        assertEquals(List.of("Zebra", "app", "apple", "pear", "zebra", "\u00E9clair", "\uFB01", emoji), sorted);
    }

    @Test
    @DisplayName("越界编号抛出 IllegalArgumentException")
    void testInvalidTermId() {
        add("only");
        assertThrows(IllegalArgumentException.class, () -> table.termText(1));
        assertThrows(IllegalArgumentException.class, () -> table.handle(-1));
    }

    @Test
    @DisplayName("构造参数校验")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new TermHashTable<>(charPool, factory, 3, 0.7f, 2, 255, counter));
        assertThrows(IllegalArgumentException.class,
            () -> new TermHashTable<>(charPool, factory, 4, 1.0f, 2, 255, counter));
        assertThrows(IllegalArgumentException.class,
            () -> new TermHashTable<>(charPool, factory, 4, 0.7f, 3, 255, counter));
        assertThrows(IllegalArgumentException.class,
            () -> new TermHashTable<>(charPool, factory, 4, 0.7f, 2, 0, counter));
    }
}
