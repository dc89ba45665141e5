package com.memindex.hash;

/**
 * 按词项编号并列存放的倒排记录。
 *
 * 每个词项一行：文本起点、整数记录起点、字节流起点以及最近一次出现的文档号。
 * 消费者通过子类追加自己需要的列，扩容时由 {@link #copyTo(PostingsArray, int)} 逐列复制。
 */
public class PostingsArray {
    public final int size;
    public final int[] textStarts;
    public final int[] intStarts;
    public final int[] byteStarts;
    public final int[] lastDocIds;

    public PostingsArray(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("倒排数组大小必须为正数: " + size);
        }
        this.size = size;
        this.textStarts = new int[size];
        this.intStarts = new int[size];
        this.byteStarts = new int[size];
        this.lastDocIds = new int[size];
    }

    /**
     * 每个词项占用的字节数，用于内存计量。子类追加列时需要累加。
     */
    public int bytesPerPosting() {
        return 4 * Integer.BYTES;
    }

    /**
     * 把前 count 行复制到更大的数组中。
     */
    public void copyTo(PostingsArray target, int count) {
        if (target.size < count) {
            throw new IllegalArgumentException("目标倒排数组容量不足: " + target.size + " < " + count);
        }
        System.arraycopy(textStarts, 0, target.textStarts, 0, count);
        System.arraycopy(intStarts, 0, target.intStarts, 0, count);
        System.arraycopy(byteStarts, 0, target.byteStarts, 0, count);
        System.arraycopy(lastDocIds, 0, target.lastDocIds, 0, count);
    }
}
