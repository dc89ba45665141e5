package com.memindex.hash;

/**
 * 由消费者提供的倒排记录工厂，决定每个词项的列布局与初始内容。
 *
 * @param <P> 倒排数组类型
 */
public interface PostingFactory<P extends PostingsArray> {

    /**
     * 创建指定容量的空倒排数组。
     */
    P newPostingsArray(int size);

    /**
     * 初始化新词项的记录。调用时 {@code postings.textStarts[termId]} 已经写入。
     */
    void newPosting(P postings, int termId);
}
