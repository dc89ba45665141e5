package com.memindex.segment;

/**
 * 字段级倒排统计。
 *
 * @param docCount 至少含一个词项的文档数
 * @param sumDocFreq 所有词项文档频率之和
 * @param sumTotalTermFreq 所有词项总词频之和，不记录词频时为 -1
 */
public record FieldStats(int docCount, long sumDocFreq, long sumTotalTermFreq) {
}
