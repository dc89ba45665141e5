package com.memindex.segment;

import java.util.List;

/**
 * 词项在单个文档中的倒排项。
 *
 * @param docId 段内文档号
 * @param freq 文档内词频，不记录词频时为 -1
 * @param positions 按位置递增的出现记录，不记录位置时为空
 */
public record DocPosting(int docId, int freq, List<PositionEntry> positions) {

    public DocPosting {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (freq == 0 || freq < -1) {
            throw new IllegalArgumentException("词频必须为正数或 -1: " + freq);
        }
        positions = positions == null ? List.of() : List.copyOf(positions);
        if (!positions.isEmpty() && positions.size() != freq) {
            throw new IllegalArgumentException("位置数与词频不一致: " + positions.size() + " vs " + freq);
        }
        for (int index = 1; index < positions.size(); index++) {
            if (positions.get(index).position() < positions.get(index - 1).position()) {
                throw new IllegalArgumentException("位置必须非递减，下标=" + index);
            }
        }
    }

    /**
     * 按出现顺序返回位置序号。
     */
    public int[] positionValues() {
        int[] values = new int[positions.size()];
        for (int index = 0; index < values.length; index++) {
            values[index] = positions.get(index).position();
        }
        return values;
    }
}
