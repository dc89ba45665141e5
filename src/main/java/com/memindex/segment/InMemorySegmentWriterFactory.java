package com.memindex.segment;

import com.memindex.config.IndexOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把每个段收集成 {@link FlushedSegment} 的输出端工厂，并校验调用顺序与排序约束。
 */
public class InMemorySegmentWriterFactory implements SegmentWriterFactory {
    private static final Logger logger = LoggerFactory.getLogger(InMemorySegmentWriterFactory.class);

    private final List<FlushedSegment> segments = new ArrayList<>();

    @Override
    public SegmentWriter open(SegmentInfo info) {
        if (info == null) {
            throw new IllegalArgumentException("段描述不能为空");
        }
        return new InMemorySegmentWriter(info);
    }

    /**
     * 已完成的段，按完成顺序。
     */
    public List<FlushedSegment> segments() {
        return List.copyOf(segments);
    }

    public FlushedSegment lastSegment() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("尚未完成任何段");
        }
        return segments.get(segments.size() - 1);
    }

    /**
     * 按码点比较词项，结果与比较 UTF-8 字节一致。
     */
    static int compareTerms(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Integer.compare(left.length() - leftIndex, right.length() - rightIndex);
    }

    private final class InMemorySegmentWriter implements SegmentWriter, NormsWriter {
        private final SegmentInfo info;
        private final InMemoryPostingsWriter postingsWriter = new InMemoryPostingsWriter();
        private final InMemoryTermVectorsWriter vectorsWriter = new InMemoryTermVectorsWriter();
        private final Map<String, byte[]> norms = new LinkedHashMap<>();
        private boolean finished;
        private boolean aborted;

        private InMemorySegmentWriter(SegmentInfo info) {
            this.info = info;
        }

        @Override
        public SegmentInfo info() {
            return info;
        }

        @Override
        public InvertedPostingsWriter postings() {
            return postingsWriter;
        }

        @Override
        public TermVectorsWriter termVectors() {
            return vectorsWriter;
        }

        @Override
        public NormsWriter norms() {
            return this;
        }

        @Override
        public void addNorms(String fieldName, byte[] fieldNorms) {
            checkOpen();
            if (norms.putIfAbsent(fieldName, fieldNorms.clone()) != null) {
                throw new IllegalStateException("字段 " + fieldName + " 的归一化因子重复写入");
            }
        }

        @Override
        public void finish(int numDocs) {
            checkOpen();
            if (postingsWriter.field != null || vectorsWriter.fields != null) {
                throw new IllegalStateException("段 " + info.name() + " 仍有未结束的字段或文档");
            }
            for (Map.Entry<String, byte[]> entry : norms.entrySet()) {
                if (entry.getValue().length != numDocs) {
                    throw new IllegalStateException("字段 " + entry.getKey() + " 的归一化因子数量 "
                        + entry.getValue().length + " 与文档数 " + numDocs + " 不一致");
                }
            }
            finished = true;
            FlushedSegment segment = new FlushedSegment(info.withDocCount(numDocs), postingsWriter.postings,
                postingsWriter.fieldStats, vectorsWriter.documents, norms, Instant.now());
            segments.add(segment);
            logger.debug("内存段 {} 已完成: {} 篇文档, {} 个词项", info.name(), numDocs, segment.termCount());
        }

        @Override
        public void abort() {
            aborted = true;
            logger.debug("内存段 {} 已丢弃", info.name());
        }

        private void checkOpen() {
            if (finished || aborted) {
                throw new IllegalStateException("段 " + info.name() + " 已关闭");
            }
        }

        private final class InMemoryPostingsWriter implements InvertedPostingsWriter {
            private final Map<String, List<TermPostings>> postings = new LinkedHashMap<>();
            private final Map<String, FieldStats> fieldStats = new LinkedHashMap<>();
            private String field;
            private IndexOptions options;
            private List<TermPostings> fieldTerms;
            private String term;
            private int termDocFreq;
            private long termTotalFreq;
            private List<DocPosting> termDocs;
            private int docId = -1;
            private int docFreq;
            private List<PositionEntry> docPositions;

            @Override
            public void startField(String fieldName, IndexOptions fieldOptions) {
                checkOpen();
                if (field != null) {
                    throw new IllegalStateException("字段 " + field + " 尚未结束");
                }
                if (postings.containsKey(fieldName)) {
                    throw new IllegalStateException("字段 " + fieldName + " 重复写入");
                }
                field = fieldName;
                options = fieldOptions;
                fieldTerms = new ArrayList<>();
            }

            @Override
            public void startTerm(String termText, int docFrequency, long totalTermFreq) {
                if (field == null || term != null) {
                    throw new IllegalStateException("startTerm 调用顺序错误: " + termText);
                }
                if (!fieldTerms.isEmpty()) {
                    String previous = fieldTerms.get(fieldTerms.size() - 1).term();
                    if (compareTerms(previous, termText) >= 0) {
                        throw new IllegalStateException("词项未严格递增: " + previous + " -> " + termText);
                    }
                }
                term = termText;
                termDocFreq = docFrequency;
                termTotalFreq = totalTermFreq;
                termDocs = new ArrayList<>();
                docId = -1;
            }

            @Override
            public void startDocument(int newDocId, int freq) {
                if (term == null || docPositions != null) {
                    throw new IllegalStateException("startDocument 调用顺序错误: " + newDocId);
                }
                if (newDocId <= docId) {
                    throw new IllegalStateException("词项 " + term + " 的文档号未严格递增: " + docId + " -> " + newDocId);
                }
                docId = newDocId;
                docFreq = freq;
                docPositions = new ArrayList<>();
            }

            @Override
            public void addPosition(int position, byte[] payload, int startOffset, int endOffset) {
                if (docPositions == null || !options.hasPositions()) {
                    throw new IllegalStateException("addPosition 调用顺序错误: " + term);
                }
                docPositions.add(new PositionEntry(position, startOffset, endOffset, payload));
            }

            @Override
            public void finishDocument() {
                if (docPositions == null) {
                    throw new IllegalStateException("finishDocument 调用顺序错误: " + term);
                }
                termDocs.add(new DocPosting(docId, docFreq, docPositions));
                docPositions = null;
            }

            @Override
            public void finishTerm() {
                if (term == null || docPositions != null) {
                    throw new IllegalStateException("finishTerm 调用顺序错误: " + term);
                }
                fieldTerms.add(new TermPostings(term, termDocFreq, termTotalFreq, termDocs));
                term = null;
                termDocs = null;
            }

            @Override
            public void finishField(FieldStats stats) {
                if (field == null || term != null) {
                    throw new IllegalStateException("finishField 调用顺序错误: " + field);
                }
                postings.put(field, List.copyOf(fieldTerms));
                fieldStats.put(field, stats);
                field = null;
                fieldTerms = null;
            }
        }

        private final class InMemoryTermVectorsWriter implements TermVectorsWriter {
            private final List<DocumentTermVectors> documents = new ArrayList<>();
            private int docId = -1;
            private int fieldsExpected;
            private Map<String, List<TermVectorEntry>> fields;
            private String field;
            private int termsExpected;
            private List<TermVectorEntry> terms;
            private String term;
            private int freq;
            private List<PositionEntry> positions;

            @Override
            public void startDocument(int newDocId, int numFields) {
                checkOpen();
                if (fields != null) {
                    throw new IllegalStateException("词向量文档 " + docId + " 尚未结束");
                }
                if (newDocId <= docId) {
                    throw new IllegalStateException("词向量文档号未严格递增: " + docId + " -> " + newDocId);
                }
                docId = newDocId;
                fieldsExpected = numFields;
                fields = new LinkedHashMap<>();
            }

            @Override
            public void startField(String fieldName, int numTerms, boolean withPositions, boolean withOffsets,
                                   boolean withPayloads) {
                if (fields == null || field != null) {
                    throw new IllegalStateException("词向量 startField 调用顺序错误: " + fieldName);
                }
                field = fieldName;
                termsExpected = numTerms;
                terms = new ArrayList<>();
            }

            @Override
            public void startTerm(String termText, int termFreq) {
                if (field == null || term != null) {
                    throw new IllegalStateException("词向量 startTerm 调用顺序错误: " + termText);
                }
                if (!terms.isEmpty()) {
                    String previous = terms.get(terms.size() - 1).term();
                    if (compareTerms(previous, termText) >= 0) {
                        throw new IllegalStateException("词向量词项未严格递增: " + previous + " -> " + termText);
                    }
                }
                term = termText;
                freq = termFreq;
                positions = new ArrayList<>();
            }

            @Override
            public void addPosition(int position, int startOffset, int endOffset, byte[] payload) {
                if (term == null) {
                    throw new IllegalStateException("词向量 addPosition 调用顺序错误");
                }
                positions.add(new PositionEntry(position, startOffset, endOffset, payload));
            }

            @Override
            public void finishTerm() {
                if (term == null) {
                    throw new IllegalStateException("词向量 finishTerm 调用顺序错误");
                }
                terms.add(new TermVectorEntry(term, freq, positions));
                term = null;
                positions = null;
            }

            @Override
            public void finishField() {
                if (field == null || term != null) {
                    throw new IllegalStateException("词向量 finishField 调用顺序错误: " + field);
                }
                if (terms.size() != termsExpected) {
                    throw new IllegalStateException("词向量字段 " + field + " 词项数不一致: "
                        + terms.size() + " vs " + termsExpected);
                }
                fields.put(field, List.copyOf(terms));
                field = null;
                terms = null;
            }

            @Override
            public void finishDocument() {
                if (fields == null || field != null) {
                    throw new IllegalStateException("词向量 finishDocument 调用顺序错误: " + docId);
                }
                if (fields.size() != fieldsExpected) {
                    throw new IllegalStateException("词向量文档 " + docId + " 字段数不一致: "
                        + fields.size() + " vs " + fieldsExpected);
                }
                documents.add(new DocumentTermVectors(docId, fields));
                fields = null;
            }
        }
    }
}
