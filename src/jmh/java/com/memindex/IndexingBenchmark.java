package com.memindex;

import com.memindex.config.FieldOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.document.IndexDocument;
import com.memindex.index.IndexingSession;
import com.memindex.segment.InMemorySegmentWriterFactory;
import com.memindex.text.EnglishTokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 内存索引性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexingBenchmark {

    @State(Scope.Thread)
    public static class CorpusState {
        List<IndexDocument> documents;
        IndexingConfig postingsOnly;
        IndexingConfig withVectors;

        @Setup
        public void setup() {
            EnglishTokenizer tokenizer = new EnglishTokenizer();
            documents = new ArrayList<>();
            // 1000 篇文档，每篇两个字段
            for (int i = 0; i < 1000; i++) {
                documents.add(IndexDocument.analyze(tokenizer,
                        "title", "Document " + i + " about " + topic(i),
                        "body", generateBody(i)));
            }

            postingsOnly = IndexingConfig.defaults();

            withVectors = IndexingConfig.defaults();
            FieldOptions bodyOptions = new FieldOptions();
            bodyOptions.setTermVectors(true);
            bodyOptions.setTermVectorPositions(true);
            bodyOptions.setTermVectorOffsets(true);
            withVectors.getFieldOptions().put("body", bodyOptions);
        }

        private String topic(int index) {
            return switch (index % 4) {
                case 0 -> "Java programming";
                case 1 -> "Python data science";
                case 2 -> "machine learning";
                default -> "general content";
            };
        }

        private String generateBody(int index) {
            return "Document " + index + " content. " +
                   "This is a test document for benchmarking. " +
                   "It contains various words like Java, Python, programming, " +
                   "search, index, document, file, content, data, " +
                   "performance, benchmark, test, example. " +
                   "The quick brown fox jumps over the lazy dog. " +
                   " repeated text to increase size.".repeat(5);
        }
    }

    @State(Scope.Thread)
    public static class SmallBudgetState {
        IndexingConfig config;

        @Setup
        public void setup() {
            config = IndexingConfig.defaults();
            config.setRamBudgetBytes(4L * 1024 * 1024);
        }
    }

    @Benchmark
    public int indexPostingsOnly(CorpusState state) {
        return indexAll(state.documents, state.postingsOnly);
    }

    @Benchmark
    public int indexWithTermVectors(CorpusState state) {
        return indexAll(state.documents, state.withVectors);
    }

    @Benchmark
    public int indexWithRamFlushes(CorpusState corpus, SmallBudgetState budget) {
        return indexAll(corpus.documents, budget.config);
    }

    private static int indexAll(List<IndexDocument> documents, IndexingConfig config) {
        InMemorySegmentWriterFactory factory = new InMemorySegmentWriterFactory();
        try (IndexingSession session = new IndexingSession(config, factory)) {
            for (IndexDocument document : documents) {
                session.addDocument(document);
            }
            session.flush();
            return session.segmentCount();
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexingBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
