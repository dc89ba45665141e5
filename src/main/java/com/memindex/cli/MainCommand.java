package com.memindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.memindex.config.FieldOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.document.IndexDocument;
import com.memindex.document.IndexField;
import com.memindex.index.IndexingSession;
import com.memindex.index.IndexingStats;
import com.memindex.segment.FlushedSegment;
import com.memindex.segment.InMemorySegmentWriterFactory;
import com.memindex.segment.SegmentInfo;
import com.memindex.text.EnglishTokenizer;
import com.memindex.text.Tokenizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Command(
    name = "lmi",
    description = "🧠 内存倒排索引核心",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧠 内存倒排索引核心");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 一次索引运行的汇总，用于 JSON 输出。
     */
    record IndexReport(List<SegmentInfo> segments, IndexingStats stats, long ramBytesUsed, long elapsedMs,
                       List<FlushedSegment> flushed) {
    }

    @Command(name = "index", description = "📂 把文件逐个作为文档建立内存索引并输出段统计")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的文件或目录", arity = "1..*")
        private List<Path> sourcePaths;

        @Option(names = {"--config"}, description = "JSON 配置文件")
        private Path configFile;

        @Option(names = {"--field"}, description = "文档字段名", defaultValue = "body")
        private String fieldName;

        @Option(names = {"--ram-budget-mb"}, description = "内存预算（MB），超过后强制刷新")
        private Long ramBudgetMb;

        @Option(names = {"--max-buffered-docs"}, description = "每段最多缓冲的文档数")
        private Integer maxBufferedDocs;

        @Option(names = {"--max-term-length"}, description = "最大词项长度")
        private Integer maxTermLength;

        @Option(names = {"--term-vectors"}, description = "为字段存储词向量", defaultValue = "false")
        private boolean termVectors;

        @Option(names = {"--payload-delimiter"}, description = "载荷分隔符，例如 '|' 使 word|payload 带载荷")
        private Character payloadDelimiter;

        @Option(names = {"--dump"}, description = "输出完整的倒排内容", defaultValue = "false")
        private boolean dump;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            try {
                IndexingConfig config = buildConfig();
                List<Path> files = collectFiles(sourcePaths);
                Tokenizer tokenizer = new EnglishTokenizer(payloadDelimiter);
                InMemorySegmentWriterFactory writerFactory = new InMemorySegmentWriterFactory();

                long start = System.currentTimeMillis();
                long ramBytesUsed;
                IndexingStats stats;
                try (IndexingSession session = new IndexingSession(config, writerFactory)) {
                    for (Path file : files) {
                        String text = Files.readString(file);
                        session.addDocument(IndexDocument.of(new IndexField(fieldName, tokenizer.tokenize(text))));
                    }
                    session.flush();
                    ramBytesUsed = session.ramBytesUsed();
                    stats = session.stats();
                }
                long elapsed = System.currentTimeMillis() - start;
                List<FlushedSegment> segments = writerFactory.segments();

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(new IndexReport(
                        segments.stream().map(FlushedSegment::info).collect(Collectors.toList()),
                        stats, ramBytesUsed, elapsed, dump ? segments : List.of()));
                } else {
                    printTextResult(files.size(), segments, stats, elapsed);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        IndexingConfig buildConfig() throws IOException {
            IndexingConfig config = configFile != null ? IndexingConfig.load(configFile) : IndexingConfig.defaults();
            if (ramBudgetMb != null) {
                config.setRamBudgetBytes(ramBudgetMb * 1024L * 1024L);
            }
            if (maxBufferedDocs != null) {
                config.setMaxBufferedDocs(maxBufferedDocs);
            }
            if (maxTermLength != null) {
                config.setMaxTermLength(maxTermLength);
            }
            if (termVectors) {
                FieldOptions options = config.optionsFor(fieldName).copy();
                options.setTermVectors(true);
                options.setTermVectorPositions(true);
                options.setTermVectorOffsets(true);
                options.setTermVectorPayloads(true);
                config.getFieldOptions().put(fieldName, options);
            }
            config.validate();
            return config;
        }

        private List<Path> collectFiles(List<Path> paths) throws IOException {
            List<Path> files = new ArrayList<>();
            for (Path path : paths) {
                if (Files.isDirectory(path)) {
                    try (Stream<Path> walk = Files.walk(path)) {
                        walk.filter(Files::isRegularFile).sorted().forEach(files::add);
                    }
                } else if (Files.isRegularFile(path)) {
                    files.add(path);
                } else {
                    throw new IOException("路径不存在: " + path);
                }
            }
            return files;
        }

        private void printTextResult(int fileCount, List<FlushedSegment> segments, IndexingStats stats, long elapsed) {
            System.out.println("✅ 索引完成！");
            System.out.println("📊 统计:");
            System.out.println("   文档数: " + fileCount);
            System.out.println("   词项数: " + stats.getTokensIndexed());
            System.out.println("   跳过词项: " + stats.getSkippedTokens());
            System.out.println("   段数量: " + segments.size());
            System.out.println("   强制刷新: " + stats.getResourceExhaustedFlushes());
            System.out.println("   峰值内存: " + formatBytes(stats.getPeakRamBytes()));
            System.out.println("   用时: " + elapsed + "ms");
            for (FlushedSegment segment : segments) {
                SegmentInfo info = segment.info();
                System.out.println("─────────────────────────────────");
                System.out.printf("📦 %s  docBase=%d  文档=%d  词条=%d%n",
                    info.name(), info.docBase(), info.docCount(), segment.termCount());
                if (dump) {
                    segment.postings().forEach((field, terms) -> terms.forEach(postings ->
                        System.out.printf("   %s:%s  df=%d  docs=%s%n", field, postings.term(),
                            postings.docFreq(), Arrays.toString(postings.docIds()))));
                }
            }
        }

        private void printJsonResult(IndexReport report) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
    }
}
