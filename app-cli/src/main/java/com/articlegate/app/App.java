package com.articlegate.app;

import com.articlegate.app.logging.LogSetup;
import com.articlegate.core.config.AcquisitionConfig;
import com.articlegate.core.config.FeedSourceLoader;
import com.articlegate.core.config.YamlConfigLoader;
import com.articlegate.core.model.AcquisitionResult;
import com.articlegate.core.model.ArticleDocument;
import com.articlegate.core.model.Failure;
import com.articlegate.core.service.ContentAcquisitionService;
import com.articlegate.core.service.ResearchDigest;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 사용법: App &lt;topic&gt; [--config acquisition.yml] [--feeds rss_feeds.txt]
 *
 * topic 이 절대 URL 이면 그 페이지 하나, 아니면 피드 키워드 검색.
 * 성공 시 stdout 으로 ResearchDigest 텍스트 출력.
 *
 * 종료 코드: 0 성공, 2 키워드 불일치(정상 조기 종료), 3 그 밖의 실패, 64 사용법 오류
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_NO_MATCH = 2;
    static final int EXIT_FAILURE = 3;
    static final int EXIT_USAGE = 64;

    static final String USAGE = "usage: App <topic> [--config acquisition.yml] [--feeds rss_feeds.txt]";

    private App() {}

    public static void main(String[] args) {
        // 로그 초기화 (-Dag.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("ag.out.dir", "out"));
        LogSetup.init(outRoot.resolve("logs"));

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        int code = run(args, System.getenv(), System.out, System.err, ContentAcquisitionService::new);
        System.exit(code);
    }

    /** main 의 본체. 테스트에서는 서비스 생성기를 바꿔 끼운다 */
    static int run(String[] args,
                   Map<String, String> env,
                   PrintStream out,
                   PrintStream err,
                   Function<AcquisitionConfig, ContentAcquisitionService> serviceFactory) {
        Args parsed;
        try {
            parsed = Args.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        AcquisitionConfig config;
        try {
            config = loadConfig(parsed, env);
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "config load failed", e);
            err.println("configuration error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        AcquisitionResult<List<ArticleDocument>> result = serviceFactory.apply(config).acquire(parsed.topic());
        if (result.isSuccess()) {
            out.print(ResearchDigest.render(result.get()));
            out.flush();
            return EXIT_OK;
        }

        Failure f = result.failure().orElseThrow();
        err.println(f.kind() + ": " + f.reason());
        return f.kind() == Failure.Kind.NO_KEYWORD_MATCH ? EXIT_NO_MATCH : EXIT_FAILURE;
    }

    static AcquisitionConfig loadConfig(Args a, Map<String, String> env) throws IOException {
        AcquisitionConfig cfg = YamlConfigLoader.load(a.config() == null ? YamlConfigLoader.DEFAULT_PATH : a.config(), env);
        if (a.feeds() != null) {
            cfg = cfg.toBuilder().feedUrls(FeedSourceLoader.readFile(a.feeds())).build();
        }
        return cfg;
    }

    /** 명령행 인자 */
    record Args(String topic, Path config, Path feeds) {

        static Args parse(String[] args) {
            String topic = null;
            Path config = null;
            Path feeds = null;
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--config" -> config = Path.of(value(args, ++i, a));
                    case "--feeds" -> feeds = Path.of(value(args, ++i, a));
                    default -> {
                        if (a.startsWith("--")) throw new IllegalArgumentException("unknown option: " + a);
                        if (topic != null) throw new IllegalArgumentException("only one topic allowed");
                        topic = a;
                    }
                }
            }
            if (topic == null || topic.isBlank()) throw new IllegalArgumentException("missing topic");
            return new Args(topic, config, feeds);
        }

        private static String value(String[] args, int i, String opt) {
            if (i >= args.length) throw new IllegalArgumentException(opt + " requires a value");
            return args[i];
        }
    }
}
