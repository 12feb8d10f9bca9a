package com.articlegate.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RSS/Atom 피드 허용 목록 로더.
 * 우선순위: 환경변수(RSS_FEED_URLS, 쉼표/공백 구분) → 텍스트 파일(한 줄에 URL 하나, 빈 줄과 '#' 줄 무시).
 * 중복은 제거하고 처음 나온 순서를 유지한다.
 */
public final class FeedSourceLoader {

    public static final String ENV_FEED_URLS = "RSS_FEED_URLS";
    public static final Path DEFAULT_FILE = Path.of("config", "rss_feeds.txt");

    private static final Logger LOG = LoggerFactory.getLogger(FeedSourceLoader.class);

    private FeedSourceLoader() {}

    public static List<String> load(Map<String, String> env, Path file) {
        Objects.requireNonNull(env, "env");
        String envVal = env.get(ENV_FEED_URLS);
        if (envVal != null && !envVal.isBlank()) {
            return dedupe(EnvOverrides.splitList(envVal));
        }
        if (file == null || !Files.isRegularFile(file)) {
            return List.of();
        }
        return readFile(file);
    }

    /** 파일 형식만 읽는다. 파일이 없으면 빈 목록 */
    public static List<String> readFile(Path file) {
        if (!Files.isRegularFile(file)) return List.of();
        try {
            List<String> lines = new ArrayList<>();
            for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String s = raw.strip();
                if (s.isEmpty() || s.startsWith("#")) continue;
                lines.add(s);
            }
            LOG.debug("Loaded {} feed url(s) from {}", lines.size(), file);
            return dedupe(lines);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read feed list: " + file, e);
        }
    }

    static List<String> dedupe(List<String> in) {
        return List.copyOf(new LinkedHashSet<>(in));
    }
}
