package com.newsenricher.app.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("App: 명령행 종료 코드 / 로컬 서버 대상 전체 실행")
class AppTest {

    static HttpServer s;
    static int port;

    @TempDir Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress(0), 0);
        port = s.getAddress().getPort();

        s.createContext("/noticia", ex -> respond(ex, 200, article()));
        s.start();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
    }

    private static String article() {
        StringBuilder body = new StringBuilder();
        for (int p = 0; p < 3; p++) {
            body.append("<p>");
            for (int i = 0; i < 40; i++) body.append("palabra").append(p).append('_').append(i).append(' ');
            body.append("</p>");
        }
        return "<html><head><title>Titular local</title>"
                + "<meta name=\"author\" content=\"Redacción\"></head>"
                + "<body><article><h1>Titular local</h1>" + body + "</article></body></html>";
    }

    private static void respond(HttpExchange ex, int code, String html) throws IOException {
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    @DisplayName("--help 는 사용법 출력 후 0")
    void help() {
        assertEquals(App.EXIT_OK, App.run(new String[]{"--help"}, out, err));
        assertThat(outBuf.toString(StandardCharsets.UTF_8)).contains("--input");
    }

    @Test
    @DisplayName("인자 오류는 1")
    void usageErrors() {
        assertEquals(App.EXIT_USAGE, App.run(new String[]{}, out, err));
        assertEquals(App.EXIT_USAGE, App.run(new String[]{"--bogus"}, out, err));
        assertEquals(App.EXIT_USAGE, App.run(new String[]{"--input", "x.txt", "--workers", "0"}, out, err));
        assertEquals(App.EXIT_USAGE, App.run(new String[]{"--input", "x.txt", "--workers"}, out, err));
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("--input is required", "Usage:");
    }

    @Test
    @DisplayName("입력 파일이 없으면 1")
    void missingInput() {
        String[] args = {"--input", dir.resolve("missing.txt").toString(), "--no-cache"};
        assertEquals(App.EXIT_USAGE, App.run(args, out, err));
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("Cannot read input");
    }

    @Test
    @DisplayName("URL 목록 → JSON Lines, 입력 순서 유지")
    void endToEnd_writesJsonLines() throws Exception {
        String target = "http://127.0.0.1:" + port + "/noticia";
        String indirect = "https://news.google.com/rd?url="
                + URLEncoder.encode(target, StandardCharsets.UTF_8);

        Path input = dir.resolve("urls.txt");
        Files.writeString(input, String.join("\n",
                "# lote de prueba",
                indirect,
                "",
                "not a url",
                ""));

        Path config = dir.resolve("enricher.yml");
        Files.writeString(config, String.join("\n",
                "cache:",
                "  path: \"" + dir.resolve("cache.db").toString().replace("\\", "/") + "\"",
                "rate:",
                "  minDelayMs: 0",
                "  maxDelayMs: 0",
                "  aggregatorBaseDelayMs: 0",
                "  aggregatorJitterMs: 0",
                "  aggregatorInitialMinMs: 0",
                "  aggregatorInitialMaxMs: 0",
                "  extraPauseEvery: 0",
                "resolver:",
                "  decoder: NONE",
                "  roundPauseMinMs: 0",
                "  roundPauseMaxMs: 0",
                ""));
        Path output = dir.resolve("out").resolve("results.jsonl");

        int code = App.run(new String[]{
                "--input", input.toString(),
                "--output", output.toString(),
                "--config", config.toString(),
                "--parallel", "--workers", "2"}, out, err);

        assertEquals(App.EXIT_OK, code, errBuf.toString(StandardCharsets.UTF_8));
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);

        ObjectMapper om = new ObjectMapper();
        JsonNode first = om.readTree(lines.get(0));
        assertEquals(0, first.get("index").asInt());
        assertEquals(indirect, first.get("input_url").asText());
        assertEquals(target, first.get("direct_url").asText());
        assertEquals("extract_url_params", first.get("method").asText());
        assertEquals("SUCCESS", first.get("status").asText());
        assertEquals("Titular local", first.get("metadata").get("title").asText());
        assertThat(first.get("content").asText()).contains("palabra0_0");
        assertThat(first.get("error_kind").isNull()).isTrue();

        JsonNode second = om.readTree(lines.get(1));
        assertEquals("not a url", second.get("input_url").asText());
        assertEquals("invalid_input", second.get("method").asText());
        assertEquals("INVALID_INPUT", second.get("error_kind").asText());

        assertThat(outBuf.toString(StandardCharsets.UTF_8)).contains("total=2", "success=1");

        // 같은 캐시에서 성공한 해석 기록만 내보내기
        Path dump = dir.resolve("cached.jsonl");
        assertEquals(App.EXIT_OK, App.run(new String[]{
                "--dump-cache", "--output", dump.toString(), "--config", config.toString()}, out, err));
        List<String> cached = Files.readAllLines(dump, StandardCharsets.UTF_8);
        assertThat(cached).hasSize(1);
        JsonNode rec = om.readTree(cached.get(0));
        assertEquals(indirect, rec.get("indirect_url").asText());
        assertEquals(target, rec.get("direct_url").asText());
    }
}
