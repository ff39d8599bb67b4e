package com.worksrec.config;

import com.worksrec.output.RecommendationJsonWriter;
import com.worksrec.parser.ParserDtos.ParseError;
import com.worksrec.recommendation.RecommendationModels;
import com.worksrec.service.SnapshotImportException;
import com.worksrec.service.SnapshotImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Batch mode: scores the snapshot file named by {@code recommendation.batch.input} ({@code -} for
 * stdin) once at startup and writes the JSON result to {@code recommendation.batch.output}, or to
 * stdout when unset. Console logging goes to stderr (see logback-spring.xml), so stdout carries
 * only the JSON.
 */
@Component
public class SnapshotFileRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SnapshotFileRunner.class);
    private static final String STDIN = "-";

    private final SnapshotImportService importService;
    private final RecommendationJsonWriter jsonWriter;
    private final String input;
    private final String output;
    private final Long seed;

    public SnapshotFileRunner(SnapshotImportService importService,
                              RecommendationJsonWriter jsonWriter,
                              @Value("${recommendation.batch.input:}") String input,
                              @Value("${recommendation.batch.output:}") String output,
                              @Value("${recommendation.batch.seed:#{null}}") Long seed) {
        this.importService = importService;
        this.jsonWriter = jsonWriter;
        this.input = input;
        this.output = output;
        this.seed = seed;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (input == null || input.isBlank()) {
            return;
        }

        String content = STDIN.equals(input) ? readStdin() : read(Path.of(input));
        RecommendationModels.RecommendationResult result;
        try {
            result = importService.recommend(content, seed);
        } catch (SnapshotImportException e) {
            for (ParseError error : e.errors()) {
                log.error("snapshot {} line={} section={} code={} {}", input, error.line(), error.section(), error.code(), error.message());
            }
            throw e;
        }

        String json = jsonWriter.write(result.recommendations());
        if (output == null || output.isBlank()) {
            System.out.println(json);
        } else {
            write(Path.of(output), json);
            log.info("batch recommendations written input={} output={} count={}", input, output, result.recommendations().size());
        }
    }

    private String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read snapshot " + path, e);
        }
    }

    private String readStdin() {
        try {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read snapshot from stdin", e);
        }
    }

    private void write(Path path, String json) {
        try {
            Files.writeString(path, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write recommendations to " + path, e);
        }
    }
}
