package com.routing;

import com.routing.config.AppConfig;
import com.routing.core.BatchAggregator;
import com.routing.core.BestResult;
import com.routing.core.CycleAggregator;
import com.routing.core.CycleFinder;
import com.routing.core.LoggingProgressListener;
import com.routing.core.StreamingAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Paths;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: routing-cycle-detector [--sorted] <input_file|->";
    static final String SORTED_FLAG = "--sorted";
    static final String STDIN_PATH = "-";

    public static void main(String[] args) throws IOException {
        int exitCode = run(args, System.in, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one scan and prints the answer line to {@code out}.
     *
     * @return the process exit code
     * @throws IOException if the input cannot be opened or read
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) throws IOException {
        if (args.length == 0) {
            err.println(USAGE);
            return 1;
        }
        boolean sorted = SORTED_FLAG.equals(args[0]);
        if (sorted && args.length < 2) {
            err.println(USAGE);
            return 1;
        }
        String path = sorted ? args[1] : args[0];

        logger.info("Starting cycle detection on '{}' ({} mode)...", path, sorted ? "streaming" : "batch");
        long startTime = System.currentTimeMillis();

        CycleAggregator aggregator = createAggregator(sorted);
        Charset charset = AppConfig.getInputCharset();
        BestResult best;
        if (STDIN_PATH.equals(path)) {
            // stdin 不关闭; 与文件输入一样, 非法字节直接报错
            CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            best = aggregator.aggregate(new BufferedReader(new InputStreamReader(in, decoder)));
        } else {
            try (BufferedReader reader = Files.newBufferedReader(Paths.get(path), charset)) {
                best = aggregator.aggregate(reader);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Process completed in {} ms", duration);
        logger.info("Longest cycle: {}", best.isEmpty() ? "none" : best.getKey() + " with " + best.getLength() + " hops");

        out.println(best.format());
        out.flush();
        return 0;
    }

    static CycleAggregator createAggregator(boolean sorted) {
        CycleFinder finder = new CycleFinder();
        int progressInterval = AppConfig.getProgressInterval();
        if (sorted) {
            return new StreamingAggregator(finder, progressInterval, new LoggingProgressListener());
        }
        return new BatchAggregator(finder, progressInterval, new LoggingProgressListener());
    }
}
