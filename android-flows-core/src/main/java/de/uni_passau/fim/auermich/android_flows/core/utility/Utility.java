package de.uni_passau.fim.auermich.android_flows.core.utility;

import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jf.dexlib2.Opcodes;
import org.jgrapht.util.ConcurrencyUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.regex.Pattern;

public final class Utility {

    // the dalvik bytecode level (Android API version)
    public static final Opcodes API_OPCODE = Opcodes.forApi(28);

    public static final String EXCLUSION_PATTERN_FILE = "exclude.txt";
    private static final Logger LOGGER = LogManager.getLogger(Utility.class);

    private Utility() {
        throw new UnsupportedOperationException("Utility class!");
    }

    /**
     * Reads the exclusion patterns from the {@link #EXCLUSION_PATTERN_FILE} on the class path. Each line
     * is a regular expression over dotted class names, e.g. {@code ^androidx\..*}.
     *
     * @return Returns a pattern matching any of the lines, or {@code null} if the file is missing or unreadable.
     */
    public static Pattern readExcludePatterns() {

        InputStream inputStream = Utility.class.getClassLoader().getResourceAsStream(EXCLUSION_PATTERN_FILE);

        if (inputStream == null) {
            LOGGER.warn("Couldn't find exclusion file!");
            return null;
        }

        StringBuilder builder = new StringBuilder();

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                if (first)
                    first = false;
                else
                    builder.append("|");
                builder.append(line);
            }
        } catch (IOException e) {
            LOGGER.error("Couldn't read from exclusion file!", e);
            return null;
        }
        return Pattern.compile(builder.toString());
    }

    /**
     * Splits the given items into (at most) {@code partitions} contiguous chunks and processes each chunk on a
     * bounded worker pool. The results are returned in chunk order once all workers completed, thus the
     * outcome does not depend on the scheduling of the workers.
     *
     * @param items The items to be processed.
     * @param partitions The desired number of chunks.
     * @param parallelism The number of worker threads.
     * @param worker The function processing a single chunk. It must not write to shared state.
     * @param <T> The item type.
     * @param <R> The result type of a single chunk.
     * @return Returns the chunk results in chunk order.
     */
    public static <T, R> List<R> processInPartitions(List<T> items, int partitions, int parallelism,
                                                     Function<List<T>, R> worker) {

        if (items.isEmpty()) {
            return new ArrayList<>();
        }

        int chunkSize = Math.max(1, (items.size() + partitions - 1) / Math.max(1, partitions));
        List<List<T>> chunks = Lists.partition(items, chunkSize);
        LOGGER.debug("Processing " + items.size() + " items in " + chunks.size() + " chunks on "
                + parallelism + " threads.");

        final var executor = ConcurrencyUtil.createThreadPoolExecutor(Math.max(1, parallelism));
        List<Future<R>> futures = new ArrayList<>(chunks.size());

        try {
            for (List<T> chunk : chunks) {
                futures.add(executor.submit(() -> worker.apply(chunk)));
            }

            // single barrier: wait for every worker before handing out any result
            List<R> results = new ArrayList<>(chunks.size());
            for (Future<R> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers!", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } finally {
            try {
                ConcurrencyUtil.shutdownExecutionService(executor);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while shutting down the worker pool!");
            }
        }
    }
}
