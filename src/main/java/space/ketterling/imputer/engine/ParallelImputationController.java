package space.ketterling.imputer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.imputer.ImputationException;
import space.ketterling.imputer.model.ImputationLogEntry;
import space.ketterling.imputer.model.TimeSlice;

/**
 * Runs {@link SliceImputer} over many slices on a bounded thread pool.
 *
 * <p>
 * Results are collected in submission order, so the output order matches the
 * input order whatever order workers finish in. A worker exception is recorded
 * against its slice and the remaining slices carry on. Each worker keeps its own
 * list of unfilled cells; the lists are merged here once every slice is done.
 * </p>
 */
public class ParallelImputationController {
    private static final Logger log = LoggerFactory.getLogger(ParallelImputationController.class);

    private final SliceImputer worker;
    private final int threads;

    public ParallelImputationController(SliceImputer worker, int threads) {
        if (threads < 1)
            throw new IllegalArgumentException("threads must be >= 1");
        this.worker = worker;
        this.threads = threads;
    }

    /**
     * {@code max(1, floor(availableUnits * fraction))}.
     */
    public static int parallelism(int availableUnits, double fraction) {
        return Math.max(1, (int) Math.floor(availableUnits * fraction));
    }

    public static int parallelism(double fraction) {
        return parallelism(Runtime.getRuntime().availableProcessors(), fraction);
    }

    public int threads() {
        return threads;
    }

    public ImputationOutcome run(List<TimeSlice> slices) {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "impute-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Imputing {} slices on {} worker threads", slices.size(), threads);

        List<SliceResult> results = new ArrayList<>(slices.size());
        List<SliceFailure> failures = new ArrayList<>();
        List<ImputationLogEntry> merged = new ArrayList<>();
        try {
            List<Future<SliceResult>> futures = new ArrayList<>(slices.size());
            for (TimeSlice slice : slices) {
                futures.add(pool.submit(() -> {
                    MDC.put("job", "impute");
                    MDC.put("slice", slice.timestamp());
                    try {
                        return worker.impute(slice);
                    } finally {
                        MDC.remove("slice");
                        MDC.remove("job");
                    }
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                String ts = slices.get(i).timestamp();
                try {
                    SliceResult r = futures.get(i).get();
                    results.add(r);
                    merged.addAll(r.unfilled());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    failures.add(new SliceFailure(i, ts, cause));
                    log.warn("Slice {} failed: {}", ts, cause.toString(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImputationException("Interrupted while waiting for slice workers", e);
        } finally {
            shutdown(pool);
        }

        ImputationOutcome outcome = new ImputationOutcome(slices, results, failures, merged);
        log.info("Imputation done: slices ok={} failed={} cellsFilled={} cellsUnfilled={}",
                results.size(), failures.size(), outcome.filledCells(), outcome.unfilledCells());
        return outcome;
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("Imputation pool did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
