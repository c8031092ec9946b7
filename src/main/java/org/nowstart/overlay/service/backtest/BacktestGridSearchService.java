package org.nowstart.overlay.service.backtest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;
import java.util.stream.LongStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.overlay.data.dto.GridSearchRow;
import org.nowstart.overlay.data.dto.HistoricalTrade;
import org.nowstart.overlay.data.dto.LayerReport;
import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.model.RegimeBands;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.property.BacktestProperties;
import org.nowstart.overlay.data.type.BacktestLayer;
import org.nowstart.overlay.service.lifecycle.LifecycleRules;
import org.nowstart.overlay.service.regime.RegimeClassifier;
import org.springframework.stereotype.Service;

/**
 * Grid over VIX band triples, stop scalars and profit scalars. Every candidate re-runs the combined
 * layer on its own lifecycle; only the best {@code topK} rows are kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestGridSearchService {

    private final LayerReplayService layerReplayService;
    private final BacktestProperties backtestProperties;

    public List<GridSearchRow> search(List<HistoricalTrade> trades, RegimeRuleBook baseRuleBook) {
        List<List<Double>> bandValues = backtestProperties.resolveVixBandTriples();
        List<Double> stopScalarValues = backtestProperties.resolveStopScalarValues();
        List<Double> profitScalarValues = backtestProperties.resolveProfitScalarValues();

        long combinations = backtestProperties.combinationCount();
        if (combinations > backtestProperties.maxGridCombinations()) {
            throw new InvalidInputException(
                    "grid has " + combinations + " combinations, limit is " + backtestProperties.maxGridCombinations()
            );
        }
        Comparator<GridSearchRow> better = rankingComparator();
        int topK = backtestProperties.topK();
        long startedAtNanos = System.nanoTime();
        long logIntervalNanos = TimeUnit.SECONDS.toNanos(backtestProperties.gridProgressLogSeconds());
        AtomicLong processed = new AtomicLong(0L);
        AtomicLong nextLogAtNanos = new AtomicLong(startedAtNanos + logIntervalNanos);

        PriorityQueue<GridSearchRow> heap = runGridSearch(
                combinations,
                backtestProperties.gridParallelism(),
                topK,
                better,
                index -> {
                    // index = (band * stops + stop) * profits + profit
                    int profit = (int) (index % profitScalarValues.size());
                    long rest = index / profitScalarValues.size();
                    int stop = (int) (rest % stopScalarValues.size());
                    int band = (int) (rest / stopScalarValues.size());

                    GridSearchRow row = evaluate(
                            trades,
                            baseRuleBook,
                            bandValues.get(band),
                            stopScalarValues.get(stop),
                            profitScalarValues.get(profit)
                    );
                    logProgress(processed, nextLogAtNanos, logIntervalNanos, combinations, startedAtNanos);
                    return row;
                }
        );

        logProgressFinal(processed.get(), combinations, startedAtNanos);

        List<GridSearchRow> out = new ArrayList<>(heap);
        out.sort(better);
        return List.copyOf(out);
    }

    private GridSearchRow evaluate(
            List<HistoricalTrade> trades,
            RegimeRuleBook baseRuleBook,
            List<Double> bands,
            double stopScalar,
            double profitScalar
    ) {
        RegimeClassifier classifier = new RegimeClassifier(new RegimeBands(bands.get(0), bands.get(1), bands.get(2)));
        LayerReport report = layerReplayService.replay(
                BacktestLayer.COMBINED,
                trades,
                LifecycleRules.full(),
                classifier,
                baseRuleBook.scaled(stopScalar, profitScalar)
        );
        return new GridSearchRow(
                bands,
                stopScalar,
                profitScalar,
                report.compositeScore(),
                report.roiAnnualized(),
                report.performance().maxDrawdown(),
                report.performance().sharpeRatio(),
                report.performance().totalReturn()
        );
    }

    private Comparator<GridSearchRow> rankingComparator() {
        return Comparator
                .comparingDouble((GridSearchRow row) -> rankValue(row.compositeScore())).reversed()
                .thenComparing(Comparator.comparingDouble((GridSearchRow row) -> rankValue(row.roiAnnualized())).reversed())
                .thenComparing(Comparator.comparingDouble((GridSearchRow row) -> rankValue(row.totalReturn())).reversed());
    }

    private PriorityQueue<GridSearchRow> runGridSearch(
            long total,
            int parallelism,
            int topK,
            Comparator<GridSearchRow> better,
            LongFunction<GridSearchRow> evaluator
    ) {
        if (parallelism <= 1) {
            return searchOnStream(LongStream.range(0, total), topK, better, evaluator);
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> searchOnStream(LongStream.range(0, total).parallel(), topK, better, evaluator)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Grid search interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Grid search failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private PriorityQueue<GridSearchRow> searchOnStream(
            LongStream stream,
            int topK,
            Comparator<GridSearchRow> better,
            LongFunction<GridSearchRow> evaluator
    ) {
        return stream.collect(
                () -> new PriorityQueue<>(topK, better.reversed()),
                (heap, index) -> offerTopK(heap, evaluator.apply(index), topK, better),
                (left, right) -> {
                    for (GridSearchRow row : right) {
                        offerTopK(left, row, topK, better);
                    }
                }
        );
    }

    private void offerTopK(
            PriorityQueue<GridSearchRow> heap,
            GridSearchRow row,
            int topK,
            Comparator<GridSearchRow> better
    ) {
        if (heap.size() < topK) {
            heap.offer(row);
            return;
        }
        GridSearchRow worst = heap.peek();
        if (worst != null && better.compare(row, worst) < 0) {
            heap.poll();
            heap.offer(row);
        }
    }

    private double rankValue(double value) {
        return Double.isFinite(value) ? value : Double.NEGATIVE_INFINITY;
    }

    private void logProgress(
            AtomicLong processed,
            AtomicLong nextLogAtNanos,
            long logIntervalNanos,
            long total,
            long startedAtNanos
    ) {
        long done = processed.incrementAndGet();
        long now = System.nanoTime();
        long targetNanos = nextLogAtNanos.get();
        if (now < targetNanos || !nextLogAtNanos.compareAndSet(targetNanos, now + logIntervalNanos)) {
            return;
        }
        GridThroughput throughput = GridThroughput.of(done, startedAtNanos, now);
        log.info(
                "[Grid][Progress] done={}/{} ({}%) rate={}/s",
                done,
                total,
                String.format(Locale.US, "%.2f", (done * 100.0) / Math.max(1L, total)),
                throughput.ratePerSecond()
        );
    }

    private void logProgressFinal(long done, long total, long startedAtNanos) {
        GridThroughput throughput = GridThroughput.of(done, startedAtNanos, System.nanoTime());
        log.info(
                "[Grid][Done] done={}/{} elapsedSec={} rate={}/s",
                done,
                total,
                String.format(Locale.US, "%.2f", throughput.elapsedSeconds()),
                throughput.ratePerSecond()
        );
    }

    private record GridThroughput(double elapsedSeconds, long ratePerSecond) {

        static GridThroughput of(long done, long startedAtNanos, long nowNanos) {
            double elapsed = Math.max(1e-9, (nowNanos - startedAtNanos) / 1_000_000_000.0);
            return new GridThroughput(elapsed, Math.round(done / elapsed));
        }
    }
}
