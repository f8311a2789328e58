package hazop.risk.matrix;

import hazop.risk.domain.RiskEntry;
import hazop.risk.error.ComputationException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders the 5x5 risk matrix as SVG markup or a PNG image. PNG encoding runs on
 * a small dedicated pool with a bounded queue; a full queue rejects the render
 * and a running render is abandoned after the configured timeout.
 */
@Component
public class RiskMatrixRenderer {
    private static final Logger log = LoggerFactory.getLogger(RiskMatrixRenderer.class);
    public static final String PNG_MIME_TYPE = "image/png";

    private final ExecutorService executor;
    private final long timeoutMs;
    private final Clock clock;

    @Autowired
    public RiskMatrixRenderer(
            @Value("${hazop.matrix.raster.pool-size:2}") int poolSize,
            @Value("${hazop.matrix.raster.timeout-ms:5000}") long timeoutMs,
            @Value("${hazop.matrix.raster.queue-capacity:8}") int queueCapacity
    ) {
        this(poolSize, timeoutMs, queueCapacity, Clock.systemUTC());
    }

    RiskMatrixRenderer(int poolSize, long timeoutMs, int queueCapacity, Clock clock) {
        this(boundedPool(poolSize, timeoutMs, queueCapacity), timeoutMs, clock);
    }

    RiskMatrixRenderer(ExecutorService executor, long timeoutMs, Clock clock) {
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    public SvgRendering renderSvg(MatrixOptions options) {
        MatrixLayout layout = MatrixLayoutEngine.layout(options);
        return new SvgRendering(SvgMatrixWriter.write(layout), layout.width(), layout.height());
    }

    public ImageRendering renderImage(MatrixOptions options) {
        MatrixLayout layout = MatrixLayoutEngine.layout(options);
        CompletableFuture<byte[]> future;
        try {
            future = CompletableFuture.supplyAsync(() -> rasterize(layout), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Risk matrix rasterization rejected, render queue is full: size={}", options.size().wireValue());
            throw new ComputationException("Risk matrix renderer is busy", e);
        }
        try {
            byte[] png = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return new ImageRendering(png, PNG_MIME_TYPE, filename(options.size()), layout.width(), layout.height());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Risk matrix rasterization timed out after {} ms: size={}", timeoutMs, options.size().wireValue());
            throw new ComputationException("Risk matrix rasterization timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException("Risk matrix rasterization interrupted", e);
        } catch (ExecutionException e) {
            log.error("Risk matrix rasterization failed: size={}", options.size().wireValue(), e.getCause());
            throw new ComputationException("Risk matrix rasterization failed", e.getCause());
        }
    }

    /**
     * Options that highlight every cell occupied by a ranked entry.
     */
    public static MatrixOptions highlightingEntries(MatrixOptions base, List<RiskEntry> entries) {
        Set<MatrixCell> cells = new LinkedHashSet<>(base.highlightCells());
        for (RiskEntry entry : entries) {
            if (entry.hasRiskRanking()) {
                cells.add(new MatrixCell(entry.severity(), entry.likelihood()));
            }
        }
        return new MatrixOptions(base.size(), base.includeLabels(), base.includeLegend(), base.showScores(),
                base.title(), new ArrayList<>(cells), base.backgroundColor());
    }

    String filename(MatrixSize size) {
        String date = LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
        return "risk_matrix_" + size.wireValue() + "_" + date + ".png";
    }

    private static byte[] rasterize(MatrixLayout layout) {
        try {
            return PngMatrixRasterizer.rasterize(layout);
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    private static ExecutorService boundedPool(int poolSize, long timeoutMs, int queueCapacity) {
        if (poolSize < 1 || timeoutMs < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException(
                    "hazop.matrix.raster pool-size, timeout-ms and queue-capacity must be positive");
        }
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
