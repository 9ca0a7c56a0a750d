package com.simdash.dashboard.render;

import com.simdash.dashboard.config.PipelineSettings;
import com.simdash.dashboard.metrics.Metrics;
import com.simdash.dashboard.model.SeriesPoint;
import com.simdash.dashboard.render.CapturedFrame.CapturedSeries;
import com.simdash.dashboard.source.EventSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-rate render tick that coalesces any amount of ingestion into at most
 * one snapshot per interval.
 *
 * On each tick:
 * - capture state if the frame source is dirty (under its lock)
 * - downsample and assemble the snapshot (outside the lock)
 * - publish to the render consumer
 *
 * A clean tick does nothing. A failing tick is logged, its frame is restored
 * for the next tick, and the schedule keeps running.
 */
@Slf4j
public class RenderScheduler {

    private final TaskScheduler taskScheduler;
    private final FrameSource frameSource;
    private final StepDownsampler downsampler;
    private final RenderConsumer renderConsumer;
    private final EventSource eventSource;
    private final Metrics metrics;

    private final List<String> keys;
    private final long intervalMs;
    private final int downsampleTarget;

    /**
     * Held for the whole of a tick; {@link #stop()} takes it to wait out an in-flight tick.
     */
    private final Object tickMutex = new Object();

    private volatile boolean running;
    private ScheduledFuture<?> scheduledTick;

    private final AtomicLong sequence = new AtomicLong();
    private volatile long lastRenderNanos = System.nanoTime();

    public RenderScheduler(
            TaskScheduler taskScheduler,
            PipelineSettings settings,
            FrameSource frameSource,
            StepDownsampler downsampler,
            RenderConsumer renderConsumer,
            EventSource eventSource,
            Metrics metrics
    ) {
        this.taskScheduler = taskScheduler;
        this.frameSource = frameSource;
        this.downsampler = downsampler;
        this.renderConsumer = renderConsumer;
        this.eventSource = eventSource;
        this.metrics = metrics;
        this.keys = settings.getMonitoredKeys();
        this.intervalMs = settings.getRefreshIntervalMs();
        this.downsampleTarget = settings.getDownsampleTarget();
    }

    public synchronized void start() {
        if (scheduledTick != null) {
            return;
        }
        running = true;
        lastRenderNanos = System.nanoTime();
        scheduledTick = taskScheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(intervalMs));
        log.info("Render scheduler started (interval={} ms, downsample target={})", intervalMs, downsampleTarget);
    }

    /**
     * Cancel future ticks. Returns once any tick already in progress has finished.
     */
    public synchronized void stop() {
        running = false;
        if (scheduledTick == null) {
            return;
        }
        scheduledTick.cancel(false);
        scheduledTick = null;
        synchronized (tickMutex) {
            log.info("Render scheduler stopped after {} snapshots", sequence.get());
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Scheduled entry point. The cancellation signal is checked once the tick
     * holds the tick mutex, never in the middle of a render, so a tick that
     * was waiting while {@link #stop()} ran does nothing.
     */
    void tick() {
        synchronized (tickMutex) {
            if (!running) {
                return;
            }
            renderIfDirty();
        }
    }

    /**
     * Run one render pass.
     *
     * @return true if a snapshot was published
     */
    public boolean renderIfDirty() {
        synchronized (tickMutex) {
            Optional<CapturedFrame> captured;
            try {
                captured = frameSource.captureIfDirty();
            } catch (Exception e) {
                log.error("Render tick failed while capturing state", e);
                metrics.onRenderFailed();
                return false;
            }
            if (captured.isEmpty()) {
                metrics.onRenderSkipped();
                return false;
            }

            CapturedFrame frame = captured.get();
            try {
                RenderSnapshot snapshot = assemble(frame);
                renderConsumer.render(snapshot);
                metrics.onRenderPublished();
                log.debug("Published snapshot {} ({} events since last tick)",
                        snapshot.sequence(), snapshot.eventsSinceLastTick());
                return true;
            } catch (Exception e) {
                log.error("Render tick failed, frame with {} new events will be retried",
                        frame.eventsSinceLastTick(), e);
                metrics.onRenderFailed();
                frameSource.restore(frame);
                return false;
            }
        }
    }

    private RenderSnapshot assemble(CapturedFrame frame) {
        Map<String, SeriesView> perKey = new LinkedHashMap<>();
        for (CapturedSeries series : frame.series()) {
            perKey.put(series.key(), toView(series));
        }

        long now = System.nanoTime();
        long sinceLastRender = TimeUnit.NANOSECONDS.toMillis(now - lastRenderNanos);
        lastRenderNanos = now;

        return new RenderSnapshot(
                sequence.incrementAndGet(),
                Instant.now(),
                perKey,
                frame.ranges(),
                frame.ranges() != null && frame.ranges().hasTimeSpan(),
                frame.totalEvents(),
                frame.eventsSinceLastTick(),
                sinceLastRender,
                eventSource.queueDepth(),
                eventSource.totalEventsProcessed()
        );
    }

    private SeriesView toView(CapturedSeries series) {
        String color = SeriesPalette.colorFor(keys.indexOf(series.key()));
        List<SeriesPoint> points = series.points();
        if (points.isEmpty()) {
            return new SeriesView(null, null, 0, List.of(), List.of(), color);
        }
        DownsampledSeries reduced = downsampler.downsample(points, downsampleTarget);
        return new SeriesView(
                points.get(points.size() - 1).value(),
                series.average(),
                points.size(),
                reduced.markers(),
                reduced.stepPath(),
                color
        );
    }
}
