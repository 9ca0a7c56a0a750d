package com.simdash.dashboard.engine;

import com.simdash.dashboard.config.PipelineSettings;
import com.simdash.dashboard.config.TimestampPolicy;
import com.simdash.dashboard.metrics.Metrics;
import com.simdash.dashboard.model.AxisRanges;
import com.simdash.dashboard.model.SeriesPoint;
import com.simdash.dashboard.model.VariableEvent;
import com.simdash.dashboard.render.CapturedFrame;
import com.simdash.dashboard.render.CapturedFrame.CapturedSeries;
import com.simdash.dashboard.render.FrameSource;
import com.simdash.dashboard.render.RenderConsumer;
import com.simdash.dashboard.render.RenderScheduler;
import com.simdash.dashboard.render.StepDownsampler;
import com.simdash.dashboard.source.EventConsumer;
import com.simdash.dashboard.source.EventSource;
import com.simdash.dashboard.source.Subscription;
import com.simdash.dashboard.state.SeriesStore;
import com.simdash.dashboard.state.TimeWeightedAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ingestion, aggregation and render hand-off for one dashboard.
 * <p>
 * One lock guards the series store, the aggregator, the dirty flag and the
 * counters. A batch is applied while holding it, and the render tick copies
 * its frame while holding it, so a snapshot never mixes statistics and
 * history from different moments.
 * <p>
 * Lifecycle: {@link #start()} subscribes and starts rendering;
 * {@link #shutdown()} stops rendering, unsubscribes, then clears state.
 */
@Slf4j
public class DashboardPipeline implements EventConsumer, FrameSource {

    private final PipelineSettings settings;
    private final EventSource eventSource;
    private final Metrics metrics;
    private final RenderScheduler renderScheduler;

    private final Object lock = new Object();

    // guarded by lock
    private final SeriesStore seriesStore;
    private final TimeWeightedAggregator aggregator = new TimeWeightedAggregator();
    private boolean dirty;
    private long totalEvents;
    private long eventsSinceLastTick;

    private Subscription subscription;
    private boolean started;
    private volatile boolean shutDown;

    public DashboardPipeline(
            PipelineSettings settings,
            EventSource eventSource,
            StepDownsampler downsampler,
            RenderConsumer renderConsumer,
            TaskScheduler renderTaskScheduler,
            Metrics metrics
    ) {
        this.settings = settings;
        this.eventSource = eventSource;
        this.metrics = metrics;
        this.seriesStore = new SeriesStore(settings.getMaxPoints());
        this.renderScheduler = new RenderScheduler(
                renderTaskScheduler,
                settings,
                this,
                downsampler,
                renderConsumer,
                eventSource,
                metrics
        );
        log.info("Initialized dashboard pipeline: {}", settings);
    }

    public synchronized void start() {
        if (started || shutDown) {
            return;
        }
        subscription = eventSource.subscribe(this);
        renderScheduler.start();
        started = true;
        log.info("Dashboard pipeline started, monitoring {} keys", settings.getMonitoredKeys().size());
    }

    /**
     * Apply a batch of events atomically with respect to render captures.
     * <p>
     * - Unmonitored keys are dropped silently
     * - Malformed entries are skipped and logged; the rest of the batch continues
     * - Every retained event is appended, aggregated and marks the pipeline dirty
     */
    @Override
    public void processEventBatch(List<VariableEvent> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        metrics.onBatchReceived(events.size());

        synchronized (lock) {
            if (shutDown) {
                log.debug("Pipeline shut down, dropping batch of {} events", events.size());
                return;
            }
            for (VariableEvent event : events) {
                applyEvent(event);
            }
            metrics.onRetainedPointsUpdated(seriesStore.totalRetainedPoints());
        }
    }

    private void applyEvent(VariableEvent event) {
        if (event == null || event.getKey() == null || event.getKey().isBlank()) {
            log.warn("Skipping event without key: {}", event);
            metrics.onEventMalformed();
            return;
        }
        String key = event.getKey();
        if (!settings.isMonitored(key)) {
            metrics.onEventIgnored();
            return;
        }
        Double timestamp = event.getTimestamp();
        Double value = event.getValue();
        if (timestamp == null || value == null
                || !Double.isFinite(timestamp) || !Double.isFinite(value)) {
            log.warn("Skipping malformed event for key {} (timestamp={}, value={})", key, timestamp, value);
            metrics.onEventMalformed();
            return;
        }
        if (settings.getTimestampPolicy() == TimestampPolicy.DROP_REGRESSIONS
                && aggregator.hasKey(key)
                && timestamp < aggregator.lastTime(key)) {
            log.debug("Dropping out-of-order event for key {} (timestamp={}, last={})",
                    key, timestamp, aggregator.lastTime(key));
            metrics.onEventOutOfOrder();
            return;
        }

        seriesStore.append(key, new SeriesPoint(timestamp, value));
        aggregator.addEvent(key, timestamp, value);
        totalEvents++;
        eventsSinceLastTick++;
        dirty = true;
        metrics.onEventAccepted();

        log.debug("Processed event {} = {} at time {}", key, value, timestamp);
    }

    @Override
    public Optional<CapturedFrame> captureIfDirty() {
        synchronized (lock) {
            if (!dirty) {
                return Optional.empty();
            }
            List<CapturedSeries> series = new ArrayList<>(settings.getMonitoredKeys().size());
            for (String key : settings.getMonitoredKeys()) {
                Double average = aggregator.hasKey(key) ? aggregator.average(key) : null;
                series.add(new CapturedSeries(key, seriesStore.snapshot(key), average));
            }
            CapturedFrame frame = new CapturedFrame(
                    series,
                    seriesStore.ranges(),
                    totalEvents,
                    eventsSinceLastTick
            );
            dirty = false;
            eventsSinceLastTick = 0;
            return Optional.of(frame);
        }
    }

    @Override
    public void restore(CapturedFrame frame) {
        synchronized (lock) {
            dirty = true;
            eventsSinceLastTick += frame.eventsSinceLastTick();
        }
    }

    /**
     * Stop rendering, unsubscribe, then clear state. Each step is attempted
     * even if an earlier one fails. Calling again does nothing.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;

        try {
            renderScheduler.stop();
        } catch (Exception e) {
            log.error("Failed to stop render scheduler", e);
        }

        try {
            if (subscription != null) {
                subscription.close();
            } else {
                eventSource.unsubscribe(this);
            }
        } catch (Exception e) {
            log.error("Failed to unsubscribe from event source", e);
        }

        synchronized (lock) {
            seriesStore.clear();
            aggregator.clear();
            dirty = false;
            eventsSinceLastTick = 0;
        }
        metrics.onRetainedPointsUpdated(0);
        log.info("Dashboard pipeline shut down (total events={})", totalEvents());
    }

    /* ---------- Read accessors ---------- */

    public boolean isDirty() {
        synchronized (lock) {
            return dirty;
        }
    }

    public long totalEvents() {
        synchronized (lock) {
            return totalEvents;
        }
    }

    public long eventsSinceLastTick() {
        synchronized (lock) {
            return eventsSinceLastTick;
        }
    }

    public List<SeriesPoint> seriesSnapshot(String key) {
        synchronized (lock) {
            return seriesStore.snapshot(key);
        }
    }

    /**
     * @see TimeWeightedAggregator#average(String)
     */
    public double average(String key) {
        synchronized (lock) {
            return aggregator.average(key);
        }
    }

    public boolean hasSeries(String key) {
        synchronized (lock) {
            return aggregator.hasKey(key);
        }
    }

    public AxisRanges ranges() {
        synchronized (lock) {
            return seriesStore.ranges();
        }
    }

    public RenderScheduler getRenderScheduler() {
        return renderScheduler;
    }
}
