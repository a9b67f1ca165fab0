package com.tablecast.hub.poll;

import com.tablecast.core.model.MesaRef;
import com.tablecast.core.model.VentaState;
import com.tablecast.core.msg.MessageTypes;
import com.tablecast.core.msg.OutboundMessages;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.metrics.MetricsService;
import com.tablecast.hub.pos.IPosClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls the POS for the open sale of every tracked mesa and notifies the mesa's
 * group with {@code venta-actualizada} when the sale's {@code updatedAt} moves.
 * <p>
 * Each mesa is checked independently with its own timeout: a slow or failing fetch
 * is logged and counted, and never holds back the others. A tick that is still
 * running when the next one fires makes the next one skip.
 * </p>
 */
public class VentaPoller {
    private static final Logger log = LoggerFactory.getLogger(VentaPoller.class);

    private final IPosClient posClient;
    private final FanoutDispatcher dispatcher;
    private final RevisionTracker tracker;
    private final MetricsService metricsService;
    private final Duration interval;
    private final Duration fetchTimeout;

    private final Set<MesaRef> tracked = ConcurrentHashMap.newKeySet();
    private Disposable task;

    public VentaPoller(IPosClient posClient,
                       FanoutDispatcher dispatcher,
                       RevisionTracker tracker,
                       MetricsService metricsService,
                       Duration interval,
                       Duration fetchTimeout) {
        this.posClient = posClient;
        this.dispatcher = dispatcher;
        this.tracker = tracker;
        this.metricsService = metricsService;
        this.interval = interval;
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * Registers a mesa for polling. Registered mesas are polled for the process lifetime.
     *
     * @return true if the mesa was not tracked yet
     */
    public boolean track(MesaRef mesa) {
        boolean added = tracked.add(mesa);
        if (added) {
            log.info("Tracking POS sale for mesa {}", mesa);
        }
        return added;
    }

    public void trackAll(Collection<MesaRef> mesas) {
        mesas.forEach(this::track);
    }

    public Set<MesaRef> getTracked() {
        return Set.copyOf(tracked);
    }

    /**
     * Starts the fixed-interval polling loop.
     */
    public synchronized void start() {
        if (task != null) {
            return;
        }
        log.info("Starting POS poller: interval={}ms, timeout={}ms, {} mesa(s) tracked",
            interval.toMillis(), fetchTimeout.toMillis(), tracked.size());
        task = Flux.interval(interval, interval, Schedulers.parallel())
            .onBackpressureDrop(tick -> log.warn("POS poll tick {} skipped, previous tick still running", tick))
            .concatMap(tick -> pollOnce(), 1)
            .subscribe(
                changed -> {
                },
                err -> log.error("POS poller stopped unexpectedly", err)
            );
    }

    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
            log.info("POS poller stopped");
        }
    }

    /**
     * Runs one check for every tracked mesa.
     *
     * @return Mono of the number of mesas whose sale changed
     */
    public Mono<Integer> pollOnce() {
        List<MesaRef> mesas = List.copyOf(tracked);
        return Flux.fromIterable(mesas)
            .flatMap(this::check)
            .filter(Boolean::booleanValue)
            .count()
            .map(Long::intValue);
    }

    /**
     * Fetches one mesa and notifies its group on a genuine change.
     *
     * @return Mono of true when a broadcast fired; never errors
     */
    Mono<Boolean> check(MesaRef mesa) {
        return posClient.fetchVenta(mesa)
            .timeout(fetchTimeout)
            .map(venta -> onFetched(mesa, venta))
            .defaultIfEmpty(false)
            .onErrorResume(err -> {
                metricsService.recordPollFailure();
                log.warn("POS fetch failed for mesa {}: {}", mesa, err.toString());
                return Mono.just(false);
            });
    }

    private boolean onFetched(MesaRef mesa, VentaState venta) {
        String marker = venta.getUpdatedAt();
        if (marker == null) {
            log.debug("Sale for mesa {} has no updatedAt, ignored", mesa);
            return false;
        }
        RevisionTracker.Outcome outcome = tracker.observe(mesa.key(), marker);
        switch (outcome) {
            case BASELINED -> {
                log.debug("Baseline for mesa {}: {}", mesa, marker);
                return false;
            }
            case UNCHANGED -> {
                return false;
            }
            default -> {
                metricsService.recordPollChange();
                int delivered = dispatcher.broadcast(mesa.topic(),
                    OutboundMessages.signal(MessageTypes.VENTA_ACTUALIZADA));
                log.info("Sale on mesa {} changed ({}), notified {} connection(s)", mesa, marker, delivered);
                return true;
            }
        }
    }
}
