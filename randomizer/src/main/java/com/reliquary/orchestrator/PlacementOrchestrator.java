package com.reliquary.orchestrator;

import com.reliquary.config.RandomizerConfig;
import com.reliquary.error.SearchException;
import com.reliquary.error.SearchExhaustedException;
import com.reliquary.model.AccessibilityModel;
import com.reliquary.search.PlacementResult;
import com.reliquary.search.PlacementSearch;
import com.reliquary.search.SeedContext;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Races placement workers over consecutive nonces and returns the placement of
 * the smallest successful nonce.
 *
 * <p>Protocol:
 * <ul>
 *   <li>every worker gets a bootstrap request with the model and seed, then one
 *       nonce at a time from a counter owned by the calling thread</li>
 *   <li>a retry reply is answered with the next nonce until the worker's
 *       dispatch budget is spent</li>
 *   <li>once a success is known, workers running a larger nonce are cancelled
 *       and their replies ignored; workers on a smaller nonce finish and take
 *       part in the tie-break, then stop</li>
 *   <li>any worker error cancels everything and fails the search</li>
 * </ul>
 * The accepted placement therefore depends only on (version, options, seed,
 * nonce base), not on thread timing.
 */
@Slf4j
@Singleton
public class PlacementOrchestrator {

    private final PlacementSearch search;
    private final RandomizerConfig config;

    @Inject
    public PlacementOrchestrator(PlacementSearch search, RandomizerConfig config) {
        this.search = search;
        this.config = config;
    }

    /**
     * Run a search.
     *
     * @param model       validated model, shared read-only with every worker
     * @param seedContext version, options and seed of this randomization
     * @param nonceBase   first nonce to dispatch
     * @return the winning placement
     * @throws SearchExhaustedException if every worker spent its budget without success
     * @throws SearchException          if a worker hit a contradiction
     * @throws InterruptedException     if the calling thread is interrupted; all
     *                                  workers are cancelled first
     */
    public OrchestrationResult search(AccessibilityModel model, SeedContext seedContext, long nonceBase)
            throws InterruptedException {
        int workerCount = config.effectiveWorkerCount();
        int budget = Math.max(config.getDispatchBudget(), 1);
        log.info("Searching relic placement for seed '{}': {} workers, {} rounds, budget {}, nonce base {}",
                seedContext.seed(), workerCount, config.getRounds(), budget, nonceBase);

        BlockingQueue<WorkerReply> replies = new LinkedBlockingQueue<>();
        List<PlacementWorker> workers = new ArrayList<>(workerCount);
        long[] inFlight = new long[workerCount];
        int[] dispatched = new int[workerCount];
        boolean[] stopped = new boolean[workerCount];
        NonceRace<PlacementResult> race = new NonceRace<>();
        long nextNonce = nonceBase;

        WorkerPool pool = new WorkerPool(workerCount);
        try {
            for (int i = 0; i < workerCount; i++) {
                PlacementWorker worker = new PlacementWorker(i, search, config.getRounds(), replies);
                workers.add(worker);
                pool.execute(worker);
            }
            for (PlacementWorker worker : workers) {
                int id = worker.getId();
                long nonce = nextNonce++;
                race.dispatched(nonce);
                inFlight[id] = nonce;
                dispatched[id]++;
                worker.send(WorkerMessage.AttemptRequest.first(nonce, model, seedContext));
            }

            while (!race.isDecided()) {
                if (!race.hasOutstanding()) {
                    long attempts = nextNonce - nonceBase;
                    log.info("Search for seed '{}' exhausted after {} attempts", seedContext.seed(), attempts);
                    throw new SearchExhaustedException(seedContext.seed(), attempts);
                }

                WorkerReply reply = replies.take();
                int id = reply.workerId();
                if (stopped[id] || !race.isOutstanding(reply.nonce())) {
                    log.debug("Ignoring reply of cancelled worker {} for nonce {}", id, reply.nonce());
                    continue;
                }

                if (reply.isError()) {
                    stopped[id] = true;
                    throw asSearchException(reply, seedContext.seed());
                }

                if (reply.done()) {
                    if (race.succeeded(reply.nonce(), reply.result())) {
                        log.debug("Worker {} succeeded at nonce {}", id, reply.nonce());
                        cancelBeaten(workers, inFlight, stopped, race);
                    }
                } else {
                    race.failed(reply.nonce());
                }

                if (race.hasWinner() || dispatched[id] >= budget) {
                    stop(workers.get(id), stopped);
                    continue;
                }
                long nonce = nextNonce++;
                race.dispatched(nonce);
                inFlight[id] = nonce;
                dispatched[id]++;
                workers.get(id).send(WorkerMessage.AttemptRequest.next(nonce));
            }

            OrchestrationResult result = new OrchestrationResult(race.getBestNonce(), race.getBest());
            log.info("Found relic placement for seed '{}' at nonce {} (complexity {}, {} nonces dispatched)",
                    seedContext.seed(), result.nonce(), result.complexity(), nextNonce - nonceBase);
            return result;
        } finally {
            for (PlacementWorker worker : workers) {
                stop(worker, stopped);
            }
            pool.shutdown();
        }
    }

    private void cancelBeaten(List<PlacementWorker> workers, long[] inFlight, boolean[] stopped,
                              NonceRace<PlacementResult> race) {
        for (PlacementWorker worker : workers) {
            int id = worker.getId();
            if (!stopped[id] && race.isOutstanding(inFlight[id]) && race.isBeaten(inFlight[id])) {
                race.abandon(inFlight[id]);
                stop(worker, stopped);
            }
        }
    }

    private static void stop(PlacementWorker worker, boolean[] stopped) {
        if (!stopped[worker.getId()]) {
            stopped[worker.getId()] = true;
            worker.send(WorkerMessage.CANCEL);
        }
    }

    private static SearchException asSearchException(WorkerReply reply, String seed) {
        Throwable error = reply.error();
        if (error instanceof SearchException searchException) {
            return searchException.withSeed(seed);
        }
        return new SearchException("Placement worker " + reply.workerId() + " failed at nonce "
                + reply.nonce() + ": " + error, seed, null, null, error);
    }
}
