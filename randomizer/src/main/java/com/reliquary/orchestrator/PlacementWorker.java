package com.reliquary.orchestrator;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.search.PlacementResult;
import com.reliquary.search.PlacementSearch;
import com.reliquary.search.SeedContext;
import com.reliquary.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One search worker. Reads requests from its own inbox, runs up to
 * {@code rounds} attempts per request on the request's random stream and posts
 * exactly one reply per request to the shared reply queue.
 *
 * <p>Exits on {@link WorkerMessage.Cancel}, checked before each request and
 * between rounds, or after reporting an error.
 */
@Slf4j
public class PlacementWorker implements Runnable {

    private final int id;
    private final PlacementSearch search;
    private final int rounds;
    private final BlockingQueue<WorkerMessage> inbox = new LinkedBlockingQueue<>();
    private final BlockingQueue<WorkerReply> replies;

    private AccessibilityModel model;
    private SeedContext seedContext;

    public PlacementWorker(int id, PlacementSearch search, int rounds, BlockingQueue<WorkerReply> replies) {
        this.id = id;
        this.search = search;
        this.rounds = Math.max(rounds, 1);
        this.replies = replies;
    }

    public int getId() {
        return id;
    }

    public void send(WorkerMessage message) {
        inbox.add(message);
    }

    @Override
    public void run() {
        try {
            while (true) {
                WorkerMessage message = inbox.take();
                if (!(message instanceof WorkerMessage.AttemptRequest request)) {
                    log.debug("Worker {} cancelled", id);
                    return;
                }
                if (!handle(request)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker {} interrupted", id);
        }
    }

    /**
     * @return false when the worker should exit
     */
    private boolean handle(WorkerMessage.AttemptRequest request) throws InterruptedException {
        long nonce = request.nonce();
        try {
            if (request.bootstrap() != null) {
                model = request.bootstrap().model();
                seedContext = request.bootstrap().seedContext();
            }
            if (model == null) {
                throw new IllegalStateException("Worker " + id + " received nonce " + nonce + " before bootstrap");
            }

            Randomization random = seedContext.randomization(nonce);
            for (int round = 0; round < rounds; round++) {
                if (round > 0 && inbox.peek() instanceof WorkerMessage.Cancel) {
                    log.debug("Worker {} cancelled during nonce {} after {} rounds", id, nonce, round);
                    return false;
                }
                Optional<PlacementResult> result = search.attempt(model, random);
                if (result.isPresent()) {
                    log.debug("Worker {} found a placement at nonce {} round {}", id, nonce, round);
                    replies.put(WorkerReply.success(id, nonce, result.get()));
                    return true;
                }
            }
            replies.put(WorkerReply.retry(id, nonce));
            return true;
        } catch (InterruptedException e) {
            throw e;
        } catch (Throwable e) {
            // Every request gets a reply, Errors included
            log.debug("Worker {} failed at nonce {}: {}", id, nonce, e.toString());
            replies.put(WorkerReply.failure(id, nonce, e));
            return false;
        }
    }
}
