package ch.battleship.matchserver.service;

import ch.battleship.matchserver.domain.Game;
import ch.battleship.matchserver.domain.Player;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.UUID;

/**
 * Pairs waiting players into games.
 *
 * <p>The queue is strictly FIFO: a newcomer is paired with the player that has waited longest. The
 * waiter becomes index 0 and moves first. There is no priority or skill matching.
 *
 * <p>Not thread-safe: instances are owned by {@link GameService}, which serializes all access.
 */
@Slf4j
public class Matchmaker {

    private final Deque<Player> waitingQueue = new ArrayDeque<>();

    /**
     * Either pairs the newcomer with the oldest waiter or puts the newcomer in the queue.
     *
     * @param newcomer player that just joined
     * @return the created game, or empty if the newcomer has to wait
     * @throws IllegalStateException if the player is already waiting
     */
    public Optional<Game> join(Player newcomer) {
        if (waitingQueue.contains(newcomer)) {
            throw new IllegalStateException("Player is already waiting for an opponent");
        }

        Player opponent = waitingQueue.pollFirst();
        if (opponent == null) {
            waitingQueue.addLast(newcomer);
            log.info("Player {} waiting for opponent", newcomer.getUsername());
            return Optional.empty();
        }

        Game game = new Game(UUID.randomUUID().toString(), opponent, newcomer);
        opponent.setGameId(game.getGameId());
        newcomer.setGameId(game.getGameId());
        return Optional.of(game);
    }

    /**
     * Removes a player from the queue. Idempotent: a player that was already paired (or never
     * queued) is ignored.
     *
     * @param player player to remove
     * @return {@code true} if the player was waiting
     */
    public boolean remove(Player player) {
        return waitingQueue.remove(player);
    }

    public boolean isWaiting(Player player) {
        return waitingQueue.contains(player);
    }

    public int getWaitingCount() {
        return waitingQueue.size();
    }
}
