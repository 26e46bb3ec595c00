package com.wordhub.gameservice.games.words.support;

import com.wordhub.gameservice.games.words.domain.port.TurnClock;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 记录启动/停止调用的内存计时器。stop 返回 {@link #remainingOnStop}。
 */
public class RecordingTurnClock implements TurnClock {

    public record Start(String gameKey, String playerKey, int seconds, long version) {}

    public final List<Start> starts = new ArrayList<>();
    public final Map<String, Start> running = new HashMap<>();
    public int stops;
    public int remainingOnStop = 0;

    @Override
    public void start(String gameKey, String playerKey, int seconds, long version) {
        Start s = new Start(gameKey, playerKey, seconds, version);
        starts.add(s);
        running.put(gameKey, s);
    }

    @Override
    public int stop(String gameKey) {
        stops++;
        return running.remove(gameKey) == null ? 0 : remainingOnStop;
    }

    public Start lastStart() {
        return starts.isEmpty() ? null : starts.get(starts.size() - 1);
    }

    public boolean isRunning(String gameKey) {
        return running.containsKey(gameKey);
    }
}
