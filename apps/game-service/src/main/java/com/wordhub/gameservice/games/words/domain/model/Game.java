package com.wordhub.gameservice.games.words.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.enums.SwapPassPolicy;
import com.wordhub.gameservice.games.words.domain.exception.GameConfigurationException;
import com.wordhub.gameservice.games.words.domain.exception.GameInvariantException;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 对局聚合根。
 *
 * 座位顺序即 players 的插入顺序；轮转只由回合引擎通过 currentPlayerKey 推进。
 * turns 只追加；整个对象作为一个 JSON 文档持久化。
 */
@Data
@NoArgsConstructor
public class Game {

    private String key;
    private long creationTimestamp;
    private String edition;
    private String dictionary;
    private GameStatus state = GameStatus.PLAYING;
    private List<Player> players = new ArrayList<>();
    private List<Turn> turns = new ArrayList<>();
    private String currentPlayerKey;
    /** 0 表示不限时 */
    private int secondsPerPlay;
    private int minPlayers;
    /** 0 表示不限人数 */
    private int maxPlayers;
    private boolean predictScore;
    private boolean allowTakeBack;
    private boolean checkDictionary;
    private String nextGameKey;
    /** 仍可被悔棋或质疑的上一手 */
    private Move previousMove;
    private Board board;
    private LetterBag letterBag;
    private int rackSize;
    /** 暂停者名字，null 表示未暂停 */
    private String pausedBy;
    private SwapPassPolicy swapPassPolicy = SwapPassPolicy.COUNT_ONLY;
    /** 当前回合计时器的版本号，每次启动计时 +1 */
    private long clockVersion;

    public Game(GameConfig config) {
        this.key = UUID.randomUUID().toString().replace("-", "");
        this.creationTimestamp = System.currentTimeMillis();
        this.edition = config.edition();
        this.dictionary = config.dictionary();
        this.secondsPerPlay = config.secondsPerPlay();
        this.minPlayers = config.minPlayers();
        this.maxPlayers = config.maxPlayers();
        this.predictScore = config.predictScore();
        this.allowTakeBack = config.allowTakeBack();
        this.checkDictionary = config.checkDictionary();
        this.swapPassPolicy = config.swapPassPolicy();
    }

    /**
     * 按版本实例化棋盘和牌袋，之后才能加人。
     */
    public Game create(Edition ed) {
        if (!ed.getName().equalsIgnoreCase(edition)) {
            throw new GameConfigurationException(GameMessages.formatEditionNotFound(edition));
        }
        this.board = new Board(ed.getCols(), ed.getRows());
        this.letterBag = LetterBag.fromEdition(ed);
        this.rackSize = ed.getRackCount();
        return this;
    }

    // ---------------- 状态 ----------------

    @JsonIgnore
    public boolean isPlaying() {
        return state == GameStatus.PLAYING;
    }

    public boolean hasEnded() {
        return state != null && state.terminal();
    }

    @JsonIgnore
    public boolean isPaused() {
        return pausedBy != null;
    }

    /**
     * 对局必须在进行中，否则 409。
     */
    public void requirePlaying() {
        if (hasEnded()) {
            throw new IllegalStateException(GameMessages.formatGameNotPlaying(state.label()));
        }
    }

    /** 终局：进入终局状态并清空当前玩家 */
    public void finish(GameStatus endState) {
        this.state = endState;
        this.currentPlayerKey = null;
        this.previousMove = null;
    }

    public long nextClockVersion() {
        return ++clockVersion;
    }

    // ---------------- 玩家与轮转 ----------------

    public Optional<Player> getPlayer(String playerKey) {
        if (playerKey == null) return Optional.empty();
        for (Player p : players) {
            if (playerKey.equals(p.getKey())) return Optional.of(p);
        }
        return Optional.empty();
    }

    public Player requirePlayer(String playerKey) {
        return getPlayer(playerKey)
                .orElseThrow(() -> new GameInvariantException(GameMessages.formatPlayerNotFound(playerKey)));
    }

    public Optional<Player> current() {
        return getPlayer(currentPlayerKey);
    }

    public Player nextPlayer(Player from) {
        return players.get(Math.floorMod(seatOf(from.getKey()) + 1, players.size()));
    }

    public Player previousPlayer(Player from) {
        return players.get(Math.floorMod(seatOf(from.getKey()) - 1, players.size()));
    }

    private int seatOf(String playerKey) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getKey().equals(playerKey)) return i;
        }
        throw new GameInvariantException(GameMessages.formatPlayerNotFound(playerKey));
    }

    /**
     * 入座并发满一手牌。人数已满或袋中不够一手时拒绝且不做任何修改。
     */
    public void addPlayer(Player player) {
        requirePlaying();
        if (maxPlayers > 0 && players.size() >= maxPlayers) {
            throw new GameConfigurationException(GameMessages.formatGameFull(maxPlayers));
        }
        if (getPlayer(player.getKey()).isPresent()) {
            throw new GameConfigurationException(String.format(GameMessages.PLAYER_ALREADY_SEATED, player.getKey()));
        }
        if (letterBag.remainingTileCount() < rackSize - player.getRack().size()) {
            throw new GameConfigurationException(GameMessages.BAG_CANNOT_FILL_RACK);
        }
        players.add(player);
        player.fillRack(letterBag, rackSize);
    }

    /**
     * 离座：牌还回袋中。
     */
    public Player removePlayer(String playerKey) {
        Player p = requirePlayer(playerKey);
        p.returnTiles(letterBag);
        players.remove(p);
        return p;
    }

    public boolean allPassedTwice() {
        if (players.isEmpty()) return false;
        for (Player p : players) {
            if (p.getPasses() < 2) return false;
        }
        return true;
    }

    public Optional<Player> playerWithNoTiles() {
        for (Player p : players) {
            if (p.getRack().isEmpty()) return Optional.of(p);
        }
        return Optional.empty();
    }

    public int winningScore() {
        int best = 0;
        for (Player p : players) best = Math.max(best, p.getScore());
        return best;
    }

    // ---------------- 回合日志 ----------------

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public void appendTurn(Turn turn) {
        turns.add(turn);
    }

    public Optional<Turn> lastTurn() {
        return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
    }

    /** 最近一次活动时间：最后一条回合记录，没有则为建局时间 */
    public long lastActivity() {
        return lastTurn().map(Turn::getTimestamp).orElse(creationTimestamp);
    }

    /** 牌袋 + 所有牌架 + 棋盘上的牌总数，整局恒定 */
    public int tileCount() {
        int n = letterBag == null ? 0 : letterBag.remainingTileCount();
        for (Player p : players) n += p.getRack().size();
        return n + (board == null ? 0 : board.occupiedCount());
    }
}
