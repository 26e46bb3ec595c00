package com.wordhub.gameservice.games.words.domain.ai;

import com.wordhub.gameservice.games.words.domain.dictionary.Dictionary;
import com.wordhub.gameservice.games.words.domain.dictionary.DictionaryRegistry;
import com.wordhub.gameservice.games.words.domain.model.Board;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import com.wordhub.gameservice.games.words.domain.model.WordPlay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * RackWordSolver：按词典逐词尝试的简单求解器。
 * 1) 空棋盘：横放一个能用牌架拼出的单词，覆盖中心格
 * 2) 非空棋盘：借用棋盘上的一个字母，横向或纵向穿过它放一个单词，
 *    新放的格子左右（或上下）不能贴着别的牌，整词两端必须是空格
 * 3) 得分按牌面分值求和（空白牌 0 分），取最高分
 * 搜索次数受 budget 限制，超出即返回当前最优。
 */
@Slf4j
@Component
public class RackWordSolver implements BestPlaySolver {

    private final DictionaryRegistry dictionaries;
    private final Executor executor;

    @Value("${words.robot.search-budget:200000}")
    private int budget = 200_000;

    public RackWordSolver(DictionaryRegistry dictionaries,
                          @Qualifier("solverExecutor") Executor executor) {
        this.dictionaries = dictionaries;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Optional<Move>> findBestPlay(PlaySearch search, Consumer<String> progress) {
        return CompletableFuture.supplyAsync(() -> {
            Optional<Dictionary> dict = search.dictionary() == null
                    ? Optional.empty()
                    : dictionaries.find(search.dictionary());
            if (dict.isEmpty()) {
                progress.accept("no dictionary");
                return Optional.empty();
            }
            return bestPlay(search.board(), dict.get(), search.rack(), progress);
        }, executor);
    }

    Optional<Move> bestPlay(Board board, Dictionary dict, List<Tile> rack, Consumer<String> progress) {
        Search s = new Search(board, rack);
        if (board.isEmpty()) {
            Iterator<String> it = dict.words().iterator();
            while (it.hasNext() && s.tries < budget) {
                s.tryOpening(it.next());
            }
        } else {
            for (int c = 0; c < board.getCols() && s.tries < budget; c++) {
                for (int r = 0; r < board.getRows() && s.tries < budget; r++) {
                    Tile anchor = board.at(c, r);
                    if (anchor == null) continue;
                    Iterator<String> it = dict.words().iterator();
                    while (it.hasNext() && s.tries < budget) {
                        String w = it.next();
                        for (int i = w.indexOf(anchor.getLetter()); i >= 0; i = w.indexOf(anchor.getLetter(), i + 1)) {
                            s.tryThrough(w, i, c, r, true);
                            s.tryThrough(w, i, c, r, false);
                        }
                    }
                }
            }
        }
        progress.accept("tried " + s.tries + " placements");
        if (s.best != null) {
            log.debug("最佳走法 {} 得分 {}", s.best.describeWords(), s.best.getScore());
        }
        return Optional.ofNullable(s.best);
    }

    /** 单次搜索的可变状态 */
    private static final class Search {
        private final Board board;
        private final List<Tile> rack;
        private Move best;
        private int tries;

        Search(Board board, List<Tile> rack) {
            this.board = board;
            this.rack = rack;
        }

        void tryOpening(String word) {
            int len = word.length();
            if (len < 2 || len > rack.size() || len > board.getCols()) return;
            tries++;
            int start = Math.max(0, Math.min(board.middleCol() - len / 2, board.getCols() - len));
            if (start > board.middleCol() || start + len <= board.middleCol()) return;
            List<Placement> placements = new ArrayList<>();
            int score = 0;
            List<Tile> pool = new ArrayList<>(rack);
            for (int k = 0; k < len; k++) {
                Tile t = take(pool, word.charAt(k));
                if (t == null) return;
                placements.add(new Placement(t, start + k, board.middleRow()));
                score += t.getScore();
            }
            offer(word, placements, score);
        }

        void tryThrough(String word, int index, int col, int row, boolean across) {
            int len = word.length();
            if (len < 2) return;
            tries++;
            int dc = across ? 1 : 0;
            int dr = across ? 0 : 1;
            int c0 = col - index * dc;
            int r0 = row - index * dr;
            if (!board.inBounds(c0, r0) || !board.inBounds(c0 + (len - 1) * dc, r0 + (len - 1) * dr)) return;
            if (board.at(c0 - dc, r0 - dr) != null || board.at(c0 + len * dc, r0 + len * dr) != null) return;
            List<Tile> pool = new ArrayList<>(rack);
            List<Placement> placements = new ArrayList<>();
            int score = 0;
            for (int k = 0; k < len; k++) {
                int c = c0 + k * dc;
                int r = r0 + k * dr;
                Tile existing = board.at(c, r);
                char want = word.charAt(k);
                if (existing != null) {
                    if (existing.getLetter() != want) return;
                    score += existing.getScore();
                    continue;
                }
                // 新放的牌不能与侧面的牌相邻，否则会形成未校验的单词
                if (board.at(c + dr, r + dc) != null || board.at(c - dr, r - dc) != null) return;
                Tile t = take(pool, want);
                if (t == null) return;
                placements.add(new Placement(t, c, r));
                score += t.getScore();
            }
            if (placements.isEmpty()) return;
            offer(word, placements, score);
        }

        private void offer(String word, List<Placement> placements, int score) {
            if (best != null && best.getScore() >= score) return;
            best = new Move(placements, score, List.of(new WordPlay(word, score)));
        }

        /** 先用同字母牌，没有再用空白牌 */
        private static Tile take(List<Tile> pool, char letter) {
            for (Iterator<Tile> it = pool.iterator(); it.hasNext(); ) {
                Tile t = it.next();
                if (!t.isBlank() && t.getLetter() == letter) {
                    it.remove();
                    return t.copy();
                }
            }
            for (Iterator<Tile> it = pool.iterator(); it.hasNext(); ) {
                Tile t = it.next();
                if (t.isBlank()) {
                    it.remove();
                    return new Tile(letter, 0, true);
                }
            }
            return null;
        }
    }
}
