package com.wordhub.gameservice.games.words.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一手走子：放置的牌、补到牌架上的牌、得分、所成单词。
 * 作为 previousMove 保存时还带上走子玩家与剩余秒数快照。
 */
@Data
@NoArgsConstructor
public class Move {

    private List<Placement> placements = new ArrayList<>();
    private List<Tile> replacements = new ArrayList<>();
    private int score;
    private List<WordPlay> words = new ArrayList<>();
    private String playerKey;
    private int remainingTime;

    public Move(List<Placement> placements, int score, List<WordPlay> words) {
        this.placements = placements == null ? new ArrayList<>() : new ArrayList<>(placements);
        this.score = score;
        this.words = words == null ? new ArrayList<>() : new ArrayList<>(words);
    }

    public void addReplacement(Tile tile) {
        replacements.add(tile);
    }

    /** 只取单词文本 */
    public List<String> wordList() {
        List<String> out = new ArrayList<>(words.size());
        words.forEach(w -> out.add(w.getWord()));
        return out;
    }

    public List<Tile> placedTiles() {
        List<Tile> out = new ArrayList<>(placements.size());
        placements.forEach(p -> out.add(p.getTile()));
        return out;
    }

    /** 拼接后的单词串，用于提示消息 */
    public String describeWords() {
        return String.join(",", wordList());
    }
}
