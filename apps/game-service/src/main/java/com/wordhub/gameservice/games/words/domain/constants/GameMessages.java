package com.wordhub.gameservice.games.words.domain.constants;

/**
 * 文字游戏相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   throw new IllegalStateException(GameMessages.formatNotYourTurn(current));
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    /** 建议/提示消息的发送方 */
    public static final String ADVISOR = "Advisor";

    // ========== 配置与创建 ==========

    public static final String EDITION_REQUIRED = "必须指定版本（edition）";

    public static final String EDITION_NOT_FOUND = "版本 %s 不存在";

    public static final String GAME_NOT_FOUND = "对局不存在：%s";

    public static final String GAME_FULL = "玩家人数已满（最多 %d 人）";

    public static final String BAG_CANNOT_FILL_RACK = "袋中剩余牌不足以发满一手";

    public static final String NEXT_GAME_EXISTS = "已经创建过下一局：%s";

    public static String formatEditionNotFound(String edition) {
        return String.format(EDITION_NOT_FOUND, edition);
    }

    public static String formatGameNotFound(String gameKey) {
        return String.format(GAME_NOT_FOUND, gameKey);
    }

    public static String formatGameFull(int maxPlayers) {
        return String.format(GAME_FULL, maxPlayers);
    }

    public static String formatNextGameExists(String nextGameKey) {
        return String.format(NEXT_GAME_EXISTS, nextGameKey);
    }

    // ========== 回合与状态 ==========

    /** 未轮到该玩家 */
    public static final String NOT_YOUR_TURN = "未轮到该玩家（当前应为 %s）";

    public static final String GAME_NOT_PLAYING = "对局已结束（%s）";

    public static final String GAME_PAUSED = "对局已被 %s 暂停";

    public static final String PLAYER_NOT_FOUND = "玩家 %s 不在对局中";

    public static final String PLAYER_ALREADY_SEATED = "玩家 %s 已在对局中";

    public static final String NO_CURRENT_PLAYER = "当前没有轮到任何玩家";

    public static final String NOT_A_ROBOT = "当前玩家 %s 不是机器人";

    public static final String INVALID_PASS_TYPE = "不支持的跳过类型：%s";

    public static final String INVALID_END_STATE = "不支持的终局状态：%s";

    public static String formatNotYourTurn(String currentPlayerKey) {
        return String.format(NOT_YOUR_TURN, currentPlayerKey);
    }

    public static String formatGameNotPlaying(String state) {
        return String.format(GAME_NOT_PLAYING, state);
    }

    public static String formatGamePaused(String pausedBy) {
        return String.format(GAME_PAUSED, pausedBy);
    }

    public static String formatPlayerNotFound(String playerKey) {
        return String.format(PLAYER_NOT_FOUND, playerKey);
    }

    // ========== 走子 / 换牌 ==========

    /** 非法走子（需要格式化，传入原因） */
    public static final String ILLEGAL_MOVE = "非法走子：%s";

    public static final String EMPTY_MOVE = "至少需要放置一张牌";

    public static final String OUT_OF_BOARD = "(%d,%d) 超出棋盘";

    public static final String CELL_OCCUPIED = "(%d,%d) 已有牌";

    public static final String DUPLICATE_CELL = "(%d,%d) 重复放置";

    public static final String TILES_NOT_ON_RACK = "牌架上没有这些牌";

    public static final String SWAP_NOT_ON_RACK = "换牌失败：牌架上没有这些牌";

    public static final String INSUFFICIENT_TILES = "袋中只剩 %d 张牌，无法换 %d 张";

    public static String formatIllegalMove(String reason) {
        return String.format(ILLEGAL_MOVE, reason);
    }

    public static String formatCell(String template, int col, int row) {
        return formatIllegalMove(String.format(template, col, row));
    }

    public static String formatInsufficientTiles(int requested, int available) {
        return String.format(INSUFFICIENT_TILES, available, requested);
    }

    // ========== 质疑 / 悔棋 / 终局 ==========

    public static final String NOTHING_TO_CHALLENGE = "没有可质疑的上一手";

    public static final String NOTHING_TO_TAKE_BACK = "没有可撤回的上一手";

    public static final String TAKE_BACK_DISABLED = "本局不允许悔棋";

    public static final String ONLY_MOVER_CAN_TAKE_BACK = "只有上一手的玩家可以悔棋";

    public static final String GAME_ALREADY_OVER = "对局已经结束";

    public static final String MULTIPLE_EMPTY_RACKS = "多名玩家同时出完了牌：%s";

    public static final String TAKE_BACK_INCONSISTENT = "上一手与当前牌面不一致，无法撤回：%s";

    // ========== 建议 / 提示 ==========

    public static final String WORD_NOT_FOUND = "词典 %s 中没有单词：%s";

    public static final String HINT_PLAY = "提示：%s 可得 %d 分（第 %d 列第 %d 行）";

    public static final String HINT_NONE = "没有找到可走的一手";

    public static final String HINT_ASKED = "%s 请求了提示";

    public static final String ADVICE_BETTER = "建议：%s 可得 %d 分（第 %d 列第 %d 行）";

    public static final String ADVICE_RECEIVED = "%s 收到了建议";

    public static final String ADVICE_ON = "已开启走子建议";

    public static final String ADVICE_OFF = "已关闭走子建议";

    public static final String ADVICE_ENABLED_BY = "%s 开启了走子建议";

    public static String formatWordNotFound(String dictionary, String word) {
        return String.format(WORD_NOT_FOUND, dictionary, word);
    }

    public static String formatPlay(String template, String words, int score, int col, int row) {
        return String.format(template, words, score, col, row);
    }

    public static String formatName(String template, String name) {
        return String.format(template, name);
    }
}
