package com.wordhub.gameservice.games.words.interfaces.http.dto;

import com.wordhub.gameservice.games.words.domain.dto.GameSummary;

import java.util.List;

/**
 * 对局列表分页结果。
 * @param nextCursor 下一页游标（本页最后一局的创建时间），没有更多时为 null
 */
public record GameListResponse(List<GameSummary> games, Long nextCursor) {

    public static GameListResponse of(List<GameSummary> games, int limit) {
        Long next = games.size() < limit || games.isEmpty()
                ? null
                : games.get(games.size() - 1).creationTimestamp();
        return new GameListResponse(games, next);
    }
}
