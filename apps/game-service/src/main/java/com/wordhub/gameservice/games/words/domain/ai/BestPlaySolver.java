package com.wordhub.gameservice.games.words.domain.ai;

import com.wordhub.gameservice.games.words.domain.model.Move;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 最佳走法求解器（异步）。
 * 结果为 empty 表示找不到可走的一手；future 异常完成表示求解失败。
 */
public interface BestPlaySolver {

    /**
     * @param progress 进度文本回调，可为 no-op
     */
    CompletableFuture<Optional<Move>> findBestPlay(PlaySearch search, Consumer<String> progress);
}
