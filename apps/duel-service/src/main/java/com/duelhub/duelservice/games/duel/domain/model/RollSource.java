package com.duelhub.duelservice.games.duel.domain.model;

/**
 * 每个对局一份的随机源。
 * 不同对局可能在不同线程并发取数，实现需线程安全；同一回合内的取数由回合锁串行化。
 */
@FunctionalInterface
public interface RollSource {

    /**
     * @return [0,1) 上的均匀随机数
     */
    double nextDouble();
}
