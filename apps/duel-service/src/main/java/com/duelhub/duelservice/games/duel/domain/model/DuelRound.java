package com.duelhub.duelservice.games.duel.domain.model;

import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;
import com.duelhub.duelservice.games.duel.domain.enums.Side;
import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.exception.DuelRejectedException;
import com.duelhub.duelservice.games.duel.domain.exception.RejectReason;
import com.duelhub.duelservice.games.duel.domain.style.StyleCatalog;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单回合状态机：STYLE_SELECT → SWING → RESOLVED（ABORTED 为异常终态）。
 * <p>
 * 并发约定：
 * - 所有修改必须在 {@link #lock()} 之内进行（公平锁，先到先处理；计时器到期同样排队取锁）；
 * - 拒绝类校验全部发生在修改之前，被拒绝的操作不会留下半截状态；
 * - 已结算的回合不可变，可无锁读取（phase/outcome 为 volatile）。
 */
public class DuelRound {

    private final String matchId;
    private final int roundNo;
    private final Map<Side, ParticipantRoundState> seats = new EnumMap<>(Side.class);
    private final ReentrantLock lock = new ReentrantLock(true);

    private final long styleDeadlineEpochMs;
    private volatile long swingDeadlineEpochMs;

    private volatile RoundPhase phase = RoundPhase.STYLE_SELECT;
    private volatile RoundOutcome outcome;
    private volatile String abortReason;

    public DuelRound(String matchId, int roundNo, String participantA, String participantB, long styleDeadlineEpochMs) {
        this.matchId = matchId;
        this.roundNo = roundNo;
        this.seats.put(Side.A, new ParticipantRoundState(participantA));
        this.seats.put(Side.B, new ParticipantRoundState(participantB));
        this.styleDeadlineEpochMs = styleDeadlineEpochMs;
    }

    // ---------------- 锁 ----------------

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    // ---------------- 选流派阶段 ----------------

    /**
     * 锁定流派。
     * @return 双方是否都已锁定
     */
    public boolean lockStyle(Side side, String styleId, StyleCatalog catalog) {
        assertWriter();
        ensureOpen();
        ensurePhase(RoundPhase.STYLE_SELECT);
        ParticipantRoundState p = seats.get(side);
        if (p.styleLocked()) {
            throw new DuelRejectedException(RejectReason.ALREADY_LOCKED,
                    "本回合已锁定流派 " + p.getStyle().getId());
        }
        StyleEffect effect = catalog.require(styleId);
        p.lockStyle(effect, false);
        return bothStylesLocked();
    }

    /**
     * 选流派超时：未锁定的一方分配默认流派。
     */
    public void applyDefaultStyles(StyleEffect defaultStyle) {
        assertWriter();
        requireInternal(phase == RoundPhase.STYLE_SELECT, "只能在选流派阶段分配默认流派");
        for (ParticipantRoundState p : seats.values()) {
            if (!p.styleLocked()) {
                p.lockStyle(defaultStyle, true);
            }
        }
    }

    /**
     * 进入出手阶段；有效参数在此计算一次，本回合内复用。
     */
    public void enterSwingPhase(Map<Side, EffectiveParams> params, long swingDeadlineEpochMs) {
        assertWriter();
        requireInternal(phase == RoundPhase.STYLE_SELECT, "阶段只能从 STYLE_SELECT 进入 SWING");
        requireInternal(bothStylesLocked(), "双方流派未全部锁定");
        seats.forEach((side, p) -> p.assignParams(params.get(side)));
        this.swingDeadlineEpochMs = swingDeadlineEpochMs;
        this.phase = RoundPhase.SWING;
    }

    // ---------------- 出手阶段 ----------------

    /**
     * 出手前校验（不消耗随机数）。
     */
    public void checkCanSwing(Side side) {
        ensureOpen();
        ensurePhase(RoundPhase.SWING);
        ParticipantRoundState p = seats.get(side);
        if (p.isSubmitted()) {
            throw new DuelRejectedException(RejectReason.ALREADY_SUBMITTED, "已收手，不能继续出手");
        }
        if (p.swingsRemaining() <= 0) {
            throw new DuelRejectedException(RejectReason.SWING_CAP_REACHED,
                    "本回合出手次数已用完（上限 " + p.getParams().swingCap() + "）");
        }
    }

    /**
     * 记录一次出手结果，覆盖此前的结果。
     */
    public ParticipantRoundState recordSwing(Side side, Tier result) {
        assertWriter();
        checkCanSwing(side);
        ParticipantRoundState p = seats.get(side);
        p.recordSwing(result);
        return p;
    }

    /**
     * 收手：锁定最近一次出手结果。
     * @return 锁定的结果
     */
    public Tier stop(Side side) {
        assertWriter();
        ensureOpen();
        ensurePhase(RoundPhase.SWING);
        ParticipantRoundState p = seats.get(side);
        if (p.isSubmitted()) {
            throw new DuelRejectedException(RejectReason.ALREADY_SUBMITTED, "已收手");
        }
        if (p.getSwingsUsed() == 0) {
            throw new DuelRejectedException(RejectReason.NO_SWINGS_TAKEN, "至少出手一次才能收手");
        }
        p.submit(false);
        return p.getBestOutcome();
    }

    /**
     * 出手阶段超时：未提交的一方按当前结果（未出手则 MISS）强制提交。
     */
    public void forceSubmitPending() {
        assertWriter();
        requireInternal(phase == RoundPhase.SWING, "只能在出手阶段强制提交");
        for (ParticipantRoundState p : seats.values()) {
            if (!p.isSubmitted()) {
                p.submit(true);
            }
        }
    }

    // ---------------- 结算 / 中止 ----------------

    /**
     * 写入结算结果（只允许一次）。
     * @throws IllegalStateException 重复结算或双方未全部提交（内部不变量被破坏）
     */
    public void resolve(RoundOutcome result) {
        assertWriter();
        requireInternal(outcome == null, "回合已结算，禁止重复结算");
        requireInternal(phase == RoundPhase.SWING, "只能从 SWING 进入 RESOLVED，当前 " + phase);
        requireInternal(bothSubmitted(), "双方未全部提交");
        this.outcome = result;
        this.phase = RoundPhase.RESOLVED;
    }

    /**
     * 中止回合（致命错误）。已结算的回合保持不变。
     */
    public void abort(String reason) {
        assertWriter();
        if (phase == RoundPhase.RESOLVED) return;
        this.abortReason = reason;
        this.phase = RoundPhase.ABORTED;
    }

    // ---------------- 读 ----------------

    public String matchId() { return matchId; }
    public int roundNo() { return roundNo; }
    public RoundPhase phase() { return phase; }
    public RoundOutcome outcome() { return outcome; }
    public String abortReason() { return abortReason; }
    public long styleDeadlineEpochMs() { return styleDeadlineEpochMs; }
    /** 出手阶段截止时间；尚未进入出手阶段为 0 */
    public long swingDeadlineEpochMs() { return swingDeadlineEpochMs; }

    public ParticipantRoundState participant(Side side) {
        return seats.get(side);
    }

    public Map<Side, ParticipantRoundState> participants() {
        return Collections.unmodifiableMap(seats);
    }

    public boolean bothStylesLocked() {
        return seats.values().stream().allMatch(ParticipantRoundState::styleLocked);
    }

    public boolean bothSubmitted() {
        return seats.values().stream().allMatch(ParticipantRoundState::isSubmitted);
    }

    // ---------------- 内部校验 ----------------

    private void ensureOpen() {
        if (phase == RoundPhase.RESOLVED) {
            throw new DuelRejectedException(RejectReason.ROUND_RESOLVED, "第 " + roundNo + " 回合已结算");
        }
        if (phase == RoundPhase.ABORTED) {
            throw new DuelRejectedException(RejectReason.ROUND_ABORTED, "第 " + roundNo + " 回合已中止");
        }
    }

    private void ensurePhase(RoundPhase expected) {
        if (phase != expected) {
            throw new DuelRejectedException(RejectReason.WRONG_PHASE,
                    "当前阶段为 " + phase + "，该操作需要 " + expected);
        }
    }

    private void assertWriter() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("修改回合状态前必须持有回合锁");
        }
    }

    private static void requireInternal(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }
}
