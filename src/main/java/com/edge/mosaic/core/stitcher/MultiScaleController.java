package com.edge.mosaic.core.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoubleFunction;
import java.util.function.Predicate;

/**
 * 多尺度重试
 * <p>
 * 状态：PENDING -> TRYING(scale_i) -> SUCCEEDED | EXHAUSTED
 * 按配置顺序逐个尺度尝试，第一个成功的尺度即停止；
 * 全部失败时返回最后一次尝试。每个实例只能运行一次。
 *
 * @param <A> 单次尝试的结果类型
 */
public class MultiScaleController<A> {
    private static final Logger logger = LoggerFactory.getLogger(MultiScaleController.class);

    public enum State {
        PENDING,
        TRYING,
        SUCCEEDED,
        EXHAUSTED
    }

    private final List<Double> scales;
    private final Predicate<A> succeeded;
    private final List<A> attempts = new ArrayList<>();
    private State state = State.PENDING;
    private int index = -1;

    public MultiScaleController(List<Double> scales, Predicate<A> succeeded) {
        if (scales == null || scales.isEmpty()) {
            throw new IllegalArgumentException("Scale list cannot be empty");
        }
        this.scales = List.copyOf(scales);
        this.succeeded = Objects.requireNonNull(succeeded, "succeeded");
    }

    /**
     * 依次尝试每个尺度，返回成功的那次尝试，或全部失败时的最后一次
     */
    public A run(DoubleFunction<A> attempt) {
        if (state != State.PENDING) {
            throw new IllegalStateException("Controller already ran, state=" + state);
        }
        A last = null;
        for (index = 0; index < scales.size(); index++) {
            state = State.TRYING;
            double scale = scales.get(index);
            logger.debug("Trying scale {} ({}/{})", scale, index + 1, scales.size());

            last = attempt.apply(scale);
            attempts.add(last);
            if (succeeded.test(last)) {
                state = State.SUCCEEDED;
                logger.debug("Scale {} succeeded", scale);
                return last;
            }
        }
        index = scales.size() - 1;
        state = State.EXHAUSTED;
        logger.debug("All {} scales exhausted", scales.size());
        return last;
    }

    public State getState() {
        return state;
    }

    /**
     * 正在尝试或最终停留的尺度；尚未开始时为空
     */
    public OptionalDouble getCurrentScale() {
        return index < 0 ? OptionalDouble.empty() : OptionalDouble.of(scales.get(index));
    }

    public List<A> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    public List<Double> getScales() {
        return scales;
    }
}
