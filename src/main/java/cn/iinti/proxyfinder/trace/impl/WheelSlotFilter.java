package cn.iinti.proxyfinder.trace.impl;

import com.google.common.base.Preconditions;

import java.util.concurrent.atomic.AtomicLongArray;

/**
 * 日志采样：把一个时间窗口等分成若干槽位，每个槽位在一个窗口内最多放行一次。
 * 默认一分钟30个槽位，即每两秒最多放行一次
 */
public class WheelSlotFilter {
    public static final int DEFAULT_SLOTS = 30;
    public static final long DEFAULT_WINDOW_MILLIS = 60_000;

    private final boolean all;
    private final long windowMillis;
    private final long slotMillis;

    /**
     * 每个槽位最后一次放行时所在的窗口编号
     */
    private final AtomicLongArray lastPassWindow;

    public WheelSlotFilter(boolean all) {
        this(all, DEFAULT_SLOTS, DEFAULT_WINDOW_MILLIS);
    }

    public WheelSlotFilter(boolean all, int slots, long windowMillis) {
        Preconditions.checkArgument(slots > 0, "slots must be positive");
        Preconditions.checkArgument(windowMillis >= slots, "window too small for %s slots", slots);
        this.all = all;
        this.windowMillis = windowMillis;
        this.slotMillis = windowMillis / slots;
        this.lastPassWindow = new AtomicLongArray(slots);
        for (int i = 0; i < slots; i++) {
            lastPassWindow.set(i, -1);
        }
    }

    public boolean acquireRecorder(boolean debug) {
        return acquireRecorder(debug, System.currentTimeMillis());
    }

    boolean acquireRecorder(boolean debug, long nowTime) {
        if (all || debug) {
            return true;
        }
        long window = nowTime / windowMillis;
        // 窗口不能被槽位数整除时，余下的时间归到最后一个槽位
        int slot = (int) Math.min((nowTime % windowMillis) / slotMillis, lastPassWindow.length() - 1);

        long last = lastPassWindow.get(slot);
        return last != window && lastPassWindow.compareAndSet(slot, last, window);
    }
}
