package cn.iinti.proxyfinder.trace.impl;

import cn.iinti.proxyfinder.trace.Recorder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collection;

/**
 * 按场景分类的日志记录器，最终输出到名为EventTrace的slf4j logger，
 * 场景标记通过MDC的Scene字段传递给logback
 */
public class DiskRecorders {

    /**
     * 代理源下载，数量少且重要，全量记录
     */
    public static final DiskRecorders SOURCE_FETCH = new DiskRecorders("source_fetch", true);
    /**
     * 单个候选代理的探测过程，数量巨大，默认采样记录
     */
    public static final DiskRecorders IP_TEST = new DiskRecorders("ip_test", false);
    /**
     * 候选过滤，同样采样
     */
    public static final DiskRecorders FILTER = new DiskRecorders("filter", false);
    public static final DiskRecorders ROTATION = new DiskRecorders("rotation", true);
    public static final DiskRecorders CACHE = new DiskRecorders("cache", true);
    public static final DiskRecorders DIAGNOSTICS = new DiskRecorders("diagnostics", true);

    private static final Logger log = LoggerFactory.getLogger("EventTrace");

    @Getter
    private final String tag;
    @Getter
    private final boolean all;
    private final WheelSlotFilter wheelSlotFilter;


    public DiskRecorders(String tag, boolean all) {
        this.tag = tag;
        this.all = all;
        this.wheelSlotFilter = new WheelSlotFilter(all);
    }

    public DiskRecorder acquireRecorder(String sessionId, boolean debug) {
        return this.wheelSlotFilter.acquireRecorder(debug) ?
                new DiskRecorderImpl(sessionId) : nopDiskRecorder;
    }

    public static abstract class DiskRecorder extends Recorder {
        abstract void recordBatchEvent(Collection<String> msgLines);
    }

    private class DiskRecorderImpl extends DiskRecorder {
        private final String sessionId;

        private DiskRecorderImpl(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        void recordBatchEvent(Collection<String> msgLines) {
            MDC.put("Scene", tag);
            try {
                msgLines.forEach(s -> log.info("sessionId:" + sessionId + " -> " + s));
            } finally {
                MDC.remove("Scene");
            }
        }

        @Override
        public void recordEvent(MessageGetter messageGetter, Throwable throwable) {
            recordBatchEvent(splitMsg(messageGetter.getMessage(), throwable));
        }
    }

    private final static DiskRecorder nopDiskRecorder = new DiskRecorder() {
        @Override
        public void recordEvent(MessageGetter messageGetter, Throwable throwable) {
            // 采样丢弃
        }

        @Override
        void recordBatchEvent(Collection<String> msgLines) {
            // 采样丢弃
        }
    };
}
